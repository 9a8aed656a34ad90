package com.improvtoolkit.ingest.service.audio.processing;

/**
 * Rational-factor polyphase resampler for mono int16 audio.
 *
 * <p>The rate ratio is reduced by the GCD to {@code up/down}. Conceptually the input is zero-stuffed
 * by {@code up}, low-pass filtered with a Kaiser-windowed sinc (cutoff {@code 1/max(up, down)} of
 * Nyquist, gain {@code up}) and decimated by {@code down}; only the taps that hit non-zero input are
 * evaluated. Output length is {@code ceil(n * up / down)}, aligned so that output {@code m} sits at
 * input time {@code m * down / up}. Each block is filtered independently (zero-padded edges).
 *
 * <p>Immutable and thread-safe once constructed.
 */
public final class PolyphaseResampler {

    private static final double KAISER_BETA = 5.0;
    private static final int HALF_LENGTH_PER_FACTOR = 10;

    private final int sourceRate;
    private final int targetRate;
    private final int up;
    private final int down;
    private final int halfLength;
    private final double[] taps;

    public PolyphaseResampler(int sourceRate, int targetRate) {
        if (sourceRate <= 0 || targetRate <= 0) {
            throw new IllegalArgumentException("Rates must be positive: " + sourceRate + " -> " + targetRate);
        }
        this.sourceRate = sourceRate;
        this.targetRate = targetRate;
        int g = gcd(sourceRate, targetRate);
        this.up = targetRate / g;
        this.down = sourceRate / g;
        this.halfLength = HALF_LENGTH_PER_FACTOR * Math.max(up, down);
        this.taps = designFilter(up, down, halfLength);
    }

    public short[] resample(short[] input) {
        if (up == down) {
            return input.clone();
        }
        int n = input.length;
        int outLength = (int) (((long) n * up + down - 1) / down);
        short[] out = new short[outLength];
        for (int m = 0; m < outLength; m++) {
            long center = (long) m * down + halfLength;
            int k = (int) (center % up);
            double acc = 0.0;
            for (; k < taps.length; k += up) {
                long idx = (center - k) / up;
                if (idx < 0) {
                    break;
                }
                if (idx < n) {
                    acc += taps[k] * input[(int) idx];
                }
            }
            out[m] = PcmCodec.clip(acc);
        }
        return out;
    }

    public boolean isPassthrough() {
        return up == down;
    }

    public int up() {
        return up;
    }

    public int down() {
        return down;
    }

    public int sourceRate() {
        return sourceRate;
    }

    public int targetRate() {
        return targetRate;
    }

    static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    private static double[] designFilter(int up, int down, int halfLength) {
        int length = 2 * halfLength + 1;
        double cutoff = 1.0 / Math.max(up, down);
        double[] h = new double[length];
        double i0Beta = besselI0(KAISER_BETA);
        double sum = 0.0;
        for (int k = 0; k < length; k++) {
            double x = k - halfLength;
            double ratio = (2.0 * k) / (length - 1) - 1.0;
            double window = besselI0(KAISER_BETA * Math.sqrt(Math.max(0.0, 1.0 - ratio * ratio))) / i0Beta;
            h[k] = cutoff * sinc(cutoff * x) * window;
            sum += h[k];
        }
        // unity DC gain per phase after zero-stuffing
        double scale = up / sum;
        for (int k = 0; k < length; k++) {
            h[k] *= scale;
        }
        return h;
    }

    private static double sinc(double x) {
        if (x == 0.0) {
            return 1.0;
        }
        double px = Math.PI * x;
        return Math.sin(px) / px;
    }

    /** Zeroth-order modified Bessel function of the first kind, by power series. */
    private static double besselI0(double x) {
        double sum = 1.0;
        double term = 1.0;
        double halfX = x / 2.0;
        for (int k = 1; k < 50; k++) {
            term *= (halfX / k) * (halfX / k);
            sum += term;
            if (term < 1e-12 * sum) {
                break;
            }
        }
        return sum;
    }
}
