package com.improvtoolkit.ingest.service.audio.processing;

/**
 * RMS level measurement and silence classification for int16 audio.
 *
 * <p>Samples are normalized to [-1, 1] (divided by 32768) before the RMS is taken, so the
 * threshold is a linear full-scale ratio: 0.01 is roughly -40 dBFS.
 */
public final class SilenceDetector {

    /** dBFS reported for digital silence. */
    public static final double FLOOR_DBFS = -120.0;

    private final double threshold;

    public SilenceDetector(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Silence threshold must be in (0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public boolean isSilent(double rms) {
        return rms < threshold;
    }

    public double threshold() {
        return threshold;
    }

    /** Normalized RMS over {@code length} samples starting at {@code offset}. */
    public static double rms(short[] samples, int offset, int length) {
        if (length <= 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (int i = offset; i < offset + length; i++) {
            double s = samples[i] / PcmCodec.INT16_FULL_SCALE;
            sumSquares += s * s;
        }
        return Math.sqrt(sumSquares / length);
    }

    public static double rms(short[] samples) {
        return rms(samples, 0, samples.length);
    }

    public static double toDbfs(double rms) {
        if (rms <= 0.0) {
            return FLOOR_DBFS;
        }
        return Math.max(FLOOR_DBFS, 20.0 * Math.log10(rms));
    }
}
