package com.improvtoolkit.ingest.service.audio.processing;

/**
 * Stateless block noise gate: 10 ms blocks whose RMS is below the gate threshold are attenuated.
 * Returns a new array; the input is left untouched.
 */
public final class NoiseGate {

    private static final int BLOCK_MS = 10;

    private final double threshold;
    private final double attenuation;

    public NoiseGate(double threshold, double attenuation) {
        if (threshold <= 0.0) {
            throw new IllegalArgumentException("Gate threshold must be positive: " + threshold);
        }
        if (attenuation < 0.0 || attenuation > 1.0) {
            throw new IllegalArgumentException("Gate attenuation must be in [0, 1]: " + attenuation);
        }
        this.threshold = threshold;
        this.attenuation = attenuation;
    }

    public short[] apply(short[] samples, int sampleRate) {
        short[] out = samples.clone();
        int block = Math.max(1, sampleRate * BLOCK_MS / 1000);
        for (int start = 0; start < out.length; start += block) {
            int len = Math.min(block, out.length - start);
            if (SilenceDetector.rms(out, start, len) < threshold) {
                for (int i = start; i < start + len; i++) {
                    out[i] = PcmCodec.clip(out[i] * attenuation);
                }
            }
        }
        return out;
    }
}
