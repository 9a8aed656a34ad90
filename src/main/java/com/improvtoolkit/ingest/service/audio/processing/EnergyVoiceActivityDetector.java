package com.improvtoolkit.ingest.service.audio.processing;

/**
 * Energy and zero-crossing-rate VAD.
 *
 * <p>The block is cut into 10, 20 or 30 ms sub-frames. A sub-frame votes speech when its RMS clears
 * the energy floor for the aggressiveness level and its zero-crossing rate stays in the voiced
 * range (broadband hiss crosses zero far more often than speech). The block is speech when the
 * share of speech votes reaches the level's quorum. Higher aggressiveness filters non-speech harder.
 * A trailing partial sub-frame is ignored unless it is the only one.
 */
public final class EnergyVoiceActivityDetector implements VoiceActivityDetector {

    private static final double[] ENERGY_FLOOR = {0.005, 0.008, 0.012, 0.02};
    private static final double[] QUORUM = {0.25, 0.4, 0.5, 0.65};
    private static final double MAX_ZCR = 0.35;

    private final int aggressiveness;
    private final int frameMs;

    public EnergyVoiceActivityDetector(int aggressiveness, int frameMs) {
        if (aggressiveness < 0 || aggressiveness > 3) {
            throw new IllegalArgumentException("VAD aggressiveness must be 0-3: " + aggressiveness);
        }
        if (frameMs != 10 && frameMs != 20 && frameMs != 30) {
            throw new IllegalArgumentException("VAD frame must be 10, 20 or 30 ms: " + frameMs);
        }
        this.aggressiveness = aggressiveness;
        this.frameMs = frameMs;
    }

    @Override
    public boolean isSpeech(short[] samples, int sampleRate) {
        if (samples.length == 0) {
            return false;
        }
        int subFrame = Math.max(1, sampleRate * frameMs / 1000);
        int frames = samples.length / subFrame;
        if (frames == 0) {
            return votesSpeech(samples, 0, samples.length);
        }
        int speech = 0;
        for (int f = 0; f < frames; f++) {
            if (votesSpeech(samples, f * subFrame, subFrame)) {
                speech++;
            }
        }
        return (double) speech / frames >= QUORUM[aggressiveness];
    }

    private boolean votesSpeech(short[] samples, int offset, int length) {
        if (SilenceDetector.rms(samples, offset, length) < ENERGY_FLOOR[aggressiveness]) {
            return false;
        }
        return zeroCrossingRate(samples, offset, length) <= MAX_ZCR;
    }

    static double zeroCrossingRate(short[] samples, int offset, int length) {
        if (length < 2) {
            return 0.0;
        }
        int crossings = 0;
        for (int i = offset + 1; i < offset + length; i++) {
            if ((samples[i - 1] >= 0) != (samples[i] >= 0)) {
                crossings++;
            }
        }
        return (double) crossings / (length - 1);
    }

    public int aggressiveness() {
        return aggressiveness;
    }

    public int frameMs() {
        return frameMs;
    }
}
