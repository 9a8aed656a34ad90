package com.improvtoolkit.ingest.service.audio.processing;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EnergyVoiceActivityDetectorTest {

    private static final int RATE = 16000;

    private static short[] tone(int samples, double freq, double amplitude) {
        short[] out = new short[samples];
        for (int i = 0; i < samples; i++) {
            out[i] = (short) (amplitude * 32767 * Math.sin(2 * Math.PI * freq * i / RATE));
        }
        return out;
    }

    @Test
    void voicedToneIsSpeech() {
        EnergyVoiceActivityDetector vad = new EnergyVoiceActivityDetector(2, 30);
        assertThat(vad.isSpeech(tone(960, 220, 0.3), RATE)).isTrue();
    }

    @Test
    void silenceAndEmptyInputAreNotSpeech() {
        EnergyVoiceActivityDetector vad = new EnergyVoiceActivityDetector(0, 10);
        assertThat(vad.isSpeech(new short[960], RATE)).isFalse();
        assertThat(vad.isSpeech(new short[0], RATE)).isFalse();
    }

    @Test
    void broadbandHissIsNotSpeech() {
        Random random = new Random(42);
        short[] hiss = new short[960];
        for (int i = 0; i < hiss.length; i++) {
            hiss[i] = (short) ((random.nextDouble() * 2 - 1) * 0.3 * 32767);
        }
        EnergyVoiceActivityDetector vad = new EnergyVoiceActivityDetector(1, 20);
        assertThat(vad.isSpeech(hiss, RATE)).isFalse();
    }

    @Test
    void quorumDependsOnAggressiveness() {
        // one loud 10 ms sub-frame followed by two silent ones
        short[] block = new short[480];
        System.arraycopy(tone(160, 220, 0.3), 0, block, 0, 160);

        assertThat(new EnergyVoiceActivityDetector(0, 10).isSpeech(block, RATE)).isTrue();
        assertThat(new EnergyVoiceActivityDetector(3, 10).isSpeech(block, RATE)).isFalse();
    }

    @Test
    void shortBlockIsJudgedAsOneFrame() {
        EnergyVoiceActivityDetector vad = new EnergyVoiceActivityDetector(2, 30);
        assertThat(vad.isSpeech(tone(100, 220, 0.3), RATE)).isTrue();
    }

    @Test
    void zeroCrossingRateCountsSignChanges() {
        short[] alternating = {100, -100, 100, -100, 100};
        assertThat(EnergyVoiceActivityDetector.zeroCrossingRate(alternating, 0, 5)).isCloseTo(1.0, within(1e-9));
        assertThat(EnergyVoiceActivityDetector.zeroCrossingRate(alternating, 0, 1)).isZero();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new EnergyVoiceActivityDetector(4, 30))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EnergyVoiceActivityDetector(2, 25))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
