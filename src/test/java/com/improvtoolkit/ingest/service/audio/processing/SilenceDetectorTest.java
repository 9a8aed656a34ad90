package com.improvtoolkit.ingest.service.audio.processing;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SilenceDetectorTest {

    @Test
    void rmsIsNormalizedToFullScale() {
        short[] samples = new short[100];
        Arrays.fill(samples, (short) 3277);
        assertThat(SilenceDetector.rms(samples)).isCloseTo(0.1, within(0.001));
        assertThat(SilenceDetector.rms(new short[0])).isZero();
    }

    @Test
    void classifiesAgainstThreshold() {
        SilenceDetector detector = new SilenceDetector(0.01);
        assertThat(detector.isSilent(0.005)).isTrue();
        assertThat(detector.isSilent(0.02)).isFalse();
    }

    @Test
    void dbfsHasFloorForDigitalSilence() {
        assertThat(SilenceDetector.toDbfs(0.0)).isEqualTo(SilenceDetector.FLOOR_DBFS);
        assertThat(SilenceDetector.toDbfs(1.0)).isCloseTo(0.0, within(1e-9));
        assertThat(SilenceDetector.toDbfs(0.01)).isCloseTo(-40.0, within(1e-9));
    }

    @Test
    void rejectsThresholdOutsideUnitRange() {
        assertThatThrownBy(() -> new SilenceDetector(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SilenceDetector(1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
