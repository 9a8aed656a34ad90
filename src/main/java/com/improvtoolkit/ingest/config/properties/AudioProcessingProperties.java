package com.improvtoolkit.ingest.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the audio processing stage (resampling, silence, VAD, noise gate).
 */
@Validated
@ConfigurationProperties(prefix = "ingest.audio.processing")
public class AudioProcessingProperties {

    /** Output rate of processed frames, in Hz. */
    @Min(8_000)
    @Max(48_000)
    private int targetSampleRate = 16_000;

    /** Linear RMS (on [-1, 1] samples) below which a frame counts as silence. */
    @Positive(message = "Silence threshold must be positive")
    @DecimalMax("1.0")
    private double silenceThreshold = 0.01;

    /** 0 (least aggressive) to 3 (most aggressive at filtering non-speech). */
    @Min(0)
    @Max(3)
    private int vadAggressiveness = 2;

    /** VAD analysis sub-frame length: 10, 20 or 30 ms. */
    @Min(10)
    @Max(30)
    private int vadFrameMs = 30;

    private boolean noiseReductionEnabled = false;

    /** Gain applied to blocks the noise gate closes on. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double noiseGateAttenuation = 0.1;

    /** Capacity of the processed frame queue. */
    @Positive
    private int queueCapacity = 50;

    public int getTargetSampleRate() {
        return targetSampleRate;
    }

    public void setTargetSampleRate(int targetSampleRate) {
        this.targetSampleRate = targetSampleRate;
    }

    public double getSilenceThreshold() {
        return silenceThreshold;
    }

    public void setSilenceThreshold(double silenceThreshold) {
        this.silenceThreshold = silenceThreshold;
    }

    public int getVadAggressiveness() {
        return vadAggressiveness;
    }

    public void setVadAggressiveness(int vadAggressiveness) {
        this.vadAggressiveness = vadAggressiveness;
    }

    public int getVadFrameMs() {
        return vadFrameMs;
    }

    public void setVadFrameMs(int vadFrameMs) {
        this.vadFrameMs = vadFrameMs;
    }

    public boolean isNoiseReductionEnabled() {
        return noiseReductionEnabled;
    }

    public void setNoiseReductionEnabled(boolean noiseReductionEnabled) {
        this.noiseReductionEnabled = noiseReductionEnabled;
    }

    public double getNoiseGateAttenuation() {
        return noiseGateAttenuation;
    }

    public void setNoiseGateAttenuation(double noiseGateAttenuation) {
        this.noiseGateAttenuation = noiseGateAttenuation;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }
}
