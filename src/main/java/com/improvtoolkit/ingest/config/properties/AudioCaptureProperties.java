package com.improvtoolkit.ingest.config.properties;

import com.improvtoolkit.ingest.domain.SampleFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the actor microphone.
 *
 * The requested rate/format is what we ask the device for; if the hardware refuses the rate the
 * capture stage falls back to the device default and the processing stage resamples.
 */
@Validated
@ConfigurationProperties(prefix = "ingest.audio.capture")
public class AudioCaptureProperties {

    /** Substring matched against enumerated input device names. */
    @NotBlank
    private final String micName;

    /** Requested capture rate in Hz. */
    @Min(8_000)
    @Max(192_000)
    private final int sampleRate;

    @NotNull
    private final SampleFormat sampleFormat;

    @Min(1)
    @Max(2)
    private final int channels;

    /** Samples per channel delivered per chunk (960 = 20 ms at 48 kHz). */
    @Min(64)
    @Max(16_384)
    private final int blockSize;

    /** Consecutive xruns that force a stream restart. */
    @Min(1)
    private final int xrunRestartThreshold;

    /** Capacity of the raw frame queue between capture and processing. */
    @Min(1)
    private final int queueCapacity;

    @ConstructorBinding
    public AudioCaptureProperties(String micName,
                                  @DefaultValue("48000") int sampleRate,
                                  @DefaultValue("INT16") SampleFormat sampleFormat,
                                  @DefaultValue("1") int channels,
                                  @DefaultValue("960") int blockSize,
                                  @DefaultValue("5") int xrunRestartThreshold,
                                  @DefaultValue("50") int queueCapacity) {
        this.micName = micName;
        this.sampleRate = sampleRate;
        this.sampleFormat = sampleFormat;
        this.channels = channels;
        this.blockSize = blockSize;
        this.xrunRestartThreshold = xrunRestartThreshold;
        this.queueCapacity = queueCapacity;
    }

    public String getMicName() { return micName; }
    public int getSampleRate() { return sampleRate; }
    public SampleFormat getSampleFormat() { return sampleFormat; }
    public int getChannels() { return channels; }
    public int getBlockSize() { return blockSize; }
    public int getXrunRestartThreshold() { return xrunRestartThreshold; }
    public int getQueueCapacity() { return queueCapacity; }
}
