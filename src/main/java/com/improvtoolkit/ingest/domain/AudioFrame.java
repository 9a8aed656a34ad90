package com.improvtoolkit.ingest.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One chunk of captured (or processed) PCM audio. Immutable: the PCM payload is copied on the
 * way in and on the way out, so stages construct new frames instead of mutating shared buffers.
 *
 * @param sourceId      microphone index the frame came from
 * @param pcm           interleaved little-endian PCM bytes in {@code format}
 * @param captureNanos  monotonic capture time ({@link System#nanoTime()})
 * @param wallTime      wall-clock capture time
 * @param sampleRate    rate declared by the stage that produced this frame
 * @param format        sample encoding of {@code pcm}
 * @param channels      interleaved channel count
 */
public record AudioFrame(int sourceId,
                         byte[] pcm,
                         long captureNanos,
                         Instant wallTime,
                         int sampleRate,
                         SampleFormat format,
                         int channels) {

    public AudioFrame {
        Objects.requireNonNull(pcm, "pcm");
        Objects.requireNonNull(wallTime, "wallTime");
        Objects.requireNonNull(format, "format");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive: " + channels);
        }
        pcm = pcm.clone();
    }

    @Override
    public byte[] pcm() {
        return pcm.clone();
    }

    /** Number of sample frames (samples per channel). */
    public int frameCount() {
        return pcm.length / (format.bytesPerSample() * channels);
    }

    /** Returns a frame carrying the same capture metadata but a new payload, rate and format. */
    public AudioFrame withPayload(byte[] newPcm, int newSampleRate, SampleFormat newFormat, int newChannels) {
        return new AudioFrame(sourceId, newPcm, captureNanos, wallTime, newSampleRate, newFormat, newChannels);
    }

    /** Value equality, comparing the PCM payload by content. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFrame other)) {
            return false;
        }
        return sourceId == other.sourceId
                && captureNanos == other.captureNanos
                && sampleRate == other.sampleRate
                && channels == other.channels
                && format == other.format
                && wallTime.equals(other.wallTime)
                && Arrays.equals(pcm, other.pcm);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sourceId, captureNanos, wallTime, sampleRate, format, channels);
        return 31 * result + Arrays.hashCode(pcm);
    }

    @Override
    public String toString() {
        return "AudioFrame[source=" + sourceId + ", bytes=" + pcm.length + ", rate=" + sampleRate
                + ", format=" + format + ", channels=" + channels + "]";
    }
}
