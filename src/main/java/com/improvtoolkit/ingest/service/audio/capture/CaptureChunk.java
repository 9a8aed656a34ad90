package com.improvtoolkit.ingest.service.audio.capture;

/**
 * One read from a capture line.
 *
 * @param pcm  bytes actually read
 * @param xrun true if the driver flagged an overrun or underrun for this chunk
 */
public record CaptureChunk(byte[] pcm, boolean xrun) {
}
