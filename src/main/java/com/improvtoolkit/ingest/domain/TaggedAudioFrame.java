package com.improvtoolkit.ingest.domain;

import java.util.Objects;

/**
 * Processed audio frame annotated with detection results.
 *
 * <p>{@code silence}, {@code voice}, {@code vadState} and {@code rmsDbfs} always describe the
 * signal before noise reduction; {@code denoised} only says whether the shipped payload was cleaned.
 */
public record TaggedAudioFrame(AudioFrame frame,
                               boolean denoised,
                               boolean silence,
                               boolean voice,
                               VadState vadState,
                               double rmsDbfs,
                               long sequenceNum) {

    public TaggedAudioFrame {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(vadState, "vadState");
        if (sequenceNum < 0) {
            throw new IllegalArgumentException("sequenceNum must be non-negative: " + sequenceNum);
        }
    }
}
