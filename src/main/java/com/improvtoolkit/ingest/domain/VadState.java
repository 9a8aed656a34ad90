package com.improvtoolkit.ingest.domain;

/**
 * Voice-activity segmentation carry state.
 *
 * <p>Transitions:
 * <ul>
 *   <li>speech: NA|STOP -&gt; START, START|CONTINUE -&gt; CONTINUE</li>
 *   <li>no speech: START|CONTINUE -&gt; STOP, STOP -&gt; NA, NA stays NA</li>
 * </ul>
 */
public enum VadState {
    NA,
    START,
    CONTINUE,
    STOP;

    public VadState next(boolean speech) {
        if (speech) {
            return (this == NA || this == STOP) ? START : CONTINUE;
        }
        return switch (this) {
            case START, CONTINUE -> STOP;
            case STOP, NA -> NA;
        };
    }
}
