package com.improvtoolkit.ingest.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * A button event queued for dispatch. Ordered by (priority value, enqueue sequence); the payload
 * never takes part in ordering.
 */
public record PriorityEnvelope(Priority priority, ButtonEvent payload, long enqueueSeq) {

    /** Total order: ascending priority value, then FIFO among equal priorities. */
    public static final Comparator<PriorityEnvelope> DISPATCH_ORDER =
            Comparator.<PriorityEnvelope>comparingInt(e -> e.priority().value())
                    .thenComparingLong(PriorityEnvelope::enqueueSeq);

    public PriorityEnvelope {
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(payload, "payload");
    }
}
