package com.improvtoolkit.ingest.service.dispatch;

import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import com.improvtoolkit.ingest.domain.TaggedAudioFrame;

/**
 * Outbound transport (pub/sub client, real-time media sender). Delivery is fire-and-forget:
 * an exception means this item was not delivered and will not be retried.
 */
public interface TransportPublisher {

    void publish(PriorityEnvelope envelope);

    void publishAudio(TaggedAudioFrame frame);
}
