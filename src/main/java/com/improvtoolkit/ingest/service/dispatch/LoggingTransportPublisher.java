package com.improvtoolkit.ingest.service.dispatch;

import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import com.improvtoolkit.ingest.domain.TaggedAudioFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fallback transport used when no real publisher is wired: serializes button envelopes and logs
 * them, and logs audio segment boundaries.
 */
public class LoggingTransportPublisher implements TransportPublisher {

    private static final Logger LOG = LogManager.getLogger(LoggingTransportPublisher.class);

    @Override
    public void publish(PriorityEnvelope envelope) {
        LOG.info("publish {}", ButtonEventJson.serialize(envelope));
    }

    @Override
    public void publishAudio(TaggedAudioFrame frame) {
        switch (frame.vadState()) {
            case START -> LOG.info("Voice segment started at frame {}", frame.sequenceNum());
            case STOP -> LOG.info("Voice segment ended at frame {}", frame.sequenceNum());
            default -> LOG.trace("audio frame {} ({} bytes)", frame.sequenceNum(), frame.frame().pcm().length);
        }
    }
}
