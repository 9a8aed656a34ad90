package com.improvtoolkit.ingest.service.dispatch;

import com.improvtoolkit.ingest.domain.TaggedAudioFrame;
import com.improvtoolkit.ingest.exception.QueueShutdownException;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.SlidingWindowQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;

/**
 * Drains processed audio frames to the transport. Failures are logged and the frame dropped.
 */
public class AudioForwarder implements Runnable {

    private static final Logger LOG = LogManager.getLogger(AudioForwarder.class);

    private final SlidingWindowQueue<TaggedAudioFrame> input;
    private final TransportPublisher publisher;
    private final PipelineMetrics metrics;

    public AudioForwarder(SlidingWindowQueue<TaggedAudioFrame> input, TransportPublisher publisher,
                          PipelineMetrics metrics) {
        this.input = Objects.requireNonNull(input);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public void run() {
        ThreadContext.put("stage", "audio-forward");
        try {
            while (!Thread.currentThread().isInterrupted()) {
                TaggedAudioFrame frame = input.get();
                try {
                    publisher.publishAudio(frame);
                } catch (RuntimeException e) {
                    LOG.warn("Dropping audio frame {} after transport failure: {}", frame.sequenceNum(), e.toString());
                    metrics.incrementDispatchFailure("audio");
                }
            }
        } catch (QueueShutdownException e) {
            LOG.debug("Queue shut down; leaving forward loop");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            ThreadContext.remove("stage");
        }
    }
}
