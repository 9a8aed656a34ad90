package com.improvtoolkit.ingest.service.dispatch;

import com.improvtoolkit.ingest.domain.AudioFrame;
import com.improvtoolkit.ingest.domain.SampleFormat;
import com.improvtoolkit.ingest.domain.TaggedAudioFrame;
import com.improvtoolkit.ingest.domain.VadState;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.SlidingWindowQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AudioForwarderTest {

    private static TaggedAudioFrame frame(long seq) {
        AudioFrame audio = new AudioFrame(0, new byte[640], 0L, Instant.now(), 16000, SampleFormat.INT16, 1);
        return new TaggedAudioFrame(audio, false, false, true, VadState.CONTINUE, -20.0, seq);
    }

    @Test
    void forwardsFramesAndSurvivesTransportFailure() throws InterruptedException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SlidingWindowQueue<TaggedAudioFrame> input = new SlidingWindowQueue<>("processed-audio", 8);
        PriorityDispatcherTest.CapturingTransport transport = new PriorityDispatcherTest.CapturingTransport();
        transport.failNext = true;
        Thread thread = new Thread(new AudioForwarder(input, transport, new PipelineMetrics(registry)));
        thread.start();

        input.put(frame(0));
        input.put(frame(1));

        await().atMost(Duration.ofSeconds(2)).until(() -> transport.audio.size() == 1);
        assertThat(transport.audio.get(0).sequenceNum()).isEqualTo(1);
        assertThat(registry.get("ingest.dispatch.failures").tag("channel", "audio").counter().count()).isEqualTo(1.0);

        input.shutdown();
        thread.join(2000);
        assertThat(thread.isAlive()).isFalse();
    }
}
