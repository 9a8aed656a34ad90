package com.improvtoolkit.ingest.service.pipeline;

import com.improvtoolkit.ingest.config.properties.AudioCaptureProperties;
import com.improvtoolkit.ingest.config.properties.AudioProcessingProperties;
import com.improvtoolkit.ingest.config.properties.ButtonProperties;
import com.improvtoolkit.ingest.config.properties.DeviceSessionProperties;
import com.improvtoolkit.ingest.config.properties.PipelineProperties;
import com.improvtoolkit.ingest.domain.ButtonAction;
import com.improvtoolkit.ingest.domain.DeviceStatus;
import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import com.improvtoolkit.ingest.domain.SampleFormat;
import com.improvtoolkit.ingest.domain.TaggedAudioFrame;
import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.audio.capture.CaptureChunk;
import com.improvtoolkit.ingest.service.audio.capture.CaptureLine;
import com.improvtoolkit.ingest.service.button.ButtonDevice;
import com.improvtoolkit.ingest.service.button.ButtonInputEvent;
import com.improvtoolkit.ingest.service.button.DeviceRegistry;
import com.improvtoolkit.ingest.service.button.KeyCode;
import com.improvtoolkit.ingest.service.dispatch.TransportPublisher;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import com.improvtoolkit.ingest.service.session.DeviceSession;
import com.improvtoolkit.ingest.service.session.SessionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class IngestPipelineTest {

    private static final String RESET_PATH = "/dev/input/event3";
    private static final String AVATAR_PATH = "/dev/input/event4";

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final FakeMicrophone microphone = new FakeMicrophone();
    private final Map<String, FakeButtons> buttonDevices = new ConcurrentHashMap<>();
    private final CapturingTransport transport = new CapturingTransport();
    private final DeviceRegistry registry = new DeviceRegistry();
    private ThreadPoolTaskExecutor executor;
    private IngestPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("ingest-test-");
        executor.initialize();

        DeviceSessionProperties sessionProps = new DeviceSessionProperties();
        sessionProps.setReconnectDelayMs(20);
        sessionProps.setSuperviseIntervalMs(20);
        sessionProps.setHeartbeatTimeoutMs(10_000);

        ButtonProperties buttonProps = new ButtonProperties();
        buttonProps.setDebounceMs(300);
        buttonProps.setPollTimeoutMs(20);
        buttonProps.setReset(new ButtonProperties.Device("reset", RESET_PATH, true,
                Map.of(KeyCode.KEY_R, ButtonAction.RESET)));
        buttonProps.setAvatars(List.of(new ButtonProperties.Device("avatar-1", AVATAR_PATH, true,
                Map.of(KeyCode.KEY_SPACE, ButtonAction.SPEAK))));

        PipelineProperties pipelineProps = new PipelineProperties();
        pipelineProps.setShutdownTimeoutMs(2000);

        pipeline = new IngestPipeline(sessionProps,
                new AudioCaptureProperties("USB", 48000, SampleFormat.INT16, 1, 960, 5, 50),
                new AudioProcessingProperties(),
                buttonProps,
                pipelineProps,
                microphone,
                device -> new FakeButtonDriver(device.getPath()),
                registry,
                transport,
                new PipelineMetrics(meters),
                events::add,
                executor);
    }

    @AfterEach
    void tearDown() {
        pipeline.stop();
        executor.shutdown();
    }

    @Test
    void startsOneSessionPerDevice() {
        pipeline.start();

        assertThat(pipeline.isRunning()).isTrue();
        assertThat(pipeline.sessions()).extracting(DeviceSession::deviceId)
                .containsExactly(IngestPipeline.MICROPHONE_ID, "reset", "avatar-1");
        await().atMost(Duration.ofSeconds(3)).until(() ->
                pipeline.sessions().stream().allMatch(s -> s.state() == SessionState.ACTIVE));
        await().atMost(Duration.ofSeconds(2)).until(() -> registry.size() == 2);
    }

    @Test
    void buttonPressReachesTransportAfterConnectStatus() {
        pipeline.start();
        await().atMost(Duration.ofSeconds(3)).until(() -> buttonDevices.containsKey(RESET_PATH));

        buttonDevices.get(RESET_PATH).press(KeyCode.KEY_R, 42_000L);

        await().atMost(Duration.ofSeconds(3)).until(() -> transport.published.stream()
                .anyMatch(e -> e.payload().action() == ButtonAction.RESET));
        assertThat(transport.published).anyMatch(e -> e.payload().status() == DeviceStatus.CONNECTED
                && "avatar-1".equals(e.payload().sourceId()));
    }

    @Test
    void capturedAudioIsProcessedAndForwarded() {
        pipeline.start();
        FakeLine line = microphone.awaitLine();

        line.chunks.add(new CaptureChunk(new byte[1920], false));

        await().atMost(Duration.ofSeconds(3)).until(() -> !transport.audio.isEmpty());
        TaggedAudioFrame frame = transport.audio.get(0);
        assertThat(frame.sequenceNum()).isZero();
        assertThat(frame.frame().sampleRate()).isEqualTo(16000);
        assertThat(frame.frame().frameCount()).isEqualTo(320);
        assertThat(frame.silence()).isTrue();
    }

    @Test
    void stopCancelsSessionsAndClosesDevices() {
        pipeline.start();
        FakeLine line = microphone.awaitLine();
        await().atMost(Duration.ofSeconds(3)).until(() -> buttonDevices.size() == 2);

        pipeline.stop();

        assertThat(pipeline.isRunning()).isFalse();
        assertThat(pipeline.sessions()).isEmpty();
        assertThat(line.closed).isTrue();
        assertThat(buttonDevices.values()).allMatch(d -> d.closed);
        assertThat(registry.size()).isZero();
    }

    @Test
    void canRestartAfterStop() {
        pipeline.start();
        pipeline.stop();
        pipeline.start();

        assertThat(pipeline.sessions()).hasSize(3);
        assertThat(pipeline.isRunning()).isTrue();
    }

    private static final class CapturingTransport implements TransportPublisher {
        final List<PriorityEnvelope> published = new CopyOnWriteArrayList<>();
        final List<TaggedAudioFrame> audio = new CopyOnWriteArrayList<>();

        @Override
        public void publish(PriorityEnvelope envelope) {
            published.add(envelope);
        }

        @Override
        public void publishAudio(TaggedAudioFrame frame) {
            audio.add(frame);
        }
    }

    private static final class FakeMicrophone implements DeviceDriver<CaptureLine> {
        final List<FakeLine> lines = new CopyOnWriteArrayList<>();

        @Override
        public CaptureLine open() {
            FakeLine line = new FakeLine();
            lines.add(line);
            return line;
        }

        @Override
        public void close(CaptureLine handle) {
            handle.close();
        }

        FakeLine awaitLine() {
            await().atMost(Duration.ofSeconds(3)).until(() -> !lines.isEmpty());
            return lines.get(lines.size() - 1);
        }
    }

    private static final class FakeLine implements CaptureLine {
        final BlockingQueue<CaptureChunk> chunks = new LinkedBlockingQueue<>();
        volatile boolean closed;

        @Override
        public CaptureChunk read() {
            while (!closed) {
                try {
                    CaptureChunk next = chunks.poll(10, TimeUnit.MILLISECONDS);
                    if (next != null) {
                        return next;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            throw new DeviceUnavailableException("fake-mic", "closed");
        }

        @Override
        public int sampleRate() {
            return 48000;
        }

        @Override
        public SampleFormat format() {
            return SampleFormat.INT16;
        }

        @Override
        public int channels() {
            return 1;
        }

        @Override
        public boolean resampleRequired() {
            return false;
        }

        @Override
        public String deviceName() {
            return "fake-mic";
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private final class FakeButtonDriver implements DeviceDriver<ButtonDevice> {
        private final String path;

        FakeButtonDriver(String path) {
            this.path = path;
        }

        @Override
        public ButtonDevice open() {
            FakeButtons device = new FakeButtons(path);
            buttonDevices.put(path, device);
            return device;
        }

        @Override
        public void close(ButtonDevice device) {
            device.close();
        }
    }

    private static final class FakeButtons implements ButtonDevice {
        private final String path;
        private final BlockingQueue<ButtonInputEvent> events = new LinkedBlockingQueue<>();
        volatile boolean closed;

        FakeButtons(String path) {
            this.path = path;
        }

        void press(KeyCode key, long when) {
            events.add(ButtonInputEvent.of(key, ButtonInputEvent.State.DOWN, when));
        }

        @Override
        public Optional<ButtonInputEvent> poll(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        @Override
        public String path() {
            return path;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
