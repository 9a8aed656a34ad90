package com.improvtoolkit.ingest.service.button;

import com.improvtoolkit.ingest.domain.ButtonAction;
import com.improvtoolkit.ingest.domain.ButtonEvent;
import com.improvtoolkit.ingest.domain.DeviceStatus;
import com.improvtoolkit.ingest.domain.Priority;
import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.PriorityDispatchQueue;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import com.improvtoolkit.ingest.service.session.SessionSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ButtonMonitorTest {

    private static final String PATH = "/dev/input/by-id/usb-reset-box-event-kbd";
    private static final Map<KeyCode, ButtonAction> RESET_KEYS =
            Map.of(KeyCode.KEY_R, ButtonAction.RESET, KeyCode.KEY_ESC, ButtonAction.EXIT);

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final DeviceRegistry registry = new DeviceRegistry();
    private final PriorityDispatchQueue queue = new PriorityDispatchQueue("button-dispatch", 64);
    private final FakeDriver driver = new FakeDriver();
    private ButtonMonitor monitor;
    private Thread thread;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (monitor != null) {
            monitor.cancel();
        }
        if (thread != null) {
            thread.join(2000);
        }
    }

    private ButtonMonitor monitor(int maxAttempts) {
        monitor = new ButtonMonitor("reset", PATH, RESET_KEYS, driver,
                new SessionSettings(maxAttempts, Duration.ofMillis(10), Duration.ofMillis(10)),
                300, Duration.ofMillis(20), registry, queue, new PipelineMetrics(meters),
                event -> { }, System::nanoTime);
        return monitor;
    }

    private void startMonitor(int maxAttempts) {
        thread = new Thread(monitor(maxAttempts), "button-monitor-under-test");
        thread.start();
    }

    @Test
    void keyDownOfMappedKeyBecomesAction() {
        ButtonMonitor m = monitor(3);

        Optional<PriorityEnvelope> envelope = m.handle(ButtonInputEvent.of(KeyCode.KEY_R, ButtonInputEvent.State.DOWN, 5_000L));

        assertThat(envelope).isPresent();
        ButtonEvent event = envelope.get().payload();
        assertThat(event.kind()).isEqualTo(ButtonEvent.Kind.ACTION);
        assertThat(event.action()).isEqualTo(ButtonAction.RESET);
        assertThat(event.sourceId()).isEqualTo("reset");
        assertThat(event.timestamp()).isEqualTo(Instant.ofEpochMilli(5_000L));
        assertThat(envelope.get().priority()).isEqualTo(Priority.HIGH);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void acceptedPressIsLoggedAtDebugOnly() {
        ButtonMonitor m = monitor(3);
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        Logger logger = ctx.getLogger(ButtonMonitor.class.getName());
        Level previous = logger.getLevel();
        InMemoryAppender appender = new InMemoryAppender("button-monitor-test");
        appender.start();
        Configurator.setLevel(ButtonMonitor.class.getName(), Level.DEBUG);
        logger.addAppender(appender);

        try {
            m.handle(ButtonInputEvent.of(KeyCode.KEY_R, ButtonInputEvent.State.DOWN, 5_000L));

            assertThat(appender.events)
                    .filteredOn(e -> e.getMessage().getFormattedMessage().startsWith("Button KEY_R"))
                    .singleElement()
                    .satisfies(e -> assertThat(e.getLevel()).isEqualTo(Level.DEBUG));
            assertThat(appender.events).noneMatch(e -> e.getLevel().isMoreSpecificThan(Level.INFO));
        } finally {
            logger.removeAppender(appender);
            appender.stop();
            Configurator.setLevel(ButtonMonitor.class.getName(), previous);
        }
    }

    @Test
    void keyUpRepeatAndUnmappedKeysAreDropped() {
        ButtonMonitor m = monitor(3);

        assertThat(m.handle(ButtonInputEvent.of(KeyCode.KEY_R, ButtonInputEvent.State.UP, 0L))).isEmpty();
        assertThat(m.handle(ButtonInputEvent.of(KeyCode.KEY_R, ButtonInputEvent.State.REPEAT, 0L))).isEmpty();
        assertThat(m.handle(ButtonInputEvent.of(KeyCode.KEY_SPACE, ButtonInputEvent.State.DOWN, 0L))).isEmpty();
        assertThat(m.handle(new ButtonInputEvent(-1, ButtonInputEvent.State.DOWN, 0L))).isEmpty();

        assertThat(queue.size()).isZero();
        assertThat(meters.get("ingest.buttons.filtered").tag("reason", "unmapped").counter().count()).isEqualTo(2.0);
        assertThat(meters.get("ingest.buttons.filtered").tag("reason", "key-up").counter().count()).isEqualTo(1.0);
    }

    @Test
    void debounceAppliesAcrossKeysOfOneDevice() {
        ButtonMonitor m = monitor(3);

        assertThat(m.handle(ButtonInputEvent.of(KeyCode.KEY_R, ButtonInputEvent.State.DOWN, 1_000L))).isPresent();
        assertThat(m.handle(ButtonInputEvent.of(KeyCode.KEY_ESC, ButtonInputEvent.State.DOWN, 1_299L))).isEmpty();
        assertThat(m.handle(ButtonInputEvent.of(KeyCode.KEY_R, ButtonInputEvent.State.DOWN, 1_300L))).isPresent();

        assertThat(meters.get("ingest.buttons.debounced").counter().count()).isEqualTo(1.0);
    }

    @Test
    void rejectsEmptyKeyMap() {
        assertThatThrownBy(() -> new ButtonMonitor("avatar-1", PATH, Map.of(), driver,
                new SessionSettings(3, Duration.ZERO, Duration.ofMillis(10)), 300, Duration.ofMillis(20),
                registry, queue, new PipelineMetrics(meters), event -> { }, System::nanoTime))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("avatar-1");
    }

    @Test
    void runningMonitorRegistersDeviceAndQueuesConnectedStatus() throws InterruptedException {
        startMonitor(3);
        FakeDevice device = driver.awaitDevice(1);

        await().atMost(Duration.ofSeconds(2)).until(() -> registry.contains(PATH));
        device.press(KeyCode.KEY_R, 10_000L);
        await().atMost(Duration.ofSeconds(2)).until(() -> queue.size() == 2);

        PriorityEnvelope first = queue.take(Duration.ofSeconds(2));
        PriorityEnvelope second = queue.take(Duration.ofSeconds(2));
        assertThat(first.payload().action()).isEqualTo(ButtonAction.RESET);
        assertThat(second.payload().status()).isEqualTo(DeviceStatus.CONNECTED);
    }

    @Test
    void unpluggedDeviceIsReopenedAndDeregistered() throws InterruptedException {
        startMonitor(3);
        FakeDevice first = driver.awaitDevice(1);
        await().atMost(Duration.ofSeconds(2)).until(() -> registry.get(PATH).orElse(null) == first);

        first.unplug();

        FakeDevice second = driver.awaitDevice(2);
        await().atMost(Duration.ofSeconds(2)).until(() -> registry.get(PATH).orElse(null) == second);
        assertThat(first.closed).isTrue();

        List<DeviceStatus> statuses = new ArrayList<>();
        while (queue.size() > 0) {
            statuses.add(queue.take().payload().status());
        }
        assertThat(statuses).containsExactly(DeviceStatus.CONNECTED, DeviceStatus.DISCONNECTED, DeviceStatus.CONNECTED);
    }

    @Test
    void deadDeviceQueuesHighPriorityDeadStatus() throws InterruptedException {
        driver.failOpens = true;
        startMonitor(2);

        thread.join(2000);

        PriorityEnvelope envelope = queue.take(Duration.ofSeconds(1));
        assertThat(envelope.payload().status()).isEqualTo(DeviceStatus.DEAD);
        assertThat(envelope.priority()).isEqualTo(Priority.HIGH);
        assertThat(driver.opens.get()).isEqualTo(2);
        assertThat(registry.size()).isZero();
    }

    private static final class FakeDriver implements DeviceDriver<ButtonDevice> {
        final AtomicInteger opens = new AtomicInteger();
        final List<FakeDevice> devices = new CopyOnWriteArrayList<>();
        volatile boolean failOpens;

        @Override
        public ButtonDevice open() {
            opens.incrementAndGet();
            if (failOpens) {
                throw new DeviceUnavailableException("reset", "no such device: " + PATH);
            }
            FakeDevice device = new FakeDevice();
            devices.add(device);
            return device;
        }

        @Override
        public void close(ButtonDevice device) {
            device.close();
        }

        FakeDevice awaitDevice(int n) {
            await().atMost(Duration.ofSeconds(3)).until(() -> devices.size() >= n);
            return devices.get(n - 1);
        }
    }

    private static final class FakeDevice implements ButtonDevice {
        private final BlockingQueue<ButtonInputEvent> events = new LinkedBlockingQueue<>();
        volatile boolean unplugged;
        volatile boolean closed;

        void press(KeyCode key, long when) {
            events.add(ButtonInputEvent.of(key, ButtonInputEvent.State.DOWN, when));
        }

        void unplug() {
            unplugged = true;
        }

        @Override
        public Optional<ButtonInputEvent> poll(Duration timeout) throws InterruptedException {
            if (unplugged) {
                throw new DeviceUnavailableException(PATH, "device stream ended");
            }
            return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        @Override
        public String path() {
            return PATH;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static class InMemoryAppender extends AbstractAppender {
        final List<LogEvent> events = new CopyOnWriteArrayList<>();

        InMemoryAppender(String name) {
            super(name, new AbstractFilter() { }, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }
}
