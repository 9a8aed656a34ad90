package com.improvtoolkit.ingest.service.button;

import com.improvtoolkit.ingest.domain.ButtonAction;
import com.improvtoolkit.ingest.domain.ButtonEvent;
import com.improvtoolkit.ingest.domain.DeviceStatus;
import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import com.improvtoolkit.ingest.exception.QueueShutdownException;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.PriorityDispatchQueue;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import com.improvtoolkit.ingest.service.session.DeviceKind;
import com.improvtoolkit.ingest.service.session.DeviceSession;
import com.improvtoolkit.ingest.service.session.HealthPolicy;
import com.improvtoolkit.ingest.service.session.RunOutcome;
import com.improvtoolkit.ingest.service.session.SessionSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Session for one physical control device.
 *
 * <p>Only key-down transitions of mapped keys that pass the debounce window become
 * {@link ButtonEvent.Kind#ACTION} events; everything else is counted and dropped. Session status
 * changes become {@link ButtonEvent.Kind#STATUS} events. Both go into the priority dispatch queue.
 * The key map and debounce window survive reconnects unchanged; only the device handle is replaced.
 */
public class ButtonMonitor extends DeviceSession<ButtonDevice> {

    private static final Logger LOG = LogManager.getLogger(ButtonMonitor.class);

    private final String path;
    private final Map<KeyCode, ButtonAction> keyMap;
    private final Debouncer debouncer;
    private final Duration pollTimeout;
    private final DeviceRegistry registry;
    private final PriorityDispatchQueue dispatchQueue;
    private final PipelineMetrics metrics;

    public ButtonMonitor(String sourceId,
                         String path,
                         Map<KeyCode, ButtonAction> keyMap,
                         DeviceDriver<ButtonDevice> driver,
                         SessionSettings settings,
                         long debounceMillis,
                         Duration pollTimeout,
                         DeviceRegistry registry,
                         PriorityDispatchQueue dispatchQueue,
                         PipelineMetrics metrics,
                         ApplicationEventPublisher publisher,
                         LongSupplier nanoClock) {
        super(sourceId, DeviceKind.BUTTON, driver, settings, HealthPolicy.none(), publisher, nanoClock);
        if (keyMap == null || keyMap.isEmpty()) {
            throw new IllegalArgumentException("Button device '" + sourceId + "' has no key mappings");
        }
        this.path = Objects.requireNonNull(path, "path");
        this.keyMap = new EnumMap<>(keyMap);
        this.debouncer = new Debouncer(debounceMillis);
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    protected void onOpened(ButtonDevice device) {
        registry.register(device);
    }

    @Override
    protected void onClosed(ButtonDevice device, RunOutcome outcome) {
        registry.remove(device.path(), device);
    }

    @Override
    protected RunOutcome runActive(ButtonDevice device) throws InterruptedException {
        while (!isCancelled()) {
            Optional<ButtonInputEvent> event = device.poll(pollTimeout);
            heartbeat();
            markHealthy();
            event.ifPresent(this::handle);
        }
        return RunOutcome.STOPPED;
    }

    @Override
    protected void onStatus(DeviceStatus status, Instant at) {
        enqueue(ButtonEvent.status(deviceId(), status, at));
    }

    /**
     * Filters, maps and debounces one raw event.
     *
     * @return the queued envelope, or empty if the event was dropped
     */
    Optional<PriorityEnvelope> handle(ButtonInputEvent event) {
        if (event.state() != ButtonInputEvent.State.DOWN) {
            metrics.incrementButtonFiltered(deviceId(), event.state() == ButtonInputEvent.State.UP ? "key-up" : "repeat");
            return Optional.empty();
        }
        Optional<KeyCode> key = event.key();
        ButtonAction action = key.map(keyMap::get).orElse(null);
        if (action == null) {
            LOG.debug("Ignoring unmapped key code {}", event.rawCode());
            metrics.incrementButtonFiltered(deviceId(), "unmapped");
            return Optional.empty();
        }
        if (!debouncer.accept(event.whenMillis())) {
            LOG.debug("Debounced {} at {}", key.get(), event.whenMillis());
            metrics.incrementButtonDebounced(deviceId());
            return Optional.empty();
        }
        LOG.debug("Button {} -> {}", key.get(), action.wireName());
        metrics.incrementButtonAccepted(deviceId(), action.wireName());
        return enqueue(ButtonEvent.action(deviceId(), action, Instant.ofEpochMilli(event.whenMillis())));
    }

    private Optional<PriorityEnvelope> enqueue(ButtonEvent event) {
        try {
            return Optional.of(dispatchQueue.offer(event));
        } catch (QueueShutdownException e) {
            LOG.debug("Dispatch queue shut down; dropping {}", event);
            return Optional.empty();
        }
    }

    public String path() {
        return path;
    }

    public Map<KeyCode, ButtonAction> keyMap() {
        return Map.copyOf(keyMap);
    }
}
