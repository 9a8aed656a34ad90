package com.improvtoolkit.ingest.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized Micrometer instrumentation for the ingest pipeline.
 *
 * <p>Covers:
 * <ul>
 *   <li>Queue depth gauges and sliding-window evictions</li>
 *   <li>Device resilience: xruns, stream restarts, reconnect attempts, dead devices</li>
 *   <li>Button outcomes: accepted, debounced, filtered</li>
 *   <li>Dispatch and forwarding results, processed audio frames</li>
 * </ul>
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "ingest";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Registers a depth gauge for a named queue. */
    public void registerQueueDepth(String queueName, Supplier<Number> depth) {
        Gauge.builder(METRIC_PREFIX + ".queue.depth", depth)
                .description("Items currently buffered in a pipeline queue")
                .tag("queue", queueName)
                .register(registry);
    }

    public void incrementEviction(String queueName) {
        counter("queue.evictions", "Oldest items dropped by a full sliding-window queue",
                "queue", queueName).increment();
    }

    public void incrementXrun(String deviceId) {
        counter("audio.xruns", "Capture chunks flagged as overrun or underrun",
                "device", deviceId).increment();
    }

    public void incrementStreamRestart(String deviceId, String reason) {
        Counter.builder(METRIC_PREFIX + ".device.restarts")
                .description("Controlled stream restarts after a degraded verdict")
                .tag("device", deviceId)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementReconnectAttempt(String deviceId) {
        counter("device.reconnects", "Failed opens and lost devices counted against the retry budget",
                "device", deviceId).increment();
    }

    public void incrementDeadDevice(String deviceId) {
        counter("device.dead", "Devices that exhausted their retry budget",
                "device", deviceId).increment();
    }

    public void incrementButtonAccepted(String deviceId, String action) {
        Counter.builder(METRIC_PREFIX + ".buttons.accepted")
                .description("Key presses mapped to an action and queued")
                .tag("device", deviceId)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void incrementButtonDebounced(String deviceId) {
        counter("buttons.debounced", "Key presses suppressed by the debounce window",
                "device", deviceId).increment();
    }

    public void incrementButtonFiltered(String deviceId, String reason) {
        Counter.builder(METRIC_PREFIX + ".buttons.filtered")
                .description("Key events dropped before mapping (key-up, repeat, unmapped)")
                .tag("device", deviceId)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementDispatched(String priority) {
        counter("dispatch.delivered", "Envelopes handed to the transport publisher",
                "priority", priority).increment();
    }

    public void incrementDispatchFailure(String channel) {
        counter("dispatch.failures", "Transport deliveries that failed and were dropped",
                "channel", channel).increment();
    }

    public void incrementFramesProcessed(boolean voice) {
        counter("audio.frames.processed", "Frames emitted by the processing stage",
                "voice", Boolean.toString(voice)).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(METRIC_PREFIX + "." + name)
                .description(description)
                .tag(tagKey, tagValue)
                .register(registry);
    }
}
