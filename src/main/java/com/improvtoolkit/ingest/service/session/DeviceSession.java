package com.improvtoolkit.ingest.service.session;

import com.improvtoolkit.ingest.domain.DeviceStatus;
import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.session.event.DeviceStateChangedEvent;
import com.improvtoolkit.ingest.service.session.event.DeviceStatusEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Supervisory loop for one physical device: open, run, classify the failure, then retry with a
 * fixed backoff or give up for good.
 *
 * <p>State machine:
 * <ul>
 *   <li>DISCONNECTED → CONNECTING: session start, or after a failure that allows a retry</li>
 *   <li>CONNECTING → ACTIVE: open succeeded; reconnect attempts and consecutive errors reset,
 *       heartbeat set to now</li>
 *   <li>ACTIVE → DEGRADED: the {@link HealthPolicy} tripped; the stream is restarted after the
 *       backoff without consuming a reconnect attempt</li>
 *   <li>ACTIVE/DEGRADED → DISCONNECTED: hard I/O error; {@code DISCONNECTED} status is emitted
 *       before the transition, then the device is reopened after the backoff. Only failed reopens
 *       consume reconnect attempts</li>
 *   <li>DISCONNECTED → PERMANENTLY_FAILED: failed opens reached the cap; {@code DEAD} is emitted
 *       once and the loop ends</li>
 *   <li>DEGRADED/DISCONNECTED → PERMANENTLY_FAILED: the device was restarted the capped number of
 *       times without any run calling {@link #markHealthy()} in between</li>
 * </ul>
 *
 * <p>Cancellation ({@link #cancel()}) is observed during backoff immediately and during an active
 * run at the next supervision tick. The device handle is always closed before {@link #run()} returns.
 *
 * @param <H> open device handle type
 */
public abstract class DeviceSession<H> implements Runnable {

    private static final Logger LOG = LogManager.getLogger(DeviceSession.class);

    private final String deviceId;
    private final DeviceKind kind;
    private final DeviceDriver<H> driver;
    private final SessionSettings settings;
    private final HealthPolicy healthPolicy;
    private final ApplicationEventPublisher publisher;
    private final LongSupplier nanoClock;
    private final DeviceHealth health;
    private final CountDownLatch cancelSignal = new CountDownLatch(1);

    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile DeviceStatus lastStatus;
    private volatile boolean cancelled;
    private volatile String lastReason = "start";

    protected DeviceSession(String deviceId,
                            DeviceKind kind,
                            DeviceDriver<H> driver,
                            SessionSettings settings,
                            HealthPolicy healthPolicy,
                            ApplicationEventPublisher publisher,
                            LongSupplier nanoClock) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.healthPolicy = Objects.requireNonNull(healthPolicy, "healthPolicy");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.health = new DeviceHealth(settings.maxReconnectAttempts(), nanoClock.getAsLong());
    }

    /**
     * Runs the device while it is healthy. Implementations return as soon as the device must be
     * restarted, has failed, or cancellation was requested; {@link #awaitVerdict} does the waiting
     * for push-style devices.
     *
     * @throws DeviceUnavailableException on a hard I/O error (treated as {@link RunOutcome#DISCONNECTED})
     * @throws InterruptedException if the running thread is interrupted (treated as cancellation)
     */
    protected abstract RunOutcome runActive(H handle) throws InterruptedException;

    /** Hook invoked after a successful open, before {@link #runActive}. */
    protected void onOpened(H handle) {
        // no-op by default
    }

    /** Hook invoked after the handle of an active run has been closed. */
    protected void onClosed(H handle, RunOutcome outcome) {
        // no-op by default
    }

    /** Hook invoked for every status emitted (after the Spring event is published). */
    protected void onStatus(DeviceStatus status, Instant at) {
        // no-op by default
    }

    @Override
    public final void run() {
        ThreadContext.put("deviceId", deviceId);
        try {
            LOG.info("Device session started: kind={}, maxReconnectAttempts={}, reconnectDelay={}ms",
                    kind, settings.maxReconnectAttempts(), settings.reconnectDelay().toMillis());
            loop();
        } finally {
            LOG.info("Device session ended in state {} ({})", state, health);
            ThreadContext.remove("deviceId");
        }
    }

    private void loop() {
        while (!cancelled) {
            transition(SessionState.CONNECTING, lastReason);
            H handle;
            try {
                handle = driver.open();
            } catch (DeviceUnavailableException e) {
                if (!retryAfterFailedOpen(e.getMessage())) {
                    return;
                }
                continue;
            } catch (RuntimeException e) {
                LOG.warn("Unexpected error while opening device", e);
                if (!retryAfterFailedOpen(e.toString())) {
                    return;
                }
                continue;
            }

            health.onConnected(nanoClock.getAsLong());
            transition(SessionState.ACTIVE, "opened");
            emitStatus(DeviceStatus.CONNECTED, "opened");
            RunOutcome outcome = runOpened(handle);

            switch (outcome) {
                case STOPPED -> {
                    return;
                }
                case DEGRADED -> {
                    transition(SessionState.DEGRADED, lastReason);
                    health.clearConsecutiveErrors();
                    if (!restartAfterRun()) {
                        return;
                    }
                }
                case DISCONNECTED -> {
                    emitStatus(DeviceStatus.DISCONNECTED, lastReason);
                    transition(SessionState.DISCONNECTED, lastReason);
                    LOG.warn("Device lost: {}", lastReason);
                    if (!restartAfterRun()) {
                        return;
                    }
                }
            }
        }
    }

    private RunOutcome runOpened(H handle) {
        RunOutcome outcome = RunOutcome.STOPPED;
        try {
            onOpened(handle);
            outcome = cancelled ? RunOutcome.STOPPED : runActive(handle);
        } catch (DeviceUnavailableException e) {
            lastReason = e.getMessage();
            outcome = RunOutcome.DISCONNECTED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
            outcome = RunOutcome.STOPPED;
        } catch (RuntimeException e) {
            LOG.warn("Unexpected error while device active: {}", e.toString());
            lastReason = e.toString();
            outcome = RunOutcome.DISCONNECTED;
        } finally {
            driver.close(handle);
            onClosed(handle, outcome);
        }
        if (cancelled) {
            return RunOutcome.STOPPED;
        }
        return outcome;
    }

    /**
     * Schedules a reopen after an active run ended. Runs that never reported healthy data count
     * against the cap; returns false when the session must stop (dead or cancelled).
     */
    private boolean restartAfterRun() {
        if (health.isRestartBudgetExhausted()) {
            LOG.error("Device kept failing after {} restarts without healthy data", health.restartsSinceHealthy());
            failPermanently("restart budget exhausted");
            return false;
        }
        int restarts = health.recordRestart();
        LOG.info("Restarting device in {}ms (restart {}/{} since last healthy run)",
                settings.reconnectDelay().toMillis(), restarts, settings.maxReconnectAttempts());
        return backoff();
    }

    /** Counts a failed open; returns false when the session must stop (dead or cancelled). */
    private boolean retryAfterFailedOpen(String message) {
        int attempts = health.recordReconnectAttempt();
        LOG.warn("Open failed (attempt {}/{}): {}", attempts, settings.maxReconnectAttempts(), message);
        lastReason = "open failed";
        transition(SessionState.DISCONNECTED, lastReason);
        if (health.isRetryBudgetExhausted()) {
            LOG.error("Device permanently failed after {} failed opens", health.reconnectAttempts());
            failPermanently("retry budget exhausted");
            return false;
        }
        return backoff();
    }

    /**
     * Blocks the calling (session) thread until the health policy trips, a hard failure is flagged
     * by {@code hardFailure}, or cancellation is requested. Intended for push-style devices whose
     * data arrives on a driver thread.
     */
    protected final RunOutcome awaitVerdict(Supplier<String> hardFailure)
            throws InterruptedException {
        long intervalNanos = settings.superviseInterval().toNanos();
        while (!cancelSignal.await(intervalNanos, TimeUnit.NANOSECONDS)) {
            String failure = hardFailure.get();
            if (failure != null) {
                lastReason = failure;
                return RunOutcome.DISCONNECTED;
            }
            HealthPolicy.Verdict verdict = healthPolicy.evaluate(health, nanoClock.getAsLong());
            if (verdict != HealthPolicy.Verdict.HEALTHY) {
                lastReason = verdict.name().toLowerCase(Locale.ROOT).replace('_', '-');
                LOG.warn("Device degraded ({}); restarting stream. {}", lastReason, health);
                return RunOutcome.DEGRADED;
            }
        }
        return RunOutcome.STOPPED;
    }

    /** Cancellable fixed backoff. Returns false if the session was cancelled meanwhile. */
    private boolean backoff() {
        Duration delay = settings.reconnectDelay();
        try {
            if (cancelSignal.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
            return false;
        }
        return !cancelled;
    }

    private void failPermanently(String reason) {
        transition(SessionState.PERMANENTLY_FAILED, reason);
        emitStatus(DeviceStatus.DEAD, reason);
    }

    private void transition(SessionState to, String reason) {
        SessionState from = state;
        if (from == to) {
            return;
        }
        state = to;
        LOG.debug("Session {} -> {} ({})", from, to, reason);
        publisher.publishEvent(new DeviceStateChangedEvent(deviceId, kind, from, to, reason, Instant.now()));
    }

    private void emitStatus(DeviceStatus status, String reason) {
        // A stream restart reopens the device without a disconnect in between; don't repeat CONNECTED.
        if (status == DeviceStatus.CONNECTED && lastStatus == DeviceStatus.CONNECTED) {
            return;
        }
        lastStatus = status;
        Instant at = Instant.now();
        publisher.publishEvent(new DeviceStatusEvent(deviceId, kind, status, reason, at));
        onStatus(status, at);
    }

    /** Requests cancellation. Idempotent; safe from any thread. */
    public void cancel() {
        cancelled = true;
        cancelSignal.countDown();
    }

    protected final boolean isCancelled() {
        return cancelled;
    }

    /** Records a heartbeat at the current monotonic time. */
    protected final void heartbeat() {
        health.heartbeat(nanoClock.getAsLong());
    }

    /** Records that the current run delivered good data, clearing the restart count. */
    protected final void markHealthy() {
        health.markHealthy();
    }

    /** Records the reason later attached to the next transition. */
    protected final void setReason(String reason) {
        this.lastReason = reason;
    }

    protected final long nanoTime() {
        return nanoClock.getAsLong();
    }

    public String deviceId() {
        return deviceId;
    }

    public DeviceKind kind() {
        return kind;
    }

    public SessionState state() {
        return state;
    }

    public DeviceHealth health() {
        return health;
    }

    protected final SessionSettings settings() {
        return settings;
    }
}
