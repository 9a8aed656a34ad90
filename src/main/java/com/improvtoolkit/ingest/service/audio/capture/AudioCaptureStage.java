package com.improvtoolkit.ingest.service.audio.capture;

import com.improvtoolkit.ingest.domain.AudioFrame;
import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.exception.QueueShutdownException;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.SlidingWindowQueue;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import com.improvtoolkit.ingest.service.session.DeviceKind;
import com.improvtoolkit.ingest.service.session.DeviceSession;
import com.improvtoolkit.ingest.service.session.HealthPolicy;
import com.improvtoolkit.ingest.service.session.RunOutcome;
import com.improvtoolkit.ingest.service.session.SessionSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Microphone session: a reader thread hands each chunk to {@link #onChunk}, while the session thread
 * supervises health.
 *
 * <p>Every chunk is a heartbeat. An xrun chunk is dropped and counted; {@code xrunThreshold}
 * consecutive xruns, or no chunk within the heartbeat timeout, restart the stream. Clean chunks become
 * {@link AudioFrame}s stamped with the negotiated rate and go into the raw frame queue.
 */
public class AudioCaptureStage extends DeviceSession<CaptureLine> {

    private static final Logger LOG = LogManager.getLogger(AudioCaptureStage.class);

    private static final long READER_JOIN_MILLIS = 1_000;

    private final int sourceId;
    private final SlidingWindowQueue<AudioFrame> output;
    private final PipelineMetrics metrics;

    private final AtomicReference<String> hardFailure = new AtomicReference<>();
    private final AtomicBoolean reading = new AtomicBoolean();
    private volatile Thread reader;
    private volatile CaptureLine activeLine;

    public AudioCaptureStage(String deviceId,
                             int sourceId,
                             DeviceDriver<CaptureLine> driver,
                             SessionSettings settings,
                             int xrunThreshold,
                             Duration heartbeatTimeout,
                             SlidingWindowQueue<AudioFrame> output,
                             PipelineMetrics metrics,
                             ApplicationEventPublisher publisher,
                             LongSupplier nanoClock) {
        super(deviceId, DeviceKind.MICROPHONE, driver, settings,
                HealthPolicy.errorBurst(xrunThreshold).or(HealthPolicy.heartbeat(heartbeatTimeout)),
                publisher, nanoClock);
        this.sourceId = sourceId;
        this.output = Objects.requireNonNull(output, "output");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    protected void onOpened(CaptureLine line) {
        activeLine = line;
        hardFailure.set(null);
        if (line.resampleRequired()) {
            LOG.info("Capturing at negotiated {}Hz; processing stage will resample", line.sampleRate());
        }
    }

    @Override
    protected RunOutcome runActive(CaptureLine line) throws InterruptedException {
        Map<String, String> context = ThreadContext.getImmutableContext();
        reading.set(true);
        Thread t = new Thread(() -> {
            ThreadContext.putAll(context);
            try {
                readLoop(line);
            } finally {
                ThreadContext.clearAll();
            }
        }, "audio-capture-" + deviceId());
        t.setDaemon(true);
        reader = t;
        t.start();
        try {
            return awaitVerdict(hardFailure::get);
        } finally {
            // the session closes the line next; a read failing after this point is expected
            reading.set(false);
        }
    }

    @Override
    protected void onClosed(CaptureLine line, RunOutcome outcome) {
        activeLine = null;
        Thread t = reader;
        reader = null;
        if (t == null || !t.isAlive()) {
            return;
        }
        try {
            t.join(READER_JOIN_MILLIS);
            if (t.isAlive()) {
                LOG.warn("Capture reader did not terminate within {}ms", READER_JOIN_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture reader to terminate");
        }
    }

    private void readLoop(CaptureLine line) {
        while (reading.get() && !isCancelled()) {
            CaptureChunk chunk;
            try {
                chunk = line.read();
            } catch (DeviceUnavailableException e) {
                if (reading.get()) {
                    hardFailure.compareAndSet(null, e.getMessage());
                }
                return;
            }
            if (!reading.get()) {
                return;
            }
            onChunk(line, chunk);
        }
    }

    /**
     * Handles one delivered chunk. Runs on the reader thread; only touches atomics and the
     * thread-safe output queue.
     */
    void onChunk(CaptureLine line, CaptureChunk chunk) {
        heartbeat();
        if (chunk.xrun()) {
            int consecutive = health().recordError();
            metrics.incrementXrun(deviceId());
            LOG.debug("Xrun on capture ({} consecutive, {} total)", consecutive, health().totalErrors());
            return;
        }
        health().clearConsecutiveErrors();
        markHealthy();
        if (chunk.pcm().length == 0) {
            return;
        }
        AudioFrame frame = new AudioFrame(sourceId, chunk.pcm(), nanoTime(), Instant.now(),
                line.sampleRate(), line.format(), line.channels());
        try {
            if (output.put(frame)) {
                metrics.incrementEviction(output.name());
            }
        } catch (QueueShutdownException e) {
            LOG.debug("Frame queue shut down; dropping chunk");
        }
    }

    /** The line currently open, or {@code null} between runs. */
    public CaptureLine activeLine() {
        return activeLine;
    }
}
