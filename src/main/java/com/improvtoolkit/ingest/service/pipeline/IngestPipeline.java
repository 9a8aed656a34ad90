package com.improvtoolkit.ingest.service.pipeline;

import com.improvtoolkit.ingest.config.properties.AudioCaptureProperties;
import com.improvtoolkit.ingest.config.properties.AudioProcessingProperties;
import com.improvtoolkit.ingest.config.properties.ButtonProperties;
import com.improvtoolkit.ingest.config.properties.DeviceSessionProperties;
import com.improvtoolkit.ingest.config.properties.PipelineProperties;
import com.improvtoolkit.ingest.domain.AudioFrame;
import com.improvtoolkit.ingest.domain.TaggedAudioFrame;
import com.improvtoolkit.ingest.service.audio.capture.AudioCaptureStage;
import com.improvtoolkit.ingest.service.audio.capture.CaptureLine;
import com.improvtoolkit.ingest.service.audio.processing.AudioProcessingStage;
import com.improvtoolkit.ingest.service.audio.processing.EnergyVoiceActivityDetector;
import com.improvtoolkit.ingest.service.audio.processing.NoiseGate;
import com.improvtoolkit.ingest.service.audio.processing.SilenceDetector;
import com.improvtoolkit.ingest.service.button.ButtonDriverFactory;
import com.improvtoolkit.ingest.service.button.ButtonMonitor;
import com.improvtoolkit.ingest.service.button.DeviceRegistry;
import com.improvtoolkit.ingest.service.dispatch.AudioForwarder;
import com.improvtoolkit.ingest.service.dispatch.PriorityDispatcher;
import com.improvtoolkit.ingest.service.dispatch.TransportPublisher;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.PriorityDispatchQueue;
import com.improvtoolkit.ingest.service.queue.SlidingWindowQueue;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import com.improvtoolkit.ingest.service.session.DeviceSession;
import com.improvtoolkit.ingest.service.session.SessionSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the running pipeline: one task per device session, plus the processing, audio forwarding
 * and dispatch stages, all connected by bounded queues.
 *
 * <p>{@link #stop()} is the group cancellation: every session is cancelled (closing its device and
 * cutting short any backoff), every queue is shut down so the stages leave their loops, and the
 * tasks are awaited within {@code ingest.pipeline.shutdown-timeout-ms}. Queues and sessions are
 * rebuilt on each {@link #start()}.
 */
@Component
public class IngestPipeline implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(IngestPipeline.class);

    static final String MICROPHONE_ID = "microphone";

    private final DeviceSessionProperties sessionProps;
    private final AudioCaptureProperties captureProps;
    private final AudioProcessingProperties processingProps;
    private final ButtonProperties buttonProps;
    private final PipelineProperties pipelineProps;
    private final DeviceDriver<CaptureLine> microphoneDriver;
    private final ButtonDriverFactory buttonDriverFactory;
    private final DeviceRegistry registry;
    private final TransportPublisher transport;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final AsyncTaskExecutor executor;

    private final Object lifecycleLock = new Object();
    private final List<DeviceSession<?>> sessions = new ArrayList<>();
    private final List<Future<?>> tasks = new ArrayList<>();
    private volatile SlidingWindowQueue<AudioFrame> rawAudio;
    private volatile SlidingWindowQueue<TaggedAudioFrame> processedAudio;
    private volatile PriorityDispatchQueue dispatchQueue;
    private volatile List<DeviceSession<?>> activeSessions = List.of();
    private volatile boolean running;

    public IngestPipeline(DeviceSessionProperties sessionProps,
                          AudioCaptureProperties captureProps,
                          AudioProcessingProperties processingProps,
                          ButtonProperties buttonProps,
                          PipelineProperties pipelineProps,
                          DeviceDriver<CaptureLine> microphoneDriver,
                          ButtonDriverFactory buttonDriverFactory,
                          DeviceRegistry registry,
                          TransportPublisher transport,
                          PipelineMetrics metrics,
                          ApplicationEventPublisher publisher,
                          @Qualifier("ingestExecutor") AsyncTaskExecutor executor) {
        this.sessionProps = sessionProps;
        this.captureProps = captureProps;
        this.processingProps = processingProps;
        this.buttonProps = buttonProps;
        this.pipelineProps = pipelineProps;
        this.microphoneDriver = microphoneDriver;
        this.buttonDriverFactory = buttonDriverFactory;
        this.registry = registry;
        this.transport = transport;
        this.metrics = metrics;
        this.publisher = publisher;
        this.executor = executor;
        metrics.registerQueueDepth("raw-audio", () -> sizeOf(rawAudio));
        metrics.registerQueueDepth("processed-audio", () -> sizeOf(processedAudio));
        metrics.registerQueueDepth("button-dispatch", () -> dispatchQueue == null ? 0 : dispatchQueue.size());
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            SessionSettings settings = sessionProps.toSettings();
            rawAudio = new SlidingWindowQueue<>("raw-audio", captureProps.getQueueCapacity());
            processedAudio = new SlidingWindowQueue<>("processed-audio", processingProps.getQueueCapacity());
            dispatchQueue = new PriorityDispatchQueue("button-dispatch", buttonProps.getDispatchCapacity());

            sessions.add(new AudioCaptureStage(MICROPHONE_ID, 0, microphoneDriver, settings,
                    captureProps.getXrunRestartThreshold(),
                    Duration.ofMillis(sessionProps.getHeartbeatTimeoutMs()),
                    rawAudio, metrics, publisher, System::nanoTime));
            for (ButtonProperties.Device device : buttonProps.allDevices()) {
                sessions.add(new ButtonMonitor(device.getId(), device.getPath(), device.getKeys(),
                        buttonDriverFactory.create(device), settings, buttonProps.getDebounceMs(),
                        Duration.ofMillis(buttonProps.getPollTimeoutMs()), registry, dispatchQueue,
                        metrics, publisher, System::nanoTime));
            }

            List<Runnable> stages = List.of(
                    new AudioProcessingStage(rawAudio, processedAudio, processingProps.getTargetSampleRate(),
                            new SilenceDetector(processingProps.getSilenceThreshold()),
                            new EnergyVoiceActivityDetector(processingProps.getVadAggressiveness(),
                                    processingProps.getVadFrameMs()),
                            noiseGate(), metrics),
                    new AudioForwarder(processedAudio, transport, metrics),
                    new PriorityDispatcher(dispatchQueue, transport, metrics));

            try {
                for (Runnable stage : stages) {
                    tasks.add(executor.submit(stage));
                }
                for (DeviceSession<?> session : sessions) {
                    tasks.add(executor.submit(session));
                }
            } catch (TaskRejectedException e) {
                LOG.error("Thread pool too small for {} sessions and {} stages", sessions.size(), stages.size());
                shutdownAll();
                throw e;
            }
            activeSessions = List.copyOf(sessions);
            running = true;
            LOG.info("Ingest pipeline started: {} device sessions, {} stages", sessions.size(), stages.size());
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            shutdownAll();
            running = false;
            LOG.info("Ingest pipeline stopped");
        }
    }

    private void shutdownAll() {
        activeSessions = List.of();
        sessions.forEach(DeviceSession::cancel);
        if (rawAudio != null) {
            rawAudio.shutdown();
        }
        if (processedAudio != null) {
            processedAudio.shutdown();
        }
        if (dispatchQueue != null) {
            dispatchQueue.shutdown();
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(pipelineProps.getShutdownTimeoutMs());
        for (Future<?> task : tasks) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                task.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                LOG.warn("Pipeline task did not stop within {}ms; interrupting", pipelineProps.getShutdownTimeoutMs());
                task.cancel(true);
            } catch (ExecutionException e) {
                LOG.warn("Pipeline task failed: {}", e.getCause().toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                task.cancel(true);
            }
        }
        tasks.clear();
        sessions.clear();
    }

    private NoiseGate noiseGate() {
        if (!processingProps.isNoiseReductionEnabled()) {
            return null;
        }
        return new NoiseGate(processingProps.getSilenceThreshold(), processingProps.getNoiseGateAttenuation());
    }

    private static int sizeOf(SlidingWindowQueue<?> queue) {
        return queue == null ? 0 : queue.size();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return pipelineProps.isAutoStart();
    }

    /** Sessions of the current run; empty when stopped. */
    public List<DeviceSession<?>> sessions() {
        return activeSessions;
    }

    public DeviceRegistry registry() {
        return registry;
    }
}
