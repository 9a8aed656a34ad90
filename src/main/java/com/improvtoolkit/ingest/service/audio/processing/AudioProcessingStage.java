package com.improvtoolkit.ingest.service.audio.processing;

import com.improvtoolkit.ingest.domain.AudioFrame;
import com.improvtoolkit.ingest.domain.SampleFormat;
import com.improvtoolkit.ingest.domain.TaggedAudioFrame;
import com.improvtoolkit.ingest.domain.VadState;
import com.improvtoolkit.ingest.exception.InvalidAudioException;
import com.improvtoolkit.ingest.exception.QueueShutdownException;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.SlidingWindowQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single-consumer stage turning raw captured frames into tagged mono int16 frames at the target rate.
 *
 * <p>Order per frame: rate conversion, RMS/silence, voice activity, then the optional noise gate.
 * Detection always sees the signal before the gate; the gate only changes the shipped payload.
 * Sequence numbers start at 0 and increase by one per emitted frame for the life of the stage.
 */
public class AudioProcessingStage implements Runnable {

    private static final Logger LOG = LogManager.getLogger(AudioProcessingStage.class);

    private final SlidingWindowQueue<AudioFrame> input;
    private final SlidingWindowQueue<TaggedAudioFrame> output;
    private final int targetRate;
    private final SilenceDetector silenceDetector;
    private final VoiceActivityDetector vad;
    private final NoiseGate noiseGate;
    private final PipelineMetrics metrics;
    private final Map<Integer, PolyphaseResampler> resamplers = new HashMap<>();

    private VadState vadState = VadState.NA;
    private long nextSequence;

    /**
     * @param noiseGate gate applied to the payload, or {@code null} when noise reduction is disabled
     */
    public AudioProcessingStage(SlidingWindowQueue<AudioFrame> input,
                                SlidingWindowQueue<TaggedAudioFrame> output,
                                int targetRate,
                                SilenceDetector silenceDetector,
                                VoiceActivityDetector vad,
                                NoiseGate noiseGate,
                                PipelineMetrics metrics) {
        if (targetRate <= 0) {
            throw new IllegalArgumentException("targetRate must be positive: " + targetRate);
        }
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
        this.targetRate = targetRate;
        this.silenceDetector = Objects.requireNonNull(silenceDetector, "silenceDetector");
        this.vad = Objects.requireNonNull(vad, "vad");
        this.noiseGate = noiseGate;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void run() {
        ThreadContext.put("stage", "audio-processing");
        LOG.info("Audio processing started: targetRate={}Hz, silenceThreshold={}, noiseReduction={}",
                targetRate, silenceDetector.threshold(), noiseGate != null);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                AudioFrame frame = input.get();
                TaggedAudioFrame tagged;
                try {
                    tagged = process(frame);
                } catch (InvalidAudioException e) {
                    LOG.warn("Dropping malformed frame {}: {}", frame, e.getReason());
                    continue;
                }
                if (output.put(tagged)) {
                    metrics.incrementEviction(output.name());
                }
            }
        } catch (QueueShutdownException e) {
            LOG.debug("Queue shut down; leaving processing loop");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            LOG.info("Audio processing stopped after {} frames", nextSequence);
            ThreadContext.remove("stage");
        }
    }

    /**
     * Processes one frame. Not thread-safe: VAD carry state and the sequence counter belong to the
     * single consuming thread.
     */
    public TaggedAudioFrame process(AudioFrame frame) {
        short[] samples = PcmCodec.toMonoInt16(frame.pcm(), frame.format(), frame.channels());
        if (frame.sampleRate() != targetRate) {
            samples = resamplerFor(frame.sampleRate()).resample(samples);
        }

        double rms = SilenceDetector.rms(samples);
        boolean silence = silenceDetector.isSilent(rms);
        boolean voice = vad.isSpeech(samples, targetRate);
        vadState = vadState.next(voice);

        boolean denoised = false;
        if (noiseGate != null) {
            samples = noiseGate.apply(samples, targetRate);
            denoised = true;
        }

        AudioFrame out = frame.withPayload(PcmCodec.toBytes(samples), targetRate, SampleFormat.INT16, 1);
        TaggedAudioFrame tagged = new TaggedAudioFrame(out, denoised, silence, voice, vadState,
                SilenceDetector.toDbfs(rms), nextSequence++);
        metrics.incrementFramesProcessed(voice);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Frame {} rms={}dBFS silence={} vad={}", tagged.sequenceNum(),
                    String.format("%.1f", tagged.rmsDbfs()), silence, vadState);
        }
        return tagged;
    }

    private PolyphaseResampler resamplerFor(int sourceRate) {
        return resamplers.computeIfAbsent(sourceRate, rate -> {
            PolyphaseResampler r = new PolyphaseResampler(rate, targetRate);
            LOG.info("Resampling {}Hz -> {}Hz (up={}, down={})", rate, targetRate, r.up(), r.down());
            return r;
        });
    }

    public VadState vadState() {
        return vadState;
    }

    public long emittedFrames() {
        return nextSequence;
    }
}
