package com.improvtoolkit.ingest.service.audio.capture;

import com.improvtoolkit.ingest.config.properties.AudioCaptureProperties;
import com.improvtoolkit.ingest.domain.SampleFormat;
import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Opens the configured microphone through Java Sound.
 *
 * <p>Discovery matches {@code mic-name} as a case-insensitive substring of the enumerated input
 * mixer names. The requested rate, format and channel count are checked before opening; if the
 * device refuses the requested rate, the first rate it does support is used instead and the line is
 * marked {@code resampleRequired}. No matching device or no feasible format fails the open with
 * {@link DeviceUnavailableException}.
 */
public class JavaSoundCaptureDriver implements DeviceDriver<CaptureLine> {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureDriver.class);

    /** Rates tried after the ones the device advertises, most common first. */
    private static final int[] COMMON_RATES = {48_000, 44_100, 32_000, 16_000};

    /** Abstraction over the Java Sound mixer registry (for testing). */
    public interface MixerCatalog {

        List<Mixer.Info> inputMixers();

        boolean supports(Mixer.Info mixer, AudioFormat format);

        /** Explicit rates the device advertises for its capture lines, in device order. */
        List<Integer> advertisedRates(Mixer.Info mixer);

        TargetDataLine open(Mixer.Info mixer, AudioFormat format, int bufferBytes) throws LineUnavailableException;
    }

    /** Outcome of format negotiation for one mixer. */
    record Negotiated(AudioFormat format, boolean resampleRequired) {
    }

    private final AudioCaptureProperties props;
    private final MixerCatalog catalog;

    public JavaSoundCaptureDriver(AudioCaptureProperties props) {
        this(props, new SystemMixerCatalog());
    }

    // Package-private for tests
    JavaSoundCaptureDriver(AudioCaptureProperties props, MixerCatalog catalog) {
        this.props = Objects.requireNonNull(props);
        this.catalog = Objects.requireNonNull(catalog);
    }

    @Override
    public CaptureLine open() {
        Mixer.Info mixer = find().orElseThrow(() -> new DeviceUnavailableException(props.getMicName(),
                "no input device matching '" + props.getMicName() + "'"));
        Negotiated negotiated = negotiate(mixer);
        AudioFormat fmt = negotiated.format();
        int blockBytes = props.getBlockSize() * fmt.getFrameSize();
        TargetDataLine line;
        try {
            // four blocks of headroom before the driver starts dropping
            line = catalog.open(mixer, fmt, blockBytes * 4);
            line.start();
        } catch (LineUnavailableException e) {
            throw new DeviceUnavailableException(props.getMicName(), "line unavailable: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new DeviceUnavailableException(props.getMicName(), "microphone access denied", e);
        }
        int rate = Math.round(fmt.getSampleRate());
        if (negotiated.resampleRequired()) {
            LOG.warn("Device '{}' rejected {}Hz; capturing at {}Hz (resample required)",
                    mixer.getName(), props.getSampleRate(), rate);
        }
        LOG.info("Opened microphone '{}' at {}Hz {} x{} (block={} frames)",
                mixer.getName(), rate, props.getSampleFormat(), props.getChannels(), props.getBlockSize());
        return new JavaSoundCaptureLine(line, mixer.getName(), rate, props.getSampleFormat(),
                props.getChannels(), negotiated.resampleRequired(), blockBytes);
    }

    @Override
    public void close(CaptureLine handle) {
        handle.close();
        LOG.debug("Closed microphone '{}'", handle.deviceName());
    }

    Optional<Mixer.Info> find() {
        String wanted = props.getMicName().toLowerCase(Locale.ROOT);
        for (Mixer.Info info : catalog.inputMixers()) {
            if (info.getName().toLowerCase(Locale.ROOT).contains(wanted)) {
                return Optional.of(info);
            }
        }
        LOG.debug("No input mixer matched '{}' among {}", props.getMicName(), catalog.inputMixers().size());
        return Optional.empty();
    }

    Negotiated negotiate(Mixer.Info mixer) {
        AudioFormat requested = toAudioFormat(props.getSampleRate(), props.getSampleFormat(), props.getChannels());
        if (catalog.supports(mixer, requested)) {
            return new Negotiated(requested, false);
        }
        Set<Integer> candidates = new LinkedHashSet<>(catalog.advertisedRates(mixer));
        for (int rate : COMMON_RATES) {
            candidates.add(rate);
        }
        for (int rate : candidates) {
            if (rate == props.getSampleRate()) {
                continue;
            }
            AudioFormat fallback = toAudioFormat(rate, props.getSampleFormat(), props.getChannels());
            if (catalog.supports(mixer, fallback)) {
                return new Negotiated(fallback, true);
            }
        }
        throw new DeviceUnavailableException(props.getMicName(), "no feasible capture format for "
                + props.getSampleFormat() + " x" + props.getChannels() + " on '" + mixer.getName() + "'");
    }

    static AudioFormat toAudioFormat(int rate, SampleFormat format, int channels) {
        int bits = format.bytesPerSample() * 8;
        int frameSize = format.bytesPerSample() * channels;
        AudioFormat.Encoding encoding = switch (format) {
            case INT16, INT32, INT8 -> AudioFormat.Encoding.PCM_SIGNED;
            case FLOAT32 -> AudioFormat.Encoding.PCM_FLOAT;
            case UINT8 -> AudioFormat.Encoding.PCM_UNSIGNED;
        };
        return new AudioFormat(encoding, rate, bits, channels, frameSize, rate, false);
    }

    /** Default catalog backed by {@link AudioSystem}. */
    static final class SystemMixerCatalog implements MixerCatalog {

        private static final DataLine.Info ANY_CAPTURE = new DataLine.Info(TargetDataLine.class, null);

        @Override
        public List<Mixer.Info> inputMixers() {
            List<Mixer.Info> inputs = new ArrayList<>();
            for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                if (AudioSystem.getMixer(info).getTargetLineInfo(ANY_CAPTURE).length > 0) {
                    inputs.add(info);
                }
            }
            return inputs;
        }

        @Override
        public boolean supports(Mixer.Info mixer, AudioFormat format) {
            return AudioSystem.getMixer(mixer).isLineSupported(new DataLine.Info(TargetDataLine.class, format));
        }

        @Override
        public List<Integer> advertisedRates(Mixer.Info mixer) {
            List<Integer> rates = new ArrayList<>();
            for (Line.Info lineInfo : AudioSystem.getMixer(mixer).getTargetLineInfo(ANY_CAPTURE)) {
                if (lineInfo instanceof DataLine.Info dataLineInfo) {
                    for (AudioFormat f : dataLineInfo.getFormats()) {
                        float rate = f.getSampleRate();
                        if (rate != AudioSystem.NOT_SPECIFIED && rate > 0) {
                            rates.add(Math.round(rate));
                        }
                    }
                }
            }
            return rates;
        }

        @Override
        public TargetDataLine open(Mixer.Info mixer, AudioFormat format, int bufferBytes)
                throws LineUnavailableException {
            TargetDataLine line = (TargetDataLine) AudioSystem.getMixer(mixer)
                    .getLine(new DataLine.Info(TargetDataLine.class, format));
            line.open(format, bufferBytes);
            return line;
        }
    }
}
