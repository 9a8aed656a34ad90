package com.improvtoolkit.ingest.service.audio.processing;

import com.improvtoolkit.ingest.domain.SampleFormat;
import com.improvtoolkit.ingest.exception.InvalidAudioException;

/**
 * Conversions between little-endian PCM byte payloads and 16-bit sample arrays.
 *
 * <p>All processing works on mono int16; multi-channel input is averaged down.
 */
public final class PcmCodec {

    /** Full-scale divisor for int16 normalization. */
    public static final double INT16_FULL_SCALE = 32768.0;

    private PcmCodec() {
        // Utility class
    }

    /**
     * Decodes {@code pcm} in the given format and downmixes to mono int16.
     *
     * @throws InvalidAudioException if the byte count is not a whole number of sample frames
     */
    public static short[] toMonoInt16(byte[] pcm, SampleFormat format, int channels) {
        int frameBytes = format.bytesPerSample() * channels;
        if (pcm.length % frameBytes != 0) {
            throw new InvalidAudioException(pcm.length,
                    "not a multiple of " + frameBytes + " bytes per frame (" + format + " x" + channels + ")");
        }
        int frames = pcm.length / frameBytes;
        short[] out = new short[frames];
        for (int f = 0; f < frames; f++) {
            int base = f * frameBytes;
            long sum = 0;
            for (int c = 0; c < channels; c++) {
                sum += readAsInt16(pcm, base + c * format.bytesPerSample(), format);
            }
            out[f] = (short) (sum / channels);
        }
        return out;
    }

    public static byte[] toBytes(short[] samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) samples[i];
            out[2 * i + 1] = (byte) (samples[i] >> 8);
        }
        return out;
    }

    /** Rounds and clips to the int16 range. */
    public static short clip(double value) {
        long rounded = Math.round(value);
        if (rounded > Short.MAX_VALUE) {
            return Short.MAX_VALUE;
        }
        if (rounded < Short.MIN_VALUE) {
            return Short.MIN_VALUE;
        }
        return (short) rounded;
    }

    private static int readAsInt16(byte[] b, int i, SampleFormat format) {
        return switch (format) {
            case INT16 -> (short) ((b[i] & 0xFF) | (b[i + 1] << 8));
            case INT32 -> ((b[i] & 0xFF) | (b[i + 1] & 0xFF) << 8 | (b[i + 2] & 0xFF) << 16 | b[i + 3] << 24) >> 16;
            case FLOAT32 -> {
                int bits = (b[i] & 0xFF) | (b[i + 1] & 0xFF) << 8 | (b[i + 2] & 0xFF) << 16 | b[i + 3] << 24;
                yield clip(Float.intBitsToFloat(bits) * INT16_FULL_SCALE);
            }
            case INT8 -> b[i] << 8;
            case UINT8 -> ((b[i] & 0xFF) - 128) << 8;
        };
    }
}
