package com.improvtoolkit.ingest.domain;

/**
 * PCM sample encodings a capture device may deliver. All multi-byte formats are little-endian.
 */
public enum SampleFormat {
    INT16(2),
    INT32(4),
    FLOAT32(4),
    INT8(1),
    UINT8(1);

    private final int bytesPerSample;

    SampleFormat(int bytesPerSample) {
        this.bytesPerSample = bytesPerSample;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }
}
