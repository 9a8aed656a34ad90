package com.improvtoolkit.ingest.service.audio.processing;

/**
 * Binary speech / non-speech classifier for one block of mono int16 audio.
 */
public interface VoiceActivityDetector {

    /**
     * @param samples    mono int16 samples of one processed frame
     * @param sampleRate rate of {@code samples} in Hz
     * @return true if the block contains speech
     */
    boolean isSpeech(short[] samples, int sampleRate);
}
