package com.evaluate.mockinterview.gateway;

/**
 * Speech-to-text for one recorded utterance.
 */
public interface Transcriber {

    /**
     * @return the recognized text, empty when no speech was detected
     * @throws com.evaluate.mockinterview.exception.ExternalServiceUnavailableException if recognition fails
     */
    String transcribe(byte[] audio);
}
