package com.evaluate.mockinterview.gateway;

import java.util.Optional;

public interface SpeechSynthesizer {

    /** Returns WAV audio, or empty when synthesis is not available. */
    Optional<byte[]> synthesize(String text);
}
