package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class AudioFeatures {
    double fluency;
    /** Mean estimated pitch in Hz. */
    double pitch;
    @Singular
    Map<String, Double> emotionWeights;
    /** Duration of the utterance in seconds. */
    double duration;
}
