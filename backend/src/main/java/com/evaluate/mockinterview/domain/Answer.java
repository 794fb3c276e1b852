package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A scored response to one question. Scores are never revised after the answer is recorded.
 */
@Value
@Builder
public class Answer {
    String questionId;
    String transcript;
    /** Technical accuracy in [0, 1]. */
    double technical;
    /** Fluency in [0, 1]. */
    double fluency;
    /** Confidence in [0, 1]. */
    double confidence;
    /** Sentiment in [-1, 1]. */
    double sentiment;
    /** Emotion label to weight; weights sum to 1 unless the map is empty. */
    @Singular
    Map<String, Double> emotionWeights;
    double audioDuration;
    Instant timestamp;
    /** True when a scoring source was unavailable and neutral defaults were used. */
    boolean degraded;

    public double communication() {
        return (fluency + confidence) / 2.0;
    }

    /** Weight of the dominant emotion, or 0.5 when no emotion data was captured. */
    public double dominantEmotionWeight() {
        return emotionWeights.values().stream()
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.5);
    }
}
