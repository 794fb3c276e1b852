package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.AudioFeatures;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.TextAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combines the text-analysis and audio-feature signals of one response into an {@link Answer}.
 * The two sources are not cross-checked; a missing source leaves its axes neutral.
 */
@Component
@RequiredArgsConstructor
public class ScoreAggregator {

    static final double NEUTRAL_SCORE = 0.5;
    static final double NEUTRAL_SENTIMENT = 0.0;

    private final Clock clock;

    /**
     * @param audioFeatures extractor output, or {@code null} when unavailable
     * @param textAnalysis  analyzer output, or {@code null} when unavailable
     */
    public Answer score(String transcript, AudioFeatures audioFeatures, TextAnalysis textAnalysis, Question question) {
        Answer.AnswerBuilder answer = Answer.builder()
                .questionId(question.getId())
                .transcript(transcript != null ? transcript : "")
                .timestamp(clock.instant())
                .degraded(audioFeatures == null || textAnalysis == null);

        if (textAnalysis != null) {
            answer.technical(clamp(textAnalysis.getTechnical(), 0, 1))
                    .sentiment(clamp(textAnalysis.getSentiment(), -1, 1))
                    .confidence(clamp(textAnalysis.getConfidence(), 0, 1));
        } else {
            answer.technical(NEUTRAL_SCORE)
                    .sentiment(NEUTRAL_SENTIMENT)
                    .confidence(NEUTRAL_SCORE);
        }

        if (audioFeatures != null) {
            answer.fluency(clamp(audioFeatures.getFluency(), 0, 1))
                    .emotionWeights(normalize(audioFeatures.getEmotionWeights()))
                    .audioDuration(Math.max(0, audioFeatures.getDuration()));
        } else {
            answer.fluency(NEUTRAL_SCORE);
        }
        return answer.build();
    }

    private static Map<String, Double> normalize(Map<String, Double> weights) {
        double total = weights.values().stream()
                .filter(w -> w != null && w > 0)
                .mapToDouble(Double::doubleValue)
                .sum();
        Map<String, Double> normalized = new LinkedHashMap<>();
        if (total <= 0) {
            return normalized;
        }
        weights.forEach((label, weight) -> {
            if (weight != null && weight > 0) {
                normalized.put(label, weight / total);
            }
        });
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min < 0 ? 0.0 : NEUTRAL_SCORE;
        }
        return Math.max(min, Math.min(max, value));
    }
}
