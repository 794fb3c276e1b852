package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.AudioFeatures;
import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.TextAnalysis;
import com.evaluate.mockinterview.support.Fixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreAggregatorTest {

    private final ScoreAggregator aggregator = new ScoreAggregator(Fixtures.CLOCK);
    private final Question question = Fixtures.question("q1", QuestionType.TECHNICAL, Difficulty.INTERMEDIATE);

    private static AudioFeatures features(double fluency) {
        return AudioFeatures.builder()
                .fluency(fluency)
                .pitch(180)
                .duration(12.5)
                .emotionWeight("confident", 2.0)
                .emotionWeight("nervous", 1.0)
                .emotionWeight("bored", 1.0)
                .build();
    }

    @Test
    void combinesBothSources() {
        Answer answer = aggregator.score("I would use a hash map", features(0.8), new TextAnalysis(0.9, 0.4, 0.7), question);

        assertEquals("q1", answer.getQuestionId());
        assertEquals("I would use a hash map", answer.getTranscript());
        assertEquals(0.9, answer.getTechnical());
        assertEquals(0.4, answer.getSentiment());
        assertEquals(0.7, answer.getConfidence());
        assertEquals(0.8, answer.getFluency());
        assertEquals(12.5, answer.getAudioDuration());
        assertEquals(Fixtures.NOW, answer.getTimestamp());
        assertFalse(answer.isDegraded());
        assertEquals(0.75, answer.communication(), 1e-9);
    }

    @Test
    void normalizesEmotionWeights() {
        Answer answer = aggregator.score("text", features(0.8), new TextAnalysis(0.5, 0, 0.5), question);

        double total = answer.getEmotionWeights().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, total, 1e-9);
        assertEquals(0.5, answer.getEmotionWeights().get("confident"), 1e-9);
        assertEquals(0.5, answer.dominantEmotionWeight(), 1e-9);
    }

    @Test
    void missingAudioLeavesFluencyNeutral() {
        Answer answer = aggregator.score("text", null, new TextAnalysis(0.9, 0.4, 0.7), question);

        assertTrue(answer.isDegraded());
        assertEquals(ScoreAggregator.NEUTRAL_SCORE, answer.getFluency());
        assertTrue(answer.getEmotionWeights().isEmpty());
        assertEquals(0.5, answer.dominantEmotionWeight());
        assertEquals(0.9, answer.getTechnical());
    }

    @Test
    void missingTextAnalysisLeavesTextAxesNeutral() {
        Answer answer = aggregator.score("", features(0.8), null, question);

        assertTrue(answer.isDegraded());
        assertEquals(ScoreAggregator.NEUTRAL_SCORE, answer.getTechnical());
        assertEquals(ScoreAggregator.NEUTRAL_SCORE, answer.getConfidence());
        assertEquals(ScoreAggregator.NEUTRAL_SENTIMENT, answer.getSentiment());
        assertEquals(0.8, answer.getFluency());
    }

    @Test
    void clampsOutOfRangeScores() {
        Answer answer = aggregator.score("text", features(1.7), new TextAnalysis(1.4, -3.0, -0.2), question);

        assertEquals(1.0, answer.getTechnical());
        assertEquals(-1.0, answer.getSentiment());
        assertEquals(0.0, answer.getConfidence());
        assertEquals(1.0, answer.getFluency());
    }

    @Test
    void nullTranscriptBecomesEmpty() {
        Answer answer = aggregator.score(null, null, null, question);

        assertEquals("", answer.getTranscript());
        assertTrue(answer.isDegraded());
    }
}
