package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Detailed breakdown of a session, computed from its questions and answers.
 */
@Value
@Builder
public class SessionAnalysis {
    int totalQuestions;
    int totalAnswers;
    double averageResponseTime;
    String performanceTrend;
    @Singular("typeScore")
    Map<QuestionType, Double> questionTypeBreakdown;
    @Singular("difficultyPoint")
    List<DifficultyPoint> difficultyProgression;
    String difficultyTrend;
    @Singular
    List<QuestionFeedback> questionFeedbacks;

    @Value
    public static class DifficultyPoint {
        int questionIndex;
        Difficulty difficulty;
        double score;
    }

    @Value
    public static class QuestionFeedback {
        String questionId;
        String question;
        QuestionType type;
        Difficulty difficulty;
        QuestionSource source;
        String response;
        double score;
        String feedback;
    }
}
