package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.SessionAnalysis;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.support.Fixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionAnalyzerTest {

    private final SessionAnalyzer analyzer = new SessionAnalyzer();

    private static InterviewSession session(Object... typeDifficultyScore) {
        InterviewSession.InterviewSessionBuilder session = InterviewSession.builder()
                .id("s1")
                .candidateId("c1")
                .job(Fixtures.job(Difficulty.INTERMEDIATE))
                .status(SessionStatus.COMPLETED)
                .createdAt(Fixtures.NOW);
        for (int i = 0; i < typeDifficultyScore.length; i += 3) {
            String id = "q" + i;
            Question question = Fixtures.question(id, (QuestionType) typeDifficultyScore[i],
                    (Difficulty) typeDifficultyScore[i + 1]);
            Answer answer = Answer.builder()
                    .questionId(id)
                    .transcript("answer " + id)
                    .technical((Double) typeDifficultyScore[i + 2])
                    .audioDuration(10.0 + i)
                    .timestamp(Fixtures.NOW)
                    .build();
            session.question(question).answer(answer);
        }
        return session.build();
    }

    @Test
    void improvingScoresAndRisingDifficulty() {
        SessionAnalysis analysis = analyzer.analyze(session(
                QuestionType.TECHNICAL, Difficulty.BEGINNER, 0.3,
                QuestionType.BEHAVIORAL, Difficulty.INTERMEDIATE, 0.5,
                QuestionType.TECHNICAL, Difficulty.ADVANCED, 0.7));

        assertEquals(3, analysis.getTotalQuestions());
        assertEquals(3, analysis.getTotalAnswers());
        assertEquals("Improving", analysis.getPerformanceTrend());
        assertEquals("Increasing", analysis.getDifficultyTrend());
        assertEquals(0.5, analysis.getQuestionTypeBreakdown().get(QuestionType.TECHNICAL), 1e-9);
        assertEquals(0.5, analysis.getQuestionTypeBreakdown().get(QuestionType.BEHAVIORAL), 1e-9);
        assertEquals(13.0, analysis.getAverageResponseTime(), 1e-9);
        assertEquals(3, analysis.getDifficultyProgression().size());
        assertEquals(Difficulty.ADVANCED, analysis.getDifficultyProgression().get(2).getDifficulty());
    }

    @Test
    void decliningScoresAndFallingDifficulty() {
        SessionAnalysis analysis = analyzer.analyze(session(
                QuestionType.TECHNICAL, Difficulty.EXPERT, 0.9,
                QuestionType.TECHNICAL, Difficulty.ADVANCED, 0.6,
                QuestionType.TECHNICAL, Difficulty.BEGINNER, 0.2));

        assertEquals("Declining", analysis.getPerformanceTrend());
        assertEquals("Decreasing", analysis.getDifficultyTrend());
    }

    @Test
    void flatScoresAreStable() {
        SessionAnalysis analysis = analyzer.analyze(session(
                QuestionType.TECHNICAL, Difficulty.INTERMEDIATE, 0.6,
                QuestionType.TECHNICAL, Difficulty.INTERMEDIATE, 0.62,
                QuestionType.TECHNICAL, Difficulty.INTERMEDIATE, 0.61));

        assertEquals("Stable", analysis.getPerformanceTrend());
        assertEquals("Stable", analysis.getDifficultyTrend());
    }

    @Test
    void fewAnswersAreInsufficient() {
        SessionAnalysis analysis = analyzer.analyze(session(
                QuestionType.TECHNICAL, Difficulty.INTERMEDIATE, 0.6,
                QuestionType.TECHNICAL, Difficulty.ADVANCED, 0.9));

        assertEquals(SessionAnalyzer.INSUFFICIENT_DATA, analysis.getPerformanceTrend());
        assertEquals(SessionAnalyzer.INSUFFICIENT_DATA, analysis.getDifficultyTrend());
    }

    @Test
    void emptySession() {
        SessionAnalysis analysis = analyzer.analyze(session());

        assertEquals(0, analysis.getTotalAnswers());
        assertEquals(0.0, analysis.getAverageResponseTime());
        assertTrue(analysis.getQuestionFeedbacks().isEmpty());
    }

    @Test
    void perQuestionFeedbackFollowsScoreBands() {
        SessionAnalysis analysis = analyzer.analyze(session(
                QuestionType.TECHNICAL, Difficulty.INTERMEDIATE, 0.85,
                QuestionType.BEHAVIORAL, Difficulty.INTERMEDIATE, 0.6,
                QuestionType.SITUATIONAL, Difficulty.INTERMEDIATE, 0.59));

        assertTrue(analysis.getQuestionFeedbacks().get(0).getFeedback().startsWith("Excellent"));
        assertTrue(analysis.getQuestionFeedbacks().get(1).getFeedback().startsWith("Good"));
        assertTrue(analysis.getQuestionFeedbacks().get(2).getFeedback().startsWith("Consider"));
        assertEquals("answer q3", analysis.getQuestionFeedbacks().get(1).getResponse());
    }

    @Test
    void slopeOfALine() {
        assertEquals(0.5, SessionAnalyzer.slope(new double[]{1.0, 1.5, 2.0, 2.5}), 1e-9);
        assertEquals(0.0, SessionAnalyzer.slope(new double[]{3.0}), 1e-9);
    }
}
