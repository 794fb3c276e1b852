package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.SessionAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-question and trend analysis of a session, the data behind an interview report.
 */
@Component
public class SessionAnalyzer {

    static final String INSUFFICIENT_DATA = "Insufficient data";
    private static final int MIN_POINTS_FOR_TREND = 3;

    public SessionAnalysis analyze(InterviewSession session) {
        List<Answer> answers = session.getAnswers();
        SessionAnalysis.SessionAnalysisBuilder analysis = SessionAnalysis.builder()
                .totalQuestions(session.getQuestions().size())
                .totalAnswers(answers.size())
                .averageResponseTime(answers.stream().mapToDouble(Answer::getAudioDuration).average().orElse(0.0));

        double[] scores = new double[answers.size()];
        double[] difficulties = new double[answers.size()];
        Map<QuestionType, List<Double>> byType = new EnumMap<>(QuestionType.class);

        for (int i = 0; i < answers.size(); i++) {
            Answer answer = answers.get(i);
            Question question = session.questionForAnswer(i);
            scores[i] = answer.getTechnical();
            difficulties[i] = question.getDifficulty().ordinal() + 1;
            byType.computeIfAbsent(question.getType(), t -> new ArrayList<>()).add(answer.getTechnical());

            analysis.difficultyPoint(new SessionAnalysis.DifficultyPoint(i, question.getDifficulty(), answer.getTechnical()));
            analysis.questionFeedback(new SessionAnalysis.QuestionFeedback(
                    question.getId(), question.getText(), question.getType(), question.getDifficulty(),
                    question.getSource(), answer.getTranscript(), answer.getTechnical(), feedback(answer)));
        }

        byType.forEach((type, values) ->
                analysis.typeScore(type, values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)));

        return analysis
                .performanceTrend(classify(scores, 0.05, "Improving", "Declining"))
                .difficultyTrend(classify(difficulties, 0.1, "Increasing", "Decreasing"))
                .build();
    }

    static String feedback(Answer answer) {
        if (answer.getTechnical() >= 0.8) {
            return "Excellent response! You demonstrated strong understanding.";
        }
        if (answer.getTechnical() >= 0.6) {
            return "Good response with room for improvement.";
        }
        return "Consider reviewing this topic and practicing similar questions.";
    }

    private static String classify(double[] values, double threshold, String rising, String falling) {
        if (values.length < MIN_POINTS_FOR_TREND) {
            return INSUFFICIENT_DATA;
        }
        double slope = slope(values);
        if (slope > threshold) {
            return rising;
        }
        if (slope < -threshold) {
            return falling;
        }
        return "Stable";
    }

    /** Least-squares slope of {@code values} against their index. */
    static double slope(double[] values) {
        int n = values.length;
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (double v : values) {
            meanY += v;
        }
        meanY /= n;
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - meanX) * (values[i] - meanY);
            denominator += (i - meanX) * (i - meanX);
        }
        return denominator == 0 ? 0 : numerator / denominator;
    }
}
