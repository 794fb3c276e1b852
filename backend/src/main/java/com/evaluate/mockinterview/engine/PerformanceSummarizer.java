package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.PerformanceMetrics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Session-level metrics derived from all answers. A pure function of the session's answers and
 * job skills.
 */
@Component
public class PerformanceSummarizer {

    static final double STRENGTH_THRESHOLD = 0.8;
    static final double WEAKNESS_THRESHOLD = 0.6;
    static final double RECOMMENDATION_THRESHOLD = 0.7;

    static final String NO_STRENGTHS = "Areas for improvement identified";
    static final String NO_WEAKNESSES = "No significant weaknesses identified";
    static final String NOT_ENOUGH_ANSWERS = "Not enough answers to assess performance";
    static final String KEEP_PRACTICING = "Continue practicing mock interviews";
    static final String RESEARCH_COMPANY = "Research the company and role thoroughly";

    public PerformanceMetrics summarize(InterviewSession session) {
        List<Answer> answers = session.getAnswers();
        if (answers.isEmpty()) {
            return PerformanceMetrics.builder()
                    .strength(NO_STRENGTHS)
                    .weakness(NOT_ENOUGH_ANSWERS)
                    .recommendation(KEEP_PRACTICING)
                    .recommendation(RESEARCH_COMPANY)
                    .build();
        }

        double technical = mean(answers, Answer::getTechnical);
        double communication = mean(answers, Answer::communication);
        double emotional = mean(answers, Answer::dominantEmotionWeight);
        double behavioral = mean(answers, Answer::getSentiment);

        return PerformanceMetrics.builder()
                .technical(technical)
                .communication(communication)
                .emotionalIntelligence(emotional)
                .behavioral(behavioral)
                .overall((technical + communication) / 2.0)
                .strengths(strengths(technical, communication, emotional, behavioral))
                .weaknesses(weaknesses(technical, communication, emotional, behavioral))
                .recommendations(recommendations(technical, communication, emotional, behavioral,
                        session.getJob().getKeySkills()))
                .build();
    }

    private static List<String> strengths(double technical, double communication, double emotional, double behavioral) {
        List<String> strengths = new ArrayList<>();
        if (technical >= STRENGTH_THRESHOLD) {
            strengths.add("Strong technical knowledge");
        }
        if (communication >= STRENGTH_THRESHOLD) {
            strengths.add("Excellent communication skills");
        }
        if (emotional >= STRENGTH_THRESHOLD) {
            strengths.add("High emotional intelligence");
        }
        if (behavioral >= STRENGTH_THRESHOLD) {
            strengths.add("Good behavioral responses");
        }
        return strengths.isEmpty() ? List.of(NO_STRENGTHS) : strengths;
    }

    private static List<String> weaknesses(double technical, double communication, double emotional, double behavioral) {
        List<String> weaknesses = new ArrayList<>();
        if (technical < WEAKNESS_THRESHOLD) {
            weaknesses.add("Technical knowledge needs improvement");
        }
        if (communication < WEAKNESS_THRESHOLD) {
            weaknesses.add("Communication skills need development");
        }
        if (emotional < WEAKNESS_THRESHOLD) {
            weaknesses.add("Emotional intelligence could be enhanced");
        }
        if (behavioral < WEAKNESS_THRESHOLD) {
            weaknesses.add("Behavioral responses need refinement");
        }
        return weaknesses.isEmpty() ? List.of(NO_WEAKNESSES) : weaknesses;
    }

    private static List<String> recommendations(double technical, double communication, double emotional,
                                                double behavioral, List<String> keySkills) {
        List<String> recommendations = new ArrayList<>();
        if (technical < RECOMMENDATION_THRESHOLD) {
            recommendations.add(keySkills.isEmpty()
                    ? "Review the core technical concepts for the role"
                    : "Focus on improving " + String.join(", ", keySkills.subList(0, Math.min(2, keySkills.size())))
                    + " skills");
        }
        if (communication < RECOMMENDATION_THRESHOLD) {
            recommendations.add("Practice clear and structured communication");
        }
        if (emotional < RECOMMENDATION_THRESHOLD) {
            recommendations.add("Work on confidence and stress management");
        }
        if (behavioral < RECOMMENDATION_THRESHOLD) {
            recommendations.add("Structure behavioral answers around situation, action and result");
        }
        recommendations.add(KEEP_PRACTICING);
        recommendations.add(RESEARCH_COMPANY);
        return recommendations;
    }

    private static double mean(List<Answer> answers, ToDoubleFunction<Answer> axis) {
        return answers.stream().mapToDouble(axis).average().orElse(0.0);
    }
}
