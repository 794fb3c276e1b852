package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.config.InterviewProperties;
import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.StopReason;
import com.evaluate.mockinterview.domain.TerminationDecision;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Early-termination rules, evaluated in order; the first rule that fires decides the stop reason.
 * <ol>
 *   <li>answer count reached the maximum</li>
 *   <li>the last technical scores plateaued (low population standard deviation)</li>
 *   <li>the last technical scores are consistently poor (low mean)</li>
 * </ol>
 * The plateau rule is checked before the poor-performance rule.
 */
@Component
public class TerminationPolicy {

    private final InterviewProperties.Termination settings;

    public TerminationPolicy(InterviewProperties properties) {
        this.settings = properties.getTermination();
    }

    public boolean shouldStop(InterviewSession session) {
        return evaluate(session).isStop();
    }

    public TerminationDecision evaluate(InterviewSession session) {
        List<Answer> answers = session.getAnswers();
        int count = answers.size();

        if (count >= settings.getMaxQuestions()) {
            return TerminationDecision.stop(StopReason.MAX_QUESTIONS);
        }
        if (count >= settings.getPlateauWindow()
                && populationStdDev(session.recentAnswers(settings.getPlateauWindow())) < settings.getPlateauStdDev()) {
            return TerminationDecision.stop(StopReason.PLATEAU);
        }
        if (count >= settings.getPoorWindow()
                && mean(session.recentAnswers(settings.getPoorWindow())) < settings.getPoorMean()) {
            return TerminationDecision.stop(StopReason.POOR_PERFORMANCE);
        }
        return TerminationDecision.CONTINUE;
    }

    static double mean(List<Answer> answers) {
        return answers.stream().mapToDouble(Answer::getTechnical).average().orElse(0.0);
    }

    static double populationStdDev(List<Answer> answers) {
        double mean = mean(answers);
        double variance = answers.stream()
                .mapToDouble(a -> (a.getTechnical() - mean) * (a.getTechnical() - mean))
                .average()
                .orElse(0.0);
        return Math.sqrt(variance);
    }
}
