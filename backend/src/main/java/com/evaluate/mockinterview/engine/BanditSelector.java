package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.config.InterviewProperties;
import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.ArmStats;
import com.evaluate.mockinterview.domain.BanditState;
import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.JobContext;
import com.evaluate.mockinterview.domain.PerformanceLevel;
import com.evaluate.mockinterview.domain.PerformanceSnapshot;
import com.evaluate.mockinterview.domain.QaExchange;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionSource;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.gateway.QuestionGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * Thompson-Sampling question selector. Runs two independent bandits, one over question types and
 * one over difficulties, and combines their samples with a job-relevance score.
 *
 * <p>The selector holds no per-session state: arm tables live on the session and every call
 * receives the snapshot it works on.</p>
 */
@Component
@Slf4j
public class BanditSelector {

    private static final double BASE_RELEVANCE = 0.5;
    private static final double SKILL_MATCH_BONUS = 0.3;
    private static final double DIFFICULTY_MATCH_BONUS = 0.2;

    private final QuestionGenerator questionGenerator;
    private final InterviewProperties.Bandit settings;
    private final Supplier<RandomGenerator> randomSource;

    @Autowired
    public BanditSelector(QuestionGenerator questionGenerator, InterviewProperties properties) {
        this(questionGenerator, properties, ThreadLocalRandom::current);
    }

    BanditSelector(QuestionGenerator questionGenerator,
                   InterviewProperties properties,
                   Supplier<RandomGenerator> randomSource) {
        this.questionGenerator = questionGenerator;
        this.settings = properties.getBandit();
        this.randomSource = randomSource;
    }

    /**
     * Prior arm table for a job: technical questions start favoured for skill-heavy postings and
     * the difficulty matching the posting's experience level starts favoured.
     */
    public BanditState seed(JobContext job) {
        Map<QuestionType, ArmStats> types = new EnumMap<>(QuestionType.class);
        for (QuestionType type : QuestionType.values()) {
            boolean favoured = type == QuestionType.TECHNICAL && job.isSkillHeavy();
            types.put(type, favoured ? ArmStats.of(3, 1) : ArmStats.of(2, 2));
        }
        Map<Difficulty, ArmStats> difficulties = new EnumMap<>(Difficulty.class);
        for (Difficulty difficulty : Difficulty.values()) {
            boolean favoured = difficulty == job.getExperienceLevel();
            difficulties.put(difficulty, favoured ? ArmStats.of(3, 1) : ArmStats.of(2, 2));
        }
        return BanditState.of(types, difficulties);
    }

    /**
     * Picks the next question for the session. Never returns a question that was already asked and
     * never throws because of the generator: a failed generation yields a {@link QuestionSource#FALLBACK}
     * template.
     */
    public Question next(InterviewSession session) {
        BanditState arms = session.getArms() != null ? session.getArms() : seed(session.getJob());
        RandomGenerator random = randomSource.get();

        Map<QuestionType, Double> typeSamples = new EnumMap<>(QuestionType.class);
        for (QuestionType type : QuestionType.values()) {
            typeSamples.put(type, BetaSampler.sample(random, arms.typeArm(type)));
        }
        Map<Difficulty, Double> difficultySamples = new EnumMap<>(Difficulty.class);
        for (Difficulty difficulty : Difficulty.values()) {
            difficultySamples.put(difficulty, BetaSampler.sample(random, arms.difficultyArm(difficulty)));
        }

        PerformanceLevel level = performanceLevel(session.getAnswers());
        Difficulty target = targetDifficulty(session.getJob(), level);
        Set<String> asked = session.askedIds();

        Question best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Question candidate : session.getQuestionPool()) {
            if (asked.contains(candidate.getId())) {
                continue;
            }
            double typeScore = typeSamples.get(candidate.getType());
            double difficultyScore = paced(difficultySamples.get(candidate.getDifficulty()),
                    candidate.getDifficulty(), level);
            double score = (typeScore + difficultyScore + relevance(candidate, session.getJob(), target)) / 3.0;
            // strict comparison keeps the earlier pool entry on ties
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        if (best != null) {
            log.debug("Session {} selected pool question {} ({} / {}) score={} level={}",
                    session.getId(), best.getId(), best.getType(), best.getDifficulty(),
                    String.format("%.3f", bestScore), level);
            return best;
        }
        return generate(session, level, target, asked);
    }

    /**
     * Credits the answered question's type arm and difficulty arm with a success when the technical
     * score reaches the success threshold, otherwise with a failure.
     */
    public BanditState update(BanditState arms, Answer answer, Question question) {
        boolean success = answer.getTechnical() >= settings.getSuccessThreshold();
        return arms.withOutcome(question.getType(), question.getDifficulty(), success);
    }

    PerformanceLevel performanceLevel(List<Answer> answers) {
        if (answers.isEmpty()) {
            return PerformanceLevel.MEDIUM;
        }
        int from = Math.max(0, answers.size() - settings.getPerformanceWindow());
        double mean = answers.subList(from, answers.size()).stream()
                .mapToDouble(Answer::getTechnical)
                .average()
                .orElse(0.0);
        if (mean >= settings.getHighPerformance()) {
            return PerformanceLevel.HIGH;
        }
        if (mean < settings.getLowPerformance()) {
            return PerformanceLevel.LOW;
        }
        return PerformanceLevel.MEDIUM;
    }

    Difficulty targetDifficulty(JobContext job, PerformanceLevel level) {
        Difficulty base = job.getExperienceLevel();
        return switch (level) {
            case HIGH -> base.harder();
            case LOW -> base.easier();
            case MEDIUM -> base;
        };
    }

    double relevance(Question question, JobContext job, Difficulty target) {
        double relevance = BASE_RELEVANCE;
        if (question.getType() == QuestionType.TECHNICAL && job.isSkillHeavy()) {
            relevance += SKILL_MATCH_BONUS;
        }
        if (question.getDifficulty() == target) {
            relevance += DIFFICULTY_MATCH_BONUS;
        }
        return Math.min(relevance, 1.0);
    }

    private double paced(double sample, Difficulty difficulty, PerformanceLevel level) {
        if (level == PerformanceLevel.HIGH && difficulty.isEasy()) {
            return sample * settings.getOffPacePenalty();
        }
        if (level == PerformanceLevel.LOW && difficulty.isHard()) {
            return sample * settings.getOffPacePenalty();
        }
        return sample;
    }

    private Question generate(InterviewSession session, PerformanceLevel level, Difficulty target, Set<String> asked) {
        int ordinal = session.getQuestions().size();
        try {
            Question generated = questionGenerator.generateContextualQuestion(
                    session.getJob().getDescription(),
                    recentHistory(session),
                    List.copyOf(asked),
                    snapshot(session, level, target));
            if (generated == null || generated.getText() == null || generated.getText().isBlank()) {
                throw new IllegalStateException("generator returned no question");
            }
            String id = uniqueId(generated.getId() == null || generated.getId().isBlank()
                    ? "generated-" + ordinal : generated.getId(), asked);
            log.info("Session {} pool exhausted, generated question {} ({})", session.getId(), id, generated.getDifficulty());
            return generated.toBuilder().id(id).source(QuestionSource.GENERATED).build();
        } catch (RuntimeException e) {
            log.warn("Question generation failed for session {}, using {} fallback: {}",
                    session.getId(), target.label(), e.getMessage());
            Question fallback = QuestionTemplates.fallback(target, ordinal);
            return fallback.toBuilder().id(uniqueId(fallback.getId(), asked)).build();
        }
    }

    private List<QaExchange> recentHistory(InterviewSession session) {
        List<Answer> answers = session.getAnswers();
        int from = Math.max(0, answers.size() - settings.getHistorySize());
        List<QaExchange> history = new ArrayList<>();
        for (int i = from; i < answers.size(); i++) {
            history.add(new QaExchange(session.questionForAnswer(i).getText(), answers.get(i).getTranscript()));
        }
        return history;
    }

    private PerformanceSnapshot snapshot(InterviewSession session, PerformanceLevel level, Difficulty target) {
        List<Answer> answers = session.getAnswers();
        double technical = answers.stream().mapToDouble(Answer::getTechnical).average().orElse(0.5);
        double communication = answers.stream().mapToDouble(Answer::communication).average().orElse(0.5);
        double confidence = answers.stream().mapToDouble(Answer::getConfidence).average().orElse(0.5);
        return new PerformanceSnapshot(technical, communication, confidence, level, target);
    }

    private static String uniqueId(String base, Set<String> asked) {
        String id = base;
        int suffix = 2;
        while (asked.contains(id)) {
            id = base + "-" + suffix++;
        }
        return id;
    }
}
