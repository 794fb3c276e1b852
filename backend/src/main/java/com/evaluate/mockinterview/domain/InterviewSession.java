package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one interview. Every state change produces a new snapshot with a higher
 * {@link #version}; only the session controller publishes new snapshots.
 *
 * <p>Questions and answers are append-only and aligned by index: {@code answers.get(i)} answers
 * {@code questions.get(i)}. At most one asked question is unanswered at any time.</p>
 */
@Value
@Builder(toBuilder = true)
public class InterviewSession {
    String id;
    String candidateId;
    JobContext job;
    SessionStatus status;
    @Singular("poolEntry")
    List<Question> questionPool;
    @Singular
    List<Question> questions;
    @Singular
    List<Answer> answers;
    int currentIndex;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    BanditState arms;
    PerformanceMetrics metrics;
    StopReason stopReason;
    long version;

    public Optional<Question> pendingQuestion() {
        if (questions.size() > answers.size()) {
            return Optional.of(questions.get(answers.size()));
        }
        return Optional.empty();
    }

    public Set<String> askedIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Question question : questions) {
            ids.add(question.getId());
        }
        return ids;
    }

    public boolean hasAsked(String questionId) {
        return questions.stream().anyMatch(q -> q.getId().equals(questionId));
    }

    /** The last {@code count} answers, oldest first. */
    public List<Answer> recentAnswers(int count) {
        int from = Math.max(0, answers.size() - count);
        return answers.subList(from, answers.size());
    }

    /** The question answered by the answer at {@code index}. */
    public Question questionForAnswer(int index) {
        return questions.get(index);
    }
}
