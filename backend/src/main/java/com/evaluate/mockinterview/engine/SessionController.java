package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.config.InterviewProperties;
import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.JobContext;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionSource;
import com.evaluate.mockinterview.domain.SessionEvent;
import com.evaluate.mockinterview.domain.SessionProgress;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.domain.StopReason;
import com.evaluate.mockinterview.exception.InvalidStateTransitionException;
import com.evaluate.mockinterview.exception.SessionNotFoundException;
import com.evaluate.mockinterview.exception.ValidationException;
import com.evaluate.mockinterview.gateway.JobAnalyzer;
import com.evaluate.mockinterview.gateway.QuestionGenerator;
import com.evaluate.mockinterview.gateway.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the lifecycle of every live session. Each session has exactly one writer at a time: a
 * per-session lock guards the in-memory transition, while selection, scoring and store writes run
 * outside it.
 *
 * <p>Terminal sessions are evicted from memory once persisted and served from the store afterwards.</p>
 */
@Component
@Slf4j
public class SessionController {

    private final SessionStore store;
    private final JobAnalyzer jobAnalyzer;
    private final QuestionGenerator questionGenerator;
    private final BanditSelector selector;
    private final PerformanceSummarizer summarizer;
    private final InterviewProperties properties;
    private final Clock clock;

    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    public SessionController(SessionStore store,
                             JobAnalyzer jobAnalyzer,
                             QuestionGenerator questionGenerator,
                             BanditSelector selector,
                             PerformanceSummarizer summarizer,
                             InterviewProperties properties,
                             Clock clock) {
        this.store = store;
        this.jobAnalyzer = jobAnalyzer;
        this.questionGenerator = questionGenerator;
        this.selector = selector;
        this.summarizer = summarizer;
        this.properties = properties;
        this.clock = clock;

        InterviewProperties.Scoring scoring = properties.getScoring();
        if (scoring.getDrainTimeout() != null && scoring.getDrainTimeout().compareTo(scoring.scoringBound()) < 0) {
            log.warn("interview.scoring.drain-timeout {} is shorter than a scoring run can take, using {}",
                    scoring.getDrainTimeout(), scoring.scoringBound());
        }
    }

    public InterviewSession create(String jobTitle, String jobDescription, String candidateId) {
        requireText(jobTitle, "job_title");
        requireText(jobDescription, "job_description");
        requireText(candidateId, "candidate_id");

        JobContext job = analyzeJob(jobTitle.trim(), jobDescription.trim());
        List<Question> pool = seedPool(jobTitle.trim(), jobDescription.trim());

        InterviewSession session = InterviewSession.builder()
                .id(UUID.randomUUID().toString())
                .candidateId(candidateId.trim())
                .job(job)
                .status(SessionStatus.CREATED)
                .questionPool(pool)
                .currentIndex(0)
                .createdAt(clock.instant())
                .stopReason(StopReason.NONE)
                .version(1)
                .build();

        SessionHandle handle = new SessionHandle(session);
        sessions.put(session.getId(), handle);
        persist(handle, session);
        log.info("Created session {} for candidate {} ({} pool questions, level {})",
                session.getId(), session.getCandidateId(), pool.size(), job.getExperienceLevel().label());
        return session;
    }

    public InterviewSession start(String sessionId) {
        return transition(sessionId, SessionEvent.START, current -> current.toBuilder()
                .arms(selector.seed(current.getJob()))
                .startedAt(clock.instant()));
    }

    /** Waits for in-flight scoring, then pauses. Questions and answers are left untouched. */
    public InterviewSession pause(String sessionId) {
        drain(sessionId, handle(sessionId));
        return transition(sessionId, SessionEvent.PAUSE, InterviewSession::toBuilder);
    }

    public InterviewSession resume(String sessionId) {
        return transition(sessionId, SessionEvent.RESUME, InterviewSession::toBuilder);
    }

    public InterviewSession complete(String sessionId) {
        return complete(sessionId, StopReason.MANUAL);
    }

    /**
     * Completes the session and freezes its metrics. Does not wait for in-flight scoring, so it is
     * safe to call from inside a tracked scoring task.
     */
    public InterviewSession complete(String sessionId, StopReason reason) {
        InterviewSession completed = transition(sessionId, SessionEvent.COMPLETE, current -> current.toBuilder()
                .metrics(summarizer.summarize(current))
                .stopReason(reason)
                .completedAt(clock.instant()));
        log.info("Session {} completed after {} answers: {}", sessionId, completed.getAnswers().size(),
                reason.description());
        return completed;
    }

    /** Waits for in-flight scoring to finish or time out, then cancels. Metrics stay unset. */
    public InterviewSession cancel(String sessionId) {
        drain(sessionId, handle(sessionId));
        InterviewSession cancelled = transition(sessionId, SessionEvent.CANCEL, current -> current.toBuilder()
                .stopReason(StopReason.MANUAL)
                .completedAt(clock.instant()));
        log.info("Session {} cancelled", sessionId);
        return cancelled;
    }

    /**
     * Returns the question the candidate should answer next. If the last asked question is still
     * unanswered it is returned again; otherwise a new one is selected and appended.
     */
    public Question nextQuestion(String sessionId) {
        SessionHandle handle = handle(sessionId);
        while (true) {
            InterviewSession observed = handle.snapshot;
            requireAllowed(observed, SessionEvent.ASK_QUESTION);
            Optional<Question> pending = observed.pendingQuestion();
            if (pending.isPresent()) {
                return pending.get();
            }

            Question selected = selector.next(observed);

            InterviewSession updated = null;
            Question result;
            handle.lock.lock();
            try {
                InterviewSession current = handle.snapshot;
                requireAllowed(current, SessionEvent.ASK_QUESTION);
                Optional<Question> raced = current.pendingQuestion();
                if (raced.isPresent()) {
                    result = raced.get();
                } else if (current.hasAsked(selected.getId())) {
                    // another caller asked this question and it was answered meanwhile
                    continue;
                } else {
                    updated = current.toBuilder()
                            .question(selected)
                            .version(current.getVersion() + 1)
                            .build();
                    handle.snapshot = updated;
                    result = selected;
                }
            } finally {
                handle.lock.unlock();
            }

            if (updated != null) {
                persist(handle, updated);
                log.info("Session {} asked question {} #{} ({} / {}, {})", sessionId, result.getId(),
                        updated.getQuestions().size(), result.getType().label(), result.getDifficulty().label(),
                        result.getSource());
            }
            return result;
        }
    }

    /**
     * Records the answer to the pending question and credits the bandit arms for it.
     *
     * @throws ValidationException if {@code question} is not the pending question or the answer
     *                             belongs to a different question
     */
    public InterviewSession recordAnswer(String sessionId, Question question, Answer answer) {
        if (question == null || answer == null) {
            throw new ValidationException("question and answer are required");
        }
        InterviewSession updated = transition(sessionId, SessionEvent.RECORD_ANSWER, current -> {
            Question pending = current.pendingQuestion()
                    .orElseThrow(() -> new ValidationException("Session " + sessionId + " has no unanswered question"));
            if (!pending.getId().equals(question.getId())) {
                throw new ValidationException("Question " + question.getId() + " is not the pending question of session "
                        + sessionId);
            }
            if (!question.getId().equals(answer.getQuestionId())) {
                throw new ValidationException("Answer belongs to question " + answer.getQuestionId()
                        + ", expected " + question.getId());
            }
            return current.toBuilder()
                    .answer(answer)
                    .currentIndex(current.getAnswers().size() + 1)
                    .arms(selector.update(current.getArms(), answer, pending));
        });
        log.debug("Session {} recorded answer to {} technical={} degraded={}", sessionId, question.getId(),
                answer.getTechnical(), answer.isDegraded());
        return updated;
    }

    /** The pending question of an in-progress session, checked against the id a client answers. */
    public Question requirePending(String sessionId, String questionId) {
        InterviewSession session = handle(sessionId).snapshot;
        requireAllowed(session, SessionEvent.RECORD_ANSWER);
        Question pending = session.pendingQuestion()
                .orElseThrow(() -> new ValidationException("Session " + sessionId + " has no unanswered question"));
        if (!pending.getId().equals(questionId)) {
            throw new ValidationException("Question " + questionId + " is not the pending question of session "
                    + sessionId);
        }
        return pending;
    }

    /**
     * Registers scoring work for a session so that {@link #pause} and {@link #cancel} wait for it.
     */
    public <T> CompletableFuture<T> track(String sessionId, CompletableFuture<T> work) {
        SessionHandle handle = handle(sessionId);
        handle.inFlight.add(work);
        work.whenComplete((result, error) -> handle.inFlight.remove(work));
        return work;
    }

    public InterviewSession get(String sessionId) {
        return handle(sessionId).snapshot;
    }

    public SessionProgress progress(String sessionId) {
        InterviewSession session = get(sessionId);
        return SessionProgress.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .questionsAsked(session.getQuestions().size())
                .answersRecorded(session.getAnswers().size())
                .currentIndex(session.getCurrentIndex())
                .maxQuestions(properties.getTermination().getMaxQuestions())
                .averageTechnical(session.getAnswers().stream()
                        .mapToDouble(Answer::getTechnical).average().orElse(0.0))
                .awaitingAnswer(session.pendingQuestion().isPresent())
                .stopReason(session.getStopReason())
                .build();
    }

    /** Sessions of a candidate, newest first, with live snapshots taking precedence over stored ones. */
    public List<InterviewSession> findByCandidate(String candidateId) {
        Map<String, InterviewSession> byId = new LinkedHashMap<>();
        for (InterviewSession stored : store.findByCandidate(candidateId)) {
            SessionHandle live = sessions.get(stored.getId());
            byId.put(stored.getId(), live != null ? live.snapshot : stored);
        }
        return new ArrayList<>(byId.values());
    }

    private InterviewSession transition(String sessionId,
                                        SessionEvent event,
                                        Function<InterviewSession, InterviewSession.InterviewSessionBuilder> change) {
        SessionHandle handle = handle(sessionId);
        InterviewSession updated;
        handle.lock.lock();
        try {
            InterviewSession current = handle.snapshot;
            requireAllowed(current, event);
            InterviewSession.InterviewSessionBuilder builder = change.apply(current);
            event.target().ifPresent(builder::status);
            updated = builder.version(current.getVersion() + 1).build();
            handle.snapshot = updated;
        } finally {
            handle.lock.unlock();
        }

        persist(handle, updated);
        if (updated.getStatus().isTerminal()) {
            sessions.remove(sessionId, handle);
        }
        if (event.target().isPresent()) {
            log.debug("Session {} {} -> {} (v{})", sessionId, event, updated.getStatus(), updated.getVersion());
        }
        return updated;
    }

    private void persist(SessionHandle handle, InterviewSession snapshot) {
        handle.persistLock.lock();
        try {
            if (snapshot.getVersion() <= handle.persistedVersion) {
                log.debug("Skipping stale snapshot v{} of session {} (stored v{})",
                        snapshot.getVersion(), snapshot.getId(), handle.persistedVersion);
                return;
            }
            store.persist(snapshot);
            handle.persistedVersion = snapshot.getVersion();
        } finally {
            handle.persistLock.unlock();
        }
    }

    private SessionHandle handle(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new SessionNotFoundException(String.valueOf(sessionId));
        }
        SessionHandle live = sessions.get(sessionId);
        if (live != null) {
            return live;
        }
        InterviewSession stored = store.load(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        SessionHandle loaded = new SessionHandle(stored);
        loaded.persistedVersion = stored.getVersion();
        if (stored.getStatus().isTerminal()) {
            return loaded;
        }
        SessionHandle existing = sessions.putIfAbsent(sessionId, loaded);
        return existing != null ? existing : loaded;
    }

    private void drain(String sessionId, SessionHandle handle) {
        List<CompletableFuture<?>> pending = List.copyOf(handle.inFlight);
        if (pending.isEmpty()) {
            return;
        }
        Duration timeout = properties.getScoring().effectiveDrainTimeout();
        log.info("Waiting for {} in-flight scoring task(s) of session {}", pending.size(), sessionId);
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("In-flight scoring of session {} did not finish within {}", sessionId, timeout);
        } catch (ExecutionException e) {
            log.warn("In-flight scoring of session {} failed: {}", sessionId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for scoring of session {}", sessionId);
        }
    }

    private JobContext analyzeJob(String jobTitle, String jobDescription) {
        try {
            JobContext analyzed = jobAnalyzer.analyze(jobTitle, jobDescription);
            if (analyzed != null) {
                return analyzed.toBuilder().title(jobTitle).description(jobDescription).build();
            }
            log.warn("Job analysis returned nothing for '{}', using defaults", jobTitle);
        } catch (RuntimeException e) {
            log.warn("Job analysis failed for '{}', using defaults: {}", jobTitle, e.getMessage());
        }
        return defaultJob(jobTitle, jobDescription);
    }

    static JobContext defaultJob(String jobTitle, String jobDescription) {
        return JobContext.builder()
                .title(jobTitle)
                .description(jobDescription)
                .keySkill("programming")
                .keySkill("problem-solving")
                .experienceLevel(Difficulty.INTERMEDIATE)
                .responsibility("development")
                .responsibility("testing")
                .preferredQualification("communication")
                .preferredQualification("teamwork")
                .build();
    }

    private List<Question> seedPool(String jobTitle, String jobDescription) {
        try {
            List<Question> generated = questionGenerator.generateQuestionPool(jobTitle, jobDescription);
            Map<String, Question> byId = new LinkedHashMap<>();
            if (generated != null) {
                for (Question question : generated) {
                    if (question == null || question.getId() == null || question.getText() == null
                            || question.getText().isBlank() || question.getType() == null
                            || question.getDifficulty() == null) {
                        continue;
                    }
                    byId.putIfAbsent(question.getId(), question.toBuilder().source(QuestionSource.POOL).build());
                }
            }
            if (!byId.isEmpty()) {
                return new ArrayList<>(byId.values());
            }
            log.warn("Question pool for '{}' came back empty, using the default pool", jobTitle);
        } catch (RuntimeException e) {
            log.warn("Question pool generation failed for '{}', using the default pool: {}", jobTitle, e.getMessage());
        }
        return QuestionTemplates.defaultPool();
    }

    private static void requireAllowed(InterviewSession session, SessionEvent event) {
        if (!event.isAllowedFrom(session.getStatus())) {
            throw new InvalidStateTransitionException(session.getId(), session.getStatus(), event);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
    }

    private static final class SessionHandle {
        final ReentrantLock lock = new ReentrantLock();
        final ReentrantLock persistLock = new ReentrantLock();
        final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
        volatile InterviewSession snapshot;
        long persistedVersion;

        SessionHandle(InterviewSession snapshot) {
            this.snapshot = snapshot;
        }
    }
}
