package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.audio.AudioRecorder;
import com.evaluate.mockinterview.config.InterviewProperties;
import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.AudioFeatures;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.PerformanceMetrics;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.SessionAnalysis;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.domain.StopReason;
import com.evaluate.mockinterview.domain.TerminationDecision;
import com.evaluate.mockinterview.domain.TextAnalysis;
import com.evaluate.mockinterview.engine.PerformanceSummarizer;
import com.evaluate.mockinterview.engine.ScoreAggregator;
import com.evaluate.mockinterview.engine.SessionAnalyzer;
import com.evaluate.mockinterview.engine.SessionController;
import com.evaluate.mockinterview.engine.TerminationPolicy;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.exception.InvalidStateTransitionException;
import com.evaluate.mockinterview.exception.ValidationException;
import com.evaluate.mockinterview.gateway.AudioFeatureExtractor;
import com.evaluate.mockinterview.gateway.SpeechSynthesizer;
import com.evaluate.mockinterview.gateway.TextAnalyzer;
import com.evaluate.mockinterview.gateway.Transcriber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives interviews: asks questions, scores answers off the caller's thread and stops sessions when
 * the termination policy says so.
 *
 * <p>Every external call made while scoring gets a timeout and one retry with backoff when the
 * collaborator reports itself unavailable. A call that still fails, or fails in any other way,
 * contributes neutral scores instead and the answer is recorded as degraded.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InterviewService {

    private final SessionController sessionController;
    private final ScoreAggregator scoreAggregator;
    private final TerminationPolicy terminationPolicy;
    private final PerformanceSummarizer performanceSummarizer;
    private final SessionAnalyzer sessionAnalyzer;
    private final Transcriber transcriber;
    private final AudioFeatureExtractor audioFeatureExtractor;
    private final TextAnalyzer textAnalyzer;
    private final SpeechSynthesizer speechSynthesizer;
    private final InterviewProperties properties;
    private final Optional<AudioRecorder> audioRecorder;

    private final AtomicReference<String> recordingSession = new AtomicReference<>();

    public InterviewSession createSession(String jobTitle, String jobDescription, String candidateId) {
        return sessionController.create(jobTitle, jobDescription, candidateId);
    }

    public Question askNextQuestion(String sessionId) {
        return sessionController.nextQuestion(sessionId);
    }

    /** Spoken version of an asked question, empty when synthesis is unavailable. */
    public Optional<byte[]> questionSpeech(String sessionId, String questionId) {
        Question question = sessionController.get(sessionId).getQuestions().stream()
                .filter(q -> q.getId().equals(questionId))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Question " + questionId + " was not asked in session "
                        + sessionId));
        return synthesize(question);
    }

    /**
     * Scores a recorded answer to the pending question and records it. The returned future is
     * registered with the session so that pause and cancel wait for it.
     */
    public CompletableFuture<AnswerOutcome> submitAudioAnswer(String sessionId, String questionId, byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new ValidationException("Audio answer is empty");
        }
        Question question = sessionController.requirePending(sessionId, questionId);
        log.info("Scoring audio answer to {} in session {} ({} bytes)", questionId, sessionId, audio.length);
        return run(sessionId, question, scoreAudio(question, audio));
    }

    /** Scores a typed answer. Only text analysis contributes, so the answer is marked degraded. */
    public CompletableFuture<AnswerOutcome> submitTextAnswer(String sessionId, String questionId, String transcript) {
        if (transcript == null || transcript.isBlank()) {
            throw new ValidationException("Answer text is empty");
        }
        Question question = sessionController.requirePending(sessionId, questionId);
        log.info("Scoring text answer to {} in session {}", questionId, sessionId);
        return run(sessionId, question, scoreText(question, transcript.trim()));
    }

    /**
     * Runs a whole interview over {@code channel} until the termination policy stops it, the
     * candidate leaves or the session is ended elsewhere.
     */
    public InterviewSession conduct(String sessionId, CandidateChannel channel) {
        if (sessionController.get(sessionId).getStatus() == SessionStatus.CREATED) {
            sessionController.start(sessionId);
        }
        while (true) {
            InterviewSession current = sessionController.get(sessionId);
            if (current.getStatus() != SessionStatus.IN_PROGRESS) {
                log.info("Session {} is {}, leaving interview loop", sessionId, current.getStatus());
                return current;
            }

            Question question = sessionController.nextQuestion(sessionId);
            channel.deliver(question, synthesize(question));
            byte[] response = channel.awaitResponse(question);
            if (response == null) {
                log.info("Candidate left session {} at question {}", sessionId, question.getId());
                return sessionController.complete(sessionId, StopReason.MANUAL);
            }

            AnswerOutcome outcome = await(submitAudioAnswer(sessionId, question.getId(), response));
            if (outcome.isFinished()) {
                return sessionController.get(sessionId);
            }
        }
    }

    public boolean startRecording(String sessionId) {
        AudioRecorder recorder = audioRecorder
                .orElseThrow(() -> new ExternalServiceUnavailableException(AudioRecorder.SERVICE,
                        "recording is disabled"));
        sessionController.get(sessionId).pendingQuestion()
                .orElseThrow(() -> new ValidationException("Session " + sessionId + " has no question to answer"));

        if (!recordingSession.compareAndSet(null, sessionId)) {
            if (sessionId.equals(recordingSession.get())) {
                return false;
            }
            throw new ValidationException("The microphone is in use by another session");
        }
        try {
            return recorder.start();
        } catch (RuntimeException e) {
            recordingSession.set(null);
            throw e;
        }
    }

    public CompletableFuture<AnswerOutcome> stopRecordingAndSubmit(String sessionId) {
        AudioRecorder recorder = audioRecorder
                .orElseThrow(() -> new ExternalServiceUnavailableException(AudioRecorder.SERVICE,
                        "recording is disabled"));
        if (!recordingSession.compareAndSet(sessionId, null)) {
            throw new ValidationException("Session " + sessionId + " is not recording");
        }
        byte[] audio = recorder.stop()
                .orElseThrow(() -> new ValidationException("No audio was captured"));
        Question pending = sessionController.get(sessionId).pendingQuestion()
                .orElseThrow(() -> new ValidationException("Session " + sessionId + " has no question to answer"));
        return submitAudioAnswer(sessionId, pending.getId(), audio);
    }

    /** Frozen metrics for completed sessions, a live summary otherwise. */
    public PerformanceMetrics metrics(String sessionId) {
        InterviewSession session = sessionController.get(sessionId);
        return session.getMetrics() != null ? session.getMetrics() : performanceSummarizer.summarize(session);
    }

    public SessionAnalysis analysis(String sessionId) {
        return sessionAnalyzer.analyze(sessionController.get(sessionId));
    }

    Mono<Answer> scoreAudio(Question question, byte[] audio) {
        Mono<Optional<AudioFeatures>> features = optional(guarded(() -> audioFeatureExtractor.extract(audio),
                "audio features"));
        Mono<Optional<String>> transcript = optional(guarded(() -> transcriber.transcribe(audio), "transcription"));

        return Mono.zip(features, transcript).flatMap(scored -> {
            Optional<String> text = scored.getT2();
            Mono<Optional<TextAnalysis>> analysis = text.isPresent()
                    ? optional(guarded(() -> textAnalyzer.analyze(question, text.get()), "text analysis"))
                    : Mono.just(Optional.empty());
            return analysis.map(result -> scoreAggregator.score(
                    text.orElse(""), scored.getT1().orElse(null), result.orElse(null), question));
        });
    }

    Mono<Answer> scoreText(Question question, String transcript) {
        return optional(guarded(() -> textAnalyzer.analyze(question, transcript), "text analysis"))
                .map(analysis -> scoreAggregator.score(transcript, null, analysis.orElse(null), question));
    }

    private CompletableFuture<AnswerOutcome> run(String sessionId, Question question, Mono<Answer> scoring) {
        CompletableFuture<AnswerOutcome> work = sessionController.track(sessionId, new CompletableFuture<>());
        scoring.map(answer -> record(sessionId, question, answer))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(work::complete, work::completeExceptionally);
        return work;
    }

    private AnswerOutcome record(String sessionId, Question question, Answer answer) {
        InterviewSession updated = sessionController.recordAnswer(sessionId, question, answer);
        TerminationDecision decision = terminationPolicy.evaluate(updated);
        if (decision.isStop()) {
            log.info("Stopping session {}: {}", sessionId, decision.getReason().description());
            try {
                updated = sessionController.complete(sessionId, decision.getReason());
            } catch (InvalidStateTransitionException e) {
                log.info("Session {} was already ended ({})", sessionId, e.getCurrentStatus());
                updated = sessionController.get(sessionId);
            }
        }
        return new AnswerOutcome(question, answer, decision, updated.getStatus(), updated.getAnswers().size());
    }

    private <T> Mono<T> guarded(Callable<T> call, String what) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.getScoring().getTimeout())
                .retryWhen(Retry.backoff(1, properties.getScoring().getRetryBackoff())
                        .filter(InterviewService::isUnavailable))
                .doOnError(e -> {
                    if (isUnavailable(e)) {
                        log.warn("{} unavailable, using neutral scores: {}", what, rootMessage(e));
                    } else {
                        log.error("{} failed unexpectedly, using neutral scores", what, e);
                    }
                });
    }

    private static <T> Mono<Optional<T>> optional(Mono<T> call) {
        return call.map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(Exception.class, e -> Mono.just(Optional.empty()));
    }

    private Optional<byte[]> synthesize(Question question) {
        try {
            return speechSynthesizer.synthesize(question.getText());
        } catch (RuntimeException e) {
            log.warn("Speech synthesis failed for question {}: {}", question.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    static boolean isUnavailable(Throwable error) {
        return error instanceof ExternalServiceUnavailableException
                || error instanceof TimeoutException
                || Exceptions.isRetryExhausted(error);
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = Exceptions.isRetryExhausted(error) && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage();
    }

    private static AnswerOutcome await(CompletableFuture<AnswerOutcome> outcome) {
        try {
            return outcome.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
