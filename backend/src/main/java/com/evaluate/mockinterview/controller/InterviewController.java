package com.evaluate.mockinterview.controller;

import com.evaluate.mockinterview.domain.Answer;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.PerformanceMetrics;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.SessionAnalysis;
import com.evaluate.mockinterview.domain.SessionProgress;
import com.evaluate.mockinterview.dto.AnswerFeedbackDto;
import com.evaluate.mockinterview.dto.AnswerSubmissionDto;
import com.evaluate.mockinterview.dto.CreateSessionRequest;
import com.evaluate.mockinterview.dto.QuestionResponseDto;
import com.evaluate.mockinterview.dto.SessionResponseDto;
import com.evaluate.mockinterview.engine.SessionController;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.exception.ValidationException;
import com.evaluate.mockinterview.service.AnswerOutcome;
import com.evaluate.mockinterview.service.InterviewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@RestController
@RequestMapping("/api/interview")
@RequiredArgsConstructor
@Slf4j
public class InterviewController {

    private final InterviewService interviewService;
    private final SessionController sessionController;

    // Sessions

    @PostMapping("/sessions")
    public SessionResponseDto createSession(@RequestBody CreateSessionRequest request) {
        log.info("Session requested for candidate {}: {}", request.getCandidateId(), request.getJobTitle());
        InterviewSession session = interviewService.createSession(
                request.getJobTitle(), request.getJobDescription(), request.getCandidateId());
        return toResponseDto(session);
    }

    @GetMapping("/sessions/{sessionId}")
    public SessionResponseDto getSession(@PathVariable String sessionId) {
        return toResponseDto(sessionController.get(sessionId));
    }

    @GetMapping("/sessions/{sessionId}/progress")
    public SessionProgress getProgress(@PathVariable String sessionId) {
        return sessionController.progress(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/start")
    public SessionResponseDto startSession(@PathVariable String sessionId) {
        return toResponseDto(sessionController.start(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/pause")
    public SessionResponseDto pauseSession(@PathVariable String sessionId) {
        return toResponseDto(sessionController.pause(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/resume")
    public SessionResponseDto resumeSession(@PathVariable String sessionId) {
        return toResponseDto(sessionController.resume(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    public SessionResponseDto cancelSession(@PathVariable String sessionId) {
        return toResponseDto(sessionController.cancel(sessionId));
    }

    @PutMapping("/sessions/{sessionId}/complete")
    public Map<String, Object> completeSession(@PathVariable String sessionId) {
        InterviewSession session = sessionController.complete(sessionId);
        return Map.of(
                "message", "Session completed",
                "final_score", session.getMetrics().getOverall(),
                "metrics", session.getMetrics()
        );
    }

    @GetMapping("/candidates/{candidateId}/sessions")
    public List<SessionResponseDto> getCandidateSessions(@PathVariable String candidateId) {
        return sessionController.findByCandidate(candidateId).stream()
                .map(this::toResponseDto)
                .toList();
    }

    // Questions

    @PostMapping("/sessions/{sessionId}/questions/next")
    public QuestionResponseDto nextQuestion(@PathVariable String sessionId) {
        Question question = interviewService.askNextQuestion(sessionId);
        InterviewSession session = sessionController.get(sessionId);
        return toQuestionDto(session, question);
    }

    @GetMapping("/sessions/{sessionId}/questions")
    public List<QuestionResponseDto> getSessionQuestions(@PathVariable String sessionId) {
        InterviewSession session = sessionController.get(sessionId);
        List<QuestionResponseDto> questions = new ArrayList<>();
        for (Question question : session.getQuestions()) {
            questions.add(toQuestionDto(session, question));
        }
        return questions;
    }

    @GetMapping("/sessions/{sessionId}/questions/{questionId}/speech")
    public ResponseEntity<byte[]> getQuestionSpeech(@PathVariable String sessionId, @PathVariable String questionId) {
        return interviewService.questionSpeech(sessionId, questionId)
                .map(audio -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType("audio/wav"))
                        .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=question_" + questionId + ".wav")
                        .body(audio))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // Answers

    @PostMapping("/sessions/{sessionId}/questions/{questionId}/answer")
    public AnswerFeedbackDto submitAnswer(@PathVariable String sessionId,
                                          @PathVariable String questionId,
                                          @RequestBody AnswerSubmissionDto submission) {
        return toFeedbackDto(await(interviewService.submitTextAnswer(sessionId, questionId, submission.getAnswer())));
    }

    @PostMapping(value = "/sessions/{sessionId}/questions/{questionId}/audio",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnswerFeedbackDto submitAudioAnswer(@PathVariable String sessionId,
                                               @PathVariable String questionId,
                                               @RequestParam("audio_file") MultipartFile audioFile) {
        byte[] audio;
        try {
            audio = audioFile.getBytes();
        } catch (IOException e) {
            throw new ValidationException("Could not read uploaded audio: " + e.getMessage());
        }
        log.info("Audio answer for {} in session {}: {} ({} bytes)", questionId, sessionId,
                audioFile.getOriginalFilename(), audio.length);
        return toFeedbackDto(await(interviewService.submitAudioAnswer(sessionId, questionId, audio)));
    }

    @PostMapping("/sessions/{sessionId}/recording/start")
    public Map<String, Object> startRecording(@PathVariable String sessionId) {
        boolean started = interviewService.startRecording(sessionId);
        return Map.of("recording", true, "started", started);
    }

    @PostMapping("/sessions/{sessionId}/recording/stop")
    public AnswerFeedbackDto stopRecording(@PathVariable String sessionId) {
        return toFeedbackDto(await(interviewService.stopRecordingAndSubmit(sessionId)));
    }

    // Reports

    @GetMapping("/sessions/{sessionId}/metrics")
    public PerformanceMetrics getMetrics(@PathVariable String sessionId) {
        return interviewService.metrics(sessionId);
    }

    @GetMapping("/sessions/{sessionId}/analysis")
    public SessionAnalysis getAnalysis(@PathVariable String sessionId) {
        return interviewService.analysis(sessionId);
    }

    private static AnswerOutcome await(CompletableFuture<AnswerOutcome> outcome) {
        try {
            return outcome.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new ExternalServiceUnavailableException("scoring", String.valueOf(e.getCause()), e.getCause());
        }
    }

    private SessionResponseDto toResponseDto(InterviewSession session) {
        return SessionResponseDto.builder()
                .id(session.getId())
                .candidateId(session.getCandidateId())
                .jobTitle(session.getJob().getTitle())
                .experienceLevel(session.getJob().getExperienceLevel().label())
                .keySkills(session.getJob().getKeySkills())
                .status(session.getStatus().name())
                .questionsAsked(session.getQuestions().size())
                .answersRecorded(session.getAnswers().size())
                .currentIndex(session.getCurrentIndex())
                .stopReason(session.getStopReason() == null ? null : session.getStopReason().name())
                .createdAt(session.getCreatedAt())
                .startedAt(session.getStartedAt())
                .completedAt(session.getCompletedAt())
                .version(session.getVersion())
                .build();
    }

    private QuestionResponseDto toQuestionDto(InterviewSession session, Question question) {
        return QuestionResponseDto.builder()
                .id(question.getId())
                .sessionId(session.getId())
                .questionText(question.getText())
                .questionType(question.getType().label())
                .difficulty(question.getDifficulty().label())
                .category(question.getCategory())
                .expectedKeywords(question.getExpectedKeywords())
                .source(question.getSource().name())
                .questionNumber(session.getQuestions().indexOf(question) + 1)
                .build();
    }

    private AnswerFeedbackDto toFeedbackDto(AnswerOutcome outcome) {
        Answer answer = outcome.getAnswer();
        return AnswerFeedbackDto.builder()
                .questionId(answer.getQuestionId())
                .transcript(answer.getTranscript())
                .technicalScore(answer.getTechnical())
                .communicationScore(answer.communication())
                .fluency(answer.getFluency())
                .confidence(answer.getConfidence())
                .sentiment(answer.getSentiment())
                .degraded(answer.isDegraded())
                .answeredCount(outcome.getAnsweredCount())
                .status(outcome.getStatus().name())
                .interviewComplete(outcome.isFinished())
                .stopReason(outcome.getDecision().getReason().name())
                .build();
    }
}
