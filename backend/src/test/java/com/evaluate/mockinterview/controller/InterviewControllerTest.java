package com.evaluate.mockinterview.controller;

import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.InterviewSession;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.SessionEvent;
import com.evaluate.mockinterview.domain.SessionStatus;
import com.evaluate.mockinterview.engine.SessionController;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.exception.InvalidStateTransitionException;
import com.evaluate.mockinterview.service.InterviewService;
import com.evaluate.mockinterview.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InterviewController.class)
class InterviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InterviewService interviewService;

    @MockBean
    private SessionController sessionController;

    @Test
    void unavailableCollaboratorMapsTo503() throws Exception {
        when(interviewService.submitTextAnswer(eq("s1"), eq("q1"), anyString()))
                .thenReturn(CompletableFuture.failedFuture(
                        new ExternalServiceUnavailableException("session-store", "disk full")));

        mockMvc.perform(post("/api/interview/sessions/s1/questions/q1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\": \"hello\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503))
                .andExpect(jsonPath("$.error").value("service_unavailable"))
                .andExpect(jsonPath("$.service").value("session-store"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void illegalTransitionMapsTo409() throws Exception {
        when(sessionController.resume("s1"))
                .thenThrow(new InvalidStateTransitionException("s1", SessionStatus.COMPLETED, SessionEvent.RESUME));

        mockMvc.perform(post("/api/interview/sessions/s1/resume"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.current_status").value("COMPLETED"))
                .andExpect(jsonPath("$.event").value("RESUME"));
    }

    @Test
    void speechIsServedAsWav() throws Exception {
        when(interviewService.questionSpeech("s1", "q1")).thenReturn(Optional.of(new byte[]{'R', 'I', 'F', 'F'}));

        mockMvc.perform(get("/api/interview/sessions/s1/questions/q1/speech"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("audio/wav"))
                .andExpect(content().bytes(new byte[]{'R', 'I', 'F', 'F'}));
    }

    @Test
    void questionIsNumberedBySessionPosition() throws Exception {
        Question question = Fixtures.question("q2", QuestionType.BEHAVIORAL, Difficulty.BEGINNER);
        InterviewSession session = Fixtures.answered(0.7).toBuilder().question(question).build();
        when(interviewService.askNextQuestion("session-1")).thenReturn(question);
        when(sessionController.get("session-1")).thenReturn(session);

        mockMvc.perform(post("/api/interview/sessions/session-1/questions/next"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("q2"))
                .andExpect(jsonPath("$.question_text").value("Question q2"))
                .andExpect(jsonPath("$.question_type").value("behavioral"))
                .andExpect(jsonPath("$.difficulty").value("beginner"))
                .andExpect(jsonPath("$.question_number").value(2));
    }
}
