package com.evaluate.mockinterview;

import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.TextAnalysis;
import com.evaluate.mockinterview.service.LlmService;
import com.evaluate.mockinterview.util.WavAudio;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class MockInterviewApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        when(llmService.analyze(any(Question.class), anyString())).thenReturn(new TextAnalysis(0.75, 0.2, 0.6));
    }

    private String createSession() throws Exception {
        String body = """
                {
                    "job_title": "Backend Engineer",
                    "job_description": "Design and run Java services on Spring Boot",
                    "candidate_id": "candidate-42"
                }
                """;
        String response = mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(response, "$.id");
    }

    private String nextQuestion(String sessionId) throws Exception {
        String response = mockMvc.perform(post("/api/interview/sessions/{id}/questions/next", sessionId))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(response, "$.id");
    }

    @Test
    void contextLoads() {
    }

    @Test
    void testHealthCheck() throws Exception {
        mockMvc.perform(get("/health/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void testReadinessReportsConfiguredDependencies() throws Exception {
        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"))
                .andExpect(jsonPath("$.dependencies.ollama").value("http://localhost:11434"))
                .andExpect(jsonPath("$.dependencies.ollama_model").value("test-model"))
                .andExpect(jsonPath("$.dependencies.azure_speech").value("unavailable"));
    }

    @Test
    void testRootEndpoint() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void testCreateSession() throws Exception {
        String sessionId = createSession();

        mockMvc.perform(get("/api/interview/sessions/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CREATED"))
                .andExpect(jsonPath("$.candidate_id").value("candidate-42"))
                .andExpect(jsonPath("$.job_title").value("Backend Engineer"))
                .andExpect(jsonPath("$.experience_level").value("intermediate"))
                .andExpect(jsonPath("$.questions_asked").value(0));
    }

    @Test
    void testCreateSessionRejectsBlankTitle() throws Exception {
        mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"job_title\": \" \", \"job_description\": \"x\", \"candidate_id\": \"c\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"));
    }

    @Test
    void testUnknownSession() throws Exception {
        mockMvc.perform(get("/api/interview/sessions/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("session_not_found"))
                .andExpect(jsonPath("$.path").value("/api/interview/sessions/does-not-exist"));
    }

    @Test
    void testQuestionBeforeStartIsConflict() throws Exception {
        String sessionId = createSession();

        mockMvc.perform(post("/api/interview/sessions/{id}/questions/next", sessionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid_state_transition"))
                .andExpect(jsonPath("$.current_status").value("CREATED"))
                .andExpect(jsonPath("$.event").value("ASK_QUESTION"));
    }

    @Test
    void testInterviewFlow() throws Exception {
        String sessionId = createSession();
        mockMvc.perform(post("/api/interview/sessions/{id}/start", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"));

        String questionId = nextQuestion(sessionId);
        mockMvc.perform(post("/api/interview/sessions/{id}/questions/{qid}/answer", sessionId, questionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\": \"I would start by profiling the service\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.question_id").value(questionId))
                .andExpect(jsonPath("$.technical_score").value(0.75))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.answered_count").value(1))
                .andExpect(jsonPath("$.interview_complete").value(false));

        String secondId = nextQuestion(sessionId);
        MockMultipartFile audio = new MockMultipartFile("audio_file", "answer.wav", "audio/wav",
                WavAudio.wrapPcm(new byte[16000], 16000));
        mockMvc.perform(multipart("/api/interview/sessions/{id}/questions/{qid}/audio", sessionId, secondId).file(audio))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.question_id").value(secondId))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.answered_count").value(2));

        mockMvc.perform(get("/api/interview/sessions/{id}/questions", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
        mockMvc.perform(get("/api/interview/sessions/{id}/progress", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answers_recorded").value(2))
                .andExpect(jsonPath("$.awaiting_answer").value(false));
        mockMvc.perform(get("/api/interview/sessions/{id}/analysis", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_answers").value(2));

        mockMvc.perform(put("/api/interview/sessions/{id}/complete", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.final_score").exists())
                .andExpect(jsonPath("$.metrics.strengths").isArray());

        mockMvc.perform(post("/api/interview/sessions/{id}/questions/next", sessionId))
                .andExpect(status().isConflict());
        mockMvc.perform(get("/api/interview/candidates/{cid}/sessions", "candidate-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == '" + sessionId + "')].status").value("COMPLETED"));
    }

    @Test
    void testAnswerToWrongQuestionIsRejected() throws Exception {
        String sessionId = createSession();
        mockMvc.perform(post("/api/interview/sessions/{id}/start", sessionId)).andExpect(status().isOk());
        nextQuestion(sessionId);

        mockMvc.perform(post("/api/interview/sessions/{id}/questions/{qid}/answer", sessionId, "not-asked")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\": \"something\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testQuestionSpeechWithoutSynthesizer() throws Exception {
        String sessionId = createSession();
        mockMvc.perform(post("/api/interview/sessions/{id}/start", sessionId)).andExpect(status().isOk());
        String questionId = nextQuestion(sessionId);

        mockMvc.perform(get("/api/interview/sessions/{id}/questions/{qid}/speech", sessionId, questionId))
                .andExpect(status().isNoContent());
    }

    @Test
    void testRecordingIsUnavailableWhenDisabled() throws Exception {
        String sessionId = createSession();
        mockMvc.perform(post("/api/interview/sessions/{id}/start", sessionId)).andExpect(status().isOk());
        nextQuestion(sessionId);

        mockMvc.perform(post("/api/interview/sessions/{id}/recording/start", sessionId))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.service").value("microphone"));
    }
}
