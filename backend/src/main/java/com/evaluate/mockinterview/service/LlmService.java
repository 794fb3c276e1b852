package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.JobContext;
import com.evaluate.mockinterview.domain.PerformanceSnapshot;
import com.evaluate.mockinterview.domain.QaExchange;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionSource;
import com.evaluate.mockinterview.domain.QuestionType;
import com.evaluate.mockinterview.domain.TextAnalysis;
import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.gateway.JobAnalyzer;
import com.evaluate.mockinterview.gateway.QuestionGenerator;
import com.evaluate.mockinterview.gateway.TextAnalyzer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ollama-backed question generation, job analysis and answer scoring.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LlmService implements QuestionGenerator, JobAnalyzer, TextAnalyzer {

    static final String SERVICE = "ollama";

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

    private final WebClient ollamaWebClient;
    private final PromptService promptService;
    private final ObjectMapper objectMapper;

    @Value("${ollama.model:llama3.2}")
    private String model;

    @Value("${ollama.timeout:60s}")
    private Duration timeout;

    @Override
    public List<Question> generateQuestionPool(String jobTitle, String jobDescription) {
        JsonNode reply = callForJson(promptService.questionPoolPrompt(jobTitle, jobDescription));
        JsonNode items = reply.isArray() ? reply : reply.path("questions");
        if (!items.isArray()) {
            throw new ExternalServiceUnavailableException(SERVICE, "question pool reply is not a JSON array");
        }

        List<Question> pool = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items) {
            index++;
            try {
                pool.add(toQuestion(item, "pool-" + index, null));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed pool question #{}: {}", index, e.getMessage());
            }
        }
        pool.sort(Comparator.comparing(Question::getDifficulty));
        log.info("Generated {} pool questions for '{}'", pool.size(), jobTitle);
        return pool;
    }

    @Override
    public Question generateContextualQuestion(String jobDescription,
                                               List<QaExchange> recentHistory,
                                               Collection<String> askedIds,
                                               PerformanceSnapshot performance) {
        String prompt = promptService.contextualQuestionPrompt(jobDescription, recentHistory, askedIds, performance);
        JsonNode reply = callForJson(prompt);
        try {
            Question question = toQuestion(reply, "generated-" + (askedIds.size() + 1), performance.getTargetDifficulty());
            return question.toBuilder().source(QuestionSource.GENERATED).build();
        } catch (IllegalArgumentException e) {
            throw new ExternalServiceUnavailableException(SERVICE, "unusable question: " + e.getMessage(), e);
        }
    }

    @Override
    public JobContext analyze(String jobTitle, String jobDescription) {
        JsonNode reply = callForJson(promptService.jobAnalysisPrompt(jobTitle, jobDescription));
        if (!reply.isObject()) {
            throw new ExternalServiceUnavailableException(SERVICE, "job analysis reply is not a JSON object");
        }
        return JobContext.builder()
                .title(jobTitle)
                .description(jobDescription)
                .keySkills(texts(reply.path("key_skills")))
                .experienceLevel(Difficulty.fromLabel(reply.path("experience_level").asText(null), Difficulty.INTERMEDIATE))
                .responsibilities(texts(reply.path("key_responsibilities")))
                .preferredQualifications(texts(reply.path("preferred_qualifications")))
                .build();
    }

    @Override
    public TextAnalysis analyze(Question question, String transcript) {
        JsonNode reply = callForJson(promptService.answerAnalysisPrompt(question, transcript));
        JsonNode technical = reply.path("technical_score");
        if (!technical.isNumber()) {
            throw new ExternalServiceUnavailableException(SERVICE, "analysis reply has no technical_score");
        }
        return new TextAnalysis(
                technical.asDouble(),
                reply.path("sentiment_score").asDouble(0.0),
                reply.path("confidence_score").asDouble(0.5));
    }

    private JsonNode callForJson(String prompt) {
        return parseJson(callOllama(prompt));
    }

    private String callOllama(String prompt) {
        Map<String, Object> body = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "format", "json"
        );

        Map<?, ?> result;
        try {
            result = ollamaWebClient.post()
                    .uri("/api/generate")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            log.warn("Ollama not available: {}", e.getMessage());
            throw new ExternalServiceUnavailableException(SERVICE, "request failed: " + e.getMessage(), e);
        }

        Object response = result != null ? result.get("response") : null;
        if (!(response instanceof String text) || text.isBlank()) {
            throw new ExternalServiceUnavailableException(SERVICE, "empty response");
        }
        return text;
    }

    JsonNode parseJson(String response) {
        String text = response.trim();
        Matcher fenced = FENCED_JSON.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Reply is not valid JSON, retrying without trailing commas: {}", e.getOriginalMessage());
        }
        try {
            return objectMapper.readTree(TRAILING_COMMA.matcher(text).replaceAll("$1"));
        } catch (JsonProcessingException e) {
            log.warn("Could not parse model reply: {}", abbreviate(text));
            throw new ExternalServiceUnavailableException(SERVICE, "reply is not valid JSON", e);
        }
    }

    private Question toQuestion(JsonNode node, String defaultId, Difficulty defaultDifficulty) {
        String text = node.path("text").asText("").trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("question text is missing");
        }
        String id = node.path("id").asText("").trim();
        String typeLabel = node.path("type").asText("");
        QuestionType type = typeLabel.isBlank() ? QuestionType.TECHNICAL : QuestionType.fromLabel(typeLabel);
        Difficulty difficulty = defaultDifficulty == null
                ? Difficulty.fromLabel(node.path("difficulty").asText(""))
                : Difficulty.fromLabel(node.path("difficulty").asText(null), defaultDifficulty);

        return Question.builder()
                .id(id.isEmpty() ? defaultId : id)
                .text(text)
                .type(type)
                .difficulty(difficulty)
                .category(node.path("category").asText("general"))
                .expectedKeywords(texts(node.path("expected_keywords")))
                .source(QuestionSource.POOL)
                .build();
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(item -> {
                String value = item.asText("").trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            });
        }
        return values;
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
