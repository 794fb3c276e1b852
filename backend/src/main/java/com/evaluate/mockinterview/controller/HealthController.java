package com.evaluate.mockinterview.controller;

import com.evaluate.mockinterview.service.SpeechService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final SpeechService speechService;

    @Value("${ollama.base-url:}")
    private String ollamaBaseUrl;

    @Value("${ollama.model:}")
    private String ollamaModel;

    @GetMapping({"", "/"})
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "healthy",
                "service", "Mock Interview API",
                "version", "1.0.0"
        );
    }

    @GetMapping("/ready")
    public Map<String, Object> readinessCheck() {
        return Map.of(
                "status", "ready",
                "dependencies", Map.of(
                        "ollama", ollamaBaseUrl.isBlank() ? "not configured" : ollamaBaseUrl,
                        "ollama_model", ollamaModel.isBlank() ? "not configured" : ollamaModel,
                        "azure_speech", speechService.isAvailable() ? "available" : "unavailable"
                )
        );
    }
}
