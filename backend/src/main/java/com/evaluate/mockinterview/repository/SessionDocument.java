package com.evaluate.mockinterview.repository;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a stored session. Enum values are stored by name; bump {@link #SCHEMA_VERSION}
 * whenever a field changes meaning.
 */
@Data
@NoArgsConstructor
public class SessionDocument {

    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion = SCHEMA_VERSION;
    private String id;
    private String candidateId;
    private JobDocument job;
    private String status;
    private List<QuestionDocument> questionPool = new ArrayList<>();
    private List<QuestionDocument> questions = new ArrayList<>();
    private List<AnswerDocument> answers = new ArrayList<>();
    private int currentIndex;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Map<String, ArmDocument> typeArms = new LinkedHashMap<>();
    private Map<String, ArmDocument> difficultyArms = new LinkedHashMap<>();
    private MetricsDocument metrics;
    private String stopReason;
    private long version;

    @Data
    @NoArgsConstructor
    public static class JobDocument {
        private String title;
        private String description;
        private List<String> keySkills = new ArrayList<>();
        private String experienceLevel;
        private List<String> responsibilities = new ArrayList<>();
        private List<String> preferredQualifications = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class QuestionDocument {
        private String id;
        private String text;
        private String type;
        private String difficulty;
        private String category;
        private List<String> expectedKeywords = new ArrayList<>();
        private String source;
    }

    @Data
    @NoArgsConstructor
    public static class AnswerDocument {
        private String questionId;
        private String transcript;
        private double technical;
        private double fluency;
        private double confidence;
        private double sentiment;
        private Map<String, Double> emotionWeights = new LinkedHashMap<>();
        private double audioDuration;
        private Instant timestamp;
        private boolean degraded;
    }

    @Data
    @NoArgsConstructor
    public static class ArmDocument {
        private int successes;
        private int failures;
    }

    @Data
    @NoArgsConstructor
    public static class MetricsDocument {
        private double technical;
        private double communication;
        private double emotionalIntelligence;
        private double behavioral;
        private double overall;
        private List<String> strengths = new ArrayList<>();
        private List<String> weaknesses = new ArrayList<>();
        private List<String> recommendations = new ArrayList<>();
    }
}
