package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.domain.Difficulty;
import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.QuestionSource;
import com.evaluate.mockinterview.domain.QuestionType;

import java.util.List;

/**
 * Built-in questions used when the generator cannot be reached.
 */
public final class QuestionTemplates {

    private QuestionTemplates() {
    }

    /**
     * Deterministic stand-in for a generated question at the given difficulty.
     *
     * @param ordinal position of the question in the session, used to keep ids unique
     */
    public static Question fallback(Difficulty difficulty, int ordinal) {
        Question.QuestionBuilder builder = Question.builder()
                .id("fallback-" + difficulty.label() + "-" + ordinal)
                .type(QuestionType.BEHAVIORAL)
                .difficulty(difficulty)
                .source(QuestionSource.FALLBACK);
        return switch (difficulty) {
            case BEGINNER -> builder
                    .text("Could you tell me about your background and experience?")
                    .category("Background")
                    .expectedKeywords(List.of("background", "experience", "skills", "introduction"))
                    .build();
            case INTERMEDIATE -> builder
                    .text("Can you describe a project you're particularly proud of?")
                    .category("Experience")
                    .expectedKeywords(List.of("project", "challenges", "solutions", "achievements"))
                    .build();
            case ADVANCED -> builder
                    .text("How would you approach solving a complex technical problem?")
                    .category("Problem Solving")
                    .expectedKeywords(List.of("approach", "problem", "solution", "technical"))
                    .build();
            case EXPERT -> builder
                    .text("Can you discuss your experience with system architecture and design patterns?")
                    .category("Architecture")
                    .expectedKeywords(List.of("architecture", "design", "patterns", "systems"))
                    .build();
        };
    }

    /**
     * Pool used when the generator cannot seed one from the job posting.
     */
    public static List<Question> defaultPool() {
        return List.of(
                Question.builder()
                        .id("tech-1")
                        .text("Explain the concept of object-oriented programming and its main principles.")
                        .type(QuestionType.TECHNICAL)
                        .difficulty(Difficulty.INTERMEDIATE)
                        .category("Programming Fundamentals")
                        .expectedKeywords(List.of("encapsulation", "inheritance", "polymorphism", "abstraction"))
                        .build(),
                Question.builder()
                        .id("behav-1")
                        .text("Tell me about a time when you had to work with a difficult team member.")
                        .type(QuestionType.BEHAVIORAL)
                        .difficulty(Difficulty.INTERMEDIATE)
                        .category("Teamwork")
                        .expectedKeywords(List.of("conflict", "resolution", "communication", "collaboration"))
                        .build(),
                Question.builder()
                        .id("sit-1")
                        .text("How would you handle a situation where you disagree with your manager's technical decision?")
                        .type(QuestionType.SITUATIONAL)
                        .difficulty(Difficulty.ADVANCED)
                        .category("Problem Solving")
                        .expectedKeywords(List.of("respect", "communication", "evidence", "compromise"))
                        .build(),
                Question.builder()
                        .id("prob-1")
                        .text("Design a system for a URL shortening service like bit.ly.")
                        .type(QuestionType.PROBLEM_SOLVING)
                        .difficulty(Difficulty.ADVANCED)
                        .category("System Design")
                        .expectedKeywords(List.of("database", "hashing", "scalability", "cache"))
                        .build(),
                Question.builder()
                        .id("cult-1")
                        .text("What type of work environment do you thrive in?")
                        .type(QuestionType.CULTURAL_FIT)
                        .difficulty(Difficulty.BEGINNER)
                        .category("Culture")
                        .expectedKeywords(List.of("collaborative", "independent", "structured", "flexible"))
                        .build(),
                Question.builder()
                        .id("tech-2")
                        .text("Could you tell me about your experience with relevant technologies for this position?")
                        .type(QuestionType.TECHNICAL)
                        .difficulty(Difficulty.BEGINNER)
                        .category("Technical Knowledge")
                        .expectedKeywords(List.of("experience", "technology", "skills", "project"))
                        .build());
    }
}
