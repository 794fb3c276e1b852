package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class Question {
    String id;
    String text;
    QuestionType type;
    Difficulty difficulty;
    String category;
    @Singular
    List<String> expectedKeywords;
    @Builder.Default
    QuestionSource source = QuestionSource.POOL;

    public boolean isFallback() {
        return source == QuestionSource.FALLBACK;
    }
}
