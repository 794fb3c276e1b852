package com.evaluate.mockinterview.gateway;

import com.evaluate.mockinterview.domain.Question;
import com.evaluate.mockinterview.domain.TextAnalysis;

/**
 * Scores a transcript against the question's rubric (its text and expected keywords).
 */
public interface TextAnalyzer {

    TextAnalysis analyze(Question question, String transcript);
}
