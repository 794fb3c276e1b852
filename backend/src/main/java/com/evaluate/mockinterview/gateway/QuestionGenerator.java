package com.evaluate.mockinterview.gateway;

import com.evaluate.mockinterview.domain.PerformanceSnapshot;
import com.evaluate.mockinterview.domain.QaExchange;
import com.evaluate.mockinterview.domain.Question;

import java.util.Collection;
import java.util.List;

public interface QuestionGenerator {

    /** Initial question pool for a job posting. */
    List<Question> generateQuestionPool(String jobTitle, String jobDescription);

    /** One follow-up question conditioned on the conversation so far. */
    Question generateContextualQuestion(String jobDescription,
                                        List<QaExchange> recentHistory,
                                        Collection<String> askedIds,
                                        PerformanceSnapshot performance);
}
