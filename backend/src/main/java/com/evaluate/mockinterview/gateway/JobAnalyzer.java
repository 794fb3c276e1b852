package com.evaluate.mockinterview.gateway;

import com.evaluate.mockinterview.domain.JobContext;

/**
 * Extracts key skills and the expected experience level from a job posting.
 */
public interface JobAnalyzer {

    JobContext analyze(String jobTitle, String jobDescription);
}
