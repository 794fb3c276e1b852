package com.evaluate.mockinterview.domain;

import lombok.Value;

/**
 * Running view of the candidate's scores, handed to the question generator.
 */
@Value
public class PerformanceSnapshot {
    double technical;
    double communication;
    double confidence;
    PerformanceLevel level;
    Difficulty targetDifficulty;
}
