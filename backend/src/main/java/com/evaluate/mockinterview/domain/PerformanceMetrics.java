package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PerformanceMetrics {
    double technical;
    double communication;
    double emotionalIntelligence;
    double behavioral;
    /** Mean of technical and communication only. */
    double overall;
    @Singular
    List<String> strengths;
    @Singular
    List<String> weaknesses;
    @Singular
    List<String> recommendations;
}
