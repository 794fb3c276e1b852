package com.evaluate.mockinterview.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Success/failure counters behind one bandit arm. The posterior is Beta(success + 1, failure + 1).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ArmStats {
    int successCount;
    int failureCount;

    public static ArmStats of(int successCount, int failureCount) {
        if (successCount < 0 || failureCount < 0) {
            throw new IllegalArgumentException("Arm counts must be non-negative: "
                    + successCount + "/" + failureCount);
        }
        return new ArmStats(successCount, failureCount);
    }

    public ArmStats withSuccess() {
        return new ArmStats(successCount + 1, failureCount);
    }

    public ArmStats withFailure() {
        return new ArmStats(successCount, failureCount + 1);
    }

    public double alpha() {
        return successCount + 1.0;
    }

    public double beta() {
        return failureCount + 1.0;
    }
}
