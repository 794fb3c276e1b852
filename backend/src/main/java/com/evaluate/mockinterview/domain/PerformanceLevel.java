package com.evaluate.mockinterview.domain;

public enum PerformanceLevel {
    LOW,
    MEDIUM,
    HIGH
}
