package com.evaluate.mockinterview.domain;

import lombok.Value;

@Value
public class TextAnalysis {
    double technical;
    double sentiment;
    double confidence;
}
