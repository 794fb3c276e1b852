package com.evaluate.mockinterview.domain;

import lombok.Value;

@Value
public class QaExchange {
    String question;
    String answer;
}
