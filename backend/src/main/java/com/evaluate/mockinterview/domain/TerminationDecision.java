package com.evaluate.mockinterview.domain;

import lombok.Value;

@Value
public class TerminationDecision {
    public static final TerminationDecision CONTINUE = new TerminationDecision(false, StopReason.NONE);

    boolean stop;
    StopReason reason;

    public static TerminationDecision stop(StopReason reason) {
        return new TerminationDecision(true, reason);
    }
}
