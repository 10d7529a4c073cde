package com.accountbroker.circuit;

import java.time.Instant;

/**
 * 账号熔断状态快照（不可变）
 */
public record CircuitSnapshot(CircuitState state, int consecutiveFailures, int consecutiveSuccesses, Instant openedAt) {

    private static final CircuitSnapshot CLOSED = new CircuitSnapshot(CircuitState.CLOSED, 0, 0, null);

    public static CircuitSnapshot closed() {
        return CLOSED;
    }

    public static CircuitSnapshot open(Instant openedAt) {
        return new CircuitSnapshot(CircuitState.OPEN, 0, 0, openedAt);
    }

    public static CircuitSnapshot halfOpen(Instant openedAt) {
        return new CircuitSnapshot(CircuitState.HALF_OPEN, 0, 0, openedAt);
    }

    public CircuitSnapshot withFailures(int failures) {
        return new CircuitSnapshot(state, failures, consecutiveSuccesses, openedAt);
    }

    public CircuitSnapshot withSuccesses(int successes) {
        return new CircuitSnapshot(state, consecutiveFailures, successes, openedAt);
    }
}
