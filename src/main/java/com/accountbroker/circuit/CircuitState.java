package com.accountbroker.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
