package com.accountbroker.circuit;

/**
 * 一次结果上报引起的状态变化
 */
public record CircuitTransition(CircuitState from, CircuitSnapshot to) {

    public boolean changed() {
        return from != to.state();
    }

    /**
     * 本次上报使熔断器打开（CLOSED 或 HALF_OPEN 进入 OPEN）
     */
    public boolean opened() {
        return changed() && to.state() == CircuitState.OPEN;
    }
}
