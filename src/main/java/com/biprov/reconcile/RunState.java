package com.biprov.reconcile;

/**
 * Lifecycle of one reconcile run. A run never leaves a terminal state.
 */
public enum RunState {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
