package org.wxvisor.smt;

/**
 * Lifecycle of an {@link Encoder}. Transitions only move forward.
 */
public enum QueryState {
    IDLE,
    BUILDING,
    ASSERTED,
    SOLVED,
    DONE
}
