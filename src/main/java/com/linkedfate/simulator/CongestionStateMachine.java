package com.linkedfate.simulator;

import java.util.Random;

/**
 * Two-state congestion model stepped once per simulated hour.
 *
 * <pre>
 *   CLEAR --(p = startProbability)--> CONGESTED, severity ~ U[0.3, 0.8)
 *   CONGESTED --(p = resolveProbability)--> CLEAR, severity = 0
 * </pre>
 *
 * <p>All randomness comes from the injected {@link Random}; the same seed replays the same
 * sequence. Not thread-safe.
 */
public class CongestionStateMachine {

    static final double MIN_SEVERITY = 0.3;
    static final double MAX_SEVERITY = 0.8;

    public enum State {
        CLEAR,
        CONGESTED
    }

    private final Random random;
    private final double startProbability;
    private final double resolveProbability;

    private State state = State.CLEAR;
    private double severity;

    public CongestionStateMachine(Random random, double startProbability, double resolveProbability) {
        this.random = random;
        this.startProbability = startProbability;
        this.resolveProbability = resolveProbability;
    }

    /** Advances one step and returns the new state. */
    public State step() {
        if (state == State.CLEAR) {
            if (random.nextDouble() < startProbability) {
                state = State.CONGESTED;
                severity = MIN_SEVERITY + random.nextDouble() * (MAX_SEVERITY - MIN_SEVERITY);
            }
        } else if (random.nextDouble() < resolveProbability) {
            state = State.CLEAR;
            severity = 0.0;
        }
        return state;
    }

    public State getState() {
        return state;
    }

    public boolean isCongested() {
        return state == State.CONGESTED;
    }

    /** 0 when clear. */
    public double getSeverity() {
        return severity;
    }
}
