package com.linkedfate.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;

import com.linkedfate.simulator.CongestionStateMachine;
import com.linkedfate.simulator.CongestionStateMachine.State;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CongestionStateMachineTest {

    private static List<Double> run(long seed, int steps) {
        CongestionStateMachine machine = new CongestionStateMachine(new Random(seed), 0.05, 0.20);
        List<Double> severities = new ArrayList<>();
        for (int i = 0; i < steps; i++) {
            machine.step();
            severities.add(machine.getSeverity());
        }
        return severities;
    }

    @Test
    @DisplayName("same seed replays the same sequence")
    void deterministic() {
        assertThat(run(42L, 500)).isEqualTo(run(42L, 500));
    }

    @Test
    @DisplayName("starts clear with zero severity")
    void initialState() {
        CongestionStateMachine machine = new CongestionStateMachine(new Random(1L), 0.05, 0.20);

        assertThat(machine.getState()).isEqualTo(State.CLEAR);
        assertThat(machine.isCongested()).isFalse();
        assertThat(machine.getSeverity()).isZero();
    }

    @Test
    @DisplayName("a congestion event draws its severity from [0.3, 0.8) and persists until resolved")
    void congestionPersists() {
        CongestionStateMachine machine = new CongestionStateMachine(new Random(7L), 1.0, 0.0);

        assertThat(machine.step()).isEqualTo(State.CONGESTED);
        double severity = machine.getSeverity();
        assertThat(severity).isGreaterThanOrEqualTo(0.3).isLessThan(0.8);
        for (int i = 0; i < 50; i++) {
            assertThat(machine.step()).isEqualTo(State.CONGESTED);
        }
        assertThat(machine.getSeverity()).isEqualTo(severity);
    }

    @Test
    @DisplayName("resolving resets severity to zero")
    void resolves() {
        CongestionStateMachine machine = new CongestionStateMachine(new Random(7L), 1.0, 1.0);

        assertThat(machine.step()).isEqualTo(State.CONGESTED);
        assertThat(machine.step()).isEqualTo(State.CLEAR);
        assertThat(machine.getSeverity()).isZero();
    }

    @Test
    @DisplayName("zero start probability never congests")
    void neverStarts() {
        CongestionStateMachine machine = new CongestionStateMachine(new Random(3L), 0.0, 0.2);

        for (int i = 0; i < 1000; i++) {
            assertThat(machine.step()).isEqualTo(State.CLEAR);
        }
    }
}
