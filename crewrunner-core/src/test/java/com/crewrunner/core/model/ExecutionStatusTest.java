package com.crewrunner.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(ExecutionStatus.COMPLETED.isTerminal());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertTrue(ExecutionStatus.CANCELLED.isTerminal());
        assertTrue(ExecutionStatus.TIMEOUT.isTerminal());

        assertFalse(ExecutionStatus.RUNNING.isTerminal());
        assertFalse(ExecutionStatus.STOPPING.isTerminal());
    }

    @Test
    void acceptsStop_shouldOnlyAcceptWhileRunning() {
        assertTrue(ExecutionStatus.RUNNING.acceptsStop());

        assertFalse(ExecutionStatus.STOPPING.acceptsStop());
        assertFalse(ExecutionStatus.COMPLETED.acceptsStop());
        assertFalse(ExecutionStatus.CANCELLED.acceptsStop());
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowStoppingAndTerminalStates() {
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.STOPPING));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.CANCELLED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.TIMEOUT));

        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.RUNNING));
    }

    @Test
    void canTransitionTo_fromStopping_shouldOnlyAllowTerminalStates() {
        assertTrue(ExecutionStatus.STOPPING.canTransitionTo(ExecutionStatus.CANCELLED));
        // work may settle on its own before the stop lands
        assertTrue(ExecutionStatus.STOPPING.canTransitionTo(ExecutionStatus.COMPLETED));

        assertFalse(ExecutionStatus.STOPPING.canTransitionTo(ExecutionStatus.RUNNING));
        assertFalse(ExecutionStatus.STOPPING.canTransitionTo(ExecutionStatus.STOPPING));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (ExecutionStatus terminal : new ExecutionStatus[] {
            ExecutionStatus.COMPLETED, ExecutionStatus.FAILED,
            ExecutionStatus.CANCELLED, ExecutionStatus.TIMEOUT}) {
            for (ExecutionStatus target : ExecutionStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }
}
