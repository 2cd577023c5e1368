package com.example.quorum.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @ParameterizedTest
    @CsvSource({
        "PENDING, READY, true",
        "PENDING, FAILED, true",
        "PENDING, RUNNING, false",
        "READY, RUNNING, true",
        "READY, SUCCEEDED, false",
        "RUNNING, AWAITING_CONSENSUS, true",
        "RUNNING, SUCCEEDED, true",
        "AWAITING_CONSENSUS, RUNNING, true",
        "AWAITING_CONSENSUS, READY, false",
        "SUCCEEDED, FAILED, false",
        "FAILED, READY, false"
    })
    void testTransitions(TaskStatus from, TaskStatus to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @Test
    void testTerminalAndInFlight() {
        assertTrue(TaskStatus.SUCCEEDED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertFalse(TaskStatus.AWAITING_CONSENSUS.isTerminal());
        assertTrue(TaskStatus.RUNNING.isInFlight());
        assertTrue(TaskStatus.AWAITING_CONSENSUS.isInFlight());
        assertFalse(TaskStatus.READY.isInFlight());
        assertFalse(TaskStatus.RUNNING.canTransitionTo(null));
    }
}
