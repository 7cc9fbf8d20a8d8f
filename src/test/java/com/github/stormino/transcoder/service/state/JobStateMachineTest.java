package com.github.stormino.transcoder.service.state;

import com.github.stormino.transcoder.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobStateMachine")
class JobStateMachineTest {

    private JobStateMachine stateMachine;
    private static final String JOB_ID = "test-job-123";

    @BeforeEach
    void setUp() {
        stateMachine = new JobStateMachine();
    }

    @Nested
    @DisplayName("isValidTransition")
    class IsValidTransitionTests {

        @Test
        @DisplayName("same state should always be valid (idempotent)")
        void sameStateShouldAlwaysBeValid() {
            for (JobStatus status : JobStatus.values()) {
                assertTrue(stateMachine.isValidTransition(status, status),
                        "Same state transition should be valid for " + status);
            }
        }

        @Test
        @DisplayName("STARTED can transition to IN_PROGRESS")
        void startedCanTransitionToInProgress() {
            assertTrue(stateMachine.isValidTransition(JobStatus.STARTED, JobStatus.IN_PROGRESS));
        }

        @Test
        @DisplayName("STARTED can transition directly to DONE")
        void startedCanTransitionDirectlyToDone() {
            assertTrue(stateMachine.isValidTransition(JobStatus.STARTED, JobStatus.DONE));
        }

        @Test
        @DisplayName("IN_PROGRESS can transition to DONE and ERROR")
        void inProgressCanFinish() {
            assertTrue(stateMachine.isValidTransition(JobStatus.IN_PROGRESS, JobStatus.DONE));
            assertTrue(stateMachine.isValidTransition(JobStatus.IN_PROGRESS, JobStatus.ERROR));
        }

        @Test
        @DisplayName("IN_PROGRESS cannot go back to STARTED")
        void inProgressCannotGoBack() {
            assertFalse(stateMachine.isValidTransition(JobStatus.IN_PROGRESS, JobStatus.STARTED));
        }

        @ParameterizedTest
        @EnumSource(value = JobStatus.class, names = {"STARTED", "IN_PROGRESS"})
        @DisplayName("terminal states cannot be left")
        void terminalStatesCannotBeLeft(JobStatus target) {
            assertFalse(stateMachine.isValidTransition(JobStatus.DONE, target));
            assertFalse(stateMachine.isValidTransition(JobStatus.ERROR, target));
        }

        @Test
        @DisplayName("DONE and ERROR cannot replace each other")
        void doneAndErrorAreExclusive() {
            assertFalse(stateMachine.isValidTransition(JobStatus.DONE, JobStatus.ERROR));
            assertFalse(stateMachine.isValidTransition(JobStatus.ERROR, JobStatus.DONE));
        }
    }

    @Nested
    @DisplayName("transition")
    class TransitionTests {

        @Test
        @DisplayName("should return new state for valid transition")
        void shouldReturnNewStateForValidTransition() {
            assertEquals(JobStatus.IN_PROGRESS,
                    stateMachine.transition(JOB_ID, JobStatus.STARTED, JobStatus.IN_PROGRESS));
        }

        @Test
        @DisplayName("should keep current state for invalid transition")
        void shouldKeepCurrentStateForInvalidTransition() {
            assertEquals(JobStatus.DONE,
                    stateMachine.transition(JOB_ID, JobStatus.DONE, JobStatus.IN_PROGRESS));
        }

        @Test
        @DisplayName("should reject null arguments")
        void shouldRejectNullArguments() {
            assertThrows(NullPointerException.class,
                    () -> stateMachine.transition(JOB_ID, null, JobStatus.DONE));
        }
    }

    @Nested
    @DisplayName("JobStatus.isTerminal")
    class TerminalStatusTests {

        @ParameterizedTest
        @EnumSource(value = JobStatus.class, names = {"DONE", "ERROR"})
        @DisplayName("DONE and ERROR are terminal")
        void doneAndErrorAreTerminal(JobStatus status) {
            assertTrue(status.isTerminal());
        }

        @ParameterizedTest
        @EnumSource(value = JobStatus.class, names = {"STARTED", "IN_PROGRESS"})
        @DisplayName("STARTED and IN_PROGRESS are not terminal")
        void runningStatesAreNotTerminal(JobStatus status) {
            assertFalse(status.isTerminal());
        }
    }
}
