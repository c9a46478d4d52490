package com.regulatory.conflict.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConflictTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private static Conflict detected() {
        return Conflict.builder()
                .pairKey(PairKey.of("A", "B"))
                .type(ConflictType.HIERARCHICAL)
                .severity(0.5)
                .evidence(ConflictEvidence.builder().authorityGap(1).build())
                .detectedAt(T0)
                .build();
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should walk the happy path and bump the version each step")
        void testHappyPath() {
            Conflict c = detected();
            Conflict selected = c.withSelectedStrategy(StrategyKind.LEX_SUPERIOR, T0);
            Conflict applied = selected.transitionTo(ConflictStatus.APPLIED, T0);
            Conflict resolved = applied.transitionTo(ConflictStatus.RESOLVED, T0);

            assertEquals(0, c.getVersion());
            assertEquals(3, resolved.getVersion());
            assertEquals(ConflictStatus.RESOLVED, resolved.getStatus());
            assertEquals(StrategyKind.LEX_SUPERIOR, resolved.getSelectedStrategy().orElseThrow());
            assertEquals(c.getId(), resolved.getId());
        }

        @Test
        @DisplayName("Should reject skipping straight to RESOLVED")
        void testIllegalTransition() {
            assertThrows(IllegalStateException.class,
                    () -> detected().transitionTo(ConflictStatus.RESOLVED, T0));
        }

        @Test
        @DisplayName("Should record the failure reason and clear it when re-detected")
        void testFailureReason() {
            Conflict escalated = detected().withFailure(ConflictStatus.ESCALATED, FailureReason.LOW_CONFIDENCE, T0);
            assertEquals(FailureReason.LOW_CONFIDENCE, escalated.getFailureReason().orElseThrow());

            Conflict reopened = escalated.transitionTo(ConflictStatus.DETECTED, T0);
            assertTrue(reopened.getFailureReason().isEmpty());
        }

        @ParameterizedTest
        @EnumSource(value = ConflictStatus.class, names = {"RESOLVED", "ESCALATED", "FAILED"})
        @DisplayName("Terminal states can only go back to DETECTED")
        void testTerminalStates(ConflictStatus terminal) {
            assertTrue(terminal.isTerminal());
            assertTrue(terminal.canTransitionTo(ConflictStatus.DETECTED));
            assertFalse(terminal.canTransitionTo(ConflictStatus.APPLIED));
        }
    }

    @Test
    @DisplayName("Should reject severity outside [0, 1]")
    void testSeverityRange() {
        assertThrows(IllegalArgumentException.class, () -> detected().toBuilder().severity(1.5).build());
    }

    @Test
    @DisplayName("Should know which provisions it involves")
    void testInvolves() {
        Conflict c = detected();
        assertTrue(c.involves("A"));
        assertTrue(c.involves("B"));
        assertFalse(c.involves("C"));
    }
}
