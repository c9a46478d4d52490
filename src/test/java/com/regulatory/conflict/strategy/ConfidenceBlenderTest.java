package com.regulatory.conflict.strategy;

import com.regulatory.conflict.analytics.StatKey;
import com.regulatory.conflict.analytics.StrategyOutcomeStat;
import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.StrategyKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceBlenderTest {

    private static final StatKey KEY = new StatKey(ConflictType.HIERARCHICAL, "US", StrategyKind.LEX_SUPERIOR);

    private final ConfidenceBlender blender = new ConfidenceBlender(10.0, 0.5);

    private static StrategyOutcomeStat stat(long success, long failure) {
        return new StrategyOutcomeStat(KEY, success, failure, Instant.EPOCH);
    }

    @Test
    void noHistory_keepsRawConfidence() {
        BlendedConfidence blended = blender.blend(0.93, null);

        assertEquals(0.93, blended.combined(), 1e-9);
        assertEquals(0.5, blended.prior(), 1e-9);
        assertEquals(0.0, blended.weight(), 1e-9);
    }

    @Test
    void emptyStat_behavesLikeNoHistory() {
        assertEquals(0.7, blender.blend(0.7, StrategyOutcomeStat.empty(KEY)).combined(), 1e-9);
    }

    @Test
    void successfulHistory_raisesConfidence() {
        BlendedConfidence blended = blender.blend(0.6, stat(10, 0));

        // prior 11/12, weight 0.5 * 10 / 20
        assertEquals(0.25, blended.weight(), 1e-9);
        assertEquals(0.75 * 0.6 + 0.25 * 11.0 / 12.0, blended.combined(), 1e-9);
        assertTrue(blended.combined() > 0.6);
    }

    @Test
    void failingHistory_canPushBelowThreshold() {
        BlendedConfidence blended = blender.blend(0.7, stat(0, 90));

        // weight 0.5 * 90 / 100 = 0.45, prior 1/92
        assertEquals(0.45, blended.weight(), 1e-9);
        assertTrue(blended.combined() < 0.6);
    }

    @Test
    void weight_neverExceedsMaximum() {
        BlendedConfidence blended = blender.blend(1.0, stat(0, 1_000_000));
        assertTrue(blended.weight() < 0.5);
        assertTrue(blended.combined() > 0.5);
    }

    @Test
    void invalidParameters_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceBlender(0.0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceBlender(10.0, 1.5));
    }
}
