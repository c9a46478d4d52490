package com.regulatory.conflict.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PairKeyTest {

    @Test
    @DisplayName("Pair key is independent of argument order")
    void testNormalizedOrder() {
        PairKey ab = PairKey.of("A", "B");
        PairKey ba = PairKey.of("B", "A");

        assertEquals(ab, ba);
        assertEquals(ab.hashCode(), ba.hashCode());
        assertEquals("A", ba.first());
        assertEquals("B", ba.second());
    }

    @Test
    @DisplayName("A provision cannot pair with itself")
    void testSelfPairRejected() {
        assertThrows(IllegalArgumentException.class, () -> PairKey.of("A", "A"));
    }

    @Test
    @DisplayName("Other returns the opposite member")
    void testOther() {
        PairKey key = PairKey.of("A", "B");
        assertEquals("B", key.other("A"));
        assertEquals("A", key.other("B"));
        assertThrows(IllegalArgumentException.class, () -> key.other("C"));
    }
}
