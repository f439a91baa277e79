package com.meteor.astrometry.util;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ArrayChecksTest {

    @Test
    void mismatchNamesBothArrays() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ArrayChecks.requireSameLength("ra", new double[2], "dec", new double[3]));
        assertTrue(e.getMessage().contains("ra"));
        assertTrue(e.getMessage().contains("dec"));
        assertTrue(e.getMessage().contains("2 != 3"));
    }

    @Test
    void nullAndEmpty() {
        assertThrows(IllegalArgumentException.class, () -> ArrayChecks.requireSameLength("a", null, "b", new double[0]));
        assertThrows(IllegalArgumentException.class, () -> ArrayChecks.requireNonEmpty("a", new double[0]));
        assertDoesNotThrow(() -> ArrayChecks.requireNonEmpty("a", new double[1]));
    }
}
