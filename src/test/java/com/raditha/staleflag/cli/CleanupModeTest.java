package com.raditha.staleflag.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CleanupMode.
 */
class CleanupModeTest {

    @Test
    void testFromString() {
        assertEquals(CleanupMode.DRY_RUN, CleanupMode.fromString("dry-run"));
        assertEquals(CleanupMode.APPLY, CleanupMode.fromString("APPLY"));
        assertThrows(IllegalArgumentException.class, () -> CleanupMode.fromString("interactive"));
        assertThrows(IllegalArgumentException.class, () -> CleanupMode.fromString(null));
    }

    @Test
    void testCliStringRoundTrip() {
        for (CleanupMode mode : CleanupMode.values()) {
            assertEquals(mode, CleanupMode.fromString(mode.toCliString()));
        }
    }
}
