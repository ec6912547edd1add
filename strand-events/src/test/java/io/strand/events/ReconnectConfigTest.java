// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ReconnectConfigTest {

    @Test
    void defaults() {
        ReconnectConfig config = ReconnectConfig.defaults();
        assertEquals(500, config.backoffBaseMs());
        assertEquals(30_000, config.backoffMaxMs());
        assertEquals(0.10, config.jitterMin());
        assertEquals(0.25, config.jitterMax());
    }

    @Test
    void delayGrowsExponentiallyWithJitter() {
        ReconnectConfig config = ReconnectConfig.builder().backoffBaseMs(100).backoffMaxMs(10_000).build();

        for (int i = 0; i < 50; i++) {
            assertBetween(110, 125, config.delayMillis(1));
            assertBetween(220, 250, config.delayMillis(2));
            assertBetween(440, 500, config.delayMillis(3));
        }
    }

    @Test
    void delayIsCappedAtMax() {
        ReconnectConfig config = ReconnectConfig.builder().backoffBaseMs(100).backoffMaxMs(1_000).build();

        assertBetween(1_100, 1_250, config.delayMillis(10));
        assertBetween(1_100, 1_250, config.delayMillis(Long.MAX_VALUE));
    }

    @ParameterizedTest
    @ValueSource(longs = {0, -1})
    void rejectsNonPositiveAttempt(long attempt) {
        assertThrows(IllegalArgumentException.class, () -> ReconnectConfig.defaults().delayMillis(attempt));
    }

    @Test
    void validatesParameters() {
        assertThrows(IllegalArgumentException.class, () -> ReconnectConfig.builder().backoffBaseMs(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ReconnectConfig.builder().backoffBaseMs(100).backoffMaxMs(50).build());
        assertThrows(IllegalArgumentException.class, () -> ReconnectConfig.builder().jitterMin(-0.1).build());
        assertThrows(IllegalArgumentException.class,
                () -> ReconnectConfig.builder().jitterMin(0.3).jitterMax(0.2).build());
    }

    private static void assertBetween(long min, long max, long actual) {
        assertTrue(actual >= min && actual <= max, actual + " not in [" + min + ", " + max + "]");
    }
}
