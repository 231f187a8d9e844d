package dev.melt.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class OperationLimiterTest {

    @Test
    void permitIsReleasedExactlyOnce() throws Exception {
        var limiter = new OperationLimiter(2);
        var permit = limiter.acquire();
        assertEquals(1, limiter.available());
        permit.close();
        permit.close();
        assertEquals(2, limiter.available());
    }

    @Test
    void tryWithResourcesReleases() throws Exception {
        var limiter = new OperationLimiter(1);
        try (var permit = limiter.acquire()) {
            assertEquals(0, limiter.available());
        }
        assertEquals(1, limiter.available());
        assertEquals(1, limiter.capacity());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new OperationLimiter(0));
    }
}
