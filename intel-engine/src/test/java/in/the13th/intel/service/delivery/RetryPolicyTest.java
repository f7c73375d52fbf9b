package in.the13th.intel.service.delivery;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void backoffDoublesUntilCap() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxBackoff(Duration.ofSeconds(30))
            .maxAttempts(10)
            .build();

        assertEquals(Duration.ofSeconds(1), policy.backoffFor(0));
        assertEquals(Duration.ofSeconds(2), policy.backoffFor(1));
        assertEquals(Duration.ofSeconds(16), policy.backoffFor(4));
        assertEquals(Duration.ofSeconds(30), policy.backoffFor(5));
        assertEquals(Duration.ofSeconds(30), policy.backoffFor(500));
    }

    @Test
    void exhaustedAtMaxAttempts() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        assertFalse(policy.isExhausted(2));
        assertTrue(policy.isExhausted(3));
    }

    @Test
    void builderRejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxBackoff(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().build().backoffFor(-1));
    }
}
