package in.the13th.intel.service.delivery;

import java.time.Duration;

/**
 * Exponential backoff for the delivery retry queue.
 *
 * After {@code attempts} failed retries the next attempt is due
 * {@code min(2^attempts seconds, maxBackoff)} later. Once {@code attempts} reaches
 * {@code maxAttempts} the entry is dead-lettered.
 *
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxBackoff(Duration.ofHours(1))
 *     .maxAttempts(8)
 *     .build();
 * </pre>
 */
public final class RetryPolicy {

    private final Duration maxBackoff;
    private final int maxAttempts;

    private RetryPolicy(Duration maxBackoff, int maxAttempts) {
        this.maxBackoff = maxBackoff;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the next attempt, given the number of failures recorded so far.
     */
    public Duration backoffFor(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative");
        }
        // 2^62 seconds overflows Duration long before the cap matters
        if (attempts >= 62) {
            return maxBackoff;
        }
        Duration exp = Duration.ofSeconds(1L << attempts);
        return exp.compareTo(maxBackoff) > 0 ? maxBackoff : exp;
    }

    public boolean isExhausted(int attempts) {
        return attempts >= maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration maxBackoff = Duration.ofHours(1);
        private int maxAttempts = 8;

        public Builder maxBackoff(Duration maxBackoff) {
            if (maxBackoff.isNegative() || maxBackoff.isZero()) {
                throw new IllegalArgumentException("Max backoff must be positive");
            }
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxBackoff, maxAttempts);
        }
    }
}
