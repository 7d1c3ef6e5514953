// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import java.time.Duration;
import java.util.Objects;

/**
 * How often and how patiently {@link RpcGateway} repeats a failed read.
 *
 * <p>The wait before retry {@code n} is {@code min(initialBackoff * 2^(n-1), maxBackoff)},
 * stretched by a random fraction in {@code [0, jitter)}.
 *
 * <pre>{@code
 * RpcRetryConfig patient = RpcRetryConfig.builder()
 *     .maxAttempts(5)
 *     .initialBackoff(Duration.ofMillis(500))
 *     .build();
 * }</pre>
 *
 * @param maxAttempts    attempts per call, the first one included
 * @param initialBackoff wait after the first failure
 * @param maxBackoff     cap on any single wait
 * @param jitter         upper bound of the random stretch, in {@code [0, 1]}
 */
public record RpcRetryConfig(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitter) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(200);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(5);
    public static final double DEFAULT_JITTER = 0.25;

    public RpcRetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive, got: " + initialBackoff);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException(
                    "maxBackoff must be >= initialBackoff, got: " + maxBackoff + " < " + initialBackoff);
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got: " + jitter);
        }
    }

    public static RpcRetryConfig defaults() {
        return builder().build();
    }

    /**
     * A single attempt, for callers that must not repeat a request.
     */
    public static RpcRetryConfig noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wait before the retry that follows failed attempt {@code attempt}, without jitter.
     */
    long baseDelayMillis(final int attempt) {
        final long delay = initialBackoff.toMillis() * (1L << Math.min(attempt - 1, 30));
        return Math.min(delay, maxBackoff.toMillis());
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private double jitter = DEFAULT_JITTER;

        private Builder() {
        }

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(final Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(final Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder jitter(final double jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public RpcRetryConfig build() {
            return new RpcRetryConfig(maxAttempts, initialBackoff, maxBackoff, jitter);
        }
    }
}
