// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import sh.lantern.core.error.NetworkException;

class RpcRetryTest {

    private static final RpcRetryConfig FAST = RpcRetryConfig.builder()
            .maxAttempts(3)
            .initialBackoff(Duration.ofMillis(1))
            .maxBackoff(Duration.ofMillis(2))
            .build();

    @Test
    void retriesIoErrors() {
        final AtomicInteger calls = new AtomicInteger();
        String result = RpcRetry.run(
                () -> {
                    if (calls.getAndIncrement() == 0) {
                        throw new NetworkException(-32000, "Network error", null, 1L, new IOException("connection reset"));
                    }
                    return "ok";
                },
                FAST);

        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    void retriesRateLimiting() {
        final AtomicInteger calls = new AtomicInteger();
        String result = RpcRetry.run(
                () -> {
                    if (calls.getAndIncrement() < 2) {
                        throw new NetworkException(-32005, "rate limit exceeded", null, null);
                    }
                    return "done";
                },
                FAST);

        assertEquals("done", result);
        assertEquals(3, calls.get());
    }

    @Test
    void doesNotRetryNotFound() {
        final AtomicInteger calls = new AtomicInteger();
        assertThrows(
                NetworkException.class,
                () -> RpcRetry.run(
                        () -> {
                            calls.incrementAndGet();
                            throw new NetworkException(NetworkException.NOT_FOUND, "Transaction not found", null, null);
                        },
                        FAST));
        assertEquals(1, calls.get());
    }

    @Test
    void doesNotRetryInsufficientBalance() {
        final AtomicInteger calls = new AtomicInteger();
        assertThrows(
                NetworkException.class,
                () -> RpcRetry.run(
                        () -> {
                            calls.incrementAndGet();
                            throw new NetworkException(-32000, "insufficient balance for fee", null, null);
                        },
                        FAST));
        assertEquals(1, calls.get());
    }

    @Test
    void exhaustionRethrowsLastWithEarlierSuppressed() {
        final AtomicInteger calls = new AtomicInteger();
        final NetworkException[] thrown = new NetworkException[3];

        final NetworkException ex = assertThrows(
                NetworkException.class,
                () -> RpcRetry.run(
                        () -> {
                            final int n = calls.getAndIncrement();
                            thrown[n] = new NetworkException(-32000, "timeout " + n, null, null);
                            throw thrown[n];
                        },
                        FAST));

        assertEquals(3, calls.get());
        assertSame(thrown[2], ex);
        assertEquals(2, ex.getSuppressed().length);
    }

    @Test
    void classifiesHttpStatuses() {
        assertTrue(RpcRetry.isRetryable(new NetworkException(-32001, "HTTP error for method x: 503", null, null)));
        assertFalse(RpcRetry.isRetryable(new NetworkException(-32001, "HTTP error for method x: 400", null, null)));
    }

    @Test
    void singleAttemptConfigNeverRetries() {
        final AtomicInteger calls = new AtomicInteger();
        assertThrows(
                NetworkException.class,
                () -> RpcRetry.run(
                        () -> {
                            calls.incrementAndGet();
                            throw new NetworkException(-32000, "timeout", null, null);
                        },
                        RpcRetryConfig.noRetry()));
        assertEquals(1, calls.get());
    }

    @Test
    void rejectsInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> RpcRetryConfig.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> RpcRetryConfig.builder().jitter(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> RpcRetryConfig.builder().maxBackoff(Duration.ofMillis(10)).build());
    }

    @Test
    void backoffDoublesUpToCap() {
        RpcRetryConfig config = RpcRetryConfig.builder()
                .initialBackoff(Duration.ofMillis(100))
                .maxBackoff(Duration.ofMillis(350))
                .build();

        assertEquals(100, config.baseDelayMillis(1));
        assertEquals(200, config.baseDelayMillis(2));
        assertEquals(350, config.baseDelayMillis(3));
        assertEquals(350, config.baseDelayMillis(40));
    }
}
