// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.lantern.core.error.NetworkException;

/**
 * Retries read-only gateway calls on transient failures with exponential backoff.
 *
 * <p>
 * <strong>Retry Conditions:</strong>
 * <ul>
 * <li>✅ I/O failures (connection refused, reset, timeouts)</li>
 * <li>✅ "timeout", "rate limit", "too many requests", "429"</li>
 * <li>✅ "internal error", "-32603", "server busy", "overloaded", "try again"</li>
 * <li>✅ HTTP 502, 503, 504</li>
 * <li>❌ Not-found ({@value NetworkException#NOT_FOUND})</li>
 * <li>❌ "insufficient" balance or fee errors</li>
 * </ul>
 *
 * <p>
 * When every attempt fails, the last {@link NetworkException} is rethrown with the earlier ones
 * attached as suppressed exceptions.
 *
 * <p>
 * Submissions are never routed through here: a resent transfer could be broadcast twice.
 *
 * <p>
 * <strong>Thread Interruption:</strong> interruption during backoff stops the loop and rethrows
 * the last failure with the {@link InterruptedException} suppressed.
 */
final class RpcRetry {

    private static final Logger log = LoggerFactory.getLogger(RpcRetry.class);

    private RpcRetry() {
    }

    static <T> T run(final Supplier<T> supplier, final RpcRetryConfig config) {
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(config, "config");

        List<NetworkException> failedAttempts = null;
        for (int attempt = 1; ; attempt++) {
            try {
                return supplier.get();
            } catch (NetworkException e) {
                if (!isRetryable(e) || attempt >= config.maxAttempts()) {
                    throw exhausted(e, failedAttempts);
                }
                if (failedAttempts == null) {
                    failedAttempts = new ArrayList<>();
                }
                failedAttempts.add(e);
                log.debug("retrying after attempt {}/{} failed: {}", attempt, config.maxAttempts(), e.getMessage());
            }

            try {
                Thread.sleep(backoff(attempt, config));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                final NetworkException last = failedAttempts.remove(failedAttempts.size() - 1);
                last.addSuppressed(ie);
                throw exhausted(last, failedAttempts);
            }
        }
    }

    static boolean isRetryable(final NetworkException e) {
        if (e == null || e.isNotFound() || e.isInsufficientBalance()) {
            return false;
        }
        if (hasIoCause(e)) {
            return true;
        }
        if (e.code() == HttpGatewayProvider.HTTP_ERROR) {
            final String message = String.valueOf(e.getMessage());
            return message.endsWith(": 502") || message.endsWith(": 503") || message.endsWith(": 504")
                    || message.endsWith(": 429");
        }
        if (e.getMessage() == null) {
            return false;
        }
        final String message = e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("timeout")
                || message.contains("timed out")
                || message.contains("connection reset")
                || message.contains("temporarily unavailable")
                || message.contains("try again")
                || message.contains("rate limit")
                || message.contains("too many requests")
                || message.contains("429")
                || message.contains("internal error")
                || message.contains("-32603")
                || message.contains("server busy")
                || message.contains("overloaded");
    }

    private static NetworkException exhausted(final NetworkException last, final List<NetworkException> earlier) {
        if (earlier != null) {
            for (final NetworkException e : earlier) {
                last.addSuppressed(e);
            }
        }
        return last;
    }

    private static long backoff(final int attempt, final RpcRetryConfig config) {
        final long delay = config.baseDelayMillis(attempt);
        if (config.jitter() == 0) {
            return delay;
        }
        return delay + (long) (delay * ThreadLocalRandom.current().nextDouble(config.jitter()));
    }

    private static boolean hasIoCause(final Throwable e) {
        Throwable current = e.getCause();
        while (current != null) {
            if (current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
