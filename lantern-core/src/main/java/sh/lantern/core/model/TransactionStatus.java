// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a recorded transaction.
 */
public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    /**
     * Maps free-form chain status text onto a lifecycle state.
     *
     * <p>Text containing {@code accept}, {@code confirmed} or {@code finalized} is
     * {@link #CONFIRMED}; text containing {@code reject}, {@code failed} or {@code aborted} is
     * {@link #FAILED}; anything else is still {@link #PENDING}. Matching ignores case.
     */
    public static TransactionStatus classify(final String chainStatus) {
        if (chainStatus == null) {
            return PENDING;
        }
        final String s = chainStatus.toLowerCase(Locale.ROOT);
        if (s.contains("accept") || s.contains("confirmed") || s.contains("finalized")) {
            return CONFIRMED;
        }
        if (s.contains("reject") || s.contains("failed") || s.contains("aborted")) {
            return FAILED;
        }
        return PENDING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TransactionStatus fromWireName(final String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
