// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.ledger;

import org.jspecify.annotations.Nullable;

import sh.lantern.core.model.TransactionKind;
import sh.lantern.core.model.TransactionStatus;

/**
 * Filter and page window for {@link TransactionLedger#query}.
 *
 * @param kind   only records of this kind, or any
 * @param status only records in this state, or any
 * @param offset records to skip (must be &gt;= 0)
 * @param limit  page size (must be &gt; 0, default {@value #DEFAULT_LIMIT})
 */
public record TransactionQuery(
        @Nullable TransactionKind kind,
        @Nullable TransactionStatus status,
        int offset,
        int limit) {

    public static final int DEFAULT_LIMIT = 20;

    public TransactionQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
    }

    public static TransactionQuery firstPage() {
        return new TransactionQuery(null, null, 0, DEFAULT_LIMIT);
    }

    public TransactionQuery withKind(final @Nullable TransactionKind newKind) {
        return new TransactionQuery(newKind, status, offset, limit);
    }

    public TransactionQuery withStatus(final @Nullable TransactionStatus newStatus) {
        return new TransactionQuery(kind, newStatus, offset, limit);
    }

    public TransactionQuery page(final int newOffset, final int newLimit) {
        return new TransactionQuery(kind, status, newOffset, newLimit);
    }
}
