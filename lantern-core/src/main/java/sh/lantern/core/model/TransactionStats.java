// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.model;

import java.math.BigDecimal;

/**
 * Aggregate view over the transaction log.
 *
 * <p>Counts span every record; the monetary totals only include {@link TransactionStatus#CONFIRMED}
 * records.
 */
public record TransactionStats(
        int total,
        int pending,
        int confirmed,
        int failed,
        BigDecimal totalSent,
        BigDecimal totalReceived,
        BigDecimal totalFees) {
}
