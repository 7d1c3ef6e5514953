// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.chain;

import java.math.BigDecimal;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.jspecify.annotations.Nullable;

/**
 * Raw on-chain view of a submitted transaction, as reported by the blockchain client.
 *
 * @param txId          transaction id ({@code at1...})
 * @param status        free-form status text, e.g. {@code accepted} or {@code rejected}
 * @param blockHeight   height of the including block, if any
 * @param confirmations blocks on top of the including block, if reported
 * @param fee           fee actually paid in credits, if reported
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChainTransaction(
        String txId,
        String status,
        @Nullable Long blockHeight,
        @Nullable Integer confirmations,
        @Nullable BigDecimal fee) {

    public ChainTransaction {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(status, "status");
    }
}
