// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.model;

import java.math.BigDecimal;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import org.jspecify.annotations.Nullable;

/**
 * One entry of the persisted transaction log.
 *
 * <p>
 * Records are immutable; reconciliation replaces an entry with a copy made through
 * {@link #reconciled}. {@code timestamp} is the submission time in epoch milliseconds and orders
 * the log (newest first).
 *
 * @param id            internal id, unique per installation
 * @param txId          chain transaction id
 * @param kind          what the transaction does
 * @param programId     executed program, for {@link TransactionKind#EXECUTE}
 * @param functionName  executed function, for {@link TransactionKind#EXECUTE}
 * @param from          sender address
 * @param to            recipient address
 * @param amount        credits moved
 * @param fee           fee in credits; replaced by the on-chain fee once reported
 * @param status        lifecycle state
 * @param timestamp     submission time, epoch millis
 * @param blockHeight   including block, once known
 * @param confirmations confirmations, once known
 * @param error         failure reason
 * @param memo          free-form user note
 * @param explorerUrl   block explorer link for {@code txId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionRecord(
        String id,
        String txId,
        TransactionKind kind,
        @Nullable String programId,
        @Nullable String functionName,
        @Nullable String from,
        @Nullable String to,
        @Nullable BigDecimal amount,
        @Nullable BigDecimal fee,
        TransactionStatus status,
        long timestamp,
        @Nullable Long blockHeight,
        @Nullable Integer confirmations,
        @Nullable String error,
        @Nullable String memo,
        @Nullable String explorerUrl) {

    public TransactionRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Returns a copy carrying the result of a reconciliation. Null arguments keep the current
     * value, except {@code error}, which is replaced as given.
     */
    public TransactionRecord reconciled(
            final TransactionStatus newStatus,
            final @Nullable Long newBlockHeight,
            final @Nullable Integer newConfirmations,
            final @Nullable BigDecimal newFee,
            final @Nullable String newError) {
        return new TransactionRecord(
                id,
                txId,
                kind,
                programId,
                functionName,
                from,
                to,
                amount,
                newFee != null ? newFee : fee,
                newStatus,
                timestamp,
                newBlockHeight != null ? newBlockHeight : blockHeight,
                newConfirmations != null ? newConfirmations : confirmations,
                newError,
                memo,
                explorerUrl);
    }

    public TransactionRecord withFrom(final String sender) {
        return new TransactionRecord(
                id, txId, kind, programId, functionName, sender, to, amount, fee, status, timestamp,
                blockHeight, confirmations, error, memo, explorerUrl);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == TransactionStatus.PENDING;
    }

    public boolean matches(final String idOrTxId) {
        return id.equals(idOrTxId) || txId.equals(idOrTxId);
    }
}
