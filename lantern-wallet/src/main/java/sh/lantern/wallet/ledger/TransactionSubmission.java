// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.ledger;

import java.math.BigDecimal;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.lantern.core.model.TransactionKind;

/**
 * What the caller knows about a transaction at the moment the gateway accepted it.
 *
 * <p>Use {@link #send} and {@link #execute} for the two shapes the wallet submits itself.
 *
 * @param txId         id returned by the gateway
 * @param kind         what the transaction does
 * @param programId    executed program, for executions
 * @param functionName executed function, for executions
 * @param from         sender; filled from the bound wallet address when {@code null}
 * @param to           recipient
 * @param amount       credits moved
 * @param fee          fee paid, in credits
 * @param memo         free-form note
 */
public record TransactionSubmission(
        String txId,
        TransactionKind kind,
        @Nullable String programId,
        @Nullable String functionName,
        @Nullable String from,
        @Nullable String to,
        @Nullable BigDecimal amount,
        @Nullable BigDecimal fee,
        @Nullable String memo) {

    public TransactionSubmission {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(kind, "kind");
        if (txId.isBlank()) {
            throw new IllegalArgumentException("txId cannot be blank");
        }
    }

    public static TransactionSubmission send(
            final String txId,
            final @Nullable String from,
            final String to,
            final BigDecimal amount,
            final BigDecimal fee) {
        return new TransactionSubmission(txId, TransactionKind.SEND, null, null, from, to, amount, fee, null);
    }

    public static TransactionSubmission execute(
            final String txId,
            final @Nullable String from,
            final String programId,
            final String functionName,
            final BigDecimal fee) {
        return new TransactionSubmission(
                txId, TransactionKind.EXECUTE, programId, functionName, from, null, null, fee, null);
    }
}
