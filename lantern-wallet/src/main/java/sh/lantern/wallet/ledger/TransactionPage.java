// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.ledger;

import java.util.List;

import sh.lantern.core.model.TransactionRecord;

/**
 * One page of {@link TransactionLedger#query} results.
 *
 * @param transactions records on this page, newest first
 * @param total        matching records across all pages
 * @param hasMore      whether records exist past this page
 */
public record TransactionPage(List<TransactionRecord> transactions, int total, boolean hasMore) {

    public TransactionPage {
        transactions = List.copyOf(transactions);
    }
}
