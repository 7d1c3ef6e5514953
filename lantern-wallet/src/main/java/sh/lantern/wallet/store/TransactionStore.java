// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import java.util.List;

import sh.lantern.core.model.TransactionRecord;

/**
 * Persistence for the transaction log. {@link #save} replaces the whole log and keeps its order.
 */
public interface TransactionStore {

    List<TransactionRecord> load();

    void save(List<TransactionRecord> transactions);
}
