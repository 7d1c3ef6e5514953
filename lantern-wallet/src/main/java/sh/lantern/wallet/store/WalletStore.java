// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import java.util.Optional;

import sh.lantern.core.model.EncryptedWalletRecord;

/**
 * Persistence for the single encrypted wallet record.
 *
 * <p>Implementations throw {@link sh.lantern.core.error.StorageException} on I/O failure.
 */
public interface WalletStore {

    Optional<EncryptedWalletRecord> load();

    void save(EncryptedWalletRecord record);

    void delete();

    default boolean exists() {
        return load().isPresent();
    }
}
