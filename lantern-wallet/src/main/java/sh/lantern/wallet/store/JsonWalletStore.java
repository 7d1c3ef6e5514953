// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;

import sh.lantern.core.model.EncryptedWalletRecord;

/**
 * {@link WalletStore} backed by {@code wallet.json}.
 */
public final class JsonWalletStore implements WalletStore {

    private static final TypeReference<EncryptedWalletRecord> TYPE = new TypeReference<>() {};

    private final Path file;

    public JsonWalletStore(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public synchronized Optional<EncryptedWalletRecord> load() {
        return JsonFiles.read(file, TYPE);
    }

    @Override
    public synchronized void save(final EncryptedWalletRecord record) {
        JsonFiles.write(file, Objects.requireNonNull(record, "record"));
    }

    @Override
    public synchronized void delete() {
        JsonFiles.delete(file);
    }
}
