// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;

import sh.lantern.core.model.TransactionRecord;

/**
 * {@link TransactionStore} backed by {@code transactions.json}.
 */
public final class JsonTransactionStore implements TransactionStore {

    private static final TypeReference<Document> TYPE = new TypeReference<>() {};

    private final Path file;

    public JsonTransactionStore(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public synchronized List<TransactionRecord> load() {
        return JsonFiles.read(file, TYPE)
                .map(doc -> doc.transactions() == null
                        ? List.<TransactionRecord>of()
                        : List.copyOf(doc.transactions()))
                .orElse(List.of());
    }

    @Override
    public synchronized void save(final List<TransactionRecord> transactions) {
        JsonFiles.write(file, new Document(List.copyOf(transactions)));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(List<TransactionRecord> transactions) {
    }
}
