// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import sh.lantern.core.error.StorageException;
import sh.lantern.core.model.EncryptedWalletRecord;
import sh.lantern.core.model.SitePermission;
import sh.lantern.core.model.TransactionKind;
import sh.lantern.core.model.TransactionRecord;
import sh.lantern.core.model.TransactionStatus;
import sh.lantern.core.types.Capability;

class JsonStoresTest {

    private static final String ADDRESS = "aleo1" + "qpzry9x8gf".repeat(5) + "2tvdw0s3";

    @TempDir
    Path dir;

    @Test
    void walletStoreRoundTripsAndDeletes() {
        JsonWalletStore store = new JsonWalletStore(dir.resolve("nested/wallet.json"));
        assertFalse(store.exists());

        EncryptedWalletRecord record = new EncryptedWalletRecord("aa", "bb", "cc", "dd", "ee", 1L, 2L);
        store.save(record);

        assertTrue(Files.exists(dir.resolve("nested/wallet.json")));
        assertFalse(Files.exists(dir.resolve("nested/wallet.json.tmp")));
        assertEquals(record, store.load().orElseThrow());

        store.delete();
        assertTrue(store.load().isEmpty());
    }

    @Test
    void permissionStoreKeysByOrigin() throws Exception {
        JsonPermissionStore store = new JsonPermissionStore(dir.resolve("permissions.json"));
        assertTrue(store.load().isEmpty());

        SitePermission site = new SitePermission(
                "https://app.example", EnumSet.of(Capability.CONNECT, Capability.VIEW_KEY), ADDRESS, 10L, 20L);
        store.save(List.of(site));

        String json = Files.readString(dir.resolve("permissions.json"));
        assertTrue(json.contains("\"sites\""));
        assertTrue(json.contains("\"https://app.example\""));
        assertTrue(json.contains("\"viewKey\""));
        assertEquals(List.of(site), store.load());
    }

    @Test
    void transactionStoreKeepsOrderAndPlainAmounts() throws Exception {
        JsonTransactionStore store = new JsonTransactionStore(dir.resolve("transactions.json"));
        TransactionRecord newer = record("r2", "at2", 2_000L);
        TransactionRecord older = record("r1", "at1", 1_000L);

        store.save(List.of(newer, older));

        String json = Files.readString(dir.resolve("transactions.json"));
        assertTrue(json.contains("\"amount\" : 0.0000001"), json);
        assertTrue(json.contains("\"status\" : \"pending\""));
        assertFalse(json.contains("blockHeight"));
        assertEquals(List.of(newer, older), store.load());
    }

    @Test
    void corruptFileIsStorageError() throws Exception {
        Files.writeString(dir.resolve("wallet.json"), "{ not json");
        JsonWalletStore store = new JsonWalletStore(dir.resolve("wallet.json"));

        StorageException ex = assertThrows(StorageException.class, store::load);
        assertTrue(ex.getMessage().contains("wallet.json"));
    }

    private static TransactionRecord record(final String id, final String txId, final long timestamp) {
        return new TransactionRecord(id, txId, TransactionKind.SEND, null, null, ADDRESS, ADDRESS,
                new BigDecimal("0.0000001"), new BigDecimal("0.01"), TransactionStatus.PENDING, timestamp,
                null, null, null, null, null);
    }
}
