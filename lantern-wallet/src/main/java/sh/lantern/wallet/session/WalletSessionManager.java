// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.session;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.lantern.core.LogFormatter;
import sh.lantern.core.Trace;
import sh.lantern.core.chain.Balance;
import sh.lantern.core.chain.BlockchainGateway;
import sh.lantern.core.chain.ChainRecord;
import sh.lantern.core.chain.GeneratedAccount;
import sh.lantern.core.chain.ImportedAccount;
import sh.lantern.core.crypto.KeyFormats;
import sh.lantern.core.crypto.KeyMaterial;
import sh.lantern.core.crypto.PasswordHash;
import sh.lantern.core.crypto.SealedPayload;
import sh.lantern.core.crypto.SecretBuffer;
import sh.lantern.core.crypto.SecretCipher;
import sh.lantern.core.error.AuthenticationException;
import sh.lantern.core.error.InvalidKeyFormatException;
import sh.lantern.core.error.InvalidPasswordException;
import sh.lantern.core.error.NetworkException;
import sh.lantern.core.error.NoWalletException;
import sh.lantern.core.error.ValidationException;
import sh.lantern.core.error.WalletExistsException;
import sh.lantern.core.error.WalletLockedException;
import sh.lantern.core.model.EncryptedWalletRecord;
import sh.lantern.core.model.TransactionRecord;
import sh.lantern.core.types.Address;
import sh.lantern.wallet.WalletConfig;
import sh.lantern.wallet.concurrent.ScheduledTask;
import sh.lantern.wallet.concurrent.TaskScheduler;
import sh.lantern.wallet.ledger.TransactionLedger;
import sh.lantern.wallet.ledger.TransactionSubmission;
import sh.lantern.wallet.store.WalletStore;

/**
 * Owns the wallet's lock state and the decrypted key material while unlocked.
 *
 * <p>
 * <strong>States:</strong>
 * <pre>
 *   Locked ──create / import / unlock──▶ Unlocked
 *   Unlocked ──lock / auto-lock / delete──▶ Locked
 * </pre>
 *
 * <p>
 * The persisted {@link EncryptedWalletRecord} is written once by create or import and never
 * overwritten by either. Unlocking checks the password fingerprint first and then opens the
 * sealed key material; any failure leaves the session locked.
 *
 * <p>
 * <strong>Auto-lock:</strong> a single timer, re-armed whenever the session unlocks and whenever
 * an operation that uses key material succeeds. Firing locks unconditionally. Each arming bumps a
 * generation counter, so a timer that fires after being replaced does nothing.
 *
 * <p>
 * <strong>Thread Safety:</strong> every public method is serialized on this instance and key
 * material is only read while the monitor is held, so {@link #lock()} can never wipe a key that a
 * gateway call is still using. Gateway calls therefore block other session operations.
 *
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * CreatedWallet created = sessions.create(password);
 * showRecoveryPhrase(created.seedPhrase());
 * created.seedPhrase().destroy();
 *
 * TransactionRecord tx = sessions.send(recipient, new BigDecimal("1.5"), null);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class WalletSessionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WalletSessionManager.class);

    private final WalletConfig config;
    private final WalletStore store;
    private final BlockchainGateway gateway;
    private final SecretCipher cipher;
    private final TaskScheduler scheduler;
    private final TransactionLedger ledger;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private @Nullable KeyMaterial keys;
    private long unlockedAt;
    private long autoLockDeadline;
    private long generation;
    private ScheduledTask autoLockTask = ScheduledTask.NONE;

    public WalletSessionManager(
            final WalletConfig config,
            final WalletStore store,
            final BlockchainGateway gateway,
            final SecretCipher cipher,
            final TaskScheduler scheduler,
            final TransactionLedger ledger) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.cipher = Objects.requireNonNull(cipher, "cipher");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public void addListener(final SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final SessionListener listener) {
        listeners.remove(listener);
    }

    // ==================== Lifecycle ====================

    /**
     * Generates a new account, persists it sealed under {@code password} and unlocks.
     *
     * @throws ValidationException    if the password is too short
     * @throws WalletExistsException  if a wallet is already persisted
     * @throws NetworkException       if the gateway cannot generate an account
     */
    public synchronized CreatedWallet create(final CharSequence password) {
        requireNewWallet(password);
        final GeneratedAccount account = gateway.generateKeyMaterial();
        persistAndOpen(account.keys(), password);
        log.info("Created wallet {}", LogFormatter.shortenId(account.keys().address().value()));
        return new CreatedWallet(account.keys().address(), account.seedPhrase());
    }

    /**
     * Imports an existing private key. The caller keeps ownership of {@code privateKey}.
     *
     * @throws InvalidKeyFormatException if the key is not {@code APrivateKey1...} of 59 characters
     */
    public synchronized Address importFromKey(final SecretBuffer privateKey, final CharSequence password) {
        requireNewWallet(password);
        KeyFormats.requirePrivateKey(privateKey);
        final ImportedAccount imported = gateway.importKeyMaterial(privateKey);
        final KeyMaterial material = new KeyMaterial(imported.address(), privateKey.copy(), imported.viewKey());
        persistAndOpen(material, password);
        log.info("Imported wallet {} from private key", LogFormatter.shortenId(imported.address().value()));
        return imported.address();
    }

    /**
     * Restores an account from its recovery phrase. The caller keeps ownership of {@code phrase}.
     *
     * @throws InvalidKeyFormatException if the phrase has fewer than
     *                                   {@value KeyFormats#MIN_SEED_WORDS} words
     */
    public synchronized Address importFromSeed(final SecretBuffer phrase, final CharSequence password) {
        requireNewWallet(password);
        final SecretBuffer normalized = KeyFormats.normalizeSeedPhrase(phrase);
        final KeyMaterial material;
        try {
            material = gateway.restoreKeyMaterial(normalized);
        } finally {
            normalized.destroy();
        }
        persistAndOpen(material, password);
        log.info("Imported wallet {} from recovery phrase", LogFormatter.shortenId(material.address().value()));
        return material.address();
    }

    /**
     * Opens the persisted wallet.
     *
     * @throws NoWalletException        if nothing is persisted
     * @throws InvalidPasswordException if the password does not open the wallet
     */
    public synchronized Address unlock(final CharSequence password) {
        Objects.requireNonNull(password, "password");
        final EncryptedWalletRecord record = store.load().orElseThrow(NoWalletException::new);
        if (!PasswordHash.matches(password, record.passwordHash())) {
            log.info("Unlock rejected: wrong password");
            throw new InvalidPasswordException();
        }
        final byte[] plaintext;
        try {
            plaintext = cipher.open(record.sealed(), password);
        } catch (AuthenticationException e) {
            log.warn("Unlock rejected: password fingerprint matched but decryption failed");
            throw new InvalidPasswordException(e);
        }
        final KeyMaterial material;
        try {
            material = KeyMaterial.fromPlaintext(plaintext);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
        try {
            store.save(record.accessedAt(scheduler.now()));
        } catch (RuntimeException e) {
            material.destroy();
            throw e;
        }
        open(material);
        log.info("Wallet unlocked");
        return material.address();
    }

    /**
     * Wipes key material and disarms the auto-lock timer. Idempotent.
     */
    public synchronized void lock() {
        lockInternal(LockReason.MANUAL);
    }

    /**
     * Locks and removes the persisted wallet. The transaction log and site grants are kept.
     */
    public synchronized void deleteWallet() {
        lockInternal(LockReason.DELETED);
        store.delete();
        log.info("Wallet deleted");
    }

    public synchronized boolean isUnlocked() {
        return keys != null;
    }

    public synchronized boolean hasWallet() {
        return store.exists();
    }

    public synchronized WalletState state() {
        if (keys == null) {
            return WalletState.locked(store.exists());
        }
        return new WalletState(true, true, keys.address(), unlockedAt, autoLockDeadline);
    }

    @Override
    public void close() {
        lock();
    }

    // ==================== Authenticated operations ====================

    /**
     * @throws WalletLockedException if locked
     */
    public synchronized Address getAddress() {
        final KeyMaterial material = requireUnlocked();
        armAutoLock();
        return material.address();
    }

    /**
     * Returns a copy of the private key; the caller destroys it.
     */
    public synchronized SecretBuffer exportPrivateKey() {
        final KeyMaterial material = requireUnlocked();
        armAutoLock();
        log.info("Private key exported");
        return material.privateKey().copy();
    }

    /**
     * Returns a copy of the view key; the caller destroys it.
     */
    public synchronized SecretBuffer exportViewKey() {
        final KeyMaterial material = requireUnlocked();
        armAutoLock();
        return material.viewKey().copy();
    }

    public synchronized String signMessage(final String message) {
        Objects.requireNonNull(message, "message");
        final KeyMaterial material = requireUnlocked();
        final String signature = gateway.signMessage(material.privateKey(), message);
        armAutoLock();
        return signature;
    }

    public synchronized String decryptRecord(final String ciphertext) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        final KeyMaterial material = requireUnlocked();
        final String plaintext = gateway.decryptRecord(material.viewKey(), ciphertext);
        armAutoLock();
        return plaintext;
    }

    public synchronized List<ChainRecord> getRecords(final @Nullable String programId) {
        final KeyMaterial material = requireUnlocked();
        final List<ChainRecord> records = gateway.getRecords(material.viewKey(), programId);
        armAutoLock();
        return records;
    }

    /**
     * Reads the wallet balance. A gateway failure degrades to {@link Balance#ZERO}.
     */
    public synchronized Balance getBalance() {
        final KeyMaterial material = requireUnlocked();
        armAutoLock();
        try {
            return gateway.getBalance(material.address());
        } catch (NetworkException e) {
            log.warn("Balance lookup failed, reporting zero: {}", e.getMessage());
            return Balance.ZERO;
        }
    }

    /**
     * Transfers public credits and records the transfer as pending.
     *
     * @param fee fee in credits, or {@code null} for {@link WalletConfig#defaultTransferFee()}
     * @throws ValidationException if the recipient is malformed, the amount is not positive or
     *                             the public balance does not cover amount plus fee
     * @throws NetworkException    if the balance lookup or submission fails
     */
    public synchronized TransactionRecord send(
            final String to, final BigDecimal amount, final @Nullable BigDecimal fee) {
        final KeyMaterial material = requireUnlocked();
        if (!Address.isValid(to)) {
            throw new ValidationException("Invalid recipient address: " + to);
        }
        requirePositive(amount, "amount");
        final BigDecimal effectiveFee = fee != null ? requireFee(fee) : config.defaultTransferFee();

        final BigDecimal required = amount.add(effectiveFee);
        final Balance balance = gateway.getBalance(material.address());
        if (balance.publicBalance().compareTo(required) < 0) {
            throw new ValidationException("Insufficient balance: need " + required.toPlainString()
                    + " credits, have " + balance.publicBalance().toPlainString());
        }

        Trace.TX.log(LogFormatter.formatTxSubmit("SEND", to, amount, effectiveFee));
        final long start = System.nanoTime();
        final String txId = gateway.submitTransfer(material.privateKey(), Address.of(to), amount, effectiveFee);
        Trace.TX.log(LogFormatter.formatTxId(txId, (System.nanoTime() - start) / 1_000L));
        armAutoLock();
        return ledger.recordSubmission(
                TransactionSubmission.send(txId, material.address().value(), to, amount, effectiveFee));
    }

    /**
     * Executes a program function and records the execution as pending.
     *
     * @param fee fee in credits, or {@code null} for {@link WalletConfig#defaultExecutionFee()}
     */
    public synchronized TransactionRecord executeProgram(
            final String programId,
            final String functionName,
            final List<String> inputs,
            final @Nullable BigDecimal fee) {
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(inputs, "inputs");
        final KeyMaterial material = requireUnlocked();
        final BigDecimal effectiveFee = fee != null ? requireFee(fee) : config.defaultExecutionFee();

        Trace.TX.log(LogFormatter.formatTxSubmit("EXECUTE", programId + "/" + functionName, "-", effectiveFee));
        final long start = System.nanoTime();
        final String txId = gateway.submitProgramExecution(
                material.privateKey(), programId, functionName, List.copyOf(inputs), effectiveFee);
        Trace.TX.log(LogFormatter.formatTxId(txId, (System.nanoTime() - start) / 1_000L));
        armAutoLock();
        return ledger.recordSubmission(TransactionSubmission.execute(
                txId, material.address().value(), programId, functionName, effectiveFee));
    }

    // ==================== Internals ====================

    private void requireNewWallet(final CharSequence password) {
        if (password == null || password.length() < config.minPasswordLength()) {
            throw new ValidationException(
                    "Password must be at least " + config.minPasswordLength() + " characters");
        }
        if (store.exists()) {
            throw new WalletExistsException();
        }
    }

    private void persistAndOpen(final KeyMaterial material, final CharSequence password) {
        final byte[] plaintext = material.toPlaintext();
        final SealedPayload sealed;
        try {
            sealed = cipher.seal(plaintext, password);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
        try {
            store.save(EncryptedWalletRecord.of(sealed, PasswordHash.hash(password), scheduler.now()));
        } catch (RuntimeException e) {
            material.destroy();
            throw e;
        }
        open(material);
    }

    private void open(final KeyMaterial material) {
        try {
            ledger.bindAddress(material.address().value());
        } catch (RuntimeException e) {
            material.destroy();
            throw e;
        }
        if (keys != null && keys != material) {
            keys.destroy();
        }
        keys = material;
        unlockedAt = scheduler.now();
        armAutoLock();
        for (SessionListener listener : listeners) {
            listener.onUnlocked(material.address());
        }
    }

    private KeyMaterial requireUnlocked() {
        if (keys == null) {
            throw new WalletLockedException();
        }
        return keys;
    }

    private void armAutoLock() {
        autoLockTask.cancel();
        final long armed = ++generation;
        autoLockDeadline = scheduler.now() + config.autoLockAfter().toMillis();
        autoLockTask = scheduler.schedule(() -> autoLockFired(armed), config.autoLockAfter());
    }

    private synchronized void autoLockFired(final long armed) {
        if (armed != generation || keys == null) {
            return;
        }
        log.info("Auto-locking after {} minutes of inactivity", config.autoLockAfter().toMinutes());
        lockInternal(LockReason.AUTO_LOCK);
    }

    private void lockInternal(final LockReason reason) {
        autoLockTask.cancel();
        autoLockTask = ScheduledTask.NONE;
        generation++;
        autoLockDeadline = 0L;
        if (keys == null) {
            return;
        }
        keys.destroy();
        keys = null;
        unlockedAt = 0L;
        log.info("Wallet locked ({})", reason);
        for (SessionListener listener : listeners) {
            listener.onLocked(reason);
        }
    }

    private static void requirePositive(final BigDecimal amount, final String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Invalid " + name + ": must be greater than zero");
        }
        requireMicrocreditPrecision(amount, name);
    }

    private static BigDecimal requireFee(final BigDecimal fee) {
        if (fee.signum() < 0) {
            throw new ValidationException("Invalid fee: must not be negative");
        }
        requireMicrocreditPrecision(fee, "fee");
        return fee;
    }

    private static void requireMicrocreditPrecision(final BigDecimal value, final String name) {
        if (!Balance.isWholeMicrocredits(value)) {
            throw new ValidationException("Invalid " + name + ": at most " + Balance.CREDIT_DECIMALS
                    + " decimal places, got " + value.toPlainString());
        }
    }
}
