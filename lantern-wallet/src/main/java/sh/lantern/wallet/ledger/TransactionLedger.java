// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.ledger;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;

import sh.lantern.core.LogFormatter;
import sh.lantern.core.Trace;
import sh.lantern.core.chain.BlockchainGateway;
import sh.lantern.core.chain.ChainTransaction;
import sh.lantern.core.error.NetworkException;
import sh.lantern.core.error.StorageException;
import sh.lantern.core.error.ValidationException;
import sh.lantern.core.model.TransactionKind;
import sh.lantern.core.model.TransactionRecord;
import sh.lantern.core.model.TransactionStats;
import sh.lantern.core.model.TransactionStatus;
import sh.lantern.wallet.WalletConfig;
import sh.lantern.wallet.concurrent.ScheduledTask;
import sh.lantern.wallet.concurrent.TaskScheduler;
import sh.lantern.wallet.store.JsonFiles;
import sh.lantern.wallet.store.TransactionStore;

/**
 * Persistent log of submitted transactions and the loop that settles them against the chain.
 *
 * <p>
 * <strong>Lifecycle of a record:</strong>
 * <ol>
 * <li>{@link #recordSubmission} appends it as {@link TransactionStatus#PENDING}, newest first</li>
 * <li>{@link #reconcile} asks the gateway for its status and moves it to
 * {@link TransactionStatus#CONFIRMED} or {@link TransactionStatus#FAILED}</li>
 * <li>A transaction the chain still does not know after the not-found grace period
 * (10 minutes by default) is marked failed</li>
 * </ol>
 *
 * <p>
 * <strong>Reconciliation loop:</strong> {@link #start()} checks every pending record immediately
 * and then every {@link WalletConfig#reconcileInterval()}. Each lookup runs on the I/O executor on
 * its own; a failing lookup is logged and retried on the next tick without holding up the others.
 *
 * <p>
 * <strong>Thread Safety:</strong> all mutations are serialized on this instance and written
 * through to the {@link TransactionStore} before returning. Gateway lookups run outside the
 * monitor.
 *
 * @since 0.1.0
 */
public final class TransactionLedger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionLedger.class);

    static final String NOT_FOUND_ERROR = "Transaction not found on chain";
    static final int DEFAULT_RECENT = 10;

    private static final TypeReference<List<TransactionRecord>> RECORDS = new TypeReference<>() {};
    private static final Comparator<TransactionRecord> NEWEST_FIRST =
            Comparator.comparingLong(TransactionRecord::timestamp).reversed();

    private final WalletConfig config;
    private final TransactionStore store;
    private final BlockchainGateway gateway;
    private final TaskScheduler scheduler;
    private final Executor ioExecutor;

    private final List<TransactionRecord> records = new ArrayList<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private @Nullable String boundAddress;
    private ScheduledTask loop = ScheduledTask.NONE;

    public TransactionLedger(
            final WalletConfig config,
            final TransactionStore store,
            final BlockchainGateway gateway,
            final TaskScheduler scheduler,
            final Executor ioExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");

        records.addAll(store.load());
        records.sort(NEWEST_FIRST);
        log.debug("Loaded {} transactions", records.size());
    }

    // ==================== Recording ====================

    /**
     * Appends a pending record for a transaction the gateway just accepted.
     *
     * @throws ValidationException if a record with the same transaction id exists
     * @throws StorageException    if the log cannot be written
     */
    public synchronized TransactionRecord recordSubmission(final TransactionSubmission submission) {
        Objects.requireNonNull(submission, "submission");
        if (indexOfTxId(submission.txId()) >= 0) {
            throw new ValidationException("Transaction already recorded: " + submission.txId());
        }
        final TransactionRecord record = new TransactionRecord(
                UUID.randomUUID().toString(),
                submission.txId(),
                submission.kind(),
                submission.programId(),
                submission.functionName(),
                submission.from() != null ? submission.from() : boundAddress,
                submission.to(),
                submission.amount(),
                submission.fee(),
                TransactionStatus.PENDING,
                scheduler.now(),
                null,
                null,
                null,
                submission.memo(),
                config.explorerUrl(submission.txId()));
        final List<TransactionRecord> next = new ArrayList<>(records.size() + 1);
        next.add(record);
        next.addAll(records);
        commit(next);
        Trace.TX.log(LogFormatter.formatTxSubmit(
                submission.kind().name(),
                submission.to() != null ? submission.to() : submission.programId(),
                submission.amount(),
                submission.fee()));
        return record;
    }

    public TransactionRecord recordSend(
            final String txId, final String to, final BigDecimal amount, final BigDecimal fee) {
        return recordSubmission(TransactionSubmission.send(txId, null, to, amount, fee));
    }

    public TransactionRecord recordExecute(
            final String txId, final String programId, final String functionName, final BigDecimal fee) {
        return recordSubmission(TransactionSubmission.execute(txId, null, programId, functionName, fee));
    }

    /**
     * Sets the sender for future submissions and fills it into earlier sends and executions
     * recorded without one.
     */
    public synchronized void bindAddress(final String address) {
        Objects.requireNonNull(address, "address");
        final List<TransactionRecord> next = new ArrayList<>(records);
        boolean changed = false;
        for (int i = 0; i < next.size(); i++) {
            final TransactionRecord record = next.get(i);
            if (record.from() == null
                    && (record.kind() == TransactionKind.SEND || record.kind() == TransactionKind.EXECUTE)) {
                next.set(i, record.withFrom(address));
                changed = true;
            }
        }
        if (changed) {
            commit(next);
        }
        boundAddress = address;
    }

    // ==================== Reconciliation ====================

    /**
     * Settles one transaction against the chain.
     *
     * <p>
     * Network errors leave the record untouched. Records that are not pending are returned as
     * they are without asking the gateway.
     *
     * @return the record after reconciliation, or empty if the ledger does not hold {@code txId}
     */
    public Optional<TransactionRecord> reconcile(final String txId) {
        final TransactionRecord before;
        synchronized (this) {
            final int index = indexOfTxId(txId);
            if (index < 0) {
                return Optional.empty();
            }
            before = records.get(index);
        }
        if (!before.isPending()) {
            return Optional.of(before);
        }

        final Optional<ChainTransaction> chain;
        try {
            chain = gateway.getTransactionStatus(txId);
        } catch (NetworkException e) {
            log.warn("Status lookup for {} failed, will retry: {}", LogFormatter.shortenId(txId), e.getMessage());
            return Optional.of(before);
        }

        synchronized (this) {
            final int index = indexOfTxId(txId);
            if (index < 0) {
                return Optional.empty();
            }
            final TransactionRecord current = records.get(index);
            if (!current.isPending()) {
                return Optional.of(current);
            }
            final TransactionRecord updated = chain
                    .map(tx -> current.reconciled(
                            TransactionStatus.classify(tx.status()),
                            tx.blockHeight(),
                            tx.confirmations(),
                            tx.fee(),
                            current.error()))
                    .orElseGet(() -> notFound(current));
            if (!updated.equals(current)) {
                final List<TransactionRecord> next = new ArrayList<>(records);
                next.set(index, updated);
                commit(next);
                if (updated.status() != current.status()) {
                    Trace.TX.log(LogFormatter.formatTxStatus(txId, updated.status().name()));
                }
            }
            return Optional.of(updated);
        }
    }

    private TransactionRecord notFound(final TransactionRecord current) {
        final long age = scheduler.now() - current.timestamp();
        if (age > config.notFoundGrace().toMillis()) {
            log.info("Transaction {} unknown to the chain after {}s, marking failed",
                    LogFormatter.shortenId(current.txId()), age / 1000);
            return current.reconciled(TransactionStatus.FAILED, null, null, null, NOT_FOUND_ERROR);
        }
        return current;
    }

    /**
     * Dispatches a {@link #reconcile} for every pending record to the I/O executor. A record whose
     * previous lookup has not finished is skipped.
     *
     * @return the number of lookups dispatched
     */
    public int reconcilePending() {
        final List<String> pending;
        synchronized (this) {
            pending = records.stream()
                    .filter(TransactionRecord::isPending)
                    .map(TransactionRecord::txId)
                    .toList();
        }
        int dispatched = 0;
        for (String txId : pending) {
            if (!inFlight.add(txId)) {
                continue;
            }
            try {
                ioExecutor.execute(() -> {
                    try {
                        reconcile(txId);
                    } catch (RuntimeException e) {
                        log.warn("Reconciliation of {} failed", LogFormatter.shortenId(txId), e);
                    } finally {
                        inFlight.remove(txId);
                    }
                });
                dispatched++;
            } catch (RejectedExecutionException e) {
                inFlight.remove(txId);
                log.debug("I/O executor rejected reconciliation of {}", txId);
            }
        }
        return dispatched;
    }

    /**
     * Arms the reconciliation loop, first tick immediately. Calling it again replaces the loop.
     */
    public synchronized void start() {
        loop.cancel();
        loop = scheduler.scheduleAtFixedRate(this::reconcilePending, Duration.ZERO, config.reconcileInterval());
        log.info("Transaction reconciliation started, interval {}s", config.reconcileInterval().toSeconds());
    }

    public synchronized void stop() {
        loop.cancel();
        loop = ScheduledTask.NONE;
    }

    public synchronized boolean isRunning() {
        return !loop.isCancelled();
    }

    @Override
    public void close() {
        stop();
    }

    // ==================== Queries ====================

    public synchronized Optional<TransactionRecord> find(final String idOrTxId) {
        return records.stream().filter(r -> r.matches(idOrTxId)).findFirst();
    }

    public synchronized Optional<TransactionRecord> findByTxId(final String txId) {
        final int index = indexOfTxId(txId);
        return index < 0 ? Optional.empty() : Optional.of(records.get(index));
    }

    /**
     * Every record, newest first.
     */
    public synchronized List<TransactionRecord> all() {
        return List.copyOf(records);
    }

    public List<TransactionRecord> recent() {
        return recent(DEFAULT_RECENT);
    }

    public synchronized List<TransactionRecord> recent(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        return List.copyOf(records.subList(0, Math.min(limit, records.size())));
    }

    public synchronized int pendingCount() {
        return (int) records.stream().filter(TransactionRecord::isPending).count();
    }

    public synchronized TransactionPage query(final TransactionQuery query) {
        Objects.requireNonNull(query, "query");
        final List<TransactionRecord> matching = records.stream()
                .filter(r -> query.kind() == null || r.kind() == query.kind())
                .filter(r -> query.status() == null || r.status() == query.status())
                .toList();
        final int total = matching.size();
        final long end = (long) query.offset() + query.limit();
        final int from = Math.min(query.offset(), total);
        final int to = (int) Math.min(end, total);
        return new TransactionPage(matching.subList(from, to), total, end < total);
    }

    /**
     * Counts over every record; sums over confirmed records only.
     */
    public synchronized TransactionStats stats() {
        int pending = 0;
        int confirmed = 0;
        int failed = 0;
        BigDecimal sent = BigDecimal.ZERO;
        BigDecimal received = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        for (TransactionRecord record : records) {
            if (record.status() == TransactionStatus.PENDING) {
                pending++;
                continue;
            }
            if (record.status() == TransactionStatus.FAILED) {
                failed++;
                continue;
            }
            confirmed++;
            if (record.amount() != null) {
                if (record.kind() == TransactionKind.SEND) {
                    sent = sent.add(record.amount());
                } else if (record.kind() == TransactionKind.RECEIVE) {
                    received = received.add(record.amount());
                }
            }
            if (record.fee() != null) {
                fees = fees.add(record.fee());
            }
        }
        return new TransactionStats(records.size(), pending, confirmed, failed, sent, received, fees);
    }

    // ==================== Maintenance ====================

    /**
     * Removes the record with the given internal or transaction id.
     *
     * @return whether a record was removed
     */
    public synchronized boolean delete(final String idOrTxId) {
        final List<TransactionRecord> next = new ArrayList<>(records);
        final boolean removed = next.removeIf(r -> r.matches(idOrTxId));
        if (removed) {
            commit(next);
        }
        return removed;
    }

    public synchronized void clear() {
        commit(new ArrayList<>());
        log.info("Transaction history cleared");
    }

    /**
     * Serializes the whole log as a JSON array, newest first.
     */
    public synchronized String exportJson() {
        try {
            return JsonFiles.mapper().writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize transaction history", e);
        }
    }

    /**
     * Merges records from a previous {@link #exportJson()}. Records whose transaction id is
     * already known are skipped.
     *
     * @return the number of records added
     * @throws ValidationException if {@code json} is not an exported transaction list
     */
    public synchronized int importJson(final String json) {
        final List<TransactionRecord> incoming;
        try {
            incoming = JsonFiles.mapper().readValue(json, RECORDS);
        } catch (IOException | IllegalArgumentException e) {
            throw new ValidationException("Invalid transaction history export", e);
        }
        if (incoming == null) {
            throw new ValidationException("Invalid transaction history export");
        }
        final Set<String> knownTxIds = new HashSet<>();
        final Set<String> knownIds = new HashSet<>();
        for (TransactionRecord record : records) {
            knownTxIds.add(record.txId());
            knownIds.add(record.id());
        }
        final List<TransactionRecord> next = new ArrayList<>(records);
        int added = 0;
        for (TransactionRecord record : incoming) {
            if (record == null || !knownTxIds.add(record.txId())) {
                continue;
            }
            TransactionRecord toAdd = record;
            if (!knownIds.add(record.id())) {
                toAdd = withId(record, UUID.randomUUID().toString());
                knownIds.add(toAdd.id());
            }
            next.add(toAdd);
            added++;
        }
        if (added > 0) {
            next.sort(NEWEST_FIRST);
            commit(next);
        }
        log.info("Imported {} of {} transactions", added, incoming.size());
        return added;
    }

    private static TransactionRecord withId(final TransactionRecord r, final String id) {
        return new TransactionRecord(id, r.txId(), r.kind(), r.programId(), r.functionName(), r.from(), r.to(),
                r.amount(), r.fee(), r.status(), r.timestamp(), r.blockHeight(), r.confirmations(), r.error(),
                r.memo(), r.explorerUrl());
    }

    private int indexOfTxId(final String txId) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).txId().equals(txId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Writes {@code next} through to the store, then makes it the live log. A failed write leaves
     * the live log untouched.
     */
    private void commit(final List<TransactionRecord> next) {
        store.save(next);
        records.clear();
        records.addAll(next);
    }
}
