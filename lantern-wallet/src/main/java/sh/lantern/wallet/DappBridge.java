// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.lantern.core.chain.Balance;
import sh.lantern.core.chain.BlockchainGateway;
import sh.lantern.core.chain.ChainRecord;
import sh.lantern.core.crypto.SecretBuffer;
import sh.lantern.core.error.LanternException;
import sh.lantern.core.error.NetworkException;
import sh.lantern.core.error.NotConnectedException;
import sh.lantern.core.error.PermissionDeniedException;
import sh.lantern.core.error.WalletLockedException;
import sh.lantern.core.model.SitePermission;
import sh.lantern.core.model.TransactionStatus;
import sh.lantern.core.types.Address;
import sh.lantern.core.types.Capability;
import sh.lantern.core.types.Origin;
import sh.lantern.wallet.permission.ApprovalKind;
import sh.lantern.wallet.permission.PermissionBroker;
import sh.lantern.wallet.session.WalletSessionManager;

/**
 * Entry point for wallet calls made by web pages, one method per page-facing operation.
 *
 * <p>
 * Every call is made on behalf of an {@link Origin}. Operations fall in three groups:
 * <ul>
 * <li><strong>Grant-based</strong> ({@link #connect}, {@link #requestViewKey},
 * {@link #requestRecords}): prompt once, then remembered in the grant table</li>
 * <li><strong>Per-action</strong> ({@link #requestTransaction}, {@link #signMessage}): prompt
 * every time</li>
 * <li><strong>Direct</strong> ({@link #account}, {@link #balance}, {@link #decrypt},
 * {@link #transactionStatus}, {@link #blockHeight}): answer immediately from existing grants</li>
 * </ul>
 *
 * <p>
 * Methods returning a {@link CompletableFuture} report every failure through the future:
 * {@link NotConnectedException} for an origin without a connect grant,
 * {@link WalletLockedException} when the wallet is locked, {@link PermissionDeniedException} when
 * the user declines and {@link sh.lantern.core.error.ApprovalTimeoutException} when nobody
 * answers. Work after an approval runs on the I/O executor.
 *
 * @since 0.1.0
 */
public final class DappBridge {

    private static final Logger log = LoggerFactory.getLogger(DappBridge.class);

    static final String UNKNOWN_STATUS = "unknown";

    private final WalletSessionManager session;
    private final PermissionBroker broker;
    private final BlockchainGateway gateway;
    private final WalletConfig config;
    private final Executor executor;

    public DappBridge(
            final WalletSessionManager session,
            final PermissionBroker broker,
            final BlockchainGateway gateway,
            final WalletConfig config,
            final Executor executor) {
        this.session = Objects.requireNonNull(session, "session");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    // ==================== Connection ====================

    /**
     * Connects the origin, prompting unless it is already connected.
     *
     * @return the address the origin is connected with
     */
    public CompletableFuture<Address> connect(final Origin origin) {
        return attempt(() -> {
            final SitePermission site = broker.sitePermission(origin).orElse(null);
            if (site != null && site.has(Capability.CONNECT)) {
                broker.touch(origin);
                return CompletableFuture.completedFuture(Address.of(site.address()));
            }
            final Address address = session.getAddress();
            return broker.requestCapability(origin, Capability.CONNECT, ApprovalKind.CONNECT, address.value())
                    .thenApply(granted -> {
                        requireGranted(granted, origin, "Connection rejected by user");
                        log.info("{} connected", origin);
                        return address;
                    });
        });
    }

    /**
     * The address a connected origin was connected with.
     *
     * @throws NotConnectedException if the origin is not connected
     */
    public Address account(final Origin origin) {
        final SitePermission site = broker.sitePermission(origin)
                .filter(s -> s.has(Capability.CONNECT))
                .orElseThrow(() -> new NotConnectedException(origin.value()));
        broker.touch(origin);
        return Address.of(site.address());
    }

    public void disconnect(final Origin origin) {
        broker.disconnect(origin);
    }

    public boolean isConnected(final Origin origin) {
        return broker.isConnected(origin);
    }

    // ==================== Approved actions ====================

    /**
     * Asks the user to approve an execution, then submits it and records it in the ledger.
     *
     * @return the transaction id
     */
    public CompletableFuture<String> requestTransaction(final Origin origin, final TransactionRequest request) {
        Objects.requireNonNull(request, "request");
        return attempt(() -> {
            requireConnected(origin);
            session.getAddress();
            final Map<String, Object> payload = request.describe(
                    request.fee() != null ? request.fee() : config.defaultExecutionFee());
            return broker.requestConsent(origin, Capability.TRANSACTION, ApprovalKind.TRANSACTION, payload)
                    .thenApplyAsync(granted -> {
                        requireGranted(granted, origin, "Transaction rejected by user");
                        return session.executeProgram(
                                request.programId(), request.functionName(), request.inputs(), request.fee())
                                .txId();
                    }, executor);
        });
    }

    /**
     * Asks the user to approve signing {@code message}, then signs it.
     */
    public CompletableFuture<String> signMessage(final Origin origin, final String message) {
        Objects.requireNonNull(message, "message");
        return attempt(() -> {
            requireConnected(origin);
            session.getAddress();
            return broker.requestConsent(origin, Capability.SIGN, ApprovalKind.SIGN_MESSAGE, Map.of("message", message))
                    .thenApplyAsync(granted -> {
                        requireGranted(granted, origin, "Signing rejected by user");
                        return session.signMessage(message);
                    }, executor);
        });
    }

    /**
     * Shares the view key after the user grants {@link Capability#VIEW_KEY}. The caller destroys
     * the returned buffer once it has been handed to the page.
     */
    public CompletableFuture<SecretBuffer> requestViewKey(final Origin origin) {
        return attempt(() -> {
            requireConnected(origin);
            final Address address = session.getAddress();
            return broker.requestCapability(origin, Capability.VIEW_KEY, ApprovalKind.VIEW_KEY, address.value())
                    .thenApplyAsync(granted -> {
                        requireGranted(granted, origin, "View key request rejected");
                        log.info("View key shared with {}", origin);
                        return session.exportViewKey();
                    }, executor);
        });
    }

    /**
     * Lists the wallet's records, optionally for one program, after the user grants
     * {@link Capability#RECORDS}.
     */
    public CompletableFuture<List<ChainRecord>> requestRecords(final Origin origin, final @Nullable String programId) {
        return attempt(() -> {
            requireConnected(origin);
            final Address address = session.getAddress();
            final Map<String, Object> payload = new LinkedHashMap<>();
            if (programId != null) {
                payload.put("programId", programId);
            }
            return broker.requestCapability(
                            origin, EnumSet.of(Capability.RECORDS), ApprovalKind.RECORDS, payload,
                            address.value())
                    .thenApplyAsync(granted -> {
                        requireGranted(granted, origin, "Records request rejected");
                        return session.getRecords(programId);
                    }, executor);
        });
    }

    // ==================== Direct reads ====================

    /**
     * Decrypts a record ciphertext for an origin holding {@link Capability#DECRYPT}.
     *
     * @throws PermissionDeniedException if the origin lacks the grant
     * @throws WalletLockedException     if the wallet is locked
     */
    public String decrypt(final Origin origin, final String ciphertext) {
        if (!broker.hasCapability(origin, Capability.DECRYPT)) {
            throw new PermissionDeniedException(origin.value(), "Decrypt permission not granted");
        }
        return session.decryptRecord(ciphertext);
    }

    /**
     * @throws NotConnectedException if the origin is not connected
     * @throws WalletLockedException if the wallet is locked
     */
    public Balance balance(final Origin origin) {
        requireConnected(origin);
        return session.getBalance();
    }

    /**
     * Lifecycle state of a transaction as {@code pending}, {@code confirmed} or {@code failed};
     * {@value #UNKNOWN_STATUS} when the network does not know it or cannot be reached.
     */
    public String transactionStatus(final String txId) {
        try {
            return gateway.getTransactionStatus(txId)
                    .map(tx -> TransactionStatus.classify(tx.status()).wireName())
                    .orElse(UNKNOWN_STATUS);
        } catch (NetworkException e) {
            log.debug("Status lookup for {} failed: {}", txId, e.getMessage());
            return UNKNOWN_STATUS;
        }
    }

    /**
     * Latest block height, or {@code 0} when the network cannot be reached.
     */
    public long blockHeight() {
        try {
            return gateway.latestBlockHeight();
        } catch (NetworkException e) {
            log.debug("Block height lookup failed: {}", e.getMessage());
            return 0L;
        }
    }

    // ==================== Internals ====================

    private void requireConnected(final Origin origin) {
        if (!broker.isConnected(origin)) {
            throw new NotConnectedException(origin.value());
        }
    }

    private static void requireGranted(final Boolean granted, final Origin origin, final String message) {
        if (!Boolean.TRUE.equals(granted)) {
            throw new PermissionDeniedException(origin.value(), message);
        }
    }

    private static <T> CompletableFuture<T> attempt(final Supplier<CompletableFuture<T>> action) {
        try {
            return action.get();
        } catch (LanternException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
