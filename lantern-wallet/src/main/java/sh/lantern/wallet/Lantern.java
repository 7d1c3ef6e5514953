// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet;

import java.util.Objects;
import java.util.concurrent.ExecutorService;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.lantern.core.chain.BlockchainGateway;
import sh.lantern.core.crypto.SecretCipher;
import sh.lantern.rpc.RpcGateway;
import sh.lantern.wallet.concurrent.ExecutorTaskScheduler;
import sh.lantern.wallet.concurrent.LanternExecutors;
import sh.lantern.wallet.concurrent.TaskScheduler;
import sh.lantern.wallet.ledger.TransactionLedger;
import sh.lantern.wallet.permission.ApprovalChannel;
import sh.lantern.wallet.permission.PermissionBroker;
import sh.lantern.wallet.session.WalletSessionManager;
import sh.lantern.wallet.store.JsonPermissionStore;
import sh.lantern.wallet.store.JsonTransactionStore;
import sh.lantern.wallet.store.JsonWalletStore;
import sh.lantern.wallet.store.PermissionStore;
import sh.lantern.wallet.store.TransactionStore;
import sh.lantern.wallet.store.WalletStore;

/**
 * The wired set of wallet services for one browser process.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (Lantern lantern = Lantern.builder(WalletConfig.defaults(dataDir))
 *         .daemonUrl("http://127.0.0.1:3030/rpc")
 *         .approvalChannel(ui::showApproval)
 *         .build()) {
 *     lantern.start();
 *     lantern.sessions().unlock(password);
 *     ...
 * }
 * }</pre>
 *
 * <p>
 * {@link #close()} locks the wallet, stops reconciliation, fails outstanding approvals and shuts
 * down the scheduler, the I/O executor and the gateway.
 *
 * @since 0.1.0
 */
public final class Lantern implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Lantern.class);

    private final WalletConfig config;
    private final BlockchainGateway gateway;
    private final TaskScheduler scheduler;
    private final ExecutorService ioExecutor;
    private final TransactionLedger ledger;
    private final WalletSessionManager sessions;
    private final PermissionBroker permissions;
    private final DappBridge dapps;
    private boolean started;
    private boolean closed;

    private Lantern(final Builder builder, final BlockchainGateway gateway) {
        this.config = builder.config;
        this.gateway = gateway;
        this.scheduler = builder.scheduler != null ? builder.scheduler : ExecutorTaskScheduler.create();
        this.ioExecutor = builder.ioExecutor != null ? builder.ioExecutor : LanternExecutors.newIoBoundExecutor();

        final WalletStore walletStore =
                builder.walletStore != null ? builder.walletStore : new JsonWalletStore(config.walletFile());
        final PermissionStore permissionStore = builder.permissionStore != null
                ? builder.permissionStore
                : new JsonPermissionStore(config.permissionsFile());
        final TransactionStore transactionStore = builder.transactionStore != null
                ? builder.transactionStore
                : new JsonTransactionStore(config.transactionsFile());
        final SecretCipher cipher = builder.cipher != null ? builder.cipher : new SecretCipher();

        this.ledger = new TransactionLedger(config, transactionStore, gateway, scheduler, ioExecutor);
        this.sessions = new WalletSessionManager(config, walletStore, gateway, cipher, scheduler, ledger);
        this.permissions = new PermissionBroker(config, permissionStore, scheduler, builder.approvalChannel);
        this.dapps = new DappBridge(sessions, permissions, gateway, config, ioExecutor);
    }

    public static Builder builder(final WalletConfig config) {
        return new Builder(config);
    }

    /**
     * Starts transaction reconciliation and drops idle site grants. Idempotent.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Lantern has been closed");
        }
        if (started) {
            return;
        }
        started = true;
        final int removed = permissions.cleanupExpired();
        ledger.start();
        log.info("Lantern started (data directory {}, {} stale site grants removed)",
                config.dataDirectory(), removed);
    }

    public WalletConfig config() {
        return config;
    }

    public WalletSessionManager sessions() {
        return sessions;
    }

    public PermissionBroker permissions() {
        return permissions;
    }

    public TransactionLedger ledger() {
        return ledger;
    }

    public DappBridge dapps() {
        return dapps;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        sessions.close();
        ledger.close();
        permissions.close();
        scheduler.close();
        ioExecutor.shutdownNow();
        gateway.close();
        log.info("Lantern closed");
    }

    /**
     * Builder for {@link Lantern}. Either {@link #gateway} or {@link #daemonUrl} and an
     * {@link #approvalChannel} are required; everything else defaults to the JSON stores under
     * {@link WalletConfig#dataDirectory()} and fresh daemon-thread executors.
     */
    public static final class Builder {
        private final WalletConfig config;
        private @Nullable BlockchainGateway gateway;
        private @Nullable String daemonUrl;
        private @Nullable ApprovalChannel approvalChannel;
        private @Nullable TaskScheduler scheduler;
        private @Nullable ExecutorService ioExecutor;
        private @Nullable WalletStore walletStore;
        private @Nullable PermissionStore permissionStore;
        private @Nullable TransactionStore transactionStore;
        private @Nullable SecretCipher cipher;

        private Builder(final WalletConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder gateway(final BlockchainGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        /**
         * Connects to a wallet daemon over JSON-RPC; ignored when {@link #gateway} is set.
         */
        public Builder daemonUrl(final String daemonUrl) {
            this.daemonUrl = daemonUrl;
            return this;
        }

        public Builder approvalChannel(final ApprovalChannel approvalChannel) {
            this.approvalChannel = approvalChannel;
            return this;
        }

        public Builder scheduler(final TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder ioExecutor(final ExecutorService ioExecutor) {
            this.ioExecutor = ioExecutor;
            return this;
        }

        public Builder walletStore(final WalletStore walletStore) {
            this.walletStore = walletStore;
            return this;
        }

        public Builder permissionStore(final PermissionStore permissionStore) {
            this.permissionStore = permissionStore;
            return this;
        }

        public Builder transactionStore(final TransactionStore transactionStore) {
            this.transactionStore = transactionStore;
            return this;
        }

        public Builder cipher(final SecretCipher cipher) {
            this.cipher = cipher;
            return this;
        }

        /**
         * @throws IllegalStateException if no gateway or approval channel is configured
         */
        public Lantern build() {
            if (approvalChannel == null) {
                throw new IllegalStateException("approvalChannel is required");
            }
            final BlockchainGateway resolved;
            if (gateway != null) {
                resolved = gateway;
            } else if (daemonUrl != null) {
                resolved = RpcGateway.connect(daemonUrl);
            } else {
                throw new IllegalStateException("gateway or daemonUrl is required");
            }
            return new Lantern(this, resolved);
        }
    }
}
