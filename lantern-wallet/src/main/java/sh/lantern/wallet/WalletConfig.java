// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

import sh.lantern.core.chain.Balance;

/**
 * Settings for the wallet services.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * WalletConfig config = WalletConfig.builder(Path.of(System.getProperty("user.home"), ".lantern"))
 *     .autoLockAfter(Duration.ofMinutes(5))
 *     .build();
 * }</pre>
 *
 * @param dataDirectory       directory holding {@code wallet.json}, {@code permissions.json} and
 *                            {@code transactions.json}
 * @param autoLockAfter       inactivity period after which an unlocked session locks itself
 * @param approvalTimeout     how long a capability request waits for the user
 * @param reconcileInterval   period of the pending-transaction check
 * @param notFoundGrace       age after which a transaction unknown to the chain is marked failed
 * @param minPasswordLength   shortest accepted wallet password
 * @param explorerBaseUrl     block explorer root, transaction links are
 *                            {@code <explorerBaseUrl>/transaction/<txId>}
 * @param defaultTransferFee  fee in credits for transfers that do not name one
 * @param defaultExecutionFee fee in credits for program executions that do not name one
 * @param permissionRetention idle time after which a site grant is dropped by cleanup
 */
public record WalletConfig(
        Path dataDirectory,
        Duration autoLockAfter,
        Duration approvalTimeout,
        Duration reconcileInterval,
        Duration notFoundGrace,
        int minPasswordLength,
        String explorerBaseUrl,
        BigDecimal defaultTransferFee,
        BigDecimal defaultExecutionFee,
        Duration permissionRetention) {

    public static final Duration DEFAULT_AUTO_LOCK = Duration.ofMinutes(15);
    public static final Duration DEFAULT_APPROVAL_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_NOT_FOUND_GRACE = Duration.ofMinutes(10);
    public static final int DEFAULT_MIN_PASSWORD_LENGTH = 8;
    public static final String DEFAULT_EXPLORER = "https://explorer.aleo.org";
    public static final BigDecimal DEFAULT_TRANSFER_FEE = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_EXECUTION_FEE = new BigDecimal("0.1");
    public static final Duration DEFAULT_PERMISSION_RETENTION = Duration.ofDays(30);

    public WalletConfig {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        requirePositive(autoLockAfter, "autoLockAfter");
        requirePositive(approvalTimeout, "approvalTimeout");
        requirePositive(reconcileInterval, "reconcileInterval");
        requirePositive(notFoundGrace, "notFoundGrace");
        requirePositive(permissionRetention, "permissionRetention");
        if (minPasswordLength < 1) {
            throw new IllegalArgumentException("minPasswordLength must be >= 1, got: " + minPasswordLength);
        }
        Objects.requireNonNull(explorerBaseUrl, "explorerBaseUrl");
        explorerBaseUrl = explorerBaseUrl.endsWith("/")
                ? explorerBaseUrl.substring(0, explorerBaseUrl.length() - 1)
                : explorerBaseUrl;
        requireNonNegative(defaultTransferFee, "defaultTransferFee");
        requireNonNegative(defaultExecutionFee, "defaultExecutionFee");
    }

    public static WalletConfig defaults(final Path dataDirectory) {
        return builder(dataDirectory).build();
    }

    public static Builder builder(final Path dataDirectory) {
        return new Builder(dataDirectory);
    }

    public Path walletFile() {
        return dataDirectory.resolve("wallet.json");
    }

    public Path permissionsFile() {
        return dataDirectory.resolve("permissions.json");
    }

    public Path transactionsFile() {
        return dataDirectory.resolve("transactions.json");
    }

    public String explorerUrl(final String txId) {
        return explorerBaseUrl + "/transaction/" + txId;
    }

    private static void requirePositive(final Duration value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    private static void requireNonNegative(final BigDecimal value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
        }
        if (!Balance.isWholeMicrocredits(value)) {
            throw new IllegalArgumentException(name + " must be a whole number of microcredits, got: " + value);
        }
    }

    /**
     * Builder initialized with default values.
     */
    public static final class Builder {
        private final Path dataDirectory;
        private Duration autoLockAfter = DEFAULT_AUTO_LOCK;
        private Duration approvalTimeout = DEFAULT_APPROVAL_TIMEOUT;
        private Duration reconcileInterval = DEFAULT_RECONCILE_INTERVAL;
        private Duration notFoundGrace = DEFAULT_NOT_FOUND_GRACE;
        private int minPasswordLength = DEFAULT_MIN_PASSWORD_LENGTH;
        private String explorerBaseUrl = DEFAULT_EXPLORER;
        private BigDecimal defaultTransferFee = DEFAULT_TRANSFER_FEE;
        private BigDecimal defaultExecutionFee = DEFAULT_EXECUTION_FEE;
        private Duration permissionRetention = DEFAULT_PERMISSION_RETENTION;

        private Builder(final Path dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        public Builder autoLockAfter(final Duration autoLockAfter) {
            this.autoLockAfter = autoLockAfter;
            return this;
        }

        public Builder approvalTimeout(final Duration approvalTimeout) {
            this.approvalTimeout = approvalTimeout;
            return this;
        }

        public Builder reconcileInterval(final Duration reconcileInterval) {
            this.reconcileInterval = reconcileInterval;
            return this;
        }

        public Builder notFoundGrace(final Duration notFoundGrace) {
            this.notFoundGrace = notFoundGrace;
            return this;
        }

        public Builder minPasswordLength(final int minPasswordLength) {
            this.minPasswordLength = minPasswordLength;
            return this;
        }

        public Builder explorerBaseUrl(final String explorerBaseUrl) {
            this.explorerBaseUrl = explorerBaseUrl;
            return this;
        }

        public Builder defaultTransferFee(final BigDecimal defaultTransferFee) {
            this.defaultTransferFee = defaultTransferFee;
            return this;
        }

        public Builder defaultExecutionFee(final BigDecimal defaultExecutionFee) {
            this.defaultExecutionFee = defaultExecutionFee;
            return this;
        }

        public Builder permissionRetention(final Duration permissionRetention) {
            this.permissionRetention = permissionRetention;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public WalletConfig build() {
            return new WalletConfig(
                    dataDirectory,
                    autoLockAfter,
                    approvalTimeout,
                    reconcileInterval,
                    notFoundGrace,
                    minPasswordLength,
                    explorerBaseUrl,
                    defaultTransferFee,
                    defaultExecutionFee,
                    permissionRetention);
        }
    }
}
