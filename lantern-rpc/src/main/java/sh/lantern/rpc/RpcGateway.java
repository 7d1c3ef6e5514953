// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.lantern.core.chain.Balance;
import sh.lantern.core.chain.BlockchainGateway;
import sh.lantern.core.chain.ChainRecord;
import sh.lantern.core.chain.ChainTransaction;
import sh.lantern.core.chain.GeneratedAccount;
import sh.lantern.core.chain.ImportedAccount;
import sh.lantern.core.crypto.KeyMaterial;
import sh.lantern.core.crypto.SecretBuffer;
import sh.lantern.core.error.NetworkException;
import sh.lantern.core.types.Address;

/**
 * {@link BlockchainGateway} backed by the local wallet daemon's JSON-RPC interface.
 *
 * <p>
 * <strong>Methods:</strong>
 * <ul>
 * <li>{@code account_generate []} → {@code {address, privateKey, viewKey, seedPhrase?}}</li>
 * <li>{@code account_import [privateKey]} → {@code {address, viewKey}}</li>
 * <li>{@code account_restore [seedPhrase]} → {@code {address, privateKey, viewKey}}</li>
 * <li>{@code transfer_public [privateKey, to, amount, fee]} → txId</li>
 * <li>{@code program_execute [privateKey, programId, function, inputs, fee]} → txId</li>
 * <li>{@code transaction_get [txId]} → {@code {id, status, blockHeight?, confirmations?, fee?}}</li>
 * <li>{@code balance_get [address]} → {@code {public, private}}</li>
 * <li>{@code message_sign [privateKey, message]} → signature</li>
 * <li>{@code record_decrypt [viewKey, ciphertext]} → plaintext</li>
 * <li>{@code records_get [viewKey, programId?]} → list of records</li>
 * <li>{@code block_height []} → height</li>
 * </ul>
 * All amounts and fees cross the wire as integer microcredits.
 *
 * <p>
 * Read-only methods are retried per {@link RpcRetryConfig}; account and submission methods are
 * sent exactly once.
 *
 * <pre>{@code
 * BlockchainGateway gateway = RpcGateway.connect("http://127.0.0.1:3030/rpc");
 * long height = gateway.latestBlockHeight();
 * }</pre>
 */
public final class RpcGateway implements BlockchainGateway {

    private static final Logger log = LoggerFactory.getLogger(RpcGateway.class);

    private final GatewayProvider provider;
    private final RpcRetryConfig retryConfig;

    public RpcGateway(final GatewayProvider provider, final RpcRetryConfig retryConfig) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
    }

    public RpcGateway(final GatewayProvider provider) {
        this(provider, RpcRetryConfig.defaults());
    }

    public static RpcGateway connect(final String url) {
        return new RpcGateway(HttpGatewayProvider.builder(url).build());
    }

    @Override
    public GeneratedAccount generateKeyMaterial() {
        final Map<String, Object> result = requireMap("account_generate", provider.send("account_generate", List.of()));
        final KeyMaterial keys = keyMaterial("account_generate", result);
        final Object seed = result.get("seedPhrase");
        return new GeneratedAccount(keys, seed == null ? null : SecretBuffer.copyOf(seed.toString()));
    }

    @Override
    public ImportedAccount importKeyMaterial(final SecretBuffer privateKey) {
        final Map<String, Object> result = requireMap(
                "account_import", provider.send("account_import", List.of(privateKey.reveal())));
        return new ImportedAccount(
                Address.of(requireString("account_import", result, "address")),
                SecretBuffer.copyOf(requireString("account_import", result, "viewKey")));
    }

    @Override
    public KeyMaterial restoreKeyMaterial(final SecretBuffer seedPhrase) {
        final Map<String, Object> result = requireMap(
                "account_restore", provider.send("account_restore", List.of(seedPhrase.reveal())));
        return keyMaterial("account_restore", result);
    }

    @Override
    public String submitTransfer(
            final SecretBuffer privateKey, final Address to, final BigDecimal amount, final BigDecimal fee) {
        final JsonRpcResponse response = provider.send(
                "transfer_public",
                List.of(privateKey.reveal(), to.value(), Balance.toMicrocredits(amount), Balance.toMicrocredits(fee)));
        return requireTxId("transfer_public", response);
    }

    @Override
    public String submitProgramExecution(
            final SecretBuffer privateKey,
            final String programId,
            final String functionName,
            final List<String> inputs,
            final BigDecimal fee) {
        final JsonRpcResponse response = provider.send(
                "program_execute",
                List.of(privateKey.reveal(), programId, functionName, List.copyOf(inputs), Balance.toMicrocredits(fee)));
        return requireTxId("program_execute", response);
    }

    @Override
    public Optional<ChainTransaction> getTransactionStatus(final String txId) {
        final JsonRpcResponse response;
        try {
            response = RpcRetry.run(() -> provider.send("transaction_get", List.of(txId)), retryConfig);
        } catch (NetworkException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
        if (response.result() == null) {
            return Optional.empty();
        }
        final Map<String, Object> result = requireMap("transaction_get", response);
        final Object status = result.get("status");
        return Optional.of(new ChainTransaction(
                txId,
                status == null ? "" : status.toString(),
                asLong("transaction_get", "blockHeight", result.get("blockHeight")),
                asInteger("transaction_get", "confirmations", result.get("confirmations")),
                asCredits("transaction_get", "fee", result.get("fee"))));
    }

    @Override
    public Balance getBalance(final Address address) {
        final JsonRpcResponse response =
                RpcRetry.run(() -> provider.send("balance_get", List.of(address.value())), retryConfig);
        final Map<String, Object> result = requireMap("balance_get", response);
        final BigDecimal publicBalance = asCredits("balance_get", "public", result.get("public"));
        final BigDecimal privateBalance = asCredits("balance_get", "private", result.get("private"));
        return new Balance(
                publicBalance == null ? BigDecimal.ZERO : publicBalance,
                privateBalance == null ? BigDecimal.ZERO : privateBalance);
    }

    @Override
    public String signMessage(final SecretBuffer privateKey, final String message) {
        return requireString("message_sign", provider.send("message_sign", List.of(privateKey.reveal(), message)));
    }

    @Override
    public String decryptRecord(final SecretBuffer viewKey, final String ciphertext) {
        return requireString(
                "record_decrypt", provider.send("record_decrypt", List.of(viewKey.reveal(), ciphertext)));
    }

    @Override
    public List<ChainRecord> getRecords(final SecretBuffer viewKey, final @Nullable String programId) {
        final String key = viewKey.reveal();
        final JsonRpcResponse response = RpcRetry.run(
                () -> provider.send("records_get", Arrays.asList(key, programId)), retryConfig);
        final List<ChainRecord> records;
        try {
            records = response.resultAs(new TypeReference<List<ChainRecord>>() {});
        } catch (IllegalArgumentException e) {
            throw malformed("records_get", "result is not a record list", e);
        }
        return records == null ? List.of() : new ArrayList<>(records);
    }

    @Override
    public long latestBlockHeight() {
        final JsonRpcResponse response = RpcRetry.run(() -> provider.send("block_height", List.of()), retryConfig);
        final Long height = asLong("block_height", "result", response.result());
        if (height == null) {
            throw malformed("block_height", "missing result");
        }
        return height;
    }

    @Override
    public void close() {
        provider.close();
    }

    private static KeyMaterial keyMaterial(final String method, final Map<String, Object> result) {
        return new KeyMaterial(
                Address.of(requireString(method, result, "address")),
                SecretBuffer.copyOf(requireString(method, result, "privateKey")),
                SecretBuffer.copyOf(requireString(method, result, "viewKey")));
    }

    private static Map<String, Object> requireMap(final String method, final JsonRpcResponse response) {
        final Map<String, Object> result;
        try {
            result = response.resultAsMap();
        } catch (IllegalArgumentException e) {
            throw malformed(method, "result is not an object", e);
        }
        if (result == null) {
            throw malformed(method, "missing result");
        }
        return result;
    }

    private static String requireString(final String method, final Map<String, Object> result, final String field) {
        final Object value = result.get(field);
        if (value == null || value.toString().isEmpty()) {
            throw malformed(method, "missing " + field);
        }
        return value.toString();
    }

    private static String requireString(final String method, final JsonRpcResponse response) {
        final String value = response.resultAsString();
        if (value == null || value.isEmpty()) {
            throw malformed(method, "missing result");
        }
        return value;
    }

    private static String requireTxId(final String method, final JsonRpcResponse response) {
        final String txId = requireString(method, response);
        log.debug("{} accepted as {}", method, txId);
        return txId;
    }

    private static NetworkException malformed(final String method, final String detail) {
        return malformed(method, detail, null);
    }

    private static NetworkException malformed(
            final String method, final String detail, final @Nullable Throwable cause) {
        return new NetworkException(
                HttpGatewayProvider.PARSE_ERROR, "Malformed " + method + " response: " + detail, null, null, cause);
    }

    private static @Nullable Long asLong(final String method, final String field, final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).longValueExact();
            }
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            throw malformed(method, field + " is not an integer: " + value, e);
        }
    }

    private static @Nullable Integer asInteger(
            final String method, final String field, final @Nullable Object value) {
        final Long asLong = asLong(method, field, value);
        if (asLong == null) {
            return null;
        }
        if (asLong < Integer.MIN_VALUE || asLong > Integer.MAX_VALUE) {
            throw malformed(method, field + " is out of range: " + asLong);
        }
        return asLong.intValue();
    }

    /** Converts a microcredit amount (number or string, optional {@code u64} suffix) to credits. */
    private static @Nullable BigDecimal asCredits(
            final String method, final String field, final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        if (text.endsWith("u64")) {
            text = text.substring(0, text.length() - 3);
        }
        try {
            return new BigDecimal(text).divide(Balance.MICROCREDITS);
        } catch (NumberFormatException | ArithmeticException e) {
            throw malformed(method, field + " is not a microcredit amount: " + value, e);
        }
    }
}
