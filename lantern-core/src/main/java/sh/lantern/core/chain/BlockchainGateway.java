// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.chain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.lantern.core.crypto.KeyMaterial;
import sh.lantern.core.crypto.SecretBuffer;
import sh.lantern.core.error.NetworkException;
import sh.lantern.core.types.Address;

/**
 * Network client the wallet delegates every cryptographic and on-chain operation to.
 *
 * <p>
 * Key derivation, signing, proving and submission live behind this interface; the wallet core
 * only seals, schedules and records. Implementations handle:
 * <ul>
 * <li>Account generation and import</li>
 * <li>Building, proving and broadcasting transfers and program executions</li>
 * <li>Read-only queries (transaction status, balance, records, block height)</li>
 * </ul>
 *
 * <p>
 * <strong>Secrets:</strong> keys are passed as {@link SecretBuffer}s owned by the caller. An
 * implementation must not retain them past the call.
 *
 * <p>
 * <strong>Errors:</strong> every method throws {@link NetworkException} on transport or remote
 * failure. A transaction that the network does not know yet is not an error; see
 * {@link #getTransactionStatus(String)}.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @since 0.1.0
 */
public interface BlockchainGateway extends AutoCloseable {

    /**
     * Generates a new account.
     */
    GeneratedAccount generateKeyMaterial() throws NetworkException;

    /**
     * Derives address and view key from an existing private key.
     */
    ImportedAccount importKeyMaterial(SecretBuffer privateKey) throws NetworkException;

    /**
     * Derives the account behind a recovery phrase.
     */
    KeyMaterial restoreKeyMaterial(SecretBuffer seedPhrase) throws NetworkException;

    /**
     * Submits a public {@code credits.aleo/transfer_public}.
     *
     * @return the transaction id
     */
    String submitTransfer(SecretBuffer privateKey, Address to, BigDecimal amount, BigDecimal fee)
            throws NetworkException;

    /**
     * Submits an execution of {@code programId/functionName}.
     *
     * @return the transaction id
     */
    String submitProgramExecution(
            SecretBuffer privateKey,
            String programId,
            String functionName,
            List<String> inputs,
            BigDecimal fee) throws NetworkException;

    /**
     * Looks up a transaction.
     *
     * @return the raw status, or empty when the network does not know the id
     */
    Optional<ChainTransaction> getTransactionStatus(String txId) throws NetworkException;

    Balance getBalance(Address address) throws NetworkException;

    /**
     * Signs an arbitrary message with the account key.
     *
     * @return the signature ({@code sign1...})
     */
    String signMessage(SecretBuffer privateKey, String message) throws NetworkException;

    String decryptRecord(SecretBuffer viewKey, String ciphertext) throws NetworkException;

    List<ChainRecord> getRecords(SecretBuffer viewKey, @Nullable String programId) throws NetworkException;

    long latestBlockHeight() throws NetworkException;

    /**
     * Releases transport resources. Defaults to a no-op.
     */
    @Override
    default void close() {
    }
}
