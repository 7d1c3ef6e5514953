// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.modes.AEADBlockCipher;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import sh.lantern.core.error.AuthenticationException;
import sh.lantern.primitives.Hex;

/**
 * Password-based authenticated encryption for secrets at rest.
 *
 * <p>
 * <strong>Scheme:</strong>
 * <ul>
 * <li>Key: PBKDF2-HMAC-SHA256 over the UTF-8 password, 32-byte random salt, 100,000 iterations,
 * 32-byte output</li>
 * <li>Cipher: AES-256-GCM, 16-byte random IV, 128-bit tag</li>
 * </ul>
 *
 * <p>
 * Every {@link #seal} draws a fresh salt and IV, so sealing the same plaintext twice yields
 * different payloads. {@link #open} either returns the whole plaintext or throws
 * {@link AuthenticationException}; partial output is never exposed. Derived key bytes are zeroed
 * before returning.
 *
 * <p>
 * Instances are stateless apart from the random source and safe to share.
 *
 * @since 0.1.0
 */
public final class SecretCipher {

    public static final int DEFAULT_ITERATIONS = 100_000;
    public static final int KEY_LENGTH = 32;
    public static final int SALT_LENGTH = 32;
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;

    private final int iterations;
    private final SecureRandom random;

    public SecretCipher() {
        this(DEFAULT_ITERATIONS, new SecureRandom());
    }

    /**
     * @param iterations PBKDF2 iteration count; payloads only open under the count that sealed them
     * @param random     source for salts and IVs
     */
    public SecretCipher(final int iterations, final SecureRandom random) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
        this.random = Objects.requireNonNull(random, "random");
    }

    public SealedPayload seal(final byte[] plaintext, final CharSequence password) {
        Objects.requireNonNull(plaintext, "plaintext");
        Objects.requireNonNull(password, "password");

        final byte[] salt = new byte[SALT_LENGTH];
        final byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(salt);
        random.nextBytes(iv);

        final KeyParameter key = deriveKey(password, salt);
        try {
            final AEADBlockCipher gcm = newCipher(true, key, iv);
            final byte[] out = new byte[gcm.getOutputSize(plaintext.length)];
            int written = gcm.processBytes(plaintext, 0, plaintext.length, out, 0);
            written += gcm.doFinal(out, written);

            final int cipherLength = written - TAG_LENGTH;
            final String ciphertext = Hex.encode(Arrays.copyOfRange(out, 0, cipherLength));
            final String tag = Hex.encode(Arrays.copyOfRange(out, cipherLength, written));
            return new SealedPayload(ciphertext, Hex.encode(iv), tag, Hex.encode(salt));
        } catch (InvalidCipherTextException e) {
            // encryption never verifies a tag
            throw new IllegalStateException("AES-GCM encryption failed", e);
        } finally {
            Arrays.fill(key.getKey(), (byte) 0);
        }
    }

    /**
     * Opens a payload sealed under {@code password}.
     *
     * @throws AuthenticationException if the tag does not verify (wrong password or corrupted data)
     */
    public byte[] open(final SealedPayload sealed, final CharSequence password) {
        Objects.requireNonNull(sealed, "sealed");
        Objects.requireNonNull(password, "password");

        final byte[] salt = Hex.decode(sealed.salt());
        final byte[] iv = Hex.decode(sealed.iv());
        final byte[] ciphertext = Hex.decode(sealed.ciphertext());
        final byte[] tag = Hex.decode(sealed.authTag());
        if (tag.length != TAG_LENGTH) {
            throw new AuthenticationException("Authentication tag must be " + TAG_LENGTH + " bytes");
        }

        final byte[] input = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
        System.arraycopy(tag, 0, input, ciphertext.length, tag.length);

        final KeyParameter key = deriveKey(password, salt);
        byte[] out = new byte[0];
        try {
            final AEADBlockCipher gcm = newCipher(false, key, iv);
            out = new byte[gcm.getOutputSize(input.length)];
            int written = gcm.processBytes(input, 0, input.length, out, 0);
            written += gcm.doFinal(out, written);
            return written == out.length ? out : Arrays.copyOf(out, written);
        } catch (InvalidCipherTextException e) {
            Arrays.fill(out, (byte) 0);
            throw new AuthenticationException("Unable to open sealed payload: authentication failed", e);
        } finally {
            Arrays.fill(key.getKey(), (byte) 0);
        }
    }

    private KeyParameter deriveKey(final CharSequence password, final byte[] salt) {
        final byte[] passwordBytes = PasswordHash.utf8(password);
        try {
            final PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(passwordBytes, salt, iterations);
            return (KeyParameter) generator.generateDerivedParameters(KEY_LENGTH * 8);
        } finally {
            Arrays.fill(passwordBytes, (byte) 0);
        }
    }

    private static AEADBlockCipher newCipher(final boolean encrypt, final KeyParameter key, final byte[] iv) {
        final AEADBlockCipher gcm = GCMBlockCipher.newInstance(AESEngine.newInstance());
        gcm.init(encrypt, new AEADParameters(key, TAG_LENGTH * 8, iv));
        return gcm;
    }
}
