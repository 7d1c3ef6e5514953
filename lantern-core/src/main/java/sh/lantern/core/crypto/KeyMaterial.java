// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import sh.lantern.core.error.InvalidKeyFormatException;
import sh.lantern.core.types.Address;

/**
 * The secret half of an unlocked account: its address plus private and view keys.
 *
 * <p>
 * The sealed form is three UTF-8 lines, {@code address}, {@code privateKey}, {@code viewKey},
 * produced and parsed without going through {@link String} for the secret parts.
 *
 * @param address    public account address
 * @param privateKey account private key ({@code APrivateKey1...})
 * @param viewKey    account view key ({@code AViewKey1...})
 */
public record KeyMaterial(Address address, SecretBuffer privateKey, SecretBuffer viewKey) implements Destroyable {

    private static final char SEPARATOR = '\n';

    public KeyMaterial {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(viewKey, "viewKey");
    }

    /**
     * Encodes this material for {@link SecretCipher#seal}. The caller zeroes the returned array.
     */
    public byte[] toPlaintext() {
        final String addr = address.value();
        final char[] joined = privateKey.apply(pk -> viewKey.apply(vk -> {
            final char[] out = new char[addr.length() + pk.length + vk.length + 2];
            addr.getChars(0, addr.length(), out, 0);
            out[addr.length()] = SEPARATOR;
            System.arraycopy(pk, 0, out, addr.length() + 1, pk.length);
            out[addr.length() + 1 + pk.length] = SEPARATOR;
            System.arraycopy(vk, 0, out, addr.length() + 2 + pk.length, vk.length);
            return out;
        }));
        try {
            final ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(joined));
            final byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            if (encoded.hasArray()) {
                Arrays.fill(encoded.array(), (byte) 0);
            }
            return bytes;
        } finally {
            Arrays.fill(joined, '\0');
        }
    }

    /**
     * Parses the output of {@link #toPlaintext()}. The input array is not modified.
     *
     * @throws InvalidKeyFormatException if the plaintext is not three non-empty lines
     */
    public static KeyMaterial fromPlaintext(final byte[] plaintext) {
        final CharBuffer decoded = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(plaintext));
        final char[] chars = new char[decoded.remaining()];
        decoded.get(chars);
        if (decoded.hasArray()) {
            Arrays.fill(decoded.array(), '\0');
        }
        try {
            final int first = indexOf(chars, 0);
            final int second = first < 0 ? -1 : indexOf(chars, first + 1);
            if (first <= 0 || second <= first + 1 || second == chars.length - 1) {
                throw new InvalidKeyFormatException("Sealed key material is malformed");
            }
            final Address address = new Address(new String(chars, 0, first));
            final SecretBuffer privateKey = SecretBuffer.wrap(Arrays.copyOfRange(chars, first + 1, second));
            final SecretBuffer viewKey = SecretBuffer.wrap(Arrays.copyOfRange(chars, second + 1, chars.length));
            return new KeyMaterial(address, privateKey, viewKey);
        } finally {
            Arrays.fill(chars, '\0');
        }
    }

    private static int indexOf(final char[] chars, final int from) {
        for (int i = from; i < chars.length; i++) {
            if (chars[i] == SEPARATOR) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public void destroy() {
        privateKey.destroy();
        viewKey.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return privateKey.isDestroyed() && viewKey.isDestroyed();
    }

    @Override
    public String toString() {
        return "KeyMaterial[address=" + address + "]";
    }
}
