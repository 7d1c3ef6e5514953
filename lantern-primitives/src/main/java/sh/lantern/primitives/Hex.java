// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.primitives;

import java.util.Arrays;

/**
 * Lowercase hex codec for the binary fields of persisted wallet records.
 *
 * <p>Sealed payloads (ciphertext, IV, tag, salt) are stored as bare hex without a {@code 0x}
 * prefix. Decoding tolerates a prefix so that hand-edited or migrated records still load.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        Arrays.fill(NIBBLES, -1);
        for (int i = 0; i < 10; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return the hex string, empty for an empty array
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            out[i * 2] = DIGITS[v >>> 4];
            out[i * 2 + 1] = DIGITS[v & 0x0F];
        }
        return new String(out);
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix.
     *
     * @param hex the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has odd length or contains a
     *                                  non-hex character
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hex) ? 2 : 0;
        final int digits = hex.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hex);
        }
        final byte[] out = new byte[digits / 2];
        for (int i = 0; i < out.length; i++) {
            final int high = nibble(hex.charAt(start + i * 2), hex);
            final int low = nibble(hex.charAt(start + i * 2 + 1), hex);
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    /**
     * Returns {@code true} if the string is non-empty, even-length hex (prefix optional).
     *
     * @param hex the string to check
     * @return whether {@link #decode(String)} would accept it and yield at least one byte
     */
    public static boolean isHex(final String hex) {
        if (hex == null) {
            return false;
        }
        final int start = hasPrefix(hex) ? 2 : 0;
        final int digits = hex.length() - start;
        if (digits == 0 || (digits & 1) == 1) {
            return false;
        }
        for (int i = start; i < hex.length(); i++) {
            final char c = hex.charAt(i);
            if (c >= NIBBLES.length || NIBBLES[c] == -1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} (case-insensitive).
     *
     * @param hex the string to check
     * @return whether the prefix is present
     */
    public static boolean hasPrefix(final String hex) {
        return hex != null
                && hex.length() >= 2
                && hex.charAt(0) == '0'
                && (hex.charAt(1) == 'x' || hex.charAt(1) == 'X');
    }

    private static int nibble(final char c, final String input) {
        if (c >= NIBBLES.length || NIBBLES[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + input);
        }
        return NIBBLES[c];
    }
}
