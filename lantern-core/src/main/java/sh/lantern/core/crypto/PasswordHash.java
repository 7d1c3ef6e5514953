// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.crypto.digests.SHA256Digest;

import sh.lantern.primitives.Hex;

/**
 * One-way password fingerprint used as a fast pre-check before the slow key derivation.
 *
 * <p>The fingerprint is the SHA-256 of the UTF-8 password, hex-encoded. Comparison runs in
 * constant time over the decoded bytes.
 */
public final class PasswordHash {

    private PasswordHash() {
    }

    public static String hash(final CharSequence password) {
        final byte[] input = utf8(password);
        try {
            final SHA256Digest digest = new SHA256Digest();
            digest.update(input, 0, input.length);
            final byte[] out = new byte[digest.getDigestSize()];
            digest.doFinal(out, 0);
            return Hex.encode(out);
        } finally {
            Arrays.fill(input, (byte) 0);
        }
    }

    public static boolean matches(final CharSequence password, final String expectedHash) {
        if (password == null || expectedHash == null || !Hex.isHex(expectedHash)) {
            return false;
        }
        final byte[] actual = Hex.decode(hash(password));
        final byte[] expected = Hex.decode(expectedHash);
        return org.bouncycastle.util.Arrays.constantTimeAreEqual(actual, expected);
    }

    static byte[] utf8(final CharSequence password) {
        final ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(password));
        final byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        if (encoded.hasArray()) {
            Arrays.fill(encoded.array(), (byte) 0);
        }
        return bytes;
    }
}
