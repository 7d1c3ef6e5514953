// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import java.util.Arrays;

import sh.lantern.core.error.InvalidKeyFormatException;

/**
 * Canonical textual formats of Aleo account secrets.
 *
 * <p>Checks are structural only (prefix, length, word count); whether a well-formed key is a
 * valid curve scalar is for the blockchain client to decide.
 */
public final class KeyFormats {

    public static final String PRIVATE_KEY_PREFIX = "APrivateKey1";
    public static final int PRIVATE_KEY_LENGTH = 59;
    public static final String VIEW_KEY_PREFIX = "AViewKey1";
    public static final int VIEW_KEY_LENGTH = 53;
    public static final int MIN_SEED_WORDS = 12;

    private KeyFormats() {
    }

    public static boolean isPrivateKey(final SecretBuffer key) {
        return key != null
                && !key.isDestroyed()
                && key.length() == PRIVATE_KEY_LENGTH
                && key.startsWith(PRIVATE_KEY_PREFIX);
    }

    public static boolean isViewKey(final SecretBuffer key) {
        return key != null
                && !key.isDestroyed()
                && key.length() == VIEW_KEY_LENGTH
                && key.startsWith(VIEW_KEY_PREFIX);
    }

    public static void requirePrivateKey(final SecretBuffer key) {
        if (!isPrivateKey(key)) {
            throw new InvalidKeyFormatException("Invalid private key format. Must start with "
                    + PRIVATE_KEY_PREFIX + " and be " + PRIVATE_KEY_LENGTH + " characters");
        }
    }

    /**
     * Collapses whitespace and lowercases a recovery phrase.
     *
     * @return a new buffer holding the normalized phrase; the input is left untouched
     * @throws InvalidKeyFormatException if the phrase has fewer than {@value #MIN_SEED_WORDS} words
     */
    public static SecretBuffer normalizeSeedPhrase(final SecretBuffer phrase) {
        if (phrase == null || phrase.isDestroyed()) {
            throw new InvalidKeyFormatException("Recovery phrase is required");
        }
        final char[] normalized = phrase.apply(chars -> {
            final char[] out = new char[chars.length];
            int length = 0;
            int words = 0;
            boolean inWord = false;
            for (final char c : chars) {
                if (Character.isWhitespace(c)) {
                    inWord = false;
                    continue;
                }
                if (!inWord) {
                    if (length > 0) {
                        out[length++] = ' ';
                    }
                    words++;
                    inWord = true;
                }
                out[length++] = Character.toLowerCase(c);
            }
            final char[] result = words < MIN_SEED_WORDS ? null : Arrays.copyOf(out, length);
            Arrays.fill(out, '\0');
            return result;
        });
        if (normalized == null) {
            throw new InvalidKeyFormatException("Invalid recovery phrase. Must be at least "
                    + MIN_SEED_WORDS + " words");
        }
        return SecretBuffer.wrap(normalized);
    }
}
