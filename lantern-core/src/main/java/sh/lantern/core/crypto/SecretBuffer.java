// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.crypto;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;

import javax.security.auth.Destroyable;

/**
 * Mutable holder for secret characters (private keys, view keys, recovery phrases).
 *
 * <p>
 * Unlike {@link String}, the backing array can be overwritten. {@link #destroy()} fills it with
 * zero characters and marks the buffer unusable; any later access throws
 * {@link IllegalStateException}.
 *
 * <p>
 * <b>Ownership:</b> {@link #wrap(char[])} takes ownership of the array passed in, so the caller's
 * reference observes the zeroing. {@link #copyOf(CharSequence)} copies.
 *
 * <p>
 * <b>Scoping:</b> prefer {@link #apply(Function)}, which lends the live array to a callback,
 * over {@link #reveal()}, which has to materialize an immutable {@link String}. Strings are only
 * produced at the boundary where an external API demands one (JSON-RPC, export to the UI).
 *
 * <p>
 * Thread-safe: access and destruction synchronize on the buffer.
 *
 * @since 0.1.0
 */
public final class SecretBuffer implements Destroyable {

    private final char[] chars;
    private boolean destroyed;

    private SecretBuffer(final char[] chars) {
        this.chars = chars;
    }

    /**
     * Wraps the given array without copying. The buffer owns it from now on.
     */
    public static SecretBuffer wrap(final char[] chars) {
        Objects.requireNonNull(chars, "chars");
        return new SecretBuffer(chars);
    }

    public static SecretBuffer copyOf(final CharSequence value) {
        Objects.requireNonNull(value, "value");
        final char[] copy = new char[value.length()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = value.charAt(i);
        }
        return new SecretBuffer(copy);
    }

    /**
     * Lends the live backing array to {@code action}. The array must not escape the callback.
     *
     * @throws IllegalStateException if the buffer has been destroyed
     */
    public synchronized <T> T apply(final Function<char[], T> action) {
        checkNotDestroyed();
        return action.apply(chars);
    }

    /**
     * Returns the secret as a String, for handing to APIs that accept nothing else.
     *
     * @throws IllegalStateException if the buffer has been destroyed
     */
    public synchronized String reveal() {
        checkNotDestroyed();
        return new String(chars);
    }

    /**
     * Returns an independent buffer holding the same characters.
     */
    public synchronized SecretBuffer copy() {
        checkNotDestroyed();
        return new SecretBuffer(chars.clone());
    }

    public synchronized int length() {
        checkNotDestroyed();
        return chars.length;
    }

    public synchronized boolean startsWith(final String prefix) {
        checkNotDestroyed();
        if (prefix.length() > chars.length) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (chars[i] != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Overwrites every character with {@code '\0'}. Idempotent.
     */
    @Override
    public synchronized void destroy() {
        Arrays.fill(chars, '\0');
        destroyed = true;
    }

    @Override
    public synchronized boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("SecretBuffer has been destroyed");
        }
    }

    @Override
    public String toString() {
        return isDestroyed() ? "SecretBuffer[destroyed]" : "SecretBuffer[***]";
    }
}
