// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.types;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A permission a page origin can hold over the wallet.
 *
 * <p>Serialized in camelCase ({@code connect}, {@code viewKey}, ...) so that persisted
 * permission tables stay readable by older builds.
 */
public enum Capability {
    /** See the wallet address and ask for further capabilities. */
    CONNECT("connect"),
    /** Receive the account view key. */
    VIEW_KEY("viewKey"),
    /** Request message signatures. */
    SIGN("sign"),
    /** Request program executions. */
    TRANSACTION("transaction"),
    /** Read the account's records. */
    RECORDS("records"),
    /** Decrypt ciphertexts with the view key. */
    DECRYPT("decrypt");

    private final String wireName;

    Capability(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Capability fromWireName(final String name) {
        for (final Capability capability : values()) {
            if (capability.wireName.equals(name) || capability.name().equals(name.toUpperCase(Locale.ROOT))) {
                return capability;
            }
        }
        throw new IllegalArgumentException("Unknown capability: " + name);
    }
}
