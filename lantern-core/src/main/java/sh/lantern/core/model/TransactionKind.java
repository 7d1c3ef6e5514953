// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionKind {
    SEND,
    RECEIVE,
    EXECUTE,
    DEPLOY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TransactionKind fromWireName(final String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
