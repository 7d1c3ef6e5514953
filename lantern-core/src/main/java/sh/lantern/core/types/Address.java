// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.types;

import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.lantern.core.error.ValidationException;

/**
 * Bech32 Aleo account address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "aleo1"</li>
 * <li>Must be exactly 63 characters long</li>
 * <li>Data part uses the lowercase bech32 alphabet</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    public static final String PREFIX = "aleo1";
    public static final int LENGTH = 63;

    private static final Pattern BECH32 =
            Pattern.compile("^aleo1[qpzry9x8gf2tvdw0s3jn54khce6mua7l]{58}$");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!isValid(value)) {
            throw new ValidationException("Invalid Aleo address: " + value);
        }
    }

    public static Address of(final String value) {
        return new Address(value);
    }

    public static boolean isValid(final String value) {
        return value != null && value.length() == LENGTH && BECH32.matcher(value).matches();
    }

    @Override
    public String toString() {
        return value;
    }
}
