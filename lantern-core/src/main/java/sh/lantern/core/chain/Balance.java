// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.chain;

import java.math.BigDecimal;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Account balance in credits.
 *
 * @param publicBalance  credits held in the public {@code credits.aleo/account} mapping
 * @param privateBalance credits held in unspent private records
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Balance(
        @JsonProperty("public") BigDecimal publicBalance,
        @JsonProperty("private") BigDecimal privateBalance) {

    public static final Balance ZERO = new Balance(BigDecimal.ZERO, BigDecimal.ZERO);

    /** Microcredits per credit. */
    public static final BigDecimal MICROCREDITS = BigDecimal.valueOf(1_000_000L);

    /** Decimal places a credit amount may carry. */
    public static final int CREDIT_DECIMALS = 6;

    public Balance {
        Objects.requireNonNull(publicBalance, "publicBalance");
        Objects.requireNonNull(privateBalance, "privateBalance");
    }

    public BigDecimal total() {
        return publicBalance.add(privateBalance);
    }

    public static BigDecimal fromMicrocredits(final long microcredits) {
        return BigDecimal.valueOf(microcredits).divide(MICROCREDITS);
    }

    /**
     * Whether {@code credits} is a whole number of microcredits.
     */
    public static boolean isWholeMicrocredits(final BigDecimal credits) {
        return credits.stripTrailingZeros().scale() <= CREDIT_DECIMALS;
    }

    /**
     * @throws ArithmeticException if {@code credits} is not a whole number of microcredits or
     *                             does not fit a {@code long}
     */
    public static long toMicrocredits(final BigDecimal credits) {
        return credits.multiply(MICROCREDITS).longValueExact();
    }
}
