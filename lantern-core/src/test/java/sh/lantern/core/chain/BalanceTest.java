// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.chain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class BalanceTest {

    @Test
    void convertsBetweenCreditsAndMicrocredits() {
        assertEquals(1_500_000L, Balance.toMicrocredits(new BigDecimal("1.5")));
        assertEquals(1L, Balance.toMicrocredits(new BigDecimal("0.000001")));
        assertEquals(0, new BigDecimal("0.25").compareTo(Balance.fromMicrocredits(250_000L)));
    }

    @Test
    void onlyWholeMicrocreditsAreRepresentable() {
        assertTrue(Balance.isWholeMicrocredits(new BigDecimal("0.000001")));
        assertTrue(Balance.isWholeMicrocredits(new BigDecimal("2.500000000")));
        assertTrue(Balance.isWholeMicrocredits(new BigDecimal("1E+3")));
        assertFalse(Balance.isWholeMicrocredits(new BigDecimal("0.0000001")));

        assertThrows(ArithmeticException.class, () -> Balance.toMicrocredits(new BigDecimal("0.0000001")));
    }

    @Test
    void totalAddsBothPools() {
        Balance balance = new Balance(new BigDecimal("1.25"), new BigDecimal("0.75"));

        assertEquals(0, new BigDecimal("2").compareTo(balance.total()));
    }
}
