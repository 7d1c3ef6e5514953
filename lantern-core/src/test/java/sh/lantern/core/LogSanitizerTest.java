// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsSecretJsonFields() {
        final String input = "{\"viewKey\":\"AViewKey1abc\",\"password\":\"hunter22\",\"address\":\"aleo1xyz\"}";

        final String out = LogSanitizer.sanitize(input);

        assertFalse(out.contains("hunter22"));
        assertFalse(out.contains("AViewKey1abc"));
        assertTrue(out.contains("\"address\":\"aleo1xyz\""));
    }

    @Test
    void redactsBareKeyLiterals() {
        final String out = LogSanitizer.sanitize("params=[\"APrivateKey1abcDEF\",\"aleo1to\"]");

        assertEquals("params=[\"APrivateKey1***[REDACTED]***\",\"aleo1to\"]", out);
    }

    @Test
    void truncatesLongInput() {
        final String out = LogSanitizer.sanitize("x".repeat(5000));

        assertEquals(2000, out.length());
        assertTrue(out.endsWith("...(truncated)"));
    }

    @Test
    void nullBecomesLiteral() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }
}
