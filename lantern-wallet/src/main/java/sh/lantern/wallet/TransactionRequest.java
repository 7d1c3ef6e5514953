// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A program execution a web page asks the wallet to sign and submit.
 *
 * @param programId    program to execute, e.g. {@code token.aleo}
 * @param functionName function within the program
 * @param inputs       function inputs as Aleo literals
 * @param fee          fee in credits, or {@code null} for the configured default
 */
public record TransactionRequest(
        String programId,
        String functionName,
        List<String> inputs,
        @Nullable BigDecimal fee) {

    public TransactionRequest {
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(functionName, "functionName");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    /**
     * The fields shown in the approval dialog.
     */
    Map<String, Object> describe(final BigDecimal effectiveFee) {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("programId", programId);
        payload.put("functionName", functionName);
        payload.put("inputs", inputs);
        payload.put("fee", effectiveFee);
        return payload;
    }
}
