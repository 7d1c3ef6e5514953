// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import static sh.lantern.rpc.internal.RpcUtils.MAPPER;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;

import org.jspecify.annotations.Nullable;

/**
 * Daemon reply to a {@link JsonRpcRequest}. Exactly one of {@code result} and {@code error} is
 * meaningful.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        String id) {

    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    public boolean hasError() {
        return error != null;
    }

    /** Scalar results such as transaction ids and signatures. */
    public @Nullable String resultAsString() {
        return result == null ? null : result.toString();
    }

    /**
     * @throws IllegalArgumentException if the result is not a JSON object
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null || result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, OBJECT);
    }

    public <T> @Nullable T resultAs(final TypeReference<T> type) {
        return result == null ? null : MAPPER.convertValue(result, type);
    }
}
