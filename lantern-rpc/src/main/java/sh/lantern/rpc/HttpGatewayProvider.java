// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import static sh.lantern.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;

import sh.lantern.core.LogFormatter;
import sh.lantern.core.Trace;
import sh.lantern.core.error.NetworkException;
import sh.lantern.rpc.internal.RpcUtils;

/**
 * {@link GatewayProvider} over HTTP POST using {@link java.net.http.HttpClient}.
 *
 * <p>
 * <strong>Error codes:</strong>
 * <ul>
 * <li>-32000: I/O failure or interruption</li>
 * <li>-32001: non-2xx HTTP status</li>
 * <li>-32700: request or response (de)serialization failure</li>
 * <li>anything else: the daemon's own JSON-RPC error code</li>
 * </ul>
 */
public final class HttpGatewayProvider implements GatewayProvider {

    static final int TRANSPORT_ERROR = -32000;
    static final int HTTP_ERROR = -32001;
    static final int PARSE_ERROR = -32700;

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpGatewayProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public static HttpGatewayProvider create(final RpcConfig config) {
        return new HttpGatewayProvider(config);
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws NetworkException {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request = new JsonRpcRequest("2.0", method, safeParams, String.valueOf(requestId));

        final String payload = serialize(request, requestId);
        final HttpRequest httpRequest = buildRequest(payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(method, httpRequest, requestId);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            Trace.RPC.log(
                    LogFormatter.formatRpcError(method, response.statusCode(),
                            "HTTP " + response.statusCode(), durationMicros));
            throw new NetworkException(
                    HTTP_ERROR,
                    "HTTP error for method " + method + ": " + response.statusCode(),
                    response.body(),
                    requestId);
        }

        final JsonRpcResponse rpcResponse = parseResponse(method, response.body(), requestId);
        if (rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            Trace.RPC.log(
                    LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new NetworkException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId);
        }

        Trace.RPC.log(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    private String serialize(final JsonRpcRequest request, final long requestId) {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new NetworkException(
                    PARSE_ERROR,
                    "Unable to serialize JSON-RPC request for " + request.method(),
                    null,
                    requestId,
                    e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private HttpResponse<String> execute(final String method, final HttpRequest request, final long requestId) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(
                    TRANSPORT_ERROR, "Interrupted during JSON-RPC call " + method, null, requestId, e);
        } catch (IOException e) {
            throw new NetworkException(
                    TRANSPORT_ERROR, "Network error during JSON-RPC call " + method, null, requestId, e);
        }
    }

    private JsonRpcResponse parseResponse(final String method, final String body, final long requestId) {
        try {
            return MAPPER.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new NetworkException(
                    PARSE_ERROR,
                    "Unable to parse JSON-RPC response for method " + method,
                    body,
                    requestId,
                    e);
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout;
        private Duration readTimeout;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpGatewayProvider build() {
            return new HttpGatewayProvider(new RpcConfig(url, connectTimeout, readTimeout, headers));
        }
    }
}
