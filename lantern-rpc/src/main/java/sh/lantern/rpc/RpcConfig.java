// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for {@link HttpGatewayProvider}.
 *
 * @param url            daemon endpoint, e.g. {@code http://127.0.0.1:3030/rpc}
 * @param connectTimeout TCP connect timeout (default 10s)
 * @param readTimeout    per-request timeout (default 120s; proving a transfer is slow)
 * @param headers        extra HTTP headers sent with every request
 */
public record RpcConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(120);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RpcConfig withDefaults(final String url) {
        return new RpcConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
