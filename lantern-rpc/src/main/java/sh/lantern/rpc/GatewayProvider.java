// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import java.util.List;

import sh.lantern.core.error.NetworkException;

/**
 * Transport for JSON-RPC calls to the wallet daemon.
 *
 * <p>
 * Implementations handle:
 * <ul>
 * <li>Serializing requests to JSON</li>
 * <li>Sending them over the wire</li>
 * <li>Mapping transport failures and error objects to {@link NetworkException}</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @see HttpGatewayProvider
 * @see RpcGateway
 */
public interface GatewayProvider extends AutoCloseable {

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the JSON-RPC method name
     * @param params the positional parameters
     * @return the response, never carrying an error
     * @throws NetworkException if the request fails or the daemon returns an error object
     */
    JsonRpcResponse send(String method, List<?> params) throws NetworkException;

    @Override
    default void close() {
    }
}
