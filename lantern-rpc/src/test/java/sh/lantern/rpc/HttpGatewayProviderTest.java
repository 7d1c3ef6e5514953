// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.lantern.core.error.NetworkException;

class HttpGatewayProviderTest {

    private HttpServer server;
    private URI baseUri;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void sendSuccessResponse() {
        final AtomicReference<String> requestBody = new AtomicReference<>();
        server.createContext(
                "/",
                exchange -> {
                    requestBody.set(read(exchange));
                    respond(exchange, 200, """
                            {"jsonrpc":"2.0","result":1234,"id":"1","extra":"ignored"}
                            """);
                });

        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString()).build();
        JsonRpcResponse response = provider.send("block_height", List.of());

        assertEquals(1234, response.result());
        assertNull(response.error());
        assertTrue(requestBody.get().contains("\"method\":\"block_height\""));
        assertTrue(requestBody.get().contains("\"jsonrpc\":\"2.0\""));
    }

    @Test
    void sendsConfiguredHeaders() {
        final AtomicReference<String> token = new AtomicReference<>();
        server.createContext(
                "/",
                exchange -> {
                    token.set(exchange.getRequestHeaders().getFirst("X-Daemon-Token"));
                    respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":null,\"id\":\"1\"}");
                });

        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString())
                .header("X-Daemon-Token", "abc")
                .build();
        provider.send("block_height", List.of());

        assertEquals("abc", token.get());
    }

    @Test
    void jsonRpcErrorThrows() {
        server.createContext(
                "/",
                exchange -> respond(exchange, 200, """
                        {"jsonrpc":"2.0","error":{"code":-32004,"message":"Transaction not found","data":{"txId":"at1x"}},"id":"1"}
                        """));

        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString()).build();
        NetworkException ex = assertThrows(
                NetworkException.class, () -> provider.send("transaction_get", List.of("at1x")));

        assertTrue(ex.isNotFound());
        assertEquals("at1x", ex.data());
        assertTrue(ex.getMessage().contains("Transaction not found"));
        assertNotNull(ex.requestId());
    }

    @Test
    void httpErrorThrows() {
        server.createContext("/", exchange -> respond(exchange, 503, "busy"));

        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString()).build();
        NetworkException ex = assertThrows(
                NetworkException.class, () -> provider.send("block_height", List.of()));

        assertEquals(-32001, ex.code());
        assertEquals("busy", ex.data());
    }

    @Test
    void malformedBodyThrowsParseError() {
        server.createContext("/", exchange -> respond(exchange, 200, "not json"));

        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString()).build();
        NetworkException ex = assertThrows(
                NetworkException.class, () -> provider.send("block_height", List.of()));

        assertEquals(-32700, ex.code());
    }

    @Test
    void connectionRefusedIsTransportError() {
        final int port = server.getAddress().getPort();
        server.stop(0);

        GatewayProvider provider = HttpGatewayProvider.builder("http://127.0.0.1:" + port).build();
        NetworkException ex = assertThrows(
                NetworkException.class, () -> provider.send("block_height", List.of()));

        assertEquals(-32000, ex.code());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    static String read(final HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static void respond(final HttpExchange exchange, final int statusCode, final String body)
            throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
