// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.rpc;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.lantern.core.Trace;
import sh.lantern.core.error.NetworkException;

class HttpGatewayProviderTraceTest {

    private HttpServer server;
    private URI baseUri;
    private final Logger traceLogger = (Logger) LoggerFactory.getLogger("sh.lantern.trace.rpc");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        appender = new ListAppender<>();
        appender.start();
        traceLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        Trace.disableAll();
        traceLogger.detachAndStopAllAppenders();
        server.stop(0);
    }

    @Test
    void logsRpcTimingWhenEnabled() {
        server.createContext(
                "/",
                exchange -> HttpGatewayProviderTest.respond(
                        exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":\"sign1abc\",\"id\":\"1\"}"));

        Trace.RPC.setEnabled(true);
        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString()).build();
        provider.send("message_sign", List.of("APrivateKey1zkp8CZNn3yeCseEtxuVPbDCwSyhGW6yZKUYKfgXmcpoGPWH", "hi"));

        assertFalse(appender.list.isEmpty());
        final String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains("[RPC] method=message_sign"));
        assertFalse(message.contains("zkp8CZNn3"));
    }

    @Test
    void logsErrorsWhenEnabled() {
        server.createContext(
                "/",
                exchange -> HttpGatewayProviderTest.respond(
                        exchange, 200,
                        "{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32000,\"message\":\"boom\"},\"id\":\"1\"}"));

        Trace.RPC.setEnabled(true);
        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString()).build();
        assertThrows(NetworkException.class, () -> provider.send("block_height", List.of()));

        assertTrue(appender.list.get(0).getFormattedMessage().contains("[RPC-ERROR] method=block_height code=-32000"));
    }

    @Test
    void silentWhenDisabled() {
        server.createContext(
                "/",
                exchange -> HttpGatewayProviderTest.respond(
                        exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":1,\"id\":\"1\"}"));

        GatewayProvider provider = HttpGatewayProvider.builder(baseUri.toString()).build();
        provider.send("block_height", List.of());

        assertTrue(appender.list.isEmpty());
    }
}
