// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TraceTest {

    private final Logger rpcLogger = (Logger) LoggerFactory.getLogger("sh.lantern.trace.rpc");
    private final Logger txLogger = (Logger) LoggerFactory.getLogger("sh.lantern.trace.tx");
    private ListAppender<ILoggingEvent> rpc;
    private ListAppender<ILoggingEvent> tx;

    @BeforeEach
    void attach() {
        rpc = new ListAppender<>();
        rpc.start();
        rpcLogger.addAppender(rpc);
        tx = new ListAppender<>();
        tx.start();
        txLogger.addAppender(tx);
    }

    @AfterEach
    void reset() {
        Trace.disableAll();
        rpcLogger.detachAndStopAllAppenders();
        txLogger.detachAndStopAllAppenders();
    }

    @Test
    void channelsAreOffByDefault() {
        Trace.RPC.log("should not appear");
        Trace.TX.log(LogFormatter.formatTxStatus("at1abc", "CONFIRMED"));

        assertFalse(Trace.RPC.isEnabled());
        assertTrue(rpc.list.isEmpty());
        assertTrue(tx.list.isEmpty());
    }

    @Test
    void channelsWriteToTheirOwnLogger() {
        Trace.TX.setEnabled(true);
        Trace.RPC.log(LogFormatter.formatRpc("balance_get", 812));
        Trace.TX.log(LogFormatter.formatTxId("at1abc", 1_500));

        assertTrue(rpc.list.isEmpty());
        assertEquals(1, tx.list.size());
        assertTrue(tx.list.get(0).getFormattedMessage().contains("txId=at1abc"));
    }

    @Test
    void keyMaterialIsRedacted() {
        Trace.RPC.setEnabled(true);
        Trace.RPC.log("payload {\"privateKey\":\"APrivateKey1zkp8CZNn3yeCseEtxuVPbDCwSyhGW6yZKUYKfgXmcpoGPWH\"}");

        assertEquals(1, rpc.list.size());
        final String message = rpc.list.get(0).getFormattedMessage();
        assertTrue(message.contains("***[REDACTED]***"));
        assertFalse(message.contains("zkp8CZNn3"));
    }

    @Test
    void disableAllSilencesEveryChannel() {
        Trace.RPC.setEnabled(true);
        Trace.TX.setEnabled(true);

        Trace.disableAll();
        Trace.RPC.log("after");
        Trace.TX.log("after");

        assertTrue(rpc.list.isEmpty());
        assertTrue(tx.list.isEmpty());
    }
}
