// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import static org.junit.jupiter.api.Assertions.*;

import io.netty.channel.embedded.EmbeddedChannel;
import io.strand.core.error.BlockDecodingException;
import io.strand.core.error.ConnectionException;
import io.strand.events.RawEvent;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class WebSocketEventConnectionTest {

    private static final String BLOCK_1 = "{\"type\":\"block\",\"block\":{\"number\":1,\"channelId\":\"ch\"}}";

    @Test
    void decodesQueuedFramesInOrder() throws Exception {
        WebSocketEventConnection connection = new WebSocketEventConnection("ws://peer0");
        connection.onText(BLOCK_1);
        connection.onText(BLOCK_1.replace("\"number\":1", "\"number\":2"));

        assertEquals(1, connection.next().blockNumber());
        RawEvent second = connection.next();
        assertEquals(2, second.blockNumber());
    }

    @Test
    void undecodableFrameDoesNotEndStream() throws Exception {
        WebSocketEventConnection connection = new WebSocketEventConnection("ws://peer0");
        connection.onText("garbage");
        connection.onText(BLOCK_1);

        assertThrows(BlockDecodingException.class, connection::next);
        assertEquals(1, connection.next().blockNumber());
    }

    @Test
    void orderlyCloseEndsStreamAfterBufferedFrames() throws Exception {
        WebSocketEventConnection connection = new WebSocketEventConnection("ws://peer0");
        connection.onText(BLOCK_1);
        connection.onClosed(null);
        connection.onText(BLOCK_1);

        assertNotNull(connection.next());
        assertNull(connection.next());
        assertNull(connection.next());
    }

    @Test
    void failureSurfacesAsConnectionException() {
        WebSocketEventConnection connection = new WebSocketEventConnection("ws://peer0");
        IOException cause = new IOException("connection reset");
        connection.onClosed(cause);

        ConnectionException ex = assertThrows(ConnectionException.class, connection::next);
        assertSame(cause, ex.getCause());
        assertEquals("ws://peer0", ex.endpoint());
        assertThrows(ConnectionException.class, connection::next);
    }

    @Test
    void closeClosesChannelAndEndsStream() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel();
        WebSocketEventConnection connection = new WebSocketEventConnection("ws://peer0");
        connection.attach(channel);

        connection.close();
        connection.close();

        assertFalse(channel.isOpen());
        assertNull(connection.next());
    }

    @Test
    void pausesReadingWhenInboxFillsUp() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel();
        WebSocketEventConnection connection = new WebSocketEventConnection("ws://peer0");
        connection.attach(channel);

        for (int i = 0; i < WebSocketEventConnection.HIGH_WATER_MARK; i++) {
            connection.onText(BLOCK_1);
        }
        assertFalse(channel.config().isAutoRead());

        int toDrain = WebSocketEventConnection.HIGH_WATER_MARK - WebSocketEventConnection.LOW_WATER_MARK;
        for (int i = 0; i < toDrain; i++) {
            connection.next();
        }
        assertTrue(channel.config().isAutoRead());
        assertEquals(WebSocketEventConnection.LOW_WATER_MARK, connection.pendingFrames());
    }
}
