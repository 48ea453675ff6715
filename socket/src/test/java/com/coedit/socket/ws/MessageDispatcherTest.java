package com.coedit.socket.ws;

import com.coedit.core.metrics.MetricsNames;
import com.coedit.core.metrics.MetricsTags;
import com.coedit.core.msg.OutboundType;
import com.coedit.core.msg.ServerMessage;
import com.coedit.socket.session.SessionState;
import com.coedit.socket.session.SessionTerminatedException;
import com.coedit.socket.support.InMemoryDocumentStore;
import com.coedit.socket.support.InMemoryUserDirectory;
import com.coedit.socket.support.LoopbackBroker;
import com.coedit.socket.support.TestClient;
import com.coedit.socket.support.TestNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private TestNode node;
    private TestClient alice;
    private TestClient bob;

    @BeforeEach
    void setUp() {
        node = new TestNode("node-1", new InMemoryDocumentStore(), new InMemoryUserDirectory(),
            new LoopbackBroker().newTransport(), Clock.fixed(NOW, ZoneOffset.UTC));
        alice = node.connect("A", "d1");
        bob = node.connect("B", "d1");
        alice.clear();
        bob.clear();
    }

    @AfterEach
    void tearDown() {
        node.close();
    }

    @Test
    void testUpdateWithoutTimestamp_UsesServerTime() {
        node.send(alice, "{\"type\":\"update\",\"data\":{\"content\":\"hi\"}}");

        ServerMessage update = bob.last();
        assertEquals(OutboundType.UPDATE, update.getType());
        assertEquals(NOW.toEpochMilli(), update.getTimestamp());
        assertEquals(List.of(), alice.received());
    }

    @Test
    void testChat_IsStampedByServer() {
        node.send(alice, "{\"type\":\"chat\",\"message\":\"hello\",\"timestamp\":5}");

        ServerMessage chat = bob.last();
        assertEquals(OutboundType.CHAT, chat.getType());
        assertEquals("hello", chat.getMessage());
        assertEquals("A", chat.getUserId());
        assertEquals(NOW.toEpochMilli(), chat.getTimestamp());
    }

    @Test
    void testCursor_PassesPositionThrough() {
        node.send(alice, "{\"type\":\"cursor\",\"position\":{\"lineNumber\":2,\"column\":4},"
            + "\"selection\":{\"startLineNumber\":2,\"endLineNumber\":3}}");

        ServerMessage cursor = bob.last();
        assertEquals(OutboundType.CURSOR, cursor.getType());
        assertEquals(4, cursor.getPosition().get("column").asInt());
        assertEquals(3, cursor.getSelection().get("endLineNumber").asInt());
    }

    @Test
    void testPing_DeliversNothing() {
        node.send(alice, "{\"type\":\"ping\"}");

        assertEquals(List.of(), bob.received());
        assertEquals(NOW.toEpochMilli(), alice.session().getLastActivity());
    }

    @Test
    void testMalformedFrame_IsDroppedAndConnectionStaysOpen() {
        node.send(alice, "{\"type\":\"update\"}");
        node.send(alice, "{\"type\":\"update\",\"data\":{\"content\":\"ok\"},\"timestamp\":1}");

        assertEquals(SessionState.ACTIVE, alice.session().getState());
        assertEquals("ok", bob.last().getData().getContent());
        assertEquals(1.0, node.counter(MetricsNames.DROPS_TOTAL, MetricsTags.REASON, "malformed"));
    }

    @Test
    void testProtocolStorm_DisconnectsSession() {
        // maxBadFrames is 3 in the test config
        for (int i = 0; i < 3; i++) {
            node.send(alice, "garbage");
        }
        assertEquals(SessionState.ACTIVE, alice.session().getState());

        node.send(alice, "garbage");

        assertEquals(SessionState.CLOSED, alice.session().getState());
        SessionTerminatedException reason = assertInstanceOf(SessionTerminatedException.class, alice.terminatedWith());
        assertEquals(SessionTerminatedException.POLICY_VIOLATION, reason.getCloseCode());
        assertEquals("A", bob.last().getUserId());
        assertEquals(OutboundType.USER_LEFT, bob.last().getType());
        assertEquals(1.0, node.counter(MetricsNames.DISCONNECTS_TOTAL, MetricsTags.REASON, "protocol_storm"));
    }

    @Test
    void testValidFrame_ResetsMalformedRun() {
        for (int round = 0; round < 3; round++) {
            node.send(alice, "garbage");
            node.send(alice, "garbage");
            node.send(alice, "garbage");
            node.send(alice, "{\"type\":\"ping\"}");
        }

        assertEquals(SessionState.ACTIVE, alice.session().getState());
    }

    @Test
    void testFramesAfterDisconnect_AreIgnored() {
        node.disconnect(alice);
        bob.clear();

        node.send(alice, "{\"type\":\"chat\",\"message\":\"ghost\"}");

        assertTrue(bob.received().isEmpty());
    }
}
