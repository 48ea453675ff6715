package com.coedit.socket.ws;

import com.coedit.core.auth.AccessToken;
import com.coedit.core.msg.OutboundType;
import com.coedit.core.util.JsonUtils;
import com.coedit.socket.auth.AuthGate;
import com.coedit.socket.auth.HmacTokenValidator;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.http.HttpServer;
import com.coedit.socket.session.SessionTerminatedException;
import com.coedit.socket.support.Await;
import com.coedit.socket.support.InMemoryDocumentStore;
import com.coedit.socket.support.InMemoryUserDirectory;
import com.coedit.socket.support.LoopbackBroker;
import com.coedit.socket.support.TestClient;
import com.coedit.socket.support.TestNode;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Drives the WebSocket route over a real socket.
 */
class WebSocketHandlerTest {

    private InMemoryDocumentStore store;
    private SocketConfig config;
    private TestNode node;
    private DisposableServer server;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        config = TestNode.config("node-ws").toBuilder()
            .idleTimeout(1)
            .pingInterval(30)
            .build();
        node = new TestNode(config, store, new InMemoryUserDirectory(), new LoopbackBroker().newTransport(), Clock.systemUTC());

        AuthGate authGate = new AuthGate(new HmacTokenValidator(config.getTokenSecret()), node.metrics);
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            authGate, new WebSocketHandler(config, node.lifecycle, node.dispatcher, node.metrics)
        );
        server = new HttpServer(config, node.registry, node.bus, null, upgradeHandler).start();
    }

    @AfterEach
    void tearDown() {
        server.disposeNow(Duration.ofSeconds(5));
        node.close();
    }

    private String url(String documentId, String token) {
        return "ws://localhost:" + server.port() + "/ws/" + documentId + (token == null ? "" : "?token=" + token);
    }

    private String token(String userId) {
        return AccessToken.issue(userId, userId, Instant.now().plusSeconds(300), config.getTokenSecret());
    }

    private static WebSocketCloseStatus closeStatus(String url) {
        return HttpClient.create()
            .websocket()
            .uri(url)
            .handle((inbound, outbound) -> inbound.receiveCloseStatus())
            .blockFirst(Duration.ofSeconds(10));
    }

    @Test
    void testMissingToken_ClosesWithPolicyViolation() {
        WebSocketCloseStatus status = closeStatus(url("d1", null));

        assertNotNull(status);
        assertEquals(SessionTerminatedException.POLICY_VIOLATION, status.code());
        assertEquals("Missing token", status.reasonText());
    }

    @Test
    void testForgedToken_ClosesWithPolicyViolation() {
        String forged = AccessToken.issue("A", "alice", Instant.now().plusSeconds(300), "some-other-secret");

        WebSocketCloseStatus status = closeStatus(url("d1", forged));

        assertNotNull(status);
        assertEquals(SessionTerminatedException.POLICY_VIOLATION, status.code());
        assertEquals("Invalid token", status.reasonText());
        assertEquals(List.of(), node.registry.activeUsers("d1"));
    }

    @Test
    void testBearerHeader_IsAccepted() throws Exception {
        store.seed("d1", "hello");

        String first = HttpClient.create()
            .headers(headers -> headers.set("Authorization", "Bearer " + token("A")))
            .websocket()
            .uri(url("d1", null))
            .handle((inbound, outbound) -> inbound.receive().asString().take(1))
            .blockFirst(Duration.ofSeconds(10));

        JsonNode init = JsonUtils.mapper().readTree(first);
        assertEquals("init", init.get("type").asText());
        assertEquals("A", init.get("user_id").asText());
        assertEquals("hello", init.get("content").asText());
    }

    @Test
    void testUnloadableDocument_ClosesWithInternalError() {
        store.failLoads(true);

        WebSocketCloseStatus status = closeStatus(url("d1", token("A")));

        assertNotNull(status);
        assertEquals(SessionTerminatedException.INTERNAL_ERROR, status.code());
        assertEquals("Document unavailable", status.reasonText());
    }

    @Test
    @DisplayName("a silent client is closed for idleness and its peers see it leave")
    void testIdleClient_ClosedAndAnnouncedAsLeft() {
        TestClient peer = node.connect("B", "d1");

        WebSocketCloseStatus status = closeStatus(url("d1", token("A")));

        assertNotNull(status);
        assertEquals(1001, status.code());
        assertEquals("Idle timeout", status.reasonText());

        Await.until(() -> peer.received(OutboundType.USER_LEFT).stream()
            .anyMatch(frame -> "A".equals(frame.getUserId())), "user_left for A");
        assertEquals(1, peer.received(OutboundType.USER_JOINED).size());
        assertEquals(List.of("B"), node.registry.activeUsers("d1"));
    }
}
