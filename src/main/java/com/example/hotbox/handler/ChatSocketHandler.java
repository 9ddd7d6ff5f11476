package com.example.hotbox.handler;

import com.example.hotbox.model.OnlineUser;
import com.example.hotbox.model.PresenceChange;
import com.example.hotbox.model.UserStatus;
import com.example.hotbox.service.PresenceListener;
import com.example.hotbox.service.PresenceService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for the chat socket (default /ws/chat). Presence plumbing only:
 * - open: connect(userId, sessionId, displayName, agent) + "onlineUsers" snapshot to the caller
 * - "ping" → "pong" (also counts as heartbeat), {"type":"heartbeat"}
 * - {"type":"setStatus","status":"DoNotDisturb"}; an Offline request gets an "error" frame
 * - close: disconnect (grace period starts when it was the last connection)
 * Every presence transition is broadcast to all open chat sockets as "userStatusChanged".
 *
 * Identity comes from the handshake query (userId, displayName, agent) as set by the
 * authenticating proxy in front of this server.
 */
@Component
public class ChatSocketHandler extends TextWebSocketHandler implements PresenceListener {

    private static final Logger log = LoggerFactory.getLogger(ChatSocketHandler.class);

    private final PresenceService presence;
    private final ObjectMapper objectMapper;
    private final SocketSessions sessions;

    /** Per WebSocket session → user id */
    private final Map<String, String> userBySession = new ConcurrentHashMap<>();

    public ChatSocketHandler(PresenceService presence, ObjectMapper objectMapper) {
        this.presence = presence;
        this.objectMapper = objectMapper;
        this.sessions = new SocketSessions(objectMapper);
    }

    @PostConstruct
    void subscribe() {
        presence.addListener(this);
    }

    @PreDestroy
    void unsubscribe() {
        presence.removeListener(this);
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        Map<String, String> q = SocketSessions.parseQuery(session.getUri());
        String userId = q.getOrDefault("userId", "").trim();
        String displayName = q.getOrDefault("displayName", "").trim();
        boolean agent = SocketSessions.parseOn(q.get("agent"));

        if (userId.isEmpty()) {
            log.warn("WS CHAT REJECT sid={}: no user identity", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unable to determine user identity"));
            return;
        }

        log.info("WS CHAT OPEN user={} name={} sid={}", userId, displayName, session.getId());
        sessions.register(session);
        userBySession.put(session.getId(), userId);

        presence.connect(userId, session.getId(), displayName, agent);

        List<Map<String, Object>> users = new ArrayList<>();
        for (OnlineUser u : presence.snapshot()) {
            users.add(userPayload(u.userId(), u.displayName(), u.status(), u.agent()));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "onlineUsers");
        payload.put("users", users);
        sessions.sendJson(session.getId(), payload);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        String userId = userBySession.get(session.getId());
        if (userId == null) {
            log.warn("WS CHAT message from unknown session sid={}", session.getId());
            return;
        }
        String text = message.getPayload();

        try {
            // Heartbeat (plain-text variant)
            if ("ping".equals(text)) {
                presence.heartbeat(userId);
                sessions.send(session.getId(), "pong");
                return;
            }

            JsonNode node = objectMapper.readTree(text);
            String type = node.path("type").asText("");
            switch (type) {
                case "heartbeat":
                    presence.heartbeat(userId);
                    break;
                case "setStatus":
                    UserStatus desired = UserStatus.parse(node.path("status").asText(null));
                    if (!presence.requestStatus(userId, desired)) {
                        sendError(session, "Cannot set status to " + node.path("status").asText("?")
                                + ". Disconnect instead.");
                    }
                    break;
                default:
                    log.debug("WS CHAT unknown frame type '{}' from user={}", type, userId);
                    sendError(session, "Unknown message type: " + type);
            }
        } catch (Exception e) {
            log.warn("WS CHAT message handling failed (user={}, sid={}): {}", userId, session.getId(), e.toString());
            sendError(session, "Malformed message");
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        sessions.unregister(session.getId());
        String userId = userBySession.remove(session.getId());
        if (userId == null) {
            log.info("WS CHAT CLOSE sid={} code={}", session.getId(), status.getCode());
            return;
        }
        log.info("WS CHAT CLOSE user={} sid={} code={} reason={}",
                userId, session.getId(), status.getCode(), status.getReason());

        boolean lastConnection = presence.disconnect(userId, session.getId());
        if (lastConnection) {
            log.debug("User {} has no chat connection left, grace period running", userId);
        }
    }

    @Override
    public void onStatusChanged(PresenceChange change) {
        Map<String, Object> payload = userPayload(change.userId(), change.displayName(), change.status(), change.agent());
        payload.put("type", "userStatusChanged");
        sessions.broadcastJson(payload);
    }

    private void sendError(WebSocketSession session, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "error");
        payload.put("message", message);
        sessions.sendJson(session.getId(), payload);
    }

    private static Map<String, Object> userPayload(String userId, String displayName, UserStatus status, boolean agent) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("userId", userId);
        m.put("displayName", displayName);
        m.put("status", status);
        m.put("isAgent", agent);
        return m;
    }
}
