package com.example.hotbox.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection id → open session. The connection id is the WebSocket session id, which is
 * what the realtime registries know as the connection handle. Sends go through
 * {@link ConcurrentWebSocketSessionDecorator} because events arrive from the event thread
 * while handler threads may be replying on the same session.
 */
public class SocketSessions {

    private static final Logger log = LoggerFactory.getLogger(SocketSessions.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> byId = new ConcurrentHashMap<>();

    public SocketSessions(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(WebSocketSession session) {
        byId.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void unregister(String connectionId) {
        if (connectionId != null) byId.remove(connectionId);
    }

    public int size() {
        return byId.size();
    }

    /** Serializes {@code payload} and sends it; returns false if the connection is gone. */
    public boolean sendJson(String connectionId, Object payload) {
        String json = toJson(payload);
        return json != null && send(connectionId, json);
    }

    public boolean send(String connectionId, String text) {
        if (connectionId == null) return false;
        WebSocketSession s = byId.get(connectionId);
        if (s == null) return false;
        if (!s.isOpen()) {
            byId.remove(connectionId);
            return false;
        }
        try {
            s.sendMessage(new TextMessage(text));
            return true;
        } catch (SessionLimitExceededException e) {
            byId.remove(connectionId);
            log.warn("WS send limit exceeded, dropping connection={}: {}", connectionId, e.getMessage());
            closeQuietly(s, e.getStatus());
            return false;
        } catch (Exception e) {
            log.warn("WS send failed (connection={}): {}", connectionId, e.toString());
            return false;
        }
    }

    private static void closeQuietly(WebSocketSession s, CloseStatus status) {
        try {
            s.close(status != null ? status : CloseStatus.SESSION_NOT_RELIABLE);
        } catch (Exception e) {
            log.debug("WS close after send failure failed: {}", e.toString());
        }
    }

    public void sendJsonToAll(Collection<String> connectionIds, Object payload) {
        String json = toJson(payload);
        if (json == null) return;
        for (String id : connectionIds) send(id, json);
    }

    public void broadcastJson(Object payload) {
        sendJsonToAll(byId.keySet(), payload);
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("WS payload serialization failed: {}", payload, e);
            return null;
        }
    }

    /** Decoded query parameters of the handshake URI (empty map if none). */
    public static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        if (uri == null || uri.getQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    public static boolean parseOn(String s) {
        if (s == null) return false;
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "1": case "true": case "on": case "yes": case "y":  return true;
            default: return false;
        }
    }
}
