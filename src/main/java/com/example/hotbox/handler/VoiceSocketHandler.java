package com.example.hotbox.handler;

import com.example.hotbox.model.SignalKind;
import com.example.hotbox.model.SignalMessage;
import com.example.hotbox.model.VoiceParticipantView;
import com.example.hotbox.model.VoiceRoomEvent;
import com.example.hotbox.service.VoiceEventListener;
import com.example.hotbox.service.VoiceRelayService;
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

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for voice signaling (default /ws/voice).
 *
 * Frames (JSON, "type" selects the action):
 * - join {roomId}            → caller gets "voiceChannelUsers", others "userJoinedVoice"
 * - leave {roomId}           → others get "userLeftVoice"
 * - offer|answer|iceCandidate {toUserId, payload} → target gets receiveOffer/receiveAnswer/receiveIceCandidate
 * - mute {roomId, muted} / deafen {roomId, deafened} → others get userMuteChanged / userDeafenChanged
 * - getIceServers            → caller gets "iceServers"
 * Unknown or malformed frames are answered with an "error" frame.
 * Socket close drops the connection from every room.
 */
@Component
public class VoiceSocketHandler extends TextWebSocketHandler implements VoiceEventListener {

    private static final Logger log = LoggerFactory.getLogger(VoiceSocketHandler.class);

    private final VoiceRelayService relay;
    private final ObjectMapper objectMapper;
    private final SocketSessions sessions;

    /** Per WebSocket session → identity supplied at handshake. */
    private final Map<String, Caller> callers = new ConcurrentHashMap<>();

    public VoiceSocketHandler(VoiceRelayService relay, ObjectMapper objectMapper) {
        this.relay = relay;
        this.objectMapper = objectMapper;
        this.sessions = new SocketSessions(objectMapper);
    }

    @PostConstruct
    void subscribe() {
        relay.addListener(this);
    }

    @PreDestroy
    void unsubscribe() {
        relay.removeListener(this);
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        Map<String, String> q = SocketSessions.parseQuery(session.getUri());
        String userId = q.getOrDefault("userId", "").trim();
        String displayName = q.getOrDefault("displayName", "").trim();

        if (userId.isEmpty()) {
            log.warn("WS VOICE REJECT sid={}: no user identity", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unable to determine user identity"));
            return;
        }
        log.info("WS VOICE OPEN user={} sid={}", userId, session.getId());
        sessions.register(session);
        callers.put(session.getId(), new Caller(userId, displayName));
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        Caller caller = callers.get(session.getId());
        if (caller == null) {
            log.warn("WS VOICE message from unknown session sid={}", session.getId());
            return;
        }
        String sid = session.getId();

        try {
            JsonNode node = objectMapper.readTree(message.getPayload());
            String type = node.path("type").asText("");
            String roomId = node.path("roomId").asText(null);

            switch (type) {
                case "join": {
                    List<VoiceParticipantView> roster = relay.join(roomId, caller.userId, sid, caller.displayName);
                    Map<String, Object> payload = frame("voiceChannelUsers", roomId);
                    payload.put("users", roster);
                    sessions.sendJson(sid, payload);
                    break;
                }
                case "leave":
                    relay.leave(roomId, sid);
                    break;
                case "offer":
                case "answer":
                case "iceCandidate": {
                    SignalKind kind = SignalKind.parse(type);
                    // unknown targets are dropped, never reported back
                    relay.relaySignal(kind, caller.userId, node.path("toUserId").asText(null),
                            encodePayload(node.get("payload")));
                    break;
                }
                case "mute":
                    relay.toggleMute(roomId, sid, node.path("muted").asBoolean(false));
                    break;
                case "deafen":
                    relay.toggleDeafen(roomId, sid, node.path("deafened").asBoolean(false));
                    break;
                case "getIceServers": {
                    Map<String, Object> payload = frame("iceServers", null);
                    payload.put("servers", relay.getIceServers());
                    sessions.sendJson(sid, payload);
                    break;
                }
                default:
                    log.debug("WS VOICE unknown frame type '{}' from user={}", type, caller.userId);
                    sendError(sid, "Unknown message type: " + type);
            }
        } catch (Exception e) {
            log.warn("WS VOICE message handling failed (user={}, sid={}): {}", caller.userId, sid, e.toString());
            sendError(sid, "Malformed message");
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        sessions.unregister(session.getId());
        Caller caller = callers.remove(session.getId());
        log.info("WS VOICE CLOSE user={} sid={} code={}",
                caller != null ? caller.userId : "?", session.getId(), status.getCode());
        relay.onDisconnect(session.getId());
    }

    // ---------------- outbound ----------------

    @Override
    public void onRoomEvent(VoiceRoomEvent event) {
        Map<String, Object> payload;
        switch (event.type()) {
            case JOINED:
                payload = frame("userJoinedVoice", event.roomId());
                payload.put("user", event.participant());
                break;
            case LEFT:
                payload = frame("userLeftVoice", event.roomId());
                payload.put("userId", event.userId());
                break;
            case MUTE_CHANGED:
                payload = frame("userMuteChanged", event.roomId());
                payload.put("userId", event.userId());
                payload.put("muted", event.participant().muted());
                break;
            case DEAFEN_CHANGED:
                payload = frame("userDeafenChanged", event.roomId());
                payload.put("userId", event.userId());
                payload.put("deafened", event.participant().deafened());
                break;
            default:
                return;
        }
        // everyone in the room except the originator
        List<String> targets = new ArrayList<>(event.memberConnectionIds());
        targets.remove(event.originConnectionId());
        sessions.sendJsonToAll(targets, payload);
    }

    @Override
    public void onSignal(SignalMessage signal) {
        String type;
        switch (signal.kind()) {
            case OFFER:         type = "receiveOffer"; break;
            case ANSWER:        type = "receiveAnswer"; break;
            case ICE_CANDIDATE: type = "receiveIceCandidate"; break;
            default: return;
        }
        Map<String, Object> payload = frame(type, null);
        payload.put("fromUserId", signal.fromUserId());
        payload.put("payload", decodePayload(signal.payload()));
        if (!sessions.sendJson(signal.targetConnectionId(), payload)) {
            log.debug("Signal {} to user {} not delivered (socket gone)", signal.kind(), signal.toUserId());
        }
    }

    private void sendError(String connectionId, String message) {
        Map<String, Object> payload = frame("error", null);
        payload.put("message", message);
        sessions.sendJson(connectionId, payload);
    }

    /**
     * Signal payloads cross the relay as JSON text, so SDP strings and
     * {candidate, sdpMid, sdpMLineIndex} objects arrive at the peer unchanged.
     */
    private static String encodePayload(JsonNode payload) {
        return (payload == null || payload.isMissingNode()) ? null : payload.toString();
    }

    private JsonNode decodePayload(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (IOException e) {
            log.warn("Signal payload is not JSON, forwarding as text: {}", e.toString());
            return objectMapper.getNodeFactory().textNode(json);
        }
    }

    private static Map<String, Object> frame(String type, String roomId) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        if (roomId != null) m.put("roomId", roomId);
        return m;
    }

    private static final class Caller {
        final String userId;
        final String displayName;
        Caller(String userId, String displayName) {
            this.userId = userId;
            this.displayName = displayName;
        }
    }
}
