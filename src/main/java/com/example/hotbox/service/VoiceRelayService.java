package com.example.hotbox.service;

import com.example.hotbox.config.VoiceProperties;
import com.example.hotbox.model.IceServer;
import com.example.hotbox.model.SignalKind;
import com.example.hotbox.model.SignalMessage;
import com.example.hotbox.model.VoiceParticipant;
import com.example.hotbox.model.VoiceParticipantView;
import com.example.hotbox.model.VoiceRoom;
import com.example.hotbox.model.VoiceRoomEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Voice signaling relay: per-room rosters and WebRTC call-setup forwarding.
 *
 * <p>Every roster mutation runs inside {@code compute}/{@code computeIfPresent} on the room map,
 * so creating a room on join and deleting it once empty are atomic against concurrent joins and
 * leaves. No empty room survives a mutation. Signals are routed by scanning the live rooms; there
 * is no second index that could drift from them.</p>
 */
public class VoiceRelayService {

    private static final Logger log = LoggerFactory.getLogger(VoiceRelayService.class);

    private final VoiceProperties props;
    private final Executor eventExecutor;

    private final Map<String, VoiceRoom> rooms = new ConcurrentHashMap<>();
    private final List<VoiceEventListener> listeners = new CopyOnWriteArrayList<>();

    public VoiceRelayService(VoiceProperties props, Executor eventExecutor) {
        this.props = Objects.requireNonNull(props, "props");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
    }

    public void addListener(VoiceEventListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(VoiceEventListener listener) {
        listeners.remove(listener);
    }

    // ========================================================================
    //  ROSTER
    // ========================================================================

    /**
     * Seats {@code connectionId} in the room (creating it if needed) and returns the roster
     * including the new seat. Rejoining from the same connection replaces the seat.
     */
    public List<VoiceParticipantView> join(String roomId, String userId, String connectionId, String displayName) {
        if (isBlank(roomId) || isBlank(userId) || isBlank(connectionId)) {
            log.warn("Voice join ignored (room={}, user={}, connection={})", roomId, userId, connectionId);
            return List.of();
        }
        VoiceParticipant seat = new VoiceParticipant(userId, displayName, connectionId);
        AtomicReference<List<VoiceParticipantView>> roster = new AtomicReference<>(List.of());

        rooms.compute(roomId, (id, room) -> {
            VoiceRoom r = (room != null) ? room : new VoiceRoom(id);
            r.put(seat);
            roster.set(r.roster());
            emitRoomEvent(new VoiceRoomEvent(VoiceRoomEvent.Type.JOINED, id, userId, seat.toView(),
                    connectionId, r.connectionIds()));
            return r;
        });

        log.info("User {} joined voice room {} ({} in room)", userId, roomId, roster.get().size());
        return roster.get();
    }

    /** Removes the seat of {@code connectionId}. Returns false if it was not in the room. */
    public boolean leave(String roomId, String connectionId) {
        if (isBlank(roomId) || isBlank(connectionId)) return false;
        VoiceParticipant left = removeSeat(roomId, connectionId);
        if (left == null) return false;
        log.info("User {} left voice room {}", left.getUserId(), roomId);
        return true;
    }

    /** Drops {@code connectionId} from every room; returns the ids of rooms it was in. */
    public Set<String> onDisconnect(String connectionId) {
        Set<String> affected = new LinkedHashSet<>();
        if (isBlank(connectionId)) return affected;

        String userId = null;
        for (String roomId : new ArrayList<>(rooms.keySet())) {
            VoiceParticipant left = removeSeat(roomId, connectionId);
            if (left != null) {
                affected.add(roomId);
                userId = left.getUserId();
            }
        }
        if (!affected.isEmpty()) {
            log.info("User {} disconnected from voice rooms {}", userId, affected);
        }
        return affected;
    }

    private VoiceParticipant removeSeat(String roomId, String connectionId) {
        AtomicReference<VoiceParticipant> removed = new AtomicReference<>();
        rooms.computeIfPresent(roomId, (id, room) -> {
            VoiceParticipant p = room.remove(connectionId);
            if (p != null) {
                removed.set(p);
                emitRoomEvent(new VoiceRoomEvent(VoiceRoomEvent.Type.LEFT, id, p.getUserId(), p.toView(),
                        connectionId, room.connectionIds()));
            }
            return room.isEmpty() ? null : room;
        });
        return removed.get();
    }

    public boolean toggleMute(String roomId, String connectionId, boolean muted) {
        return updateSeat(roomId, connectionId, VoiceRoomEvent.Type.MUTE_CHANGED, p -> {
            if (p.isMuted() == muted) return false;
            p.setMuted(muted);
            return true;
        });
    }

    public boolean toggleDeafen(String roomId, String connectionId, boolean deafened) {
        return updateSeat(roomId, connectionId, VoiceRoomEvent.Type.DEAFEN_CHANGED, p -> {
            if (p.isDeafened() == deafened) return false;
            p.setDeafened(deafened);
            return true;
        });
    }

    /** Applies {@code change} in place; emits only when it reports a real change. */
    private boolean updateSeat(String roomId, String connectionId, VoiceRoomEvent.Type type, Predicate<VoiceParticipant> change) {
        if (isBlank(roomId) || isBlank(connectionId)) return false;
        AtomicBoolean found = new AtomicBoolean(false);
        rooms.computeIfPresent(roomId, (id, room) -> {
            VoiceParticipant p = room.get(connectionId);
            if (p == null) return room;
            found.set(true);
            if (change.test(p)) {
                log.debug("User {} {} in voice room {}", p.getUserId(), type, id);
                emitRoomEvent(new VoiceRoomEvent(type, id, p.getUserId(), p.toView(),
                        connectionId, room.connectionIds()));
            }
            return room;
        });
        if (!found.get()) {
            log.debug("Voice {} ignored: connection {} not in room {}", type, connectionId, roomId);
        }
        return found.get();
    }

    public List<VoiceParticipantView> getRoomRoster(String roomId) {
        if (roomId == null) return List.of();
        VoiceRoom room = rooms.get(roomId);
        return (room == null) ? List.of() : room.roster();
    }

    public boolean roomExists(String roomId) {
        return roomId != null && rooms.containsKey(roomId);
    }

    public int roomCount() {
        return rooms.size();
    }

    // ========================================================================
    //  SIGNALING
    // ========================================================================

    /**
     * Forwards {@code payload} verbatim to the first seat of {@code toUserId} found in any room.
     * Unknown targets are dropped and logged, never reported to the sender.
     */
    public boolean relaySignal(SignalKind kind, String fromUserId, String toUserId, String payload) {
        if (kind == null || isBlank(toUserId)) {
            log.warn("Signal from {} dropped: kind={} target={}", fromUserId, kind, toUserId);
            return false;
        }
        VoiceParticipant target = findByUserId(toUserId);
        if (target == null) {
            log.warn("User {} tried to send {} to unknown user {}", fromUserId, kind, toUserId);
            return false;
        }
        log.debug("User {} sending {} to user {}", fromUserId, kind, toUserId);
        SignalMessage msg = new SignalMessage(kind, fromUserId, toUserId, target.getConnectionId(), payload);
        dispatch(l -> l.onSignal(msg), msg);
        return true;
    }

    private VoiceParticipant findByUserId(String userId) {
        for (VoiceRoom room : rooms.values()) {
            VoiceParticipant p = room.findByUserId(userId).orElse(null);
            if (p != null) return p;
        }
        return null;
    }

    public List<IceServer> getIceServers() {
        List<IceServer> servers = new ArrayList<>(2);
        List<String> stun = props.stunUrls();
        if (stun != null && !stun.isEmpty()) {
            servers.add(IceServer.stun(stun));
        }
        if (!isBlank(props.turnUrl())) {
            servers.add(IceServer.turn(props.turnUrl(), props.turnUsername(), props.turnCredential()));
        }
        return servers;
    }

    // ========================================================================
    //  EVENTS
    // ========================================================================

    private void emitRoomEvent(VoiceRoomEvent event) {
        dispatch(l -> l.onRoomEvent(event), event);
    }

    private void dispatch(Consumer<VoiceEventListener> call, Object what) {
        try {
            eventExecutor.execute(() -> {
                for (VoiceEventListener l : listeners) {
                    try {
                        call.accept(l);
                    } catch (Throwable t) {
                        log.error("Voice listener failed for {}", what, t);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Voice event dropped (executor shut down): {}", what);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
