package com.example.hotbox.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Voice room roster keyed by connection id (insertion order kept for a stable roster).
 * Methods are synchronized so signal routing can scan a room while another thread mutates it;
 * the create/delete lifecycle is owned by VoiceRelayService.
 */
public class VoiceRoom {

    private final String id;
    private final Map<String, VoiceParticipant> participants = new LinkedHashMap<>();

    public VoiceRoom(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /** Inserts or replaces the seat of {@code p.getConnectionId()}; returns the replaced one. */
    public synchronized VoiceParticipant put(VoiceParticipant p) {
        return participants.put(p.getConnectionId(), p);
    }

    public synchronized VoiceParticipant remove(String connectionId) {
        if (connectionId == null) return null;
        return participants.remove(connectionId);
    }

    public synchronized VoiceParticipant get(String connectionId) {
        if (connectionId == null) return null;
        return participants.get(connectionId);
    }

    public synchronized Optional<VoiceParticipant> findByUserId(String userId) {
        if (userId == null) return Optional.empty();
        for (VoiceParticipant p : participants.values()) {
            if (userId.equals(p.getUserId())) return Optional.of(p);
        }
        return Optional.empty();
    }

    public synchronized boolean isEmpty() {
        return participants.isEmpty();
    }

    public synchronized int size() {
        return participants.size();
    }

    public synchronized List<VoiceParticipantView> roster() {
        List<VoiceParticipantView> out = new ArrayList<>(participants.size());
        for (VoiceParticipant p : participants.values()) out.add(p.toView());
        return out;
    }

    public synchronized List<String> connectionIds() {
        return new ArrayList<>(participants.keySet());
    }
}
