package com.example.hotbox.model;

import java.util.Objects;

/** One connection's seat in a voice room. The connection id never leaves the server. */
public class VoiceParticipant {

    private final String userId;
    private final String displayName;
    private final String connectionId;
    private volatile boolean muted;
    private volatile boolean deafened;

    public VoiceParticipant(String userId, String displayName, String connectionId) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.displayName = (displayName == null || displayName.isBlank()) ? "Unknown" : displayName;
    }

    public String getUserId() { return userId; }
    public String getDisplayName() { return displayName; }
    public String getConnectionId() { return connectionId; }

    public boolean isMuted() { return muted; }
    public void setMuted(boolean muted) { this.muted = muted; }

    public boolean isDeafened() { return deafened; }
    public void setDeafened(boolean deafened) { this.deafened = deafened; }

    /** Redacted view for clients (no connection id). */
    public VoiceParticipantView toView() {
        return new VoiceParticipantView(userId, displayName, muted, deafened);
    }

    @Override
    public String toString() {
        return "VoiceParticipant{" +
                "userId='" + userId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", muted=" + muted +
                ", deafened=" + deafened +
                '}';
    }
}
