package com.example.hotbox.model;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Live presence entry of one tracked (non-offline) user.
 * PresenceService guards the connection set and all writes with its engine lock;
 * the volatile fields may be read without it.
 */
public class UserPresence {

    private final String userId;
    private volatile String displayName;
    private volatile boolean agent;
    private volatile UserStatus status = UserStatus.ONLINE;
    private volatile long lastHeartbeat;   // epoch millis

    private final Set<String> connections = new LinkedHashSet<>();

    /** Identifies the grace timer that may still take this user offline (0 = none). */
    private long graceToken;

    public UserPresence(String userId, String displayName, boolean agent, long now) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.displayName = displayName;
        this.agent = agent;
        this.lastHeartbeat = now;
    }

    public String getUserId() { return userId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public boolean isAgent() { return agent; }
    public void setAgent(boolean agent) { this.agent = agent; }

    public UserStatus getStatus() { return status; }
    public void setStatus(UserStatus status) { this.status = status; }

    public long getLastHeartbeat() { return lastHeartbeat; }
    public void setLastHeartbeat(long lastHeartbeat) { this.lastHeartbeat = lastHeartbeat; }

    // connections (caller holds the engine lock)
    public boolean addConnection(String connectionId) { return connections.add(connectionId); }
    public boolean removeConnection(String connectionId) { return connections.remove(connectionId); }
    public boolean hasConnections() { return !connections.isEmpty(); }
    public int connectionCount() { return connections.size(); }

    public long getGraceToken() { return graceToken; }
    public void setGraceToken(long graceToken) { this.graceToken = graceToken; }

    public OnlineUser toOnlineUser() {
        return new OnlineUser(userId, displayName, status, agent);
    }

    @Override
    public String toString() {
        return "UserPresence{" +
                "userId='" + userId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", status=" + status +
                ", agent=" + agent +
                ", connections=" + connections.size() +
                ", lastHeartbeat=" + lastHeartbeat +
                '}';
    }
}
