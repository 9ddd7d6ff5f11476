package com.example.hotbox.service;

import com.example.hotbox.config.PresenceProperties;
import com.example.hotbox.model.OnlineUser;
import com.example.hotbox.model.PresenceChange;
import com.example.hotbox.model.UserPresence;
import com.example.hotbox.model.UserStatus;
import com.example.hotbox.timer.TimerKind;
import com.example.hotbox.timer.TimerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Presence engine: per-user connection sets, the Online/Idle/DoNotDisturb state machine,
 * grace / idle / agent-inactivity timers and the status-change event stream.
 *
 * <p>A user is tracked (non-offline) iff present in {@link #users}. Every mutation and every
 * timer callback runs under {@link #lock}, so "last connection gone → offline" and
 * "reconnect" can never interleave. Reads are lock-free.</p>
 *
 * <p>Events are handed to {@code eventExecutor} while the lock is held; with a single-thread
 * executor listeners therefore see each user's transitions in the order they happened.</p>
 */
public class PresenceService {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private final TimerManager timers;
    private final PresenceProperties props;
    private final Clock clock;
    private final Executor eventExecutor;

    private final Map<String, UserPresence> users = new ConcurrentHashMap<>();
    private final List<PresenceListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();

    /** Source of grace tokens (guarded by lock). */
    private long graceSeq = 0L;

    public PresenceService(TimerManager timers, PresenceProperties props, Clock clock, Executor eventExecutor) {
        this.timers = Objects.requireNonNull(timers, "timers");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
    }

    // ========================================================================
    //  LISTENERS
    // ========================================================================

    public void addListener(PresenceListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(PresenceListener listener) {
        listeners.remove(listener);
    }

    // ========================================================================
    //  CONNECTIONS
    // ========================================================================

    public void connect(String userId, String connectionId, String displayName, boolean agent) {
        if (isBlank(userId) || isBlank(connectionId)) {
            log.warn("Connect ignored (userId={}, connectionId={})", userId, connectionId);
            return;
        }
        synchronized (lock) {
            timers.cancel(userId, TimerKind.GRACE);

            long now = clock.millis();
            UserPresence p = users.get(userId);
            UserStatus prior = (p == null) ? UserStatus.OFFLINE : p.getStatus();
            if (p == null) {
                p = new UserPresence(userId, nameOrUnknown(displayName), agent, now);
                users.put(userId, p);
            } else {
                p.setDisplayName(nameOrUnknown(displayName));
                p.setAgent(agent);
            }
            p.setGraceToken(0L);
            p.addConnection(connectionId);
            p.setLastHeartbeat(now);
            p.setStatus(UserStatus.ONLINE);
            armIdle(p);

            if (prior != UserStatus.ONLINE) {
                log.info("User {} ({}) is now online", userId, p.getDisplayName());
                emit(p);
            } else {
                log.debug("User {} added connection {} ({} open)", userId, connectionId, p.connectionCount());
            }
        }
    }

    /**
     * Removes one connection. Returns true when the user holds no connection any more
     * (grace period started, or the user was not tracked at all).
     */
    public boolean disconnect(String userId, String connectionId) {
        if (isBlank(userId)) return true;
        synchronized (lock) {
            UserPresence p = users.get(userId);
            if (p == null) {
                log.debug("Disconnect for untracked user {} (connection {})", userId, connectionId);
                return true;
            }
            boolean removed = connectionId != null && p.removeConnection(connectionId);
            if (p.hasConnections()) return false;

            // agent-only entries never held a socket; their inactivity timer governs
            if (removed) startGrace(p);
            return true;
        }
    }

    public void heartbeat(String userId) {
        if (isBlank(userId)) return;
        synchronized (lock) {
            UserPresence p = users.get(userId);
            if (p == null) return;

            p.setLastHeartbeat(clock.millis());
            boolean wasIdle = p.getStatus() == UserStatus.IDLE;
            if (wasIdle) p.setStatus(UserStatus.ONLINE);
            armIdle(p);

            if (wasIdle) {
                log.info("User {} ({}) is back online", userId, p.getDisplayName());
                emit(p);
            }
        }
    }

    // ========================================================================
    //  EXPLICIT STATUS
    // ========================================================================

    /**
     * Client-initiated transition. Returns false when the request is rejected
     * (OFFLINE or null requested, or user not tracked); no-op requests return true.
     */
    public boolean requestStatus(String userId, UserStatus desired) {
        if (desired == null || desired == UserStatus.OFFLINE) {
            log.warn("Rejected status request {} for user {}: disconnect instead", desired, userId);
            return false;
        }
        if (isBlank(userId)) return false;

        synchronized (lock) {
            UserPresence p = users.get(userId);
            if (p == null) {
                log.warn("Rejected status request {} for untracked user {}", desired, userId);
                return false;
            }
            UserStatus current = p.getStatus();

            switch (desired) {
                case IDLE:
                    // DND is sticky against idle requests
                    if (current == UserStatus.DO_NOT_DISTURB || current == UserStatus.IDLE) return true;
                    p.setStatus(UserStatus.IDLE);
                    break;
                case DO_NOT_DISTURB:
                    timers.cancel(userId, TimerKind.IDLE);
                    if (current == UserStatus.DO_NOT_DISTURB) return true;
                    p.setStatus(UserStatus.DO_NOT_DISTURB);
                    break;
                case ONLINE:
                    p.setLastHeartbeat(clock.millis());
                    p.setStatus(UserStatus.ONLINE);
                    armIdle(p);
                    if (current == UserStatus.ONLINE) return true;
                    break;
                default:
                    return false;
            }

            log.info("User {} ({}) set status to {}", userId, p.getDisplayName(), desired);
            emit(p);
            return true;
        }
    }

    /** Takes the user offline immediately, bypassing the grace period. */
    public void forceOffline(String userId) {
        if (isBlank(userId)) return;
        synchronized (lock) {
            UserPresence p = users.get(userId);
            if (p == null) return;
            goOffline(p, "forced");
        }
    }

    /** Heartbeat equivalent for API-key (agent) accounts without a socket. */
    public void touchAgentActivity(String userId, String displayName) {
        if (isBlank(userId)) return;
        synchronized (lock) {
            long now = clock.millis();
            UserPresence p = users.get(userId);
            boolean changed;
            if (p == null) {
                p = new UserPresence(userId, nameOrUnknown(displayName), true, now);
                users.put(userId, p);
                changed = true;
            } else {
                if (!isBlank(displayName)) p.setDisplayName(displayName);
                p.setAgent(true);
                p.setLastHeartbeat(now);
                changed = p.getStatus() == UserStatus.IDLE;
                if (changed) p.setStatus(UserStatus.ONLINE);
            }

            // activity proves liveness: a pending grace must not take the agent offline
            timers.cancel(userId, TimerKind.GRACE);
            p.setGraceToken(0L);
            armAgentInactivity(p, props.getAgentInactivityTimeout());

            if (changed) {
                log.info("Agent {} ({}) is now online", userId, p.getDisplayName());
                emit(p);
            }
        }
    }

    // ========================================================================
    //  QUERIES
    // ========================================================================

    public UserStatus getStatus(String userId) {
        if (userId == null) return UserStatus.OFFLINE;
        UserPresence p = users.get(userId);
        return (p == null) ? UserStatus.OFFLINE : p.getStatus();
    }

    public List<OnlineUser> snapshot() {
        List<OnlineUser> out = new ArrayList<>(users.size());
        for (UserPresence p : users.values()) out.add(p.toOnlineUser());
        return out;
    }

    public int connectionCount(String userId) {
        if (userId == null) return 0;
        synchronized (lock) {
            UserPresence p = users.get(userId);
            return (p == null) ? 0 : p.connectionCount();
        }
    }

    public boolean isTracked(String userId) {
        return userId != null && users.containsKey(userId);
    }

    public int trackedCount() {
        return users.size();
    }

    // ========================================================================
    //  TIMERS (caller holds lock)
    // ========================================================================

    private void startGrace(UserPresence p) {
        String userId = p.getUserId();
        long token = ++graceSeq;
        p.setGraceToken(token);
        timers.start(userId, TimerKind.GRACE, props.getGracePeriod(), () -> onGraceExpired(userId, token));
        log.debug("Started {} grace period for user {}", props.getGracePeriod(), userId);
    }

    private void onGraceExpired(String userId, long token) {
        synchronized (lock) {
            UserPresence p = users.get(userId);
            // a reconnect (or a newer grace) that got the lock first wins
            if (p == null || p.getGraceToken() != token || p.hasConnections()) {
                log.debug("Grace expiry for user {} ignored (reconnected or superseded)", userId);
                return;
            }
            p.setGraceToken(0L);
            if (p.isAgent()) {
                // agents stay until their own inactivity window runs out
                long remaining = props.getAgentInactivityTimeout().toMillis() - (clock.millis() - p.getLastHeartbeat());
                if (remaining > 0) {
                    armAgentInactivity(p, Duration.ofMillis(remaining));
                    return;
                }
            }
            goOffline(p, "grace period expired");
        }
    }

    private void armIdle(UserPresence p) {
        if (p.getStatus() == UserStatus.DO_NOT_DISTURB) {
            timers.cancel(p.getUserId(), TimerKind.IDLE);
            return;
        }
        scheduleIdle(p.getUserId(), props.getIdleTimeout());
    }

    private void scheduleIdle(String userId, Duration delay) {
        timers.start(userId, TimerKind.IDLE, delay, () -> onIdleTimer(userId));
    }

    private void onIdleTimer(String userId) {
        synchronized (lock) {
            UserPresence p = users.get(userId);
            if (p == null || p.getStatus() != UserStatus.ONLINE) return;

            long idleMs = props.getIdleTimeout().toMillis();
            long elapsed = clock.millis() - p.getLastHeartbeat();
            if (elapsed < idleMs) {
                // heartbeat arrived after this timer was armed: wait out the rest of the window only
                scheduleIdle(userId, Duration.ofMillis(idleMs - elapsed));
                return;
            }
            p.setStatus(UserStatus.IDLE);
            log.info("User {} ({}) is now idle", userId, p.getDisplayName());
            emit(p);
        }
    }

    private void armAgentInactivity(UserPresence p, Duration delay) {
        String userId = p.getUserId();
        timers.start(userId, TimerKind.AGENT_INACTIVITY, delay, () -> onAgentInactivity(userId));
    }

    private void onAgentInactivity(String userId) {
        synchronized (lock) {
            UserPresence p = users.get(userId);
            if (p == null || p.hasConnections()) return;

            long timeoutMs = props.getAgentInactivityTimeout().toMillis();
            long elapsed = clock.millis() - p.getLastHeartbeat();
            if (elapsed < timeoutMs) {
                armAgentInactivity(p, Duration.ofMillis(timeoutMs - elapsed));
                return;
            }
            goOffline(p, "agent inactivity");
        }
    }

    private void goOffline(UserPresence p, String reason) {
        String userId = p.getUserId();
        users.remove(userId);
        timers.cancelAll(userId);
        log.info("User {} ({}) is now offline ({})", userId, p.getDisplayName(), reason);
        emit(new PresenceChange(userId, p.getDisplayName(), UserStatus.OFFLINE, p.isAgent()));
    }

    // ========================================================================
    //  EVENTS
    // ========================================================================

    private void emit(UserPresence p) {
        emit(new PresenceChange(p.getUserId(), p.getDisplayName(), p.getStatus(), p.isAgent()));
    }

    private void emit(PresenceChange change) {
        try {
            eventExecutor.execute(() -> dispatch(change));
        } catch (RejectedExecutionException e) {
            log.warn("Presence event dropped (executor shut down): {}", change);
        }
    }

    private void dispatch(PresenceChange change) {
        for (PresenceListener l : listeners) {
            try {
                l.onStatusChanged(change);
            } catch (Throwable t) {
                log.error("Presence listener failed for {}", change, t);
            }
        }
    }

    // ========================================================================
    //  HELPERS
    // ========================================================================

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String nameOrUnknown(String displayName) {
        return isBlank(displayName) ? "Unknown" : displayName.trim();
    }
}
