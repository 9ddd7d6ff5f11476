package com.example.hotbox.timer;

/** Timer slots; each key holds at most one live timer per kind. */
public enum TimerKind {
    GRACE,
    IDLE,
    AGENT_INACTIVITY
}
