package com.example.hotbox.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Presence status as seen by peers. OFFLINE is the default and is never stored. */
public enum UserStatus {
    ONLINE("Online"),
    IDLE("Idle"),
    DO_NOT_DISTURB("DoNotDisturb"),
    OFFLINE("Offline");

    private final String wireName;

    UserStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Lenient parse: accepts "DoNotDisturb", "do_not_disturb", "dnd"... Returns null if unknown. */
    @JsonCreator
    public static UserStatus parse(String s) {
        if (s == null) return null;
        String t = s.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        switch (t) {
            case "online":       return ONLINE;
            case "idle":
            case "away":         return IDLE;
            case "donotdisturb":
            case "dnd":          return DO_NOT_DISTURB;
            case "offline":      return OFFLINE;
            default:             return null;
        }
    }
}
