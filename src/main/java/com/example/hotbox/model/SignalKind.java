package com.example.hotbox.model;

import java.util.Locale;

/** WebRTC call-setup message kinds the relay forwards. */
public enum SignalKind {
    OFFER,
    ANSWER,
    ICE_CANDIDATE;

    /** Accepts "offer", "answer", "iceCandidate", "ice-candidate", "ice". Null if unknown. */
    public static SignalKind parse(String s) {
        if (s == null) return null;
        switch (s.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "")) {
            case "offer":        return OFFER;
            case "answer":       return ANSWER;
            case "icecandidate":
            case "ice":          return ICE_CANDIDATE;
            default:             return null;
        }
    }
}
