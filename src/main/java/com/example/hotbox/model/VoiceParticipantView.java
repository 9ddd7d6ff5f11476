package com.example.hotbox.model;

public record VoiceParticipantView(String userId, String displayName, boolean muted, boolean deafened) { }
