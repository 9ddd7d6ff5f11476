package com.example.hotbox.model;

/** Emitted once per real presence transition of a user. */
public record PresenceChange(String userId, String displayName, UserStatus status, boolean agent) { }
