package com.example.hotbox.model;

/** One row of the "who is online" payload. */
public record OnlineUser(String userId, String displayName, UserStatus status, boolean agent) { }
