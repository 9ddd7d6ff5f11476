package com.example.hotbox.model;

/** A signal routed to one connection; {@code payload} is forwarded verbatim. */
public record SignalMessage(SignalKind kind,
                            String fromUserId,
                            String toUserId,
                            String targetConnectionId,
                            String payload) { }
