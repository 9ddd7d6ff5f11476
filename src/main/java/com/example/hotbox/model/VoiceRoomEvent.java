package com.example.hotbox.model;

import java.util.List;

/**
 * Room-scoped roster delta.
 * {@code originConnectionId} is the connection that caused the change and
 * {@code memberConnectionIds} the room's members right after it, so the transport can
 * fan out to "everyone except the originator" without a second lookup.
 * Server-side only: connection ids never go to clients.
 */
public record VoiceRoomEvent(Type type,
                             String roomId,
                             String userId,
                             VoiceParticipantView participant,
                             String originConnectionId,
                             List<String> memberConnectionIds) {

    public enum Type {
        JOINED,
        LEFT,
        MUTE_CHANGED,
        DEAFEN_CHANGED
    }
}
