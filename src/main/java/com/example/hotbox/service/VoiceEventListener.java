package com.example.hotbox.service;

import com.example.hotbox.model.SignalMessage;
import com.example.hotbox.model.VoiceRoomEvent;

/** Outbound side of the voice relay; fan-out policy belongs to the implementation. */
public interface VoiceEventListener {

    /** Join / leave / mute / deafen deltas, one per real roster change. */
    default void onRoomEvent(VoiceRoomEvent event) { }

    /** A signal to forward to {@link SignalMessage#targetConnectionId()}. */
    default void onSignal(SignalMessage signal) { }
}
