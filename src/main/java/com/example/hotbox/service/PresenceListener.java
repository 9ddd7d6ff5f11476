package com.example.hotbox.service;

import com.example.hotbox.model.PresenceChange;

/**
 * Receives one call per real presence transition, in transition order.
 * Implementations must not block; they run on the presence event thread.
 */
@FunctionalInterface
public interface PresenceListener {

    void onStatusChanged(PresenceChange change);
}
