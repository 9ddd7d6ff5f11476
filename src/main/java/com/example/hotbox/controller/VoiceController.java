package com.example.hotbox.controller;

import com.example.hotbox.model.IceServer;
import com.example.hotbox.model.VoiceParticipantView;
import com.example.hotbox.service.VoiceRelayService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/voice")
public class VoiceController {

    private final VoiceRelayService relay;

    public VoiceController(VoiceRelayService relay) {
        this.relay = relay;
    }

    @GetMapping("/ice-servers")
    public List<IceServer> iceServers() {
        return relay.getIceServers();
    }

    /** Roster of a voice room; 404 when nobody is in it. */
    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<List<VoiceParticipantView>> roster(@PathVariable String roomId) {
        if (!relay.roomExists(roomId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(relay.getRoomRoster(roomId));
    }
}
