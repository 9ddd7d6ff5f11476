package com.example.hotbox.controller;

import com.example.hotbox.model.OnlineUser;
import com.example.hotbox.service.PresenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only presence queries. Mutations only happen through the chat socket
 * and the agent-activity interceptor.
 */
@RestController
@RequestMapping("/api/presence")
public class PresenceController {

    private final PresenceService presence;

    public PresenceController(PresenceService presence) {
        this.presence = presence;
    }

    /** GET /api/presence/online */
    @GetMapping("/online")
    public List<OnlineUser> online() {
        return presence.snapshot();
    }

    /**
     * Status of one user; unknown users are reported as Offline.
     * URL: GET /api/presence/{userId}
     */
    @GetMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String userId) {
        String id = userId == null ? "" : userId.trim();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("userId", id);
        out.put("status", presence.getStatus(id));
        return ResponseEntity.ok(out);
    }
}
