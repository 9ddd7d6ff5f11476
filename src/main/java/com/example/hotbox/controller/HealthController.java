package com.example.hotbox.controller;

import com.example.hotbox.service.PresenceService;
import com.example.hotbox.service.VoiceRelayService;
import com.example.hotbox.timer.TimerManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final PresenceService presence;
  private final VoiceRelayService relay;
  private final TimerManager timers;

  @Value("${spring.profiles.active:default}")
  private String activeProfile;

  public HealthController(PresenceService presence, VoiceRelayService relay, TimerManager timers) {
    this.presence = presence;
    this.relay = relay;
    this.timers = timers;
  }

  /** Liveness check, touches nothing. */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Human-readable status with realtime counters */
  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("profile", activeProfile);
    m.put("trackedUsers", presence.trackedCount());
    m.put("voiceRooms", relay.roomCount());
    m.put("pendingTimers", timers.pendingCount());
    return m;
  }
}
