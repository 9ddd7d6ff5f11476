package com.example.hotbox.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Clock-driven presence thresholds. PresenceService reads them on every use,
 * so changing a value at runtime affects the next timer that is armed.
 */
@Validated
@ConfigurationProperties("app.presence")
public class PresenceProperties {

  /** Delay after the last connection drops before the user is taken offline. */
  @NotNull
  private Duration gracePeriod = Duration.ofSeconds(30);

  /** Heartbeat silence after which an online user is marked idle. */
  @NotNull
  private Duration idleTimeout = Duration.ofMinutes(5);

  /** API-only (agent) accounts go offline after this much silence. */
  @NotNull
  private Duration agentInactivityTimeout = Duration.ofMinutes(5);

  // --- getters/setters ---

  public Duration getGracePeriod() { return gracePeriod; }
  public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }

  public Duration getIdleTimeout() { return idleTimeout; }
  public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }

  public Duration getAgentInactivityTimeout() { return agentInactivityTimeout; }
  public void setAgentInactivityTimeout(Duration agentInactivityTimeout) { this.agentInactivityTimeout = agentInactivityTimeout; }
}
