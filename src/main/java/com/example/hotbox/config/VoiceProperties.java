package com.example.hotbox.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/** STUN/TURN servers handed to voice clients. TURN is optional (blank url = none). */
@ConfigurationProperties(prefix = "app.voice")
public record VoiceProperties(
        @DefaultValue("stun:stun.l.google.com:19302") List<String> stunUrls,
        String turnUrl,
        String turnUsername,
        String turnCredential) { }
