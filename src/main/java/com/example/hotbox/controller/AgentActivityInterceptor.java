package com.example.hotbox.controller;

import com.example.hotbox.service.PresenceService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Keeps API-key (agent) accounts present while they call the REST API.
 * The authenticating proxy marks such requests with X-User-Id / X-Display-Name / X-Agent: true.
 * Never blocks the request.
 */
public class AgentActivityInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AgentActivityInterceptor.class);

    public static final String HEADER_USER_ID = "X-User-Id";
    public static final String HEADER_DISPLAY_NAME = "X-Display-Name";
    public static final String HEADER_AGENT = "X-Agent";

    private final PresenceService presence;

    public AgentActivityInterceptor(PresenceService presence) {
        this.presence = presence;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!Boolean.parseBoolean(request.getHeader(HEADER_AGENT))) return true;

        String userId = request.getHeader(HEADER_USER_ID);
        if (userId == null || userId.isBlank()) {
            log.debug("Agent request without {} header: {}", HEADER_USER_ID, request.getRequestURI());
            return true;
        }
        presence.touchAgentActivity(userId.trim(), request.getHeader(HEADER_DISPLAY_NAME));
        return true;
    }
}
