package com.example.hotbox.config;

import com.example.hotbox.controller.AgentActivityInterceptor;
import com.example.hotbox.service.PresenceService;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final PresenceService presence;

    public WebMvcConfig(PresenceService presence) {
        this.presence = presence;
    }

    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        registry.addInterceptor(new AgentActivityInterceptor(presence)).addPathPatterns("/api/**");
    }
}
