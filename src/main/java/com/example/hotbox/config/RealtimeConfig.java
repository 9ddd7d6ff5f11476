package com.example.hotbox.config;

import com.example.hotbox.service.PresenceService;
import com.example.hotbox.service.VoiceRelayService;
import com.example.hotbox.timer.TimerManager;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The realtime registries. Each is created once here, lives as long as the context and is
 * injected into the transport handlers; nothing reaches them through static state.
 */
@Configuration
@EnableConfigurationProperties({PresenceProperties.class, VoiceProperties.class})
public class RealtimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public TimerManager timerManager() {
        return new TimerManager();
    }

    /** Single thread: listeners see events in the order the registries produced them. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService realtimeEventExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "realtime-events");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public PresenceService presenceService(TimerManager timerManager,
                                           PresenceProperties presenceProperties,
                                           Clock clock,
                                           ExecutorService realtimeEventExecutor) {
        return new PresenceService(timerManager, presenceProperties, clock, realtimeEventExecutor);
    }

    @Bean
    public VoiceRelayService voiceRelayService(VoiceProperties voiceProperties,
                                               ExecutorService realtimeEventExecutor) {
        return new VoiceRelayService(voiceProperties, realtimeEventExecutor);
    }
}
