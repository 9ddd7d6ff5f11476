package com.example.hotbox.config;

import com.example.hotbox.handler.ChatSocketHandler;
import com.example.hotbox.handler.VoiceSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.*;
import java.util.stream.Collectors;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final ChatSocketHandler chatHandler;
  private final VoiceSocketHandler voiceHandler;
  private final String chatPath;
  private final String voicePath;
  private final List<String> originPatterns;
  private final boolean allowAll;

  public WebSocketConfig(
      ChatSocketHandler chatHandler,
      VoiceSocketHandler voiceHandler,
      @Value("${app.websocket.chat-path:/ws/chat}") String chatPath,
      @Value("${app.websocket.voice-path:/ws/voice}") String voicePath,
      // CSV list, expanded to origin patterns
      @Value("${app.websocket.allowed-origins:http://localhost:8080}") String originsCsv,
      @Value("${app.websocket.debug-open:false}") boolean allowAll
  ) {
    this.chatHandler = chatHandler;
    this.voiceHandler = voiceHandler;
    this.chatPath = chatPath;
    this.voicePath = voicePath;
    this.allowAll = allowAll;

    List<String> list = Arrays.stream(originsCsv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .flatMap(s -> expandToPatterns(s).stream())
        .distinct()
        .collect(Collectors.toList());

    this.originPatterns = list.isEmpty() ? Collections.singletonList("*") : list;
  }

  // localhost origins also match any port and 127.0.0.1
  static List<String> expandToPatterns(String origin) {
    List<String> out = new ArrayList<>();
    if ("*".equals(origin)) { out.add("*"); return out; }
    out.add(origin);
    if (origin.startsWith("http://localhost")) {
      out.add("http://localhost:*");
      out.add("http://127.0.0.1:*");
    }
    if (origin.startsWith("https://localhost")) {
      out.add("https://localhost:*");
    }
    return out;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    String[] patterns = allowAll ? new String[] {"*"} : originPatterns.toArray(String[]::new);

    registry.addHandler(chatHandler, chatPath)
            .setAllowedOriginPatterns(patterns);
    registry.addHandler(voiceHandler, voicePath)
            .setAllowedOriginPatterns(patterns);
  }
}
