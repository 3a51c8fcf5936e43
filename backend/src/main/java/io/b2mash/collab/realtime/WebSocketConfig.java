package io.b2mash.collab.realtime;

import io.b2mash.collab.session.SessionProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final RealtimeWebSocketHandler handler;
  private final RealtimeProperties properties;
  private final SessionProperties sessionProperties;

  public WebSocketConfig(
      RealtimeWebSocketHandler handler,
      RealtimeProperties properties,
      SessionProperties sessionProperties) {
    this.handler = handler;
    this.properties = properties;
    this.sessionProperties = sessionProperties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(handler, properties.path())
        .addInterceptors(new SessionCookieHandshakeInterceptor(sessionProperties))
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
  }
}
