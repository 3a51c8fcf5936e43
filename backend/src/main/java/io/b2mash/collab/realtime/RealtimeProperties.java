package io.b2mash.collab.realtime;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "collab.realtime")
public record RealtimeProperties(
    @DefaultValue("/ws") String path,
    @DefaultValue("10s") Duration authTimeout,
    @DefaultValue("30000") long heartbeatIntervalMs,
    @DefaultValue("10s") Duration sendTimeLimit,
    @DefaultValue("512KB") DataSize sendBufferLimit,
    @DefaultValue("*") List<String> allowedOrigins) {

  /** Connections silent for longer than two heartbeat intervals are treated as dead peers. */
  public Duration idleLimit() {
    return Duration.ofMillis(heartbeatIntervalMs * 2);
  }
}
