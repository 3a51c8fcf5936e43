package io.b2mash.collab.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A pushed event, serialized as {@code {"type": ..., "data": ...}}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RealtimeEvent(EventType type, Object data) {

  public static RealtimeEvent of(EventType type, Object data) {
    return new RealtimeEvent(type, data);
  }

  public static RealtimeEvent of(EventType type) {
    return new RealtimeEvent(type, null);
  }
}
