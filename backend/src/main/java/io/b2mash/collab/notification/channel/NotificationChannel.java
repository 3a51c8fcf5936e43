package io.b2mash.collab.notification.channel;

import io.b2mash.collab.notification.Notification;

/**
 * Abstraction for notification delivery channels. Each channel handles one delivery mechanism
 * (realtime push, email).
 */
public interface NotificationChannel {

  /** Unique identifier for this channel (e.g., "realtime", "email"). */
  String channelId();

  /** Delivers a persisted notification. Implementations may throw; the dispatcher contains it. */
  void deliver(Notification notification, String recipientEmail);

  boolean isEnabled();
}
