package io.b2mash.collab.notification.channel;

import io.b2mash.collab.notification.Notification;
import io.b2mash.collab.notification.NotificationResponse;
import io.b2mash.collab.realtime.BroadcastDispatcher;
import io.b2mash.collab.realtime.EventType;
import io.b2mash.collab.realtime.RealtimeEvent;
import java.util.List;
import org.springframework.stereotype.Component;

/** Pushes {@code notification_created} to the recipient's open connections. */
@Component
public class RealtimeNotificationChannel implements NotificationChannel {

  private final BroadcastDispatcher broadcastDispatcher;

  public RealtimeNotificationChannel(BroadcastDispatcher broadcastDispatcher) {
    this.broadcastDispatcher = broadcastDispatcher;
  }

  @Override
  public String channelId() {
    return "realtime";
  }

  @Override
  public void deliver(Notification notification, String recipientEmail) {
    broadcastDispatcher.sendToUsers(
        RealtimeEvent.of(EventType.NOTIFICATION_CREATED, NotificationResponse.from(notification)),
        List.of(notification.getUserId()));
  }

  @Override
  public boolean isEnabled() {
    return true;
  }
}
