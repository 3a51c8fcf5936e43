package io.b2mash.collab.notification.channel;

import io.b2mash.collab.notification.Notification;
import io.b2mash.collab.realtime.DeliveryReport;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes a persisted notification to every enabled channel. Channels self-register via
 * constructor injection (Spring collects all NotificationChannel beans).
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<NotificationChannel> channels;

  public NotificationDispatcher(List<NotificationChannel> channelBeans) {
    this.channels = channelBeans.stream().filter(NotificationChannel::isEnabled).toList();
    log.info(
        "Notification channels enabled: {}",
        channels.stream().map(NotificationChannel::channelId).toList());
  }

  /** Delivers to each channel independently; a failing channel does not stop the others. */
  public DeliveryReport dispatch(Notification notification, String recipientEmail) {
    int delivered = 0;
    for (var channel : channels) {
      try {
        channel.deliver(notification, recipientEmail);
        delivered++;
      } catch (Exception e) {
        log.warn(
            "Failed to deliver notification via channel={} notificationId={}",
            channel.channelId(),
            notification.getId(),
            e);
      }
    }
    return new DeliveryReport(channels.size(), delivered, channels.size() - delivered);
  }
}
