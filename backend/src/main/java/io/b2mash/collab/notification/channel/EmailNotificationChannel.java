package io.b2mash.collab.notification.channel;

import io.b2mash.collab.notification.Notification;
import io.b2mash.collab.notification.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Sends a plain-text email per notification through the configured SMTP server and marks the
 * record sent. Enabled only with {@code collab.notifications.email.enabled=true} and a mail
 * sender configured.
 */
@Component
public class EmailNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

  private final JavaMailSender mailSender;
  private final EmailProperties properties;
  private final NotificationService notificationService;

  public EmailNotificationChannel(
      ObjectProvider<JavaMailSender> mailSender,
      EmailProperties properties,
      NotificationService notificationService) {
    this.mailSender = mailSender.getIfAvailable();
    this.properties = properties;
    this.notificationService = notificationService;
  }

  @Override
  public String channelId() {
    return "email";
  }

  @Override
  public void deliver(Notification notification, String recipientEmail) {
    if (recipientEmail == null || recipientEmail.isBlank()) {
      log.debug("Skipping email for notification {} -- no recipient email", notification.getId());
      return;
    }

    var message = new SimpleMailMessage();
    message.setFrom(properties.from());
    message.setTo(recipientEmail);
    message.setSubject(notification.getSubject());
    message.setText(notification.getContent() != null ? notification.getContent() : "");
    mailSender.send(message);

    notificationService.markSent(notification.getId());
    log.debug("Email sent for notification={} to={}", notification.getId(), recipientEmail);
  }

  @Override
  public boolean isEnabled() {
    return properties.enabled() && mailSender != null;
  }
}
