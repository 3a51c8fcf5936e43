package io.b2mash.collab.notification.channel;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "collab.notifications.email")
public record EmailProperties(
    @DefaultValue("false") boolean enabled, @DefaultValue("no-reply@collab.local") String from) {}
