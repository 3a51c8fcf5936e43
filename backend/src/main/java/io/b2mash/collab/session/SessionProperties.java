package io.b2mash.collab.session;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "collab.session")
public record SessionProperties(
    @DefaultValue("collab.sid") String cookieName,
    @DefaultValue("7d") Duration ttl,
    @DefaultValue("false") boolean secureCookie) {}
