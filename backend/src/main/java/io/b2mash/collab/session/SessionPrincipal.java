package io.b2mash.collab.session;

/**
 * The authenticated identity bound to a session. Written once at login and read back unchanged by
 * the HTTP filter and the WebSocket handshake.
 */
public record SessionPrincipal(Long userId, String username) {}
