package io.b2mash.collab.realtime;

import io.b2mash.collab.session.SessionProperties;
import java.util.Map;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.WebUtils;

/**
 * Copies the session id from the upgrade request (session cookie, else {@code sid} query
 * parameter) into the transport attributes. The upgrade always proceeds; authentication happens
 * on the open transport so rejections carry a close code the client can read.
 */
public class SessionCookieHandshakeInterceptor implements HandshakeInterceptor {

  public static final String SESSION_ID_ATTRIBUTE = "collab.sessionId";
  static final String SESSION_ID_PARAM = "sid";

  private final SessionProperties sessionProperties;

  public SessionCookieHandshakeInterceptor(SessionProperties sessionProperties) {
    this.sessionProperties = sessionProperties;
  }

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    String sid = null;
    if (request instanceof ServletServerHttpRequest servletRequest) {
      var cookie =
          WebUtils.getCookie(servletRequest.getServletRequest(), sessionProperties.cookieName());
      if (cookie != null && !cookie.getValue().isBlank()) {
        sid = cookie.getValue();
      }
    }
    if (sid == null) {
      sid =
          UriComponentsBuilder.fromUri(request.getURI())
              .build()
              .getQueryParams()
              .getFirst(SESSION_ID_PARAM);
    }
    if (sid != null && !sid.isBlank()) {
      attributes.put(SESSION_ID_ATTRIBUTE, sid);
    }
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {}
}
