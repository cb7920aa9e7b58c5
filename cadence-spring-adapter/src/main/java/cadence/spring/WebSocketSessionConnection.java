package cadence.spring;

import cadence.live.LiveConnection;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.Objects;

/**
 * {@link LiveConnection} over a Spring {@link WebSocketSession}.
 *
 * <p>Spring sessions do not allow concurrent sends, so frames are written while holding
 * the session's monitor. Two connections are equal when they wrap the same session.
 */
public final class WebSocketSessionConnection implements LiveConnection {
  private final WebSocketSession session;

  public WebSocketSessionConnection(WebSocketSession session) {
    this.session = Objects.requireNonNull(session, "session");
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void send(String text) throws Exception {
    synchronized (session) {
      session.sendMessage(new TextMessage(text));
    }
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  WebSocketSession session() {
    return session;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WebSocketSessionConnection)) {
      return false;
    }
    return session.equals(((WebSocketSessionConnection) o).session);
  }

  @Override
  public int hashCode() {
    return session.hashCode();
  }

  @Override
  public String toString() {
    return "WebSocketSessionConnection[" + session.getId() + "]";
  }
}
