package cadence.spring;

import cadence.live.ConnectionRegistry;
import cadence.util.JsonCodec;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.security.Principal;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registers accepted WebSocket sessions with a {@link ConnectionRegistry}.
 *
 * <p>The owner is read from the {@value #OWNER_ATTRIBUTE} session attribute, which a
 * handshake interceptor is expected to set after authenticating the client. When the
 * attribute is absent the authenticated principal's name is used. Sessions with neither
 * are closed with status {@code 4001}.
 *
 * <p>Inbound frames: {@code {"type":"ping"}} is answered with {@code {"type":"pong"}} on the
 * same session; any other JSON object is echoed to all of the owner's connections as an
 * {@code echo} message. Frames that are not JSON objects are ignored.
 */
public class CadenceWebSocketHandler extends TextWebSocketHandler {
  private static final Logger logger = Logger.getLogger(CadenceWebSocketHandler.class.getName());

  public static final String OWNER_ATTRIBUTE = "cadence.ownerId";
  static final CloseStatus UNAUTHENTICATED = new CloseStatus(4001, "unauthenticated");

  private final ConnectionRegistry registry;
  private final JsonCodec jsonCodec;

  public CadenceWebSocketHandler(ConnectionRegistry registry) {
    this(registry, JsonCodec.getDefault());
  }

  public CadenceWebSocketHandler(ConnectionRegistry registry, JsonCodec jsonCodec) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    String ownerId = ownerOf(session);
    if (ownerId == null) {
      logger.log(Level.FINE, "Closing session {0} without an owner", session.getId());
      session.close(UNAUTHENTICATED);
      return;
    }
    registry.register(ownerId, new WebSocketSessionConnection(session));
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message)
      throws Exception {
    String ownerId = ownerOf(session);
    if (ownerId == null) {
      return;
    }
    Map<String, String> frame;
    try {
      frame = jsonCodec.parseObject(message.getPayload());
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Ignoring malformed frame on session " + session.getId(), e);
      return;
    }
    if ("ping".equals(frame.get("type"))) {
      new WebSocketSessionConnection(session).send(jsonCodec.toJson(Map.of("type", "pong")));
    } else {
      registry.sendToOwner(ownerId, "echo", frame);
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.log(Level.FINE, "Transport error on session " + session.getId(), exception);
    unregister(session);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    unregister(session);
  }

  private void unregister(WebSocketSession session) {
    String ownerId = ownerOf(session);
    if (ownerId != null) {
      registry.unregister(ownerId, new WebSocketSessionConnection(session));
    }
  }

  /**
   * Resolves the owner of a session, or {@code null} when it cannot be determined.
   * Subclasses may override to read the owner from elsewhere.
   */
  protected String ownerOf(WebSocketSession session) {
    Object attribute = session.getAttributes().get(OWNER_ATTRIBUTE);
    if (attribute != null && !attribute.toString().isEmpty()) {
      return attribute.toString();
    }
    Principal principal = session.getPrincipal();
    return principal != null ? principal.getName() : null;
  }
}
