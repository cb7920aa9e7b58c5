/**
 * Spring integration for Cadence transports.
 *
 * <p>{@link cadence.spring.CadenceWebSocketHandler} exposes the connection registry over
 * Spring WebSocket, wrapping each session in a {@link cadence.spring.WebSocketSessionConnection}.
 * {@link cadence.spring.SpringMailEmailSender} delivers the email channel through Spring Mail.
 */
package cadence.spring;
