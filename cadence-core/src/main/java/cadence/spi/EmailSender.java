package cadence.spi;

/**
 * Outbound email adapter.
 *
 * <p>Delivery is at-least-once: the subject and body carry the notification id so the
 * receiving side can deduplicate.
 */
@FunctionalInterface
public interface EmailSender {

    /**
     * Sends one message.
     *
     * @param to      recipient address
     * @param subject subject line
     * @param body    HTML body
     * @throws Exception if the message was not accepted
     */
    void send(String to, String subject, String body) throws Exception;
}
