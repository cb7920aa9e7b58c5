package cadence.spi;

import java.util.List;
import java.util.Map;

/**
 * Outbound push-notification adapter.
 */
@FunctionalInterface
public interface PushSender {

    /**
     * Sends one notification to several device tokens.
     *
     * @return one result per token; tokens missing from the result are treated as failed
     * @throws Exception if the request as a whole failed
     */
    List<PushResult> send(List<String> deviceTokens, String title, String body,
            Map<String, String> data) throws Exception;

    /**
     * Per-token outcome.
     *
     * @param error failure description, {@code null} on success
     */
    record PushResult(String token, boolean success, String error) {

        public static PushResult ok(String token) {
            return new PushResult(token, true, null);
        }

        public static PushResult failed(String token, String error) {
            return new PushResult(token, false, error);
        }
    }
}
