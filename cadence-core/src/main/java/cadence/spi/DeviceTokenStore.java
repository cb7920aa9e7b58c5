package cadence.spi;

import java.util.List;

/**
 * Push-notification device registrations.
 */
public interface DeviceTokenStore {

    /**
     * Returns the owner's active device tokens.
     */
    List<String> activeTokens(String ownerId);

    /**
     * Registers or re-activates a token for an owner.
     */
    void register(String ownerId, String token);

    /**
     * Deactivates a token at the owner's request. No-op if unknown.
     */
    void unregister(String ownerId, String token);

    /**
     * Deactivates a token after a push failure, recording the error.
     */
    void deactivate(String token, String error);
}
