package cadence.spi;

import java.util.Optional;

/**
 * Resolves contact details owned by the user service.
 */
@FunctionalInterface
public interface RecipientDirectory {

    /**
     * Returns the owner's email address, or empty when none is on file.
     */
    Optional<String> emailFor(String ownerId);
}
