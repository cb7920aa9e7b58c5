package cadence.spi;

import cadence.model.NotificationPreference;
import cadence.model.NotificationType;

import java.util.Optional;

/**
 * Per-owner, per-type notification preferences. Preferences are never deleted.
 */
public interface PreferenceStore {

    Optional<NotificationPreference> find(String ownerId, NotificationType type);

    /**
     * Inserts or replaces the preference for {@code (ownerId, type)}.
     */
    void upsert(NotificationPreference preference);
}
