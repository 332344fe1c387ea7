package villagecompute.dailybrief.data.stores;

import villagecompute.dailybrief.data.models.BriefPreference;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to user brief preferences.
 *
 * @see PanacheBriefPreferenceStore
 */
public interface BriefPreferenceStore {

    /**
     * Returns every preference with {@code is_active = true}.
     */
    List<BriefPreference> listActivePreferences();

    /**
     * Returns the preference of a single user, active or not.
     */
    Optional<BriefPreference> findByUserId(UUID userId);
}
