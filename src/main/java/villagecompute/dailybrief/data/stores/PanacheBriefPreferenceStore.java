package villagecompute.dailybrief.data.stores;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.dailybrief.data.models.BriefPreference;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link BriefPreferenceStore} backed by the {@code user_brief_preferences} table.
 */
@ApplicationScoped
public class PanacheBriefPreferenceStore implements BriefPreferenceStore {

    @Override
    public List<BriefPreference> listActivePreferences() {
        return BriefPreference.findActive();
    }

    @Override
    public Optional<BriefPreference> findByUserId(UUID userId) {
        return BriefPreference.findByUserId(userId);
    }
}
