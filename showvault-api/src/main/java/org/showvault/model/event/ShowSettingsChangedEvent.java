package org.showvault.model.event;

import lombok.Builder;
import lombok.Value;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.enums.PauseTransition;
import org.showvault.model.enums.ShowSettingField;

import java.util.Set;

/**
 * Published after a show's stored settings actually changed. Never published for a no-op update.
 */
@Value
@Builder
public class ShowSettingsChangedEvent {
    long showId;
    Set<ShowSettingField> changedFields;
    PauseTransition pauseTransition;
    ShowSettings settings;
}
