package org.showvault.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.enums.PauseTransition;
import org.showvault.model.enums.ShowSettingField;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowUpdateResult {
    private ShowSettings settings;
    private Set<ShowSettingField> changedFields;
    private PauseTransition pauseTransition;
}
