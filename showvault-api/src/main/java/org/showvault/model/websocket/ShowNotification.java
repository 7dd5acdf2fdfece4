package org.showvault.model.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.enums.PauseTransition;
import org.showvault.model.enums.ShowSettingField;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowNotification {
    private long showId;
    private String showName;
    private Set<ShowSettingField> changedFields;
    private PauseTransition pauseTransition;
    private Instant timestamp;
}
