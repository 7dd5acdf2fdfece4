package org.showvault.service.show;

import org.showvault.model.QualitySelection;
import org.showvault.model.dto.QualityOption;
import org.showvault.model.dto.QualityOptions;
import org.showvault.model.dto.QualityPresetOption;
import org.showvault.model.enums.Quality;
import org.showvault.model.enums.QualityPreset;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Service
public class QualityOptionsService {

    public QualityOptions getQualityOptions() {
        return QualityOptions.builder()
                .tiers(optionsFor(QualitySelection.NEVER))
                .presets(Arrays.stream(QualityPreset.values())
                        .map(preset -> QualityPresetOption.builder()
                                .name(preset.name())
                                .displayName(preset.getDisplayName())
                                .packed(preset.getPacked())
                                .qualities(preset.getSelection().getInitial())
                                .build())
                        .toList())
                .build();
    }

    /**
     * One checkbox row per selectable tier, marked for the initial and upgrade groups.
     */
    public List<QualityOption> optionsFor(QualitySelection selection) {
        QualitySelection current = selection != null ? selection : QualitySelection.NEVER;
        return Quality.selectable().stream()
                .map(quality -> QualityOption.builder()
                        .quality(quality)
                        .value(quality.getValue())
                        .displayName(quality.getDisplayName())
                        .initialSelected(current.getInitial().contains(quality))
                        .upgradeSelected(current.getUpgrade().contains(quality))
                        .build())
                .toList();
    }
}
