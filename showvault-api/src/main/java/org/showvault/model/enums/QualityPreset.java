package org.showvault.model.enums;

import lombok.Getter;
import org.showvault.model.QualitySelection;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;

import static org.showvault.model.enums.Quality.*;

@Getter
public enum QualityPreset {
    ANY("Any", EnumSet.of(SDTV, SDDVD, HDTV, FULLHDTV, HDWEBDL, FULLHDWEBDL, HDBLURAY, FULLHDBLURAY, UNKNOWN)),
    SD("SD", EnumSet.of(SDTV, SDDVD)),
    HD("HD", EnumSet.of(HDTV, FULLHDTV, HDWEBDL, FULLHDWEBDL, HDBLURAY, FULLHDBLURAY)),
    HD720P("HD720p", EnumSet.of(HDTV, HDWEBDL, HDBLURAY)),
    HD1080P("HD1080p", EnumSet.of(FULLHDTV, FULLHDWEBDL, FULLHDBLURAY)),
    UHD_4K("UHD-4K", EnumSet.of(UHD_4K_TV, UHD_4K_WEBDL, UHD_4K_BLURAY));

    private final String displayName;
    private final QualitySelection selection;

    QualityPreset(String displayName, EnumSet<Quality> initial) {
        this.displayName = displayName;
        this.selection = QualitySelection.of(initial, EnumSet.noneOf(Quality.class));
    }

    public int getPacked() {
        return selection.toPacked();
    }

    public static Optional<QualityPreset> fromPacked(int packed) {
        return Arrays.stream(values())
                .filter(preset -> preset.getPacked() == packed)
                .findFirst();
    }

    public static Optional<QualityPreset> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(preset -> preset.name().equalsIgnoreCase(trimmed) || preset.displayName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
