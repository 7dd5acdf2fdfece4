package org.showvault.model.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QualityPresetTest {

    @Test
    void presets_haveNoUpgradeTiers() {
        for (QualityPreset preset : QualityPreset.values()) {
            assertThat(preset.getSelection().getUpgrade()).as(preset.name()).isEmpty();
            assertThat(preset.getSelection().getInitial()).as(preset.name()).isNotEmpty();
        }
    }

    @Test
    void fromPacked_recognisesEveryPreset() {
        for (QualityPreset preset : QualityPreset.values()) {
            assertThat(QualityPreset.fromPacked(preset.getPacked())).contains(preset);
        }
    }

    @Test
    void fromPacked_customCombination_isEmpty() {
        int packed = QualityPreset.SD.getPacked() | (Quality.HDTV.getValue() << Quality.TIER_BITS);
        assertThat(QualityPreset.fromPacked(packed)).isEmpty();
    }

    @Test
    void fromName_matchesEnumOrDisplayName() {
        assertThat(QualityPreset.fromName("hd720p")).contains(QualityPreset.HD720P);
        assertThat(QualityPreset.fromName("UHD-4K")).contains(QualityPreset.UHD_4K);
        assertThat(QualityPreset.fromName("custom")).isEmpty();
        assertThat(QualityPreset.fromName(null)).isEmpty();
    }
}
