package org.showvault.service.show;

import org.junit.jupiter.api.Test;
import org.showvault.model.QualitySelection;
import org.showvault.model.dto.QualityOption;
import org.showvault.model.dto.QualityOptions;
import org.showvault.model.enums.Quality;
import org.showvault.model.enums.QualityPreset;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityOptionsServiceTest {

    private final QualityOptionsService service = new QualityOptionsService();

    @Test
    void optionsFor_marksSelectedTiersPerGroup() {
        List<QualityOption> options = service.optionsFor(QualitySelection.of(EnumSet.of(Quality.SDTV), EnumSet.of(Quality.HDTV)));

        assertThat(options).hasSize(Quality.selectable().size());
        assertThat(options).filteredOn(QualityOption::isInitialSelected).extracting(QualityOption::getQuality)
                .containsExactly(Quality.SDTV);
        assertThat(options).filteredOn(QualityOption::isUpgradeSelected).extracting(QualityOption::getQuality)
                .containsExactly(Quality.HDTV);
    }

    @Test
    void getQualityOptions_listsEveryPresetUnselected() {
        QualityOptions options = service.getQualityOptions();

        assertThat(options.getPresets()).hasSize(QualityPreset.values().length);
        assertThat(options.getTiers()).noneMatch(QualityOption::isInitialSelected);
    }
}
