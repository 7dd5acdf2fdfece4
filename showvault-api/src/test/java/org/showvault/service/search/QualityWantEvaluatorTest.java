package org.showvault.service.search;

import org.junit.jupiter.api.Test;
import org.showvault.model.QualitySelection;
import org.showvault.model.enums.Quality;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.showvault.model.enums.Quality.*;

class QualityWantEvaluatorTest {

    private final QualityWantEvaluator evaluator = new QualityWantEvaluator();
    private final QualitySelection sdThenHd = QualitySelection.of(EnumSet.of(SDTV, SDDVD), EnumSet.of(HDTV, FULLHDWEBDL));

    @Test
    void nothingDownloaded_wantsInitialOrUpgradeTiers() {
        assertThat(evaluator.wantRelease(sdThenHd, false, NONE, SDTV)).isTrue();
        assertThat(evaluator.wantRelease(sdThenHd, false, null, FULLHDWEBDL)).isTrue();
        assertThat(evaluator.wantRelease(sdThenHd, false, NONE, FULLHDBLURAY)).isFalse();
    }

    @Test
    void downloaded_wantsOnlyStrictlyBetterUpgrade() {
        assertThat(evaluator.wantRelease(sdThenHd, false, SDTV, HDTV)).isTrue();
        assertThat(evaluator.wantRelease(sdThenHd, false, SDTV, SDDVD)).isFalse();
        assertThat(evaluator.wantRelease(sdThenHd, false, FULLHDWEBDL, HDTV)).isFalse();
        assertThat(evaluator.wantRelease(sdThenHd, false, HDTV, HDTV)).isFalse();
    }

    @Test
    void skipDownloaded_blocksUpgrades() {
        assertThat(evaluator.wantRelease(sdThenHd, true, SDTV, HDTV)).isFalse();
        assertThat(evaluator.wantRelease(sdThenHd, true, NONE, SDTV)).isTrue();
    }

    @Test
    void neverDownload_wantsNothing() {
        assertThat(evaluator.wantRelease(QualitySelection.NEVER, false, NONE, SDTV)).isFalse();
        assertThat(evaluator.wantRelease(sdThenHd, false, NONE, NONE)).isFalse();
    }

    @Test
    void unknownTier_onlyWhenSelected() {
        QualitySelection anyWithUnknown = QualitySelection.of(EnumSet.of(SDTV, UNKNOWN), EnumSet.noneOf(Quality.class));
        assertThat(evaluator.wantRelease(anyWithUnknown, false, NONE, UNKNOWN)).isTrue();
        assertThat(evaluator.wantRelease(sdThenHd, false, NONE, UNKNOWN)).isFalse();
    }
}
