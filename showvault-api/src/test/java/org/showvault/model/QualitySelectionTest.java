package org.showvault.model;

import org.junit.jupiter.api.Test;
import org.showvault.model.enums.Quality;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.showvault.model.enums.Quality.*;

class QualitySelectionTest {

    @Test
    void decompose_inversesCompose_forEverySmallSubsetPair() {
        List<Set<Quality>> subsets = subsetsOf(List.of(SDTV, HDTV, FULLHDBLURAY, UNKNOWN));
        for (Set<Quality> initial : subsets) {
            for (Set<Quality> upgrade : subsets) {
                QualitySelection decoded = QualitySelection.decompose(QualitySelection.compose(initial, upgrade));
                assertThat(decoded.getInitial()).isEqualTo(initial);
                assertThat(decoded.getUpgrade()).isEqualTo(upgrade);
            }
        }
    }

    @Test
    void compose_allSelectableTiers_roundTrips() {
        Set<Quality> all = Quality.selectable();
        QualitySelection decoded = QualitySelection.decompose(QualitySelection.compose(all, all));
        assertThat(decoded.getInitial()).isEqualTo(all);
        assertThat(decoded.getUpgrade()).isEqualTo(all);
    }

    @Test
    void compose_placesUpgradeTiersInHighBits() {
        int packed = QualitySelection.compose(EnumSet.of(SDTV), EnumSet.of(HDTV));
        assertThat(packed & Quality.TIER_MASK).isEqualTo(SDTV.getValue());
        assertThat(packed >>> Quality.TIER_BITS).isEqualTo(HDTV.getValue());
    }

    @Test
    void compose_bothEmpty_isZeroAndNeverDownload() {
        assertThat(QualitySelection.compose(EnumSet.noneOf(Quality.class), EnumSet.noneOf(Quality.class))).isZero();
        assertThat(QualitySelection.decompose(0).isNeverDownload()).isTrue();
        assertThat(QualitySelection.decompose(0)).isEqualTo(QualitySelection.NEVER);
    }

    @Test
    void of_dropsNoneAndNulls() {
        List<Quality> withNone = new ArrayList<>();
        withNone.add(NONE);
        withNone.add(null);
        withNone.add(SDDVD);
        QualitySelection selection = QualitySelection.of(withNone, null);
        assertThat(selection.getInitial()).containsExactly(SDDVD);
        assertThat(selection.getUpgrade()).isEmpty();
    }

    @Test
    void sets_areUnmodifiable() {
        QualitySelection selection = QualitySelection.of(EnumSet.of(SDTV), EnumSet.of(HDTV));
        assertThrows(UnsupportedOperationException.class, () -> selection.getInitial().add(HDTV));
    }

    @Test
    void bestUpgrade_returnsHighestRankedTier() {
        QualitySelection selection = QualitySelection.of(EnumSet.of(SDTV), EnumSet.of(HDTV, FULLHDWEBDL, UNKNOWN));
        assertThat(selection.bestUpgrade()).isEqualTo(FULLHDWEBDL);
        assertThat(QualitySelection.NEVER.bestUpgrade()).isEqualTo(NONE);
    }

    private static List<Set<Quality>> subsetsOf(List<Quality> tiers) {
        List<Set<Quality>> subsets = new ArrayList<>();
        for (int bits = 0; bits < (1 << tiers.size()); bits++) {
            Set<Quality> subset = EnumSet.noneOf(Quality.class);
            for (int i = 0; i < tiers.size(); i++) {
                if ((bits & (1 << i)) != 0) {
                    subset.add(tiers.get(i));
                }
            }
            subsets.add(subset);
        }
        return subsets;
    }
}
