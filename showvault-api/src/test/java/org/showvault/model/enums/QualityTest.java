package org.showvault.model.enums;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class QualityTest {

    @Test
    void tierValues_areDistinctSingleBitsWithinSixteenBits() {
        int seen = 0;
        for (Quality quality : Quality.selectable()) {
            assertThat(Integer.bitCount(quality.getValue())).isEqualTo(1);
            assertThat(quality.getValue() & ~Quality.TIER_MASK).isZero();
            assertThat(seen & quality.getValue()).isZero();
            seen |= quality.getValue();
        }
    }

    @Test
    void fromFormValue_acceptsNameOrBitValue() {
        assertThat(Quality.fromFormValue("hdtv")).contains(Quality.HDTV);
        assertThat(Quality.fromFormValue(" 4 ")).contains(Quality.HDTV);
        assertThat(Quality.fromFormValue("32768")).contains(Quality.UNKNOWN);
    }

    @Test
    void fromFormValue_rejectsNoneAndGarbage() {
        assertThat(Quality.fromFormValue("NONE")).isEqualTo(Optional.empty());
        assertThat(Quality.fromFormValue("0")).isEmpty();
        assertThat(Quality.fromFormValue("8K")).isEmpty();
        assertThat(Quality.fromFormValue(" ")).isEmpty();
    }

    @Test
    void unknown_ranksBelowEveryRealTier() {
        assertThat(Quality.SDTV.isBetterThan(Quality.UNKNOWN)).isTrue();
        assertThat(Quality.UNKNOWN.isBetterThan(Quality.NONE)).isTrue();
        assertThat(Quality.FULLHDBLURAY.isBetterThan(Quality.HDBLURAY)).isTrue();
    }
}
