package org.showvault.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.showvault.model.enums.Quality;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tiers acceptable for a first download ({@code initial}) and tiers worth replacing an
 * existing download with ({@code upgrade}). Packs into a single integer: initial tiers in the
 * low 16 bits, upgrade tiers in the high 16 bits.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QualitySelection {

    public static final QualitySelection NEVER = of(EnumSet.noneOf(Quality.class), EnumSet.noneOf(Quality.class));

    private final Set<Quality> initial;
    private final Set<Quality> upgrade;

    private QualitySelection(Set<Quality> initial, Set<Quality> upgrade) {
        this.initial = Collections.unmodifiableSet(initial);
        this.upgrade = Collections.unmodifiableSet(upgrade);
    }

    public static QualitySelection of(Collection<Quality> initial, Collection<Quality> upgrade) {
        return new QualitySelection(copyOf(initial), copyOf(upgrade));
    }

    public static int compose(Collection<Quality> initial, Collection<Quality> upgrade) {
        return Quality.toMask(copyOf(initial)) | (Quality.toMask(copyOf(upgrade)) << Quality.TIER_BITS);
    }

    public static QualitySelection decompose(int packed) {
        Set<Quality> initial = Quality.fromMask(packed & Quality.TIER_MASK);
        Set<Quality> upgrade = Quality.fromMask((packed >>> Quality.TIER_BITS) & Quality.TIER_MASK);
        return new QualitySelection(initial, upgrade);
    }

    public int toPacked() {
        return compose(initial, upgrade);
    }

    @JsonIgnore
    public boolean isNeverDownload() {
        return initial.isEmpty() && upgrade.isEmpty();
    }

    public Quality bestUpgrade() {
        return upgrade.stream()
                .max((a, b) -> Integer.compare(a.rank(), b.rank()))
                .orElse(Quality.NONE);
    }

    private static EnumSet<Quality> copyOf(Collection<Quality> qualities) {
        EnumSet<Quality> copy = EnumSet.noneOf(Quality.class);
        if (qualities != null) {
            qualities.stream()
                    .filter(q -> q != null && q != Quality.NONE)
                    .forEach(copy::add);
        }
        return copy;
    }
}
