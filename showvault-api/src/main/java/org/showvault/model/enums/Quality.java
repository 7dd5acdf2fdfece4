package org.showvault.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Download quality tiers. Each tier owns one bit so a set of tiers fits in 16 bits.
 * {@link #NONE} means "nothing downloaded" and never appears inside a selection.
 */
@Getter
@RequiredArgsConstructor
public enum Quality {
    NONE(0, "N/A"),
    SDTV(1, "SDTV"),
    SDDVD(1 << 1, "SD DVD"),
    HDTV(1 << 2, "720p HDTV"),
    RAWHDTV(1 << 3, "RawHD TV"),
    FULLHDTV(1 << 4, "1080p HDTV"),
    HDWEBDL(1 << 5, "720p WEB-DL"),
    FULLHDWEBDL(1 << 6, "1080p WEB-DL"),
    HDBLURAY(1 << 7, "720p BluRay"),
    FULLHDBLURAY(1 << 8, "1080p BluRay"),
    UHD_4K_TV(1 << 9, "4K UHD TV"),
    UHD_4K_WEBDL(1 << 10, "4K UHD WEB-DL"),
    UHD_4K_BLURAY(1 << 11, "4K UHD BluRay"),
    UNKNOWN(1 << 15, "Unknown");

    public static final int TIER_BITS = 16;
    public static final int TIER_MASK = (1 << TIER_BITS) - 1;

    private final int value;
    private final String displayName;

    /**
     * Tiers that can be selected, in rendering order.
     */
    public static Set<Quality> selectable() {
        return EnumSet.complementOf(EnumSet.of(NONE));
    }

    public static int toMask(Collection<Quality> qualities) {
        int mask = 0;
        for (Quality quality : qualities) {
            mask |= quality.value;
        }
        return mask;
    }

    public static Set<Quality> fromMask(int mask) {
        Set<Quality> result = EnumSet.noneOf(Quality.class);
        for (Quality quality : selectable()) {
            if ((mask & quality.value) != 0) {
                result.add(quality);
            }
        }
        return result;
    }

    /**
     * Resolves a submitted checkbox value, which is either the tier name or its bit value.
     */
    public static Optional<Quality> fromFormValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        Optional<Quality> byName = Arrays.stream(values())
                .filter(q -> q != NONE && q.name().equalsIgnoreCase(value))
                .findFirst();
        if (byName.isPresent()) {
            return byName;
        }
        try {
            int bits = Integer.parseInt(value);
            return Arrays.stream(values())
                    .filter(q -> q != NONE && q.value == bits)
                    .findFirst();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Ordering used for upgrade decisions. UNKNOWN ranks below every real tier.
     */
    public int rank() {
        if (this == NONE) {
            return -1;
        }
        return this == UNKNOWN ? 0 : value;
    }

    public boolean isBetterThan(Quality other) {
        return rank() > other.rank();
    }
}
