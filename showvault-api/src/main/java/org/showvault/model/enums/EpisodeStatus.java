package org.showvault.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Status given to newly discovered future episodes of a show.
 */
public enum EpisodeStatus {
    WANTED,
    SKIPPED,
    IGNORED;

    public static Optional<EpisodeStatus> fromFormValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
