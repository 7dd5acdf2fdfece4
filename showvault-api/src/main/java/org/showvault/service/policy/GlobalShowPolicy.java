package org.showvault.service.policy;

/**
 * Snapshot of the global flags that gate per-show settings, taken once per request.
 */
public record GlobalShowPolicy(boolean forceSeasonFolders, boolean subtitlesEnabled) {

    public boolean effectiveSeasonFolders(boolean requested) {
        return requested || forceSeasonFolders;
    }

    public boolean effectiveSubtitles(boolean stored) {
        return stored && subtitlesEnabled;
    }

    public boolean seasonFoldersLocked() {
        return forceSeasonFolders;
    }
}
