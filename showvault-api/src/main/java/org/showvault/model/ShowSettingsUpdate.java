package org.showvault.model;

import lombok.Builder;
import lombok.Value;
import org.showvault.model.enums.EpisodeStatus;

import java.util.List;
import java.util.Set;

/**
 * A fully validated edit-form submission. Nullable fields were absent from the form and leave
 * the stored value untouched; booleans come from checkbox presence and always apply.
 */
@Value
@Builder
public class ShowSettingsUpdate {
    String location;
    QualitySelection quality;
    EpisodeStatus defaultEpisodeStatus;
    String language;
    boolean skipDownloaded;
    boolean subtitles;
    boolean subtitlesUseShowMetadata;
    boolean paused;
    boolean airByDate;
    boolean sports;
    boolean dvdOrder;
    boolean anime;
    boolean sceneNumbering;
    boolean seasonFolders;
    List<String> ignoreWords;
    List<String> requireWords;
    List<String> releaseGroupWhitelist;
    List<String> releaseGroupBlacklist;
    Set<String> sceneExceptions;
    Integer searchDelayDays;
}
