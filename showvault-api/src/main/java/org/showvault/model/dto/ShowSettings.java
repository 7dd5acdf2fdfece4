package org.showvault.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.QualitySelection;
import org.showvault.model.enums.EpisodeStatus;
import org.showvault.model.enums.NumberingScheme;
import org.showvault.model.enums.ShowState;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ShowSettings {
    private Long showId;
    private String name;
    private String location;
    private QualitySelection quality;
    private int qualityPacked;
    private String qualityPreset;
    private EpisodeStatus defaultEpisodeStatus;
    private String language;
    private boolean skipDownloaded;
    private boolean subtitlesEnabled;
    private boolean effectiveSubtitlesEnabled;
    private boolean subtitlesUseShowMetadata;
    private boolean paused;
    private ShowState state;
    private boolean airByDate;
    private boolean sports;
    private boolean dvdOrder;
    private boolean anime;
    private boolean sceneNumbering;
    private NumberingScheme numberingScheme;
    private boolean seasonFolders;
    private List<String> ignoreWords;
    private List<String> requireWords;
    private List<String> releaseGroupWhitelist;
    private List<String> releaseGroupBlacklist;
    private Set<String> sceneExceptions;
    private int searchDelayDays;
    private Instant updatedAt;
}
