package org.showvault.service.policy;

import org.showvault.model.QualitySelection;
import org.showvault.model.enums.EpisodeStatus;

import java.util.List;

public interface GlobalConfigurationStore {

    boolean useSubtitlesGlobally();

    boolean forceSeasonFolders();

    QualitySelection defaultQuality();

    EpisodeStatus defaultEpisodeStatus();

    String defaultLanguage();

    boolean defaultSeasonFolders();

    boolean defaultSubtitles();

    boolean defaultAnime();

    boolean defaultSceneNumbering();

    int defaultSearchDelayDays();

    List<String> globalIgnoreWords();

    List<String> globalRequireWords();

    default GlobalShowPolicy snapshot() {
        return new GlobalShowPolicy(forceSeasonFolders(), useSubtitlesGlobally());
    }
}
