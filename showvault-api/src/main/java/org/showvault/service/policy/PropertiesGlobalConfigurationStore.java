package org.showvault.service.policy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.showvault.config.AppProperties;
import org.showvault.model.QualitySelection;
import org.showvault.model.enums.EpisodeStatus;
import org.showvault.model.enums.QualityPreset;
import org.showvault.util.WordListParser;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PropertiesGlobalConfigurationStore implements GlobalConfigurationStore {

    private final AppProperties appProperties;

    @Override
    public boolean useSubtitlesGlobally() {
        return appProperties.getShows().isUseSubtitles();
    }

    @Override
    public boolean forceSeasonFolders() {
        return appProperties.getShows().isForceSeasonFolders();
    }

    /**
     * Accepts a preset name or a packed quality integer.
     */
    @Override
    public QualitySelection defaultQuality() {
        String configured = appProperties.getShows().getDefaultQuality();
        if (StringUtils.isBlank(configured)) {
            return QualityPreset.SD.getSelection();
        }
        return QualityPreset.fromName(configured)
                .map(QualityPreset::getSelection)
                .orElseGet(() -> {
                    try {
                        return QualitySelection.decompose(Integer.parseInt(configured.trim()));
                    } catch (NumberFormatException e) {
                        log.warn("Unrecognised default quality '{}', falling back to SD", configured);
                        return QualityPreset.SD.getSelection();
                    }
                });
    }

    @Override
    public EpisodeStatus defaultEpisodeStatus() {
        String configured = appProperties.getShows().getDefaultEpisodeStatus();
        return EpisodeStatus.fromFormValue(configured).orElseGet(() -> {
            log.warn("Unrecognised default episode status '{}', falling back to SKIPPED", configured);
            return EpisodeStatus.SKIPPED;
        });
    }

    @Override
    public String defaultLanguage() {
        return appProperties.getShows().getDefaultLanguage();
    }

    @Override
    public boolean defaultSeasonFolders() {
        return appProperties.getShows().isDefaultSeasonFolders();
    }

    @Override
    public boolean defaultSubtitles() {
        return appProperties.getShows().isDefaultSubtitles();
    }

    @Override
    public boolean defaultAnime() {
        return appProperties.getShows().isDefaultAnime();
    }

    @Override
    public boolean defaultSceneNumbering() {
        return appProperties.getShows().isDefaultSceneNumbering();
    }

    @Override
    public int defaultSearchDelayDays() {
        return Math.max(0, appProperties.getShows().getDefaultSearchDelayDays());
    }

    @Override
    public List<String> globalIgnoreWords() {
        return WordListParser.clean(appProperties.getSearch().getIgnoreWords());
    }

    @Override
    public List<String> globalRequireWords() {
        return WordListParser.clean(appProperties.getSearch().getRequireWords());
    }
}
