package org.showvault.service.show;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.showvault.convertor.WordListConverter;
import org.showvault.exception.ApiError;
import org.showvault.model.QualitySelection;
import org.showvault.model.ShowSettingsUpdate;
import org.showvault.model.dto.request.ShowEditForm;
import org.showvault.model.entity.ShowEntity;
import org.showvault.model.enums.EpisodeStatus;
import org.showvault.model.enums.Quality;
import org.showvault.model.enums.QualityPreset;
import org.showvault.service.indexer.IndexerMetadataService;
import org.showvault.service.policy.GlobalShowPolicy;
import org.showvault.util.WordListParser;
import org.springframework.stereotype.Component;

import java.util.*;

import static org.showvault.model.dto.request.ShowEditForm.*;

/**
 * Turns a raw form into a {@link ShowSettingsUpdate}. Every field is validated before anything is
 * returned, so a bad field rejects the whole submission.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShowEditFormParser {

    private static final String CUSTOM_PRESET = "CUSTOM";
    private static final WordListConverter WORD_LIST_CONVERTER = new WordListConverter();

    private final IndexerMetadataService indexerMetadataService;

    public long parseShowId(ShowEditForm form) {
        String raw = form.value(SHOW).map(String::trim).orElse("");
        try {
            long showId = Long.parseLong(raw);
            if (showId <= 0) {
                throw ApiError.VALIDATION_ERROR.createException(SHOW, "show ID must be positive");
            }
            return showId;
        } catch (NumberFormatException e) {
            throw ApiError.VALIDATION_ERROR.createException(SHOW, "show ID is required and must be a number");
        }
    }

    public ShowSettingsUpdate parse(ShowEditForm form, GlobalShowPolicy policy) {
        String location = form.value(LOCATION)
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .orElseThrow(() -> ApiError.VALIDATION_ERROR.createException(LOCATION, "a show location is required"));
        if (location.length() > ShowEntity.LOCATION_LENGTH) {
            throw ApiError.VALIDATION_ERROR.createException(LOCATION, "must be at most " + ShowEntity.LOCATION_LENGTH + " characters");
        }

        EpisodeStatus status = form.value(DEFAULT_EPISODE_STATUS)
                .map(raw -> EpisodeStatus.fromFormValue(raw)
                        .orElseThrow(() -> ApiError.VALIDATION_ERROR.createException(DEFAULT_EPISODE_STATUS, "unknown status '" + raw + "'")))
                .orElse(null);

        String language = form.value(INDEXER_LANGUAGE)
                .map(String::trim)
                .map(this::requireSupportedLanguage)
                .orElse(null);

        Integer searchDelay = form.value(SEARCH_DELAY)
                .map(this::parseSearchDelay)
                .orElse(null);

        boolean requestedSeasonFolders = form.present(SEASON_FOLDERS);
        boolean seasonFolders = policy.effectiveSeasonFolders(requestedSeasonFolders);
        if (seasonFolders != requestedSeasonFolders) {
            log.debug("Season folders are forced globally, ignoring request to disable them");
        }

        boolean airByDate = form.present(AIR_BY_DATE);
        boolean sports = form.present(SPORTS);
        if (airByDate && sports) {
            log.debug("Show is flagged both air-by-date and sports");
        }

        return ShowSettingsUpdate.builder()
                .location(location)
                .quality(parseQuality(form))
                .defaultEpisodeStatus(status)
                .language(language)
                .skipDownloaded(form.present(SKIP_DOWNLOADED))
                .subtitles(form.present(SUBTITLES))
                .subtitlesUseShowMetadata(form.present(SUBTITLES_USE_SHOW_METADATA))
                .paused(form.present(PAUSED))
                .airByDate(airByDate)
                .sports(sports)
                .dvdOrder(form.present(DVD_ORDER))
                .anime(form.present(ANIME))
                .sceneNumbering(form.present(SCENE_NUMBERING))
                .seasonFolders(seasonFolders)
                .ignoreWords(wordList(form, IGNORE_WORDS))
                .requireWords(wordList(form, REQUIRE_WORDS))
                .releaseGroupWhitelist(wordList(form, RELEASE_GROUP_WHITELIST))
                .releaseGroupBlacklist(wordList(form, RELEASE_GROUP_BLACKLIST))
                .sceneExceptions(sceneExceptions(form))
                .searchDelayDays(searchDelay)
                .build();
    }

    /**
     * A preset wins over individual checkboxes. Either checkbox group being present means the
     * user edited the quality, so an empty submission yields "never download".
     */
    QualitySelection parseQuality(ShowEditForm form) {
        Optional<String> preset = form.value(QUALITY_PRESET)
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .filter(value -> !CUSTOM_PRESET.equalsIgnoreCase(value));
        if (preset.isPresent()) {
            String value = preset.get();
            return QualityPreset.fromName(value)
                    .map(QualityPreset::getSelection)
                    .orElseThrow(() -> ApiError.VALIDATION_ERROR.createException(QUALITY_PRESET, "unknown preset '" + value + "'"));
        }
        if (!form.present(INITIAL_QUALITIES) && !form.present(UPGRADE_QUALITIES)) {
            return null;
        }
        return QualitySelection.of(qualities(form, INITIAL_QUALITIES), qualities(form, UPGRADE_QUALITIES));
    }

    private Set<Quality> qualities(ShowEditForm form, String field) {
        Set<Quality> result = EnumSet.noneOf(Quality.class);
        for (String raw : form.values(field)) {
            for (String token : WordListParser.parse(raw)) {
                result.add(Quality.fromFormValue(token)
                        .orElseThrow(() -> ApiError.VALIDATION_ERROR.createException(field, "unknown quality '" + token + "'")));
            }
        }
        return result;
    }

    private String requireSupportedLanguage(String language) {
        if (!indexerMetadataService.isSupportedLanguage(language)) {
            throw ApiError.UNSUPPORTED_LANGUAGE.createException(language);
        }
        return language.toLowerCase(Locale.ROOT);
    }

    private Integer parseSearchDelay(String raw) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return 0;
        }
        try {
            int delay = Integer.parseInt(value);
            if (delay < 0) {
                throw ApiError.VALIDATION_ERROR.createException(SEARCH_DELAY, "must not be negative");
            }
            return delay;
        } catch (NumberFormatException e) {
            throw ApiError.VALIDATION_ERROR.createException(SEARCH_DELAY, "'" + raw + "' is not a whole number of days");
        }
    }

    private List<String> wordList(ShowEditForm form, String field) {
        if (!form.present(field)) {
            return null;
        }
        List<String> words = new ArrayList<>();
        for (String raw : form.values(field)) {
            words.addAll(WordListParser.parse(raw));
        }
        String stored = WORD_LIST_CONVERTER.convertToDatabaseColumn(words);
        if (stored != null && stored.length() > ShowEntity.WORD_LIST_LENGTH) {
            throw ApiError.VALIDATION_ERROR.createException(field, "list is too long to store (" + stored.length()
                    + " of at most " + ShowEntity.WORD_LIST_LENGTH + " characters)");
        }
        return words;
    }

    private Set<String> sceneExceptions(ShowEditForm form) {
        if (!form.present(SCENE_EXCEPTIONS)) {
            return null;
        }
        Set<String> exceptions = new LinkedHashSet<>();
        for (String raw : form.values(SCENE_EXCEPTIONS)) {
            String name = StringUtils.trimToNull(raw);
            if (name != null && name.length() > ShowEntity.SCENE_EXCEPTION_LENGTH) {
                throw ApiError.VALIDATION_ERROR.createException(SCENE_EXCEPTIONS,
                        "scene exception names must be at most " + ShowEntity.SCENE_EXCEPTION_LENGTH + " characters");
            }
            if (name != null && exceptions.stream().noneMatch(name::equalsIgnoreCase)) {
                exceptions.add(name);
            }
        }
        return exceptions;
    }
}
