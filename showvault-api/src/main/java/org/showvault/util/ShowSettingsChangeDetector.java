package org.showvault.util;

import lombok.experimental.UtilityClass;
import org.showvault.model.entity.ShowEntity;
import org.showvault.model.enums.ShowSettingField;

import java.util.*;
import java.util.function.Function;

@UtilityClass
public class ShowSettingsChangeDetector {

    private record FieldDescriptor(ShowSettingField field, Function<ShowEntity, Object> valueGetter) {

        Object capture(ShowEntity entity) {
            Object value = valueGetter.apply(entity);
            if (value instanceof Set<?> set) {
                return new HashSet<>(set);
            }
            if (value instanceof List<?> list) {
                return new ArrayList<>(list);
            }
            return value;
        }
    }

    private static final List<FieldDescriptor> FIELDS = List.of(
            new FieldDescriptor(ShowSettingField.LOCATION, ShowEntity::getLocation),
            new FieldDescriptor(ShowSettingField.QUALITY, ShowEntity::getQuality),
            new FieldDescriptor(ShowSettingField.DEFAULT_EPISODE_STATUS, ShowEntity::getDefaultEpisodeStatus),
            new FieldDescriptor(ShowSettingField.LANGUAGE, ShowEntity::getLanguage),
            new FieldDescriptor(ShowSettingField.SKIP_DOWNLOADED, ShowEntity::isSkipDownloaded),
            new FieldDescriptor(ShowSettingField.SUBTITLES, ShowEntity::isSubtitles),
            new FieldDescriptor(ShowSettingField.SUBTITLES_USE_SHOW_METADATA, ShowEntity::isSubtitlesUseShowMetadata),
            new FieldDescriptor(ShowSettingField.PAUSED, ShowEntity::isPaused),
            new FieldDescriptor(ShowSettingField.AIR_BY_DATE, ShowEntity::isAirByDate),
            new FieldDescriptor(ShowSettingField.SPORTS, ShowEntity::isSports),
            new FieldDescriptor(ShowSettingField.DVD_ORDER, ShowEntity::isDvdOrder),
            new FieldDescriptor(ShowSettingField.ANIME, ShowEntity::isAnime),
            new FieldDescriptor(ShowSettingField.SCENE_NUMBERING, ShowEntity::isSceneNumbering),
            new FieldDescriptor(ShowSettingField.SEASON_FOLDERS, ShowEntity::isSeasonFolders),
            new FieldDescriptor(ShowSettingField.IGNORE_WORDS, ShowEntity::getIgnoreWords),
            new FieldDescriptor(ShowSettingField.REQUIRE_WORDS, ShowEntity::getRequireWords),
            new FieldDescriptor(ShowSettingField.RELEASE_GROUP_WHITELIST, ShowEntity::getReleaseGroupWhitelist),
            new FieldDescriptor(ShowSettingField.RELEASE_GROUP_BLACKLIST, ShowEntity::getReleaseGroupBlacklist),
            new FieldDescriptor(ShowSettingField.SCENE_EXCEPTIONS, ShowEntity::getSceneExceptions),
            new FieldDescriptor(ShowSettingField.SEARCH_DELAY, ShowEntity::getSearchDelayDays)
    );

    public Map<ShowSettingField, Object> snapshot(ShowEntity entity) {
        Map<ShowSettingField, Object> values = new EnumMap<>(ShowSettingField.class);
        for (FieldDescriptor descriptor : FIELDS) {
            values.put(descriptor.field(), descriptor.capture(entity));
        }
        return values;
    }

    public Set<ShowSettingField> changedFields(Map<ShowSettingField, Object> before, ShowEntity after) {
        Set<ShowSettingField> changed = EnumSet.noneOf(ShowSettingField.class);
        for (FieldDescriptor descriptor : FIELDS) {
            if (!Objects.equals(before.get(descriptor.field()), descriptor.capture(after))) {
                changed.add(descriptor.field());
            }
        }
        return changed;
    }
}
