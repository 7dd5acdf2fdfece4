package org.showvault.model.enums;

public enum ShowSettingField {
    LOCATION,
    QUALITY,
    DEFAULT_EPISODE_STATUS,
    LANGUAGE,
    SKIP_DOWNLOADED,
    SUBTITLES,
    SUBTITLES_USE_SHOW_METADATA,
    PAUSED,
    AIR_BY_DATE,
    SPORTS,
    DVD_ORDER,
    ANIME,
    SCENE_NUMBERING,
    SEASON_FOLDERS,
    IGNORE_WORDS,
    REQUIRE_WORDS,
    RELEASE_GROUP_WHITELIST,
    RELEASE_GROUP_BLACKLIST,
    SCENE_EXCEPTIONS,
    SEARCH_DELAY
}
