package org.showvault.model.dto.request;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sparse view of a submitted edit-show form. An unchecked checkbox is simply absent, so boolean
 * fields are read with {@link #present(String)} and never default to true.
 */
public final class ShowEditForm {

    public static final String SHOW = "show";
    public static final String LOCATION = "location";
    public static final String DEFAULT_EPISODE_STATUS = "defaultEpStatus";
    public static final String INDEXER_LANGUAGE = "indexerLang";
    public static final String SKIP_DOWNLOADED = "skip_downloaded";
    public static final String SUBTITLES = "subtitles";
    public static final String SUBTITLES_USE_SHOW_METADATA = "subtitles_sr_metadata";
    public static final String PAUSED = "paused";
    public static final String AIR_BY_DATE = "air_by_date";
    public static final String SPORTS = "sports";
    public static final String DVD_ORDER = "dvdorder";
    public static final String ANIME = "anime";
    public static final String SEASON_FOLDERS = "flatten_folders";
    public static final String SCENE_NUMBERING = "scene";
    public static final String IGNORE_WORDS = "rls_ignore_words";
    public static final String REQUIRE_WORDS = "rls_require_words";
    public static final String SEARCH_DELAY = "search_delay";
    public static final String SCENE_EXCEPTIONS = "exceptions_list";
    public static final String INITIAL_QUALITIES = "anyQualities";
    public static final String UPGRADE_QUALITIES = "bestQualities";
    public static final String QUALITY_PRESET = "quality_preset";
    public static final String RELEASE_GROUP_WHITELIST = "whitelist";
    public static final String RELEASE_GROUP_BLACKLIST = "blacklist";

    private final MultiValueMap<String, String> fields;

    private ShowEditForm(MultiValueMap<String, String> fields) {
        this.fields = fields;
    }

    public static ShowEditForm of(MultiValueMap<String, String> fields) {
        return new ShowEditForm(fields == null ? new LinkedMultiValueMap<>() : new LinkedMultiValueMap<>(fields));
    }

    public static ShowEditForm of(Map<String, String> singleValued) {
        LinkedMultiValueMap<String, String> map = new LinkedMultiValueMap<>();
        if (singleValued != null) {
            singleValued.forEach(map::add);
        }
        return new ShowEditForm(map);
    }

    public boolean present(String field) {
        return fields.containsKey(field);
    }

    public Optional<String> value(String field) {
        return Optional.ofNullable(fields.getFirst(field));
    }

    public List<String> values(String field) {
        List<String> submitted = fields.get(field);
        return submitted == null ? Collections.emptyList() : Collections.unmodifiableList(submitted);
    }

    @Override
    public String toString() {
        return "ShowEditForm" + fields.keySet();
    }
}
