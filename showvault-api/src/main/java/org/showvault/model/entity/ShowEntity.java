package org.showvault.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.showvault.convertor.WordListConverter;
import org.showvault.model.enums.EpisodeStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "tv_show")
public class ShowEntity {

    public static final int NAME_LENGTH = 255;
    public static final int LOCATION_LENGTH = 1024;
    public static final int WORD_LIST_LENGTH = 4096;
    public static final int SCENE_EXCEPTION_LENGTH = 255;

    /**
     * Indexer-assigned show ID.
     */
    @Id
    private Long id;

    @Column(name = "name", nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(name = "location", nullable = false, length = LOCATION_LENGTH)
    private String location;

    /**
     * Packed initial/upgrade quality tiers, see {@link org.showvault.model.QualitySelection}.
     */
    @Column(name = "quality", nullable = false)
    private int quality;

    @Enumerated(EnumType.STRING)
    @Column(name = "default_episode_status", nullable = false)
    private EpisodeStatus defaultEpisodeStatus;

    @Column(name = "language", nullable = false, length = 16)
    private String language;

    @Column(name = "skip_downloaded", nullable = false)
    private boolean skipDownloaded;

    @Column(name = "subtitles", nullable = false)
    private boolean subtitles;

    @Column(name = "subtitles_use_show_metadata", nullable = false)
    private boolean subtitlesUseShowMetadata;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "air_by_date", nullable = false)
    private boolean airByDate;

    @Column(name = "sports", nullable = false)
    private boolean sports;

    @Column(name = "dvd_order", nullable = false)
    private boolean dvdOrder;

    @Column(name = "anime", nullable = false)
    private boolean anime;

    @Column(name = "scene_numbering", nullable = false)
    private boolean sceneNumbering;

    @Column(name = "season_folders", nullable = false)
    private boolean seasonFolders;

    @Convert(converter = WordListConverter.class)
    @Column(name = "ignore_words", length = WORD_LIST_LENGTH)
    @Builder.Default
    private List<String> ignoreWords = new ArrayList<>();

    @Convert(converter = WordListConverter.class)
    @Column(name = "require_words", length = WORD_LIST_LENGTH)
    @Builder.Default
    private List<String> requireWords = new ArrayList<>();

    @Convert(converter = WordListConverter.class)
    @Column(name = "release_group_whitelist", length = WORD_LIST_LENGTH)
    @Builder.Default
    private List<String> releaseGroupWhitelist = new ArrayList<>();

    @Convert(converter = WordListConverter.class)
    @Column(name = "release_group_blacklist", length = WORD_LIST_LENGTH)
    @Builder.Default
    private List<String> releaseGroupBlacklist = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "show_scene_exception", joinColumns = @JoinColumn(name = "show_id"))
    @Column(name = "name", nullable = false, length = SCENE_EXCEPTION_LENGTH)
    @OrderBy
    @Builder.Default
    private Set<String> sceneExceptions = new LinkedHashSet<>();

    @Column(name = "search_delay_days", nullable = false)
    private int searchDelayDays;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
