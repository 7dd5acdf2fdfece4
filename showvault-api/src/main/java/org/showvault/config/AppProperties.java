package org.showvault.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {
    private String version;
    private Shows shows = new Shows();
    private Search search = new Search();
    private Indexer indexer = new Indexer();
    private Database database = new Database();

    @Getter
    @Setter
    public static class Shows {
        /**
         * When true every show stores its episodes in season folders and the per-show
         * toggle becomes read-only.
         */
        private boolean forceSeasonFolders = false;
        private boolean useSubtitles = false;

        // Defaults copied onto a show when it is first added.
        private String defaultQuality = "SD";
        private String defaultEpisodeStatus = "SKIPPED";
        private String defaultLanguage = "en";
        private boolean defaultSeasonFolders = true;
        private boolean defaultSubtitles = false;
        private boolean defaultAnime = false;
        private boolean defaultSceneNumbering = false;
        private int defaultSearchDelayDays = 0;

        private Duration updateLockTimeout = Duration.ofSeconds(5);
        private Duration locationCheckTimeout = Duration.ofSeconds(5);
        private int persistenceTimeoutSeconds = 5;
    }

    @Getter
    @Setter
    public static class Search {
        private List<String> ignoreWords = new ArrayList<>(List.of("german", "french", "core2hd", "dutch", "swedish", "reenc", "MrLss"));
        private List<String> requireWords = new ArrayList<>();
        private int queueCapacity = 500;
    }

    @Getter
    @Setter
    public static class Indexer {
        private List<String> languages = new ArrayList<>(List.of(
                "en", "fr", "de", "es", "it", "nl", "pt", "sv", "da", "fi", "no", "pl", "ru", "ja", "zh", "ko"));
    }

    @Getter
    @Setter
    public static class Database {
        private boolean repairOnValidationFailure = true;
    }
}
