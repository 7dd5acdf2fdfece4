package org.showvault.service.indexer;

import lombok.RequiredArgsConstructor;
import org.showvault.config.AppProperties;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Serves the indexer's language list from configuration.
 */
@Service
@RequiredArgsConstructor
public class ConfiguredIndexerMetadataService implements IndexerMetadataService {

    private final AppProperties appProperties;

    @Override
    public Set<String> supportedLanguages() {
        Set<String> languages = new LinkedHashSet<>();
        for (String language : appProperties.getIndexer().getLanguages()) {
            if (language != null && !language.isBlank()) {
                languages.add(language.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(languages);
    }
}
