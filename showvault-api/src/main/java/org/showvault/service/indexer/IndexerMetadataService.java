package org.showvault.service.indexer;

import java.util.Set;

public interface IndexerMetadataService {

    Set<String> supportedLanguages();

    default boolean isSupportedLanguage(String language) {
        if (language == null) {
            return false;
        }
        String candidate = language.trim();
        return supportedLanguages().stream().anyMatch(candidate::equalsIgnoreCase);
    }
}
