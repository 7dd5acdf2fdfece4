package org.showvault.service.search;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.showvault.model.dto.ShowSettings;
import org.showvault.service.policy.GlobalConfigurationStore;
import org.showvault.util.ReleaseNameUtils;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Applies a show's word lists, the global word lists and the anime release-group lists to a
 * release name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReleaseFilterService {

    private final GlobalConfigurationStore globalConfigurationStore;

    public boolean isAcceptable(ShowSettings show, String releaseName) {
        return rejectionReason(show, releaseName).isEmpty();
    }

    public Optional<String> rejectionReason(ShowSettings show, String releaseName) {
        Optional<String> ignored = ReleaseNameUtils.findAnyWord(releaseName, show.getIgnoreWords())
                .or(() -> ReleaseNameUtils.findAnyWord(releaseName, globalConfigurationStore.globalIgnoreWords()));
        if (ignored.isPresent()) {
            return Optional.of("Contains ignored word '" + ignored.get() + "'");
        }
        if (missesRequired(releaseName, show.getRequireWords())) {
            return Optional.of("Contains none of the show's required words " + show.getRequireWords());
        }
        List<String> globalRequired = globalConfigurationStore.globalRequireWords();
        if (missesRequired(releaseName, globalRequired)) {
            return Optional.of("Contains none of the global required words " + globalRequired);
        }
        if (show.isAnime()) {
            return releaseGroupRejection(show, releaseName);
        }
        return Optional.empty();
    }

    /**
     * Scene exceptions replace the canonical name for matching when any are defined.
     */
    public boolean matchesShow(ShowSettings show, String releaseName) {
        Collection<String> names = show.getSceneExceptions() != null && !show.getSceneExceptions().isEmpty()
                ? show.getSceneExceptions()
                : List.of(show.getName());
        return names.stream().anyMatch(name -> ReleaseNameUtils.startsWithShowName(releaseName, name));
    }

    private boolean missesRequired(String releaseName, List<String> required) {
        return required != null && !required.isEmpty()
                && ReleaseNameUtils.findAnyWord(releaseName, required).isEmpty();
    }

    private Optional<String> releaseGroupRejection(ShowSettings show, String releaseName) {
        Optional<String> group = ReleaseNameUtils.releaseGroup(releaseName);
        List<String> blacklist = show.getReleaseGroupBlacklist();
        if (group.isPresent() && blacklist != null && blacklist.stream().anyMatch(group.get()::equalsIgnoreCase)) {
            return Optional.of("Release group '" + group.get() + "' is blacklisted");
        }
        List<String> whitelist = show.getReleaseGroupWhitelist();
        if (whitelist != null && !whitelist.isEmpty()
                && group.map(g -> whitelist.stream().noneMatch(g::equalsIgnoreCase)).orElse(true)) {
            log.debug("Release {} rejected, group {} not whitelisted", releaseName, group.orElse("<none>"));
            return Optional.of("Release group '" + group.orElse("unknown") + "' is not whitelisted");
        }
        return Optional.empty();
    }
}
