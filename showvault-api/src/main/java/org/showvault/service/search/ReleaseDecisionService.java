package org.showvault.service.search;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.dto.request.ReleaseCheckRequest;
import org.showvault.model.dto.response.ReleaseDecision;
import org.showvault.model.enums.Quality;
import org.showvault.service.show.ShowSettingsService;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReleaseDecisionService {

    private final ShowSettingsService showSettingsService;
    private final ReleaseFilterService releaseFilterService;
    private final QualityWantEvaluator qualityWantEvaluator;

    public ReleaseDecision evaluate(long showId, ReleaseCheckRequest request) {
        ShowSettings show = showSettingsService.loadForShow(showId);
        String releaseName = request.getReleaseName().trim();
        Quality releaseQuality = request.getReleaseQuality();

        if (show.isPaused()) {
            return ReleaseDecision.reject(releaseName, releaseQuality, "Show is paused");
        }
        if (!releaseFilterService.matchesShow(show, releaseName)) {
            return ReleaseDecision.reject(releaseName, releaseQuality, "Release name does not match the show or its scene exceptions");
        }
        Optional<String> filtered = releaseFilterService.rejectionReason(show, releaseName);
        if (filtered.isPresent()) {
            return ReleaseDecision.reject(releaseName, releaseQuality, filtered.get());
        }
        if (!qualityWantEvaluator.wantRelease(show.getQuality(), show.isSkipDownloaded(), request.getCurrentQuality(), releaseQuality)) {
            log.info("Skipping {} because we don't want an episode that's {}", releaseName, releaseQuality.getDisplayName());
            return ReleaseDecision.reject(releaseName, releaseQuality, "Quality " + releaseQuality.getDisplayName() + " is not wanted");
        }
        return ReleaseDecision.accept(releaseName, releaseQuality);
    }
}
