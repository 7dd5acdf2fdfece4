package org.showvault.service.search;

import org.showvault.model.QualitySelection;
import org.showvault.model.enums.Quality;
import org.springframework.stereotype.Component;

@Component
public class QualityWantEvaluator {

    /**
     * Nothing on disk: any tier from either group is acceptable. Already downloaded: only a
     * strictly better upgrade tier, and never when the show skips downloaded episodes.
     */
    public boolean wantRelease(QualitySelection selection, boolean skipDownloaded, Quality currentQuality, Quality releaseQuality) {
        if (selection == null || releaseQuality == null || releaseQuality == Quality.NONE) {
            return false;
        }
        Quality current = currentQuality != null ? currentQuality : Quality.NONE;
        if (current == Quality.NONE) {
            return selection.getInitial().contains(releaseQuality) || selection.getUpgrade().contains(releaseQuality);
        }
        if (skipDownloaded) {
            return false;
        }
        return selection.getUpgrade().contains(releaseQuality) && releaseQuality.isBetterThan(current);
    }
}
