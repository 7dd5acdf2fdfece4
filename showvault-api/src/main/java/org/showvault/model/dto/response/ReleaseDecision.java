package org.showvault.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.enums.Quality;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseDecision {
    private String releaseName;
    private Quality releaseQuality;
    private boolean accepted;
    private String reason;

    public static ReleaseDecision accept(String releaseName, Quality quality) {
        return new ReleaseDecision(releaseName, quality, true, "Release accepted");
    }

    public static ReleaseDecision reject(String releaseName, Quality quality, String reason) {
        return new ReleaseDecision(releaseName, quality, false, reason);
    }
}
