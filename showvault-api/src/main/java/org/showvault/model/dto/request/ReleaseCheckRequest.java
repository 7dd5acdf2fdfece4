package org.showvault.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.enums.Quality;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseCheckRequest {
    @NotBlank(message = "Release name must not be empty.")
    private String releaseName;

    @NotNull(message = "Release quality is required.")
    private Quality releaseQuality;

    /**
     * Quality already on disk for the episode, {@code NONE} when nothing is downloaded.
     */
    private Quality currentQuality;
}
