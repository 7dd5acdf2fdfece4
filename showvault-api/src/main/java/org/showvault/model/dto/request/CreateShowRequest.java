package org.showvault.model.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.entity.ShowEntity;
import org.showvault.model.enums.EpisodeStatus;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateShowRequest {
    @NotNull(message = "Show ID is required.")
    @Positive(message = "Show ID must be positive.")
    private Long showId;

    @NotBlank(message = "Show name must not be empty.")
    @Size(max = ShowEntity.NAME_LENGTH, message = "Show name is too long.")
    private String name;

    @NotBlank(message = "Show location must not be empty.")
    @Size(max = ShowEntity.LOCATION_LENGTH, message = "Show location is too long.")
    private String location;

    // Optional overrides of the global defaults
    private String language;
    private String qualityPreset;
    private EpisodeStatus defaultEpisodeStatus;
    private Boolean anime;
    private Boolean seasonFolders;
    private Boolean subtitles;

    @Min(value = 0, message = "Search delay must not be negative.")
    private Integer searchDelayDays;
}
