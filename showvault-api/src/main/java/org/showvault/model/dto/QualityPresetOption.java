package org.showvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.enums.Quality;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityPresetOption {
    private String name;
    private String displayName;
    private int packed;
    private Set<Quality> qualities;
}
