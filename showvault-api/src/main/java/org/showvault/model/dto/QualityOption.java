package org.showvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.showvault.model.enums.Quality;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityOption {
    private Quality quality;
    private int value;
    private String displayName;
    private boolean initialSelected;
    private boolean upgradeSelected;
}
