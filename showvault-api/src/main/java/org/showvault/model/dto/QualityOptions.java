package org.showvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityOptions {
    private List<QualityOption> tiers;
    private List<QualityPresetOption> presets;
}
