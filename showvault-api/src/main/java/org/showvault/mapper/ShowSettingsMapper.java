package org.showvault.mapper;

import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import org.showvault.model.QualitySelection;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.entity.ShowEntity;
import org.showvault.model.enums.NumberingScheme;
import org.showvault.model.enums.QualityPreset;
import org.showvault.model.enums.ShowState;
import org.showvault.service.policy.GlobalShowPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE,
        imports = {QualitySelection.class, QualityPreset.class, NumberingScheme.class, ShowState.class})
public interface ShowSettingsMapper {

    @Mapping(source = "id", target = "showId")
    @Mapping(source = "subtitles", target = "subtitlesEnabled")
    @Mapping(source = "quality", target = "qualityPacked")
    @Mapping(target = "quality", expression = "java(QualitySelection.decompose(showEntity.getQuality()))")
    @Mapping(target = "qualityPreset", expression = "java(QualityPreset.fromPacked(showEntity.getQuality()).map(Enum::name).orElse(null))")
    @Mapping(target = "effectiveSubtitlesEnabled", expression = "java(policy.effectiveSubtitles(showEntity.isSubtitles()))")
    @Mapping(target = "state", expression = "java(ShowState.of(showEntity.isPaused()))")
    @Mapping(target = "numberingScheme", expression = "java(NumberingScheme.of(showEntity.isSceneNumbering()))")
    ShowSettings toShowSettings(ShowEntity showEntity, @Context GlobalShowPolicy policy);
}
