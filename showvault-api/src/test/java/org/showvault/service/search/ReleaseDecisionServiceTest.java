package org.showvault.service.search;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.dto.request.ReleaseCheckRequest;
import org.showvault.model.dto.response.ReleaseDecision;
import org.showvault.model.enums.Quality;
import org.showvault.model.enums.QualityPreset;
import org.showvault.service.policy.GlobalConfigurationStore;
import org.showvault.service.show.ShowSettingsService;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReleaseDecisionServiceTest {

    @Mock
    private ShowSettingsService showSettingsService;
    @Mock
    private GlobalConfigurationStore globalConfigurationStore;

    private ReleaseDecisionService releaseDecisionService;
    private ShowSettings show;

    @BeforeEach
    void setUp() {
        releaseDecisionService = new ReleaseDecisionService(showSettingsService,
                new ReleaseFilterService(globalConfigurationStore), new QualityWantEvaluator());
        show = ShowSettings.builder()
                .showId(5L)
                .name("Show Name")
                .quality(QualityPreset.SD.getSelection())
                .ignoreWords(List.of("cam"))
                .requireWords(List.of())
                .sceneExceptions(Set.of())
                .build();
        when(showSettingsService.loadForShow(5L)).thenReturn(show);
        lenient().when(globalConfigurationStore.globalIgnoreWords()).thenReturn(List.of());
        lenient().when(globalConfigurationStore.globalRequireWords()).thenReturn(List.of());
    }

    private ReleaseDecision check(String name, Quality quality) {
        return releaseDecisionService.evaluate(5L, ReleaseCheckRequest.builder()
                .releaseName(name)
                .releaseQuality(quality)
                .currentQuality(Quality.NONE)
                .build());
    }

    @Test
    void wantedRelease_isAccepted() {
        assertThat(check("Show.Name.S01E01.HDTV-GRP", Quality.SDTV).isAccepted()).isTrue();
    }

    @Test
    void pausedShow_rejectsEverything() {
        show.setPaused(true);
        ReleaseDecision decision = check("Show.Name.S01E01.HDTV-GRP", Quality.SDTV);
        assertThat(decision.isAccepted()).isFalse();
        assertThat(decision.getReason()).contains("paused");
    }

    @Test
    void otherShow_isRejected() {
        assertThat(check("Other.Show.S01E01-GRP", Quality.SDTV).isAccepted()).isFalse();
    }

    @Test
    void ignoredWord_isRejected() {
        ReleaseDecision decision = check("Show.Name.S01E01.CAM-GRP", Quality.SDTV);
        assertThat(decision.isAccepted()).isFalse();
        assertThat(decision.getReason()).contains("cam");
    }

    @Test
    void unwantedQuality_isRejected() {
        ReleaseDecision decision = check("Show.Name.S01E01.1080p.BluRay-GRP", Quality.FULLHDBLURAY);
        assertThat(decision.isAccepted()).isFalse();
        assertThat(decision.getReason()).contains(Quality.FULLHDBLURAY.getDisplayName());
    }
}
