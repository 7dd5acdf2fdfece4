package org.showvault.service.search;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.showvault.model.dto.ShowSettings;
import org.showvault.service.policy.GlobalConfigurationStore;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class ReleaseFilterServiceTest {

    @Mock
    private GlobalConfigurationStore globalConfigurationStore;

    @InjectMocks
    private ReleaseFilterService releaseFilterService;

    private ShowSettings show;

    @BeforeEach
    void setUp() {
        show = ShowSettings.builder()
                .showId(1L)
                .name("Show Name")
                .ignoreWords(List.of())
                .requireWords(List.of())
                .releaseGroupWhitelist(List.of())
                .releaseGroupBlacklist(List.of())
                .sceneExceptions(Set.of())
                .build();
        lenient().when(globalConfigurationStore.globalIgnoreWords()).thenReturn(List.of("german"));
        lenient().when(globalConfigurationStore.globalRequireWords()).thenReturn(List.of());
    }

    @Test
    void emptyLists_acceptEverything() {
        assertThat(releaseFilterService.isAcceptable(show, "Show.Name.S01E01.720p.HDTV-GRP")).isTrue();
    }

    @Test
    void showIgnoreWords_reject() {
        show.setIgnoreWords(List.of("cam"));
        assertThat(releaseFilterService.rejectionReason(show, "Show.Name.S01E01.CAM-GRP")).hasValueSatisfying(
                reason -> assertThat(reason).contains("cam"));
    }

    @Test
    void globalIgnoreWords_reject() {
        assertThat(releaseFilterService.isAcceptable(show, "Show.Name.S01E01.GERMAN.720p-GRP")).isFalse();
    }

    @Test
    void requireWords_needAtLeastOne() {
        show.setRequireWords(List.of("x265", "hevc"));
        assertThat(releaseFilterService.isAcceptable(show, "Show.Name.S01E01.1080p.HEVC-GRP")).isTrue();
        assertThat(releaseFilterService.isAcceptable(show, "Show.Name.S01E01.1080p.x264-GRP")).isFalse();
    }

    @Test
    void globalRequireWords_apply() {
        lenient().when(globalConfigurationStore.globalRequireWords()).thenReturn(List.of("proper"));
        assertThat(releaseFilterService.isAcceptable(show, "Show.Name.S01E01.720p-GRP")).isFalse();
        assertThat(releaseFilterService.isAcceptable(show, "Show.Name.S01E01.PROPER.720p-GRP")).isTrue();
    }

    @Test
    void releaseGroupLists_onlyApplyToAnime() {
        show.setReleaseGroupBlacklist(List.of("BadSubs"));
        assertThat(releaseFilterService.isAcceptable(show, "[BadSubs] Show Name - 01")).isTrue();

        show.setAnime(true);
        assertThat(releaseFilterService.isAcceptable(show, "[BadSubs] Show Name - 01")).isFalse();
        assertThat(releaseFilterService.isAcceptable(show, "[GoodSubs] Show Name - 01")).isTrue();
    }

    @Test
    void whitelist_rejectsOtherOrMissingGroups() {
        show.setAnime(true);
        show.setReleaseGroupWhitelist(List.of("GoodSubs"));

        assertThat(releaseFilterService.isAcceptable(show, "[goodsubs] Show Name - 01")).isTrue();
        assertThat(releaseFilterService.isAcceptable(show, "[OtherSubs] Show Name - 01")).isFalse();
        assertThat(releaseFilterService.isAcceptable(show, "Show Name 01")).isFalse();
    }

    @Test
    void matchesShow_usesSceneExceptionsWhenDefined() {
        assertThat(releaseFilterService.matchesShow(show, "Show.Name.S01E01")).isTrue();

        show.setSceneExceptions(Set.of("Alias Name"));
        assertThat(releaseFilterService.matchesShow(show, "Alias.Name.S01E01")).isTrue();
        assertThat(releaseFilterService.matchesShow(show, "Show.Name.S01E01")).isFalse();
    }
}
