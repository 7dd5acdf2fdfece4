package org.showvault.util;

import org.junit.jupiter.api.Test;
import org.showvault.model.entity.ShowEntity;
import org.showvault.model.enums.EpisodeStatus;
import org.showvault.model.enums.ShowSettingField;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShowSettingsChangeDetectorTest {

    private ShowEntity show() {
        return ShowEntity.builder()
                .id(1L)
                .name("Show")
                .location("/tv/show")
                .quality(3)
                .defaultEpisodeStatus(EpisodeStatus.SKIPPED)
                .language("en")
                .ignoreWords(new ArrayList<>(List.of("german")))
                .build();
    }

    @Test
    void changedFields_noMutation_isEmpty() {
        ShowEntity show = show();
        Map<ShowSettingField, Object> before = ShowSettingsChangeDetector.snapshot(show);
        assertThat(ShowSettingsChangeDetector.changedFields(before, show)).isEmpty();
    }

    @Test
    void changedFields_reportsOnlyTouchedFields() {
        ShowEntity show = show();
        Map<ShowSettingField, Object> before = ShowSettingsChangeDetector.snapshot(show);

        show.setPaused(true);
        show.getIgnoreWords().add("french");
        show.getSceneExceptions().add("Alias");

        assertThat(ShowSettingsChangeDetector.changedFields(before, show))
                .containsExactlyInAnyOrder(ShowSettingField.PAUSED, ShowSettingField.IGNORE_WORDS, ShowSettingField.SCENE_EXCEPTIONS);
    }

    @Test
    void changedFields_sameValueWritten_isNotAChange() {
        ShowEntity show = show();
        Map<ShowSettingField, Object> before = ShowSettingsChangeDetector.snapshot(show);

        show.setLocation("/tv/show");
        show.setIgnoreWords(new ArrayList<>(List.of("german")));

        assertThat(ShowSettingsChangeDetector.changedFields(before, show)).isEmpty();
    }
}
