package org.showvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything the edit-show form renders: the stored settings plus visibility and lock hints.
 * Hints are advisory; none of them is enforced when the form is submitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowEditView {
    private ShowSettings settings;
    private boolean seasonFoldersLocked;
    private boolean subtitlesAvailable;
    private boolean releaseGroupListsVisible;
    private boolean dateNamingConflict;
    private List<String> supportedLanguages;
    private List<QualityOption> qualities;
    private String selectedPreset;
    private String ignoreWordsText;
    private String requireWordsText;
    private String releaseGroupWhitelistText;
    private String releaseGroupBlacklistText;
}
