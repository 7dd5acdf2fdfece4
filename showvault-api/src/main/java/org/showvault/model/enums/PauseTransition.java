package org.showvault.model.enums;

public enum PauseTransition {
    NONE,
    PAUSED,
    RESUMED;

    public static PauseTransition between(boolean wasPaused, boolean isPaused) {
        if (wasPaused == isPaused) {
            return NONE;
        }
        return isPaused ? PAUSED : RESUMED;
    }
}
