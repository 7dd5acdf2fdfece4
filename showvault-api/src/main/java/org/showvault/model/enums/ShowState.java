package org.showvault.model.enums;

public enum ShowState {
    ACTIVE,
    PAUSED;

    public static ShowState of(boolean paused) {
        return paused ? PAUSED : ACTIVE;
    }
}
