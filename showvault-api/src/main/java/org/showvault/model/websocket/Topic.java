package org.showvault.model.websocket;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Topic {
    SHOW_SETTINGS_CHANGED("/topic/shows/settings"),
    SHOW_REMOVED("/topic/shows/removed");

    private final String path;
}
