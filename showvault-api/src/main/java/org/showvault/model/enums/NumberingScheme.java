package org.showvault.model.enums;

public enum NumberingScheme {
    INDEXER,
    SCENE;

    public static NumberingScheme of(boolean sceneNumbering) {
        return sceneNumbering ? SCENE : INDEXER;
    }
}
