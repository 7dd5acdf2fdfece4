package org.showvault.model.enums;

/**
 * Declared from most to least urgent.
 */
public enum SearchPriority {
    EXTREME,
    HIGH,
    NORMAL,
    LOW
}
