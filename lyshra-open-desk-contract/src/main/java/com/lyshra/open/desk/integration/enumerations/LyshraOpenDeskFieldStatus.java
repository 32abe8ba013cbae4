package com.lyshra.open.desk.integration.enumerations;

/**
 * Compiled display status of a single field.
 */
public enum LyshraOpenDeskFieldStatus {
    WRITE,
    READ,
    NONE;

    public boolean isEditable() {
        return this == WRITE;
    }

    public boolean isVisible() {
        return this != NONE;
    }
}
