package com.lyshra.open.desk.integration.enumerations;

/**
 * Toolbar and menu sections an action is rendered in.
 */
public enum LyshraOpenDeskActionGroup {
    PRIMARY,
    VIEW,
    ACTIONS,
    WORKFLOW,
    NAVIGATION,
    DOCUMENT,
    PRINT,
    EMAIL,
    MORE
}
