package com.lyshra.open.desk.integration.enumerations;

/**
 * Document type capability flags an action can require.
 */
public enum LyshraOpenDeskMetadataFlag {
    SUBMITTABLE,
    RENAME_ALLOWED,
    IS_TABLE,
    IS_SINGLE
}
