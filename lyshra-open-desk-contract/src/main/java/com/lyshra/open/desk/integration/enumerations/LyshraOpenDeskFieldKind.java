package com.lyshra.open.desk.integration.enumerations;

/**
 * Whether a field carries a value or only shapes the form layout.
 */
public enum LyshraOpenDeskFieldKind {

    /**
     * Holds a value on the document.
     */
    DATA,

    /**
     * Layout only (section, column and tab breaks, headings, HTML blocks, buttons).
     * Never editable and never validated.
     */
    STRUCTURAL
}
