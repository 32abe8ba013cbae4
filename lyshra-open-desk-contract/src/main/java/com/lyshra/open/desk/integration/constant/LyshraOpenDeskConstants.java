package com.lyshra.open.desk.integration.constant;

import java.util.Set;

public interface LyshraOpenDeskConstants {

    // Reserved document keys
    String NAME = "name";
    String DOCTYPE = "doctype";
    String OWNER = "owner";
    String DOCSTATUS = "docstatus";
    String NEW_NAME = "__newname";
    String AMENDED_FROM = "amended_from";
    String IS_LOCAL = "__islocal";
    String IS_NEW = "__isNew";
    String IS_UNSAVED = "__unsaved";

    /**
     * Keys removed from a document before it is copied into a new one.
     */
    Set<String> SYSTEM_FIELDS = Set.of(
            NAME, OWNER, "creation", "modified", "modified_by", DOCSTATUS, "idx", AMENDED_FROM,
            IS_LOCAL, IS_UNSAVED, "__onload", "__run_link_triggers");

    /**
     * Keys removed from child rows in addition to {@link #SYSTEM_FIELDS}.
     */
    Set<String> CHILD_ROW_FIELDS = Set.of("parent", "parenttype", "parentfield", DOCTYPE);

    // Field types
    String FIELD_TYPE_DATA = "Data";
    String FIELD_TYPE_LINK = "Link";
    String FIELD_TYPE_TABLE = "Table";
    String FIELD_TYPE_TABLE_MULTI_SELECT = "Table MultiSelect";

    Set<String> TABLE_FIELD_TYPES = Set.of(FIELD_TYPE_TABLE, FIELD_TYPE_TABLE_MULTI_SELECT);

    Set<String> STRUCTURAL_FIELD_TYPES = Set.of(
            "Section Break", "Column Break", "Tab Break", "HTML", "Heading", "Button", "Fold", "Image");

    /**
     * Structural types that are also left out of the jump-to-field list.
     */
    Set<String> LAYOUT_BREAK_FIELD_TYPES = Set.of("Section Break", "Column Break", "Tab Break", "HTML");

    String AUTONAME_PROMPT = "Prompt";

    String DEFAULT_ADMINISTRATOR = "Administrator";
}
