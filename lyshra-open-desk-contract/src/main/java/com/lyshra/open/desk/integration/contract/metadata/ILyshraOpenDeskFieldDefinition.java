package com.lyshra.open.desk.integration.contract.metadata;

import com.lyshra.open.desk.integration.constant.LyshraOpenDeskConstants;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldFormat;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldKind;

import java.util.Optional;

/**
 * One field of a document type. Immutable once loaded.
 *
 * <p>The three expression getters return either a {@link String} (a field reference or an
 * {@code eval:} expression), a {@link Boolean}, or {@code null} when the field has no such condition.
 */
public interface ILyshraOpenDeskFieldDefinition {
    String getFieldName();
    String getFieldType();
    LyshraOpenDeskFieldKind getKind();
    String getLabel();
    int getPermissionLevel();
    boolean isRequired();
    boolean isReadOnly();
    boolean isHidden();
    boolean isAllowOnSubmit();
    boolean isNoCopy();
    Object getVisibilityExpression();
    Object getRequiredExpression();
    Object getReadOnlyExpression();
    Optional<Integer> getMaxLength();

    /**
     * Raw options: the format kind for {@code Data} fields, the child document type for tables,
     * the target document type for links.
     */
    Optional<String> getOptions();

    Optional<LyshraOpenDeskFieldFormat> getFormat();

    default boolean isTable() {
        return LyshraOpenDeskConstants.TABLE_FIELD_TYPES.contains(getFieldType());
    }

    default boolean isDataBearing() {
        return getKind() == LyshraOpenDeskFieldKind.DATA;
    }

    /**
     * Label for messages, falling back to the field name.
     */
    default String getDisplayLabel() {
        String label = getLabel();
        return label == null || label.isBlank() ? getFieldName() : label;
    }
}
