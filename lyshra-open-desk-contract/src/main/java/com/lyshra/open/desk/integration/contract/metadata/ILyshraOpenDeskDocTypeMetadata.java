package com.lyshra.open.desk.integration.contract.metadata;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskMetadataFlag;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema of one document type: ordered fields, permission rules and capability flags.
 */
public interface ILyshraOpenDeskDocTypeMetadata {
    String getName();
    List<ILyshraOpenDeskFieldDefinition> getFields();
    List<ILyshraOpenDeskPermissionRule> getPermissionRules();
    boolean isSubmittable();
    boolean isRenameAllowed();
    boolean isTable();
    boolean isSingle();
    Optional<String> getAutoname();

    /**
     * Document types linking to this one, with the linking field names.
     */
    Map<String, List<String>> getLinkedWith();

    default Optional<ILyshraOpenDeskFieldDefinition> getField(String fieldName) {
        return getFields().stream()
                .filter(field -> field.getFieldName().equals(fieldName))
                .findFirst();
    }

    default boolean hasFlag(LyshraOpenDeskMetadataFlag flag) {
        return switch (flag) {
            case SUBMITTABLE -> isSubmittable();
            case RENAME_ALLOWED -> isRenameAllowed();
            case IS_TABLE -> isTable();
            case IS_SINGLE -> isSingle();
        };
    }
}
