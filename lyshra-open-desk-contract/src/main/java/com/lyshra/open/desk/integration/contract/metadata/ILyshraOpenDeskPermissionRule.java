package com.lyshra.open.desk.integration.contract.metadata;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;

/**
 * A role permission row of a document type.
 */
public interface ILyshraOpenDeskPermissionRule {
    String getRole();
    int getPermissionLevel();
    boolean isRead();
    boolean isWrite();
    boolean isCreate();
    boolean isDelete();
    boolean isSubmit();
    boolean isCancel();
    boolean isAmend();
    boolean isPrint();
    boolean isEmail();
    boolean isExport();
    boolean isImport();
    boolean isShare();

    /**
     * Rights of this row apply only to documents owned by the user.
     */
    boolean isOwnerOnly();

    default boolean grants(LyshraOpenDeskPermissionType type) {
        return switch (type) {
            case READ -> isRead();
            case WRITE -> isWrite();
            case CREATE -> isCreate();
            case DELETE -> isDelete();
            case SUBMIT -> isSubmit();
            case CANCEL -> isCancel();
            case AMEND -> isAmend();
            case PRINT -> isPrint();
            case EMAIL -> isEmail();
            case EXPORT -> isExport();
            case IMPORT -> isImport();
            case SHARE -> isShare();
        };
    }
}
