package com.lyshra.open.desk.integration.models.field;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldStatus;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionMatrix;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Compiled access state of a whole form for one user and one document snapshot.
 */
@Data
@Builder
public class LyshraOpenDeskFormState {
    private final LyshraOpenDeskPermissionMatrix permissionMatrix;
    private final LyshraOpenDeskDependencyOverrides dependencyOverrides;
    /**
     * Field name to status, in field declaration order.
     */
    private final Map<String, LyshraOpenDeskFieldStatus> fieldStatuses;

    /**
     * {@code NONE} for fields the form does not know.
     */
    public LyshraOpenDeskFieldStatus getFieldStatus(String fieldName) {
        return fieldStatuses.getOrDefault(fieldName, LyshraOpenDeskFieldStatus.NONE);
    }

    public boolean canEdit(String fieldName) {
        return getFieldStatus(fieldName).isEditable();
    }

    public boolean canRead(String fieldName) {
        return getFieldStatus(fieldName).isVisible();
    }

    public boolean isHidden(String fieldName) {
        return !canRead(fieldName);
    }
}
