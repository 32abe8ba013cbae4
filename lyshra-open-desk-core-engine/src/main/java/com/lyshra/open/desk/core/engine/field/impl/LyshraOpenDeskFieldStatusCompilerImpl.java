package com.lyshra.open.desk.core.engine.field.impl;

import com.lyshra.open.desk.core.engine.field.ILyshraOpenDeskFieldStatusCompiler;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentShare;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.contract.permission.ILyshraOpenDeskPermission;
import com.lyshra.open.desk.integration.contract.permission.ILyshraOpenDeskPermissionMatrix;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldStatus;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermission;

import java.util.Map;
import java.util.Optional;

/**
 * Combines the permission matrix, the per-document overlay, dependency overrides and the document's
 * lifecycle state into a single status.
 *
 * <p>Level 0 is the only level the overlay touches. Server-computed document permissions replace
 * the role grants outright, shares can only add rights. Without server permissions, rights that
 * came only from owner-only rules are withdrawn on saved documents owned by another user.</p>
 *
 * <p>Submitted documents keep {@code WRITE} only for allow-on-submit fields the role matrix lets the
 * user write; cancelled documents never keep it.</p>
 */
public class LyshraOpenDeskFieldStatusCompilerImpl implements ILyshraOpenDeskFieldStatusCompiler {

    @Override
    public LyshraOpenDeskFieldStatus compile(
            ILyshraOpenDeskFieldDefinition field,
            ILyshraOpenDeskDocument document,
            ILyshraOpenDeskPermissionMatrix matrix,
            ILyshraOpenDeskDocumentOverlay overlay,
            LyshraOpenDeskDependencyOverrides dependencyOverrides,
            String currentUserId) {

        if (field == null || matrix == null) {
            return LyshraOpenDeskFieldStatus.NONE;
        }
        LyshraOpenDeskDependencyOverrides overrides = dependencyOverrides != null
                ? dependencyOverrides
                : LyshraOpenDeskDependencyOverrides.empty();
        String fieldName = field.getFieldName();
        boolean readOnly = overrides.getDynamicallyReadOnly(fieldName).orElse(field.isReadOnly());
        int level = field.getPermissionLevel();

        LyshraOpenDeskPermission levelPermission = matrixPermission(matrix, level);
        LyshraOpenDeskPermission effective = levelPermission;
        if (level == 0 && !matrix.isAdministrator()) {
            Optional<Map<LyshraOpenDeskPermissionType, Boolean>> documentPermissions = documentPermissions(overlay);
            if (documentPermissions.isPresent()) {
                Map<LyshraOpenDeskPermissionType, Boolean> permissions = documentPermissions.get();
                effective = LyshraOpenDeskPermission.of(
                        Boolean.TRUE.equals(permissions.get(LyshraOpenDeskPermissionType.READ)),
                        Boolean.TRUE.equals(permissions.get(LyshraOpenDeskPermissionType.WRITE)));
            } else if (isOwnedByAnotherUser(document, currentUserId)) {
                effective = LyshraOpenDeskPermission.copyOf(matrix.getUnrestrictedBaseLevel());
            }
            Optional<ILyshraOpenDeskDocumentShare> share = overlay == null ? Optional.empty() : overlay.findShare(currentUserId);
            if (share.isPresent()) {
                effective = effective.merge(LyshraOpenDeskPermission.of(share.get().isRead(), share.get().isWrite()));
            }
        }
        boolean canRead = effective.isRead();
        boolean canWrite = effective.isWrite() && !readOnly;

        LyshraOpenDeskFieldStatus status;
        if (canWrite && field.isDataBearing()) {
            status = LyshraOpenDeskFieldStatus.WRITE;
        } else if (canRead) {
            status = LyshraOpenDeskFieldStatus.READ;
        } else {
            status = LyshraOpenDeskFieldStatus.NONE;
        }

        if (field.isHidden() || overrides.isHiddenByDependency(fieldName)) {
            return LyshraOpenDeskFieldStatus.NONE;
        }
        if (document == null || document.isNew()) {
            return status;
        }

        if (status == LyshraOpenDeskFieldStatus.WRITE) {
            if (document.isCancelled()) {
                status = LyshraOpenDeskFieldStatus.READ;
            } else if (document.isSubmitted() && !(field.isAllowOnSubmit() && levelPermission.isWrite())) {
                status = LyshraOpenDeskFieldStatus.READ;
            }
        }
        if (status == LyshraOpenDeskFieldStatus.WRITE && readOnly) {
            status = LyshraOpenDeskFieldStatus.READ;
        }
        return status;
    }

    private static LyshraOpenDeskPermission matrixPermission(ILyshraOpenDeskPermissionMatrix matrix, int level) {
        Optional<? extends ILyshraOpenDeskPermission> permission = matrix.getPermission(level);
        return permission.isPresent() ? LyshraOpenDeskPermission.copyOf(permission.get()) : LyshraOpenDeskPermission.NONE;
    }

    private static Optional<Map<LyshraOpenDeskPermissionType, Boolean>> documentPermissions(ILyshraOpenDeskDocumentOverlay overlay) {
        if (overlay == null) {
            return Optional.empty();
        }
        return overlay.getPermissions().filter(permissions -> !permissions.isEmpty());
    }

    private static boolean isOwnedByAnotherUser(ILyshraOpenDeskDocument document, String currentUserId) {
        if (document == null || document.isNew()) {
            return false;
        }
        Optional<String> owner = document.getOwner();
        return owner.isPresent() && !owner.get().equals(currentUserId);
    }
}
