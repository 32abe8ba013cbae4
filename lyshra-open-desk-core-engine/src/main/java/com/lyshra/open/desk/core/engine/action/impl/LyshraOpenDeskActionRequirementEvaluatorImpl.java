package com.lyshra.open.desk.core.engine.action.impl;

import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionRequirementEvaluator;
import com.lyshra.open.desk.core.engine.permission.ILyshraOpenDeskPermissionResolver;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskDiagnostics;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionRequirement;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentShare;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskMetadataFlag;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Fail-closed requirement checks. Document permissions come from the server overlay only;
 * the share row of the current user can upgrade read, write, submit and share.
 */
@Slf4j
@RequiredArgsConstructor
public class LyshraOpenDeskActionRequirementEvaluatorImpl implements ILyshraOpenDeskActionRequirementEvaluator {

    private final ILyshraOpenDeskPermissionResolver permissionResolver;
    private final ILyshraOpenDeskDiagnostics diagnostics;

    @Override
    public boolean isAvailable(ILyshraOpenDeskAction action, ILyshraOpenDeskActionContext context) {
        try {
            for (ILyshraOpenDeskActionRequirement requirement : action.getRequirements()) {
                if (!isSatisfied(requirement, context)) {
                    log.trace("Action [{}] hidden by requirement [{}]", action.getId(), requirement);
                    return false;
                }
            }
            return true;
        } catch (RuntimeException e) {
            diagnostics.reportRequirementFailure(action.getId(), e);
            return false;
        }
    }

    @Override
    public boolean isSatisfied(ILyshraOpenDeskActionRequirement requirement, ILyshraOpenDeskActionContext context) {
        Optional<LyshraOpenDeskPermissionType> permission = requirement.getPermission();
        if (permission.isPresent() && !hasPermission(permission.get(), context)) {
            return false;
        }
        Optional<LyshraOpenDeskMetadataFlag> flag = requirement.getMetadataFlag();
        if (flag.isPresent() && (context.getMetadata() == null || !context.getMetadata().hasFlag(flag.get()))) {
            return false;
        }
        if (!requirement.getAllowedDocStatuses().isEmpty()
                && !requirement.getAllowedDocStatuses().contains(context.getDocStatus())) {
            return false;
        }
        if (requirement.isNotNew() && context.isNewDocument()) {
            return false;
        }
        Optional<Predicate<ILyshraOpenDeskActionContext>> predicate = requirement.getCustomPredicate();
        return predicate.isEmpty() || predicate.get().test(context);
    }

    private boolean hasPermission(LyshraOpenDeskPermissionType type, ILyshraOpenDeskActionContext context) {
        if (permissionResolver.isAdministrator(context.getCurrentUserRoles(), context.getCurrentUserId())) {
            return true;
        }
        if (type == LyshraOpenDeskPermissionType.CREATE) {
            return permissionResolver.hasDocTypePermission(
                    context.getMetadata(), context.getCurrentUserRoles(), context.getCurrentUserId(), type);
        }
        Optional<ILyshraOpenDeskDocumentOverlay> overlay = context.getOverlay();
        Optional<Map<LyshraOpenDeskPermissionType, Boolean>> permissions = overlay
                .flatMap(ILyshraOpenDeskDocumentOverlay::getPermissions);
        if (permissions.isEmpty()) {
            return false;
        }
        if (Boolean.TRUE.equals(permissions.get().get(type))) {
            return true;
        }
        return overlay.get()
                .findShare(context.getCurrentUserId())
                .map(share -> shareGrants(share, type))
                .orElse(false);
    }

    private static boolean shareGrants(ILyshraOpenDeskDocumentShare share, LyshraOpenDeskPermissionType type) {
        return switch (type) {
            case READ -> share.isRead();
            case WRITE -> share.isWrite();
            case SUBMIT -> share.isSubmit();
            case SHARE -> share.isShare();
            default -> false;
        };
    }
}
