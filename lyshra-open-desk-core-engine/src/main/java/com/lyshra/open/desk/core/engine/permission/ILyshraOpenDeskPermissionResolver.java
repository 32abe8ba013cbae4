package com.lyshra.open.desk.core.engine.permission;

import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionMatrix;

import java.util.Collection;

public interface ILyshraOpenDeskPermissionResolver {

    /**
     * Computes the per-level read/write matrix of a user for a document type.
     */
    LyshraOpenDeskPermissionMatrix resolve(ILyshraOpenDeskDocTypeMetadata metadata, Collection<String> userRoles, String currentUserId);

    /**
     * Whether any level-0 rule of the user's roles grants a document type capability such as {@code create}.
     */
    boolean hasDocTypePermission(
            ILyshraOpenDeskDocTypeMetadata metadata,
            Collection<String> userRoles,
            String currentUserId,
            LyshraOpenDeskPermissionType permissionType);

    boolean isAdministrator(Collection<String> userRoles, String currentUserId);
}
