package com.lyshra.open.desk.integration.contract.permission;

import java.util.Optional;
import java.util.SortedMap;

/**
 * Read/write grants per permission level for one user and one document type.
 * Level 0 is always present.
 */
public interface ILyshraOpenDeskPermissionMatrix {

    SortedMap<Integer, ? extends ILyshraOpenDeskPermission> getLevels();

    Optional<? extends ILyshraOpenDeskPermission> getPermission(int level);

    /**
     * Level-0 rights granted by at least one rule without the owner-only restriction.
     */
    ILyshraOpenDeskPermission getUnrestrictedBaseLevel();

    /**
     * Whether the matrix came from the administrator bypass.
     */
    boolean isAdministrator();
}
