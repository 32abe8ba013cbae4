package com.lyshra.open.desk.integration.contract.action;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskMetadataFlag;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;

import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Gate deciding whether an action is offered. Every check that is set must hold.
 */
public interface ILyshraOpenDeskActionRequirement {
    Optional<LyshraOpenDeskPermissionType> getPermission();
    Optional<LyshraOpenDeskMetadataFlag> getMetadataFlag();

    /**
     * Allowed docstatus values; empty means any.
     */
    Set<Integer> getAllowedDocStatuses();

    boolean isNotNew();

    Optional<Predicate<ILyshraOpenDeskActionContext>> getCustomPredicate();
}
