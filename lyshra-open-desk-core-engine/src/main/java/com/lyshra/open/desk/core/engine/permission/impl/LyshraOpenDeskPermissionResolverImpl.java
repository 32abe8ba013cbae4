package com.lyshra.open.desk.core.engine.permission.impl;

import com.lyshra.open.desk.core.engine.permission.ILyshraOpenDeskPermissionResolver;
import com.lyshra.open.desk.core.util.CommonUtil;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskEngineSettings;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskPermissionRule;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermission;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionMatrix;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Role based permission resolution.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Level 0 is always present, denied until a rule grants it.</li>
 *   <li>The super-administrator user or role gets read and write on every level from 0 to the highest
 *   level used by the metadata plus the configured safety margin.</li>
 *   <li>Every rule whose role the user holds is OR-merged into its level. Rules never overwrite each other.</li>
 * </ol>
 *
 * <p>Level-0 rights coming from rules without the owner-only restriction are tracked separately so
 * the field status compiler can withdraw owner-only rights on documents owned by someone else.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class LyshraOpenDeskPermissionResolverImpl implements ILyshraOpenDeskPermissionResolver {

    private final ILyshraOpenDeskEngineSettings settings;

    @Override
    public LyshraOpenDeskPermissionMatrix resolve(ILyshraOpenDeskDocTypeMetadata metadata, Collection<String> userRoles, String currentUserId) {
        if (isAdministrator(userRoles, currentUserId)) {
            return administratorMatrix(metadata);
        }
        if (metadata == null || CommonUtil.isNullOrEmpty(userRoles)) {
            return LyshraOpenDeskPermissionMatrix.denied();
        }

        Map<Integer, LyshraOpenDeskPermission> levels = new HashMap<>();
        levels.put(0, LyshraOpenDeskPermission.NONE);
        LyshraOpenDeskPermission unrestricted = LyshraOpenDeskPermission.NONE;
        for (ILyshraOpenDeskPermissionRule rule : CommonUtil.nonNullList(metadata.getPermissionRules())) {
            if (!appliesTo(rule, userRoles)) {
                continue;
            }
            LyshraOpenDeskPermission granted = LyshraOpenDeskPermission.of(rule.isRead(), rule.isWrite());
            levels.merge(rule.getPermissionLevel(), granted, (current, added) -> current.merge(added));
            if (rule.getPermissionLevel() == 0 && !rule.isOwnerOnly()) {
                unrestricted = unrestricted.merge(granted);
            }
        }
        return new LyshraOpenDeskPermissionMatrix(levels, unrestricted, false);
    }

    @Override
    public boolean hasDocTypePermission(
            ILyshraOpenDeskDocTypeMetadata metadata,
            Collection<String> userRoles,
            String currentUserId,
            LyshraOpenDeskPermissionType permissionType) {

        if (isAdministrator(userRoles, currentUserId)) {
            return true;
        }
        if (metadata == null || CommonUtil.isNullOrEmpty(userRoles) || permissionType == null) {
            return false;
        }
        return CommonUtil.nonNullList(metadata.getPermissionRules()).stream()
                .filter(rule -> appliesTo(rule, userRoles))
                .filter(rule -> rule.getPermissionLevel() == 0)
                .anyMatch(rule -> rule.grants(permissionType));
    }

    @Override
    public boolean isAdministrator(Collection<String> userRoles, String currentUserId) {
        if (currentUserId != null && currentUserId.equals(settings.getSuperAdministratorUserId())) {
            return true;
        }
        String administratorRole = settings.getAdministratorRole();
        return userRoles != null && administratorRole != null && userRoles.contains(administratorRole);
    }

    /**
     * A rule without a role grants nothing.
     */
    private static boolean appliesTo(ILyshraOpenDeskPermissionRule rule, Collection<String> userRoles) {
        return rule != null && rule.getRole() != null && userRoles.contains(rule.getRole());
    }

    private LyshraOpenDeskPermissionMatrix administratorMatrix(ILyshraOpenDeskDocTypeMetadata metadata) {
        int highestLevel = highestLevel(metadata) + Math.max(0, settings.getPermissionLevelSafetyMargin());
        Map<Integer, LyshraOpenDeskPermission> levels = new HashMap<>();
        for (int level = 0; level <= highestLevel; level++) {
            levels.put(level, LyshraOpenDeskPermission.FULL);
        }
        log.trace("Administrator bypass granted full access on levels 0..[{}]", highestLevel);
        return new LyshraOpenDeskPermissionMatrix(levels, LyshraOpenDeskPermission.FULL, true);
    }

    private static int highestLevel(ILyshraOpenDeskDocTypeMetadata metadata) {
        if (metadata == null) {
            return 0;
        }
        int highest = 0;
        for (ILyshraOpenDeskFieldDefinition field : CommonUtil.nonNullList(metadata.getFields())) {
            if (field != null) {
                highest = Math.max(highest, field.getPermissionLevel());
            }
        }
        for (ILyshraOpenDeskPermissionRule rule : CommonUtil.nonNullList(metadata.getPermissionRules())) {
            if (rule != null) {
                highest = Math.max(highest, rule.getPermissionLevel());
            }
        }
        return highest;
    }
}
