package com.lyshra.open.desk.integration.models.permission;

import com.lyshra.open.desk.integration.contract.permission.ILyshraOpenDeskPermissionMatrix;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

@Getter
@ToString
@EqualsAndHashCode
public class LyshraOpenDeskPermissionMatrix implements ILyshraOpenDeskPermissionMatrix {
    private final SortedMap<Integer, LyshraOpenDeskPermission> levels;
    private final LyshraOpenDeskPermission unrestrictedBaseLevel;
    private final boolean administrator;

    public LyshraOpenDeskPermissionMatrix(
            Map<Integer, LyshraOpenDeskPermission> levels,
            LyshraOpenDeskPermission unrestrictedBaseLevel,
            boolean administrator) {

        TreeMap<Integer, LyshraOpenDeskPermission> copy = new TreeMap<>(levels);
        copy.putIfAbsent(0, LyshraOpenDeskPermission.NONE);
        this.levels = Collections.unmodifiableSortedMap(copy);
        this.unrestrictedBaseLevel = unrestrictedBaseLevel == null ? LyshraOpenDeskPermission.NONE : unrestrictedBaseLevel;
        this.administrator = administrator;
    }

    /**
     * Level 0 denied, nothing else.
     */
    public static LyshraOpenDeskPermissionMatrix denied() {
        return new LyshraOpenDeskPermissionMatrix(Map.of(), LyshraOpenDeskPermission.NONE, false);
    }

    @Override
    public Optional<LyshraOpenDeskPermission> getPermission(int level) {
        return Optional.ofNullable(levels.get(level));
    }

    public LyshraOpenDeskPermission getPermissionOrNone(int level) {
        return levels.getOrDefault(level, LyshraOpenDeskPermission.NONE);
    }

    public LyshraOpenDeskPermission getBaseLevel() {
        return getPermissionOrNone(0);
    }
}
