package com.lyshra.open.desk.integration.models.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionRequirement;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskMetadataFlag;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import lombok.Builder;
import lombok.Data;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Data
@Builder
public class LyshraOpenDeskActionRequirement implements ILyshraOpenDeskActionRequirement {
    private final LyshraOpenDeskPermissionType permission;
    private final LyshraOpenDeskMetadataFlag metadataFlag;
    @Builder.Default
    private final Set<Integer> allowedDocStatuses = Set.of();
    private final boolean notNew;
    private final Predicate<ILyshraOpenDeskActionContext> customPredicate;

    @Override
    public Optional<LyshraOpenDeskPermissionType> getPermission() {
        return Optional.ofNullable(permission);
    }

    @Override
    public Optional<LyshraOpenDeskMetadataFlag> getMetadataFlag() {
        return Optional.ofNullable(metadataFlag);
    }

    @Override
    public Optional<Predicate<ILyshraOpenDeskActionContext>> getCustomPredicate() {
        return Optional.ofNullable(customPredicate);
    }

    public static LyshraOpenDeskActionRequirement permission(LyshraOpenDeskPermissionType permission) {
        return LyshraOpenDeskActionRequirement.builder().permission(permission).build();
    }

    public static LyshraOpenDeskActionRequirement metadataFlag(LyshraOpenDeskMetadataFlag flag) {
        return LyshraOpenDeskActionRequirement.builder().metadataFlag(flag).build();
    }

    public static LyshraOpenDeskActionRequirement docStatus(Integer... docStatuses) {
        return LyshraOpenDeskActionRequirement.builder()
                .allowedDocStatuses(Arrays.stream(docStatuses).collect(Collectors.toUnmodifiableSet()))
                .build();
    }

    public static LyshraOpenDeskActionRequirement notNew() {
        return LyshraOpenDeskActionRequirement.builder().notNew(true).build();
    }

    public static LyshraOpenDeskActionRequirement custom(Predicate<ILyshraOpenDeskActionContext> predicate) {
        return LyshraOpenDeskActionRequirement.builder().customPredicate(predicate).build();
    }
}
