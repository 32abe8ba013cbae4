package com.lyshra.open.desk.integration.models.document;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentShare;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
public class LyshraOpenDeskDocumentOverlay implements ILyshraOpenDeskDocumentOverlay {
    private final Map<LyshraOpenDeskPermissionType, Boolean> permissions;
    @Builder.Default
    private final List<ILyshraOpenDeskDocumentShare> shared = List.of();

    @Override
    public Optional<Map<LyshraOpenDeskPermissionType, Boolean>> getPermissions() {
        return Optional.ofNullable(permissions);
    }

    public static LyshraOpenDeskDocumentOverlay empty() {
        return LyshraOpenDeskDocumentOverlay.builder().build();
    }
}
