package com.lyshra.open.desk.integration.models.metadata;

import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskPermissionRule;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LyshraOpenDeskPermissionRule implements ILyshraOpenDeskPermissionRule {
    private final String role;
    private final int permissionLevel;
    private final boolean read;
    private final boolean write;
    private final boolean create;
    private final boolean delete;
    private final boolean submit;
    private final boolean cancel;
    private final boolean amend;
    private final boolean print;
    private final boolean email;
    private final boolean export;
    private final boolean dataImport; // "import" on the server
    private final boolean share;
    private final boolean ownerOnly;

    @Override
    public boolean isImport() {
        return dataImport;
    }
}
