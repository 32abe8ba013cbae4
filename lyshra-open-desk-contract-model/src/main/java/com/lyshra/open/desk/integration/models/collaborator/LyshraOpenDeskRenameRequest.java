package com.lyshra.open.desk.integration.models.collaborator;

import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskRenameRequest;
import lombok.Data;

@Data
public class LyshraOpenDeskRenameRequest implements ILyshraOpenDeskRenameRequest {
    private final String newName;
    private final boolean merge;
}
