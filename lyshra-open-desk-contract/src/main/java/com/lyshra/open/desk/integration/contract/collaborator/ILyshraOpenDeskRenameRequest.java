package com.lyshra.open.desk.integration.contract.collaborator;

public interface ILyshraOpenDeskRenameRequest {
    String getNewName();
    boolean isMerge();
}
