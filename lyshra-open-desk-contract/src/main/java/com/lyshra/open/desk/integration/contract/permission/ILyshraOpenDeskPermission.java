package com.lyshra.open.desk.integration.contract.permission;

public interface ILyshraOpenDeskPermission {
    boolean isRead();
    boolean isWrite();
}
