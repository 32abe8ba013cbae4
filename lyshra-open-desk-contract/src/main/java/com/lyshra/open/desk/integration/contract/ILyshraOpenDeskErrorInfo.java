package com.lyshra.open.desk.integration.contract;

public interface ILyshraOpenDeskErrorInfo {
    String getErrorCode();
    String getErrorTemplate();
    String getResolutionTemplate();
}
