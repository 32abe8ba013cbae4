package com.lyshra.open.desk.integration.exception;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskErrorInfo;

import java.util.Map;

public interface ILyshraOpenDeskException {
    ILyshraOpenDeskErrorInfo getErrorInfo();
    Map<String, String> getTemplateVariables();
    Throwable getRootCause();
}
