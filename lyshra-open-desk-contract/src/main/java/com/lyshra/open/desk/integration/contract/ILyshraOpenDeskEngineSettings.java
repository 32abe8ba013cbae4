package com.lyshra.open.desk.integration.contract;

public interface ILyshraOpenDeskEngineSettings {
    String getSuperAdministratorUserId();
    String getAdministratorRole();
    int getPermissionLevelSafetyMargin();
    String getEvalPrefix();
    String getFunctionPrefix();
    int getMaxExpressionLength();
    int getMaxExpressionDepth();
    int getDefaultActionPriority();
}
