package com.lyshra.open.desk.core.engine.config;

import com.lyshra.open.desk.integration.constant.LyshraOpenDeskConstants;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskEngineSettings;
import lombok.Data;

/**
 * Engine tunables. Field initializers are the defaults used when no configuration resource is present.
 */
@Data
public class LyshraOpenDeskEngineConfig implements ILyshraOpenDeskEngineSettings {

    /**
     * User id that bypasses every permission rule.
     */
    private String superAdministratorUserId = LyshraOpenDeskConstants.DEFAULT_ADMINISTRATOR;

    /**
     * Role that bypasses every permission rule.
     */
    private String administratorRole = LyshraOpenDeskConstants.DEFAULT_ADMINISTRATOR;

    /**
     * Levels granted to administrators beyond the highest level found in the metadata.
     */
    private int permissionLevelSafetyMargin = 1;

    private String evalPrefix = "eval:";
    private String functionPrefix = "fn:";
    private int maxExpressionLength = 4096;
    private int maxExpressionDepth = 64;

    /**
     * Sort priority of actions that declare none.
     */
    private int defaultActionPriority = 1000;

    public static LyshraOpenDeskEngineConfig defaults() {
        return new LyshraOpenDeskEngineConfig();
    }
}
