package com.lyshra.open.desk.core.engine.diagnostics;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskDiagnostics;
import lombok.extern.slf4j.Slf4j;

/**
 * Default diagnostics sink writing every absorbed failure to the log.
 */
@Slf4j
public class LyshraOpenDeskLoggingDiagnostics implements ILyshraOpenDeskDiagnostics {

    private LyshraOpenDeskLoggingDiagnostics() {}

    private static final class SingletonHolder {
        private static final LyshraOpenDeskLoggingDiagnostics INSTANCE = new LyshraOpenDeskLoggingDiagnostics();
    }

    public static ILyshraOpenDeskDiagnostics getInstance() {
        return SingletonHolder.INSTANCE;
    }

    @Override
    public void reportExpressionFailure(Object expression, String reason, Throwable cause) {
        log.warn("Expression [{}] evaluated as satisfied after failure: [{}]", expression, reason, cause);
    }

    @Override
    public void reportProviderFailure(String providerName, Throwable cause) {
        log.error("Action provider [{}] failed, its actions are skipped", providerName, cause);
    }

    @Override
    public void reportRequirementFailure(String actionId, Throwable cause) {
        log.warn("Requirement check for action [{}] failed, action is hidden", actionId, cause);
    }
}
