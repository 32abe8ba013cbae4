package com.lyshra.open.desk.integration.contract;

/**
 * Observability sink for failures the engine absorbs instead of throwing.
 */
public interface ILyshraOpenDeskDiagnostics {

    /**
     * A dependency or condition expression could not be evaluated and was treated as satisfied.
     */
    void reportExpressionFailure(Object expression, String reason, Throwable cause);

    /**
     * An action provider failed and its actions were left out of the manifest.
     */
    void reportProviderFailure(String providerName, Throwable cause);

    /**
     * A custom requirement predicate threw and the action was left out of the manifest.
     */
    void reportRequirementFailure(String actionId, Throwable cause);
}
