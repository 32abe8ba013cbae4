package com.lyshra.open.desk.core.engine.support;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskDiagnostics;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public class RecordingDiagnostics implements ILyshraOpenDeskDiagnostics {
    private final List<Object> expressionFailures = new ArrayList<>();
    private final List<String> providerFailures = new ArrayList<>();
    private final List<String> requirementFailures = new ArrayList<>();

    @Override
    public void reportExpressionFailure(Object expression, String reason, Throwable cause) {
        expressionFailures.add(expression);
    }

    @Override
    public void reportProviderFailure(String providerName, Throwable cause) {
        providerFailures.add(providerName);
    }

    @Override
    public void reportRequirementFailure(String actionId, Throwable cause) {
        requirementFailures.add(actionId);
    }
}
