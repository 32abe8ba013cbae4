package com.lyshra.open.desk.integration.models.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskWorkflowTransition;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Optional;

@Data
@Builder
public class LyshraOpenDeskWorkflowTransition implements ILyshraOpenDeskWorkflowTransition {
    private final String action;
    private final String targetState;
    @Builder.Default
    private final List<String> allowedRoles = List.of();
    private final String condition;

    @Override
    public Optional<String> getCondition() {
        return Optional.ofNullable(condition);
    }
}
