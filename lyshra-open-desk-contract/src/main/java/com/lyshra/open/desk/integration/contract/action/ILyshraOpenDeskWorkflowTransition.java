package com.lyshra.open.desk.integration.contract.action;

import java.util.List;
import java.util.Optional;

public interface ILyshraOpenDeskWorkflowTransition {
    String getAction();
    String getTargetState();
    List<String> getAllowedRoles();

    /**
     * Server-side condition. Evaluated by the server when it lists transitions, never by the engine.
     */
    Optional<String> getCondition();
}
