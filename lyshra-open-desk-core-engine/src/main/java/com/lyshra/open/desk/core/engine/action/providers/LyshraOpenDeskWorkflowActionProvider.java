package com.lyshra.open.desk.core.engine.action.providers;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskWorkflowTransition;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskAction;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionRequirement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One action per workflow transition the server offers for a saved document.
 * Transition conditions are evaluated by the server before the transition list is sent.
 */
@Slf4j
public class LyshraOpenDeskWorkflowActionProvider implements ILyshraOpenDeskActionProvider {

    public static final String PROVIDER_NAME = "WorkflowActionProvider";
    public static final String ACTION_ID_PREFIX = "workflow-";

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public List<ILyshraOpenDeskAction> getActions(ILyshraOpenDeskActionContext context) {
        List<ILyshraOpenDeskWorkflowTransition> transitions = context.getWorkflowTransitions();
        if (context.isNewDocument() || transitions == null || transitions.isEmpty()) {
            return List.of();
        }
        List<ILyshraOpenDeskAction> actions = new ArrayList<>(transitions.size());
        for (ILyshraOpenDeskWorkflowTransition transition : transitions) {
            actions.add(toAction(transition));
        }
        return actions;
    }

    private ILyshraOpenDeskAction toAction(ILyshraOpenDeskWorkflowTransition transition) {
        String workflowAction = transition.getAction();
        Set<String> allowedRoles = Set.copyOf(transition.getAllowedRoles());

        LyshraOpenDeskAction.OptionsStep builder = LyshraOpenDeskAction.builder()
                .id(ACTION_ID_PREFIX + workflowAction)
                .label(workflowAction)
                .group(LyshraOpenDeskActionGroup.WORKFLOW)
                .icon("GitBranch")
                .priority(10)
                .requires(LyshraOpenDeskActionRequirement.notNew());
        if (!allowedRoles.isEmpty()) {
            builder.requires(LyshraOpenDeskActionRequirement.custom(
                    context -> context.getCurrentUserRoles().stream().anyMatch(allowedRoles::contains)));
        }
        return builder
                .executor(context -> {
                    log.debug("Applying workflow action [{}] towards state [{}]", workflowAction, transition.getTargetState());
                    return context.requireGateway()
                            .applyWorkflow(context.requireDocument(), workflowAction)
                            .then(LyshraOpenDeskActionSupport.reload(context));
                })
                .build();
    }
}
