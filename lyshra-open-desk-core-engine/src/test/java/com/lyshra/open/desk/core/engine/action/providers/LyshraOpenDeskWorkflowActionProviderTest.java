package com.lyshra.open.desk.core.engine.action.providers;

import com.lyshra.open.desk.core.engine.AbstractEngineTest;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionProviderRegistry;
import com.lyshra.open.desk.core.engine.support.FakeDocumentGateway;
import com.lyshra.open.desk.core.engine.support.RecordingUiDelegate;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionContext;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LyshraOpenDeskWorkflowActionProviderTest extends AbstractEngineTest {

    private final LyshraOpenDeskWorkflowActionProvider provider = new LyshraOpenDeskWorkflowActionProvider();
    private final FakeDocumentGateway gateway = new FakeDocumentGateway();
    private final RecordingUiDelegate ui = new RecordingUiDelegate();

    private LyshraOpenDeskActionContext.LyshraOpenDeskActionContextBuilder order(String... roles) {
        return LyshraOpenDeskActionContext.builder()
                .documentType("Sales Order")
                .document(salesOrder())
                .metadata(salesOrderMeta())
                .overlay(salesOrderDocInfo())
                .workflowTransitions(salesOrderTransitions())
                .currentUserId(SALES_USER)
                .currentUserRoles(List.of(roles))
                .gateway(gateway)
                .ui(ui);
    }

    @Test
    void everyTransition_becomesAWorkflowAction() {
        List<ILyshraOpenDeskAction> actions = provider.getActions(order("Sales User").build());

        assertEquals(List.of("workflow-Approve", "workflow-Reject", "workflow-Review"),
                actions.stream().map(ILyshraOpenDeskAction::getId).toList());
        assertTrue(actions.stream().allMatch(action -> action.getGroup() == LyshraOpenDeskActionGroup.WORKFLOW));
        assertEquals("Approve", actions.get(0).getLabel());
    }

    @Test
    void newDocuments_andMissingTransitions_yieldNothing() {
        assertTrue(provider.getActions(order("Sales Manager").document(null).build()).isEmpty());
        assertTrue(provider.getActions(order("Sales Manager").workflowTransitions(List.of()).build()).isEmpty());
    }

    @Test
    void transitionsAreOfferedOnlyToTheirAllowedRoles() {
        LyshraOpenDeskActionProviderRegistry registry = new LyshraOpenDeskActionProviderRegistry().register(provider);

        assertEquals(List.of("workflow-Review"), manifestIds(registry, order("Sales User")));
        assertEquals(List.of("workflow-Approve", "workflow-Review"), manifestIds(registry, order("Approver")));
        assertEquals(List.of("workflow-Approve", "workflow-Reject", "workflow-Review"), manifestIds(registry, order("Sales Manager")));
    }

    @Test
    void executor_appliesTheTransitionAndReloads() {
        LyshraOpenDeskActionContext context = order("Sales Manager").build();
        ILyshraOpenDeskAction approve = provider.getActions(context).get(0);

        StepVerifier.create(facade.getActionInvoker().invoke(approve, context)).verifyComplete();

        assertEquals(List.of("workflow:Approve"), gateway.getCalls());
        assertEquals(1, ui.getReloads());
    }

    private static List<String> manifestIds(
            LyshraOpenDeskActionProviderRegistry registry, LyshraOpenDeskActionContext.LyshraOpenDeskActionContextBuilder context) {
        return facade.createManifestBuilder(registry).build(context.build()).getActions().stream()
                .map(ILyshraOpenDeskAction::getId)
                .toList();
    }
}
