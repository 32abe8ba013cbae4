package com.lyshra.open.desk.core.engine.action.impl;

import com.lyshra.open.desk.core.engine.AbstractEngineTest;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionComparator;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionProviderRegistry;
import com.lyshra.open.desk.core.engine.config.LyshraOpenDeskEngineConfig;
import com.lyshra.open.desk.core.engine.permission.impl.LyshraOpenDeskPermissionResolverImpl;
import com.lyshra.open.desk.core.engine.support.RecordingDiagnostics;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskAction;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionManifest;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionRequirement;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class LyshraOpenDeskActionManifestBuilderImplTest extends AbstractEngineTest {

    private final RecordingDiagnostics diagnostics = new RecordingDiagnostics();
    private final LyshraOpenDeskActionProviderRegistry registry = new LyshraOpenDeskActionProviderRegistry();
    private final LyshraOpenDeskActionManifestBuilderImpl builder = new LyshraOpenDeskActionManifestBuilderImpl(
            registry,
            new LyshraOpenDeskActionRequirementEvaluatorImpl(
                    new LyshraOpenDeskPermissionResolverImpl(LyshraOpenDeskEngineConfig.defaults()), diagnostics),
            new LyshraOpenDeskActionComparator(1000),
            diagnostics);

    private final ILyshraOpenDeskActionContext context = LyshraOpenDeskActionContext.builder()
            .documentType("Sales Order")
            .document(salesOrder())
            .metadata(salesOrderMeta())
            .overlay(salesOrderDocInfo())
            .currentUserId(SALES_USER)
            .currentUserRoles(List.of("Sales User"))
            .build();

    @Test
    void actionsOfAllProviders_areMergedAndSorted() {
        // Given
        registry.register(provider("first", ctx -> List.of(action("b", "Beta", 20), action("c", "Gamma", 5))));
        registry.register(provider("second", ctx -> List.of(action("a", "Alpha", 20))));

        // When
        LyshraOpenDeskActionManifest manifest = builder.build(context);

        // Then
        assertEquals(List.of("c", "a", "b"), ids(manifest));
        assertSame(context, manifest.getContext());
    }

    @Test
    void unavailableActions_areLeftOut() {
        ILyshraOpenDeskAction deletable = LyshraOpenDeskAction.builder()
                .id("delete")
                .label("Delete")
                .group(LyshraOpenDeskActionGroup.DOCUMENT)
                .requires(LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.DELETE))
                .executor(ctx -> Mono.empty())
                .build();
        registry.register(provider("mixed", ctx -> List.of(deletable, action("print", "Print", 40))));

        LyshraOpenDeskActionManifest manifest = builder.build(context);

        assertEquals(List.of("print"), ids(manifest));
        assertTrue(manifest.findAction("delete").isEmpty());
        assertTrue(manifest.findAction("print").isPresent());
    }

    @Test
    void failingProvider_isIsolatedAndReported() {
        registry.register(provider("broken", ctx -> {
            throw new IllegalStateException("provider exploded");
        }));
        registry.register(provider("healthy", ctx -> List.of(action("ok", "Ok", 1))));

        LyshraOpenDeskActionManifest manifest = builder.build(context);

        assertEquals(List.of("ok"), ids(manifest));
        assertEquals(List.of("broken"), diagnostics.getProviderFailures());
    }

    @Test
    void providersForOtherDocTypes_areSkipped() {
        registry.register(new ILyshraOpenDeskActionProvider() {
            @Override
            public String getName() {
                return "invoice-only";
            }

            @Override
            public boolean appliesTo(String documentType) {
                return "Sales Invoice".equals(documentType);
            }

            @Override
            public List<ILyshraOpenDeskAction> getActions(ILyshraOpenDeskActionContext ctx) {
                return List.of(action("make-payment", "Payment", 1));
            }
        });

        assertTrue(builder.build(context).getActions().isEmpty());
    }

    @Test
    void nullActionLists_andNullEntries_areIgnored() {
        registry.register(provider("null-list", ctx -> null));
        registry.register(provider("null-entry", ctx -> Arrays.asList(null, action("x", "X", 1))));

        assertEquals(List.of("x"), ids(builder.build(context)));
        assertTrue(diagnostics.getProviderFailures().isEmpty());
    }

    @Test
    void equalActions_keepRegistrationOrder() {
        ILyshraOpenDeskAction fromFirst = action("same", "Same", 5);
        ILyshraOpenDeskAction fromSecond = action("same", "Same", 5);
        registry.register(provider("first", ctx -> List.of(fromFirst)));
        registry.register(provider("second", ctx -> List.of(fromSecond)));

        List<ILyshraOpenDeskAction> actions = builder.build(context).getActions();

        log.debug("Manifest: {}", actions);
        assertSame(fromFirst, actions.get(0));
        assertSame(fromSecond, actions.get(1));
    }

    @ParameterizedTest
    @CsvSource({"true, false", "false, true"})
    void savedOnlyAction_followsTheNewDocumentFlag(boolean isNew, boolean expectedInManifest) {
        // Given
        ILyshraOpenDeskAction reload = LyshraOpenDeskAction.builder()
                .id("reload")
                .label("Reload")
                .group(LyshraOpenDeskActionGroup.VIEW)
                .requires(LyshraOpenDeskActionRequirement.notNew())
                .executor(ctx -> Mono.empty())
                .build();
        registry.register(provider("view", ctx -> List.of(reload)));
        ILyshraOpenDeskActionContext flagged = LyshraOpenDeskActionContext.builder()
                .documentType("Sales Order")
                .document(salesOrder().put("__isNew", isNew))
                .metadata(salesOrderMeta())
                .overlay(salesOrderDocInfo())
                .currentUserId(SALES_USER)
                .currentUserRoles(List.of("Sales User"))
                .build();

        // When
        LyshraOpenDeskActionManifest manifest = builder.build(flagged);

        // Then
        assertEquals(expectedInManifest, manifest.findAction("reload").isPresent());
    }

    private static List<String> ids(LyshraOpenDeskActionManifest manifest) {
        return manifest.getActions().stream().map(ILyshraOpenDeskAction::getId).toList();
    }

    private static ILyshraOpenDeskAction action(String id, String label, int priority) {
        return LyshraOpenDeskAction.builder()
                .id(id)
                .label(label)
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .priority(priority)
                .executor(ctx -> Mono.empty())
                .build();
    }

    private static ILyshraOpenDeskActionProvider provider(
            String name, Function<ILyshraOpenDeskActionContext, List<ILyshraOpenDeskAction>> actions) {
        return new ILyshraOpenDeskActionProvider() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<ILyshraOpenDeskAction> getActions(ILyshraOpenDeskActionContext ctx) {
                return actions.apply(ctx);
            }
        };
    }
}
