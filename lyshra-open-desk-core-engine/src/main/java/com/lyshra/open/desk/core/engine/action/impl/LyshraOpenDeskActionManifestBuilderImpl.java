package com.lyshra.open.desk.core.engine.action.impl;

import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionManifestBuilder;
import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionRequirementEvaluator;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionComparator;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionProviderRegistry;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskDiagnostics;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Slf4j
@RequiredArgsConstructor
public class LyshraOpenDeskActionManifestBuilderImpl implements ILyshraOpenDeskActionManifestBuilder {

    private final LyshraOpenDeskActionProviderRegistry registry;
    private final ILyshraOpenDeskActionRequirementEvaluator requirementEvaluator;
    private final LyshraOpenDeskActionComparator comparator;
    private final ILyshraOpenDeskDiagnostics diagnostics;

    @Override
    public LyshraOpenDeskActionManifest build(ILyshraOpenDeskActionContext context) {
        List<ILyshraOpenDeskAction> candidates = new ArrayList<>();
        for (ILyshraOpenDeskActionProvider provider : registry.getProviders()) {
            candidates.addAll(collect(provider, context));
        }

        // stream sort is stable, equal keys keep registration order
        List<ILyshraOpenDeskAction> actions = candidates.stream()
                .filter(action -> requirementEvaluator.isAvailable(action, context))
                .sorted(comparator)
                .toList();

        log.debug("Action manifest for [{}]: [{}] of [{}] candidate actions available",
                context.getDocumentType(), actions.size(), candidates.size());
        return new LyshraOpenDeskActionManifest(actions, context);
    }

    private List<ILyshraOpenDeskAction> collect(ILyshraOpenDeskActionProvider provider, ILyshraOpenDeskActionContext context) {
        try {
            if (!provider.appliesTo(context.getDocumentType())) {
                return List.of();
            }
            List<ILyshraOpenDeskAction> actions = provider.getActions(context);
            if (actions == null) {
                return List.of();
            }
            return actions.stream().filter(Objects::nonNull).toList();
        } catch (RuntimeException e) {
            diagnostics.reportProviderFailure(provider.getName(), e);
            return List.of();
        }
    }
}
