package com.lyshra.open.desk.core.engine.dependency.impl;

import com.lyshra.open.desk.core.engine.dependency.ILyshraOpenDeskDependencyResolver;
import com.lyshra.open.desk.core.engine.expression.ExpressionContext;
import com.lyshra.open.desk.core.engine.expression.ILyshraOpenDeskExpressionEvaluator;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskFieldDependencyState;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class LyshraOpenDeskDependencyResolverImpl implements ILyshraOpenDeskDependencyResolver {

    private final ILyshraOpenDeskExpressionEvaluator expressionEvaluator;

    @Override
    public LyshraOpenDeskDependencyOverrides resolve(
            List<? extends ILyshraOpenDeskFieldDefinition> fields,
            ILyshraOpenDeskDocument document,
            ILyshraOpenDeskDocument parent) {

        if (document == null || fields == null) {
            return LyshraOpenDeskDependencyOverrides.empty();
        }
        ExpressionContext context = ExpressionContext.of(document, parent);
        Map<String, LyshraOpenDeskFieldDependencyState> states = new LinkedHashMap<>();
        for (ILyshraOpenDeskFieldDefinition field : fields) {
            if (field == null || field.getFieldName() == null) {
                continue;
            }
            Object visibility = field.getVisibilityExpression();
            Object required = field.getRequiredExpression();
            Object readOnly = field.getReadOnlyExpression();
            if (visibility == null && required == null && readOnly == null) {
                continue;
            }
            // the field stays visible while its guardian expression holds
            states.put(field.getFieldName(), LyshraOpenDeskFieldDependencyState.builder()
                    .hiddenByDependency(visibility == null ? null : !expressionEvaluator.evaluate(visibility, context))
                    .dynamicallyRequired(required == null ? null : expressionEvaluator.evaluate(required, context))
                    .dynamicallyReadOnly(readOnly == null ? null : expressionEvaluator.evaluate(readOnly, context))
                    .build());
        }
        return new LyshraOpenDeskDependencyOverrides(states);
    }
}
