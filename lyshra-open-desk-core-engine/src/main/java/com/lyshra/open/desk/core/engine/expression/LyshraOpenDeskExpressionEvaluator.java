package com.lyshra.open.desk.core.engine.expression;

import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskDiagnostics;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskEngineSettings;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskExpressionType;
import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates visibility, mandatory and read-only conditions. A condition that cannot be evaluated is
 * reported to diagnostics and treated as satisfied, so a broken expression never hides a field.
 */
@Slf4j
public class LyshraOpenDeskExpressionEvaluator implements ILyshraOpenDeskExpressionEvaluator {

    private final ExpressionEvaluatorFactory evaluatorFactory;
    private final ILyshraOpenDeskDiagnostics diagnostics;

    public LyshraOpenDeskExpressionEvaluator(ILyshraOpenDeskEngineSettings settings, ILyshraOpenDeskDiagnostics diagnostics) {
        this.evaluatorFactory = new ExpressionEvaluatorFactory(settings);
        this.diagnostics = diagnostics;
    }

    @Override
    public boolean evaluate(Object expression, ExpressionContext context) {
        LyshraOpenDeskExpressionType type = evaluatorFactory.classify(expression);
        if (type != LyshraOpenDeskExpressionType.LITERAL && (context == null || !context.hasDocument())) {
            return true;
        }
        try {
            return evaluatorFactory.getEvaluator(type).evaluateBoolean(expression, context);
        } catch (ExpressionEvaluationException | RuntimeException e) {
            log.debug("Failed to evaluate expression [{}]: [{}]", expression, e.getMessage());
            diagnostics.reportExpressionFailure(expression, e.getMessage(), e);
            return true;
        }
    }
}
