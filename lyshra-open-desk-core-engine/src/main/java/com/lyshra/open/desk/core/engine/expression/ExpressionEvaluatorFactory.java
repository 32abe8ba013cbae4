package com.lyshra.open.desk.core.engine.expression;

import com.lyshra.open.desk.core.engine.expression.evaluators.AbstractExpressionEvaluator;
import com.lyshra.open.desk.core.engine.expression.evaluators.EvalExpressionEvaluator;
import com.lyshra.open.desk.core.engine.expression.evaluators.FieldReferenceExpressionEvaluator;
import com.lyshra.open.desk.core.engine.expression.evaluators.FunctionReferenceExpressionEvaluator;
import com.lyshra.open.desk.core.engine.expression.evaluators.LiteralExpressionEvaluator;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskEngineSettings;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskExpressionType;

import java.util.EnumMap;

public class ExpressionEvaluatorFactory {

    private final EnumMap<LyshraOpenDeskExpressionType, AbstractExpressionEvaluator> evaluators = new EnumMap<>(LyshraOpenDeskExpressionType.class);
    private final ILyshraOpenDeskEngineSettings settings;

    public ExpressionEvaluatorFactory(ILyshraOpenDeskEngineSettings settings) {
        this.settings = settings;
        register(new LiteralExpressionEvaluator());
        register(new FieldReferenceExpressionEvaluator());
        register(new EvalExpressionEvaluator(settings));
        register(new FunctionReferenceExpressionEvaluator());
    }

    private void register(AbstractExpressionEvaluator evaluator) {
        evaluators.put(evaluator.getEvaluatorType(), evaluator);
    }

    public AbstractExpressionEvaluator getEvaluator(LyshraOpenDeskExpressionType expressionType) {
        return evaluators.get(expressionType);
    }

    public LyshraOpenDeskExpressionType classify(Object expression) {
        if (!(expression instanceof String source)) {
            return LyshraOpenDeskExpressionType.LITERAL;
        }
        if (source.startsWith(settings.getEvalPrefix())) {
            return LyshraOpenDeskExpressionType.EVAL;
        }
        if (source.startsWith(settings.getFunctionPrefix())) {
            return LyshraOpenDeskExpressionType.FUNCTION_REFERENCE;
        }
        return LyshraOpenDeskExpressionType.FIELD_REFERENCE;
    }
}
