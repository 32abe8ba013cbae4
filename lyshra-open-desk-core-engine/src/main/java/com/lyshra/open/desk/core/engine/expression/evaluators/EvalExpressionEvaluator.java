package com.lyshra.open.desk.core.engine.expression.evaluators;

import com.lyshra.open.desk.core.engine.expression.ExpressionContext;
import com.lyshra.open.desk.core.engine.expression.functions.ExpressionFunctionRegistry;
import com.lyshra.open.desk.core.engine.expression.parser.ExpressionNode;
import com.lyshra.open.desk.core.engine.expression.parser.ExpressionParser;
import com.lyshra.open.desk.core.engine.expression.parser.ExpressionScope;
import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskEngineSettings;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskExpressionType;

/**
 * Interprets {@code eval:} expressions. Source is parsed on every call; nothing is cached.
 */
public class EvalExpressionEvaluator extends AbstractExpressionEvaluator {

    private final ILyshraOpenDeskEngineSettings settings;
    private final ExpressionFunctionRegistry functionRegistry;

    public EvalExpressionEvaluator(ILyshraOpenDeskEngineSettings settings) {
        this.settings = settings;
        this.functionRegistry = ExpressionFunctionRegistry.getInstance();
    }

    @Override
    public LyshraOpenDeskExpressionType getEvaluatorType() {
        return LyshraOpenDeskExpressionType.EVAL;
    }

    @Override
    public Object evaluate(Object expression, ExpressionContext context) throws ExpressionEvaluationException {
        String source = String.valueOf(expression).substring(settings.getEvalPrefix().length());
        if (source.length() > settings.getMaxExpressionLength()) {
            throw new ExpressionEvaluationException(
                    "Expression length " + source.length() + " exceeds " + settings.getMaxExpressionLength());
        }
        ExpressionNode node = ExpressionParser.parse(source, settings.getMaxExpressionDepth());
        return node.evaluate(new ExpressionScope(context, functionRegistry));
    }

}
