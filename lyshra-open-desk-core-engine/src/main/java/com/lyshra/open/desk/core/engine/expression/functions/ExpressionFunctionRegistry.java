package com.lyshra.open.desk.core.engine.expression.functions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Helper functions callable from {@code eval:} expressions, named as on the server.
 */
public class ExpressionFunctionRegistry {
    private final Map<String, IExpressionFunction> functionRegistry;

    private ExpressionFunctionRegistry() {
        functionRegistry = new HashMap<>();
        this.register(new InListFunction());
        this.register(new CintFunction());
        this.register(new FltFunction());
        this.register(new CstrFunction());
        this.register(new IsNullFunction());
        this.register(new HasCommonFunction());
        this.register(new HasWordsFunction());
    }

    private static class SingletonHolder {
        private static final ExpressionFunctionRegistry INSTANCE = new ExpressionFunctionRegistry();
    }

    public static ExpressionFunctionRegistry getInstance() {
        return SingletonHolder.INSTANCE;
    }

    private void register(IExpressionFunction function) {
        this.functionRegistry.put(function.getFunctionName(), function);
    }

    public IExpressionFunction getFunction(String functionName) {
        return this.functionRegistry.get(functionName);
    }

    public Map<String, IExpressionFunction> getAllFunctions() {
        return Collections.unmodifiableMap(functionRegistry);
    }

}
