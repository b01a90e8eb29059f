package com.spreadsheet.engine.functions;

/**
 * Registers every builtin function family.
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        MathFunctions.register(registry);
        LogicalFunctions.register(registry);
        TextFunctions.register(registry);
        LookupFunctions.register(registry);
        DateTimeFunctions.register(registry);
        InfoFunctions.register(registry);
    }
}
