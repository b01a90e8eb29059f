package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.FormulaError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Name -> function table. Names are stored upper-cased, so lookup is case-insensitive.
 *
 * Functions registered with {@link #register} never see error arguments: the first error
 * among the arguments is returned instead of calling them. Functions that inspect errors
 * (IFERROR, ISERROR, COUNT...) use {@link #registerErrorAware}.
 */
public class FunctionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

    public static final int VARIADIC = Integer.MAX_VALUE;

    private final Map<String, FormulaFunction> functions = new HashMap<>();

    /**
     * Registry preloaded with every builtin function.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        BuiltinFunctions.registerAll(registry);
        logger.debug("Registered {} builtin functions", registry.functions.size());
        return registry;
    }

    /**
     * Registers a function as-is. Replaces any function already under this name.
     */
    public void registerRaw(String name, FormulaFunction function) {
        functions.put(name.toUpperCase(Locale.ROOT), function);
    }

    /**
     * Registers a function that takes between minArgs and maxArgs arguments and
     * propagates the first error argument.
     */
    public void register(String name, int minArgs, int maxArgs, FormulaFunction function) {
        registerRaw(name, checkArity(name, minArgs, maxArgs, (args, context) -> {
            FormulaError error = args.firstError();
            return error != null ? error : function.apply(args, context);
        }));
    }

    /**
     * Registers a function that receives error arguments like any other value.
     */
    public void registerErrorAware(String name, int minArgs, int maxArgs, FormulaFunction function) {
        registerRaw(name, checkArity(name, minArgs, maxArgs, function));
    }

    public Optional<FormulaFunction> get(String name) {
        return Optional.ofNullable(functions.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean has(String name) {
        return functions.containsKey(name.toUpperCase(Locale.ROOT));
    }

    /** Registered names, sorted. */
    public List<String> list() {
        List<String> names = new ArrayList<>(functions.keySet());
        Collections.sort(names);
        return names;
    }

    private static FormulaFunction checkArity(String name, int minArgs, int maxArgs, FormulaFunction function) {
        return (args, context) -> {
            if (args.size() < minArgs || args.size() > maxArgs) {
                return FormulaError.value("Wrong number of arguments to " + name.toUpperCase(Locale.ROOT));
            }
            return function.apply(args, context);
        };
    }
}
