package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ext.ExtHolder;
import io.github.eutro.mdsl2ir.ssa.display.IRPrinter;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A module, a collection of functions with unique symbols, one of which is the entry point.
 */
public final class Module extends ExtHolder {
    /**
     * The symbol of the entry function, which holds the top-level operations of a script.
     */
    public static final String MAIN_SYMBOL = "main";

    private final Map<String, Function> functions = new LinkedHashMap<>();
    // shared by every translation emitting into this module
    private final AtomicInteger uniqueCounter = new AtomicInteger();
    private final Function main;

    public Module() {
        main = register(new Function(MAIN_SYMBOL, MAIN_SYMBOL));
    }

    private Function register(Function func) {
        functions.put(func.symbol, func);
        func.attachExt(CommonExts.OWNING_MODULE, this);
        return func;
    }

    /**
     * Create a new function with the given source name, and a symbol unique in this module.
     *
     * @param name The source name.
     * @return The function.
     */
    public Function newFunction(String name) {
        String symbol;
        do {
            symbol = name + "-" + uniqueCounter.incrementAndGet();
        } while (functions.containsKey(symbol));
        return register(new Function(name, symbol));
    }

    public Function getMain() {
        return main;
    }

    public @Nullable Function getFunction(String symbol) {
        return functions.get(symbol);
    }

    /**
     * Get the functions of this module, in creation order, starting with the entry function.
     *
     * @return The functions.
     */
    public Collection<Function> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }
}
