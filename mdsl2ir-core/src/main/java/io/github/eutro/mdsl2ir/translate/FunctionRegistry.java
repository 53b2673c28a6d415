package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import io.github.eutro.mdsl2ir.ssa.Var;
import io.github.eutro.mdsl2ir.types.Type;
import io.github.eutro.mdsl2ir.types.Types;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The user-defined functions visible to a script, by name, with overloads in definition order.
 */
public final class FunctionRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, List<Function>> functions = new LinkedHashMap<>();

    public void register(String name, Function func) {
        functions.computeIfAbsent(name, $ -> new ArrayList<>()).add(func);
    }

    public boolean has(String name) {
        return functions.containsKey(name);
    }

    public List<Function> get(String name) {
        return functions.getOrDefault(name, Collections.emptyList());
    }

    /**
     * Get every registration, as name and function pairs, in registration order per name.
     *
     * @return The registrations.
     */
    public Map<String, List<Function>> entries() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * Find the first overload of {@code name} whose parameters are compatible with the argument types.
     *
     * @param name     The function name.
     * @param args     The arguments.
     * @param location The location of the call.
     * @return The function, or null if there is no function with that name.
     * @throws TranslationException If there are functions with the name, but none matches.
     */
    public @Nullable Function findMatching(String name, List<Var> args, SourceLocation location) {
        List<Function> candidates = functions.get(name);
        if (candidates == null) return null;
        outer:
        for (Function func : candidates) {
            List<Type> params = func.getParamTypes();
            if (params.size() != args.size()) continue;
            for (int i = 0; i < params.size(); i++) {
                if (!Types.isCompatible(params.get(i), args.get(i).type)) continue outer;
            }
            LOGGER.debug("resolved call to {} with {} arguments to {}", name, args.size(), func.symbol);
            return func;
        }
        throw TranslationException.of(
                TranslationError.Kind.OVERLOAD_RESOLUTION,
                location,
                "no definition of function `%s` for argument types (%s), available options: %s",
                name,
                args.stream().map(arg -> arg.type.toString()).collect(Collectors.joining(", ")),
                candidates.stream()
                        .map(func -> func.getParamTypes().stream()
                                .map(Object::toString)
                                .collect(Collectors.joining(", ", name + "(", ")")))
                        .collect(Collectors.joining(", ")));
    }

    /**
     * Find the first overload of {@code name} taking a single parameter compatible with {@code argType}.
     *
     * @param name     The function name.
     * @param argType  The argument type.
     * @param location The location of the use.
     * @return The function, or null if there is no function with that name.
     * @throws TranslationException If there are functions with the name, but none matches.
     */
    public @Nullable Function findMatchingUnary(String name, Type argType, SourceLocation location) {
        List<Function> candidates = functions.get(name);
        if (candidates == null) return null;
        for (Function func : candidates) {
            List<Type> params = func.getParamTypes();
            if (params.size() == 1 && Types.isCompatible(params.get(0), argType)) {
                return func;
            }
        }
        throw TranslationException.of(
                TranslationError.Kind.OVERLOAD_RESOLUTION,
                location,
                "no definition of function `%s` found with a single parameter compatible with %s",
                name,
                argType);
    }
}
