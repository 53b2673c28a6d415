package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.IRBuilder;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import io.github.eutro.mdsl2ir.ssa.Var;
import io.github.eutro.mdsl2ir.types.*;

import java.util.*;

/**
 * The built-in functions of scripts, which calls fall back to if no user-defined function
 * has the name being called.
 */
public final class Builtins {
    private static final Map<String, Builtin> BUILTINS = new LinkedHashMap<>();

    @FunctionalInterface
    interface ResultTypes {
        List<Type> infer(List<Type> args);
    }

    static final class Builtin {
        final String name;
        final int minArgs;
        final int maxArgs;
        final ResultTypes resultTypes;

        Builtin(String name, int minArgs, int maxArgs, ResultTypes resultTypes) {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.resultTypes = resultTypes;
        }
    }

    private static void register(String name, int minArgs, int maxArgs, ResultTypes resultTypes) {
        BUILTINS.put(name, new Builtin(name, minArgs, maxArgs, resultTypes));
    }

    private static void register(String name, int args, ResultTypes resultTypes) {
        register(name, args, args, resultTypes);
    }

    private static ResultTypes one(java.util.function.Function<List<Type>, Type> rule) {
        return args -> Collections.singletonList(rule.apply(args));
    }

    private static Type aggregate(Type ty) {
        return Types.valueTypeOf(ty);
    }

    private static Type floating(Type ty) {
        if (ty.isUnknown()) return ty;
        if (ty instanceof MatrixType) return new MatrixType(ScalarType.F64);
        return ty instanceof FrameType ? UnknownType.INSTANCE : ScalarType.F64;
    }

    private static Type matrixOfAll(List<Type> types) {
        for (Type ty : types) {
            if (ty.isUnknown()) return MatrixType.UNKNOWN;
        }
        return new MatrixType(Types.mostGeneral(types));
    }

    static {
        ResultTypes none = args -> Collections.emptyList();
        ResultTypes same = one(args -> args.get(0));

        register("print", 1, 3, none);
        register("stop", 0, 1, none);

        register("sum", 1, one(args -> aggregate(args.get(0))));
        register("aggMin", 1, one(args -> aggregate(args.get(0))));
        register("aggMax", 1, one(args -> aggregate(args.get(0))));
        register("mean", 1, one(args -> args.get(0).isUnknown() ? UnknownType.INSTANCE : ScalarType.F64));
        register("stddev", 1, one(args -> args.get(0).isUnknown() ? UnknownType.INSTANCE : ScalarType.F64));
        ResultTypes minMax = one(args -> args.size() == 1
                ? aggregate(args.get(0))
                : TypeInference.elementWise(DslOps.EW_ADD, args.get(0), args.get(1)));
        register("min", 1, 2, minMax);
        register("max", 1, 2, minMax);
        register("rowSums", 1, one(args -> Types.matrixOf(args.get(0))));
        register("colSums", 1, one(args -> Types.matrixOf(args.get(0))));

        for (String name : new String[]{"sqrt", "exp", "ln"}) {
            register(name, 1, one(args -> floating(args.get(0))));
        }
        for (String name : new String[]{"abs", "round", "floor", "ceil", "isNan", "diagMatrix", "t"}) {
            register(name, 1, same);
        }

        ResultTypes size = one(args -> ScalarType.SIZE);
        register("nrow", 1, size);
        register("ncol", 1, size);
        register("ncell", 1, size);

        register("rand", 6, one(args -> matrixOfAll(args.subList(2, 4))));
        register("fill", 3, one(args -> Types.matrixOf(args.get(0))));
        register("seq", 2, 3, one(Builtins::matrixOfAll));
        ResultTypes bind = one(args -> args.get(0) instanceof MatrixType && args.get(1) instanceof MatrixType
                ? matrixOfAll(args)
                : UnknownType.INSTANCE);
        register("cbind", 2, bind);
        register("rbind", 2, bind);
        register("reshape", 3, one(args -> Types.matrixOf(args.get(0))));
        register("eigen", 1, args -> {
            Type vt = Types.valueTypeOf(args.get(0));
            return Arrays.asList(new MatrixType(vt), new MatrixType(vt));
        });
        register("map", 2, one(args -> MatrixType.UNKNOWN));
        register("now", 0, one(args -> ScalarType.SI64));
    }

    private Builtins() {
    }

    public static boolean has(String name) {
        return BUILTINS.containsKey(name);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(BUILTINS.keySet());
    }

    /**
     * Insert a call to a built-in function.
     *
     * @param builder  The builder to insert with.
     * @param name     The name of the built-in.
     * @param args     The arguments.
     * @param location The location of the call, for errors.
     * @return The inserted effect, whose results are the results of the call.
     * @throws TranslationException If there is no such built-in, or it does not take that many arguments.
     */
    public static Effect build(IRBuilder builder, String name, List<Var> args, SourceLocation location) {
        Builtin builtin = BUILTINS.get(name);
        if (builtin == null) {
            throw TranslationException.of(
                    TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                    location,
                    "no function or built-in named `%s`",
                    name);
        }
        if (args.size() < builtin.minArgs || args.size() > builtin.maxArgs) {
            String expected = builtin.minArgs == builtin.maxArgs
                    ? String.valueOf(builtin.minArgs)
                    : builtin.minArgs + " to " + builtin.maxArgs;
            throw TranslationException.of(
                    TranslationError.Kind.ARITY_MISMATCH,
                    location,
                    "built-in function '%s' expects %s argument(s), but got %d",
                    name,
                    expected,
                    args.size());
        }
        List<Type> argTypes = new ArrayList<>(args.size());
        for (Var arg : args) {
            argTypes.add(arg.type);
        }
        List<Var> results = new ArrayList<>();
        for (Type ty : builtin.resultTypes.infer(argTypes)) {
            results.add(builder.func.newVar(name, ty));
        }
        return builder.insert(DslOps.BUILTIN.create(name).insn(args).assignTo(results));
    }
}
