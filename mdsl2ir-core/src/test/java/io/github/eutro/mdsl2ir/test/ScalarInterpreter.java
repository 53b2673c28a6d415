package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ops.*;
import io.github.eutro.mdsl2ir.ssa.*;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.types.ScalarType;
import io.github.eutro.mdsl2ir.types.Type;

import java.util.*;

/**
 * Runs IR that only computes on scalars, recording what it prints.
 * <p>
 * Integers are {@link Long}s, floating point numbers are {@link Double}s.
 */
public class ScalarInterpreter {
    private final Module module;
    public final List<String> printed = new ArrayList<>();

    public ScalarInterpreter(Module module) {
        this.module = module;
    }

    private static final class Outcome {
        final Op terminator;
        final List<Object> values;

        Outcome(Op terminator, List<Object> values) {
            this.terminator = terminator;
            this.values = values;
        }
    }

    public List<Object> runMain() {
        return call(module.getMain(), Collections.emptyList());
    }

    public List<Object> call(Function func, List<Object> args) {
        Map<Var, Object> env = new IdentityHashMap<>();
        Outcome outcome = run(func.body, env, args);
        if (outcome.terminator != CommonOps.RETURN) {
            throw new IllegalStateException("function " + func.symbol + " ended with " + outcome.terminator);
        }
        return outcome.values;
    }

    private Outcome run(Region region, Map<Var, Object> env, List<Object> args) {
        for (int i = 0; i < args.size(); i++) {
            env.put(region.getArgs().get(i), args.get(i));
        }
        for (Effect fx : region.getEffects()) {
            Op op = fx.insn().op;
            List<Object> operands = new ArrayList<>();
            for (Var arg : fx.insn().args()) {
                if (!env.containsKey(arg)) {
                    throw new IllegalStateException("unbound variable in " + fx);
                }
                operands.add(env.get(arg));
            }
            if (op == CommonOps.RETURN || op == ScfOps.YIELD || op == ScfOps.CONDITION) {
                return new Outcome(op, operands);
            }
            List<Object> results = execute(fx, op, operands, env);
            List<Var> assignsTo = fx.getAssignsTo();
            for (int i = 0; i < assignsTo.size(); i++) {
                env.put(assignsTo.get(i), results.get(i));
            }
        }
        throw new IllegalStateException("region without terminator");
    }

    private List<Object> execute(Effect fx, Op op, List<Object> operands, Map<Var, Object> env) {
        if (op.key == CommonOps.CONST) {
            return Collections.singletonList(CommonOps.CONST.cast(op).arg);
        }
        if (op == CommonOps.RENAME) {
            return operands;
        }
        if (op == DslOps.CAST) {
            return Collections.singletonList(convert(operands.get(0), fx.getAssignsTo().get(0).type));
        }
        if (op == DslOps.EW_MINUS) {
            Object v = operands.get(0);
            return Collections.singletonList(v instanceof Long ? (Object) (-(Long) v) : (Object) (-toDouble(v)));
        }
        if (op == DslOps.EW_SIGN) {
            return Collections.singletonList((long) Math.signum(toDouble(operands.get(0))));
        }
        if (op.key == DslOps.BUILTIN) {
            String name = DslOps.BUILTIN.cast(op).arg;
            if ("print".equals(name)) {
                printed.add(String.valueOf(operands.get(0)));
                return Collections.emptyList();
            }
            throw new UnsupportedOperationException("built-in " + name);
        }
        if (op.key == DslOps.CALL) {
            Function callee = Objects.requireNonNull(module.getFunction(DslOps.CALL.cast(op).arg));
            return call(callee, operands);
        }
        if (op.key == ScfOps.IF) {
            List<Region> regions = fx.getRegions();
            Region taken = (Boolean) operands.get(0) ? regions.get(0) : regions.size() > 1 ? regions.get(1) : null;
            if (taken == null) return Collections.emptyList();
            return run(taken, env, Collections.emptyList()).values;
        }
        if (op.key == ScfOps.WHILE) {
            List<Object> values = operands;
            while (true) {
                List<Object> condition = run(fx.getRegions().get(0), env, values).values;
                List<Object> forwarded = condition.subList(1, condition.size());
                if (!(Boolean) condition.get(0)) return new ArrayList<>(forwarded);
                values = run(fx.getRegions().get(1), env, new ArrayList<>(forwarded)).values;
            }
        }
        if (op.key == ScfOps.FOR) {
            long lb = (Long) operands.get(0);
            long ub = (Long) operands.get(1);
            long step = (Long) operands.get(2);
            List<Object> carried = new ArrayList<>(operands.subList(3, operands.size()));
            for (long iv = lb; iv < ub; iv += step) {
                List<Object> args = new ArrayList<>();
                args.add(iv);
                args.addAll(carried);
                carried = run(fx.getRegions().get(0), env, args).values;
            }
            return carried;
        }
        if (operands.size() == 2) {
            return Collections.singletonList(binary(op, operands.get(0), operands.get(1), fx.getAssignsTo().get(0).type));
        }
        throw new UnsupportedOperationException(fx.toString());
    }

    private static Object binary(Op op, Object lhs, Object rhs, Type resultType) {
        if (op == DslOps.EW_AND) return toBoolean(lhs) && toBoolean(rhs);
        if (op == DslOps.EW_OR) return toBoolean(lhs) || toBoolean(rhs);
        boolean integral = lhs instanceof Long && rhs instanceof Long;
        int cmp = integral ? Long.compare((Long) lhs, (Long) rhs) : Double.compare(toDouble(lhs), toDouble(rhs));
        if (op == DslOps.EW_EQ) return cmp == 0;
        if (op == DslOps.EW_NEQ) return cmp != 0;
        if (op == DslOps.EW_LT) return cmp < 0;
        if (op == DslOps.EW_LE) return cmp <= 0;
        if (op == DslOps.EW_GT) return cmp > 0;
        if (op == DslOps.EW_GE) return cmp >= 0;
        if (integral) {
            long l = (Long) lhs;
            long r = (Long) rhs;
            if (op == DslOps.EW_ADD) return l + r;
            if (op == DslOps.EW_SUB) return l - r;
            if (op == DslOps.EW_MUL) return l * r;
            if (op == DslOps.EW_DIV) return l / r;
            if (op == DslOps.EW_MOD) return l % r;
            if (op == DslOps.EW_POW) return (long) Math.pow(l, r);
        }
        double l = toDouble(lhs);
        double r = toDouble(rhs);
        double result;
        if (op == DslOps.EW_ADD) result = l + r;
        else if (op == DslOps.EW_SUB) result = l - r;
        else if (op == DslOps.EW_MUL) result = l * r;
        else if (op == DslOps.EW_DIV) result = l / r;
        else if (op == DslOps.EW_MOD) result = l % r;
        else if (op == DslOps.EW_POW) result = Math.pow(l, r);
        else throw new UnsupportedOperationException(op.toString());
        return convert(result, resultType);
    }

    private static Object convert(Object value, Type type) {
        if (!(type instanceof ScalarType)) return value;
        ScalarType st = (ScalarType) type;
        switch (st.kind) {
            case BOOL:
                return toBoolean(value);
            case SIGNED:
            case UNSIGNED:
            case INDEX:
                return value instanceof Boolean ? ((Boolean) value ? 1L : 0L) : ((Number) value).longValue();
            case FLOAT:
                return toDouble(value);
            case STRING:
                return String.valueOf(value);
            default:
                return value;
        }
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        return ((Number) value).doubleValue() != 0;
    }

    private static double toDouble(Object value) {
        if (value instanceof Boolean) return (Boolean) value ? 1 : 0;
        return ((Number) value).doubleValue();
    }
}
