package io.github.eutro.mdsl2ir.ssa.display;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ssa.*;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.types.Type;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders IR as text.
 * <p>
 * Variables are numbered in the order they are first encountered, so the output
 * for structurally identical IR is identical, which makes it usable for comparisons.
 */
public final class IRPrinter {
    private final StringBuilder sb = new StringBuilder();
    private final Map<Var, Integer> numbers = new IdentityHashMap<>();

    private IRPrinter() {
    }

    public static String print(Module module) {
        IRPrinter printer = new IRPrinter();
        boolean first = true;
        for (Function func : module.getFunctions()) {
            if (!first) printer.sb.append('\n');
            first = false;
            printer.printFunction(func);
        }
        return printer.sb.toString();
    }

    public static String print(Function func) {
        IRPrinter printer = new IRPrinter();
        printer.printFunction(func);
        return printer.sb.toString();
    }

    public static String print(Region region) {
        IRPrinter printer = new IRPrinter();
        printer.printRegion(region, 0);
        return printer.sb.toString();
    }

    private void printFunction(Function func) {
        numbers.clear();
        sb.append("func @").append(func.symbol).append('(');
        printTypedVars(func.getParams());
        sb.append(") -> (");
        printTypes(func.resultTypes);
        sb.append(") ");
        printEffects(func.body, 0);
        sb.append('\n');
    }

    private void printRegion(Region region, int depth) {
        if (!region.getArgs().isEmpty()) {
            sb.append("^(");
            printTypedVars(region.getArgs());
            sb.append(") ");
        }
        printEffects(region, depth);
    }

    private void printEffects(Region region, int depth) {
        sb.append("{\n");
        for (Effect effect : region.getEffects()) {
            indent(depth + 1);
            printEffect(effect, depth + 1);
            sb.append('\n');
        }
        indent(depth);
        sb.append('}');
    }

    private void printEffect(Effect effect, int depth) {
        List<Var> results = effect.getAssignsTo();
        for (int i = 0; i < results.size(); i++) {
            if (i != 0) sb.append(", ");
            printVar(results.get(i));
        }
        if (!results.isEmpty()) sb.append(" = ");
        sb.append(effect.insn().op);
        List<Var> args = effect.insn().args();
        for (int i = 0; i < args.size(); i++) {
            sb.append(i == 0 ? " " : ", ");
            printVar(args.get(i));
        }
        if (!results.isEmpty()) {
            sb.append(" : ");
            for (int i = 0; i < results.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(results.get(i).type);
            }
        }
        String hint = effect.getNullable(CommonExts.KERNEL_HINT);
        if (hint != null) {
            sb.append(" [kernel=").append(hint).append(']');
        }
        boolean first = true;
        for (Region region : effect.getRegions()) {
            sb.append(first ? " " : " else ");
            first = false;
            printRegion(region, depth);
        }
    }

    private void printTypedVars(List<Var> vars) {
        for (int i = 0; i < vars.size(); i++) {
            if (i != 0) sb.append(", ");
            printVar(vars.get(i));
            sb.append(": ").append(vars.get(i).type);
        }
    }

    private void printTypes(List<Type> types) {
        for (int i = 0; i < types.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(types.get(i));
        }
    }

    private void printVar(Var var) {
        Integer n = numbers.get(var);
        if (n == null) {
            n = numbers.size();
            numbers.put(var, n);
        }
        sb.append('%').append(n);
    }

    private void indent(int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
    }
}
