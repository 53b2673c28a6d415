package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Stmt;
import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ops.ScfOps;
import io.github.eutro.mdsl2ir.ssa.*;
import io.github.eutro.mdsl2ir.types.ScalarType;
import io.github.eutro.mdsl2ir.types.Type;
import io.github.eutro.mdsl2ir.types.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lowers source-level control flow into structured region operations.
 * <p>
 * The variables a construct assigns that existed before it (its write-set) become the results
 * of the operation, and, for loops, the loop-carried values of its regions.
 */
final class ControlFlowLowering {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowLowering.class);

    private final ScriptTranslator t;

    ControlFlowLowering(ScriptTranslator t) {
        this.t = t;
    }

    void visitIf(Stmt.If stmt) {
        IRBuilder ib = t.builder;
        SymbolTable symbols = t.symbols;
        Var cond = t.castIf(ScalarType.BOOL, t.visitValue(stmt.cond));
        Region outer = ib.getRegion();

        Region thenRegion = new Region();
        ib.setRegion(thenRegion);
        symbols.pushScope();
        t.visitStmt(stmt.thenStmt);
        SymbolTable.Scope owThen = symbols.popScope();

        Region elseRegion = new Region();
        SymbolTable.Scope owElse = new SymbolTable.Scope();
        if (stmt.elseStmt != null) {
            ib.setRegion(elseRegion);
            symbols.pushScope();
            t.visitStmt(stmt.elseStmt);
            owElse = symbols.popScope();
        }

        Set<String> owUnion = new TreeSet<>(owThen.keySet());
        owUnion.addAll(owElse.keySet());
        List<String> names = new ArrayList<>(owUnion);
        List<Var> resultsThen = new ArrayList<>();
        List<Var> resultsElse = new ArrayList<>();
        for (String name : names) {
            Var valThen = Objects.requireNonNull(symbols.get(name, owThen)).value;
            Var valElse = Objects.requireNonNull(symbols.get(name, owElse)).value;
            if (!Types.equalUnknownAware(valThen.type, valElse.type)) {
                throw TranslationException.of(
                        TranslationError.Kind.TYPE_AMBIGUITY,
                        stmt.location,
                        "type of variable `%s` after if-statement is ambiguous, could be either %s (then-branch) or %s (else-branch)",
                        name,
                        valThen.type,
                        valElse.type);
            }
            resultsThen.add(valThen);
            resultsElse.add(valElse);
        }

        ib.setRegion(thenRegion);
        ib.insert(ScfOps.YIELD.insn(resultsThen));
        ib.setRegion(elseRegion);
        ib.insert(ScfOps.YIELD.insn(resultsElse));
        ib.setRegion(outer);

        List<Var> results = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            Type ty = resultsThen.get(i).type;
            if (ty.isUnknown()) ty = resultsElse.get(i).type;
            results.add(ib.func.newVar(names.get(i), ty));
        }
        boolean needsElse = stmt.elseStmt != null || !names.isEmpty();
        ib.insert((needsElse
                ? ScfOps.IF.create(thenRegion, elseRegion)
                : ScfOps.IF.create(thenRegion))
                .insn(cond)
                .assignTo(results));

        for (int i = 0; i < names.size(); i++) {
            symbols.put(names.get(i), new SymbolTable.SymbolInfo(results.get(i), false));
        }
    }

    void visitWhile(Stmt.While stmt) {
        IRBuilder ib = t.builder;
        SymbolTable symbols = t.symbols;
        Region outer = ib.getRegion();
        Region before = new Region();
        Region after = new Region();

        Var cond;
        SymbolTable.Scope ow;
        if (stmt.doWhile) {
            ib.setRegion(before);
            // the condition sees the body's updates, but not its new variables
            symbols.pushScope();
            symbols.pushScope();
            t.visitStmt(stmt.body);
            ow = symbols.popScope();
            symbols.put(ow);
            cond = t.castIf(ScalarType.BOOL, t.visitValue(stmt.cond));
            symbols.popScope();
        } else {
            ib.setRegion(before);
            cond = t.castIf(ScalarType.BOOL, t.visitValue(stmt.cond));
            ib.setRegion(after);
            symbols.pushScope();
            t.visitStmt(stmt.body);
            ow = symbols.popScope();
        }

        List<Var> owVals = new ArrayList<>();
        List<Var> operands = new ArrayList<>();
        for (Map.Entry<String, SymbolTable.SymbolInfo> entry : ow.entrySet()) {
            Var owVal = entry.getValue().value;
            Var oldVal = Objects.requireNonNull(symbols.get(entry.getKey())).value;
            checkLoopCarried(entry.getKey(), oldVal, owVal, stmt);
            owVals.add(owVal);
            operands.add(oldVal);
            before.getArgs().add(ib.func.newVar(entry.getKey(), owVal.type));
            after.getArgs().add(ib.func.newVar(entry.getKey(), owVal.type));
        }
        LOGGER.debug("while loop at {} carries {}", stmt.location, ow.keySet());

        ib.setRegion(before);
        List<Var> conditionArgs = new ArrayList<>();
        conditionArgs.add(cond);
        conditionArgs.addAll(stmt.doWhile ? owVals : before.getArgs());
        ib.insert(ScfOps.CONDITION.insn(conditionArgs));
        ib.setRegion(after);
        ib.insert(ScfOps.YIELD.insn(stmt.doWhile ? new ArrayList<>(after.getArgs()) : owVals));
        ib.setRegion(outer);

        List<Var> results = new ArrayList<>();
        for (Var owVal : owVals) {
            results.add(ib.func.newVar(owVal.name, owVal.type));
        }
        ib.insert(ScfOps.WHILE.create(before, after).insn(operands).assignTo(results));

        int i = 0;
        for (String name : ow.keySet()) {
            before.replaceUses(operands.get(i), before.getArgs().get(i));
            after.replaceUses(operands.get(i), after.getArgs().get(i));
            symbols.put(name, new SymbolTable.SymbolInfo(results.get(i), false));
            i++;
        }
    }

    void visitFor(Stmt.For stmt) {
        IRBuilder ib = t.builder;
        SymbolTable symbols = t.symbols;

        Var from = t.castIf(ScalarType.SI64, t.visitValue(stmt.from));
        Var to = t.castIf(ScalarType.SI64, t.visitValue(stmt.to));
        Var step;
        Var direction;
        if (stmt.step != null) {
            step = t.castIf(ScalarType.SI64, t.visitValue(stmt.step));
            direction = ib.insert(DslOps.EW_SIGN.insn(step), "direction", ScalarType.SI64);
        } else {
            // -1 + 2 * (to >= from), ascending when the bounds are equal
            Var ascending = ib.insert(DslOps.EW_GE.insn(to, from), "ascending", ScalarType.BOOL);
            Var twice = ib.insert(
                    DslOps.EW_MUL.insn(ib.constant(2L, ScalarType.SI64), t.castIf(ScalarType.SI64, ascending)),
                    "step",
                    ScalarType.SI64);
            step = ib.insert(
                    DslOps.EW_ADD.insn(ib.constant(-1L, ScalarType.SI64), twice),
                    "step",
                    ScalarType.SI64);
            direction = step;
        }
        // the source bound is inclusive
        to = ib.insert(DslOps.EW_ADD.insn(to, direction), "to", ScalarType.SI64);
        // count upwards
        from = ib.insert(DslOps.EW_MUL.insn(from, direction), "from", ScalarType.SI64);
        to = ib.insert(DslOps.EW_MUL.insn(to, direction), "to", ScalarType.SI64);
        step = ib.insert(DslOps.EW_MUL.insn(step, direction), "step", ScalarType.SI64);
        from = t.castIf(ScalarType.INDEX, from);
        to = t.castIf(ScalarType.INDEX, to);
        step = t.castIf(ScalarType.INDEX, step);

        Region outer = ib.getRegion();
        Region body = new Region();
        Var iv = ib.func.newVar(stmt.var, ScalarType.INDEX);
        body.getArgs().add(iv);
        ib.setRegion(body);
        symbols.pushScope();
        Var visibleIv = ib.insert(
                DslOps.EW_MUL.insn(t.castIf(ScalarType.SI64, iv), direction),
                stmt.var,
                ScalarType.SI64);
        symbols.put(stmt.var, new SymbolTable.SymbolInfo(visibleIv, true));
        t.visitStmt(stmt.body);
        SymbolTable.Scope ow = symbols.popScope();

        List<Var> resVals = new ArrayList<>();
        List<Var> operands = new ArrayList<>();
        for (Map.Entry<String, SymbolTable.SymbolInfo> entry : ow.entrySet()) {
            Var resVal = entry.getValue().value;
            Var oldVal = Objects.requireNonNull(symbols.get(entry.getKey())).value;
            checkLoopCarried(entry.getKey(), oldVal, resVal, stmt);
            resVals.add(resVal);
            operands.add(oldVal);
            body.getArgs().add(ib.func.newVar(entry.getKey(), resVal.type));
        }
        LOGGER.debug("for loop at {} carries {}", stmt.location, ow.keySet());
        ib.insert(ScfOps.YIELD.insn(resVals));
        ib.setRegion(outer);

        List<Var> forOperands = new ArrayList<>(Arrays.asList(from, to, step));
        forOperands.addAll(operands);
        List<Var> results = new ArrayList<>();
        for (Var resVal : resVals) {
            results.add(ib.func.newVar(resVal.name, resVal.type));
        }
        ib.insert(ScfOps.FOR.create(body).insn(forOperands).assignTo(results));

        int i = 0;
        for (String name : ow.keySet()) {
            body.replaceUses(operands.get(i), body.getArgs().get(i + 1));
            symbols.put(name, new SymbolTable.SymbolInfo(results.get(i), false));
            i++;
        }
    }

    void visitParFor(Stmt.For stmt) {
        IRBuilder ib = t.builder;
        SymbolTable symbols = t.symbols;

        Var from = t.castIf(ScalarType.SI64, t.visitValue(stmt.from));
        Var to = t.castIf(ScalarType.SI64, t.visitValue(stmt.to));
        Var step = stmt.step != null
                ? t.castIf(ScalarType.SI64, t.visitValue(stmt.step))
                : ib.constant(1L, ScalarType.SI64);

        Region outer = ib.getRegion();
        Region body = new Region();
        Var iv = ib.func.newVar(stmt.var, ScalarType.INDEX);
        body.getArgs().add(iv);
        ib.setRegion(body);
        symbols.pushScope();
        symbols.put(stmt.var, new SymbolTable.SymbolInfo(iv, true));
        t.visitStmt(stmt.body);
        SymbolTable.Scope ow = symbols.popScope();

        Effect userReturn = null;
        for (Effect fx : body.getEffects()) {
            if (fx.insn().op == CommonOps.RETURN) {
                userReturn = fx;
                break;
            }
        }
        if (userReturn != null) {
            dropAfterReturn(body, userReturn);
            // the body is its own callable, so its return values do not reach the loop's results
            if (!ow.isEmpty()) {
                t.session.warn(new Diagnostic(stmt.location, String.format(
                        "updates to %s in the parfor body are not visible after the loop, as the body returns at %s",
                        ow.keySet(),
                        locationOf(userReturn))));
                ow.clear();
            }
        }

        List<Var> resVals = new ArrayList<>();
        List<Var> captured = new ArrayList<>();
        for (Map.Entry<String, SymbolTable.SymbolInfo> entry : ow.entrySet()) {
            resVals.add(entry.getValue().value);
            captured.add(Objects.requireNonNull(symbols.get(entry.getKey())).value);
        }
        // every other value from outside that the body uses
        Set<Var> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.addAll(captured);
        body.walk(fx -> {
            for (Var operand : fx.insn().args()) {
                if (!body.defines(operand) && seen.add(operand)) {
                    captured.add(operand);
                }
            }
        });
        // resVals may also be values from outside
        for (Var resVal : resVals) {
            if (!body.defines(resVal) && seen.add(resVal)) {
                captured.add(resVal);
            }
        }
        LOGGER.debug("parfor loop at {} updates {} and captures {} values", stmt.location, ow.keySet(), captured.size());
        if (userReturn == null) {
            ib.insert(CommonOps.RETURN.insn(resVals));
        }
        ib.setRegion(outer);

        for (Var value : captured) {
            body.getArgs().add(ib.func.newVar(value.name, value.type));
        }

        List<Var> operands = new ArrayList<>(Arrays.asList(from, to, step));
        operands.addAll(captured);
        List<Var> results = new ArrayList<>();
        for (Var resVal : resVals) {
            results.add(ib.func.newVar(resVal.name, resVal.type));
        }
        ib.insert(ScfOps.PARFOR.create(body).insn(operands).assignTo(results));

        for (int i = 0; i < captured.size(); i++) {
            body.replaceUses(captured.get(i), body.getArgs().get(i + 1));
        }
        int i = 0;
        for (String name : ow.keySet()) {
            symbols.put(name, new SymbolTable.SymbolInfo(results.get(i++), false));
        }
    }

    private void dropAfterReturn(Region region, Effect ret) {
        List<Effect> effects = region.getEffects();
        int index = effects.indexOf(ret);
        for (int i = index + 1; i < effects.size(); i++) {
            Effect fx = effects.get(i);
            SourceLocation loc = fx.getNullable(CommonExts.LOCATION);
            if (loc != null && !CommonExts.isPure(fx)) {
                t.session.warn(new Diagnostic(loc, String.format(
                        "operation `%s` is ignored, as the parfor body returns at %s",
                        fx.insn().op.key,
                        locationOf(ret))));
            }
        }
        for (int i = effects.size() - 1; i > index; i--) {
            effects.remove(i);
        }
    }

    private static SourceLocation locationOf(Effect fx) {
        SourceLocation loc = fx.getNullable(CommonExts.LOCATION);
        return loc == null ? SourceLocation.UNKNOWN : loc;
    }

    private static void checkLoopCarried(String name, Var before, Var after, Stmt loop) {
        if (!Types.equalUnknownAware(before.type, after.type)) {
            throw TranslationException.of(
                    TranslationError.Kind.TYPE_AMBIGUITY,
                    loop.location,
                    "type of variable `%s` changes in the loop body, from %s to %s",
                    name,
                    before.type,
                    after.type);
        }
    }
}
