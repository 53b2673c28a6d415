package io.github.eutro.mdsl2ir.passes.form;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.Op;
import io.github.eutro.mdsl2ir.ops.ScfOps;
import io.github.eutro.mdsl2ir.passes.InPlaceIRPass;
import io.github.eutro.mdsl2ir.ssa.*;
import io.github.eutro.mdsl2ir.translate.Diagnostic;
import io.github.eutro.mdsl2ir.translate.TranslationError;
import io.github.eutro.mdsl2ir.translate.TranslationException;
import io.github.eutro.mdsl2ir.types.Type;
import io.github.eutro.mdsl2ir.types.Types;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A pass which rewrites {@code return}s nested in conditionals, so that the function body
 * has exactly one return, as its final effect.
 * <p>
 * The most deeply nested return is handled first. Its conditional is rebuilt to yield the
 * returned values: the branch that returns yields them directly, and the effects that would
 * have run after the conditional are moved (or, from enclosing regions, cloned) into the
 * branch that does not. A return of the rebuilt conditional's results is then placed after it,
 * which is in turn handled the same way, until the only return left is at the top level.
 * <p>
 * Effects that can never run, because they follow a return, are discarded. Impure ones are reported.
 * Returns in the body of a {@link ScfOps#PARFOR parfor} are left alone, since that body is a
 * closed callable of its own. Returns in other loops are not supported.
 */
public class RectifyEarlyReturns implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RectifyEarlyReturns.class);

    private final Consumer<Diagnostic> warnings;

    /**
     * Construct the pass.
     *
     * @param warnings Where to report discarded effects.
     */
    public RectifyEarlyReturns(Consumer<Diagnostic> warnings) {
        this.warnings = warnings;
    }

    @Override
    public void runInPlace(Function func) {
        if (func.body.getTerminator() == null) {
            func.body.addEffect(CommonOps.RETURN.insn().assignTo());
        }
        while (true) {
            ReturnSearch search = new ReturnSearch();
            search.visit(func.body, 1);
            Effect ret = search.found;
            if (ret == null) break;
            Region region = ret.getRegion();
            assert region != null;
            Effect owner = region.getOwner();
            if (owner == null) {
                // top-level, nothing after it can run
                discardAfter(region, region.getEffects().indexOf(ret), ret);
                break;
            }
            Op op = owner.insn().op;
            if (!ScfOps.IF.check(op)) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        locationOf(ret),
                        "early return in `%s` is not supported",
                        op.key);
            }
            LOGGER.debug("rectifying return at depth {} in {}", search.depth, func.symbol);
            rebuild(func, owner);
        }
    }

    private void rebuild(Function func, Effect oldIf) {
        Region parent = oldIf.getRegion();
        assert parent != null;
        List<Region> oldRegions = oldIf.getRegions();
        Region thenCase = new Region();
        Region elseCase = new Region();
        moveAll(oldRegions.get(0), thenCase);
        if (oldRegions.size() > 1) {
            moveAll(oldRegions.get(1), elseCase);
        }

        boolean thenReturns = truncateAtReturn(thenCase);
        boolean elseReturns = truncateAtReturn(elseCase);
        if (!thenReturns) {
            continueInto(func, oldIf, thenCase);
        } else if (!elseReturns) {
            continueInto(func, oldIf, elseCase);
        } else {
            // both branches return
            Effect lastReturn = elseCase.getEffects().get(elseCase.getEffects().size() - 1);
            discardAfter(parent, parent.getEffects().indexOf(oldIf), lastReturn);
        }

        List<Var> thenValues = returnToYield(thenCase);
        List<Var> elseValues = returnToYield(elseCase);
        SourceLocation location = locationOf(oldIf);
        if (thenValues.size() != elseValues.size()) {
            throw TranslationException.of(
                    TranslationError.Kind.ARITY_MISMATCH,
                    location,
                    "function `%s` returns a different number of values on different paths (%d vs. %d)",
                    func.name,
                    thenValues.size(),
                    elseValues.size());
        }
        List<Var> results = new ArrayList<>(thenValues.size());
        for (int i = 0; i < thenValues.size(); i++) {
            Type thenType = thenValues.get(i).type;
            Type elseType = elseValues.get(i).type;
            if (!Types.equalUnknownAware(thenType, elseType)) {
                throw TranslationException.of(
                        TranslationError.Kind.TYPE_AMBIGUITY,
                        location,
                        "function `%s` returns different types for return value #%d on different paths (%s vs. %s)",
                        func.name,
                        i,
                        thenType,
                        elseType);
            }
            results.add(func.newVar("returned", thenType.isUnknown() ? elseType : thenType));
        }

        Var cond = oldIf.insn().args().get(0);
        Effect newIf = ScfOps.IF.create(thenCase, elseCase).insn(cond).assignTo(results);
        Effect newReturn = CommonOps.RETURN.insn(results).assignTo();
        newIf.attachExt(CommonExts.LOCATION, location);
        newReturn.attachExt(CommonExts.LOCATION, location);
        int index = parent.getEffects().indexOf(oldIf);
        parent.getEffects().set(index, newIf);
        parent.getEffects().add(index + 1, newReturn);
    }

    private static void moveAll(Region from, Region to) {
        for (Effect fx : new ArrayList<>(from.getEffects())) {
            to.addEffect(fx);
        }
        from.getEffects().clear();
    }

    private boolean truncateAtReturn(Region region) {
        List<Effect> effects = region.getEffects();
        for (int i = 0; i < effects.size(); i++) {
            Effect fx = effects.get(i);
            if (isReturn(fx)) {
                discardAfter(region, i, fx);
                return true;
            }
        }
        return false;
    }

    private void discardAfter(Region region, int index, Effect ret) {
        List<Effect> effects = region.getEffects();
        SourceLocation returnLocation = locationOf(ret);
        for (int i = index + 1; i < effects.size(); i++) {
            Effect fx = effects.get(i);
            SourceLocation loc = fx.getNullable(CommonExts.LOCATION);
            if (CommonExts.isPure(fx)) {
                LOGGER.debug("dropping unreachable {} at {}", fx.insn().op.key, loc);
                continue;
            }
            // effects without a location were not written by the user
            if (loc != null && (!CommonExts.isTerminator(fx) || isReturn(fx))) {
                warnings.accept(new Diagnostic(loc, String.format(
                        "operation `%s` is ignored, as the function returns at %s",
                        fx.insn().op.key,
                        returnLocation)));
            }
        }
        for (int i = effects.size() - 1; i > index; i--) {
            effects.remove(i);
        }
    }

    /**
     * Make a branch without a return run everything that would have run after the conditional,
     * up to and including the function's return.
     */
    private void continueInto(Function func, Effect oldIf, Region caseRegion) {
        if (caseRegion.getTerminator() == null) {
            caseRegion.addEffect(ScfOps.YIELD.insn().assignTo());
        }

        Cloner cloner = new Cloner(func);
        Region origin = oldIf.getRegion();
        Region region = origin;
        assert region != null;
        int index = region.getEffects().indexOf(oldIf) + 1;
        while (index < region.getEffects().size()) {
            Effect fx = region.getEffects().get(index);
            Op op = fx.insn().op;
            Effect jumpTo = null;
            if (op == ScfOps.YIELD || op == ScfOps.CONDITION) {
                jumpTo = region.getOwner();
                if (jumpTo == null) {
                    throw new IllegalStateException(String.format(
                            "%s outside of a nested region\n  effect: %s",
                            op.key,
                            fx));
                }
                if (!ScfOps.IF.check(jumpTo.insn().op)) {
                    throw TranslationException.of(
                            TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                            locationOf(oldIf),
                            "early return in `%s` is not supported",
                            jumpTo.insn().op.key);
                }
            }
            if (region == origin) {
                caseRegion.addEffect(fx);
                region.getEffects().remove(index);
            } else {
                caseRegion.addEffect(cloner.clone(fx));
                index++;
            }
            if (jumpTo != null) {
                region = jumpTo.getRegion();
                assert region != null;
                index = region.getEffects().indexOf(jumpTo) + 1;
            } else if (isReturn(fx)) {
                break;
            }
        }

        // each yield now passes values to the effects that follow it in the same branch
        Effect currIf = oldIf;
        for (Effect fx : new ArrayList<>(caseRegion.getEffects())) {
            if (fx.insn().op != ScfOps.YIELD || currIf == null) continue;
            List<Var> results = currIf.getAssignsTo();
            List<Var> yielded = fx.insn().args();
            for (int i = 0; i < results.size() && i < yielded.size(); i++) {
                caseRegion.replaceUses(results.get(i), yielded.get(i));
            }
            Region currRegion = currIf.getRegion();
            currIf = currRegion == null ? null : currRegion.getOwner();
            caseRegion.getEffects().remove(fx);
        }
    }

    private static List<Var> returnToYield(Region caseRegion) {
        Effect terminator = caseRegion.getTerminator();
        if (terminator == null || !isReturn(terminator)) {
            throw new IllegalStateException(String.format(
                    "branch does not end in a return after rectification\n  branch: %s",
                    caseRegion));
        }
        List<Var> values = new ArrayList<>(terminator.insn().args());
        terminator.setInsn(ScfOps.YIELD.insn(values));
        return values;
    }

    private static boolean isReturn(Effect fx) {
        return fx.insn().op == CommonOps.RETURN;
    }

    private static SourceLocation locationOf(Effect fx) {
        SourceLocation loc = fx.getNullable(CommonExts.LOCATION);
        return loc == null ? SourceLocation.UNKNOWN : loc;
    }

    private static class ReturnSearch {
        @Nullable Effect found;
        int depth;

        void visit(Region region, int regionDepth) {
            for (Effect fx : region.getEffects()) {
                if (isReturn(fx) && regionDepth > depth) {
                    found = fx;
                    depth = regionDepth;
                }
                if (ScfOps.PARFOR.check(fx.insn().op)) continue;
                for (Region nested : fx.getRegions()) {
                    visit(nested, regionDepth + 1);
                }
            }
        }
    }
}
