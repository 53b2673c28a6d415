package io.github.eutro.mdsl2ir.passes.meta;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.ScfOps;
import io.github.eutro.mdsl2ir.passes.InPlaceIRPass;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.Region;
import io.github.eutro.mdsl2ir.ssa.Var;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks that every region of a function ends in a terminator, and that every operand
 * is defined before it is used, in its own region or an enclosing one.
 * <p>
 * The body of a {@link ScfOps#PARFOR parfor} sees only its own arguments.
 */
public class VerifyRegions implements InPlaceIRPass<Function> {
    public static final VerifyRegions INSTANCE = new VerifyRegions();

    @Override
    public void runInPlace(Function function) {
        verify(function, function.body, new HashSet<>());
    }

    private void verify(Function function, Region region, Set<Var> outer) {
        Set<Var> visible = new HashSet<>(outer);
        visible.addAll(region.getArgs());
        for (Effect effect : region.getEffects()) {
            if (effect.getRegion() != region) {
                throw new IllegalStateException(String.format(
                        "effect not owned by region\n  effect: %s\n  in function: %s",
                        effect,
                        function.symbol));
            }
            for (Var arg : effect.insn().args()) {
                if (!visible.contains(arg)) {
                    throw new IllegalStateException(String.format(
                            "use of undefined variable\n  variable: %s\n  effect: %s\n  in function: %s",
                            arg,
                            effect,
                            function.symbol));
                }
            }
            boolean closed = ScfOps.PARFOR.check(effect.insn().op);
            for (Region nested : effect.getRegions()) {
                verify(function, nested, closed ? new HashSet<>() : visible);
            }
            visible.addAll(effect.getAssignsTo());
        }

        Effect terminator = region.getTerminator();
        if (terminator == null) {
            throw new IllegalStateException(String.format(
                    "region does not end in a terminator\n  region: %s\n  in function: %s",
                    region,
                    function.symbol));
        }
        for (int i = 0; i < region.getEffects().size() - 1; i++) {
            if (CommonExts.isTerminator(region.getEffects().get(i))) {
                throw new IllegalStateException(String.format(
                        "terminator not at region end\n  region: %s\n  in function: %s",
                        region,
                        function.symbol));
            }
        }
    }
}
