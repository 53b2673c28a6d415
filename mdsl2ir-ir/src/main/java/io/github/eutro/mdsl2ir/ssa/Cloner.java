package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.Op;
import io.github.eutro.mdsl2ir.ops.RegionOpKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies effects, giving every variable they define a fresh counterpart.
 * <p>
 * Uses of variables that were defined by effects cloned through the same cloner
 * refer to the copies. Uses of other variables are left as they are.
 */
public class Cloner {
    private final Map<Var, Var> varMap;
    private final Function func;

    public Cloner(Function func, Map<Var, Var> varMap) {
        this.func = func;
        this.varMap = varMap;
    }

    public Cloner(Function func) {
        this(func, new HashMap<>());
    }

    /**
     * Get the variable mapping built so far, from originals to copies.
     *
     * @return The mutable mapping.
     */
    public Map<Var, Var> getVarMap() {
        return varMap;
    }

    /**
     * Get the copy of a variable, or the variable itself if it has not been copied.
     *
     * @param var The variable.
     * @return The copy.
     */
    public Var map(Var var) {
        return varMap.getOrDefault(var, var);
    }

    /**
     * Clone an effect, and any regions its operation holds.
     * The clone is not inserted anywhere.
     *
     * @param fx The effect.
     * @return The clone.
     */
    public Effect clone(Effect fx) {
        Op op = fx.insn().op;
        if (op instanceof RegionOpKey.RegionOp) {
            RegionOpKey.RegionOp rop = (RegionOpKey.RegionOp) op;
            List<Region> regions = new ArrayList<>(rop.regions.size());
            for (Region region : rop.regions) {
                regions.add(cloneRegion(region));
            }
            op = ((RegionOpKey) rop.key).create(regions);
        }
        Insn insn = op.insn(mapAll(fx.insn().args()));
        List<Var> results = new ArrayList<>();
        for (Var result : fx.getAssignsTo()) {
            results.add(fresh(result));
        }
        Effect copy = insn.assignTo(results);
        fx.getExt(CommonExts.LOCATION).ifPresent(loc -> copy.attachExt(CommonExts.LOCATION, loc));
        fx.getExt(CommonExts.KERNEL_HINT).ifPresent(hint -> copy.attachExt(CommonExts.KERNEL_HINT, hint));
        return copy;
    }

    /**
     * Clone a region, with fresh arguments.
     *
     * @param region The region.
     * @return The clone.
     */
    public Region cloneRegion(Region region) {
        Region copy = new Region();
        for (Var arg : region.getArgs()) {
            copy.getArgs().add(fresh(arg));
        }
        for (Effect effect : region.getEffects()) {
            copy.addEffect(clone(effect));
        }
        return copy;
    }

    private Var fresh(Var old) {
        Var copy = func.newVar(old.name, old.type);
        varMap.put(old, copy);
        return copy;
    }

    private List<Var> mapAll(List<Var> vars) {
        List<Var> ret = new ArrayList<>(vars.size());
        for (Var var : vars) {
            ret.add(map(var));
        }
        return ret;
    }
}
