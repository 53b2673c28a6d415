package io.github.eutro.mdsl2ir.passes.misc;

import io.github.eutro.mdsl2ir.passes.InPlaceIRPass;
import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.Module;

import java.util.ArrayList;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift an in-place function pass to run on every function of a module, in order.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static InPlaceIRPass<Module> liftFunctions(InPlaceIRPass<Function> pass) {
        return module -> {
            for (Function func : new ArrayList<>(module.getFunctions())) {
                pass.runInPlace(func);
            }
        };
    }

    /**
     * Lift an in-place function pass to run on the entry function of a module only.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static InPlaceIRPass<Module> liftMain(InPlaceIRPass<Function> pass) {
        return module -> pass.runInPlace(module.getMain());
    }
}
