package io.github.eutro.mdsl2ir.ops;

import io.github.eutro.mdsl2ir.ext.CommonExts;

/**
 * Structured control flow operations.
 * <p>
 * The results of each of these are the values passed by the terminators of its regions.
 */
public class ScfOps {
    /**
     * Effect: conditional.
     * <p>
     * Operands: the {@code bool} condition. Regions: the then region, and optionally the else region,
     * both without arguments and terminated by {@link #YIELD}. If there is no else region,
     * the conditional has no results.
     */
    public static final RegionOpKey IF = new RegionOpKey("if", 1, 2);

    /**
     * Effect: while loop.
     * <p>
     * Operands: the initial values of the loop-carried variables. Regions: the "before" region,
     * which takes the current loop-carried values and is terminated by {@link #CONDITION},
     * and the "after" region, which takes the values forwarded by the condition and is terminated by
     * {@link #YIELD} with the next loop-carried values. The results are the values forwarded by
     * the condition when it is false.
     */
    public static final RegionOpKey WHILE = new RegionOpKey("while", 2);

    /**
     * Effect: counted loop over {@code [lb, ub)} with a positive step.
     * <p>
     * Operands: {@code lb}, {@code ub}, {@code step}, all {@code index}, and the initial values of the
     * loop-carried variables. Regions: the body, taking the induction variable and the current
     * loop-carried values, terminated by {@link #YIELD} with the next ones.
     */
    public static final RegionOpKey FOR = new RegionOpKey("for", 1);

    /**
     * Effect: parallel counted loop over {@code [lb, ub)}.
     * <p>
     * Operands: {@code lb}, {@code ub}, {@code step}, all {@code si64}, followed by the captured values:
     * the values of the updated variables before the loop, then every other value from outside
     * used by the body. Regions: the body, taking the {@code index} induction variable and then one
     * argument for each captured value, terminated by {@link CommonOps#RETURN} with the values of the
     * updated variables. The body uses no values from outside it.
     */
    public static final RegionOpKey PARFOR = new RegionOpKey("parfor", 1);

    /**
     * Terminator: passes its arguments to the operation owning the region.
     */
    public static final Op YIELD = new SimpleOpKey("yield").create();

    /**
     * Terminator of the "before" region of a {@link #WHILE}: a {@code bool} condition, followed by
     * the values forwarded to the "after" region, or to the results if the condition is false.
     */
    public static final Op CONDITION = new SimpleOpKey("condition").create();

    static {
        CommonExts.markTerminator(YIELD.key);
        CommonExts.markTerminator(CONDITION.key);
    }
}
