/**
 * This package defines the intermediate representation (IR) that scripts are translated into.
 * <p>
 * The IR is structured: instead of basic blocks and jumps, control flow is expressed by
 * operations holding {@link io.github.eutro.mdsl2ir.ssa.Region regions}, such as conditionals
 * and loops. Values flow into a region through its arguments and the operands of its owning
 * effect, and out of it through its terminator, which become the results of the owning effect.
 * <p>
 * The IR is in static single assignment form (SSA). That is, each
 * {@link io.github.eutro.mdsl2ir.ssa.Var} is assigned to by <i>exactly</i> one
 * {@link io.github.eutro.mdsl2ir.ssa.Effect}, or is the argument of exactly one region,
 * and is only used after its definition in the same region or a region nested in it.
 * <p>
 * Functions are aggregated in a {@link io.github.eutro.mdsl2ir.ssa.Module}, whose entry function
 * holds the top-level operations of a script.
 */
package io.github.eutro.mdsl2ir.ssa;
