package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Expr;
import io.github.eutro.mdsl2ir.ast.Indexing;
import io.github.eutro.mdsl2ir.ast.Range;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ops.Op;
import io.github.eutro.mdsl2ir.ssa.IRBuilder;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import io.github.eutro.mdsl2ir.ssa.Var;
import io.github.eutro.mdsl2ir.types.FrameType;
import io.github.eutro.mdsl2ir.types.ScalarType;
import io.github.eutro.mdsl2ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * Lowers indexing into data objects, both reading ({@code X[i, j]}) and writing ({@code X[i, j] = v}).
 * <p>
 * Positions are half-open ranges: a single numeric position {@code p} selects {@code [p, p + 1)}.
 */
final class IndexingLowering {
    enum Dim {
        ROW(DslOps.EXTRACT_ROW, DslOps.SLICE_ROW, DslOps.INSERT_ROW, DslOps.NUM_ROWS, DslOps.FILTER_ROW),
        COL(DslOps.EXTRACT_COL, DslOps.SLICE_COL, DslOps.INSERT_COL, DslOps.NUM_COLS, DslOps.FILTER_COL),
        ;

        final Op extract;
        final Op slice;
        final Op insert;
        final Op num;
        final Op filter;

        Dim(Op extract, Op slice, Op insert, Op num, Op filter) {
            this.extract = extract;
            this.slice = slice;
            this.insert = insert;
            this.num = num;
            this.filter = filter;
        }
    }

    /**
     * An evaluated axis of an indexing: either a single position, or a range whose bounds
     * may be omitted.
     */
    static final class Axis {
        final @Nullable Var pos;
        final @Nullable Var lower;
        final @Nullable Var upper;

        Axis(@Nullable Var pos, @Nullable Var lower, @Nullable Var upper) {
            this.pos = pos;
            this.lower = lower;
            this.upper = upper;
        }
    }

    private final ScriptTranslator t;

    IndexingLowering(ScriptTranslator t) {
        this.t = t;
    }

    private @Nullable Axis evaluate(@Nullable Range range) {
        if (range == null) return null;
        if (!range.isRange()) {
            return new Axis(t.visitValue(range.pos), null, null);
        }
        if (range.lower == null && range.upper == null) return null;
        return new Axis(
                null,
                range.lower == null ? null : t.visitValue(range.lower),
                range.upper == null ? null : t.visitValue(range.upper));
    }

    Var rightIndex(Expr.RightIndex expr) {
        Var obj = t.visitValue(expr.obj);
        Axis rows = evaluate(expr.indexing.rows);
        Axis cols = evaluate(expr.indexing.cols);
        if (rows != null) {
            obj = applyRight(Dim.ROW, obj, rows, false, expr.location);
        }
        if (cols != null) {
            obj = applyRight(Dim.COL, obj, cols, obj.type instanceof FrameType, expr.location);
        }
        return obj;
    }

    Var rightFilter(Expr.RightFilter expr) {
        Var obj = t.visitValue(expr.obj);
        if (expr.rows != null) {
            Var rows = t.visitValue(expr.rows);
            obj = t.builder.insert(Dim.ROW.filter.insn(obj, rows), "filtered", obj.type);
        }
        if (expr.cols != null) {
            Var cols = t.visitValue(expr.cols);
            obj = t.builder.insert(Dim.COL.filter.insn(obj, cols), "filtered", obj.type);
        }
        return obj;
    }

    /**
     * Lower an assignment into part of a variable.
     *
     * @param name     The name of the variable.
     * @param obj      The current value of the variable.
     * @param indexing The indexing on the left hand side.
     * @param ins      The value being assigned.
     * @param location The location of the assignment.
     * @return The new value of the variable.
     */
    Var leftIndex(String name, Var obj, Indexing indexing, Var ins, SourceLocation location) {
        Axis rows = evaluate(indexing.rows);
        Axis cols = evaluate(indexing.cols);
        if (rows != null && cols != null) {
            // update the rows, then put them back
            Var rowSeg = applyRight(Dim.ROW, obj, rows, false, location);
            rowSeg = applyLeft(Dim.COL, name, rowSeg, cols, ins, obj.type instanceof FrameType, location);
            return applyLeft(Dim.ROW, name, obj, rows, rowSeg, false, location);
        } else if (rows != null) {
            return applyLeft(Dim.ROW, name, obj, rows, ins, false, location);
        } else if (cols != null) {
            return applyLeft(Dim.COL, name, obj, cols, ins, obj.type instanceof FrameType, location);
        }
        return t.renameIf(ins, name);
    }

    private Var applyRight(Dim dim, Var obj, Axis axis, boolean allowLabel, SourceLocation location) {
        IRBuilder ib = t.builder;
        Type resultType = TypeInference.selection(obj.type, dim == Dim.ROW);
        if (axis.pos != null) {
            Var pos = axis.pos;
            if (pos.type.isDataObject()) {
                return ib.insert(dim.extract.insn(obj, pos), "extracted", resultType);
            }
            if (ScalarType.STR.equals(pos.type)) {
                if (!allowLabel) {
                    throw TranslationException.of(
                            TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                            location,
                            "cannot use right indexing with label in this case");
                }
                return ib.insert(dim.extract.insn(obj, pos), "extracted", resultType);
            }
            Var lo = t.castIf(ScalarType.SI64, pos);
            Var hi = ib.insert(
                    DslOps.EW_ADD.insn(lo, ib.constant(1L, ScalarType.SI64)),
                    "upper",
                    ScalarType.SI64);
            return ib.insert(dim.slice.insn(obj, lo, hi), "sliced", resultType);
        }
        Var lo = t.castIf(ScalarType.SI64, lower(axis));
        Var hi = t.castIf(ScalarType.SI64, upper(dim, obj, axis));
        return ib.insert(dim.slice.insn(obj, lo, hi), "sliced", resultType);
    }

    private Var applyLeft(Dim dim, String name, Var obj, Axis axis, Var ins, boolean allowLabel, SourceLocation location) {
        IRBuilder ib = t.builder;
        Var lo;
        Var hi;
        if (axis.pos != null) {
            Var pos = axis.pos;
            if (pos.type.isDataObject()) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        location,
                        "left indexing with positions as a data object is not supported");
            }
            if (ScalarType.STR.equals(pos.type)) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        location,
                        allowLabel
                                ? "left indexing by label is not supported"
                                : "cannot use left indexing with label in this case");
            }
            lo = t.castIf(ScalarType.SI64, pos);
            hi = ib.insert(
                    DslOps.EW_ADD.insn(lo, ib.constant(1L, ScalarType.SI64)),
                    "upper",
                    ScalarType.SI64);
        } else {
            lo = t.castIf(ScalarType.SI64, lower(axis));
            hi = t.castIf(ScalarType.SI64, upper(dim, obj, axis));
        }
        return ib.insert(dim.insert.insn(obj, ins, lo, hi), name, obj.type);
    }

    private Var lower(Axis axis) {
        return axis.lower != null ? axis.lower : t.builder.constant(0L, ScalarType.SI64);
    }

    private Var upper(Dim dim, Var obj, Axis axis) {
        return axis.upper != null
                ? axis.upper
                : t.builder.insert(dim.num.insn(obj), "extent", ScalarType.SIZE);
    }
}
