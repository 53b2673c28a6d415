package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Expr;
import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.ConstantBuffer;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.IRBuilder;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import io.github.eutro.mdsl2ir.ssa.Var;
import io.github.eutro.mdsl2ir.types.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds matrices and frames from literals, baking the elements known at translation time
 * into a {@link ConstantBuffer} and inserting the rest afterwards.
 */
final class LiteralBuilder {
    private final ScriptTranslator t;

    LiteralBuilder(ScriptTranslator t) {
        this.t = t;
    }

    Var matrix(Expr.MatrixLiteral literal) {
        if (literal.elements.isEmpty()) {
            throw TranslationException.of(
                    TranslationError.Kind.INVALID_LITERAL,
                    literal.location,
                    "empty matrix literals are not supported");
        }
        IRBuilder ib = t.builder;
        List<Var> elements = new ArrayList<>(literal.elements.size());
        for (Expr element : literal.elements) {
            elements.add(t.visitValue(element));
        }
        long n = elements.size();

        Var rows;
        Var cols;
        if (literal.rows == null && literal.cols == null) {
            rows = ib.constant(n, ScalarType.SIZE);
            cols = ib.constant(1L, ScalarType.SIZE);
        } else if (literal.rows == null) {
            cols = t.castIf(ScalarType.SIZE, t.visitValue(literal.cols));
            rows = ib.insert(DslOps.EW_DIV.insn(ib.constant(n, ScalarType.SIZE), cols), "rows", ScalarType.SIZE);
        } else if (literal.cols == null) {
            rows = t.castIf(ScalarType.SIZE, t.visitValue(literal.rows));
            cols = ib.insert(DslOps.EW_DIV.insn(ib.constant(n, ScalarType.SIZE), rows), "cols", ScalarType.SIZE);
        } else {
            cols = t.castIf(ScalarType.SIZE, t.visitValue(literal.cols));
            rows = t.castIf(ScalarType.SIZE, t.visitValue(literal.rows));
        }

        ScalarType vt = elementType(elements, literal.location);
        Var column = buildColumn(elements, vt);
        return ib.insert(DslOps.RESHAPE.insn(column, rows, cols), "matrix", new MatrixType(vt));
    }

    Var colMajorFrame(Expr.ColMajorFrame literal) {
        if (literal.labels.size() != literal.columns.size()) {
            throw TranslationException.of(
                    TranslationError.Kind.INVALID_LITERAL,
                    literal.location,
                    "frame literals must have the same number of labels and columns, got %d labels and %d columns",
                    literal.labels.size(),
                    literal.columns.size());
        }
        if (literal.columns.isEmpty()) {
            throw TranslationException.of(
                    TranslationError.Kind.INVALID_LITERAL,
                    literal.location,
                    "empty frame literals are not supported");
        }
        List<Var> labels = new ArrayList<>();
        List<Var> columns = new ArrayList<>();
        List<Type> columnTypes = new ArrayList<>();
        for (int i = 0; i < literal.labels.size(); i++) {
            Var label = t.visitValue(literal.labels.get(i));
            if (!ScalarType.STR.equals(label.type)) {
                throw TranslationException.of(
                        TranslationError.Kind.INVALID_LITERAL,
                        literal.labels.get(i).location,
                        "labels of frame literals must be strings, got %s",
                        label.type);
            }
            Var column = t.visitValue(literal.columns.get(i));
            if (!(column.type instanceof MatrixType)) {
                throw TranslationException.of(
                        TranslationError.Kind.INVALID_LITERAL,
                        literal.columns.get(i).location,
                        "columns of frame literals must be matrices, got %s",
                        column.type);
            }
            labels.add(label);
            columns.add(column);
            columnTypes.add(((MatrixType) column.type).elementType);
        }
        return createFrame(columns, labels, columnTypes);
    }

    Var rowMajorFrame(Expr.RowMajorFrame literal) {
        List<Var> labels = new ArrayList<>();
        for (Expr labelExpr : literal.labels) {
            Var label = t.visitValue(labelExpr);
            if (!ScalarType.STR.equals(label.type)) {
                throw TranslationException.of(
                        TranslationError.Kind.INVALID_LITERAL,
                        labelExpr.location,
                        "labels of frame literals must be strings, got %s",
                        label.type);
            }
            labels.add(label);
        }
        if (labels.isEmpty() || literal.rows.isEmpty()) {
            throw TranslationException.of(
                    TranslationError.Kind.INVALID_LITERAL,
                    literal.location,
                    "empty frame literals are not supported");
        }

        List<List<Var>> columnValues = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            columnValues.add(new ArrayList<>());
        }
        for (List<Expr> row : literal.rows) {
            if (row.size() != labels.size()) {
                throw TranslationException.of(
                        TranslationError.Kind.INVALID_LITERAL,
                        literal.location,
                        "size of row does not match the amount of labels");
            }
            for (int i = 0; i < row.size(); i++) {
                columnValues.get(i).add(t.visitValue(row.get(i)));
            }
        }

        List<Var> columns = new ArrayList<>();
        List<Type> columnTypes = new ArrayList<>();
        for (List<Var> values : columnValues) {
            ScalarType vt = elementType(values, literal.location);
            columns.add(buildColumn(values, vt));
            columnTypes.add(vt);
        }
        return createFrame(columns, labels, columnTypes);
    }

    private Var createFrame(List<Var> columns, List<Var> labels, List<Type> columnTypes) {
        List<Var> operands = new ArrayList<>(columns);
        operands.addAll(labels);
        return t.builder.insert(DslOps.CREATE_FRAME.insn(operands), "frame", new FrameType(columnTypes));
    }

    /**
     * Find the element type of a literal: the most general type of its elements, which must all
     * be known scalars. String elements can only be mixed with other strings.
     */
    private static ScalarType elementType(List<Var> elements, SourceLocation location) {
        List<Type> types = new ArrayList<>(elements.size());
        for (Var element : elements) {
            if (!Types.isScalar(element.type)) {
                throw TranslationException.of(
                        TranslationError.Kind.INVALID_LITERAL,
                        location,
                        "matrix literal of invalid value type, elements must be scalars of a known type, got %s",
                        element.type);
            }
            types.add(element.type);
        }
        ScalarType vt = (ScalarType) Types.mostGeneral(types);
        if (vt == ScalarType.STR) {
            for (Type ty : types) {
                if (ty != ScalarType.STR) {
                    throw TranslationException.of(
                            TranslationError.Kind.INVALID_LITERAL,
                            location,
                            "matrix literal of invalid value type, cannot mix strings with %s",
                            ty);
                }
            }
        }
        return vt;
    }

    /**
     * Build a single-column matrix of the elements.
     *
     * @param elements The elements.
     * @param vt       The element type of the matrix.
     * @return The matrix.
     */
    private Var buildColumn(List<Var> elements, ScalarType vt) {
        IRBuilder ib = t.builder;
        ConstantBuffer buffer = ConstantBuffer.allocate(vt, elements.size());
        List<Integer> patches = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            Var element = elements.get(i);
            Object k = constantValue(element);
            if (k == null) {
                patches.add(i);
            } else {
                buffer.set(i, k, (ScalarType) element.type);
            }
        }

        MatrixType type = new MatrixType(vt);
        Var column = ib.insert(DslOps.MATRIX_CONSTANT.create(buffer).insn(), "column", type);
        for (int i : patches) {
            Var element = t.castIf(vt, elements.get(i));
            Var cell = ib.insert(DslOps.CAST.insn(element), "cell", type);
            Var lo = ib.constant((long) i, ScalarType.SI64);
            Var hi = ib.constant((long) i + 1, ScalarType.SI64);
            column = ib.insert(DslOps.INSERT_ROW.insn(column, cell, lo, hi), "column", type);
        }
        return column;
    }

    /**
     * Get the value of a variable known at translation time: a constant, or the negation of
     * a numeric constant.
     */
    private static @Nullable Object constantValue(Var var) {
        Object k = CommonOps.constantValue(var);
        if (k != null) return k;
        Effect fx = var.getNullable(CommonExts.ASSIGNED_AT);
        if (fx == null || fx.insn().op != DslOps.EW_MINUS) return null;
        Object negated = CommonOps.constantValue(fx.insn().args().get(0));
        if (negated instanceof Long) return -(Long) negated;
        if (negated instanceof Double) return -(Double) negated;
        if (negated instanceof Float) return -(Float) negated;
        return null;
    }
}
