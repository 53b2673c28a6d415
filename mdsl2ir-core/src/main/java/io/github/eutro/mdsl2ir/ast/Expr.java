package io.github.eutro.mdsl2ir.ast;

import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An expression node. The {@link #kind} determines which subclass a node is.
 */
public abstract class Expr {
    public enum Kind {
        LITERAL,
        ARG,
        IDENTIFIER,
        CALL,
        CAST,
        RIGHT_INDEX,
        RIGHT_FILTER,
        UNARY,
        BINARY,
        TERNARY,
        MATRIX_LITERAL,
        COL_MAJOR_FRAME,
        ROW_MAJOR_FRAME,
    }

    public final Kind kind;
    public final SourceLocation location;

    Expr(Kind kind, SourceLocation location) {
        this.kind = kind;
        this.location = location;
    }

    private static <T> List<T> copy(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    public enum LiteralKind {
        INT,
        FLOAT,
        BOOL,
        STRING,
    }

    /**
     * A literal, with its text as written in the source (strings still quoted and escaped).
     */
    public static final class Literal extends Expr {
        public final LiteralKind literalKind;
        public final String text;

        public Literal(SourceLocation location, LiteralKind literalKind, String text) {
            super(Kind.LITERAL, location);
            this.literalKind = literalKind;
            this.text = text;
        }
    }

    /**
     * A reference to a script argument, {@code $name}.
     */
    public static final class Arg extends Expr {
        public final String name;

        public Arg(SourceLocation location, String name) {
            super(Kind.ARG, location);
            this.name = name;
        }
    }

    /**
     * A variable reference. Names of imported variables contain dots.
     */
    public static final class Identifier extends Expr {
        public final String name;

        public Identifier(SourceLocation location, String name) {
            super(Kind.IDENTIFIER, location);
            this.name = name;
        }
    }

    public static final class Call extends Expr {
        public final String name;
        public final List<Expr> args;
        public final @Nullable String kernelHint;

        public Call(SourceLocation location, String name, List<Expr> args, @Nullable String kernelHint) {
            super(Kind.CALL, location);
            this.name = name;
            this.args = copy(args);
            this.kernelHint = kernelHint;
        }
    }

    /**
     * {@code as.dataType<valueType>(arg)}, {@code as.dataType(arg)} or {@code as.valueType(arg)}.
     */
    public static final class Cast extends Expr {
        public final @Nullable String dataType;
        public final @Nullable String valueType;
        public final Expr arg;

        public Cast(SourceLocation location, @Nullable String dataType, @Nullable String valueType, Expr arg) {
            super(Kind.CAST, location);
            this.dataType = dataType;
            this.valueType = valueType;
            this.arg = arg;
        }
    }

    /**
     * {@code obj[rows, cols]}.
     */
    public static final class RightIndex extends Expr {
        public final Expr obj;
        public final Indexing indexing;

        public RightIndex(SourceLocation location, Expr obj, Indexing indexing) {
            super(Kind.RIGHT_INDEX, location);
            this.obj = obj;
            this.indexing = indexing;
        }
    }

    /**
     * {@code obj[[rows, cols]]}, selecting by bitmaps.
     */
    public static final class RightFilter extends Expr {
        public final Expr obj;
        public final @Nullable Expr rows;
        public final @Nullable Expr cols;

        public RightFilter(SourceLocation location, Expr obj, @Nullable Expr rows, @Nullable Expr cols) {
            super(Kind.RIGHT_FILTER, location);
            this.obj = obj;
            this.rows = rows;
            this.cols = cols;
        }
    }

    public static final class Unary extends Expr {
        public final String op;
        public final Expr arg;

        public Unary(SourceLocation location, String op, Expr arg) {
            super(Kind.UNARY, location);
            this.op = op;
            this.arg = arg;
        }
    }

    public static final class Binary extends Expr {
        public final String op;
        public final Expr lhs;
        public final Expr rhs;
        public final @Nullable String kernelHint;

        public Binary(SourceLocation location, String op, Expr lhs, Expr rhs, @Nullable String kernelHint) {
            super(Kind.BINARY, location);
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
            this.kernelHint = kernelHint;
        }
    }

    public static final class Ternary extends Expr {
        public final Expr cond;
        public final Expr thenExpr;
        public final Expr elseExpr;

        public Ternary(SourceLocation location, Expr cond, Expr thenExpr, Expr elseExpr) {
            super(Kind.TERNARY, location);
            this.cond = cond;
            this.thenExpr = thenExpr;
            this.elseExpr = elseExpr;
        }
    }

    /**
     * {@code [e0, e1, ...](rows, cols)}, elements in row-major order.
     */
    public static final class MatrixLiteral extends Expr {
        public final List<Expr> elements;
        public final @Nullable Expr rows;
        public final @Nullable Expr cols;

        public MatrixLiteral(SourceLocation location, List<Expr> elements, @Nullable Expr rows, @Nullable Expr cols) {
            super(Kind.MATRIX_LITERAL, location);
            this.elements = copy(elements);
            this.rows = rows;
            this.cols = cols;
        }
    }

    /**
     * {@code {"a": colA, "b": colB}}.
     */
    public static final class ColMajorFrame extends Expr {
        public final List<Expr> labels;
        public final List<Expr> columns;

        public ColMajorFrame(SourceLocation location, List<Expr> labels, List<Expr> columns) {
            super(Kind.COL_MAJOR_FRAME, location);
            this.labels = copy(labels);
            this.columns = copy(columns);
        }
    }

    /**
     * {@code {["a", "b"], [a0, b0], [a1, b1]}}.
     */
    public static final class RowMajorFrame extends Expr {
        public final List<Expr> labels;
        public final List<List<Expr>> rows;

        public RowMajorFrame(SourceLocation location, List<Expr> labels, List<List<Expr>> rows) {
            super(Kind.ROW_MAJOR_FRAME, location);
            this.labels = copy(labels);
            List<List<Expr>> rowsCopy = new ArrayList<>();
            for (List<Expr> row : rows) {
                rowsCopy.add(copy(row));
            }
            this.rows = Collections.unmodifiableList(rowsCopy);
        }

        public RowMajorFrame(SourceLocation location, List<Expr> labels, Expr[]... rows) {
            this(location, labels, toLists(rows));
        }

        private static List<List<Expr>> toLists(Expr[][] rows) {
            List<List<Expr>> ret = new ArrayList<>();
            for (Expr[] row : rows) {
                ret.add(Arrays.asList(row));
            }
            return ret;
        }
    }
}
