package io.github.eutro.mdsl2ir.ops;

import io.github.eutro.mdsl2ir.ext.CommonExts;

/**
 * Operations on scalars, matrices and frames.
 * <p>
 * Positions and bounds are zero-based, ranges are half-open. The result types are those of the
 * variables the instructions are assigned to.
 */
public class DslOps {
    // element-wise binary: lhs, rhs
    public static final Op EW_ADD = new SimpleOpKey("ew_add").create();
    public static final Op EW_SUB = new SimpleOpKey("ew_sub").create();
    public static final Op EW_MUL = new SimpleOpKey("ew_mul").create();
    public static final Op EW_DIV = new SimpleOpKey("ew_div").create();
    public static final Op EW_POW = new SimpleOpKey("ew_pow").create();
    public static final Op EW_MOD = new SimpleOpKey("ew_mod").create();
    public static final Op EW_EQ = new SimpleOpKey("ew_eq").create();
    public static final Op EW_NEQ = new SimpleOpKey("ew_neq").create();
    public static final Op EW_LT = new SimpleOpKey("ew_lt").create();
    public static final Op EW_LE = new SimpleOpKey("ew_le").create();
    public static final Op EW_GT = new SimpleOpKey("ew_gt").create();
    public static final Op EW_GE = new SimpleOpKey("ew_ge").create();
    public static final Op EW_AND = new SimpleOpKey("ew_and").create();
    public static final Op EW_OR = new SimpleOpKey("ew_or").create();

    // element-wise unary: arg
    public static final Op EW_MINUS = new SimpleOpKey("ew_minus").create();
    public static final Op EW_SIGN = new SimpleOpKey("ew_sign").create();

    /**
     * Matrix multiplication: lhs, rhs, transpose lhs ({@code bool}), transpose rhs ({@code bool}).
     */
    public static final Op MAT_MUL = new SimpleOpKey("matmul").create();
    /**
     * Element-wise selection: condition, then value, else value.
     */
    public static final Op COND = new SimpleOpKey("cond").create();
    /**
     * Conversion of the argument to the result type.
     */
    public static final Op CAST = new SimpleOpKey("cast").create();

    /**
     * Gather: object, positions (a matrix of positions, or a label for frame columns).
     */
    public static final Op EXTRACT_ROW = new SimpleOpKey("extract_row").create();
    public static final Op EXTRACT_COL = new SimpleOpKey("extract_col").create();
    /**
     * Slice: object, lower bound, upper bound.
     */
    public static final Op SLICE_ROW = new SimpleOpKey("slice_row").create();
    public static final Op SLICE_COL = new SimpleOpKey("slice_col").create();
    /**
     * Copy with a slice replaced: object, inserted object, lower bound, upper bound.
     */
    public static final Op INSERT_ROW = new SimpleOpKey("insert_row").create();
    public static final Op INSERT_COL = new SimpleOpKey("insert_col").create();
    /**
     * Filter: object, a bitmap of which rows (columns) to keep.
     */
    public static final Op FILTER_ROW = new SimpleOpKey("filter_row").create();
    public static final Op FILTER_COL = new SimpleOpKey("filter_col").create();
    public static final Op NUM_ROWS = new SimpleOpKey("num_rows").create();
    public static final Op NUM_COLS = new SimpleOpKey("num_cols").create();

    /**
     * A column matrix holding the elements of the buffer.
     */
    public static final UnaryOpKey<ConstantBuffer> MATRIX_CONSTANT = new UnaryOpKey<>("matrix_constant");
    /**
     * Reshape: object, rows, columns.
     */
    public static final Op RESHAPE = new SimpleOpKey("reshape").create();
    /**
     * A frame from columns and labels: n column matrices, followed by n string labels.
     */
    public static final Op CREATE_FRAME = new SimpleOpKey("create_frame").create();

    /**
     * Call of a user-defined function, by its unique symbol in the module.
     */
    public static final UnaryOpKey<String> CALL = new UnaryOpKey<>("call", sym -> "@" + sym);
    /**
     * Call of a built-in operation, by name.
     */
    public static final UnaryOpKey<String> BUILTIN = new UnaryOpKey<>("builtin");

    static {
        for (OpKey key : new OpKey[]{
                EW_ADD.key, EW_SUB.key, EW_MUL.key, EW_DIV.key, EW_POW.key, EW_MOD.key,
                EW_EQ.key, EW_NEQ.key, EW_LT.key, EW_LE.key, EW_GT.key, EW_GE.key,
                EW_AND.key, EW_OR.key, EW_MINUS.key, EW_SIGN.key,
                MAT_MUL.key, COND.key, CAST.key,
                EXTRACT_ROW.key, EXTRACT_COL.key, SLICE_ROW.key, SLICE_COL.key,
                INSERT_ROW.key, INSERT_COL.key, FILTER_ROW.key, FILTER_COL.key,
                NUM_ROWS.key, NUM_COLS.key,
                MATRIX_CONSTANT, RESHAPE.key, CREATE_FRAME.key,
        }) {
            CommonExts.markPure(key);
        }
    }
}
