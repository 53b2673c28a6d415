package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ops.Op;
import io.github.eutro.mdsl2ir.types.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Result type rules for the operations the translator emits.
 */
final class TypeInference {
    private static final Set<Op> BOOLEAN_OPS = new HashSet<>(Arrays.asList(
            DslOps.EW_EQ,
            DslOps.EW_NEQ,
            DslOps.EW_LT,
            DslOps.EW_LE,
            DslOps.EW_GT,
            DslOps.EW_GE,
            DslOps.EW_AND,
            DslOps.EW_OR
    ));

    private TypeInference() {
    }

    /**
     * The result type of an element-wise binary operation.
     * <p>
     * Frames and unknown operands give unknown results. Otherwise the value type is the
     * most general of the operands', in a matrix if either operand is one. Scalar comparisons
     * and logical operations give {@code bool}.
     *
     * @param op  The operation.
     * @param lhs The type of the left operand.
     * @param rhs The type of the right operand.
     * @return The result type.
     */
    static Type elementWise(Op op, Type lhs, Type rhs) {
        if (lhs.isUnknown() || rhs.isUnknown()) return UnknownType.INSTANCE;
        if (lhs instanceof FrameType || rhs instanceof FrameType) return UnknownType.INSTANCE;
        Type vt = Types.mostGeneral(lhs, rhs);
        if (lhs instanceof MatrixType || rhs instanceof MatrixType) {
            return new MatrixType(vt);
        }
        return BOOLEAN_OPS.contains(op) ? ScalarType.BOOL : vt;
    }

    static Type conditional(Type cond, Type thenType, Type elseType) {
        if (cond.isUnknown()) return UnknownType.INSTANCE;
        if (cond instanceof MatrixType) {
            return new MatrixType(Types.mostGeneral(thenType, elseType));
        }
        if (thenType.equals(elseType)) return thenType;
        if (Types.isScalar(thenType) && Types.isScalar(elseType)) {
            return Types.mostGeneral(thenType, elseType);
        }
        return UnknownType.INSTANCE;
    }

    /**
     * The type of a row or column taken out of a data object.
     * <p>
     * Selecting columns of a frame changes its schema, which is not tracked.
     *
     * @param obj   The type of the object.
     * @param byRow Whether rows are selected.
     * @return The result type.
     */
    static Type selection(Type obj, boolean byRow) {
        if (!obj.isDataObject()) return UnknownType.INSTANCE;
        if (byRow || obj instanceof MatrixType) return obj;
        return UnknownType.INSTANCE;
    }
}
