package io.github.eutro.mdsl2ir.types;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Utilities for working with {@link Type}s.
 */
public final class Types {
    private static final Map<String, ScalarType> BY_NAME = new LinkedHashMap<>();

    static {
        for (ScalarType ty : new ScalarType[]{
                ScalarType.F64,
                ScalarType.F32,
                ScalarType.SI64,
                ScalarType.SI32,
                ScalarType.SI8,
                ScalarType.UI64,
                ScalarType.UI32,
                ScalarType.UI8,
                ScalarType.STR,
                ScalarType.BOOL,
                ScalarType.INDEX,
        }) {
            BY_NAME.put(ty.name, ty);
        }
    }

    private Types() {
    }

    /**
     * Look up a scalar type by its source-level name, such as {@code f64} or {@code si64}.
     *
     * @param name The name.
     * @return The type, or null if there is no type with that name.
     */
    public static @Nullable ScalarType byName(String name) {
        return BY_NAME.get(name);
    }

    /**
     * Get the names of all scalar types, in a fixed order.
     *
     * @return The names.
     */
    public static Set<String> scalarTypeNames() {
        return Collections.unmodifiableSet(BY_NAME.keySet());
    }

    /**
     * The matrix type with the value type of {@code ty} as its element type.
     * Matrices are returned unchanged.
     *
     * @param ty The type.
     * @return The matrix type.
     */
    public static MatrixType matrixOf(Type ty) {
        if (ty instanceof MatrixType) return (MatrixType) ty;
        return new MatrixType(valueTypeOf(ty));
    }

    /**
     * The value type of a type: the element type of matrices, the most general
     * column type of frames, and scalars themselves.
     *
     * @param ty The type.
     * @return The value type.
     */
    public static Type valueTypeOf(Type ty) {
        if (ty instanceof MatrixType) return ((MatrixType) ty).elementType;
        if (ty instanceof FrameType) {
            List<Type> cols = ((FrameType) ty).columnTypes;
            return cols.isEmpty() ? UnknownType.INSTANCE : mostGeneral(cols);
        }
        return ty;
    }

    public static boolean isScalar(Type ty) {
        return ty instanceof ScalarType;
    }

    /**
     * Find the most general value type of the given types, by the order
     * {@code bool < ui8 < ui32 < ui64 < si8 < si32 < si64 < f32 < f64 < str}.
     * <p>
     * If any of the types is unknown, so is the result. Data object types
     * contribute their value types. The index type is treated as {@code si64}.
     *
     * @param types The types, must not be empty.
     * @return The most general value type.
     */
    public static Type mostGeneral(Collection<? extends Type> types) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("no types given");
        }
        ScalarType best = null;
        for (Type ty : types) {
            Type vt = valueTypeOf(ty);
            if (vt.isUnknown()) return UnknownType.INSTANCE;
            ScalarType st = (ScalarType) vt;
            if (st == ScalarType.INDEX) st = ScalarType.SI64;
            if (best == null || st.generality > best.generality) {
                best = st;
            }
        }
        return best;
    }

    public static Type mostGeneral(Type... types) {
        return mostGeneral(Arrays.asList(types));
    }

    /**
     * Compare two types, treating unknown types as equal to anything.
     * <p>
     * Matrices are compared by element type and frames column by column, both unknown-aware.
     *
     * @param a The first type.
     * @param b The second type.
     * @return Whether the types may be the same.
     */
    public static boolean equalUnknownAware(Type a, Type b) {
        if (a.isUnknown() || b.isUnknown()) return true;
        if (a instanceof MatrixType && b instanceof MatrixType) {
            return equalUnknownAware(((MatrixType) a).elementType, ((MatrixType) b).elementType);
        }
        if (a instanceof FrameType && b instanceof FrameType) {
            List<Type> ac = ((FrameType) a).columnTypes;
            List<Type> bc = ((FrameType) b).columnTypes;
            if (ac.size() != bc.size()) return false;
            for (int i = 0; i < ac.size(); i++) {
                if (!equalUnknownAware(ac.get(i), bc.get(i))) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Whether an argument of type {@code arg} may be passed for a parameter of type {@code param}:
     * the types are equal, either is unknown, or both are matrices and
     * at least one has an unknown element type.
     *
     * @param param The parameter type.
     * @param arg   The argument type.
     * @return Whether they are compatible.
     */
    public static boolean isCompatible(Type param, Type arg) {
        if (param.equals(arg) || param.isUnknown() || arg.isUnknown()) return true;
        if (param instanceof MatrixType && arg instanceof MatrixType) {
            return ((MatrixType) param).elementType.isUnknown()
                    || ((MatrixType) arg).elementType.isUnknown();
        }
        return false;
    }
}
