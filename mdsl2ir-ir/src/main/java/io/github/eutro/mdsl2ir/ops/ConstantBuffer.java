package io.github.eutro.mdsl2ir.ops;

import io.github.eutro.mdsl2ir.types.ScalarType;

import java.util.Arrays;
import java.util.Objects;

/**
 * The backing storage of a constant matrix, a flat array of elements of a single scalar type.
 * <p>
 * Integers of any width are stored as {@code long}s, unsigned ones reinterpreted.
 */
public final class ConstantBuffer {
    public final ScalarType elementType;
    private final Object data;
    private final int size;

    private ConstantBuffer(ScalarType elementType, int size) {
        this.elementType = elementType;
        this.size = size;
        switch (elementType.kind) {
            case BOOL:
                data = new boolean[size];
                break;
            case SIGNED:
            case UNSIGNED:
            case INDEX:
                data = new long[size];
                break;
            case FLOAT:
                data = elementType.width == 32 ? new float[size] : new double[size];
                break;
            case STRING: {
                String[] strs = new String[size];
                Arrays.fill(strs, "");
                data = strs;
                break;
            }
            default:
                throw new IllegalArgumentException("unsupported element type " + elementType);
        }
    }

    /**
     * Allocate a zero-filled buffer. Strings are filled with the empty string.
     *
     * @param elementType The element type.
     * @param size        The number of elements.
     * @return The buffer.
     */
    public static ConstantBuffer allocate(ScalarType elementType, int size) {
        return new ConstantBuffer(elementType, size);
    }

    public int size() {
        return size;
    }

    /**
     * Store a value, converting it from its type to the element type of this buffer.
     *
     * @param i         The index.
     * @param value     The value, as held by a constant instruction.
     * @param valueType The type of the value.
     */
    public void set(int i, Object value, ScalarType valueType) {
        switch (elementType.kind) {
            case BOOL:
                ((boolean[]) data)[i] = toBoolean(value);
                break;
            case SIGNED:
            case UNSIGNED:
            case INDEX:
                ((long[]) data)[i] = toLong(value);
                break;
            case FLOAT:
                if (data instanceof float[]) {
                    ((float[]) data)[i] = (float) toDouble(value, valueType);
                } else {
                    ((double[]) data)[i] = toDouble(value, valueType);
                }
                break;
            case STRING:
                ((String[]) data)[i] = toStr(value, valueType);
                break;
            default:
                throw new IllegalStateException();
        }
    }

    /**
     * Get an element, boxed the way a constant instruction would hold it.
     *
     * @param i The index.
     * @return The element.
     */
    public Object get(int i) {
        if (data instanceof boolean[]) return ((boolean[]) data)[i];
        if (data instanceof long[]) return ((long[]) data)[i];
        if (data instanceof float[]) return ((float[]) data)[i];
        if (data instanceof double[]) return ((double[]) data)[i];
        return ((String[]) data)[i];
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0;
        throw new IllegalArgumentException("cannot store " + value + " as bool");
    }

    private static long toLong(Object value) {
        if (value instanceof Boolean) return (Boolean) value ? 1 : 0;
        if (value instanceof Number) return ((Number) value).longValue();
        throw new IllegalArgumentException("cannot store " + value + " as integer");
    }

    private static double toDouble(Object value, ScalarType valueType) {
        if (value instanceof Boolean) return (Boolean) value ? 1 : 0;
        if (value instanceof Long && valueType.kind == ScalarType.Kind.UNSIGNED) {
            long l = (Long) value;
            return l >= 0 ? l : Double.parseDouble(Long.toUnsignedString(l));
        }
        if (value instanceof Number) return ((Number) value).doubleValue();
        throw new IllegalArgumentException("cannot store " + value + " as floating point");
    }

    private static String toStr(Object value, ScalarType valueType) {
        if (value instanceof Long && valueType.kind == ScalarType.Kind.UNSIGNED) {
            return Long.toUnsignedString((Long) value);
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstantBuffer that = (ConstantBuffer) o;
        return elementType == that.elementType
                && Objects.deepEquals(new Object[]{data}, new Object[]{that.data});
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(new Object[]{elementType, data});
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(elementType).append('[');
        for (int i = 0; i < size; i++) {
            if (i != 0) sb.append(", ");
            Object elt = get(i);
            if (elt instanceof String) {
                sb.append('"').append(elt).append('"');
            } else if (elt instanceof Long && elementType.kind == ScalarType.Kind.UNSIGNED) {
                sb.append(Long.toUnsignedString((Long) elt));
            } else {
                sb.append(elt);
            }
        }
        return sb.append(']').toString();
    }
}
