package io.github.eutro.mdsl2ir.types;

/**
 * A scalar value type, also used as the element type of matrices and frame columns.
 */
public final class ScalarType extends Type {
    // in order of generality
    public static final ScalarType BOOL = new ScalarType("bool", 0, Kind.BOOL, 1);
    public static final ScalarType UI8 = new ScalarType("ui8", 1, Kind.UNSIGNED, 8);
    public static final ScalarType UI32 = new ScalarType("ui32", 2, Kind.UNSIGNED, 32);
    public static final ScalarType UI64 = new ScalarType("ui64", 3, Kind.UNSIGNED, 64);
    public static final ScalarType SI8 = new ScalarType("si8", 4, Kind.SIGNED, 8);
    public static final ScalarType SI32 = new ScalarType("si32", 5, Kind.SIGNED, 32);
    public static final ScalarType SI64 = new ScalarType("si64", 6, Kind.SIGNED, 64);
    public static final ScalarType F32 = new ScalarType("f32", 7, Kind.FLOAT, 32);
    public static final ScalarType F64 = new ScalarType("f64", 8, Kind.FLOAT, 64);
    public static final ScalarType STR = new ScalarType("str", 9, Kind.STRING, 0);

    /**
     * The type of loop induction variables and positions.
     */
    public static final ScalarType INDEX = new ScalarType("index", -1, Kind.INDEX, 64);
    /**
     * The type of sizes, such as the {@code z} integer literal suffix.
     */
    public static final ScalarType SIZE = UI64;

    public enum Kind {
        BOOL,
        UNSIGNED,
        SIGNED,
        FLOAT,
        STRING,
        INDEX,
    }

    public final String name;
    public final int generality;
    public final Kind kind;
    public final int width;

    private ScalarType(String name, int generality, Kind kind, int width) {
        this.name = name;
        this.generality = generality;
        this.kind = kind;
        this.width = width;
    }

    public boolean isInteger() {
        return kind == Kind.SIGNED || kind == Kind.UNSIGNED || kind == Kind.INDEX;
    }

    public boolean isFloat() {
        return kind == Kind.FLOAT;
    }

    @Override
    public String toString() {
        return name;
    }
}
