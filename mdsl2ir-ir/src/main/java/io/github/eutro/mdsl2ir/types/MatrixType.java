package io.github.eutro.mdsl2ir.types;

import java.util.Objects;

/**
 * A matrix with elements of a given type, which may be {@link UnknownType unknown}.
 */
public final class MatrixType extends Type {
    public static final MatrixType UNKNOWN = new MatrixType(UnknownType.INSTANCE);

    public final Type elementType;

    public MatrixType(Type elementType) {
        if (elementType.isDataObject()) {
            throw new IllegalArgumentException("matrix element type must be a scalar, got " + elementType);
        }
        this.elementType = elementType;
    }

    @Override
    public boolean isDataObject() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elementType.equals(((MatrixType) o).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MatrixType.class, elementType);
    }

    @Override
    public String toString() {
        return "matrix<" + elementType + ">";
    }
}
