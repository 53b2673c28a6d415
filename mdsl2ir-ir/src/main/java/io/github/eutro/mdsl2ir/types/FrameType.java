package io.github.eutro.mdsl2ir.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A frame, a table of columns each with their own element type.
 */
public final class FrameType extends Type {
    public final List<Type> columnTypes;

    public FrameType(List<Type> columnTypes) {
        this.columnTypes = Collections.unmodifiableList(new ArrayList<>(columnTypes));
    }

    @Override
    public boolean isDataObject() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return columnTypes.equals(((FrameType) o).columnTypes);
    }

    @Override
    public int hashCode() {
        return columnTypes.hashCode() * 31 + 7;
    }

    @Override
    public String toString() {
        return columnTypes.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "frame<[", "]>"));
    }
}
