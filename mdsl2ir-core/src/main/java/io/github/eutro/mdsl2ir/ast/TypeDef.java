package io.github.eutro.mdsl2ir.ast;

import org.jetbrains.annotations.Nullable;

/**
 * A type annotation of a function parameter or result: {@code matrix}, {@code matrix<f64>},
 * {@code frame}, or a bare value type such as {@code si64}.
 */
public final class TypeDef {
    public final @Nullable String dataType;
    public final @Nullable String valueType;

    public TypeDef(@Nullable String dataType, @Nullable String valueType) {
        this.dataType = dataType;
        this.valueType = valueType;
    }

    @Override
    public String toString() {
        if (dataType == null) return String.valueOf(valueType);
        return valueType == null ? dataType : dataType + "<" + valueType + ">";
    }
}
