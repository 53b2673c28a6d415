package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ext.Ext;
import io.github.eutro.mdsl2ir.ext.ExtHolder;
import io.github.eutro.mdsl2ir.ssa.display.IRPrinter;
import io.github.eutro.mdsl2ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A function, whose {@link #body} region takes the parameters as its arguments.
 */
public final class Function extends ExtHolder {
    /**
     * The name of the function in the source.
     */
    public final String name;
    /**
     * The name of the function in its {@link Module}, unique within it.
     */
    public final String symbol;
    public final Region body = new Region();
    /**
     * The types of the results of this function, in order.
     */
    public final List<Type> resultTypes = new ArrayList<>();

    Function(String name, String symbol) {
        this.name = name;
        this.symbol = symbol;
        body.attachExt(CommonExts.OWNING_FUNCTION, this);
    }

    /**
     * Create a new variable for use in this function.
     *
     * @param name The name hint.
     * @param type The type of the variable.
     * @return The new variable.
     */
    public Var newVar(String name, Type type) {
        return new Var(name, type);
    }

    /**
     * Append a parameter to this function.
     *
     * @param name The name hint.
     * @param type The type of the parameter.
     * @return The variable the parameter is bound to in the body.
     */
    public Var newParam(String name, Type type) {
        Var param = newVar(name, type);
        body.getArgs().add(param);
        return param;
    }

    public List<Var> getParams() {
        return body.getArgs();
    }

    public List<Type> getParamTypes() {
        List<Type> types = new ArrayList<>();
        for (Var param : body.getArgs()) {
            types.add(param.type);
        }
        return types;
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }

    // exts
    private Module owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_MODULE) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_MODULE) {
            owner = (Module) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_MODULE) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
