package io.github.eutro.mdsl2ir.ext;

import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.ssa.*;

public class CommonExts {
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    public static final Ext<Region> ARG_OF = Ext.create(Region.class, "ARG_OF");

    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * Present on operation keys whose instructions have no effect besides computing their results.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");
    /**
     * Present on operation keys whose instructions may only appear last in a region.
     */
    public static final Ext<Boolean> IS_TERMINATOR = Ext.create(Boolean.class, "IS_TERMINATOR");

    public static final Ext<SourceLocation> LOCATION = Ext.create(SourceLocation.class, "LOCATION");
    /**
     * The name of a preferred kernel implementation, not validated.
     */
    public static final Ext<String> KERNEL_HINT = Ext.create(String.class, "KERNEL_HINT");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }

    public static <T extends ExtContainer> T markTerminator(T t) {
        t.attachExt(IS_TERMINATOR, true);
        return t;
    }

    public static boolean isPure(Effect fx) {
        return fx.insn().getNullable(IS_PURE) != null;
    }

    public static boolean isTerminator(Effect fx) {
        return fx.insn().getNullable(IS_TERMINATOR) != null;
    }
}
