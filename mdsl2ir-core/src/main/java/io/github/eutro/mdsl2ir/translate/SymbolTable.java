package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A stack of lexical scopes, mapping variable names to their current values.
 * <p>
 * A name resolves to its binding in the innermost scope that defines it.
 * Scopes are sorted by name, so anything derived from iterating them is deterministic.
 */
public final class SymbolTable {
    /**
     * The binding of a name.
     */
    public static final class SymbolInfo {
        public final Var value;
        /**
         * Read-only bindings, such as loop induction variables, may not be reassigned.
         */
        public final boolean readOnly;

        public SymbolInfo(Var value, boolean readOnly) {
            this.value = value;
            this.readOnly = readOnly;
        }
    }

    /**
     * A single scope.
     */
    public static final class Scope extends TreeMap<String, SymbolInfo> {
        public Scope() {
        }

        public Scope(Map<String, SymbolInfo> m) {
            super(m);
        }
    }

    private final List<Scope> scopes = new ArrayList<>();

    public SymbolTable() {
        pushScope();
    }

    public void pushScope() {
        scopes.add(new Scope());
    }

    /**
     * Pop the innermost scope.
     * <p>
     * Bindings of names that are not defined in any enclosing scope are discarded.
     *
     * @return The bindings of the popped scope for names that are defined in an enclosing scope,
     * the write-set of the scope.
     */
    public Scope popScope() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("cannot pop the outermost scope");
        }
        Scope popped = scopes.remove(scopes.size() - 1);
        Scope written = new Scope();
        for (Map.Entry<String, SymbolInfo> entry : popped.entrySet()) {
            if (has(entry.getKey())) {
                written.put(entry.getKey(), entry.getValue());
            }
        }
        return written;
    }

    public int getNumScopes() {
        return scopes.size();
    }

    /**
     * Bind a name in the innermost scope.
     *
     * @param name The name.
     * @param info The binding.
     */
    public void put(String name, SymbolInfo info) {
        scopes.get(scopes.size() - 1).put(name, info);
    }

    /**
     * Bind all names of a scope in the innermost scope.
     *
     * @param scope The bindings.
     */
    public void put(Map<String, SymbolInfo> scope) {
        scopes.get(scopes.size() - 1).putAll(scope);
    }

    /**
     * Look up a name.
     *
     * @param name The name.
     * @return The binding in the innermost scope that defines it, or null if none does.
     */
    public @Nullable SymbolInfo get(String name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            SymbolInfo info = scopes.get(i).get(name);
            if (info != null) return info;
        }
        return null;
    }

    /**
     * Look up a name in the given scope first, then in this table.
     *
     * @param name  The name.
     * @param scope The scope to check first.
     * @return The binding, or null.
     */
    public @Nullable SymbolInfo get(String name, Map<String, SymbolInfo> scope) {
        SymbolInfo info = scope.get(name);
        return info != null ? info : get(name);
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    /**
     * Whether the value is bound to any name, in any scope.
     *
     * @param value The value.
     * @return Whether it is bound.
     */
    public boolean has(Var value) {
        for (Scope scope : scopes) {
            for (SymbolInfo info : scope.values()) {
                if (info.value == value) return true;
            }
        }
        return false;
    }

    /**
     * Get a copy of the innermost scope.
     *
     * @return The copy.
     */
    public Scope topScope() {
        return new Scope(scopes.get(scopes.size() - 1));
    }
}
