package io.github.eutro.mdsl2ir.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A key under which a value of type {@code T} can be attached to
 * an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, so iteration over an {@link ExtHolder}
 * follows the order in which the exts were declared.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext of the given class with the given name.
     * <p>
     * Classes cannot carry generic arguments, so {@code R} may be
     * any subtype of the class given, such as {@code List<Var>} for {@code List.class}.
     *
     * @param type The most specific superclass of the type of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
