package io.github.eutro.mdsl2ir.ext;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A list view which notifies subclasses of every element that enters or leaves it.
 * <p>
 * Used by the IR to keep ownership exts of elements in sync with the
 * collections that contain them.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        for (E e : viewed) {
            onRemoved(e);
        }
        viewed.clear();
    }

    @Override
    public boolean addAll(int index, @NotNull Collection<? extends E> c) {
        for (E e : c) {
            onAdded(e);
        }
        return viewed.addAll(index, c);
    }

    @Override
    public boolean addAll(@NotNull Collection<? extends E> c) {
        return addAll(viewed.size(), c);
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        List<E> sub = viewed.subList(fromIndex, toIndex);
        for (E e : sub) {
            onRemoved(e);
        }
        sub.clear();
    }

    @NotNull
    @Override
    public ListIterator<E> listIterator(int index) {
        ListIterator<E> li = viewed.listIterator(index);
        return new ListIterator<E>() {
            E last;

            @Override
            public boolean hasNext() {
                return li.hasNext();
            }

            @Override
            public E next() {
                return last = li.next();
            }

            @Override
            public boolean hasPrevious() {
                return li.hasPrevious();
            }

            @Override
            public E previous() {
                return last = li.previous();
            }

            @Override
            public int nextIndex() {
                return li.nextIndex();
            }

            @Override
            public int previousIndex() {
                return li.previousIndex();
            }

            @Override
            public void remove() {
                li.remove();
                onRemoved(last);
                last = null;
            }

            @Override
            public void set(E e) {
                li.set(e);
                onRemoved(last);
                onAdded(e);
                last = e;
            }

            @Override
            public void add(E e) {
                onAdded(e);
                li.add(e);
            }
        };
    }
}
