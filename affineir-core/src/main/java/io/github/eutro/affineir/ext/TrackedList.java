package io.github.eutro.affineir.ext;

import java.util.*;

/**
 * A list view that is notified of every element added to or removed from it.
 * <p>
 * Blocks and regions use this to keep the parent references of their
 * operations and blocks in sync with their contents.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList() {
        this(new ArrayList<>());
    }

    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called just before {@code elt} becomes part of this list.
     *
     * @param elt The element.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called just after {@code elt} stopped being part of this list.
     *
     * @param elt The element.
     */
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
    public E set(int index, E element) {
        onAdded(element);
        E removed = viewed.set(index, element);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> copy = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : copy) {
            onRemoved(e);
        }
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        for (E e : c) {
            onAdded(e);
        }
        return viewed.addAll(index, c);
    }

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
                onAdded(e);
                li.set(e);
                onRemoved(last);
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
