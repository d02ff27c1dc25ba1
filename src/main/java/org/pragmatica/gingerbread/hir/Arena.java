package org.pragmatica.gingerbread.hir;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Append-only storage handing out stable {@link Idx} identifiers.
 */
public final class Arena<T> implements Iterable<T> {
    private final List<T> items;

    private Arena(List<T> items) {
        this.items = items;
    }

    public static <T> Arena<T> create() {
        return new Arena<>(new ArrayList<>());
    }

    @SafeVarargs
    public static <T> Arena<T> of(T... items) {
        var arena = Arena.<T>create();
        for (var item : items) {
            arena.alloc(item);
        }
        return arena;
    }

    public Idx<T> alloc(T item) {
        Objects.requireNonNull(item, "item");
        items.add(item);
        return Idx.of(items.size() - 1);
    }

    public T get(Idx<T> idx) {
        if (idx.raw() >= items.size()) {
            throw new IndexOutOfBoundsException("Arena of size " + items.size() + " has no element " + idx);
        }
        return items.get(idx.raw());
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Independent copy holding the same elements under the same identifiers.
     */
    public Arena<T> copy() {
        return new Arena<>(new ArrayList<>(items));
    }

    public List<T> items() {
        return List.copyOf(items);
    }

    @Override
    public Iterator<T> iterator() {
        return items().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Arena<?> other && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Arena" + items;
    }
}
