package org.pragmatica.gingerbread.hir;

/**
 * Identifier of an element in an {@link Arena}. Only meaningful for the arena that issued it
 * or a copy of that arena.
 */
public record Idx<T>(int raw) {

    public Idx {
        if (raw < 0) {
            throw new IllegalArgumentException("Negative arena index " + raw);
        }
    }

    public static <T> Idx<T> of(int raw) {
        return new Idx<>(raw);
    }

    @Override
    public String toString() {
        return "#" + raw;
    }
}
