package org.pragmatica.gingerbread.hir;

import java.util.ArrayList;
import java.util.List;

/**
 * Contiguous run of identifiers from one arena, {@code start} inclusive, {@code end} exclusive.
 */
public record IdRange<T>(int start, int end) {

    public IdRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid id range " + start + ".." + end);
        }
    }

    public static <T> IdRange<T> empty() {
        return new IdRange<>(0, 0);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(Idx<T> idx) {
        return idx.raw() >= start && idx.raw() < end;
    }

    public List<Idx<T>> ids() {
        var result = new ArrayList<Idx<T>>(size());
        for (int raw = start; raw < end; raw++) {
            result.add(Idx.of(raw));
        }
        return result;
    }

    /**
     * Collects identifiers allocated one after another.
     */
    public static final class Builder<T> {
        private int start = -1;
        private int end = -1;

        private Builder() {}

        public Builder<T> include(Idx<T> idx) {
            if (start == -1) {
                start = idx.raw();
            } else if (idx.raw() != end) {
                throw new IllegalStateException("Id " + idx + " does not follow " + (end - 1));
            }
            end = idx.raw() + 1;
            return this;
        }

        public IdRange<T> build() {
            return start == -1
                   ? IdRange.empty()
                   : new IdRange<>(start, end);
        }
    }
}
