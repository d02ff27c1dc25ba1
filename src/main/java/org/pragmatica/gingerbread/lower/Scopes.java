package org.pragmatica.gingerbread.lower;

import org.pragmatica.gingerbread.hir.VarDefId;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Chain of variable scopes, innermost first. The outermost scope is the top level of the unit.
 */
final class Scopes {
    private final Deque<Map<String, VarDefId>> frames;

    Scopes(Map<String, VarDefId> topLevel) {
        this.frames = new ArrayDeque<>();
        this.frames.push(new HashMap<>(topLevel));
    }

    void push() {
        frames.push(new HashMap<>());
    }

    void pop() {
        if (frames.size() == 1) {
            throw new IllegalStateException("Cannot leave the top-level scope");
        }
        frames.pop();
    }

    void define(String name, VarDefId id) {
        frames.peek().put(name, id);
    }

    Optional<VarDefId> lookup(String name) {
        for (var frame : frames) {
            var id = frame.get(name);
            if (id != null) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    Map<String, VarDefId> topLevel() {
        return frames.peekLast();
    }
}
