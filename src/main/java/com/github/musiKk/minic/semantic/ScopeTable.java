package com.github.musiKk.minic.semantic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.ToString;

/**
 * Lexical scopes kept in an arena and addressed by index. Entering a block
 * pushes a fresh scope whose parent is the current one; leaving it pops the
 * index again. Closed scopes stay in the arena so a later use of one of their
 * names can be told apart from a name that was never declared.
 */
@ToString
public class ScopeTable {

    public static final int NO_PARENT = -1;

    private final List<Scope> arena = new ArrayList<>();
    private final Deque<Integer> active = new ArrayDeque<>();

    public ScopeTable() {
        arena.add(new Scope(NO_PARENT, 0, new HashMap<>()));
        active.push(0);
    }

    record Scope(int parent, int level, Map<String, Variable> variables) {}

    public int current() {
        return active.peek();
    }

    public int level() {
        return arena.get(current()).level();
    }

    public int push() {
        var parent = current();
        arena.add(new Scope(parent, arena.get(parent).level() + 1, new HashMap<>()));
        int index = arena.size() - 1;
        active.push(index);
        return index;
    }

    public void pop() {
        if (active.size() == 1) {
            throw new IllegalStateException("cannot leave the root scope");
        }
        active.pop();
    }

    /**
     * Declares a name in the current scope.
     *
     * @return the new variable, or empty if the current scope already has the name
     */
    public Optional<Variable> declare(String name, Type type) {
        var variables = arena.get(current()).variables();
        if (variables.containsKey(name)) {
            return Optional.empty();
        }
        var variable = new Variable(name, type, false);
        variables.put(name, variable);
        return Optional.of(variable);
    }

    /** Resolves a name through the chain of currently open scopes. */
    public Optional<Variable> lookup(String name) {
        int index = current();
        while (index != NO_PARENT) {
            var scope = arena.get(index);
            var variable = scope.variables().get(name);
            if (variable != null) {
                return Optional.of(variable);
            }
            index = scope.parent();
        }
        return Optional.empty();
    }

    /** Finds a name among scopes that have already been closed. */
    public Optional<Variable> lookupClosed(String name) {
        for (int index = 0; index < arena.size(); index++) {
            if (active.contains(index)) {
                continue;
            }
            var variable = arena.get(index).variables().get(name);
            if (variable != null) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }
}
