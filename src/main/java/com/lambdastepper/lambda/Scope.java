package com.lambdastepper.lambda;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The identifiers bound by the lambdas enclosing a position in a tree,
 * innermost first. Scopes never change: {@link #bind} returns a new scope
 * that encloses the receiver.
 */
public final class Scope {
    public static final Scope EMPTY = new Scope(null, null);

    private final String name;
    private final Scope enclosing;

    private Scope(String name, Scope enclosing) {
        this.name = name;
        this.enclosing = enclosing;
    }

    public Scope bind(String id) {
        return new Scope(id, this);
    }

    public boolean contains(String id) {
        Scope scope = this;
        while (scope.enclosing != null) {
            if (scope.name.equals(id)) {
                return true;
            }
            scope = scope.enclosing;
        }
        return false;
    }

    public boolean isEmpty() {
        return enclosing == null;
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        Scope scope = this;
        while (scope.enclosing != null) {
            names.add(scope.name);
            scope = scope.enclosing;
        }
        return names;
    }

    @Override
    public String toString() {
        return names().toString();
    }
}
