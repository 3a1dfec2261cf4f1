package org.newo.nsl.frontend.semantics;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * A stack of variable scopes used during semantic analysis.
 * <p>
 * The root scope holds the declared parameters and built-in globals. Loops push a scope for
 * their iterator and pop it when the loop ends; lookups walk from the innermost scope outwards.
 */
public class SymbolTable {

    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    /**
     * Constructs a symbol table whose root scope contains the given names.
     * @param rootNames The names visible everywhere.
     */
    public SymbolTable(Collection<String> rootNames) {
        scopes.push(new HashSet<>(rootNames));
    }

    /**
     * Enters a new, empty scope.
     */
    public void enterScope() {
        scopes.push(new HashSet<>());
    }

    /**
     * Leaves the current scope. The root scope is never left.
     */
    public void leaveScope() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
    }

    /**
     * Defines a name in the current scope.
     * @param name The variable name.
     */
    public void define(String name) {
        scopes.peek().add(name);
    }

    /**
     * Checks whether a name is visible from the current scope.
     * @param name The variable name.
     * @return {@code true} if any enclosing scope defines the name.
     */
    public boolean isDefined(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
