package com.tangle.marking;

import java.util.Objects;

/**
 * Key of an indirect access: a name and the scope modifier it carries in the enclosed scope.
 */
public record IndirectKey(String name, ScopeClass scope) {

    public IndirectKey {
        Identifiers.requireIdentifier(name);
        Objects.requireNonNull(scope, "scope");
        if (scope != ScopeClass.FREE && scope != ScopeClass.NONLOCAL && scope != ScopeClass.GLOBAL) {
            throw new IllegalArgumentException("Indirect access scope must be free, nonlocal or global: " + scope);
        }
    }
}
