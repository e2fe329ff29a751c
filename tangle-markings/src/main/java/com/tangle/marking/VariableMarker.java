package com.tangle.marking;

import com.tangle.tree.node.TreeNode;

import java.util.Map;

/** Names read or written by a node, with their scope class. */
public final class VariableMarker extends Marker<Map<String, ScopeClass>> {

    VariableMarker(MarkingKind kind, MarkingStore store, TreeNode node) {
        super(kind, store, node);
        if (kind != MarkingKind.READS && kind != MarkingKind.WRITES) {
            throw new IllegalArgumentException("Variable marker needs reads or writes, got " + kind);
        }
    }

    /**
     * Records the name with the given scope class (local, nonlocal, global or unknown).
     *
     * @throws InvalidNameException if the name is not an identifier
     */
    public boolean addVariable(String name, ScopeClass scope) {
        Identifiers.requireIdentifier(name);
        if (scope == ScopeClass.FREE) {
            throw new IllegalArgumentException("Free scope is only valid for indirect accesses");
        }
        return update(m -> {
            m.put(name, scope);
            return m;
        });
    }

    public boolean remove(String name) {
        return update(m -> {
            m.remove(name);
            return m;
        });
    }

    /** Scope class of the name, or null if not accessed. */
    public ScopeClass getVariable(String name) {
        return get().get(name);
    }
}
