package com.tangle.marking;

import com.tangle.tree.node.TreeNode;

import java.util.Map;

/** global / nonlocal declarations contained in a node. */
public final class ScopeMarker extends Marker<Map<String, ScopeClass>> {

    ScopeMarker(MarkingStore store, TreeNode node) {
        super(MarkingKind.SCOPE, store, node);
    }

    public boolean addNonlocal(String name) {
        return declare(name, ScopeClass.NONLOCAL);
    }

    public boolean addGlobal(String name) {
        return declare(name, ScopeClass.GLOBAL);
    }

    public boolean remove(String name) {
        return update(m -> {
            m.remove(name);
            return m;
        });
    }

    /** Declared scope of the name, {@link ScopeClass#UNKNOWN} when it carries no declaration. */
    public ScopeClass getScope(String name) {
        return get().getOrDefault(name, ScopeClass.UNKNOWN);
    }

    private boolean declare(String name, ScopeClass scope) {
        Identifiers.requireIdentifier(name);
        return update(m -> {
            m.put(name, scope);
            return m;
        });
    }
}
