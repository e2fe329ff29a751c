package com.tangle.marking;

import com.tangle.tree.node.TreeNode;

import java.util.Map;

/**
 * Reads and writes of names in an enclosed scope that are not local to it, keyed by the
 * name and its scope modifier there. A null flag argument leaves that flag unchanged.
 */
public final class IndirectRwMarker extends Marker<Map<IndirectKey, IndirectAccess>> {

    IndirectRwMarker(MarkingStore store, TreeNode node) {
        super(MarkingKind.INDIRECT_RW, store, node);
    }

    /** Access flags for the key; (false, false) when absent. */
    public IndirectAccess getVariable(String name, ScopeClass scope) {
        return get().getOrDefault(new IndirectKey(name, scope), IndirectAccess.NONE);
    }

    public boolean addFree(String name, Boolean read, Boolean write) {
        return addVariable(name, ScopeClass.FREE, read, write);
    }

    public boolean addNonlocal(String name, Boolean read, Boolean write) {
        return addVariable(name, ScopeClass.NONLOCAL, read, write);
    }

    public boolean addGlobal(String name, Boolean read, Boolean write) {
        return addVariable(name, ScopeClass.GLOBAL, read, write);
    }

    public boolean addVariable(String name, ScopeClass scope, Boolean read, Boolean write) {
        IndirectKey key = new IndirectKey(name, scope);
        return update(m -> {
            IndirectAccess access = m.getOrDefault(key, IndirectAccess.NONE);
            if (read != null) access = access.withRead(read);
            if (write != null) access = access.withWrite(write);
            m.put(key, access);
            return m;
        });
    }

    public boolean remove(String name, ScopeClass scope) {
        IndirectKey key = new IndirectKey(name, scope);
        return update(m -> {
            m.remove(key);
            return m;
        });
    }
}
