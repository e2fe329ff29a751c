package com.tangle.branch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Id-indexed bag of branch facts of one {@link EntryType}. Ids start at 0, increase
 * monotonically and are never reused, even after removal.
 *
 * @param <E> entry class matching the collection's type
 */
public final class BranchCollection<E extends BranchEntry> {

    private final String name;
    private final EntryType type;
    private final SortedMap<Integer, E> entries = new TreeMap<>();
    private int nextId;

    public BranchCollection(String name, EntryType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public EntryType getType() {
        return type;
    }

    /** Id the next added entry will get. */
    public int getNextId() {
        return nextId;
    }

    /**
     * Adds an entry and returns its id.
     *
     * @throws BranchTypeViolationException if the entry's type or node kind does not fit
     */
    public int add(E entry) {
        check(entry);
        int id = nextId++;
        entries.put(id, entry);
        return id;
    }

    /** Entry with the id, or null. */
    public E get(int id) {
        return entries.get(id);
    }

    /**
     * Replaces the entry under an existing id.
     *
     * @throws BranchTypeViolationException if the entry does not fit
     * @throws IllegalArgumentException if no entry has the id
     */
    public void replace(int id, E entry) {
        check(entry);
        if (!entries.containsKey(id)) throw new IllegalArgumentException("No entry " + id + " in " + name);
        entries.put(id, entry);
    }

    public boolean remove(int id) {
        return entries.remove(id) != null;
    }

    public boolean contains(int id) {
        return entries.containsKey(id);
    }

    public SortedMap<Integer, E> entries() {
        return Collections.unmodifiableSortedMap(entries);
    }

    public List<E> values() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Puts an entry under a given id while restoring saved state; nextId moves past it. */
    void restore(int id, E entry) {
        check(entry);
        if (id < 0) throw new IllegalArgumentException("Negative id " + id + " in " + name);
        entries.put(id, entry);
        nextId = Math.max(nextId, id + 1);
    }

    void restoreNextId(int savedNextId) {
        if (savedNextId < nextId) {
            throw new IllegalArgumentException("Next id " + savedNextId + " of " + name + " is below a used id");
        }
        nextId = savedNextId;
    }

    private void check(E entry) {
        Objects.requireNonNull(entry, "entry");
        if (entry.type() != type) {
            throw new BranchTypeViolationException(name, type,
                    "Collection " + name + " holds " + type.getTag() + " entries, not " + entry.type().getTag());
        }
        if (!type.accepts(entry.node())) {
            throw new BranchTypeViolationException(name, type,
                    "Node " + entry.node() + " is not a valid " + type.getTag() + " for collection " + name);
        }
    }
}
