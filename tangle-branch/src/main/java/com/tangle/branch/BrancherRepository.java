package com.tangle.branch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Branchers of a session, by name. Passed explicitly to whatever needs it.
 */
public final class BrancherRepository {

    private final Map<String, Brancher> byName = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a brancher with the same name exists
     */
    public void add(Brancher brancher) {
        Objects.requireNonNull(brancher, "brancher");
        if (byName.putIfAbsent(brancher.getName(), brancher) != null) {
            throw new IllegalArgumentException("Brancher already exists: " + brancher.getName());
        }
    }

    /** Adds or replaces the brancher with the same name, e.g. after loading saved state. */
    public void put(Brancher brancher) {
        Objects.requireNonNull(brancher, "brancher");
        byName.put(brancher.getName(), brancher);
    }

    public Optional<Brancher> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean remove(String name) {
        return byName.remove(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    public int size() {
        return byName.size();
    }
}
