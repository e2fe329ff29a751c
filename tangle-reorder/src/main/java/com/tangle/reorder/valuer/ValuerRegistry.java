package com.tangle.reorder.valuer;

import com.tangle.annotations.TangleValuer;
import com.tangle.reorder.Valuer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Valuers by name. Register instances whose class is annotated with {@link TangleValuer};
 * look them up by {@link TangleValuer#name()}.
 */
public final class ValuerRegistry {

    private final Map<String, ValuerEntry> byName = new LinkedHashMap<>();

    /**
     * Registry holding the built-in valuers: wrange, rwrange, rwlogrange, knots, random and first.
     *
     * @param random source for the random valuer
     */
    public static ValuerRegistry withDefaults(Random random) {
        ValuerRegistry registry = new ValuerRegistry();
        registry.register(new WriteRangeValuer());
        registry.register(new WriteUseValuer());
        registry.register(new WriteUseLogValuer());
        registry.register(new KnotValuer());
        registry.register(new RandomValuer(random));
        registry.register(new FirstValuer());
        return registry;
    }

    /**
     * Registers a valuer under the name from its {@link TangleValuer} annotation.
     *
     * @throws IllegalArgumentException if the class is not annotated, the name is blank or already taken
     */
    public void register(Valuer valuer) {
        Objects.requireNonNull(valuer, "valuer");
        Class<?> clazz = valuer.getClass();
        TangleValuer ann = clazz.getAnnotation(TangleValuer.class);
        if (ann == null) {
            throw new IllegalArgumentException("Valuer implementation must be annotated with @TangleValuer: " + clazz.getName());
        }
        if (ann.name() == null || ann.name().isBlank()) {
            throw new IllegalArgumentException("@TangleValuer name must be non-blank: " + clazz.getName());
        }
        ValuerEntry entry = new ValuerEntry(ann.name(), ann.description(), ann.randomized(), valuer);
        if (byName.putIfAbsent(entry.getName(), entry) != null) {
            throw new IllegalArgumentException("Valuer already registered: " + entry.getName());
        }
    }

    /** Entry for the name, or null if none is registered. */
    public ValuerEntry get(String name) {
        return byName.get(name);
    }

    /**
     * Valuer for the name, negated when {@code invert} is set.
     *
     * @throws IllegalArgumentException if no valuer has that name
     */
    public Valuer require(String name, boolean invert) {
        ValuerEntry e = byName.get(name);
        if (e == null) {
            throw new IllegalArgumentException("Unknown valuer: " + name + " (known: " + byName.keySet() + ")");
        }
        return invert ? Valuer.invert(e.getValuer()) : e.getValuer();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    public Map<String, ValuerEntry> getAll() {
        return Collections.unmodifiableMap(byName);
    }

    /**
     * Registered valuer: metadata plus the instance.
     */
    public static final class ValuerEntry {
        private final String name;
        private final String description;
        private final boolean randomized;
        private final Valuer valuer;

        ValuerEntry(String name, String description, boolean randomized, Valuer valuer) {
            this.name = name;
            this.description = description;
            this.randomized = randomized;
            this.valuer = valuer;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        /** True if repeated scoring of one ordering may differ. */
        public boolean isRandomized() { return randomized; }
        public Valuer getValuer() { return valuer; }
    }
}
