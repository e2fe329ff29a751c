package com.tangle.branch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tangle.marking.MarkingStore;
import com.tangle.tree.TreeJson;
import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;

/**
 * Saves and restores the collections of a {@link Brancher}. Ids, the next id and each
 * collection's entry type survive a round trip; fact nodes are stored in {@link TreeJson} form
 * and rebuilt in the target arena.
 * <pre>{@code
 * {"name": "b", "collections": {"predicates": {"type": "predicate", "nextId": 2,
 *   "entries": [{"id": 1, "node": {...}, "expected": true}]}, ...}}
 * }</pre>
 */
public final class BrancherJson {

    private static final Logger log = LoggerFactory.getLogger(BrancherJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private BrancherJson() {
    }

    /**
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Brancher brancher) {
        Map<String, CollectionState> collections = new LinkedHashMap<>();
        for (BranchCollection<? extends BranchEntry> c : brancher.collections()) {
            List<EntryState> entries = new ArrayList<>();
            c.entries().forEach((id, entry) -> entries.add(EntryState.of(id, entry)));
            collections.put(c.getName(), new CollectionState(c.getType().getTag(), c.getNextId(), entries));
        }
        try {
            return MAPPER.writeValueAsString(new BrancherState(brancher.getName(), collections));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Rebuilds a brancher; fact nodes are created in the store's arena.
     *
     * @throws UncheckedIOException on malformed JSON
     * @throws BranchTypeViolationException if a saved entry does not fit its collection
     * @throws IllegalArgumentException for an unknown collection or inconsistent ids
     */
    public static Brancher fromJson(String json, MarkingStore store, Random random) {
        BrancherState state;
        try {
            state = MAPPER.readValue(json, BrancherState.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (state.getName() == null) throw new IllegalArgumentException("Saved brancher has no name");
        Brancher brancher = new Brancher(state.getName(), store, random);
        state.getCollections().forEach((name, saved) -> restore(brancher, name, saved, store.getArena()));
        log.info("Restored brancher {} with {} collection(s)", brancher.getName(), state.getCollections().size());
        return brancher;
    }

    @SuppressWarnings("unchecked")
    private static void restore(Brancher brancher, String name, CollectionState saved, NodeArena arena) {
        BranchCollection<BranchEntry> target = (BranchCollection<BranchEntry>) brancher.collection(name);
        if (target == null) throw new IllegalArgumentException("Unknown collection: " + name);
        if (saved == null) return;
        EntryType type = EntryType.fromValue(saved.getType());
        if (type != target.getType()) {
            throw new BranchTypeViolationException(name, target.getType(),
                    "Saved collection " + name + " has type " + saved.getType());
        }
        for (EntryState e : saved.getEntries()) target.restore(e.getId(), e.toEntry(type, arena));
        target.restoreNextId(saved.getNextId());
    }

    static final class BrancherState {
        private final String name;
        private final Map<String, CollectionState> collections;

        @JsonCreator
        BrancherState(@JsonProperty("name") String name,
                      @JsonProperty("collections") Map<String, CollectionState> collections) {
            this.name = name;
            this.collections = collections != null ? collections : Map.of();
        }

        @JsonProperty("name")
        String getName() {
            return name;
        }

        @JsonProperty("collections")
        Map<String, CollectionState> getCollections() {
            return collections;
        }
    }

    static final class CollectionState {
        private final String type;
        private final int nextId;
        private final List<EntryState> entries;

        @JsonCreator
        CollectionState(@JsonProperty("type") String type,
                        @JsonProperty("nextId") Integer nextId,
                        @JsonProperty("entries") List<EntryState> entries) {
            this.type = type;
            this.nextId = nextId != null ? nextId : 0;
            this.entries = entries != null ? entries : List.of();
        }

        @JsonProperty("type")
        String getType() {
            return type;
        }

        @JsonProperty("nextId")
        int getNextId() {
            return nextId;
        }

        @JsonProperty("entries")
        List<EntryState> getEntries() {
            return entries;
        }
    }

    static final class EntryState {
        private final int id;
        private final JsonNode node;
        private final Boolean expected;
        private final Boolean raises;
        private final List<String> exceptionTypes;

        @JsonCreator
        EntryState(@JsonProperty("id") int id,
                   @JsonProperty("node") JsonNode node,
                   @JsonProperty("expected") Boolean expected,
                   @JsonProperty("raises") Boolean raises,
                   @JsonProperty("exceptionTypes") List<String> exceptionTypes) {
            this.id = id;
            this.node = node;
            this.expected = expected;
            this.raises = raises;
            this.exceptionTypes = exceptionTypes;
        }

        static EntryState of(int id, BranchEntry entry) {
            JsonNode node = TreeJson.toJsonTree(entry.node());
            if (entry instanceof PredicateEntry p) return new EntryState(id, node, p.expected(), null, null);
            if (entry instanceof ExceptionEntry e) {
                return new EntryState(id, node, null, e.raises(), new ArrayList<>(e.exceptionTypes()));
            }
            return new EntryState(id, node, null, null, null);
        }

        BranchEntry toEntry(EntryType type, NodeArena arena) {
            if (node == null || node.isNull()) throw new IllegalArgumentException("Saved entry " + id + " has no node");
            TreeNode n = TreeJson.fromJsonTree(node, arena);
            return switch (type) {
                case PREDICATE -> new PredicateEntry(n, Boolean.TRUE.equals(expected));
                case EXCEPTION -> new ExceptionEntry(n, Boolean.TRUE.equals(raises),
                        new TreeSet<>(exceptionTypes != null ? exceptionTypes : List.of()));
                case EXPRESSION -> new ExpressionEntry(n);
                case STATEMENT -> new StatementEntry(n);
            };
        }

        @JsonProperty("id")
        int getId() {
            return id;
        }

        @JsonProperty("node")
        JsonNode getNode() {
            return node;
        }

        @JsonProperty("expected")
        Boolean getExpected() {
            return expected;
        }

        @JsonProperty("raises")
        Boolean getRaises() {
            return raises;
        }

        @JsonProperty("exceptionTypes")
        List<String> getExceptionTypes() {
            return exceptionTypes;
        }
    }
}
