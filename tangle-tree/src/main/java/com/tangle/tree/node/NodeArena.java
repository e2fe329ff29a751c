package com.tangle.tree.node;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns every node of one or more trees and hands out stable integer ids.
 * All node construction goes through the arena: front ends build parsed trees, the resolution
 * engine builds synthetic rewrites, and the branch catalog builds new statements.
 * <p>
 * Synthetic nodes and placeholders are transient: they get negative ids and are not retained,
 * so they are garbage once the caller drops them. Only retained nodes count in {@link #size()}
 * and can be looked up with {@link #get(int)}.
 * <p>
 * Not thread-safe; callers serialize access when trees are shared.
 */
public final class NodeArena {

    private final List<TreeNode> nodes = new ArrayList<>();
    private int nextTransientId = -1;

    /** Number of retained nodes (ids are {@code 0 .. size()-1}). */
    public int size() {
        return nodes.size();
    }

    /** Returns the retained node with the given id. */
    public TreeNode get(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        return nodes.get(id);
    }

    public TreeNode empty() {
        return create(NodeKind.EMPTY, null, null, null, false);
    }

    /**
     * Fresh transient empty node with no parent, used as a detached binding for marker
     * snapshots. Unlike synthetic nodes it can hold markings.
     */
    public TreeNode placeholder() {
        return transientNode(NodeKind.EMPTY, null, null, null, false);
    }

    /**
     * Creates an atomic leaf. Accepts strings, integral numbers, floating-point numbers and byte arrays.
     *
     * @throws UnknownNodeKindException for any other value type
     */
    public TreeNode atomic(Object value) {
        return create(NodeKind.ATOMIC, null, null, normalizeAtomic(value), false);
    }

    public TreeNode list(List<TreeNode> items) {
        return createList(items, false);
    }

    public TreeNode structured(NodeKind kind, Map<String, TreeNode> fields) {
        return createStructured(kind, fields, false);
    }

    public TreeNode structured(String kindTag, Map<String, TreeNode> fields) {
        return createStructured(NodeKind.fromValue(kindTag), fields, false);
    }

    /**
     * Convenience constructor from alternating field names and raw values, e.g.
     * {@code node(NodeKind.NAME, "id", "x", "ctx", node(NodeKind.LOAD))}. Values are wrapped
     * with {@link #wrap(Object)}.
     */
    public TreeNode node(NodeKind kind, Object... fieldsAndValues) {
        return createStructured(kind, pairs(fieldsAndValues), false);
    }

    /** Same as {@link #node} but the result is flagged synthetic. Children given as nodes are shared, not copied. */
    public TreeNode syntheticNode(NodeKind kind, Object... fieldsAndValues) {
        return createStructured(kind, pairs(fieldsAndValues, true), true);
    }

    public TreeNode syntheticList(List<TreeNode> items) {
        return createList(items, true);
    }

    /**
     * Wraps a raw value: null becomes an empty node, a {@link TreeNode} is returned as is,
     * a {@link List} becomes a list of wrapped items and strings/numbers/bytes become atomics.
     *
     * @throws UnknownNodeKindException when the value is none of these
     */
    public TreeNode wrap(Object raw) {
        return wrap(raw, false);
    }

    private TreeNode wrap(Object raw, boolean synthetic) {
        if (raw == null) return create(NodeKind.EMPTY, null, null, null, synthetic);
        if (raw instanceof TreeNode n) return requireOwned(n);
        if (raw instanceof List<?> list) {
            List<TreeNode> wrapped = new ArrayList<>(list.size());
            for (Object o : list) wrapped.add(wrap(o, synthetic));
            return createList(wrapped, synthetic);
        }
        return create(NodeKind.ATOMIC, null, null, normalizeAtomic(raw), synthetic);
    }

    /**
     * Concatenates the given items into a new list node. When {@code flatten} is true, items that
     * are themselves lists contribute their items instead of themselves.
     */
    public TreeNode buildList(boolean flatten, TreeNode... items) {
        return buildList(flatten, Arrays.asList(items));
    }

    public TreeNode buildList(boolean flatten, List<TreeNode> items) {
        List<TreeNode> out = new ArrayList<>();
        for (TreeNode item : items) {
            requireOwned(Objects.requireNonNull(item, "item"));
            if (flatten && item.isList()) {
                out.addAll(item.items());
            } else {
                out.add(item);
            }
        }
        return createList(out, false);
    }

    /**
     * Copies a whole subtree. Every copied node gets a fresh id, so markings of the original
     * are not shared with the copy.
     */
    public TreeNode deepCopy(TreeNode node) {
        requireOwned(Objects.requireNonNull(node, "node"));
        return switch (node.category()) {
            case EMPTY -> empty();
            case ATOMIC -> atomic(node.value() instanceof byte[] b ? b.clone() : node.value());
            case LIST -> {
                List<TreeNode> copies = new ArrayList<>(node.size());
                for (TreeNode item : node.items()) copies.add(deepCopy(item));
                yield createList(copies, false);
            }
            case STRUCTURED -> {
                Map<String, TreeNode> copies = new LinkedHashMap<>();
                for (String field : node.fieldNames()) copies.put(field, deepCopy(node.child(field)));
                yield createStructured(node.kind(), copies, false);
            }
        };
    }

    private TreeNode createStructured(NodeKind kind, Map<String, TreeNode> fields, boolean synthetic) {
        Objects.requireNonNull(kind, "kind");
        if (kind.getCategory() != NodeCategory.STRUCTURED) {
            throw new IllegalArgumentException("Kind " + kind.getTag() + " is not a structured kind");
        }
        Map<String, TreeNode> copy = new LinkedHashMap<>();
        if (fields != null) {
            for (Map.Entry<String, TreeNode> e : fields.entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) {
                    throw new IllegalArgumentException("Field name must be non-blank for " + kind.getTag());
                }
                TreeNode child = e.getValue() != null ? requireOwned(e.getValue()) : create(NodeKind.EMPTY, null, null, null, synthetic);
                copy.put(e.getKey(), child);
            }
        }
        return create(kind, copy, null, null, synthetic);
    }

    private TreeNode createList(List<TreeNode> items, boolean synthetic) {
        List<TreeNode> copy = new ArrayList<>();
        if (items != null) {
            for (TreeNode item : items) copy.add(requireOwned(Objects.requireNonNull(item, "item")));
        }
        return create(NodeKind.NODE_LIST, null, copy, null, synthetic);
    }

    private TreeNode create(NodeKind kind, Map<String, TreeNode> fields, List<TreeNode> items, Object value, boolean synthetic) {
        if (synthetic) return transientNode(kind, fields, items, value, true);
        TreeNode node = new TreeNode(this, nodes.size(), kind, fields, items, value, false);
        nodes.add(node);
        return node;
    }

    private TreeNode transientNode(NodeKind kind, Map<String, TreeNode> fields, List<TreeNode> items, Object value, boolean synthetic) {
        if (nextTransientId == Integer.MIN_VALUE) nextTransientId = -1;
        return new TreeNode(this, nextTransientId--, kind, fields, items, value, synthetic);
    }

    private Map<String, TreeNode> pairs(Object[] fieldsAndValues) {
        return pairs(fieldsAndValues, false);
    }

    private Map<String, TreeNode> pairs(Object[] fieldsAndValues, boolean synthetic) {
        if (fieldsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating field names and values");
        }
        Map<String, TreeNode> out = new LinkedHashMap<>();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            if (!(fieldsAndValues[i] instanceof String field)) {
                throw new IllegalArgumentException("Field name expected at position " + i);
            }
            out.put(field, wrap(fieldsAndValues[i + 1], synthetic));
        }
        return out;
    }

    private TreeNode requireOwned(TreeNode node) {
        if (node.getArena() != this) {
            throw new IllegalArgumentException("Node " + node + " belongs to another arena");
        }
        return node;
    }

    private static Object normalizeAtomic(Object value) {
        if (value instanceof String || value instanceof byte[]) return value;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) return ((Number) value).doubleValue();
        if (value instanceof BigInteger) return value;
        if (value instanceof BigDecimal d) return d.doubleValue();
        throw new UnknownNodeKindException(value == null ? "null" : value.getClass().getName());
    }
}
