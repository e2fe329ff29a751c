package com.tangle.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON boundary for syntax trees supplied by a front end and handed to a writer.
 * <ul>
 *   <li>structured node: {@code {"kind": "Assign", "fields": {"targets": [...], "value": {...}}}}</li>
 *   <li>list: JSON array</li>
 *   <li>empty: {@code null}</li>
 *   <li>atomic: JSON string or number; byte sequences as {@code {"bytes": "<base64>"}}</li>
 * </ul>
 * Unknown kind tags are rejected with {@link com.tangle.tree.node.UnknownNodeKindException}.
 */
public final class TreeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TreeJson() {
    }

    /**
     * Parses a tree into the given arena.
     *
     * @throws UncheckedIOException on malformed JSON
     * @throws IllegalArgumentException when an object is neither a structured node nor a byte leaf
     */
    public static TreeNode fromJson(String json, NodeArena arena) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return read(root, arena);
    }

    /** Serializes a tree (synthetic nodes included) to compact JSON. */
    public static String toJson(TreeNode node) {
        try {
            return MAPPER.writeValueAsString(write(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Same as {@link #toJson} but pretty-printed. */
    public static String toJsonPretty(TreeNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(write(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Reads a tree already parsed to a Jackson tree, e.g. one embedded in a larger document. */
    public static TreeNode fromJsonTree(JsonNode json, NodeArena arena) {
        return read(json, arena);
    }

    /** Jackson tree form of a node, for embedding in a larger document. */
    public static JsonNode toJsonTree(TreeNode node) {
        return write(node);
    }

    private static TreeNode read(JsonNode json, NodeArena arena) {
        if (json == null || json.isNull() || json.isMissingNode()) return arena.empty();
        if (json.isArray()) {
            List<TreeNode> items = new ArrayList<>(json.size());
            for (JsonNode element : json) items.add(read(element, arena));
            return arena.list(items);
        }
        if (json.isTextual()) return arena.atomic(json.asText());
        if (json.isBigInteger()) return arena.atomic(json.bigIntegerValue());
        if (json.isIntegralNumber()) return arena.atomic(json.longValue());
        if (json.isNumber()) return arena.atomic(json.doubleValue());
        if (json.isObject()) {
            if (json.has("bytes") && json.size() == 1) {
                return arena.atomic(Base64.getDecoder().decode(json.get("bytes").asText()));
            }
            JsonNode kind = json.get("kind");
            if (kind == null || !kind.isTextual()) {
                throw new IllegalArgumentException("Tree object without a \"kind\" tag: " + json);
            }
            Map<String, TreeNode> fields = new LinkedHashMap<>();
            JsonNode fieldsJson = json.get("fields");
            if (fieldsJson != null && fieldsJson.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = fieldsJson.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    fields.put(e.getKey(), read(e.getValue(), arena));
                }
            }
            return arena.structured(NodeKind.fromValue(kind.asText()), fields);
        }
        throw new IllegalArgumentException("Unsupported JSON value in tree: " + json);
    }

    private static JsonNode write(TreeNode node) {
        return switch (node.category()) {
            case EMPTY -> NODES.nullNode();
            case ATOMIC -> writeAtomic(node.value());
            case LIST -> {
                ArrayNode array = NODES.arrayNode();
                for (TreeNode item : node.items()) array.add(write(item));
                yield array;
            }
            case STRUCTURED -> {
                ObjectNode object = NODES.objectNode();
                object.put("kind", node.kind().getTag());
                ObjectNode fields = object.putObject("fields");
                for (String field : node.fieldNames()) fields.set(field, write(node.child(field)));
                yield object;
            }
        };
    }

    private static JsonNode writeAtomic(Object value) {
        if (value instanceof String s) return NODES.textNode(s);
        if (value instanceof Long l) return NODES.numberNode(l);
        if (value instanceof Double d) return NODES.numberNode(d);
        if (value instanceof BigInteger b) return NODES.numberNode(b);
        if (value instanceof byte[] bytes) {
            ObjectNode object = NODES.objectNode();
            object.put("bytes", Base64.getEncoder().encodeToString(bytes));
            return object;
        }
        throw new IllegalStateException("Unexpected atomic value " + value);
    }
}
