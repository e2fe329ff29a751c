package com.tangle.resolution.rule;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tangle.tree.node.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rule overrides from JSON: an object mapping node kind tags to {@link RuleDefinition}s, e.g.
 * <pre>{@code
 * { "Call": { "type": "leaf", "fields": ["func", "args"], "addBreaks": ["except"] } }
 * }</pre>
 */
public final class RuleTableJson {

    private static final Logger log = LoggerFactory.getLogger(RuleTableJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, RuleDefinition>> TABLE_TYPE = new TypeReference<>() {};

    private RuleTableJson() {
    }

    /**
     * Parses an override table.
     *
     * @throws UncheckedIOException on malformed JSON
     * @throws com.tangle.tree.node.UnknownNodeKindException for an unknown kind tag
     * @throws IllegalArgumentException for an invalid rule definition
     */
    public static RuleTable fromJson(String json) {
        Map<String, RuleDefinition> defs;
        try {
            defs = MAPPER.readValue(json, TABLE_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Map<NodeKind, Rule> rules = new EnumMap<>(NodeKind.class);
        if (defs != null) {
            defs.forEach((tag, def) -> {
                if (def == null) throw new IllegalArgumentException("Missing rule for kind " + tag);
                rules.put(NodeKind.fromValue(tag), def.toRule());
            });
        }
        return RuleTable.of(rules);
    }

    /** Reads an override table from a file. */
    public static RuleTable load(Path file) {
        try {
            RuleTable table = fromJson(Files.readString(file));
            log.info("Loaded {} rule override(s) from {}", table.size(), file);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Default table with the overrides applied kind by kind. */
    public static RuleTable applyOverrides(RuleTable defaults, String json) {
        return defaults.overriddenBy(fromJson(json));
    }
}
