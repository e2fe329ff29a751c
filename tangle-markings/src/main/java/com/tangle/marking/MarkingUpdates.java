package com.tangle.marking;

import com.tangle.tree.node.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Applies parsed {@link MarkingUpdate}s. Edits go to a detached marker, so the node keeps its
 * stored value until the caller commits the returned {@link Result}.
 */
public final class MarkingUpdates {

    private static final Logger log = LoggerFactory.getLogger(MarkingUpdates.class);

    private MarkingUpdates() {
    }

    /** Value produced by a batch of updates and whether any update changed it. */
    public record Result(MarkingKind kind, boolean changed, Object value) {
    }

    /**
     * Applies the updates to a detached copy of the node's marking.
     *
     * @throws IllegalArgumentException for an unrecognised action or scope code
     * @throws InvalidNameException     for a name that is not an identifier
     */
    public static Result translate(MarkingStore store, TreeNode node, MarkingKind kind, List<MarkingUpdate> updates) {
        Objects.requireNonNull(updates, "updates");
        Marker<?> marker = store.marker(kind, node);
        marker.detach();
        boolean changed = false;
        for (MarkingUpdate update : updates) {
            changed |= apply(marker, update);
        }
        log.debug("Translated {} update(s) of {} for {}: changed={}", updates.size(), kind, node, changed);
        return new Result(kind, changed, marker.get());
    }

    /** Stores a translated value on the node. Returns false for synthetic nodes. */
    public static boolean commit(MarkingStore store, TreeNode node, Result result) {
        return store.put(node, result.kind(), result.value());
    }

    /** Applies one update to a marker of any kind. Returns whether the value changed. */
    public static boolean apply(Marker<?> marker, MarkingUpdate update) {
        Objects.requireNonNull(update, "update");
        String action = update.action() == null ? "" : update.action().trim().toLowerCase(Locale.ROOT);
        if (marker instanceof VariableMarker m) return applyVariable(m, action, update.name());
        if (marker instanceof ScopeMarker m) return applyScope(m, action, update.name());
        if (marker instanceof IndirectRwMarker m) return applyIndirect(m, action, update.scope(), update.name());
        if (marker instanceof BreaksMarker m) return applyBreak(m, action, update.name());
        if (marker instanceof VisibleMarker m) return applyVisible(m, action);
        throw new IllegalArgumentException("Unsupported marker " + marker.getClass().getName());
    }

    private static boolean applyVariable(VariableMarker marker, String action, String name) {
        if (action.equals("r")) return marker.remove(Identifiers.requireIdentifier(name));
        ScopeClass scope = ScopeClass.fromValue(action);
        if (scope == ScopeClass.FREE) {
            throw new IllegalArgumentException("Unrecognised action for " + marker.getKind() + ": " + action);
        }
        return marker.addVariable(name, scope);
    }

    private static boolean applyScope(ScopeMarker marker, String action, String name) {
        return switch (action) {
            case "n" -> marker.addNonlocal(name);
            case "g" -> marker.addGlobal(name);
            case "r" -> marker.remove(Identifiers.requireIdentifier(name));
            default -> throw new IllegalArgumentException("Unrecognised action for scope: " + action);
        };
    }

    private static boolean applyIndirect(IndirectRwMarker marker, String action, String scopeCode, String name) {
        ScopeClass scope = ScopeClass.fromValue(scopeCode);
        return switch (action) {
            case "r" -> marker.addVariable(name, scope, true, null);
            case "nr" -> marker.addVariable(name, scope, false, null);
            case "w" -> marker.addVariable(name, scope, null, true);
            case "nw" -> marker.addVariable(name, scope, null, false);
            default -> throw new IllegalArgumentException("Unrecognised action for indirectrw: " + action);
        };
    }

    private static boolean applyBreak(BreaksMarker marker, String action, String type) {
        return switch (action) {
            case "add" -> marker.addBreak(type);
            case "clear" -> marker.removeBreak(type);
            default -> throw new IllegalArgumentException("Unrecognised action for breaks: " + action);
        };
    }

    private static boolean applyVisible(VisibleMarker marker, String action) {
        return switch (action) {
            case "yes" -> marker.setVisible(true);
            case "no" -> marker.setVisible(false);
            default -> throw new IllegalArgumentException("Unrecognised action for visible: " + action);
        };
    }
}
