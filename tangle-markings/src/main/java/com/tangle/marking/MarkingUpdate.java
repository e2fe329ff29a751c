package com.tangle.marking;

/**
 * One parsed edit from an interactive command layer.
 * <ul>
 *   <li>reads / writes: action is a scope code {@code l|n|g|u} (add) or {@code r} (remove); scope unused</li>
 *   <li>scope: action {@code n|g} (declare nonlocal/global) or {@code r} (remove); scope unused</li>
 *   <li>indirectrw: action {@code r|nr|w|nw}, scope {@code f|n|g}</li>
 *   <li>breaks: action {@code add|clear}, name is the break type</li>
 *   <li>visible: action {@code yes|no}; scope and name unused</li>
 * </ul>
 */
public record MarkingUpdate(String action, String scope, String name) {

    public static MarkingUpdate of(String action, String name) {
        return new MarkingUpdate(action, null, name);
    }
}
