/**
 * Marking resolution.
 *
 * <ul>
 *   <li>{@link com.tangle.resolution.ResolutionEngine} – strategy chain (existing, computed, interactive, then fallback),
 *       all-or-nothing commit, review callback</li>
 *   <li>{@link com.tangle.resolution.rule} – rule algebra (leaf, rewrite, sequential, all-of, any-of, conditional),
 *       {@link com.tangle.resolution.rule.RuleTable} and JSON overrides</li>
 *   <li>{@link com.tangle.resolution.python} – default rule table and desugarings for Python trees</li>
 * </ul>
 */
package com.tangle.resolution;
