/**
 * Syntax tree model.
 *
 * <ul>
 *   <li>{@link com.tangle.tree.node} – {@link com.tangle.tree.node.TreeNode}, {@link com.tangle.tree.node.NodeArena}
 *       (id-addressed node storage) and the fixed {@link com.tangle.tree.node.NodeKind} set</li>
 *   <li>{@link com.tangle.tree.TreeJson} – {@code fromJson}/{@code toJson} boundary with the front end and writer</li>
 * </ul>
 */
package com.tangle.tree;
