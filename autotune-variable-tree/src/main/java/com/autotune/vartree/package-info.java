/**
 * Variable tree and configuration space.
 *
 * <ul>
 *   <li>{@link com.autotune.vartree.tree} – declared {@link com.autotune.vartree.tree.VariableNode}s and the
 *       validated {@link com.autotune.vartree.tree.VariableTree}</li>
 *   <li>{@link com.autotune.vartree.space} – {@link com.autotune.vartree.space.Valuation} and
 *       {@link com.autotune.vartree.space.ConfigurationSpace} (enumerate, count, normalize)</li>
 *   <li>{@link com.autotune.vartree.VariableTreeConfig} – {@code fromJson}/{@code toJson} for the node list</li>
 * </ul>
 */
package com.autotune.vartree;
