package com.autotune.vartree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Declared node of the variable tree as it appears in the settings file.
 * Root nodes have no {@code activeWhen}; every nested node must name the parent value
 * for which it takes part in a valuation.
 *
 * <pre>
 * [
 *   { "name": "threads", "children": [ { "name": "blocks", "activeWhen": "64" } ] },
 *   { "name": "unroll" }
 * ]
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class VariableNode {

    private final String name;
    private final String activeWhen;
    private final List<VariableNode> children;

    @JsonCreator
    public VariableNode(
            @JsonProperty("name") String name,
            @JsonProperty("activeWhen") String activeWhen,
            @JsonProperty("children") List<VariableNode> children) {
        this.name = name;
        this.activeWhen = activeWhen;
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    /** Root (unconditional) node. */
    public static VariableNode root(String name, VariableNode... children) {
        return new VariableNode(name, null, List.of(children));
    }

    /** Conditional node, active when its parent holds {@code activeWhen}. */
    public static VariableNode when(String activeWhen, String name, VariableNode... children) {
        return new VariableNode(name, activeWhen, List.of(children));
    }

    public String getName() {
        return name;
    }

    /** Parent value that activates this node; null for roots. */
    public String getActiveWhen() {
        return activeWhen;
    }

    public List<VariableNode> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariableNode that = (VariableNode) o;
        return Objects.equals(name, that.name) && Objects.equals(activeWhen, that.activeWhen)
                && Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, activeWhen, children);
    }
}
