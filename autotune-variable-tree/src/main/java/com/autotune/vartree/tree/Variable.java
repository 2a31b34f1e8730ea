package com.autotune.vartree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tunable variable: unique name, ordered domain of legal values and, for non-roots, the parent
 * value that activates it. Instances are created and linked by {@link VariableTree}.
 */
public final class Variable {

    private final String name;
    private final List<String> domain;
    private final Variable parent;
    private final String activationValue;
    private final List<Variable> children = new ArrayList<>();

    Variable(String name, List<String> domain, Variable parent, String activationValue) {
        this.name = name;
        this.domain = List.copyOf(domain);
        this.parent = parent;
        this.activationValue = activationValue;
    }

    void addChild(Variable child) {
        children.add(child);
    }

    public String getName() {
        return name;
    }

    /** Legal values in declaration order. Never empty. */
    public List<String> getDomain() {
        return domain;
    }

    /** Parent variable, or null for a root. */
    public Variable getParent() {
        return parent;
    }

    /** Parent value for which this variable is active; null for a root. */
    public String getActivationValue() {
        return activationValue;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Children in declaration order. Unmodifiable. */
    public List<Variable> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /** Children that become active when this variable holds {@code value}, in declaration order. */
    public List<Variable> childrenActiveFor(String value) {
        if (children.isEmpty()) return List.of();
        List<Variable> active = new ArrayList<>(children.size());
        for (Variable child : children) {
            if (child.activationValue.equals(value)) {
                active.add(child);
            }
        }
        return active;
    }

    /** Number of ancestors; 0 for roots. */
    public int depth() {
        int d = 0;
        for (Variable p = parent; p != null; p = p.parent) d++;
        return d;
    }

    @Override
    public String toString() {
        return parent == null ? name : name + "[" + parent.name + "=" + activationValue + "]";
    }
}
