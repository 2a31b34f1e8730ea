package com.autotune.vartree.tree;

import com.autotune.vartree.ConfigurationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forest of tunable variables built from declared {@link VariableNode}s and a value-domain map.
 * Validation is fail-fast: every structural problem is collected and reported in a single
 * {@link ConfigurationError} before the tree is usable.
 */
public final class VariableTree {

    private static final Logger log = LoggerFactory.getLogger(VariableTree.class);

    private final List<Variable> roots;
    private final Map<String, Variable> byName;

    private VariableTree(List<Variable> roots, Map<String, Variable> byName) {
        this.roots = List.copyOf(roots);
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * Builds and validates a tree.
     *
     * @param nodes  root nodes in declaration order
     * @param values domain for every variable named in the tree
     * @throws ConfigurationError if the tree or the domains are malformed
     */
    public static VariableTree of(List<VariableNode> nodes, Map<String, List<String>> values) {
        List<String> problems = new ArrayList<>();
        Map<String, List<String>> domains = values != null ? values : Map.of();
        if (nodes == null || nodes.isEmpty()) {
            throw new ConfigurationError("Variable tree declares no variables");
        }
        Map<String, Variable> byName = new LinkedHashMap<>();
        List<Variable> roots = new ArrayList<>();
        for (VariableNode node : nodes) {
            if (node == null) {
                problems.add("Null variable node at top level");
                continue;
            }
            if (node.getActiveWhen() != null) {
                problems.add("Root variable '" + node.getName() + "' must not declare activeWhen");
            }
            Variable root = build(node, null, domains, byName, problems, new HashSet<>());
            if (root != null) roots.add(root);
        }
        for (String declared : domains.keySet()) {
            if (!byName.containsKey(declared)) {
                log.warn("Value domain for unknown variable ignored | variable={}", declared);
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationError(problems);
        }
        log.debug("VariableTree built | roots={} | variables={}", roots.size(), byName.size());
        return new VariableTree(roots, byName);
    }

    private static Variable build(VariableNode node, Variable parent, Map<String, List<String>> domains,
                                  Map<String, Variable> byName, List<String> problems, Set<String> path) {
        String name = node.getName();
        if (name == null || name.isBlank()) {
            problems.add("Variable with blank name" + (parent != null ? " under '" + parent.getName() + "'" : ""));
            return null;
        }
        if (path.contains(name)) {
            problems.add("Cycle through variable '" + name + "'");
            return null;
        }
        if (byName.containsKey(name)) {
            problems.add("Duplicate variable name '" + name + "'");
            return null;
        }
        List<String> domain = domains.get(name);
        boolean domainOk = checkDomain(name, domain, problems);

        String activation = node.getActiveWhen();
        if (parent != null) {
            if (activation == null) {
                problems.add("Variable '" + name + "' under '" + parent.getName() + "' must declare activeWhen");
            } else if (!parent.getDomain().isEmpty() && !parent.getDomain().contains(activation)) {
                problems.add("Variable '" + name + "' is active when '" + parent.getName() + "' = '"
                        + activation + "', which is not in its domain " + parent.getDomain());
            }
        }
        Variable variable = new Variable(name, domainOk ? domain : List.of(), parent,
                parent != null ? activation : null);
        byName.put(name, variable);
        if (parent != null) parent.addChild(variable);

        path.add(name);
        for (VariableNode child : node.getChildren()) {
            if (child == null) {
                problems.add("Null child node under '" + name + "'");
                continue;
            }
            build(child, variable, domains, byName, problems, path);
        }
        path.remove(name);
        return variable;
    }

    private static boolean checkDomain(String name, List<String> domain, List<String> problems) {
        if (domain == null) {
            problems.add("No value domain for variable '" + name + "'");
            return false;
        }
        if (domain.isEmpty()) {
            problems.add("Empty value domain for variable '" + name + "'");
            return false;
        }
        boolean ok = true;
        Set<String> seen = new HashSet<>();
        for (String value : domain) {
            if (value == null || value.isBlank()) {
                problems.add("Blank value in domain of '" + name + "'");
                ok = false;
            } else if (!seen.add(value)) {
                problems.add("Duplicate value '" + value + "' in domain of '" + name + "'");
                ok = false;
            }
        }
        return ok;
    }

    /** Programmatic construction, mostly for tests and embedding. */
    public static Builder builder() {
        return new Builder();
    }

    public List<Variable> getRoots() {
        return roots;
    }

    /** Variable by name, or null. */
    public Variable get(String name) {
        return byName.get(name);
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** All variables, pre-order in declaration order. */
    public List<Variable> variables() {
        List<Variable> out = new ArrayList<>(byName.size());
        for (Variable root : roots) collect(root, out);
        return out;
    }

    /** Variable names, pre-order in declaration order. This is the column order of result logs. */
    public List<String> flatten() {
        List<String> names = new ArrayList<>(byName.size());
        for (Variable v : variables()) names.add(v.getName());
        return names;
    }

    private static void collect(Variable v, List<Variable> out) {
        out.add(v);
        for (Variable child : v.getChildren()) collect(child, out);
    }

    /** One variable per line, indented by depth, with its domain and activation condition. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Variable v : variables()) {
            sb.append("  ".repeat(v.depth())).append(v.getName());
            if (!v.isRoot()) {
                sb.append(" [when ").append(v.getParent().getName()).append('=')
                        .append(v.getActivationValue()).append(']');
            }
            sb.append(" : ").append(String.join(", ", v.getDomain())).append(System.lineSeparator());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "VariableTree" + flatten();
    }

    /**
     * Builder for trees declared in code. Parents must be declared before their children.
     */
    public static final class Builder {
        private final List<VariableNode> roots = new ArrayList<>();
        private final Map<String, List<String>> values = new LinkedHashMap<>();
        private final Map<String, String> parents = new LinkedHashMap<>();
        private final Map<String, String> activation = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder variable(String name, String... domain) {
            parents.put(name, null);
            values.put(name, List.of(domain));
            return this;
        }

        public Builder conditional(String name, String parent, String activationValue, String... domain) {
            parents.put(name, parent);
            activation.put(name, activationValue);
            values.put(name, List.of(domain));
            return this;
        }

        public VariableTree build() {
            List<String> problems = new ArrayList<>();
            for (Map.Entry<String, String> e : parents.entrySet()) {
                if (e.getValue() != null && !parents.containsKey(e.getValue())) {
                    problems.add("Variable '" + e.getKey() + "' names unknown parent '" + e.getValue() + "'");
                }
            }
            for (String name : parents.keySet()) {
                Set<String> seen = new HashSet<>();
                for (String p = name; p != null; p = parents.get(p)) {
                    if (!seen.add(p)) {
                        problems.add("Cycle through variable '" + name + "'");
                        break;
                    }
                }
            }
            if (!problems.isEmpty()) throw new ConfigurationError(problems);
            roots.clear();
            for (Map.Entry<String, String> e : parents.entrySet()) {
                if (e.getValue() == null) roots.add(node(e.getKey(), null));
            }
            return VariableTree.of(roots, values);
        }

        private VariableNode node(String name, String activeWhen) {
            List<VariableNode> children = new ArrayList<>();
            for (Map.Entry<String, String> e : parents.entrySet()) {
                if (name.equals(e.getValue())) {
                    children.add(node(e.getKey(), activation.get(e.getKey())));
                }
            }
            return new VariableNode(name, activeWhen, children);
        }
    }
}
