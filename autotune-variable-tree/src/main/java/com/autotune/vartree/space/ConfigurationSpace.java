package com.autotune.vartree.space;

import com.autotune.vartree.ConfigurationError;
import com.autotune.vartree.tree.Variable;
import com.autotune.vartree.tree.VariableTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Set of valid valuations of a {@link VariableTree}.
 * <p>
 * Enumeration is depth-first over active variables: each variable's domain is walked in
 * declared order and only children whose activation value matches the current choice are
 * visited. The last chosen variable varies fastest. Counting uses the conditional product
 * and never enumerates.
 */
public final class ConfigurationSpace {

    private final VariableTree tree;

    public ConfigurationSpace(VariableTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    public VariableTree getTree() {
        return tree;
    }

    /** Lazy, restartable enumeration; every call to {@code iterator()} starts from the beginning. */
    public Iterable<Valuation> enumerate() {
        return () -> new Odometer(tree.getRoots());
    }

    /**
     * Number of valid valuations: for each variable the sum over its values of the product of
     * the counts of the children active for that value; the product of these over all roots.
     *
     * @throws ConfigurationError if the count does not fit in a long
     */
    public long count() {
        try {
            long total = 1;
            for (Variable root : tree.getRoots()) {
                total = Math.multiplyExact(total, count(root));
            }
            return total;
        } catch (ArithmeticException e) {
            throw new ConfigurationError("Configuration space is too large to count", e);
        }
    }

    private static long count(Variable v) {
        long sum = 0;
        for (String value : v.getDomain()) {
            long product = 1;
            for (Variable child : v.childrenActiveFor(value)) {
                product = Math.multiplyExact(product, count(child));
            }
            sum = Math.addExact(sum, product);
        }
        return sum;
    }

    /**
     * Closest valid valuation to {@code partial}: variables that are not active are dropped
     * and active variables with no value in {@code partial} get the first value of their domain.
     *
     * @throws IllegalArgumentException if {@code partial} holds a value outside a variable's domain
     */
    public Valuation normalize(Valuation partial) {
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        Deque<Variable> pending = new ArrayDeque<>(tree.getRoots());
        while (!pending.isEmpty()) {
            Variable v = pending.pollFirst();
            String value = partial.get(v.getName());
            if (value == null) {
                value = v.getDomain().get(0);
            } else if (!v.getDomain().contains(value)) {
                throw new IllegalArgumentException("Value '" + value + "' is not in the domain of '" + v.getName() + "'");
            }
            out.put(v.getName(), value);
            pushFront(pending, v.childrenActiveFor(value));
        }
        return Valuation.of(out);
    }

    /** True if {@code valuation} is one of the valuations produced by {@link #enumerate()}. */
    public boolean contains(Valuation valuation) {
        if (valuation == null) return false;
        int seen = 0;
        Deque<Variable> pending = new ArrayDeque<>(tree.getRoots());
        while (!pending.isEmpty()) {
            Variable v = pending.pollFirst();
            String value = valuation.get(v.getName());
            if (value == null || !v.getDomain().contains(value)) return false;
            seen++;
            pushFront(pending, v.childrenActiveFor(value));
        }
        return seen == valuation.size();
    }

    private static void pushFront(Deque<Variable> pending, List<Variable> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.addFirst(children.get(i));
        }
    }

    /**
     * Walks the derivation as a mixed-radix counter. Each position remembers the variables still
     * to be assigned when it was chosen, so advancing a position re-derives everything after it.
     */
    private static final class Odometer implements Iterator<Valuation> {
        private final List<Variable> vars = new ArrayList<>();
        private final List<Integer> indexes = new ArrayList<>();
        private final List<List<Variable>> remaining = new ArrayList<>();
        private Valuation next;

        Odometer(List<Variable> roots) {
            extend(new ArrayList<>(roots));
            next = current();
        }

        private void extend(List<Variable> queue) {
            Deque<Variable> pending = new ArrayDeque<>(queue);
            while (!pending.isEmpty()) {
                Variable v = pending.pollFirst();
                vars.add(v);
                indexes.add(0);
                remaining.add(new ArrayList<>(pending));
                pushFront(pending, v.childrenActiveFor(v.getDomain().get(0)));
            }
        }

        private Valuation current() {
            LinkedHashMap<String, String> map = new LinkedHashMap<>();
            for (int i = 0; i < vars.size(); i++) {
                map.put(vars.get(i).getName(), vars.get(i).getDomain().get(indexes.get(i)));
            }
            return Valuation.of(map);
        }

        private Valuation advance() {
            for (int pos = vars.size() - 1; pos >= 0; pos--) {
                Variable v = vars.get(pos);
                int idx = indexes.get(pos) + 1;
                if (idx < v.getDomain().size()) {
                    List<Variable> rest = remaining.get(pos);
                    truncate(pos + 1);
                    indexes.set(pos, idx);
                    Deque<Variable> pending = new ArrayDeque<>(rest);
                    pushFront(pending, v.childrenActiveFor(v.getDomain().get(idx)));
                    extend(new ArrayList<>(pending));
                    return current();
                }
            }
            return null;
        }

        private void truncate(int size) {
            while (vars.size() > size) {
                int last = vars.size() - 1;
                vars.remove(last);
                indexes.remove(last);
                remaining.remove(last);
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Valuation next() {
            if (next == null) throw new NoSuchElementException();
            Valuation result = next;
            next = advance();
            return result;
        }
    }
}
