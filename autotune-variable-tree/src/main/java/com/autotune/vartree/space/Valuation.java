package com.autotune.vartree.space;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assignment of a value to every active variable of one configuration.
 * Equality and hash are by mapping only; iteration order is the enumeration order and is
 * used for rendering and logging.
 */
public final class Valuation {

    private static final Valuation EMPTY = new Valuation(new LinkedHashMap<>());

    private final Map<String, String> values;

    private Valuation(LinkedHashMap<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Valuation empty() {
        return EMPTY;
    }

    /** Copies {@code values}, keeping its iteration order. */
    public static Valuation of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : values.entrySet()) {
            copy.put(Objects.requireNonNull(e.getKey(), "name"), Objects.requireNonNull(e.getValue(), "value"));
        }
        return new Valuation(copy);
    }

    /** Convenience factory: alternating name, value pairs. */
    public static Valuation of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " strings");
        }
        LinkedHashMap<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return of(map);
    }

    /** Value of {@code name}, or null when the variable is not active. */
    public String get(String name) {
        return values.get(name);
    }

    public boolean isActive(String name) {
        return values.containsKey(name);
    }

    /** Active variable names in enumeration order. */
    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, String> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Copy with {@code name} set to {@code value}; position is kept if already present. */
    public Valuation with(String name, String value) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(values);
        copy.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return new Valuation(copy);
    }

    public Valuation without(String name) {
        if (!values.containsKey(name)) return this;
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(values);
        copy.remove(name);
        return new Valuation(copy);
    }

    /**
     * Sorted {@code name = value} pairs joined by {@code separator}, for user-facing lines.
     */
    public String describe(String separator) {
        List<String> names = new ArrayList<>(values.keySet());
        Collections.sort(names);
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            if (sb.length() > 0) sb.append(separator);
            sb.append(name).append(" = ").append(values.get(name));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Valuation)) return false;
        return values.equals(((Valuation) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
