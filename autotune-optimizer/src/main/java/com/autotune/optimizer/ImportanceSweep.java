package com.autotune.optimizer;

import com.autotune.vartree.space.ConfigurationSpace;
import com.autotune.vartree.space.Valuation;
import com.autotune.vartree.tree.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidates of the importance sweep: for every active variable of the optimum and every value of
 * its domain, the optimum with that single variable overridden. Overriding a parent can change which
 * children are active, so each candidate is normalized to a legal valuation. Duplicates are removed,
 * first occurrence wins.
 */
public final class ImportanceSweep {

    private ImportanceSweep() {
    }

    public static List<Valuation> candidates(ConfigurationSpace space, Valuation optimum) {
        Set<Valuation> out = new LinkedHashSet<>();
        for (String name : optimum.names()) {
            Variable variable = space.getTree().get(name);
            if (variable == null) {
                throw new IllegalArgumentException("Optimum names unknown variable '" + name + "'");
            }
            for (String value : variable.getDomain()) {
                out.add(space.normalize(optimum.with(name, value)));
            }
        }
        return new ArrayList<>(out);
    }
}
