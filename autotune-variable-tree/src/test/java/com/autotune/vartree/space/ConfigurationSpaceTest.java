package com.autotune.vartree.space;

import com.autotune.vartree.ConfigurationError;
import com.autotune.vartree.VariableTreeConfig;
import com.autotune.vartree.tree.VariableTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationSpaceTest {

    private static ConfigurationSpace threadsAndBlocks() {
        return new ConfigurationSpace(VariableTree.builder()
                .variable("threads", "32", "64")
                .conditional("blocks", "threads", "64", "32", "64")
                .build());
    }

    private static List<Valuation> list(Iterable<Valuation> it) {
        List<Valuation> out = new ArrayList<>();
        it.forEach(out::add);
        return out;
    }

    @Test
    void count_withConditionalChildIsSumOverBranches() {
        ConfigurationSpace space = threadsAndBlocks();

        assertEquals(3, space.count());
        assertEquals(List.of(
                Valuation.of("threads", "32"),
                Valuation.of("threads", "64", "blocks", "32"),
                Valuation.of("threads", "64", "blocks", "64")), list(space.enumerate()));
    }

    @Test
    void count_withoutConditionalsIsCrossProduct() {
        ConfigurationSpace space = new ConfigurationSpace(VariableTree.builder()
                .variable("a", "1", "2", "3")
                .variable("b", "x", "y")
                .variable("c", "only")
                .build());

        assertEquals(6, space.count());
        List<Valuation> all = list(space.enumerate());
        assertEquals(6, all.size());
        assertEquals(6, new HashSet<>(all).size());
        assertTrue(all.stream().allMatch(v -> "only".equals(v.get("c"))));
        assertEquals(Valuation.of("a", "1", "b", "y", "c", "only"), all.get(1));
    }

    @Test
    void count_matchesEnumerationForNestedConditionals() {
        VariableTree tree = VariableTreeConfig.fromJson("""
                [
                  { "name": "algo", "children": [
                      { "name": "tile", "activeWhen": "tiled", "children": [
                          { "name": "prefetch", "activeWhen": "16" } ] },
                      { "name": "threads", "activeWhen": "tiled" },
                      { "name": "simd", "activeWhen": "naive" } ] },
                  { "name": "opt" }
                ]
                """, """
                { "algo": ["naive", "tiled"], "tile": ["8", "16"], "prefetch": ["on", "off"],
                  "threads": ["1", "2", "4"], "simd": ["sse", "avx"], "opt": ["O2", "O3"] }
                """);
        ConfigurationSpace space = new ConfigurationSpace(tree);

        // algo: naive -> 2 (simd), tiled -> (1 + 2) * 3 = 9; times opt
        assertEquals(22, space.count());
        List<Valuation> all = list(space.enumerate());
        assertEquals(22, all.size());
        assertEquals(22, new HashSet<>(all).size());
        assertTrue(all.stream().allMatch(space::contains));
    }

    @Test
    void enumerate_isDeterministicAndRestartable() {
        ConfigurationSpace space = threadsAndBlocks();
        Iterable<Valuation> it = space.enumerate();

        assertEquals(list(it), list(it));
        assertEquals(list(it), list(threadsAndBlocks().enumerate()));
    }

    @Test
    void enumerate_keepsEnumerationOrderInsideValuation() {
        Valuation last = list(threadsAndBlocks().enumerate()).get(2);

        assertEquals(List.of("threads", "blocks"), new ArrayList<>(last.names()));
    }

    @Test
    void count_overflowIsConfigurationError() {
        VariableTree.Builder builder = VariableTree.builder();
        String[] values = new String[1000];
        for (int i = 0; i < values.length; i++) values[i] = "v" + i;
        for (int i = 0; i < 8; i++) builder.variable("x" + i, values);
        ConfigurationSpace space = new ConfigurationSpace(builder.build());

        assertThrows(ConfigurationError.class, space::count);
    }

    @Test
    void normalize_dropsInactiveAndDefaultsNewlyActive() {
        ConfigurationSpace space = threadsAndBlocks();

        assertEquals(Valuation.of("threads", "32"),
                space.normalize(Valuation.of("threads", "32", "blocks", "64")));
        assertEquals(Valuation.of("threads", "64", "blocks", "32"),
                space.normalize(Valuation.of("threads", "64")));
        assertThrows(IllegalArgumentException.class, () -> space.normalize(Valuation.of("threads", "128")));
    }

    @Test
    void contains_rejectsExtraMissingAndIllegalValues() {
        ConfigurationSpace space = threadsAndBlocks();

        assertTrue(space.contains(Valuation.of("threads", "64", "blocks", "64")));
        assertFalse(space.contains(Valuation.of("threads", "32", "blocks", "64")));
        assertFalse(space.contains(Valuation.of("threads", "64")));
        assertFalse(space.contains(Valuation.of("threads", "16")));
    }
}
