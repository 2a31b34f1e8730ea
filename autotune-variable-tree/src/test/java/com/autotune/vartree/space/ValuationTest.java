package com.autotune.vartree.space;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ValuationTest {

    @Test
    void equals_ignoresInsertionOrder() {
        Map<String, String> reversed = new LinkedHashMap<>();
        reversed.put("b", "2");
        reversed.put("a", "1");

        assertEquals(Valuation.of("a", "1", "b", "2"), Valuation.of(reversed));
        assertEquals(Valuation.of("a", "1", "b", "2").hashCode(), Valuation.of(reversed).hashCode());
    }

    @Test
    void describe_sortsByName() {
        assertEquals("a = 1, b = 2", Valuation.of("b", "2", "a", "1").describe(", "));
    }

    @Test
    void withAndWithout_returnCopies() {
        Valuation base = Valuation.of("a", "1");

        assertEquals(Valuation.of("a", "2"), base.with("a", "2"));
        assertEquals(Valuation.empty(), base.without("a"));
        assertEquals("1", base.get("a"));
        assertThrows(UnsupportedOperationException.class, () -> base.asMap().put("c", "3"));
    }
}
