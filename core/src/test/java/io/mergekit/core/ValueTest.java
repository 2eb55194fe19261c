package io.mergekit.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test
    void plain_java_data_converts_to_tree() {
        var v = Value.of(Map.of("name", "web", "ports", List.of(80, 443), "tls", true));

        var m = assertInstanceOf(Value.Mapping.class, v);
        assertEquals(Value.text("web"), m.get("name"));
        assertEquals(Value.seq(80, 443), m.get("ports"));
        assertEquals(Value.bool(true), m.get("tls"));
        assertNull(m.get("missing"));
        assertSame(Value.Null.INSTANCE, Value.of(null));
    }

    @Test
    void non_string_keys_and_unknown_types_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Value.of(Map.of(1, "x")));
        assertThrows(IllegalArgumentException.class, () -> Value.of(new Object()));
        assertThrows(IllegalArgumentException.class, () -> Value.of(Double.NaN));
    }

    @Test
    void numbers_compare_numerically() {
        var one = Value.num(1);
        var oneDecimal = new Value.Num(new BigDecimal("1.00"));

        assertEquals(one, oneDecimal);
        assertEquals(one.hashCode(), oneDecimal.hashCode());
        assertEquals(one, Value.of(1.0));
        assertNotEquals(one, Value.text("1"));
    }

    @Test
    void deep_copy_is_independent() {
        var original = (Value.Mapping) Value.of(Map.of("list", List.of(1), "child", Map.of("a", 1)));
        var copy = original.deepCopy();

        ((Value.Sequence) copy.get("list")).add(Value.num(2));
        ((Value.Mapping) copy.get("child")).put("b", Value.num(2));

        assertEquals(Value.seq(1), original.get("list"));
        assertEquals(Value.of(Map.of("a", 1)), original.get("child"));
        assertNotEquals(original, copy);
    }

    @Test
    void java_null_is_stored_as_null_value() {
        var m = new Value.Mapping().put("a", null);
        var s = new Value.Sequence().add(null);

        assertSame(Value.Null.INSTANCE, m.get("a"));
        assertSame(Value.Null.INSTANCE, s.get(0));
    }

    @Test
    void remove_all_drops_every_equal_element() {
        var s = Value.seq("a", "b", "a");
        assertTrue(s.removeAll(Value.text("a")));
        assertEquals(Value.seq("b"), s);
        assertFalse(s.removeAll(Value.text("zzz")));
    }

    @Test
    void ordering_groups_by_kind_then_natural_order() {
        var values = new ArrayList<Value>(List.of(
                Value.of(Map.of("k", 1)),
                Value.text("b"),
                Value.seq(2),
                Value.num(10),
                Value.text("a"),
                Value.nil(),
                Value.num(2),
                Value.bool(true),
                Value.seq(1, 5),
                Value.bool(false)
        ));

        values.sort(ValueOrdering.NATURAL);

        assertEquals(List.of(
                Value.nil(),
                Value.bool(false),
                Value.bool(true),
                Value.num(2),
                Value.num(10),
                Value.text("a"),
                Value.text("b"),
                Value.seq(1, 5),
                Value.seq(2),
                Value.of(Map.of("k", 1))
        ), values);
    }
}
