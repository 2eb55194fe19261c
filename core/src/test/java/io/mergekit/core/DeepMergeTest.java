package io.mergekit.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Preset entry points: merge, horizontalMerge, roleMerge.
 */
class DeepMergeTest {

    private final DeepMerge concat = new DeepMerge(true);
    private final DeepMerge union = new DeepMerge();

    @Test
    void merge_lets_overlay_replace_arrays_across_tiers() {
        var base = Value.of(Map.of("ports", List.of(80), "name", "base"));
        var overlay = Value.of(Map.of("ports", List.of(443)));

        var merged = concat.merge(overlay, base);

        assertEquals(Value.of(Map.of("ports", List.of(443), "name", "base")), merged);
    }

    @Test
    void horizontal_merge_concatenates_arrays() {
        var base = Value.of(Map.of("ports", List.of(80, 443)));
        var overlay = Value.of(Map.of("ports", List.of(443, 8080)));

        var merged = concat.horizontalMerge(overlay, base);

        assertEquals(Value.of(Map.of("ports", List.of(80, 443, 443, 8080))), merged);
    }

    @Test
    void role_merge_applies_merge_knockout() {
        var base = Value.of(Map.of("recipes", List.of("a", "b")));
        var overlay = Value.of(Map.of("recipes", List.of("!merge:a", "c")));

        var merged = concat.roleMerge(overlay, base);

        assertEquals(Value.of(Map.of("recipes", List.of("b", "c"))), merged);
    }

    @Test
    void plain_merge_treats_knockout_text_as_data() {
        var base = Value.of(Map.of("recipes", List.of("a")));
        var overlay = Value.of(Map.of("recipes", List.of("!merge:a")));

        assertEquals(overlay, concat.merge(overlay, base));
    }

    @Test
    void union_mode_merges_arrays_as_ordered_set() {
        var base = Value.seq("b", "a", "b");
        var overlay = Value.seq("c", "a");

        // dedup(base ++ overlay), first occurrence kept
        assertEquals(Value.seq("b", "a", "c"), union.merge(overlay, base));
        assertEquals(Value.seq("b", "a", "c"), union.horizontalMerge(overlay, base));
    }

    @Test
    void union_result_equals_dedup_of_concatenation() {
        var a = List.of(5, 1, 3, 1);
        var b = List.of(3, 2, 5);

        var expected = new LinkedHashSet<Object>(b);
        expected.addAll(a);

        assertEquals(Value.of(List.copyOf(expected)), union.merge(Value.of(a), Value.of(b)));
    }

    @Test
    void presets_do_not_modify_inputs() {
        var base = Value.of(Map.of("recipes", List.of("a", "b"), "env", Map.of("x", 1)));
        var overlay = Value.of(Map.of("recipes", List.of("!merge:a"), "env", Map.of("y", 2)));
        var baseBefore = base.deepCopy();
        var overlayBefore = overlay.deepCopy();

        concat.merge(overlay, base);
        concat.horizontalMerge(overlay, base);
        concat.roleMerge(overlay, base);

        assertEquals(baseBefore, base);
        assertEquals(overlayBefore, overlay);
    }

    @Test
    void disjoint_keys_are_all_kept_with_original_values() {
        var base = Value.of(Map.of("a", 1, "b", List.of(1, 2)));
        var overlay = Value.of(Map.of("c", Map.of("d", "e"), "f", false));

        var merged = (Value.Mapping) union.merge(overlay, base);

        assertEquals(4, merged.size());
        assertEquals(Value.num(1), merged.get("a"));
        assertEquals(Value.seq(1, 2), merged.get("b"));
        assertEquals(Value.of(Map.of("d", "e")), merged.get("c"));
        assertEquals(Value.bool(false), merged.get("f"));
    }

    @Test
    void preset_flag_is_exposed() {
        assertTrue(concat.legacyArrayConcat());
        assertFalse(union.legacyArrayConcat());
        assertFalse(new DeepMerge(false).legacyArrayConcat());
    }
}
