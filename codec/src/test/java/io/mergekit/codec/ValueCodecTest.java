package io.mergekit.codec;

import io.mergekit.core.DeepMerge;
import io.mergekit.core.MergeOptions;
import io.mergekit.core.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies configuration layers can be read from and written back to JSON.
 */
class ValueCodecTest {

    @TempDir
    Path tmp;

    private final ValueCodec codec = new ValueCodec();

    @Test
    void parses_every_json_shape() {
        var v = codec.parse("""
                {
                  "name": "web",
                  "port": 8080,
                  "ratio": 0.25,
                  "tls": true,
                  "owner": null,
                  "tags": ["a", 1],
                  "db": {"host": "localhost"}
                }
                """);

        var m = assertInstanceOf(Value.Mapping.class, v);
        assertEquals(List.of("name", "port", "ratio", "tls", "owner", "tags", "db"), List.copyOf(m.keys()));
        assertEquals(Value.text("web"), m.get("name"));
        assertEquals(Value.num(8080), m.get("port"));
        assertEquals(new Value.Num(new BigDecimal("0.25")), m.get("ratio"));
        assertEquals(Value.bool(true), m.get("tls"));
        assertSame(Value.Null.INSTANCE, m.get("owner"));
        assertEquals(Value.seq("a", 1), m.get("tags"));
        assertEquals(Value.text("localhost"), ((Value.Mapping) m.get("db")).get("host"));
    }

    @Test
    void writes_integral_numbers_without_fraction() {
        var v = new Value.Mapping()
                .put("port", new Value.Num(new BigDecimal("8080.0")))
                .put("ratio", new Value.Num(new BigDecimal("0.5")))
                .put("tags", Value.seq("a", true))
                .put("owner", Value.nil());

        assertEquals("{\"port\":8080,\"ratio\":0.5,\"tags\":[\"a\",true],\"owner\":null}", codec.write(v, true));
    }

    @Test
    void pretty_output_parses_back_to_the_same_tree() {
        var v = codec.parse("{\"a\":{\"b\":[1,2,{\"c\":\"d\"}]}}");
        var pretty = codec.write(v, false);

        assertTrue(pretty.contains("\n"));
        assertEquals(v, codec.parse(pretty));
    }

    @Test
    void reads_layers_from_files_in_order() throws Exception {
        Path base = tmp.resolve("base.json");
        Path site = tmp.resolve("site.json");
        Files.writeString(base, "{\"name\":\"base\",\"ports\":[80]}");
        Files.writeString(site, "{\"ports\":[443]}");

        var layers = codec.readAll(List.of(base, site));

        assertEquals(2, layers.size());
        var merged = new DeepMerge(false).merge(layers.get(1), layers.get(0));
        assertEquals(codec.parse("{\"name\":\"base\",\"ports\":[80,443]}"), merged);
    }

    @Test
    void integral_numbers_are_written_without_fraction() {
        assertTrue(codec.toJson(new Value.Num(new BigDecimal("1E+2"))).isBigInteger());
        assertEquals("[100,42,0]", codec.write(codec.parse("[1E+2, 42.0, 0.00]"), true));
    }

    @Test
    void huge_exponents_stay_in_exponent_form() {
        var huge = new Value.Num(new BigDecimal("1e999999999"));

        var node = codec.toJson(huge);

        assertTrue(node.isBigDecimal());
        assertEquals(new BigDecimal("1e999999999"), node.decimalValue());
        assertEquals(huge, codec.parse(codec.write(huge, true)));
    }

    @Test
    void missing_file_names_the_path() {
        Path missing = tmp.resolve("missing.json");

        var e = assertThrows(UncheckedIOException.class, () -> codec.read(missing));
        assertTrue(e.getMessage().contains(missing.toString()));
    }

    @Test
    void malformed_text_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\": "));
    }

    @Test
    void knockout_example_round_trips_through_json() {
        var source = codec.parse("{\"x\": [\"!merge:1\", \"2\"]}");
        var dest = codec.parse("{\"x\": [\"1\", \"3\"]}");
        var opts = MergeOptions.builder()
                .knockoutPrefix("!merge")
                .sortMergedArrays(true)
                .build();

        var merged = DeepMerge.deepMerge(source, dest, opts);

        assertEquals("{\"x\":[\"2\",\"3\"]}", codec.write(merged, true));
    }
}
