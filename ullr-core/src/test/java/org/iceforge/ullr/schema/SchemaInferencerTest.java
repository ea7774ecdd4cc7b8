package org.iceforge.ullr.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.ullr.decode.ResultDecoder;
import org.iceforge.ullr.logs.LogModels;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaInferencerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResultDecoder decoder = new ResultDecoder(mapper);
    private final SchemaInferencer inferencer = new SchemaInferencer(mapper);

    @Test
    void classifiesBackendTextBooleanBeforeNumber() {
        assertThat(inferencer.classifyText("true")).isEqualTo(FieldType.BOOLEAN);
        assertThat(inferencer.classifyText("FALSE")).isEqualTo(FieldType.BOOLEAN);
        assertThat(inferencer.classifyText("0")).isEqualTo(FieldType.NUMBER);
        assertThat(inferencer.classifyText("-12.5e3")).isEqualTo(FieldType.NUMBER);
        assertThat(inferencer.classifyText("{\"a\":1}")).isEqualTo(FieldType.OBJECT);
        assertThat(inferencer.classifyText("[1,2]")).isEqualTo(FieldType.ARRAY);
        assertThat(inferencer.classifyText("{oops")).isEqualTo(FieldType.STRING);
        assertThat(inferencer.classifyText("{\"a\":1} trailing")).isEqualTo(FieldType.STRING);
        assertThat(inferencer.classifyText("[1,2] and more")).isEqualTo(FieldType.STRING);
        assertThat(inferencer.classifyText("2026-10-19 11:59:00.000")).isEqualTo(FieldType.STRING);
        assertThat(inferencer.classifyText("NaN")).isEqualTo(FieldType.STRING);
        assertThat(inferencer.classifyText(null)).isEqualTo(FieldType.UNKNOWN);
    }

    @Test
    void classifiesDecodedValuesByJsonType() {
        assertThat(inferencer.classifyValue("5")).isEqualTo(FieldType.STRING);
        assertThat(inferencer.classifyValue(5)).isEqualTo(FieldType.NUMBER);
        assertThat(inferencer.classifyValue(false)).isEqualTo(FieldType.BOOLEAN);
        assertThat(inferencer.classifyValue(List.of())).isEqualTo(FieldType.ARRAY);
        assertThat(inferencer.classifyValue(Map.of())).isEqualTo(FieldType.OBJECT);
        assertThat(inferencer.classifyValue(null)).isEqualTo(FieldType.UNKNOWN);
    }

    @Test
    void stringAndNumberForSameFieldIsMixed() {
        SortedMap<String, SchemaEntry> schema = inferencer.infer(decoder.decode(List.of(
                LogModels.RawRow.of("@message", "{\"x\":\"5\"}"),
                LogModels.RawRow.of("@message", "{\"x\":5}"))));

        SchemaEntry x = schema.get("x");
        assertThat(x.type()).isEqualTo(FieldType.MIXED);
        assertThat(x.occurrences()).isEqualTo(2);
        assertThat(x.observedTypes()).containsExactlyInAnyOrder(FieldType.STRING, FieldType.NUMBER);
    }

    @Test
    void twentyRowSampleWithSplitLatencyTypes() {
        List<LogModels.RawRow> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(LogModels.RawRow.of(
                    "@timestamp", "2026-10-19 11:59:" + (10 + i) + ".000",
                    "@message", "{\"service\":\"api\",\"latency\":" + (i * 3) + ",\"ok\":true}"));
        }
        for (int i = 0; i < 10; i++) {
            rows.add(LogModels.RawRow.of(
                    "@timestamp", "2026-10-19 11:58:" + (10 + i) + ".000",
                    "@message", "{\"service\":\"worker\",\"latency\":\"" + i + "ms\"}"));
        }

        SortedMap<String, SchemaEntry> schema = inferencer.infer(decoder.decode(rows));

        assertThat(schema.get("latency").type()).isEqualTo(FieldType.MIXED);
        assertThat(schema.get("latency").occurrences()).isEqualTo(20);
        assertThat(schema.get("service").type()).isEqualTo(FieldType.STRING);
        assertThat(schema.get("ok").type()).isEqualTo(FieldType.BOOLEAN);
        assertThat(schema.get("ok").occurrences()).isEqualTo(10);
        assertThat(schema.get("@message").type()).isEqualTo(FieldType.OBJECT);
        assertThat(schema.get("@timestamp").type()).isEqualTo(FieldType.STRING);
        assertThat(schema.keySet()).containsExactly("@message", "@timestamp", "latency", "ok", "service");
    }

    @Test
    void absentFieldsContributeNothingAndNullsAddNoType() {
        SortedMap<String, SchemaEntry> schema = inferencer.infer(decoder.decode(List.of(
                LogModels.RawRow.of("@message", "{\"a\":1,\"n\":null}"),
                LogModels.RawRow.of("@message", "{\"b\":\"x\",\"n\":\"set\"}"),
                LogModels.RawRow.of("@message", "{\"only_null\":null}"))));

        assertThat(schema.get("a").type()).isEqualTo(FieldType.NUMBER);
        assertThat(schema.get("a").occurrences()).isEqualTo(1);
        assertThat(schema.get("n").type()).isEqualTo(FieldType.STRING);
        assertThat(schema.get("n").occurrences()).isEqualTo(2);
        assertThat(schema.get("only_null").type()).isEqualTo(FieldType.UNKNOWN);
    }

    @Test
    void plainAndJsonMessagesMakeMessageMixed() {
        SortedMap<String, SchemaEntry> schema = inferencer.infer(decoder.decode(List.of(
                LogModels.RawRow.of("@message", "{\"a\":1}"),
                LogModels.RawRow.of("@message", "started worker 3"))));

        assertThat(schema.get("@message").type()).isEqualTo(FieldType.MIXED);
    }

    @Test
    void resultDoesNotDependOnRowOrder() {
        List<LogModels.DecodedRow> rows = new ArrayList<>(decoder.decode(List.of(
                LogModels.RawRow.of("@message", "{\"x\":1,\"y\":[1]}"),
                LogModels.RawRow.of("@message", "{\"x\":\"one\"}"),
                LogModels.RawRow.of("@message", "{\"z\":{\"k\":1}}"),
                LogModels.RawRow.of("@ptr", "abc", "@message", "text"))));

        SortedMap<String, SchemaEntry> forward = inferencer.infer(rows);
        Collections.reverse(rows);
        SortedMap<String, SchemaEntry> backward = inferencer.infer(rows);

        assertThat(backward).isEqualTo(forward);
    }

    @Test
    void supersetNeverDropsFieldsOnlyWidensToMixed() {
        List<LogModels.DecodedRow> subset = decoder.decode(List.of(
                LogModels.RawRow.of("@message", "{\"x\":1,\"y\":true,\"u\":null}"),
                LogModels.RawRow.of("@message", "{\"z\":\"s\"}")));
        List<LogModels.DecodedRow> superset = new ArrayList<>(subset);
        superset.addAll(decoder.decode(List.of(
                LogModels.RawRow.of("@message", "{\"x\":\"one\",\"w\":[1]}"),
                LogModels.RawRow.of("@message", "{\"y\":false,\"u\":7}"))));

        SortedMap<String, SchemaEntry> small = inferencer.infer(subset);
        SortedMap<String, SchemaEntry> big = inferencer.infer(superset);

        assertThat(big.keySet()).containsAll(small.keySet());
        small.forEach((name, entry) -> {
            FieldType widened = big.get(name).type();
            // UNKNOWN is the bottom type and may become anything
            assertThat(entry.type() == FieldType.UNKNOWN || widened == entry.type() || widened == FieldType.MIXED)
                    .as("type of %s: %s -> %s", name, entry.type(), widened)
                    .isTrue();
        });
        assertThat(big.get("x").type()).isEqualTo(FieldType.MIXED);
        assertThat(big.get("y").type()).isEqualTo(FieldType.BOOLEAN);
        assertThat(small.get("u").type()).isEqualTo(FieldType.UNKNOWN);
        assertThat(big.get("u").type()).isEqualTo(FieldType.NUMBER);
    }

    @Test
    void emptySampleYieldsEmptySchema() {
        assertThat(inferencer.infer(List.of())).isEmpty();
        assertThat(inferencer.infer(null)).isEmpty();
    }
}
