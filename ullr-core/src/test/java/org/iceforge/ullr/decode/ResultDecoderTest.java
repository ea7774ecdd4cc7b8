package org.iceforge.ullr.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.ullr.logs.LogModels;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ResultDecoderTest {

    private final ResultDecoder decoder = new ResultDecoder(new ObjectMapper());

    @Test
    void flattensTopLevelKeysOfJsonMessage() {
        LogModels.RawRow row = LogModels.RawRow.of(
                "@timestamp", "2026-10-19 11:59:00.000",
                "@message", "{\"level\":\"INFO\",\"code\":200}");

        LogModels.DecodedRow decoded = decoder.decode(row);

        assertThat(decoded.raw()).isEqualTo(row);
        assertThat(decoded.flattened()).containsExactly(entry("level", "INFO"), entry("code", 200));
        assertThat(decoded.fields()).containsKeys("@timestamp", "@message", "level", "code");
        assertThat(decoded.fields().get("@message")).isEqualTo("{\"level\":\"INFO\",\"code\":200}");
    }

    @Test
    void plainTextMessagePassesThrough() {
        LogModels.RawRow row = LogModels.RawRow.of("@message", "GET /health 200 3ms");

        LogModels.DecodedRow decoded = decoder.decode(row);

        assertThat(decoded.flattened()).isEmpty();
        assertThat(decoded.fields()).containsExactly(entry("@message", "GET /health 200 3ms"));
    }

    @Test
    void brokenJsonScalarsAndArraysPassThrough() {
        List<LogModels.RawRow> rows = List.of(
                LogModels.RawRow.of("@message", "{\"level\":\"INFO\""),
                LogModels.RawRow.of("@message", "{not json at all}"),
                LogModels.RawRow.of("@message", "[1,2,3]"),
                LogModels.RawRow.of("@message", "42"),
                LogModels.RawRow.of("@message", "\"quoted\""),
                LogModels.RawRow.of("@message", ""),
                LogModels.RawRow.of("@timestamp", "2026-10-19 11:59:00.000"));

        List<LogModels.DecodedRow> decoded = decoder.decode(rows);

        assertThat(decoded).hasSize(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            assertThat(decoded.get(i).raw()).isEqualTo(rows.get(i));
            assertThat(decoded.get(i).flattened()).isEmpty();
        }
    }

    @Test
    void objectFollowedByTextIsNotJson() {
        LogModels.RawRow row = LogModels.RawRow.of("@message", "{\"level\":\"INFO\"} request took 3ms");

        LogModels.DecodedRow decoded = decoder.decode(row);

        assertThat(decoded.flattened()).isEmpty();
        assertThat(decoded.fields()).containsExactly(entry("@message", "{\"level\":\"INFO\"} request took 3ms"));
    }

    @Test
    void flattenedKeysNeverShadowBackendFields() {
        LogModels.RawRow row = LogModels.RawRow.of(
                "@timestamp", "2026-10-19 11:59:00.000",
                "@message", "{\"@timestamp\":\"forged\",\"@message\":\"inner\",\"user\":\"ana\"}");

        LogModels.DecodedRow decoded = decoder.decode(row);

        assertThat(decoded.flattened()).containsOnlyKeys("user");
        assertThat(decoded.fields().get("@timestamp")).isEqualTo("2026-10-19 11:59:00.000");
        assertThat(decoded.fields().get("@message")).isEqualTo(row.value("@message").orElseThrow());
    }

    @Test
    void nestedValuesKeepTheirStructure() {
        LogModels.RawRow row = LogModels.RawRow.of("@message",
                "{\"req\":{\"path\":\"/a\",\"ms\":12},\"tags\":[\"x\",\"y\"],\"ok\":true,\"err\":null,\"ratio\":0.5}");

        Map<String, Object> flat = decoder.decode(row).flattened();

        assertThat(flat.get("req")).isInstanceOf(Map.class);
        Map<?, ?> req = (Map<?, ?>) flat.get("req");
        assertThat(req.get("path")).isEqualTo("/a");
        assertThat(req.get("ms")).isEqualTo(12);
        assertThat(flat.get("tags")).isEqualTo(List.of("x", "y"));
        assertThat(flat.get("ok")).isEqualTo(Boolean.TRUE);
        assertThat(flat).containsEntry("err", null);
        assertThat(flat.get("ratio")).isEqualTo(0.5d);
    }

    @Test
    void decodingIsIdempotent() {
        List<LogModels.RawRow> rows = List.of(
                LogModels.RawRow.of("@message", "{\"a\":1,\"b\":{\"c\":[1,2]}}"),
                LogModels.RawRow.of("@message", "plain"));

        assertThat(decoder.decode(rows)).isEqualTo(decoder.decode(rows));
    }

    @Test
    void honoursConfiguredMessageField() {
        ResultDecoder custom = new ResultDecoder(new ObjectMapper(), "body");
        LogModels.RawRow row = LogModels.RawRow.of("@message", "{\"a\":1}", "body", "{\"b\":2}");

        assertThat(custom.decode(row).flattened()).containsOnlyKeys("b");
    }
}
