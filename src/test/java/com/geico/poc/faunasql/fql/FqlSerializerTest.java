package com.geico.poc.faunasql.fql;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.geico.poc.faunasql.fql.Fql.*;
import static org.junit.jupiter.api.Assertions.*;

public class FqlSerializerTest {

    @Test
    @DisplayName("Object literals are wrapped so the store does not read their keys as functions")
    public void testObjectWrapping() {
        JsonNode json = FqlSerializer.serialize(obj("name", "Bob", "age", 30));

        assertEquals("Bob", json.path("object").path("name").asText());
        assertEquals(30, json.path("object").path("age").asInt());
        assertEquals(1, json.size());
    }

    @Test
    public void testCallKeysFollowForm() {
        JsonNode json = FqlSerializer.serialize(select(path("data", "name"), get(ref(collection("users"), value("7")))));

        assertTrue(json.has("select"));
        assertTrue(json.has("from"));
        assertFalse(json.has("default"), "an omitted default must not be sent");
        assertEquals("users", json.path("from").path("get").path("ref").path("collection").asText());
        assertEquals("7", json.path("from").path("get").path("id").asText());
    }

    @Test
    @DisplayName("A collection named by an expression is resolved when the query runs")
    public void testComputedCollection() {
        JsonNode json = FqlSerializer.serialize(ref(collection(select(path("table"), var("references"))), value("9")));

        assertEquals("references", json.path("ref").path("collection").path("from").path("var").asText());
        assertEquals("9", json.path("id").asText());
    }

    @Test
    public void testExplicitNullDefaultIsSent() {
        JsonNode json = FqlSerializer.serialize(select(path("data"), var("doc"), Fql.NULL));

        assertTrue(json.has("default"));
        assertTrue(json.get("default").isNull());
    }

    @Test
    public void testLambdaParameters() {
        JsonNode single = FqlSerializer.serialize(lambda("ref", get(var("ref"))));
        JsonNode pair = FqlSerializer.serialize(lambda(Arrays.asList("value", "ref"), var("ref")));

        assertEquals("ref", single.get("lambda").asText());
        assertTrue(pair.get("lambda").isArray());
        assertEquals("value", pair.get("lambda").get(0).asText());
        assertEquals("ref", pair.path("expr").path("var").asText());
    }

    @Test
    @DisplayName("Let bindings keep their declaration order")
    public void testLetBindingOrder() {
        Map<String, Expr> bindings = new LinkedHashMap<>();
        bindings.put("refs", match(index("users_all")));
        bindings.put("count", count(var("refs")));
        JsonNode json = FqlSerializer.serialize(let(bindings, var("count")));

        assertEquals(2, json.get("let").size());
        assertTrue(json.get("let").get(0).has("refs"));
        assertTrue(json.get("let").get(1).has("count"));
        assertEquals("count", json.path("in").path("var").asText());
    }

    @Test
    public void testTemporalLiterals() {
        OffsetDateTime timestamp = OffsetDateTime.of(2021, 3, 4, 5, 6, 7, 0, ZoneOffset.UTC);

        assertEquals("2021-03-04T05:06:07Z", FqlSerializer.serialize(value(timestamp)).path("@ts").asText());
        assertEquals("2021-03-04", FqlSerializer.serialize(value(LocalDate.of(2021, 3, 4))).path("@date").asText());
    }

    @Test
    public void testNumericLiterals() {
        assertTrue(FqlSerializer.serialize(value(new BigDecimal("12"))).isIntegralNumber());
        assertEquals(1.5, FqlSerializer.serialize(value(new BigDecimal("1.5"))).asDouble(), 0.0);
        assertEquals(3L, FqlSerializer.serialize(value(3)).asLong());
    }

    @Test
    public void testAppendPutsBaseFirst() {
        JsonNode json = FqlSerializer.serialize(append(arr(value(2)), arr(value(1))));

        assertEquals(2, json.get("append").get(0).asInt());
        assertEquals(1, json.get("collection").get(0).asInt());
    }

    @Test
    public void testCallArityIsChecked() {
        assertThrows(IllegalArgumentException.class, () -> new Call(Form.IF, Literal.TRUE, Literal.NULL));
        assertThrows(IllegalArgumentException.class, () -> new Call(Form.GET, (Expr) null));
        assertThrows(IllegalArgumentException.class, () -> Literal.of(new Object()));
    }

    @Test
    public void testToJson() {
        assertEquals("{\"collection\":\"users\"}", FqlSerializer.toJson(collection("users")));
    }
}
