package com.geico.poc.faunasql.fql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Writes expression trees in the store's JSON wire format.
 *
 * <ul>
 *   <li>object literals are wrapped as {@code {"object": {...}}}</li>
 *   <li>timestamps become {@code {"@ts": "..."}}, dates {@code {"@date": "..."}}</li>
 *   <li>a call is one JSON object keyed by its {@link Form} keys</li>
 * </ul>
 */
public class FqlSerializer implements ExprVisitor<JsonNode> {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final FqlSerializer INSTANCE = new FqlSerializer();

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public static JsonNode serialize(Expr expr) {
        return expr.accept(INSTANCE);
    }

    public static String toJson(Expr expr) {
        try {
            return objectMapper.writeValueAsString(serialize(expr));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write expression as JSON", e);
        }
    }

    @Override
    public JsonNode visitLiteral(Literal literal) {
        Object value = literal.getValue();
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof Boolean) {
            return nodes.booleanNode((Boolean) value);
        }
        if (value instanceof Long) {
            return nodes.numberNode((Long) value);
        }
        if (value instanceof Double) {
            return nodes.numberNode((Double) value);
        }
        if (value instanceof OffsetDateTime) {
            ObjectNode node = nodes.objectNode();
            node.put("@ts", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) value));
            return node;
        }
        if (value instanceof LocalDate) {
            ObjectNode node = nodes.objectNode();
            node.put("@date", value.toString());
            return node;
        }
        return nodes.textNode(value.toString());
    }

    @Override
    public JsonNode visitArray(ArrayExpr array) {
        ArrayNode node = nodes.arrayNode();
        for (Expr element : array.getElements()) {
            node.add(element.accept(this));
        }
        return node;
    }

    @Override
    public JsonNode visitObject(ObjectExpr object) {
        ObjectNode fields = nodes.objectNode();
        for (Map.Entry<String, Expr> entry : object.getFields().entrySet()) {
            fields.set(entry.getKey(), entry.getValue().accept(this));
        }
        ObjectNode node = nodes.objectNode();
        node.set("object", fields);
        return node;
    }

    @Override
    public JsonNode visitVar(Var var) {
        ObjectNode node = nodes.objectNode();
        node.put("var", var.getName());
        return node;
    }

    @Override
    public JsonNode visitLambda(Lambda lambda) {
        ObjectNode node = nodes.objectNode();
        if (lambda.getParams().size() == 1) {
            node.put("lambda", lambda.getParams().get(0));
        } else {
            ArrayNode params = node.putArray("lambda");
            lambda.getParams().forEach(params::add);
        }
        node.set("expr", lambda.getBody().accept(this));
        return node;
    }

    @Override
    public JsonNode visitLet(Let let) {
        ObjectNode node = nodes.objectNode();
        ArrayNode bindings = node.putArray("let");
        for (Map.Entry<String, Expr> binding : let.getBindings().entrySet()) {
            ObjectNode entry = nodes.objectNode();
            entry.set(binding.getKey(), binding.getValue().accept(this));
            bindings.add(entry);
        }
        node.set("in", let.getIn().accept(this));
        return node;
    }

    @Override
    public JsonNode visitCall(Call call) {
        ObjectNode node = nodes.objectNode();
        for (int i = 0; i < call.getForm().arity(); i++) {
            Expr arg = call.arg(i);
            if (arg != null) {
                node.set(call.getForm().getKeys().get(i), arg.accept(this));
            }
        }
        return node;
    }
}
