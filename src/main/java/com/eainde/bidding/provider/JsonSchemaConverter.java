package com.eainde.bidding.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds langchain4j response schemas from plain JSON Schema text, so prompts and their
 * expected output shapes can be declared side by side as strings.
 *
 * <p>Supports {@code object}, {@code array}, {@code string} (with {@code enum}),
 * {@code integer}, {@code number} and {@code boolean}. A type union such as
 * {@code ["string", "null"]} resolves to its first non-null member.</p>
 */
public final class JsonSchemaConverter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema parse(String name, String jsonSchema) {
        JsonNode root;
        try {
            root = MAPPER.readTree(jsonSchema);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON schema for '" + name + "'", e);
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("JSON schema for '" + name + "' must be an object");
        }
        return JsonSchema.builder()
                .name(name)
                .rootElement(toElement(root))
                .build();
    }

    private static JsonSchemaElement toElement(JsonNode node) {
        String description = textOrNull(node, "description");
        switch (resolveType(node)) {
            case "object":
                return toObject(node, description);
            case "array": {
                JsonArraySchema.Builder array = JsonArraySchema.builder().description(description);
                array.items(node.has("items") ? toElement(node.get("items")) : JsonStringSchema.builder().build());
                return array.build();
            }
            case "integer":
                return JsonIntegerSchema.builder().description(description).build();
            case "number":
                return JsonNumberSchema.builder().description(description).build();
            case "boolean":
                return JsonBooleanSchema.builder().description(description).build();
            default:
                if (node.has("enum")) {
                    return JsonEnumSchema.builder().description(description).enumValues(strings(node.get("enum"))).build();
                }
                return JsonStringSchema.builder().description(description).build();
        }
    }

    private static JsonObjectSchema toObject(JsonNode node, String description) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
        JsonNode properties = node.path("properties");
        properties.fieldNames().forEachRemaining(key -> builder.addProperty(key, toElement(properties.get(key))));
        if (node.path("required").isArray()) {
            builder.required(strings(node.get("required")));
        }
        return builder.build();
    }

    private static String resolveType(JsonNode node) {
        JsonNode type = node.get("type");
        if (type == null) {
            return node.has("properties") ? "object" : "string";
        }
        if (type.isArray()) {
            for (JsonNode member : type) {
                if (!"null".equals(member.asText())) {
                    return member.asText();
                }
            }
            return "string";
        }
        return type.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }

    private static String textOrNull(JsonNode node, String key) {
        return node.hasNonNull(key) ? node.get(key).asText() : null;
    }
}
