package com.eainde.bidding.provider;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    @Test
    void parse_shouldMapPrimitivesAndRequired() {
        JsonSchema schema = JsonSchemaConverter.parse("Field", """
                {
                  "type": "object",
                  "properties": {
                    "found": { "type": "boolean" },
                    "value": { "type": "string", "description": "提取的值" },
                    "evidence_id": { "type": "integer" }
                  },
                  "required": ["found"]
                }
                """);

        assertThat(schema.name()).isEqualTo("Field");
        JsonObjectSchema root = (JsonObjectSchema) schema.rootElement();
        assertThat(root.properties()).containsOnlyKeys("found", "value", "evidence_id");
        assertThat(root.properties().get("found")).isInstanceOf(JsonBooleanSchema.class);
        assertThat(root.properties().get("value")).isInstanceOf(JsonStringSchema.class);
        assertThat(((JsonStringSchema) root.properties().get("value")).description()).isEqualTo("提取的值");
        assertThat(root.properties().get("evidence_id")).isInstanceOf(JsonIntegerSchema.class);
        assertThat(root.required()).containsExactly("found");
    }

    @Test
    void parse_shouldResolveNullableUnionsToTheNonNullType() {
        JsonSchema schema = JsonSchemaConverter.parse("Nullable", """
                { "type": "object", "properties": { "id": { "type": ["null", "integer"] } } }
                """);

        JsonObjectSchema root = (JsonObjectSchema) schema.rootElement();
        assertThat(root.properties().get("id")).isInstanceOf(JsonIntegerSchema.class);
    }

    @Test
    void parse_shouldHandleArraysOfObjectsAndEnums() {
        JsonSchema schema = JsonSchemaConverter.parse("Scores", """
                {
                  "type": "object",
                  "properties": {
                    "scores": { "type": "array", "items": { "type": "object", "properties": { "id": { "type": "integer" } } } },
                    "status": { "type": "string", "enum": ["FOUND", "NOT_FOUND"] }
                  }
                }
                """);

        JsonObjectSchema root = (JsonObjectSchema) schema.rootElement();
        JsonArraySchema scores = (JsonArraySchema) root.properties().get("scores");
        assertThat(scores.items()).isInstanceOf(JsonObjectSchema.class);
        JsonEnumSchema status = (JsonEnumSchema) root.properties().get("status");
        assertThat(status.enumValues()).containsExactly("FOUND", "NOT_FOUND");
    }

    @Test
    void parse_shouldRejectInvalidJson() {
        assertThatThrownBy(() -> JsonSchemaConverter.parse("Broken", "{ not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Broken");
    }
}
