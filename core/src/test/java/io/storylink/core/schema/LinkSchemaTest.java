package io.storylink.core.schema;

import io.storylink.core.json.JsonDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkSchemaTest {

    private static final String PERSON = """
            {
              "type": "object",
              "required": ["name"],
              "additionalProperties": false,
              "properties": {
                "name": {"type": "string", "minLength": 1},
                "age":  {"type": "integer", "minimum": 0, "maximum": 150},
                "tags": {"type": "array", "items": {"type": "string"}, "maxItems": 3},
                "role": {"enum": ["admin", "user"]}
              }
            }
            """;

    private static List<SchemaViolation> check(String schema, String value) {
        return LinkSchema.compile(schema).validate(JsonDocument.parse(value));
    }

    @Test
    void conforming_value_has_no_violations() {
        assertTrue(check(PERSON, "{\"name\":\"ada\",\"age\":36,\"tags\":[\"x\"],\"role\":\"admin\"}").isEmpty());
    }

    @Test
    void violations_name_the_constraint_and_the_document_location() {
        var v = check(PERSON, "{\"age\":-1,\"tags\":[\"ok\",3]}");
        var keywords = v.stream().map(SchemaViolation::keyword).toList();

        assertTrue(keywords.contains("required"), v.toString());
        assertTrue(keywords.contains("minimum"), v.toString());
        assertTrue(keywords.contains("type"), v.toString());

        var typeViolation = v.stream().filter(x -> x.keyword().equals("type")).findFirst().orElseThrow();
        assertEquals("/tags/1", typeViolation.docPointer());
        assertEquals("#/properties/tags/items", typeViolation.schemaPointer());
    }

    @Test
    void additional_members_and_enum_mismatch_are_reported() {
        var v = check(PERSON, "{\"name\":\"n\",\"role\":\"root\",\"extra\":1}");
        var keywords = v.stream().map(SchemaViolation::keyword).toList();
        assertEquals(List.of("enum", "additionalProperties"), keywords);
    }

    @Test
    void integer_type_accepts_whole_decimals() {
        assertTrue(check("{\"type\":\"integer\"}", "3.0").isEmpty());
        assertFalse(check("{\"type\":\"integer\"}", "3.5").isEmpty());
    }

    @Test
    void boolean_schemas_and_combinators() {
        assertTrue(check("true", "{\"anything\":1}").isEmpty());
        assertFalse(check("false", "1").isEmpty());
        assertTrue(check("{\"anyOf\":[{\"type\":\"string\"},{\"type\":\"null\"}]}", "null").isEmpty());
        assertFalse(check("{\"anyOf\":[{\"type\":\"string\"},{\"type\":\"null\"}]}", "1").isEmpty());
        assertFalse(check("{\"not\":{\"const\":0}}", "0").isEmpty());
        assertFalse(check("{\"allOf\":[{\"minLength\":2},{\"pattern\":\"^a\"}]}", "\"ba\"").isEmpty());
    }

    @Test
    void invalid_schemas_fail_to_compile() {
        assertThrows(IllegalArgumentException.class, () -> LinkSchema.compile("{not json"));
        assertThrows(IllegalArgumentException.class, () -> LinkSchema.compile("{\"type\":\"object\"} trailing"));
        assertThrows(IllegalArgumentException.class, () -> LinkSchema.compile("42"));
        assertThrows(IllegalArgumentException.class, () -> LinkSchema.compile("{\"type\":\"thing\"}"));
        assertThrows(IllegalArgumentException.class, () -> LinkSchema.compile("{\"minLength\":-1}"));
        assertThrows(IllegalArgumentException.class, () -> LinkSchema.compile("{\"pattern\":\"(\"}"));
    }
}
