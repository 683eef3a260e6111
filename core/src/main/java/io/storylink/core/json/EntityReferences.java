package io.storylink.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Envelope that marks a link value as an opaque entity reference instead of
 * structured data: {@code {"@entityRef": "<reference>"}}.
 */
public final class EntityReferences {

    public static final String ENTITY_REF_MEMBER = "@entityRef";

    private EntityReferences() {
        // utility
    }

    public static String toJson(String entityReference) {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        obj.put(ENTITY_REF_MEMBER, entityReference);
        return JsonDocument.toJson(obj);
    }

    /** The reference held by an envelope, or null if {@code json} is not one. */
    public static String fromJson(String json) {
        JsonNode node = JsonDocument.parse(json);
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode ref = node.get(ENTITY_REF_MEMBER);
        return ref != null && ref.isTextual() ? ref.asText() : null;
    }
}
