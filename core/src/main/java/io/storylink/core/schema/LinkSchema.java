package io.storylink.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.storylink.core.json.JsonDocument;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled JSON Schema used to check link values after each mutation.
 * <p>
 * Validation is advisory: callers log violations and never block a write.
 * Supported keywords (a pragmatic subset of draft-07):
 * {@code type, enum, const, properties, required, additionalProperties,
 * items, minItems, maxItems, minLength, maxLength, pattern, minimum, maximum,
 * allOf, anyOf, not}. Unknown keywords are ignored.
 * <p>
 * Compile once, validate many times; instances are immutable and thread safe.
 */
public final class LinkSchema {

    private final Node root;

    private LinkSchema(Node root) {
        this.root = root;
    }

    /**
     * Parse and compile a schema.
     *
     * @throws IllegalArgumentException if the text is not JSON or not a valid schema
     */
    public static LinkSchema compile(String schemaJson) {
        JsonNode doc = JsonDocument.parse(schemaJson);
        if (doc == null) {
            throw new IllegalArgumentException("schema is not valid JSON");
        }
        return new LinkSchema(compileNode(doc, "#"));
    }

    /** Validate a value; returns an empty list when it conforms. */
    public List<SchemaViolation> validate(JsonNode value) {
        var out = new ArrayList<SchemaViolation>();
        root.check(value, "", out);
        return out;
    }

    // ---------- compiled form ----------

    private record Node(
            String schemaPointer,
            boolean rejectAll,
            Set<String> types,
            List<JsonNode> enumValues,
            JsonNode constValue,
            Map<String, Node> properties,
            List<String> required,
            Boolean additionalAllowed,
            Node additionalSchema,
            Node items,
            Integer minItems,
            Integer maxItems,
            Integer minLength,
            Integer maxLength,
            Pattern pattern,
            Double minimum,
            Double maximum,
            List<Node> allOf,
            List<Node> anyOf,
            Node not
    ) {
        void check(JsonNode v, String at, List<SchemaViolation> out) {
            if (rejectAll) {
                out.add(new SchemaViolation(schemaPointer, "false", at, "no value allowed"));
                return;
            }
            if (!types.isEmpty() && types.stream().noneMatch(t -> hasType(v, t))) {
                out.add(new SchemaViolation(schemaPointer, "type", at, "expected " + types + " but was " + typeOf(v)));
                return;
            }
            if (enumValues != null && !enumValues.contains(v)) {
                out.add(new SchemaViolation(schemaPointer, "enum", at, "value not in enum"));
            }
            if (constValue != null && !constValue.equals(v)) {
                out.add(new SchemaViolation(schemaPointer, "const", at, "value differs from const"));
            }
            if (v.isObject()) {
                checkObject(v, at, out);
            }
            if (v.isArray()) {
                if (minItems != null && v.size() < minItems) {
                    out.add(new SchemaViolation(schemaPointer, "minItems", at, "fewer than " + minItems + " items"));
                }
                if (maxItems != null && v.size() > maxItems) {
                    out.add(new SchemaViolation(schemaPointer, "maxItems", at, "more than " + maxItems + " items"));
                }
                if (items != null) {
                    for (int i = 0; i < v.size(); i++) {
                        items.check(v.get(i), at + "/" + i, out);
                    }
                }
            }
            if (v.isTextual()) {
                int len = v.asText().codePointCount(0, v.asText().length());
                if (minLength != null && len < minLength) {
                    out.add(new SchemaViolation(schemaPointer, "minLength", at, "shorter than " + minLength));
                }
                if (maxLength != null && len > maxLength) {
                    out.add(new SchemaViolation(schemaPointer, "maxLength", at, "longer than " + maxLength));
                }
                if (pattern != null && !pattern.matcher(v.asText()).find()) {
                    out.add(new SchemaViolation(schemaPointer, "pattern", at, "does not match " + pattern.pattern()));
                }
            }
            if (v.isNumber()) {
                double d = v.asDouble();
                if (minimum != null && d < minimum) {
                    out.add(new SchemaViolation(schemaPointer, "minimum", at, d + " < " + minimum));
                }
                if (maximum != null && d > maximum) {
                    out.add(new SchemaViolation(schemaPointer, "maximum", at, d + " > " + maximum));
                }
            }
            for (Node n : allOf) {
                n.check(v, at, out);
            }
            if (!anyOf.isEmpty()) {
                boolean any = anyOf.stream().anyMatch(n -> {
                    var tmp = new ArrayList<SchemaViolation>();
                    n.check(v, at, tmp);
                    return tmp.isEmpty();
                });
                if (!any) {
                    out.add(new SchemaViolation(schemaPointer, "anyOf", at, "no alternative matched"));
                }
            }
            if (not != null) {
                var tmp = new ArrayList<SchemaViolation>();
                not.check(v, at, tmp);
                if (tmp.isEmpty()) {
                    out.add(new SchemaViolation(schemaPointer, "not", at, "value matched a forbidden schema"));
                }
            }
        }

        private void checkObject(JsonNode v, String at, List<SchemaViolation> out) {
            for (String r : required) {
                if (!v.has(r)) {
                    out.add(new SchemaViolation(schemaPointer, "required", at, "missing member " + r));
                }
            }
            Iterator<Map.Entry<String, JsonNode>> it = v.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String childAt = at + "/" + e.getKey();
                Node prop = properties.get(e.getKey());
                if (prop != null) {
                    prop.check(e.getValue(), childAt, out);
                } else if (additionalSchema != null) {
                    additionalSchema.check(e.getValue(), childAt, out);
                } else if (Boolean.FALSE.equals(additionalAllowed)) {
                    out.add(new SchemaViolation(schemaPointer, "additionalProperties", childAt,
                            "member " + e.getKey() + " not allowed"));
                }
            }
        }
    }

    private static Node compileNode(JsonNode s, String pointer) {
        if (s.isBoolean()) {
            return emptyNode(pointer, !s.booleanValue());
        }
        if (!s.isObject()) {
            throw new IllegalArgumentException("schema at " + pointer + " must be an object or boolean");
        }

        Set<String> types = new LinkedHashSet<>();
        JsonNode t = s.get("type");
        if (t != null) {
            if (t.isTextual()) {
                types.add(checkType(t.asText(), pointer));
            } else if (t.isArray()) {
                t.forEach(x -> types.add(checkType(x.asText(), pointer)));
            } else {
                throw new IllegalArgumentException("'type' at " + pointer + " must be a string or array");
            }
        }

        List<JsonNode> enumValues = null;
        JsonNode e = s.get("enum");
        if (e != null) {
            if (!e.isArray()) throw new IllegalArgumentException("'enum' at " + pointer + " must be an array");
            enumValues = new ArrayList<>();
            e.forEach(enumValues::add);
        }

        Map<String, Node> properties = new LinkedHashMap<>();
        JsonNode props = s.get("properties");
        if (props != null) {
            if (!props.isObject()) throw new IllegalArgumentException("'properties' at " + pointer + " must be an object");
            props.fields().forEachRemaining(p ->
                    properties.put(p.getKey(), compileNode(p.getValue(), pointer + "/properties/" + p.getKey())));
        }

        List<String> required = new ArrayList<>();
        JsonNode req = s.get("required");
        if (req != null) {
            if (!req.isArray()) throw new IllegalArgumentException("'required' at " + pointer + " must be an array");
            req.forEach(r -> required.add(r.asText()));
        }

        Boolean additionalAllowed = null;
        Node additionalSchema = null;
        JsonNode add = s.get("additionalProperties");
        if (add != null) {
            if (add.isBoolean()) {
                additionalAllowed = add.booleanValue();
            } else {
                additionalSchema = compileNode(add, pointer + "/additionalProperties");
            }
        }

        Pattern pattern = null;
        JsonNode pat = s.get("pattern");
        if (pat != null) {
            try {
                pattern = Pattern.compile(pat.asText());
            } catch (PatternSyntaxException ex) {
                throw new IllegalArgumentException("'pattern' at " + pointer + " is not a valid regex", ex);
            }
        }

        return new Node(
                pointer,
                false,
                types,
                enumValues,
                s.get("const"),
                properties,
                required,
                additionalAllowed,
                additionalSchema,
                s.has("items") ? compileNode(s.get("items"), pointer + "/items") : null,
                intOrNull(s, "minItems", pointer),
                intOrNull(s, "maxItems", pointer),
                intOrNull(s, "minLength", pointer),
                intOrNull(s, "maxLength", pointer),
                pattern,
                numberOrNull(s, "minimum", pointer),
                numberOrNull(s, "maximum", pointer),
                compileList(s, "allOf", pointer),
                compileList(s, "anyOf", pointer),
                s.has("not") ? compileNode(s.get("not"), pointer + "/not") : null
        );
    }

    private static Node emptyNode(String pointer, boolean rejectAll) {
        return new Node(pointer, rejectAll, Set.of(), null, null, Map.of(), List.of(),
                null, null, null, null, null, null, null, null, null, null,
                List.of(), List.of(), null);
    }

    private static List<Node> compileList(JsonNode s, String keyword, String pointer) {
        JsonNode arr = s.get(keyword);
        if (arr == null) {
            return List.of();
        }
        if (!arr.isArray() || arr.isEmpty()) {
            throw new IllegalArgumentException("'" + keyword + "' at " + pointer + " must be a non-empty array");
        }
        var out = new ArrayList<Node>(arr.size());
        for (int i = 0; i < arr.size(); i++) {
            out.add(compileNode(arr.get(i), pointer + "/" + keyword + "/" + i));
        }
        return out;
    }

    private static Integer intOrNull(JsonNode s, String keyword, String pointer) {
        JsonNode n = s.get(keyword);
        if (n == null) return null;
        if (!n.canConvertToInt() || n.asInt() < 0) {
            throw new IllegalArgumentException("'" + keyword + "' at " + pointer + " must be a non-negative integer");
        }
        return n.asInt();
    }

    private static Double numberOrNull(JsonNode s, String keyword, String pointer) {
        JsonNode n = s.get(keyword);
        if (n == null) return null;
        if (!n.isNumber()) throw new IllegalArgumentException("'" + keyword + "' at " + pointer + " must be a number");
        return n.asDouble();
    }

    private static String checkType(String type, String pointer) {
        return switch (type) {
            case "object", "array", "string", "number", "integer", "boolean", "null" -> type;
            default -> throw new IllegalArgumentException("unknown type '" + type + "' at " + pointer);
        };
    }

    private static boolean hasType(JsonNode v, String type) {
        return switch (type) {
            case "object" -> v.isObject();
            case "array" -> v.isArray();
            case "string" -> v.isTextual();
            case "number" -> v.isNumber();
            case "integer" -> v.isIntegralNumber()
                    || (v.isNumber() && v.asDouble() == Math.rint(v.asDouble()));
            case "boolean" -> v.isBoolean();
            case "null" -> v.isNull();
            default -> false;
        };
    }

    private static String typeOf(JsonNode v) {
        if (v.isObject()) return "object";
        if (v.isArray()) return "array";
        if (v.isTextual()) return "string";
        if (v.isNumber()) return "number";
        if (v.isBoolean()) return "boolean";
        if (v.isNull()) return "null";
        return v.getNodeType().name().toLowerCase();
    }
}
