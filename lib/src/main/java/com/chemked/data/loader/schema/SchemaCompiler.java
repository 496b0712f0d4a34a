package com.chemked.data.loader.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles the plain-map form of a schema into {@link FieldSchema} trees. The rule vocabulary is
 * {@code type, required, nullable, allowed, min, max, minlength, maxlength, schema, items, excludes,
 * dependencies, anyof}; any key starting with {@code isvalid_} names a custom rule. Unknown keys are
 * rejected so that typos in schema files surface immediately.
 */
final class SchemaCompiler {

    static final String CUSTOM_RULE_PREFIX = "isvalid_";

    private static final Set<String> STRUCTURAL_KEYS =
            Set.of(
                    "type",
                    "required",
                    "nullable",
                    "allowed",
                    "min",
                    "max",
                    "minlength",
                    "maxlength",
                    "schema",
                    "items",
                    "excludes",
                    "dependencies",
                    "anyof");

    private final Map<Object, FieldSchema> compiled = new IdentityHashMap<>();

    /** Compile a mapping of field name to field definition into a root {@code dict} schema. */
    FieldSchema compileRoot(Map<?, ?> definitions) {
        return FieldSchema.builder().type(FieldType.DICT).fields(compileFields(definitions, "")).build();
    }

    private Map<String, FieldSchema> compileFields(Map<?, ?> definitions, String location) {
        Map<String, FieldSchema> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : definitions.entrySet()) {
            String name = String.valueOf(entry.getKey());
            fields.put(name, compileField(entry.getValue(), join(location, name)));
        }
        return fields;
    }

    private FieldSchema compileField(Object raw, String location) {
        if (!(raw instanceof Map<?, ?> definition)) {
            throw new IllegalArgumentException("Schema definition for '" + location + "' must be a mapping");
        }
        FieldSchema cached = compiled.get(raw);
        if (cached != null) {
            return cached;
        }
        FieldSchema.Builder builder = FieldSchema.builder();
        List<FieldType> types = new ArrayList<>();
        Object typeValue = definition.get("type");
        if (typeValue != null) {
            for (String name : stringList(typeValue, location, "type")) {
                FieldType type = FieldType.fromSchemaName(name);
                types.add(type);
                builder.type(type);
            }
        }

        for (Map.Entry<?, ?> entry : definition.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (key.startsWith(CUSTOM_RULE_PREFIX)) {
                if (Boolean.TRUE.equals(value)) {
                    builder.rule(key);
                } else if (!Boolean.FALSE.equals(value)) {
                    throw new IllegalArgumentException(
                            "Custom rule '" + key + "' at '" + location + "' must be true or false");
                }
                continue;
            }
            if (!STRUCTURAL_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown schema rule '" + key + "' at '" + location + "'");
            }
            switch (key) {
                case "type":
                    break;
                case "required":
                    builder.required(bool(value, location, key));
                    break;
                case "nullable":
                    builder.nullable(bool(value, location, key));
                    break;
                case "allowed":
                    if (!(value instanceof List<?> list)) {
                        throw new IllegalArgumentException("'allowed' at '" + location + "' must be a list");
                    }
                    builder.allowed(list);
                    break;
                case "min":
                    builder.min(decimal(value, location, key));
                    break;
                case "max":
                    builder.max(decimal(value, location, key));
                    break;
                case "minlength":
                    builder.minLength(decimal(value, location, key).intValueExact());
                    break;
                case "maxlength":
                    builder.maxLength(decimal(value, location, key).intValueExact());
                    break;
                case "schema":
                    compileNested(value, types, location, builder);
                    break;
                case "items":
                    if (!(value instanceof List<?> positional)) {
                        throw new IllegalArgumentException("'items' at '" + location + "' must be a list");
                    }
                    List<FieldSchema> itemSchemas = new ArrayList<>();
                    for (int i = 0; i < positional.size(); i++) {
                        itemSchemas.add(compileField(positional.get(i), location + "[" + i + "]"));
                    }
                    builder.items(itemSchemas);
                    break;
                case "excludes":
                    builder.excludes(stringList(value, location, key));
                    break;
                case "dependencies":
                    builder.dependencies(stringList(value, location, key));
                    break;
                case "anyof":
                    if (!(value instanceof List<?> alternatives)) {
                        throw new IllegalArgumentException("'anyof' at '" + location + "' must be a list");
                    }
                    for (int i = 0; i < alternatives.size(); i++) {
                        builder.anyOf(compileField(alternatives.get(i), location + "<anyof " + i + ">"));
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled schema rule " + key);
            }
        }
        FieldSchema schema = builder.build();
        compiled.put(raw, schema);
        return schema;
    }

    private void compileNested(Object value, List<FieldType> types, String location, FieldSchema.Builder builder) {
        if (!(value instanceof Map<?, ?> nested)) {
            throw new IllegalArgumentException("'schema' at '" + location + "' must be a mapping");
        }
        if (types.contains(FieldType.LIST)) {
            builder.itemSchema(compileField(nested, location + "[]"));
        } else {
            builder.fields(compileFields(nested, location));
        }
    }

    private static boolean bool(Object value, String location, String key) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException("'" + key + "' at '" + location + "' must be true or false");
    }

    private static BigDecimal decimal(Object value, String location, String key) {
        if (value instanceof Integer || value instanceof Long) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        throw new IllegalArgumentException("'" + key + "' at '" + location + "' must be a number");
    }

    private static List<String> stringList(Object value, String location, String key) {
        if (value instanceof String text) {
            return List.of(text);
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(String.valueOf(item));
            }
            return result;
        }
        throw new IllegalArgumentException("'" + key + "' at '" + location + "' must be a string or a list");
    }

    private static String join(String location, String name) {
        return location.isEmpty() ? name : location + "." + name;
    }
}
