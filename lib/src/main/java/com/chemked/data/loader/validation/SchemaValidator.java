package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NullNode;
import com.chemked.data.loader.node.NumberNode;
import com.chemked.data.loader.node.TextNode;
import com.chemked.data.loader.schema.ChemKedSchema;
import com.chemked.data.loader.schema.FieldSchema;
import com.chemked.data.loader.schema.FieldType;
import com.chemked.data.lookup.LookupServices;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Checks a document tree against a {@link ChemKedSchema}. Every problem is reported; validation
 * never stops at the first error. Custom rules attached to a node run only when the node and its
 * children passed their structural checks.
 */
public final class SchemaValidator {
    private static final Logger LOGGER = Logger.getLogger(SchemaValidator.class.getName());

    private final ChemKedSchema schema;
    private final ValidationRunner runner;
    private final LookupServices lookups;

    public SchemaValidator(ChemKedSchema schema, ValidationRunner runner, LookupServices lookups) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.lookups = Objects.requireNonNull(lookups, "lookups");
        Set<String> missing = new LinkedHashSet<>(schema.getRuleNames());
        missing.removeAll(runner.ruleNames());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Schema references unregistered validation rules: " + missing);
        }
    }

    /** Validator for the bundled schema with the default rules. */
    public static SchemaValidator standard(LookupServices lookups) {
        return new SchemaValidator(ChemKedSchema.bundled(), ValidationRunner.defaultRules(), lookups);
    }

    public ValidationResult validate(MapNode document) {
        Objects.requireNonNull(document, "document");
        List<LoaderMessage> messages = new ArrayList<>();
        ValidationContext context = new ValidationContext(document, lookups);
        validateNode(schema.getRoot(), document, context, messages);
        LOGGER.log(Level.FINE, "Validation produced {0} message(s)", messages.size());
        return new ValidationResult(messages);
    }

    private void validateNode(
            FieldSchema fieldSchema, DocumentNode node, ValidationContext context, List<LoaderMessage> out) {
        int errorsBefore = errorCount(out);
        String path = node.getPath().toString();

        if (node instanceof NullNode) {
            if (!fieldSchema.isNullable()) {
                out.add(structural(path, "null value not allowed"));
            }
            return;
        }

        List<FieldType> types = fieldSchema.getTypes();
        if (!types.isEmpty() && types.stream().noneMatch(type -> type.matches(node))) {
            out.add(structural(path, "must be of " + describeTypes(types) + " type"));
            return;
        }

        if (!fieldSchema.getAllowed().isEmpty()) {
            checkAllowed(fieldSchema.getAllowed(), node, path, out);
        }
        if (node instanceof NumberNode number) {
            BigDecimal value = number.decimalValue();
            fieldSchema
                    .getMin()
                    .filter(min -> value.compareTo(min) < 0)
                    .ifPresent(min -> out.add(structural(path, "min value is " + min.toPlainString())));
            fieldSchema
                    .getMax()
                    .filter(max -> value.compareTo(max) > 0)
                    .ifPresent(max -> out.add(structural(path, "max value is " + max.toPlainString())));
        }
        int length = lengthOf(node);
        if (length >= 0) {
            fieldSchema
                    .getMinLength()
                    .filter(min -> length < min)
                    .ifPresent(min -> out.add(structural(path, "min length is " + min)));
            fieldSchema
                    .getMaxLength()
                    .filter(max -> length > max)
                    .ifPresent(max -> out.add(structural(path, "max length is " + max)));
        }

        if (node instanceof MapNode map && fieldSchema.getFields().isPresent()) {
            validateMapping(fieldSchema.getFields().get(), map, context, out);
        }
        if (node instanceof ListNode list) {
            if (fieldSchema.getItems().isPresent()) {
                List<FieldSchema> positional = fieldSchema.getItems().get();
                for (int i = 0; i < Math.min(positional.size(), list.size()); i++) {
                    validateNode(positional.get(i), list.get(i), context, out);
                }
            }
            if (fieldSchema.getItemSchema().isPresent()) {
                for (DocumentNode item : list.getItems()) {
                    validateNode(fieldSchema.getItemSchema().get(), item, context, out);
                }
            }
        }
        if (!fieldSchema.getAnyOf().isEmpty()) {
            validateAnyOf(fieldSchema.getAnyOf(), node, path, context, out);
        }

        if (errorCount(out) == errorsBefore) {
            String field = node.getPath().lastKey();
            for (String rule : fieldSchema.getRules()) {
                out.addAll(runner.run(rule, field, node, context));
            }
        }
    }

    private void validateMapping(
            Map<String, FieldSchema> fields, MapNode map, ValidationContext context, List<LoaderMessage> out) {
        for (String key : map.keys()) {
            if (!fields.containsKey(key)) {
                out.add(structural(map.getPath().key(key).toString(), "unknown field"));
            }
        }
        for (Map.Entry<String, FieldSchema> entry : fields.entrySet()) {
            String key = entry.getKey();
            FieldSchema fieldSchema = entry.getValue();
            String path = map.getPath().key(key).toString();
            DocumentNode child = map.get(key);
            if (child == null) {
                boolean excludedPeerPresent = fieldSchema.getExcludes().stream().anyMatch(map::has);
                if (fieldSchema.isRequired() && !excludedPeerPresent) {
                    out.add(structural(path, "required field"));
                }
                continue;
            }
            for (String excluded : fieldSchema.getExcludes()) {
                if (map.has(excluded)) {
                    out.add(structural(path, "'" + excluded + "' must not be present with '" + key + "'"));
                }
            }
            for (String dependency : fieldSchema.getDependencies()) {
                if (!map.has(dependency)) {
                    out.add(structural(path, "field '" + dependency + "' is required"));
                }
            }
            validateNode(fieldSchema, child, context, out);
        }
    }

    private void validateAnyOf(
            List<FieldSchema> alternatives,
            DocumentNode node,
            String path,
            ValidationContext context,
            List<LoaderMessage> out) {
        List<String> reasons = new ArrayList<>();
        for (int i = 0; i < alternatives.size(); i++) {
            List<LoaderMessage> attempt = new ArrayList<>();
            validateNode(alternatives.get(i), node, context, attempt);
            if (errorCount(attempt) == 0) {
                out.addAll(attempt);
                return;
            }
            final int definition = i;
            attempt.stream()
                    .filter(LoaderMessage::isError)
                    .map(message -> "definition " + definition + ": " + message.getMessage())
                    .forEach(reasons::add);
        }
        out.add(structural(path, "no definitions validate (" + String.join("; ", reasons) + ")"));
    }

    private static void checkAllowed(List<Object> allowed, DocumentNode node, String path, List<LoaderMessage> out) {
        if (node instanceof ListNode list) {
            List<String> unallowed =
                    list.getItems().stream()
                            .filter(item -> !isAllowed(allowed, item))
                            .map(DocumentNode::toString)
                            .collect(Collectors.toList());
            if (!unallowed.isEmpty()) {
                out.add(structural(path, "unallowed values " + unallowed));
            }
        } else if (!isAllowed(allowed, node)) {
            out.add(structural(path, "unallowed value " + node));
        }
    }

    private static boolean isAllowed(List<Object> allowed, DocumentNode node) {
        for (Object candidate : allowed) {
            if (node instanceof TextNode text && candidate instanceof String value && text.getValue().equals(value)) {
                return true;
            }
            if (node instanceof NumberNode number
                    && candidate instanceof Number value
                    && number.decimalValue().compareTo(new BigDecimal(value.toString())) == 0) {
                return true;
            }
        }
        return false;
    }

    private static int lengthOf(DocumentNode node) {
        if (node instanceof ListNode list) {
            return list.size();
        }
        if (node instanceof TextNode text) {
            return text.getValue().length();
        }
        if (node instanceof MapNode map) {
            return map.size();
        }
        return -1;
    }

    private static String describeTypes(List<FieldType> types) {
        return types.stream().map(FieldType::getSchemaName).collect(Collectors.joining(" or "));
    }

    private static int errorCount(List<LoaderMessage> messages) {
        int count = 0;
        for (LoaderMessage message : messages) {
            if (message.isError()) {
                count++;
            }
        }
        return count;
    }

    private static LoaderMessage structural(String path, String message) {
        return LoaderMessage.error(Category.STRUCTURAL, path, message);
    }
}
