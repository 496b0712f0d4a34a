package com.chemked.data.loader.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled constraints for one field. Instances are immutable and may be shared by several fields
 * (an anchored definition compiles once).
 */
public final class FieldSchema {
    private final List<FieldType> types;
    private final boolean required;
    private final boolean nullable;
    private final List<Object> allowed;
    private final BigDecimal min;
    private final BigDecimal max;
    private final Integer minLength;
    private final Integer maxLength;
    private final Map<String, FieldSchema> fields;
    private final FieldSchema itemSchema;
    private final List<FieldSchema> items;
    private final List<String> excludes;
    private final List<String> dependencies;
    private final List<FieldSchema> anyOf;
    private final List<String> rules;

    private FieldSchema(Builder builder) {
        this.types = List.copyOf(builder.types);
        this.required = builder.required;
        this.nullable = builder.nullable;
        this.allowed = Collections.unmodifiableList(new ArrayList<>(builder.allowed));
        this.min = builder.min;
        this.max = builder.max;
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.fields = builder.fields == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.itemSchema = builder.itemSchema;
        this.items = builder.items == null ? null : List.copyOf(builder.items);
        this.excludes = List.copyOf(builder.excludes);
        this.dependencies = List.copyOf(builder.dependencies);
        this.anyOf = List.copyOf(builder.anyOf);
        this.rules = List.copyOf(builder.rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<FieldType> getTypes() {
        return types;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isNullable() {
        return nullable;
    }

    public List<Object> getAllowed() {
        return allowed;
    }

    public Optional<BigDecimal> getMin() {
        return Optional.ofNullable(min);
    }

    public Optional<BigDecimal> getMax() {
        return Optional.ofNullable(max);
    }

    public Optional<Integer> getMinLength() {
        return Optional.ofNullable(minLength);
    }

    public Optional<Integer> getMaxLength() {
        return Optional.ofNullable(maxLength);
    }

    /** Field definitions of a mapping; empty when this schema does not describe a mapping. */
    public Optional<Map<String, FieldSchema>> getFields() {
        return Optional.ofNullable(fields);
    }

    /** Schema applied to every element of a list. */
    public Optional<FieldSchema> getItemSchema() {
        return Optional.ofNullable(itemSchema);
    }

    /** Positional schemas applied to the leading elements of a list. */
    public Optional<List<FieldSchema>> getItems() {
        return Optional.ofNullable(items);
    }

    public List<String> getExcludes() {
        return excludes;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public List<FieldSchema> getAnyOf() {
        return anyOf;
    }

    /** Names of custom rules, in declaration order. */
    public List<String> getRules() {
        return rules;
    }

    public static final class Builder {
        private final List<FieldType> types = new ArrayList<>();
        private boolean required;
        private boolean nullable;
        private final List<Object> allowed = new ArrayList<>();
        private BigDecimal min;
        private BigDecimal max;
        private Integer minLength;
        private Integer maxLength;
        private Map<String, FieldSchema> fields;
        private FieldSchema itemSchema;
        private List<FieldSchema> items;
        private final List<String> excludes = new ArrayList<>();
        private final List<String> dependencies = new ArrayList<>();
        private final List<FieldSchema> anyOf = new ArrayList<>();
        private final List<String> rules = new ArrayList<>();

        private Builder() {}

        public Builder type(FieldType type) {
            types.add(type);
            return this;
        }

        public Builder required(boolean value) {
            this.required = value;
            return this;
        }

        public Builder nullable(boolean value) {
            this.nullable = value;
            return this;
        }

        public Builder allowed(List<?> values) {
            allowed.addAll(values);
            return this;
        }

        public Builder min(BigDecimal value) {
            this.min = value;
            return this;
        }

        public Builder max(BigDecimal value) {
            this.max = value;
            return this;
        }

        public Builder minLength(int value) {
            this.minLength = value;
            return this;
        }

        public Builder maxLength(int value) {
            this.maxLength = value;
            return this;
        }

        public Builder fields(Map<String, FieldSchema> value) {
            this.fields = value;
            return this;
        }

        public Builder itemSchema(FieldSchema value) {
            this.itemSchema = value;
            return this;
        }

        public Builder items(List<FieldSchema> value) {
            this.items = value;
            return this;
        }

        public Builder excludes(List<String> value) {
            excludes.addAll(value);
            return this;
        }

        public Builder dependencies(List<String> value) {
            dependencies.addAll(value);
            return this;
        }

        public Builder anyOf(FieldSchema alternative) {
            anyOf.add(alternative);
            return this;
        }

        public Builder rule(String name) {
            rules.add(name);
            return this;
        }

        public FieldSchema build() {
            return new FieldSchema(this);
        }
    }
}
