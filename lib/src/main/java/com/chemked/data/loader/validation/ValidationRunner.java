package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the custom rules a schema may reference. This keeps a single place to register
 * rules, and lets the validator reject schemas that name a rule nobody implements.
 */
public final class ValidationRunner {

    private final Map<String, ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        Objects.requireNonNull(rules, "rules");
        Map<String, ValidationRule> byName = new LinkedHashMap<>();
        for (ValidationRule rule : rules) {
            if (byName.put(rule.name(), rule) != null) {
                throw new IllegalArgumentException("Duplicate validation rule: " + rule.name());
            }
        }
        this.rules = Collections.unmodifiableMap(byName);
    }

    /** Convenience factory that wires in the default rule set. */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(
                List.of(
                        new UnitRule(),
                        new QuantityRule(),
                        new UncertaintyRule(),
                        new CompositionRule(),
                        new HistoryRule(),
                        new OrcidRule(),
                        new ReferenceRule(),
                        new ApparatusConditionsRule()));
    }

    public Set<String> ruleNames() {
        return rules.keySet();
    }

    public Optional<ValidationRule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /**
     * Run one rule.
     *
     * @throws IllegalArgumentException if no rule of that name is registered
     */
    public List<LoaderMessage> run(String name, String field, DocumentNode value, ValidationContext context) {
        ValidationRule rule = rules.get(name);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown validation rule: " + name);
        }
        return rule.validate(field, value, context);
    }
}
