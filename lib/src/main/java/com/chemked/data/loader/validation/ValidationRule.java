package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import java.util.List;

/**
 * A named semantic check that a schema attaches to a field with {@code isvalid_<name>: true}. The
 * validator only invokes a rule on a node whose structural checks passed, so rules may rely on the
 * shape the schema promises.
 */
public interface ValidationRule {

    /** Schema key of this rule, e.g. {@code isvalid_quantity}. */
    String name();

    /**
     * Evaluate this rule against one node.
     *
     * @param field Nearest mapping key above the node, e.g. {@code temperature} for the value string
     *     of a temperature entry.
     * @param value The node the rule is attached to.
     * @param context Document and registries of the current run.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context);
}
