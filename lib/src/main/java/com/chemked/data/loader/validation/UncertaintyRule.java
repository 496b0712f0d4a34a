package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NumberNode;
import com.chemked.data.loader.node.TextNode;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code isvalid_uncertainty}: the uncertainty block following a quantity string. Absolute values
 * written with units must have the quantity's dimension; every given bound must be positive.
 * Relative values are plain fractions.
 */
final class UncertaintyRule implements ValidationRule {
    private static final List<String> BOUNDS = List.of("uncertainty", "upper-uncertainty", "lower-uncertainty");

    @Override
    public String name() {
        return "isvalid_uncertainty";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (!(value instanceof ListNode list) || list.size() < 2 || !(list.get(1) instanceof MapNode block)) {
            return messages;
        }
        boolean relative = block.text("uncertainty-type").map("relative"::equals).orElse(false);
        for (String bound : BOUNDS) {
            DocumentNode node = block.get(bound);
            if (node == null) {
                continue;
            }
            String path = node.getPath().toString();
            if (node instanceof NumberNode number) {
                if (number.doubleValue() <= 0.0) {
                    messages.add(QuantityChecks.semantic(path, bound + " must be greater than 0.0"));
                }
            } else if (node instanceof TextNode text) {
                if (relative) {
                    QuantityChecks.checkDimensionless("relative " + bound, text.getValue(), path, messages);
                } else {
                    QuantityChecks.checkQuantity(field, text.getValue(), path, messages);
                }
            }
        }
        return messages;
    }
}
