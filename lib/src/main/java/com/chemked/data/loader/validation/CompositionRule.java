package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NumberNode;
import com.chemked.data.loader.node.TextNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * {@code isvalid_composition}: every species amount lies within the bounds of the composition kind
 * and the amounts sum to the kind's total (1 for fractions, 100 for mole percent). Amount
 * uncertainties are dimensionless and positive whatever their type; an absolute one may not
 * exceed the kind's total. Species names are unique.
 */
final class CompositionRule implements ValidationRule {
    private static final List<String> BOUNDS = List.of("uncertainty", "upper-uncertainty", "lower-uncertainty");
    private static final double RELATIVE_TOLERANCE = 1e-5;
    private static final double ABSOLUTE_TOLERANCE = 1e-8;

    @Override
    public String name() {
        return "isvalid_composition";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (!(value instanceof MapNode composition)) {
            return messages;
        }
        String kind = composition.text("kind").orElse("");
        String path = value.getPath().toString();
        double upperLimit;
        switch (kind) {
            case "mole fraction":
            case "mass fraction":
                upperLimit = 1.0;
                break;
            case "mole percent":
                upperLimit = 100.0;
                break;
            default:
                messages.add(
                        QuantityChecks.semantic(
                                path,
                                "composition kind must be \"mole percent\", \"mass fraction\", or \"mole fraction\""));
                return messages;
        }
        double lowerLimit = 0.0;
        double sum = 0.0;
        ListNode species = composition.list("species").orElse(null);
        if (species == null) {
            return messages;
        }
        Set<String> names = new HashSet<>();
        for (DocumentNode item : species.getItems()) {
            if (!(item instanceof MapNode entry)) {
                continue;
            }
            String name = entry.text("species-name").orElse("?");
            if (!names.add(name)) {
                messages.add(QuantityChecks.semantic(path, "Species " + name + " is listed more than once"));
            }
            checkAmountUncertainty(entry, upperLimit, messages);
            double amount = amountOf(entry);
            sum += amount;
            if (amount < lowerLimit) {
                messages.add(
                        QuantityChecks.semantic(
                                path,
                                "Species " + name + " " + kind + " must be greater than " + oneDecimal(lowerLimit)));
            } else if (amount > upperLimit) {
                messages.add(
                        QuantityChecks.semantic(
                                path, "Species " + name + " " + kind + " must be less than " + oneDecimal(upperLimit)));
            }
        }
        if (!isClose(upperLimit, sum)) {
            messages.add(
                    QuantityChecks.semantic(
                            path,
                            "Species "
                                    + kind
                                    + "s do not sum to "
                                    + oneDecimal(upperLimit)
                                    + ": "
                                    + String.format(Locale.ROOT, "%f", sum)));
        }
        return messages;
    }

    private static void checkAmountUncertainty(MapNode species, double upperLimit, List<LoaderMessage> out) {
        Optional<ListNode> amount = species.list("amount");
        if (amount.isEmpty() || amount.get().size() < 2 || !(amount.get().get(1) instanceof MapNode block)) {
            return;
        }
        boolean absolute = block.text("uncertainty-type").map("absolute"::equals).orElse(false);
        for (String bound : BOUNDS) {
            DocumentNode node = block.get(bound);
            String label = "species amount " + bound;
            if (node instanceof NumberNode number) {
                if (number.doubleValue() <= 0.0) {
                    out.add(QuantityChecks.semantic(node.getPath().toString(), label + " must be greater than 0.0"));
                } else if (absolute && number.doubleValue() > upperLimit) {
                    out.add(
                            QuantityChecks.semantic(
                                    node.getPath().toString(),
                                    label + " must be less than " + oneDecimal(upperLimit)));
                }
            } else if (node instanceof TextNode text) {
                QuantityChecks.checkDimensionless(label, text.getValue(), node.getPath().toString(), out);
            }
        }
    }

    /** {@code |a - b| <= atol + rtol * |b|}, the usual closeness test for summed fractions. */
    static boolean isClose(double a, double b) {
        return Math.abs(a - b) <= ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(b);
    }

    private static double amountOf(MapNode species) {
        return species.list("amount")
                .filter(list -> !list.isEmpty() && list.get(0) instanceof NumberNode)
                .map(list -> ((NumberNode) list.get(0)).doubleValue())
                .orElse(0.0);
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
