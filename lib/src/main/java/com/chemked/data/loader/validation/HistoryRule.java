package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NumberNode;
import com.chemked.data.loader.node.TextNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code isvalid_history}: time and quantity units match the history type, the two columns are 0
 * and 1 and inline rows have exactly two values. An absolute uncertainty has the quantity's dimension
 * and a relative one is a positive plain fraction.
 */
final class HistoryRule implements ValidationRule {

    @Override
    public String name() {
        return "isvalid_history";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (!(value instanceof MapNode history)) {
            return messages;
        }
        String type = history.text("type").orElse("");
        Optional<MapNode> time = history.map("time");
        Optional<MapNode> quantity = history.map("quantity");

        time.flatMap(node -> node.text("units"))
                .ifPresent(units -> QuantityChecks.checkUnits(
                        "time", units, time.get().getPath().key("units").toString(), "time ", messages));
        quantity.flatMap(node -> node.text("units"))
                .ifPresent(units -> QuantityChecks.checkUnits(
                        type, units, quantity.get().getPath().key("units").toString(), type + " ", messages));

        int timeColumn = time.flatMap(node -> node.number("column")).map(n -> n.getValue().intValue()).orElse(0);
        int quantityColumn =
                quantity.flatMap(node -> node.number("column")).map(n -> n.getValue().intValue()).orElse(1);
        if (timeColumn == quantityColumn) {
            messages.add(
                    QuantityChecks.semantic(
                            value.getPath().toString(), "time and quantity must use different columns"));
        }

        Optional<ListNode> rows = history.list("values");
        if (rows.isPresent()) {
            for (DocumentNode row : rows.get().getItems()) {
                if (!(row instanceof ListNode pair) || pair.size() != 2) {
                    messages.add(
                            QuantityChecks.semantic(row.getPath().toString(), "history rows must have two values"));
                }
            }
        }

        history.map("uncertainty").ifPresent(uncertainty -> checkUncertainty(type, uncertainty, messages));
        return messages;
    }

    private static void checkUncertainty(String type, MapNode uncertainty, List<LoaderMessage> out) {
        boolean absolute = uncertainty.text("type").map("absolute"::equals).orElse(false);
        DocumentNode value = uncertainty.get("value");
        if (value instanceof NumberNode number && number.doubleValue() <= 0.0) {
            out.add(QuantityChecks.semantic(value.getPath().toString(), "uncertainty must be greater than 0.0"));
        }
        if (!absolute) {
            if (value instanceof TextNode text) {
                QuantityChecks.checkDimensionless(
                        "relative uncertainty", text.getValue(), value.getPath().toString(), out);
            }
            uncertainty
                    .text("units")
                    .ifPresent(units -> QuantityChecks.checkDimensionlessUnits(
                            "relative uncertainty units",
                            units,
                            uncertainty.getPath().key("units").toString(),
                            out));
            return;
        }
        uncertainty
                .text("units")
                .ifPresent(units -> QuantityChecks.checkUnits(
                        type, units, uncertainty.getPath().key("units").toString(), "uncertainty ", out));
        if (value instanceof TextNode text) {
            QuantityChecks.checkQuantity(type, text.getValue(), value.getPath().toString(), out);
        }
    }
}
