package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.TextNode;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code isvalid_unit}: the units given for a field have that field's dimension. The node is either
 * the unit string itself or a mapping with a {@code units} entry.
 */
final class UnitRule implements ValidationRule {

    @Override
    public String name() {
        return "isvalid_unit";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        String units = null;
        if (value instanceof TextNode text) {
            units = text.getValue();
        } else if (value instanceof MapNode map) {
            units = map.text("units").orElse(null);
        }
        if (units != null) {
            QuantityChecks.checkUnits(field, units, value.getPath().toString(), "", messages);
        }
        return messages;
    }
}
