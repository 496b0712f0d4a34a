package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code isvalid_apparatus_conditions}: apparatus-specific data point fields agree with
 * {@code apparatus.kind}. RCM data belongs to rapid compression machines; pressure rise and volume
 * histories do not fit the other apparatus.
 */
final class ApparatusConditionsRule implements ValidationRule {
    static final String SHOCK_TUBE = "shock tube";
    static final String RCM = "rapid compression machine";

    @Override
    public String name() {
        return "isvalid_apparatus_conditions";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (!(value instanceof MapNode datapoint)) {
            return messages;
        }
        Optional<String> kind = context.getDocument().map("apparatus").flatMap(apparatus -> apparatus.text("kind"));
        if (kind.isEmpty()) {
            return messages;
        }
        String path = value.getPath().toString();
        if (datapoint.has("rcm-data") && !RCM.equals(kind.get())) {
            messages.add(QuantityChecks.semantic(
                    path + ".rcm-data", "rcm-data is only valid for rapid compression machine experiments"));
        }
        if (datapoint.has("pressure-rise") && RCM.equals(kind.get())) {
            messages.add(QuantityChecks.semantic(
                    path + ".pressure-rise", "pressure-rise is not valid for rapid compression machine experiments"));
        }
        if (SHOCK_TUBE.equals(kind.get()) && hasVolumeHistory(datapoint)) {
            messages.add(QuantityChecks.semantic(
                    path + ".time-histories", "volume history is not valid for shock tube experiments"));
        }
        return messages;
    }

    private static boolean hasVolumeHistory(MapNode datapoint) {
        Optional<ListNode> histories = datapoint.list("time-histories");
        if (histories.isEmpty()) {
            return false;
        }
        for (DocumentNode history : histories.get().getItems()) {
            if (history instanceof MapNode map && map.text("type").map("volume"::equals).orElse(false)) {
                return true;
            }
        }
        return false;
    }
}
