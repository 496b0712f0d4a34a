package com.chemked.data.loader.normalize;

import com.chemked.data.loader.DocumentParseException;
import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.DocumentNodes;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NodePath;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prepares a parsed document for validation. The {@code common-properties} section only exists so
 * authors can anchor shared values; by the time the parser hands over the document, every alias has
 * been expanded into the data points that reference it. This step drops the section, rebuilds each
 * data point as an independent tree and reports data points that omit a common property. Nothing is
 * injected into a data point that does not reference the property itself.
 */
public final class DocumentNormalizer {
    private static final Logger LOGGER = Logger.getLogger(DocumentNormalizer.class.getName());

    public static final String COMMON_PROPERTIES = "common-properties";
    public static final String DATAPOINTS = "datapoints";

    public NormalizedDocument normalize(Object parsed) throws DocumentParseException {
        if (!(parsed instanceof Map<?, ?>)) {
            String found = parsed == null ? "an empty document" : parsed.getClass().getSimpleName();
            throw new DocumentParseException("ChemKED document root must be a mapping, found " + found);
        }
        DocumentNode converted;
        try {
            converted = DocumentNodes.fromPlain(parsed);
        } catch (IllegalArgumentException ex) {
            throw new DocumentParseException(ex.getMessage(), ex);
        }
        return normalize((MapNode) converted);
    }

    public NormalizedDocument normalize(MapNode document) {
        List<LoaderMessage> messages = new ArrayList<>();
        DocumentNode common = document.get(COMMON_PROPERTIES);
        MapNode result = document.without(COMMON_PROPERTIES);

        if (common != null && !(common instanceof MapNode)) {
            messages.add(
                    LoaderMessage.error(
                            Category.STRUCTURAL,
                            NodePath.ROOT.key(COMMON_PROPERTIES).toString(),
                            "must be of dict type"));
        }

        DocumentNode datapoints = result.get(DATAPOINTS);
        if (datapoints instanceof ListNode list) {
            List<DocumentNode> copies = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                DocumentNode point = list.get(i);
                NodePath pointPath = NodePath.ROOT.key(DATAPOINTS).index(i);
                copies.add(point.relocate(pointPath));
                if (common instanceof MapNode commonMap && point instanceof MapNode pointMap) {
                    reportOmissions(commonMap, pointMap, pointPath, messages);
                }
            }
            result = result.with(DATAPOINTS, new ListNode(NodePath.ROOT.key(DATAPOINTS), copies));
        }

        if (common != null) {
            LOGGER.log(Level.FINE, "Consumed common-properties section with keys {0}",
                    common instanceof MapNode map ? map.keys() : "[]");
        }
        return new NormalizedDocument(result, messages);
    }

    private static void reportOmissions(
            MapNode common, MapNode point, NodePath pointPath, List<LoaderMessage> messages) {
        for (String key : common.keys()) {
            if (!point.has(key)) {
                messages.add(
                        LoaderMessage.warning(
                                Category.NORMALIZATION,
                                pointPath.toString(),
                                "common property '" + key + "' is not referenced by this data point; "
                                        + "common properties are not inherited"));
            }
        }
    }
}
