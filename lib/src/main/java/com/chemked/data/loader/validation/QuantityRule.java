package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.TextNode;
import java.util.ArrayList;
import java.util.List;

/** {@code isvalid_quantity}: a {@code "value unit"} string parses, has the right dimension and is positive. */
final class QuantityRule implements ValidationRule {

    @Override
    public String name() {
        return "isvalid_quantity";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (value instanceof TextNode text) {
            QuantityChecks.checkQuantity(field, text.getValue(), value.getPath().toString(), messages);
        }
        return messages;
    }
}
