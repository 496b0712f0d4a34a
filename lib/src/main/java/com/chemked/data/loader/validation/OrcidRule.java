package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.lookup.LookupUnavailableException;
import com.chemked.data.lookup.PersonName;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@code isvalid_orcid}: an author's ORCID is well formed, carries a correct check digit and, when
 * the registry answers, belongs to a person whose registered name matches the written one.
 */
final class OrcidRule implements ValidationRule {
    private static final Logger LOGGER = Logger.getLogger(OrcidRule.class.getName());

    @Override
    public String name() {
        return "isvalid_orcid";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (!(value instanceof MapNode author)) {
            return messages;
        }
        Optional<String> orcid = author.text("ORCID");
        if (orcid.isEmpty()) {
            return messages;
        }
        String name = author.text("name").orElse("");
        String path = value.getPath().toString();
        if (!OrcidChecksum.isWellFormed(orcid.get())) {
            messages.add(
                    QuantityChecks.semantic(path, "ORCID " + orcid.get() + " is not of the form 0000-0000-0000-000X"));
            return messages;
        }
        if (!OrcidChecksum.isValid(orcid.get())) {
            messages.add(QuantityChecks.semantic(path, "ORCID " + orcid.get() + " has an invalid check digit"));
            return messages;
        }

        Optional<PersonName> registered;
        try {
            registered = context.identityLookup().lookup(orcid.get());
        } catch (LookupUnavailableException ex) {
            LOGGER.log(Level.WARNING, "ORCID lookup unavailable: {0}", ex.getMessage());
            messages.add(LoaderMessage.warning(Category.LOOKUP, path, "network not available, ORCID not validated."));
            return messages;
        }
        if (registered.isEmpty()) {
            messages.add(QuantityChecks.semantic(path, "ORCID incorrect or invalid for " + name));
            return messages;
        }
        PersonName person = registered.get();
        if (!NameComparator.matches(person.given(), person.family(), name)) {
            messages.add(
                    QuantityChecks.semantic(
                            path,
                            "Name and ORCID do not match. Name supplied: "
                                    + name
                                    + ". Name associated with ORCID: "
                                    + person.fullName()));
        }
        return messages;
    }
}
