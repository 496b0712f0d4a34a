package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NumberNode;
import com.chemked.data.lookup.BibliographicRecord;
import com.chemked.data.lookup.BibliographicRecord.RegisteredAuthor;
import com.chemked.data.lookup.Dois;
import com.chemked.data.lookup.LookupUnavailableException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@code isvalid_reference}: when a DOI is given, the journal, year, volume, pages and author list
 * must agree with what the bibliographic registry holds for it.
 */
final class ReferenceRule implements ValidationRule {
    private static final Logger LOGGER = Logger.getLogger(ReferenceRule.class.getName());

    @Override
    public String name() {
        return "isvalid_reference";
    }

    @Override
    public List<LoaderMessage> validate(String field, DocumentNode value, ValidationContext context) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (!(value instanceof MapNode reference) || reference.text("doi").isEmpty()) {
            return messages;
        }
        String path = value.getPath().toString();
        String doi = Dois.normalize(reference.text("doi").get());

        Optional<BibliographicRecord> found;
        try {
            found = context.bibliographicLookup().lookup(doi);
        } catch (LookupUnavailableException ex) {
            LOGGER.log(Level.WARNING, "DOI lookup unavailable: {0}", ex.getMessage());
            messages.add(LoaderMessage.warning(Category.LOOKUP, path, "network not available, DOI not validated."));
            return messages;
        }
        if (found.isEmpty()) {
            messages.add(error(path, "DOI not found"));
            return messages;
        }
        BibliographicRecord record = found.get();

        String registeredJournal = record.getJournal().orElse("");
        if (!reference.text("journal").map(registeredJournal::equals).orElse(false)) {
            messages.add(error(path, "journal should be " + registeredJournal));
        }

        if (record.getYear() > 0) {
            Optional<Integer> year = reference.number("year").map(number -> number.getValue().intValue());
            if (year.isEmpty() || year.get() != record.getYear()) {
                messages.add(error(path, "year should be " + record.getYear()));
            }
        }

        Optional<NumberNode> volume = reference.number("volume");
        if (record.getVolume().isEmpty()) {
            if (volume.isPresent()) {
                messages.add(error(path, "Volume was specified in the YAML but is not present in the DOI reference."));
            }
        } else if (volume.isEmpty() || !sameVolume(volume.get(), record.getVolume().get())) {
            messages.add(error(path, "volume should be " + record.getVolume().get()));
        }

        Optional<String> pages = reference.text("pages");
        if (record.getPages().isEmpty()) {
            if (pages.isPresent()) {
                messages.add(error(path, "Pages were specified in the YAML but are not present in the DOI reference."));
            }
        } else if (pages.isEmpty() || !pages.get().equals(record.getPages().get())) {
            messages.add(error(path, "pages should be " + record.getPages().get()));
        }

        checkAuthors(reference, record, path, messages);
        return messages;
    }

    private static void checkAuthors(
            MapNode reference, BibliographicRecord record, String path, List<LoaderMessage> out) {
        List<MapNode> authors = new ArrayList<>();
        ListNode authorList = reference.list("authors").orElse(null);
        if (authorList != null) {
            for (DocumentNode node : authorList.getItems()) {
                if (node instanceof MapNode author) {
                    authors.add(author);
                }
            }
        }
        List<String> unmatched = new ArrayList<>();
        for (MapNode author : authors) {
            unmatched.add(author.text("name").orElse(""));
        }

        for (RegisteredAuthor registered : record.getAuthors()) {
            MapNode match = null;
            for (MapNode author : authors) {
                if (NameComparator.matches(registered.given(), registered.family(), author.text("name").orElse(""))) {
                    match = author;
                    break;
                }
            }
            if (match == null) {
                out.add(error(path, "Missing author: " + registered.fullName()));
                continue;
            }
            String matchedName = match.text("name").orElse("");
            unmatched.remove(matchedName);

            Optional<String> registeredOrcid = registered.getOrcid();
            if (registeredOrcid.isEmpty()) {
                continue;
            }
            Optional<String> givenOrcid = match.text("ORCID");
            if (givenOrcid.isPresent()) {
                if (!givenOrcid.get().equals(registeredOrcid.get())) {
                    out.add(
                            error(
                                    path,
                                    matchedName
                                            + " ORCID does not match that in reference. Reference: "
                                            + registeredOrcid.get()
                                            + ". Given: "
                                            + givenOrcid.get()));
                }
            } else {
                out.add(
                        LoaderMessage.warning(
                                Category.SEMANTIC,
                                match.getPath().toString(),
                                "ORCID " + registeredOrcid.get() + " missing for " + matchedName));
            }
        }

        if (!unmatched.isEmpty()) {
            out.add(error(path, "Extra author(s) given: " + String.join(", ", unmatched)));
        }
    }

    private static boolean sameVolume(NumberNode given, String registered) {
        try {
            return given.getValue().longValue() == Long.parseLong(registered.trim());
        } catch (NumberFormatException ex) {
            return given.toString().equals(registered.trim());
        }
    }

    private static LoaderMessage error(String path, String message) {
        return LoaderMessage.error(Category.SEMANTIC, path, message);
    }
}
