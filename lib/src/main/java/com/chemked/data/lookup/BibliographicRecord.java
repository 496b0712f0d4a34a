package com.chemked.data.lookup;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata a bibliographic registry holds for one DOI. Volume and pages are optional because not
 * every work has them.
 */
public final class BibliographicRecord {

    /** An author as the registry lists it; the ORCID may be a bare id or an orcid.org URL. */
    public record RegisteredAuthor(String given, String family, String orcid) {

        public RegisteredAuthor {
            given = given == null ? "" : given;
            family = Objects.requireNonNull(family, "family");
        }

        public Optional<String> getOrcid() {
            if (orcid == null || orcid.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(orcid.substring(orcid.lastIndexOf('/') + 1));
        }

        public String fullName() {
            return given.isEmpty() ? family : given + " " + family;
        }
    }

    private final String doi;
    private final String journal;
    private final int year;
    private final String volume;
    private final String pages;
    private final List<RegisteredAuthor> authors;

    public BibliographicRecord(
            String doi, String journal, int year, String volume, String pages, List<RegisteredAuthor> authors) {
        this.doi = Objects.requireNonNull(doi, "doi");
        this.journal = journal;
        this.year = year;
        this.volume = volume;
        this.pages = pages;
        this.authors = List.copyOf(Objects.requireNonNull(authors, "authors"));
    }

    public String getDoi() {
        return doi;
    }

    public Optional<String> getJournal() {
        return Optional.ofNullable(journal);
    }

    public int getYear() {
        return year;
    }

    public Optional<String> getVolume() {
        return Optional.ofNullable(volume);
    }

    public Optional<String> getPages() {
        return Optional.ofNullable(pages);
    }

    public List<RegisteredAuthor> getAuthors() {
        return authors;
    }
}
