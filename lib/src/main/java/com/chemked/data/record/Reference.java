package com.chemked.data.record;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/** Publication the data were taken from. */
public final class Reference {
    private final String doi;
    private final String journal;
    private final int year;
    private final Integer volume;
    private final String pages;
    private final String detail;
    private final List<Author> authors;

    public Reference(
            String doi, String journal, int year, Integer volume, String pages, String detail, List<Author> authors) {
        this.doi = doi;
        this.journal = journal;
        this.year = year;
        this.volume = volume;
        this.pages = pages;
        this.detail = detail;
        this.authors = List.copyOf(Objects.requireNonNull(authors, "authors"));
        if (this.authors.isEmpty()) {
            throw new IllegalArgumentException("reference needs at least one author");
        }
    }

    public Optional<String> getDoi() {
        return Optional.ofNullable(doi);
    }

    public Optional<String> getJournal() {
        return Optional.ofNullable(journal);
    }

    public int getYear() {
        return year;
    }

    public OptionalInt getVolume() {
        return volume == null ? OptionalInt.empty() : OptionalInt.of(volume);
    }

    public Optional<String> getPages() {
        return Optional.ofNullable(pages);
    }

    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    public List<Author> getAuthors() {
        return authors;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Reference that)) {
            return false;
        }
        return year == that.year
                && Objects.equals(doi, that.doi)
                && Objects.equals(journal, that.journal)
                && Objects.equals(volume, that.volume)
                && Objects.equals(pages, that.pages)
                && Objects.equals(detail, that.detail)
                && authors.equals(that.authors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(doi, journal, year, volume, pages, detail, authors);
    }
}
