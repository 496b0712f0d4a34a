package com.chemked.data.record;

import java.util.Objects;
import java.util.Optional;

/** A person credited with a record or a publication. */
public final class Author {
    private final String name;
    private final String orcid;

    public Author(String name, String orcid) {
        this.name = Objects.requireNonNull(name, "name");
        this.orcid = orcid == null || orcid.isBlank() ? null : orcid;
    }

    public static Author named(String name) {
        return new Author(name, null);
    }

    public String getName() {
        return name;
    }

    public Optional<String> getOrcid() {
        return Optional.ofNullable(orcid);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Author that)) {
            return false;
        }
        return name.equals(that.name) && Objects.equals(orcid, that.orcid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, orcid);
    }

    @Override
    public String toString() {
        return orcid == null ? name : name + " (" + orcid + ")";
    }
}
