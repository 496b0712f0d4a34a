package com.chemked.data.record;

import java.util.Objects;
import java.util.Optional;

public final class Apparatus {
    private final ApparatusKind kind;
    private final String institution;
    private final String facility;

    public Apparatus(ApparatusKind kind, String institution, String facility) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.institution = institution;
        this.facility = facility;
    }

    public ApparatusKind getKind() {
        return kind;
    }

    public Optional<String> getInstitution() {
        return Optional.ofNullable(institution);
    }

    public Optional<String> getFacility() {
        return Optional.ofNullable(facility);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Apparatus that
                && kind == that.kind
                && Objects.equals(institution, that.institution)
                && Objects.equals(facility, that.facility);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, institution, facility);
    }
}
