package com.chemked.data.lookup;

import java.util.Objects;

/** Given and family name as registered with an identity registry. */
public record PersonName(String given, String family) {

    public PersonName {
        given = given == null ? "" : given.trim();
        family = Objects.requireNonNull(family, "family").trim();
    }

    public String fullName() {
        return given.isEmpty() ? family : given + " " + family;
    }
}
