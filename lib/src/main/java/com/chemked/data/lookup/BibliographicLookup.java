package com.chemked.data.lookup;

import java.util.Optional;

/** Resolves a DOI to the bibliographic metadata registered for it. */
@FunctionalInterface
public interface BibliographicLookup {

    /**
     * @param doi bare DOI such as {@code 10.1016/j.combustflame.2012.01.024}
     * @return the registered metadata, or empty when the DOI does not resolve
     * @throws LookupUnavailableException if the registry cannot be consulted
     */
    Optional<BibliographicRecord> lookup(String doi) throws LookupUnavailableException;
}
