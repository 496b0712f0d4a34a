package com.chemked.data.lookup;

import java.util.Optional;

/** Resolves an ORCID to the name registered for it. */
@FunctionalInterface
public interface IdentityLookup {

    /**
     * @param orcid identifier in {@code dddd-dddd-dddd-dddX} form
     * @return the registered name, or empty when the registry does not know the identifier
     * @throws LookupUnavailableException if the registry cannot be consulted
     */
    Optional<PersonName> lookup(String orcid) throws LookupUnavailableException;
}
