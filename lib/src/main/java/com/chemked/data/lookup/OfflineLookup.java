package com.chemked.data.lookup;

/** Lookups used when networking is disabled: every query reports the registry as unavailable. */
public final class OfflineLookup {

    private static final IdentityLookup IDENTITY =
            orcid -> {
                throw new LookupUnavailableException("Registry lookups are disabled; ORCID " + orcid + " not resolved");
            };

    private static final BibliographicLookup BIBLIOGRAPHIC =
            doi -> {
                throw new LookupUnavailableException("Registry lookups are disabled; DOI " + doi + " not resolved");
            };

    private OfflineLookup() {}

    public static IdentityLookup identity() {
        return IDENTITY;
    }

    public static BibliographicLookup bibliographic() {
        return BIBLIOGRAPHIC;
    }
}
