package com.chemked.data.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/** Reads the public name record of an ORCID from the ORCID public API ({@code /{orcid}/person}). */
public final class OrcidPublicApiClient extends RegistryClient implements IdentityLookup {

    public OrcidPublicApiClient(HttpClient httpClient, String baseUrl, Duration timeout) {
        super(httpClient, baseUrl, timeout);
    }

    @Override
    public Optional<PersonName> lookup(String orcid) throws LookupUnavailableException {
        Optional<JsonNode> person = fetch(orcid + "/person");
        if (person.isEmpty()) {
            return Optional.empty();
        }
        JsonNode name = person.get().path("name");
        String family = text(name.path("family-name"), "value");
        String given = text(name.path("given-names"), "value");
        if (family == null && given == null) {
            throw new LookupUnavailableException("ORCID " + orcid + " does not publish a name");
        }
        return Optional.of(new PersonName(given, family == null ? "" : family));
    }
}
