package com.chemked.data.lookup;

import com.chemked.data.Version;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Resolves DOIs through the Crossref REST API ({@code /works/{doi}}). */
public final class CrossrefClient extends RegistryClient implements BibliographicLookup {

    private final String mailto;

    public CrossrefClient(HttpClient httpClient, String baseUrl, Duration timeout, String mailto) {
        super(httpClient, baseUrl, timeout);
        this.mailto = mailto;
    }

    @Override
    String userAgent() {
        return mailto == null ? Version.USER_AGENT : Version.USER_AGENT + " (mailto:" + mailto + ")";
    }

    @Override
    public Optional<BibliographicRecord> lookup(String doi) throws LookupUnavailableException {
        Optional<JsonNode> response = fetch(doi);
        if (response.isEmpty()) {
            return Optional.empty();
        }
        JsonNode message = response.get().path("message");
        if (message.isMissingNode()) {
            throw new LookupUnavailableException("Crossref response for " + doi + " has no message");
        }
        JsonNode titles = message.path("container-title");
        String journal = titles.isArray() && titles.size() > 0 ? titles.get(0).asText() : null;

        List<BibliographicRecord.RegisteredAuthor> authors = new ArrayList<>();
        for (JsonNode author : message.path("author")) {
            String family = text(author, "family");
            if (family == null) {
                // Consortium entries carry only a "name".
                family = text(author, "name");
            }
            if (family != null) {
                authors.add(
                        new BibliographicRecord.RegisteredAuthor(text(author, "given"), family, text(author, "ORCID")));
            }
        }
        return Optional.of(
                new BibliographicRecord(
                        doi, journal, year(message), text(message, "volume"), text(message, "page"), authors));
    }

    private static int year(JsonNode message) {
        for (String field : new String[] {"published-print", "published-online", "issued"}) {
            JsonNode parts = message.path(field).path("date-parts").path(0).path(0);
            if (parts.canConvertToInt()) {
                return parts.asInt();
            }
        }
        return 0;
    }
}
