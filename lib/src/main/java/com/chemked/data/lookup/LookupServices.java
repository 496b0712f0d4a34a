package com.chemked.data.lookup;

import com.chemked.data.ChemKedSettings;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * The pair of registries used by validation and conversion. Instances are immutable and safe to
 * share between threads.
 */
public record LookupServices(IdentityLookup identity, BibliographicLookup bibliographic) {

    public LookupServices {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(bibliographic, "bibliographic");
    }

    /** Lookups that never touch the network; every query yields a lookup warning. */
    public static LookupServices offline() {
        return new LookupServices(OfflineLookup.identity(), OfflineLookup.bibliographic());
    }

    /** Online registries configured from {@link ChemKedSettings}, or offline when disabled. */
    public static LookupServices fromSettings() {
        if (!ChemKedSettings.isLookupEnabled()) {
            return offline();
        }
        Duration timeout = ChemKedSettings.lookupTimeout();
        HttpClient client =
                HttpClient.newBuilder()
                        .connectTimeout(timeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
        return new LookupServices(
                new OrcidPublicApiClient(client, ChemKedSettings.orcidBaseUrl(), timeout),
                new CrossrefClient(
                        client,
                        ChemKedSettings.crossrefBaseUrl(),
                        timeout,
                        ChemKedSettings.lookupMailto().orElse(null)));
    }
}
