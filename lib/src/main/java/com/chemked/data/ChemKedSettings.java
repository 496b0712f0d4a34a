package com.chemked.data;

import java.time.Duration;
import java.util.Optional;

/**
 * Runtime settings. Each value is read from a system property first and falls back to an
 * environment variable, so command line tools and test runners can both override it.
 */
public final class ChemKedSettings {
    private static final String LOOKUP_ENABLED_PROPERTY = "chemked.lookup.enabled";
    private static final String LOOKUP_ENABLED_ENV = "CHEMKED_LOOKUP_ENABLED";
    private static final String LOOKUP_TIMEOUT_PROPERTY = "chemked.lookup.timeoutSeconds";
    private static final String LOOKUP_TIMEOUT_ENV = "CHEMKED_LOOKUP_TIMEOUT_SECONDS";
    private static final String LOOKUP_MAILTO_PROPERTY = "chemked.lookup.mailto";
    private static final String LOOKUP_MAILTO_ENV = "CHEMKED_LOOKUP_MAILTO";
    private static final String ORCID_BASE_URL_PROPERTY = "chemked.orcid.baseUrl";
    private static final String ORCID_BASE_URL_ENV = "CHEMKED_ORCID_BASE_URL";
    private static final String CROSSREF_BASE_URL_PROPERTY = "chemked.crossref.baseUrl";
    private static final String CROSSREF_BASE_URL_ENV = "CHEMKED_CROSSREF_BASE_URL";

    static final String DEFAULT_ORCID_BASE_URL = "https://pub.orcid.org/v3.0/";
    static final String DEFAULT_CROSSREF_BASE_URL = "https://api.crossref.org/works/";
    private static final long DEFAULT_TIMEOUT_SECONDS = 10;

    private ChemKedSettings() {}

    /** Whether the online ORCID and Crossref registries should be consulted. */
    public static boolean isLookupEnabled() {
        return value(LOOKUP_ENABLED_PROPERTY, LOOKUP_ENABLED_ENV).map(Boolean::parseBoolean).orElse(true);
    }

    public static Duration lookupTimeout() {
        Optional<String> raw = value(LOOKUP_TIMEOUT_PROPERTY, LOOKUP_TIMEOUT_ENV);
        if (raw.isEmpty()) {
            return Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        }
        try {
            long seconds = Long.parseLong(raw.get().trim());
            if (seconds <= 0) {
                throw new IllegalArgumentException(LOOKUP_TIMEOUT_PROPERTY + " must be positive: " + raw.get());
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(LOOKUP_TIMEOUT_PROPERTY + " is not a number: " + raw.get(), ex);
        }
    }

    /** Contact address sent to Crossref with every request, if configured. */
    public static Optional<String> lookupMailto() {
        return value(LOOKUP_MAILTO_PROPERTY, LOOKUP_MAILTO_ENV);
    }

    public static String orcidBaseUrl() {
        return withTrailingSlash(value(ORCID_BASE_URL_PROPERTY, ORCID_BASE_URL_ENV).orElse(DEFAULT_ORCID_BASE_URL));
    }

    public static String crossrefBaseUrl() {
        return withTrailingSlash(
                value(CROSSREF_BASE_URL_PROPERTY, CROSSREF_BASE_URL_ENV).orElse(DEFAULT_CROSSREF_BASE_URL));
    }

    private static Optional<String> value(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static String withTrailingSlash(String url) {
        return url.endsWith("/") ? url : url + "/";
    }
}
