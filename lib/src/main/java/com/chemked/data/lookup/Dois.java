package com.chemked.data.lookup;

import java.util.Locale;
import java.util.Objects;

/** DOI clean-up shared by reference validation and the ReSpecTh converter. */
public final class Dois {
    private static final String[] RESOLVER_PREFIXES = {
        "https://doi.org/", "http://doi.org/", "https://dx.doi.org/", "http://dx.doi.org/", "doi.org/", "doi:"
    };

    private Dois() {}

    /**
     * Strip surrounding whitespace, resolver prefixes such as {@code https://doi.org/} or
     * {@code doi:}, and trailing punctuation picked up from prose ({@code 10.1/x.} becomes
     * {@code 10.1/x}).
     */
    public static String normalize(String doi) {
        Objects.requireNonNull(doi, "doi");
        String value = doi.strip();
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            String lower = value.toLowerCase(Locale.ROOT);
            for (String prefix : RESOLVER_PREFIXES) {
                if (lower.startsWith(prefix)) {
                    value = value.substring(prefix.length()).strip();
                    stripped = true;
                    break;
                }
            }
        }
        int end = value.length();
        while (end > 0 && ".,;:".indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(0, end);
    }
}
