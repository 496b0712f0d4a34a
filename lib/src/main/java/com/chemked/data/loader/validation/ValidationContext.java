package com.chemked.data.loader.validation;

import com.chemked.data.loader.node.MapNode;
import com.chemked.data.lookup.BibliographicLookup;
import com.chemked.data.lookup.BibliographicRecord;
import com.chemked.data.lookup.IdentityLookup;
import com.chemked.data.lookup.LookupServices;
import com.chemked.data.lookup.LookupUnavailableException;
import com.chemked.data.lookup.PersonName;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State visible to custom rules during one validation run: the document being validated and the
 * registries. Registry answers are memoized for the run so an author listed both as file author
 * and reference author is looked up once.
 */
public final class ValidationContext {
    private final MapNode document;
    private final LookupServices lookups;
    private final Map<String, Answer<PersonName>> identities = new HashMap<>();
    private final Map<String, Answer<BibliographicRecord>> works = new HashMap<>();

    public ValidationContext(MapNode document, LookupServices lookups) {
        this.document = Objects.requireNonNull(document, "document");
        this.lookups = Objects.requireNonNull(lookups, "lookups");
    }

    public MapNode getDocument() {
        return document;
    }

    public IdentityLookup identityLookup() {
        return orcid -> lookupIdentity(orcid);
    }

    public BibliographicLookup bibliographicLookup() {
        return doi -> lookupWork(doi);
    }

    private Optional<PersonName> lookupIdentity(String orcid) throws LookupUnavailableException {
        Answer<PersonName> answer = identities.get(orcid);
        if (answer == null) {
            try {
                answer = new Answer<>(lookups.identity().lookup(orcid), null);
            } catch (LookupUnavailableException ex) {
                answer = new Answer<>(null, ex);
            }
            identities.put(orcid, answer);
        }
        return answer.get();
    }

    private Optional<BibliographicRecord> lookupWork(String doi) throws LookupUnavailableException {
        Answer<BibliographicRecord> answer = works.get(doi);
        if (answer == null) {
            try {
                answer = new Answer<>(lookups.bibliographic().lookup(doi), null);
            } catch (LookupUnavailableException ex) {
                answer = new Answer<>(null, ex);
            }
            works.put(doi, answer);
        }
        return answer.get();
    }

    private record Answer<T>(Optional<T> value, LookupUnavailableException failure) {
        Optional<T> get() throws LookupUnavailableException {
            if (failure != null) {
                throw failure;
            }
            return value;
        }
    }
}
