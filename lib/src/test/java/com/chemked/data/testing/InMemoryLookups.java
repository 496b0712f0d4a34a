package com.chemked.data.testing;

import com.chemked.data.lookup.BibliographicLookup;
import com.chemked.data.lookup.BibliographicRecord;
import com.chemked.data.lookup.BibliographicRecord.RegisteredAuthor;
import com.chemked.data.lookup.IdentityLookup;
import com.chemked.data.lookup.LookupServices;
import com.chemked.data.lookup.PersonName;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registries backed by maps, preloaded with the people and works the test documents cite. Every
 * query is recorded so tests can check how often a registry was consulted.
 */
public final class InMemoryLookups {

    public static final String NIEMEYER_ORCID = "0000-0003-4425-7097";
    public static final String SUNG_ORCID = "0000-0003-2046-8076";
    public static final String MITTAL_2006_DOI = "10.1002/kin.20180";
    public static final String CHAUMEIX_2007_DOI = "10.1016/j.ijhydene.2007.04.008";

    private final Map<String, PersonName> people = new HashMap<>();
    private final Map<String, BibliographicRecord> works = new HashMap<>();
    private final List<String> queries = new ArrayList<>();

    public static InMemoryLookups standard() {
        InMemoryLookups lookups = new InMemoryLookups();
        lookups.person(NIEMEYER_ORCID, new PersonName("Kyle", "Niemeyer"));
        lookups.person(SUNG_ORCID, new PersonName("Chih-Jen", "Sung"));
        lookups.work(
                new BibliographicRecord(
                        MITTAL_2006_DOI,
                        "International Journal of Chemical Kinetics",
                        2006,
                        "38",
                        "516-529",
                        List.of(
                                new RegisteredAuthor("Gaurav", "Mittal", null),
                                new RegisteredAuthor("Chih-Jen", "Sung", "http://orcid.org/" + SUNG_ORCID),
                                new RegisteredAuthor("Richard A.", "Yetter", null))));
        lookups.work(
                new BibliographicRecord(
                        CHAUMEIX_2007_DOI,
                        "International Journal of Hydrogen Energy",
                        2007,
                        "32",
                        "2216-2226",
                        List.of(
                                new RegisteredAuthor("N.", "Chaumeix", null),
                                new RegisteredAuthor("S.", "Pichon", null),
                                new RegisteredAuthor("F.", "Lafosse", null),
                                new RegisteredAuthor("C.-E.", "Paillard", null))));
        return lookups;
    }

    public InMemoryLookups person(String orcid, PersonName name) {
        people.put(orcid, name);
        return this;
    }

    public InMemoryLookups work(BibliographicRecord record) {
        works.put(record.getDoi(), record);
        return this;
    }

    /** Identifiers queried so far, ORCIDs and DOIs alike, in query order. */
    public List<String> getQueries() {
        return queries;
    }

    public IdentityLookup identity() {
        return this::lookupPerson;
    }

    public BibliographicLookup bibliographic() {
        return this::lookupWork;
    }

    public LookupServices services() {
        return new LookupServices(identity(), bibliographic());
    }

    private Optional<PersonName> lookupPerson(String orcid) {
        queries.add(orcid);
        return Optional.ofNullable(people.get(orcid));
    }

    private Optional<BibliographicRecord> lookupWork(String doi) {
        queries.add(doi);
        return Optional.ofNullable(works.get(doi));
    }
}
