package com.chemked.data.lookup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class RegistryClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final String MITTAL_WORK =
            "{\"status\":\"ok\",\"message\":{"
                    + "\"container-title\":[\"International Journal of Chemical Kinetics\"],"
                    + "\"volume\":\"38\",\"page\":\"516-529\","
                    + "\"published-print\":{\"date-parts\":[[2006,8]]},"
                    + "\"issued\":{\"date-parts\":[[2005]]},"
                    + "\"author\":["
                    + "{\"given\":\"Gaurav\",\"family\":\"Mittal\"},"
                    + "{\"given\":\"Chih-Jen\",\"family\":\"Sung\","
                    + "\"ORCID\":\"http://orcid.org/0000-0003-2046-8076\"},"
                    + "{\"name\":\"Combustion Consortium\"}]}}";

    private static final String SUNG_PERSON =
            "{\"name\":{\"given-names\":{\"value\":\"Chih-Jen\"},\"family-name\":{\"value\":\"Sung\"}}}";

    private final Map<String, String> responses =
            Map.of(
                    "/works/10.1002/kin.20180", MITTAL_WORK,
                    "/works/10.1/empty", "{\"status\":\"ok\"}",
                    "/works/10.1/garbled", "{\"message\":",
                    "/orcid/0000-0003-2046-8076/person", SUNG_PERSON,
                    "/orcid/0000-0002-1825-0097/person", "{\"name\":null}");
    private final List<String> userAgents = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::respond);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void respond(HttpExchange exchange) throws IOException {
        userAgents.add(exchange.getRequestHeaders().getFirst("User-Agent"));
        String path = exchange.getRequestURI().getPath();
        int status;
        byte[] body;
        if (path.endsWith("/unavailable")) {
            status = 503;
            body = "down".getBytes(StandardCharsets.UTF_8);
        } else if (responses.containsKey(path)) {
            status = 200;
            body = responses.get(path).getBytes(StandardCharsets.UTF_8);
        } else {
            status = 404;
            body = "Resource not found.".getBytes(StandardCharsets.UTF_8);
        }
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private CrossrefClient crossref(String mailto) {
        return new CrossrefClient(HttpClient.newHttpClient(), baseUrl + "/works/", TIMEOUT, mailto);
    }

    private OrcidPublicApiClient orcid() {
        return new OrcidPublicApiClient(HttpClient.newHttpClient(), baseUrl + "/orcid/", TIMEOUT);
    }

    @Test
    void readsCrossrefWork() throws Exception {
        BibliographicRecord work = crossref(null).lookup("10.1002/kin.20180").orElseThrow();

        assertEquals("10.1002/kin.20180", work.getDoi());
        assertEquals("International Journal of Chemical Kinetics", work.getJournal().orElseThrow());
        assertEquals(2006, work.getYear());
        assertEquals("38", work.getVolume().orElseThrow());
        assertEquals("516-529", work.getPages().orElseThrow());
        assertEquals(3, work.getAuthors().size());
        assertEquals("Gaurav Mittal", work.getAuthors().get(0).fullName());
        assertEquals("0000-0003-2046-8076", work.getAuthors().get(1).getOrcid().orElseThrow());
        assertEquals("Combustion Consortium", work.getAuthors().get(2).fullName());
    }

    @Test
    void unknownIdentifiersAreNotFound() throws Exception {
        assertTrue(crossref(null).lookup("10.1/missing").isEmpty());
        assertTrue(orcid().lookup("0000-0000-0000-0000").isEmpty());
    }

    @Test
    void registryFailuresAreUnavailable() {
        assertThrows(LookupUnavailableException.class, () -> crossref(null).lookup("10.1/unavailable"));
        assertThrows(LookupUnavailableException.class, () -> crossref(null).lookup("10.1/empty"));
        assertThrows(LookupUnavailableException.class, () -> crossref(null).lookup("10.1/garbled"));
        assertThrows(LookupUnavailableException.class, () -> orcid().lookup("0000-0002-1825-0097"));
    }

    @Test
    void unreachableRegistryIsUnavailable() {
        server.stop(0);
        LookupUnavailableException ex =
                assertThrows(LookupUnavailableException.class, () -> orcid().lookup("0000-0003-2046-8076"));
        assertTrue(ex.getMessage().startsWith("Unable to reach 127.0.0.1"), ex.getMessage());
    }

    @Test
    void readsOrcidPersonName() throws Exception {
        PersonName name = orcid().lookup("0000-0003-2046-8076").orElseThrow();

        assertEquals(new PersonName("Chih-Jen", "Sung"), name);
        assertEquals("Chih-Jen Sung", name.fullName());
    }

    @Test
    void crossrefRequestsCarryContactAddress() throws Exception {
        crossref("chemked@example.org").lookup("10.1002/kin.20180");
        crossref(null).lookup("10.1002/kin.20180");

        assertTrue(userAgents.get(0).endsWith(" (mailto:chemked@example.org)"), userAgents.get(0));
        assertTrue(!userAgents.get(1).contains("mailto"), userAgents.get(1));
    }
}
