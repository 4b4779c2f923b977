package com.imageanalysis.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.imageanalysis.shared.json.Json;
import com.imageanalysis.shared.model.ResultStatus;
import com.imageanalysis.shared.store.FileResultStore;
import com.imageanalysis.shared.store.ResultStore;
import com.imageanalysis.shared.store.StoreException;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class QueryApiServerTest {

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private QueryApiServer server;
    private HttpClient client;

    @Before
    public void setUp() throws Exception {
        FileResultStore store = new FileResultStore(temp.getRoot().toPath());
        store.upsert(QueryServiceTest.result("a", "cat.jpg", Instant.parse("2024-05-01T10:00:00Z"),
                ResultStatus.COMPLETE));
        store.upsert(QueryServiceTest.result("b", "dog.png", Instant.parse("2024-05-02T10:00:00Z"),
                ResultStatus.PARTIAL));

        server = start(store);
        client = HttpClient.newHttpClient();
    }

    @After
    public void tearDown() {
        server.close();
    }

    private static QueryApiServer start(ResultStore store) {
        QueryApiServer started = new QueryApiServer(new QueryService(store), 0);
        started.start();
        return started;
    }

    private HttpResponse<String> get(QueryApiServer target, String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + target.getPort() + pathAndQuery))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        return get(server, pathAndQuery);
    }

    @Test
    public void testListResults() throws Exception {
        HttpResponse<String> response = get("/api/results?limit=5");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").get().startsWith("application/json"));
        JsonNode body = Json.mapper().readTree(response.body());
        assertEquals(2, body.get("count").asInt());
        JsonNode newest = body.get("results").get(0);
        assertEquals("b", newest.get("id").asText());
        assertEquals("ISO instants, as stored", "2024-05-02T10:00:00Z", newest.get("analyzedAt").asText());
        assertFalse("Listing shows the short form", newest.has("analyses"));
    }

    @Test
    public void testDefaultLimit() throws Exception {
        JsonNode body = Json.mapper().readTree(get("/api/results").body());

        assertEquals(2, body.get("count").asInt());
    }

    @Test
    public void testListWithFilters() throws Exception {
        JsonNode byStatus = Json.mapper().readTree(get("/api/results?status=partial").body());
        assertEquals(1, byStatus.get("count").asInt());
        assertEquals("dog.png", byStatus.get("results").get(0).get("fileName").asText());

        JsonNode byName = Json.mapper().readTree(get("/api/results?fileName=CAT").body());
        assertEquals(1, byName.get("count").asInt());

        JsonNode byTime = Json.mapper().readTree(get("/api/results?after=2024-05-01T12:00:00Z").body());
        assertEquals(1, byTime.get("count").asInt());
        assertEquals("b", byTime.get("results").get(0).get("id").asText());
    }

    @Test
    public void testGetResult() throws Exception {
        HttpResponse<String> response = get("/api/results/a");

        assertEquals(200, response.statusCode());
        JsonNode body = Json.mapper().readTree(response.body());
        assertEquals("cat.jpg", body.get("fileName").asText());
        assertEquals("COMPLETE", body.get("status").asText());
        assertTrue(body.get("summary").has("hasText"));
        assertTrue("Single result carries the full record", body.has("blobPath"));
    }

    @Test
    public void testUnknownResult() throws Exception {
        HttpResponse<String> response = get("/api/results/nope");

        assertEquals(404, response.statusCode());
        assertEquals("Result not found: nope", Json.mapper().readTree(response.body()).get("error").asText());
    }

    @Test
    public void testBadParameters() throws Exception {
        HttpResponse<String> badLimit = get("/api/results?limit=ten");
        assertEquals(400, badLimit.statusCode());
        assertEquals("Invalid limit: ten", Json.mapper().readTree(badLimit.body()).get("error").asText());

        assertEquals(400, get("/api/results?status=DONE").statusCode());
        assertEquals(400, get("/api/results?after=yesterday").statusCode());
    }

    @Test
    public void testOnlyGetAllowed() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + "/api/results"))
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();

        assertEquals(405, client.send(request, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    public void testStoreFailureIsServerError() throws Exception {
        ResultStore broken = mock(ResultStore.class);
        when(broken.list(anyInt(), any())).thenThrow(new StoreException("table unavailable"));
        QueryApiServer failing = start(broken);
        try {
            HttpResponse<String> response = get(failing, "/api/results");

            assertEquals(500, response.statusCode());
            assertEquals("table unavailable", Json.mapper().readTree(response.body()).get("error").asText());
        } finally {
            failing.close();
        }
    }
}
