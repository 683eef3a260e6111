package io.storylink.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storylink.storage.InMemoryPageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP binding of link connections.
 *
 * Focus:
 *  - connect / set / get / watch round trip through two connections.
 *  - Validation errors: invalid JSON, bad permissions, non-object update -> 400.
 *  - Unknown connection or watcher -> 404, wrong method -> 405.
 *  - Too-large body -> 413.
 */
class WebServerTest {

    private static final int PORT = 18181; // test-only port
    private static final String BASE = "http://localhost:" + PORT;
    private static final String LINK = "/stories/story-1/links/root:editor/notes";

    private final ObjectMapper json = new ObjectMapper();
    private LinkService service;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        // Notifications inline, so every write has settled when its response arrives.
        service = new LinkService(storyId -> new InMemoryPageStore(Runnable::run));
        server = new WebServer(PORT, service);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        server.stop();
        service.close();
    }

    // ---------- helpers ----------

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(BASE + path))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode ok(HttpResponse<String> resp) throws Exception {
        assertEquals(200, resp.statusCode(), resp.body());
        return json.readTree(resp.body());
    }

    private int connect(String body) throws Exception {
        return ok(send("POST", LINK + "/connections", body)).get("connectionId").asInt();
    }

    private List<String> drain(int connection, long watcher) throws Exception {
        JsonNode values = ok(send("GET", LINK + "/connections/" + connection + "/watchers/" + watcher, null)).get("values");
        return json.convertValue(values, json.getTypeFactory().constructCollectionType(List.class, String.class));
    }

    // ---------- round trips ----------

    @Test
    void health_returns_ok() throws Exception {
        assertEquals("ok", ok(send("GET", "/admin/health", null)).get("status").asText());
    }

    @Test
    void connect_set_and_get_round_trip() throws Exception {
        HttpResponse<String> created = send("POST", LINK + "/connections",
                "{\"primary\":true,\"initialData\":\"{}\"}");
        JsonNode body = ok(created);
        assertEquals(2, body.get("connectionId").asInt());
        assertTrue(body.get("primary").asBoolean());

        ok(send("PUT", LINK + "/connections/2/value", "{\"path\":[\"title\"],\"json\":\"\\\"Intro\\\"\"}"));

        JsonNode read = ok(send("GET", LINK + "/connections/2/value?path=title", null));
        assertTrue(read.get("found").asBoolean());
        assertEquals("\"Intro\"", read.get("json").asText());

        JsonNode whole = ok(send("GET", LINK + "/connections/2/value", null));
        assertEquals("{\"title\":\"Intro\"}", whole.get("json").asText());
    }

    @Test
    void missing_value_is_404_with_found_false() throws Exception {
        int c = connect("{\"initialData\":\"{}\"}");
        HttpResponse<String> resp = send("GET", LINK + "/connections/" + c + "/value?path=nothing/here", null);
        assertEquals(404, resp.statusCode());
        assertFalse(json.readTree(resp.body()).get("found").asBoolean());
    }

    @Test
    void watchers_buffer_changes_from_other_connections() throws Exception {
        int a = connect("{\"initialData\":\"{}\"}");
        int b = connect(null);
        long watcherB = ok(send("POST", LINK + "/connections/" + b + "/watchers", "{}")).get("watcherId").asLong();
        long watcherA = ok(send("POST", LINK + "/connections/" + a + "/watchers", "{\"all\":false}")).get("watcherId").asLong();

        ok(send("PUT", LINK + "/connections/" + a + "/value", "{\"json\":\"{\\\"x\\\":1}\"}"));
        ok(send("PATCH", LINK + "/connections/" + b + "/value", "{\"json\":\"{\\\"y\\\":2}\"}"));

        // B hears A's write but not its own update; A hears only B's update.
        assertEquals(List.of("{}", "{\"x\":1}"), drain(b, watcherB));
        assertEquals(List.of("{}", "{\"x\":1,\"y\":2}"), drain(a, watcherA));
        assertEquals(List.of(), drain(b, watcherB), "drain empties the buffer");
    }

    @Test
    void watch_all_includes_own_writes_and_erase_is_reported() throws Exception {
        int a = connect("{\"initialData\":\"{\\\"k\\\":1}\"}");
        long w = ok(send("POST", LINK + "/connections/" + a + "/watchers", "{\"all\":true}")).get("watcherId").asLong();

        ok(send("DELETE", LINK + "/connections/" + a + "/value", "{\"path\":[\"k\"]}"));
        ok(send("POST", LINK + "/connections/" + a + "/sync", null));

        assertEquals(List.of("{\"k\":1}", "{}"), drain(a, w));
    }

    @Test
    void entity_round_trip() throws Exception {
        int c = connect(null);
        assertEquals(404, send("GET", LINK + "/connections/" + c + "/entity", null).statusCode());

        ok(send("PUT", LINK + "/connections/" + c + "/entity", "{\"entityRef\":\"entity://photos/7\"}"));

        JsonNode entity = ok(send("GET", LINK + "/connections/" + c + "/entity", null));
        assertTrue(entity.get("found").asBoolean());
        assertEquals("entity://photos/7", entity.get("entityRef").asText());
    }

    @Test
    void schema_is_accepted_and_writes_still_apply() throws Exception {
        int c = connect(null);
        ok(send("PUT", LINK + "/connections/" + c + "/schema", "{\"type\":\"object\"}"));
        ok(send("PUT", LINK + "/connections/" + c + "/value", "{\"json\":\"42\"}"));

        assertEquals("42", ok(send("GET", LINK + "/connections/" + c + "/value", null)).get("json").asText());
    }

    @Test
    void active_links_lists_connected_links() throws Exception {
        connect(null);

        JsonNode links = ok(send("GET", "/stories/story-1/links", null));
        assertEquals("story-1", links.get("storyId").asText());
        assertEquals(1, links.get("links").size());
        assertEquals("root:editor", links.get("links").get(0).get("modulePath").asText());
        assertEquals("notes", links.get("links").get(0).get("linkName").asText());

        assertEquals(0, ok(send("GET", "/stories/unknown/links", null)).get("links").size());
    }

    @Test
    void closed_connection_is_gone_and_orphaned_link_disposed() throws Exception {
        int c = connect(null);
        ok(send("DELETE", LINK + "/connections/" + c, null));

        assertEquals(404, send("GET", LINK + "/connections/" + c + "/value", null).statusCode());
        assertEquals(404, send("DELETE", LINK + "/connections/" + c, null).statusCode());
        assertEquals(0, ok(send("GET", "/stories/story-1/links", null)).get("links").size());
    }

    // ---------- validation ----------

    @Test
    void invalid_json_body_returns_400() throws Exception {
        int c = connect(null);
        HttpResponse<String> resp = send("PUT", LINK + "/connections/" + c + "/value", "{not-json");
        assertEquals(400, resp.statusCode());
        assertEquals("invalid JSON", json.readTree(resp.body()).get("error").asText());
    }

    @Test
    void set_without_json_returns_400() throws Exception {
        int c = connect(null);
        assertEquals(400, send("PUT", LINK + "/connections/" + c + "/value", "{\"path\":[\"a\"]}").statusCode());
    }

    @Test
    void update_with_non_object_returns_400() throws Exception {
        int c = connect(null);
        assertEquals(400, send("PATCH", LINK + "/connections/" + c + "/value", "{\"json\":\"[1,2]\"}").statusCode());
    }

    @Test
    void unknown_permissions_return_400() throws Exception {
        HttpResponse<String> resp = send("POST", LINK + "/connections", "{\"permissions\":\"everyone\"}");
        assertEquals(400, resp.statusCode());
    }

    @Test
    void bad_story_id_returns_400() throws Exception {
        assertEquals(400, send("POST", "/stories/.hidden/links/root/notes/connections", null).statusCode());
    }

    @Test
    void non_numeric_connection_id_returns_400() throws Exception {
        assertEquals(400, send("GET", LINK + "/connections/abc/value", null).statusCode());
    }

    @Test
    void unknown_connection_and_watcher_return_404() throws Exception {
        assertEquals(404, send("GET", LINK + "/connections/99/value", null).statusCode());

        int c = connect(null);
        assertEquals(404, send("GET", LINK + "/connections/" + c + "/watchers/12345", null).statusCode());
    }

    @Test
    void unknown_path_returns_404() throws Exception {
        assertEquals(404, send("GET", "/nope", null).statusCode());
        assertEquals(404, send("GET", LINK + "/connections/2/unknown", null).statusCode());
    }

    @Test
    void wrong_method_returns_405() throws Exception {
        assertEquals(405, send("GET", LINK + "/connections", null).statusCode());
        int c = connect(null);
        assertEquals(405, send("POST", LINK + "/connections/" + c + "/value", "{}").statusCode());
        assertEquals(405, send("GET", LINK + "/connections/" + c + "/sync", null).statusCode());
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        int c = connect(null);
        String big = "x".repeat(WebServer.MAX_BODY_BYTES + 1);
        HttpResponse<String> resp = send("PUT", LINK + "/connections/" + c + "/schema", big);
        assertEquals(413, resp.statusCode());
        assertEquals("request body too large", json.readTree(resp.body()).get("error").asText());
    }
}
