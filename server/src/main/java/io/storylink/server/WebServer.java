package io.storylink.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storylink.core.LinkPath;
import io.storylink.core.json.JsonDocument;
import io.storylink.server.dto.*;
import io.storylink.server.link.CreateLinkInfo;
import io.storylink.server.link.LinkConnection;
import io.storylink.server.link.LinkPermissions;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link LinkService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert link results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout ({@code L} = /stories/{story}/links/{modulePath}/{link}):
 *   - POST   L/connections                     Connect
 *   - DELETE L/connections/{id}                Close the connection
 *   - GET    L/connections/{id}/value?path=a/b Read (whole value without path)
 *   - PUT    L/connections/{id}/value          Set
 *   - PATCH  L/connections/{id}/value          Update (shallow merge)
 *   - DELETE L/connections/{id}/value          Erase
 *   - GET    L/connections/{id}/entity         Read the entity reference
 *   - PUT    L/connections/{id}/entity         Store an entity reference
 *   - PUT    L/connections/{id}/schema         Install a JSON schema (raw body)
 *   - POST   L/connections/{id}/sync           Wait for queued work
 *   - POST   L/connections/{id}/watchers       Register a buffering watcher
 *   - GET    L/connections/{id}/watchers/{wid} Drain buffered notifications
 *   - GET    /stories/{story}/links            Live links of a story
 *   - GET    /admin/health                     Basic health check
 *
 * Link calls block until the link's queue has run them, so every request is
 * dispatched off the IO thread.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final LinkService links;

    public WebServer(int port, LinkService links) {
        this.links = links;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::handle);
                        return;
                    }
                    handle(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- dispatch ----------

    private record Reply(int status, Object body) {
        static Reply ok(Object body) {
            return new Reply(200, body);
        }
    }

    /** Thrown when a request body exceeds {@link #MAX_BODY_BYTES}. */
    private static final class BodyTooLargeException extends RuntimeException {
        BodyTooLargeException() {
            super("request body too large");
        }
    }

    private void handle(HttpServerExchange ex) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        long start = System.nanoTime();
        long linkMs = -1L;
        int status;
        Throwable error = null;
        try {
            long lStart = System.nanoTime();
            Reply reply = route(ex, method, path);
            if (reply.status() == 200) {
                linkMs = (System.nanoTime() - lStart) / 1_000_000L;
            }
            status = reply.status();
            send(ex, status, reply.body());
        } catch (NotFoundException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", missing.getMessage()));
        } catch (BodyTooLargeException big) {
            status = 413;
            error = big;
            send(ex, status, Map.of("error", big.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, path, status, totalMs, linkMs, error);
    }

    private Reply route(HttpServerExchange ex, String method, String path) throws IOException {
        if ("/admin/health".equals(path)) {
            return Reply.ok(Map.of("status", "ok"));
        }
        LinkRoute r = LinkRoute.parse(path);
        if (r == null) {
            return new Reply(404, Map.of("error", "not found"));
        }
        if (r.linkPath() == null) {
            return "GET".equals(method) ? handleActiveLinks(r) : methodNotAllowed();
        }
        if (r.connectionId() == null) {
            return "POST".equals(method) ? handleConnect(ex, r) : methodNotAllowed();
        }
        if (r.resource() == null) {
            if (!"DELETE".equals(method)) {
                return methodNotAllowed();
            }
            links.disconnect(r.sessionKey());
            return Reply.ok(Map.of("ok", true));
        }
        if (r.watcherId() != null) {
            return "GET".equals(method) ? handleDrain(r) : methodNotAllowed();
        }
        return switch (r.resource()) {
            case "value" -> switch (method) {
                case "GET" -> handleGet(ex, r);
                case "PUT", "PATCH", "DELETE" -> handleChange(ex, r, method);
                default -> methodNotAllowed();
            };
            case "entity" -> switch (method) {
                case "GET" -> handleGetEntity(r);
                case "PUT" -> handleSetEntity(ex, r);
                default -> methodNotAllowed();
            };
            case "schema" -> "PUT".equals(method) ? handleSetSchema(ex, r) : methodNotAllowed();
            case "sync" -> {
                if (!"POST".equals(method)) {
                    yield methodNotAllowed();
                }
                links.await(links.connection(r.sessionKey()).sync());
                yield Reply.ok(Map.of("ok", true));
            }
            case "watchers" -> "POST".equals(method) ? handleWatch(ex, r) : methodNotAllowed();
            default -> new Reply(404, Map.of("error", "not found"));
        };
    }

    // ---------- handlers ----------

    /** POST .../connections */
    private Reply handleConnect(HttpServerExchange ex, LinkRoute r) throws IOException {
        var req = readBody(ex, ConnectRequest.class, new ConnectRequest());
        LinkPermissions permissions = req.permissions == null
                ? LinkPermissions.READ_WRITE
                : LinkPermissions.valueOf(req.permissions.trim().toUpperCase(Locale.ROOT));
        LinkConnection connection = links.connect(r.storyId(), r.linkPath(), req.primary,
                new CreateLinkInfo(req.initialData, permissions));

        var dto = new ConnectResponse();
        dto.connectionId = connection.id();
        dto.primary = connection.isPrimary();
        return Reply.ok(dto);
    }

    /** GET .../value?path=a/b */
    private Reply handleGet(HttpServerExchange ex, LinkRoute r) {
        String rawPath = firstOrNull(ex.getQueryParameters().get("path"));
        List<String> path = rawPath == null || rawPath.isEmpty()
                ? List.of()
                : Arrays.asList(rawPath.split("/", -1));
        String value = links.await(links.connection(r.sessionKey()).get(path));

        var dto = new ValueResponse();
        dto.found = value != null;
        dto.json = value;
        return new Reply(value != null ? 200 : 404, dto);
    }

    /** PUT / PATCH / DELETE .../value */
    private Reply handleChange(HttpServerExchange ex, LinkRoute r, String method) throws IOException {
        var req = readBody(ex, ValueRequest.class, new ValueRequest());
        List<String> path = req.path == null ? List.of() : req.path;
        if (!"DELETE".equals(method)) {
            if (req.json == null) {
                throw new IllegalArgumentException("json must be present");
            }
            if ("PATCH".equals(method) && !isObject(req.json)) {
                throw new IllegalArgumentException("json of an update must be an object");
            }
        }
        LinkConnection connection = links.connection(r.sessionKey());
        links.await(switch (method) {
            case "PUT" -> connection.set(path, req.json);
            case "PATCH" -> connection.update(path, req.json);
            default -> connection.erase(path);
        });
        return Reply.ok(Map.of("ok", true));
    }

    /** GET .../entity */
    private Reply handleGetEntity(LinkRoute r) {
        String ref = links.await(links.connection(r.sessionKey()).getEntity());
        var dto = new EntityResponse();
        dto.found = ref != null;
        dto.entityRef = ref;
        return new Reply(ref != null ? 200 : 404, dto);
    }

    /** PUT .../entity */
    private Reply handleSetEntity(HttpServerExchange ex, LinkRoute r) throws IOException {
        var req = readBody(ex, EntityRequest.class, null);
        if (req == null || req.entityRef == null || req.entityRef.isBlank()) {
            throw new IllegalArgumentException("entityRef must not be empty");
        }
        links.await(links.connection(r.sessionKey()).setEntity(req.entityRef));
        return Reply.ok(Map.of("ok", true));
    }

    /** PUT .../schema, body is the schema itself. */
    private Reply handleSetSchema(HttpServerExchange ex, LinkRoute r) throws IOException {
        String schema = new String(readBytes(ex), StandardCharsets.UTF_8);
        if (schema.isBlank()) {
            throw new IllegalArgumentException("schema must not be empty");
        }
        links.await(links.connection(r.sessionKey()).setSchema(schema));
        return Reply.ok(Map.of("ok", true));
    }

    /** POST .../watchers */
    private Reply handleWatch(HttpServerExchange ex, LinkRoute r) throws IOException {
        var req = readBody(ex, WatchRequest.class, new WatchRequest());
        var dto = new WatchResponse();
        dto.watcherId = links.watch(r.sessionKey(), req.all);
        return Reply.ok(dto);
    }

    /** GET .../watchers/{wid} */
    private Reply handleDrain(LinkRoute r) {
        var dto = new NotificationsResponse();
        dto.watcherId = r.watcherId();
        dto.values = links.drain(r.sessionKey(), r.watcherId());
        return Reply.ok(dto);
    }

    /** GET /stories/{story}/links */
    private Reply handleActiveLinks(LinkRoute r) {
        var dto = new LinksResponse();
        dto.storyId = r.storyId();
        dto.links = new ArrayList<>();
        for (LinkPath p : links.activeLinks(r.storyId())) {
            var rec = new LinksResponse.LinkRecord();
            rec.modulePath = p.encodedModulePath();
            rec.linkName = p.linkName();
            dto.links.add(rec);
        }
        return Reply.ok(dto);
    }

    // ---------- helpers ----------

    private static Reply methodNotAllowed() {
        return new Reply(405, Map.of("error", "method not allowed"));
    }

    private static boolean isObject(String text) {
        var node = JsonDocument.parse(text);
        return node != null && node.isObject();
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Read the whole body; bodies over {@link #MAX_BODY_BYTES} are refused. */
    private static byte[] readBytes(HttpServerExchange ex) throws IOException {
        ex.startBlocking();
        byte[] data = ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
        if (data.length > MAX_BODY_BYTES) {
            throw new BodyTooLargeException();
        }
        return data;
    }

    /** Decode a JSON body, or return {@code fallback} when the body is empty. */
    private <T> T readBody(HttpServerExchange ex, Class<T> type, T fallback) throws IOException {
        byte[] data = readBytes(ex);
        if (data.length == 0) {
            return fallback;
        }
        return json.readValue(data, type);
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
