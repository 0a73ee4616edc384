package com.secpipe.orchestrator.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secpipe.orchestrator.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the documentation system's content REST API (Confluence).
 *
 * Covers the calls the publisher needs: title search scoped to a space, page
 * create/update, and attachment upload. Uses java.net.http.HttpClient with
 * basic auth (user + API token). Every failure, including non-2xx responses
 * and a missing base URL, surfaces as {@link DocumentationException}.
 */
public class DocumentationClient {

    private static final Logger log = LoggerFactory.getLogger(DocumentationClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final PipelineProperties.Documentation settings;

    public DocumentationClient(PipelineProperties.Documentation settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean isConfigured() {
        return settings.configured();
    }

    public String baseUrl() {
        return settings.baseUrl();
    }

    // ------------------------------------------------------------------
    // Pages
    // ------------------------------------------------------------------

    /**
     * Find pages in {@code spaceKey} whose title equals {@code title}.
     * An empty list means no match; more than one means the title is ambiguous.
     */
    public List<PageSummary> searchByTitle(String spaceKey, String title) {
        String cql = "space = \"" + cqlEscape(spaceKey) + "\" AND type = page AND title = \""
                + cqlEscape(title) + "\"";
        String body = get("/rest/api/content/search?expand=version&cql=" + encode(cql),
                "search for '" + title + "'");
        return parsePages(json, body);
    }

    /** Create a page and return its id. */
    public String createPage(String spaceKey, String title, String bodyHtml) {
        log.info("Creating page '{}' in space {}", title, spaceKey);
        String payload = toJson(Map.of(
                "type",  "page",
                "title", title,
                "space", Map.of("key", spaceKey),
                "body",  storage(bodyHtml)));
        String resp = send(jsonRequest("/rest/api/content")
                        .POST(HttpRequest.BodyPublishers.ofString(payload)).build(),
                "createPage '" + title + "'");
        try {
            return json.readTree(resp).path("id").asText();
        } catch (JsonProcessingException e) {
            throw new DocumentationException("Failed to parse createPage response", e);
        }
    }

    /** Replace the body of an existing page, bumping its version. */
    public void updatePage(PageSummary page, String bodyHtml) {
        log.info("Updating page '{}' ({}) to version {}", page.title(), page.id(), page.version() + 1);
        String payload = toJson(Map.of(
                "id",      page.id(),
                "type",    "page",
                "title",   page.title(),
                "version", Map.of("number", page.version() + 1),
                "body",    storage(bodyHtml)));
        send(jsonRequest("/rest/api/content/" + page.id())
                        .PUT(HttpRequest.BodyPublishers.ofString(payload)).build(),
                "updatePage " + page.id());
    }

    // ------------------------------------------------------------------
    // Attachments
    // ------------------------------------------------------------------

    /** Upload {@code file} to the page, replacing an attachment of the same name. */
    public void uploadAttachment(String pageId, Path file) {
        String name = file.getFileName().toString();
        String existing = get("/rest/api/content/" + pageId + "/child/attachment?filename=" + encode(name),
                "attachment lookup for " + name);
        List<PageSummary> matches = parsePages(json, existing);
        String path = matches.isEmpty()
                ? "/rest/api/content/" + pageId + "/child/attachment"
                : "/rest/api/content/" + pageId + "/child/attachment/" + matches.get(0).id() + "/data";

        String boundary = "----secpipe" + UUID.randomUUID().toString().replace("-", "");
        HttpRequest req = request(path)
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .header("X-Atlassian-Token", "no-check")
                .POST(HttpRequest.BodyPublishers.ofByteArray(multipart(boundary, name, file)))
                .build();
        send(req, "upload " + name);
        log.info("Uploaded attachment {} to page {}", name, pageId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Parse a content listing ({"results":[{"id","title","version":{"number"}}]}). */
    static List<PageSummary> parsePages(ObjectMapper json, String body) {
        try {
            JsonNode results = json.readTree(body).path("results");
            List<PageSummary> pages = new ArrayList<>();
            for (JsonNode node : results) {
                pages.add(new PageSummary(
                        node.path("id").asText(),
                        node.path("title").asText(),
                        node.path("version").path("number").asInt(0)));
            }
            return pages;
        } catch (JsonProcessingException e) {
            throw new DocumentationException("Unparseable content listing", e);
        }
    }

    private String get(String path, String opName) {
        return send(request(path).header("Accept", "application/json").GET().build(), opName);
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new DocumentationException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (DocumentationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentationException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new DocumentationException(opName + " failed", e);
        }
    }

    private HttpRequest.Builder jsonRequest(String path) {
        return request(path)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json");
    }

    private HttpRequest.Builder request(String path) {
        if (!settings.configured()) {
            throw new DocumentationException("Documentation base URL is not configured");
        }
        String credentials = nullToEmpty(settings.user()) + ":" + nullToEmpty(settings.token());
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(settings.baseUrl() + path))
                    .timeout(settings.timeout())
                    .header("Authorization", "Basic " + Base64.getEncoder()
                            .encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        } catch (IllegalArgumentException e) {
            // Missing scheme, unsupported scheme or characters URI rejects.
            throw new DocumentationException("Invalid documentation base URL '" + settings.baseUrl() + "'", e);
        }
    }

    private static Map<String, Object> storage(String html) {
        return Map.of("storage", Map.of("value", html, "representation", "storage"));
    }

    private static byte[] multipart(String boundary, String fileName, Path file) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            String head = "--" + boundary + "\r\n"
                    + "Content-Disposition: form-data; name=\"file\"; filename=\"" + fileName + "\"\r\n"
                    + "Content-Type: application/octet-stream\r\n\r\n";
            out.write(head.getBytes(StandardCharsets.UTF_8));
            out.write(Files.readAllBytes(file));
            out.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
            return out.toByteArray();
        } catch (IOException e) {
            throw new DocumentationException("Cannot read attachment " + file, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DocumentationException("JSON serialization failed", e);
        }
    }

    private static String cqlEscape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
