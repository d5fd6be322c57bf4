package com.bookapi;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
public class BookApiTest {

    private static HttpServer server;
    private static HttpClient client;
    private static InMemoryBookGateway gateway;
    private static int port;

    @BeforeAll
    static void startServer() throws IOException {
        gateway = new InMemoryBookGateway();
        BookApiTelemetry telemetry = new BookApiTelemetry(OpenTelemetry.noop(), "bookapi-test");
        server = new HttpServer(0, App.createHandler(new BookHandlers(gateway), telemetry));
        server.start();
        port = server.getPort();
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterAll
    static void stopServer() {
        if (server != null) server.stop();
    }

    @BeforeEach
    void cleanGateway() {
        gateway.clear();
    }

    // --- Helper methods ---

    private String baseUrl() {
        return "http://localhost:" + port;
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl() + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        return client.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl() + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private HttpResponse<String> put(String path, String body) throws IOException, InterruptedException {
        return client.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl() + path))
                        .header("Content-Type", "application/json")
                        .PUT(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private HttpResponse<String> delete(String path) throws IOException, InterruptedException {
        return client.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl() + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private HttpResponse<String> sendMethod(String method, String path) throws IOException, InterruptedException {
        return client.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl() + path))
                        .method(method, HttpRequest.BodyPublishers.noBody())
                        .build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private String bookJson(String title, String author, String summary) {
        JsonObject json = new JsonObject();
        if (title != null) json.addProperty("title", title);
        if (author != null) json.addProperty("author", author);
        if (summary != null) json.addProperty("summary", summary);
        return json.toString();
    }

    private long createBook(String title, String author, String summary) throws Exception {
        HttpResponse<String> resp = post("/books", bookJson(title, author, summary));
        assertEquals(201, resp.statusCode());
        return JsonParser.parseString(resp.body()).getAsJsonObject().get("id").getAsLong();
    }

    private JsonArray getArray(String path) throws Exception {
        HttpResponse<String> resp = get(path);
        assertEquals(200, resp.statusCode());
        return JsonParser.parseString(resp.body()).getAsJsonArray();
    }

    // --- T1: Create, get, delete, get again ---
    @Test
    void testT01_createGetDeleteLifecycle() throws Exception {
        HttpResponse<String> createResp = post("/books", bookJson("A", "B", "C"));
        assertEquals(201, createResp.statusCode());
        assertTrue(createResp.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));

        JsonObject created = JsonParser.parseString(createResp.body()).getAsJsonObject();
        long id = created.get("id").getAsLong();
        assertEquals("A", created.get("title").getAsString());
        assertEquals("B", created.get("author").getAsString());
        assertEquals("C", created.get("summary").getAsString());

        JsonArray fetched = getArray("/books?id=" + id);
        assertEquals(1, fetched.size());
        JsonObject book = fetched.get(0).getAsJsonObject();
        assertEquals(id, book.get("id").getAsLong());
        assertEquals("A", book.get("title").getAsString());
        assertEquals("B", book.get("author").getAsString());
        assertEquals("C", book.get("summary").getAsString());

        assertEquals(204, delete("/books?id=" + id).statusCode());

        HttpResponse<String> afterDelete = get("/books?id=" + id);
        assertEquals(200, afterDelete.statusCode());
        assertEquals("[]", afterDelete.body());
    }

    // --- T2: Empty list is an array, never null ---
    @Test
    void testT02_emptyListIsEmptyArray() throws Exception {
        HttpResponse<String> resp = get("/books");
        assertEquals(200, resp.statusCode());
        assertEquals("[]", resp.body());
    }

    // --- T3: N creates, M deletes ---
    @Test
    void testT03_listReflectsCreatesAndDeletes() throws Exception {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(createBook("Book " + i, "Author " + i, "Summary " + i));
        }
        assertEquals(204, delete("/books?id=" + ids.get(1)).statusCode());
        assertEquals(204, delete("/books?id=" + ids.get(3)).statusCode());
        assertEquals(200, put("/books?id=" + ids.get(4), bookJson("Book 4b", "Author 4b", null)).statusCode());

        JsonArray books = getArray("/books");
        assertEquals(3, books.size());
        for (var element : books) {
            JsonObject book = element.getAsJsonObject();
            long id = book.get("id").getAsLong();
            assertNotEquals(ids.get(1).longValue(), id);
            assertNotEquals(ids.get(3).longValue(), id);
            if (id == ids.get(4).longValue()) {
                assertEquals("Book 4b", book.get("title").getAsString());
                assertTrue(book.get("summary").isJsonNull());
            }
        }
    }

    // --- T4: Get-by-id miss answers 200 with an empty array ---
    @Test
    void testT04_getByIdMissIsEmptyArray() throws Exception {
        HttpResponse<String> resp = get("/books?id=424242");
        assertEquals(200, resp.statusCode());
        assertEquals("[]", resp.body());
    }

    // --- T5: Non-numeric id ---
    @Test
    void testT05_nonNumericIdIsBadRequest() throws Exception {
        assertEquals(400, get("/books?id=abc").statusCode());
        assertEquals(400, put("/books?id=abc", bookJson("A", "B", "C")).statusCode());
        assertEquals(400, delete("/books?id=abc").statusCode());
    }

    // --- T6: Empty id means list all ---
    @Test
    void testT06_emptyIdListsAll() throws Exception {
        createBook("A", "B", "C");
        createBook("D", "E", "F");
        assertEquals(2, getArray("/books?id=").size());
    }

    // --- T7: Malformed bodies on create ---
    @ParameterizedTest
    @ValueSource(strings = {"not json at all", "{\"title\":", "[1,2,3]", "\"just a string\"", "",
            "{\"title\":5,\"author\":\"B\"}", "{\"title\":\"A\",\"author\":{\"name\":\"B\"}}",
            "{title:A,author:B}", "{'title':'A','author':'B'}", "{\"title\":\"A\",\"author\":\"B\"}{}"})
    void testT07_malformedCreateBody(String body) throws Exception {
        HttpResponse<String> resp = post("/books", body);
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("error"));
        assertEquals(0, gateway.size());
    }

    // --- T8: Client-supplied id is ignored ---
    @Test
    void testT08_clientIdIgnoredOnCreate() throws Exception {
        HttpResponse<String> resp = post("/books", "{\"id\":999,\"title\":\"A\",\"author\":\"B\",\"summary\":\"C\"}");
        assertEquals(201, resp.statusCode());
        long id = JsonParser.parseString(resp.body()).getAsJsonObject().get("id").getAsLong();
        assertNotEquals(999L, id);
        assertEquals("[]", get("/books?id=999").body());
    }

    // --- T9: Title and author are required ---
    @ParameterizedTest
    @ValueSource(strings = {"{\"author\":\"B\",\"summary\":\"C\"}", "{\"title\":\"A\"}",
            "{\"title\":null,\"author\":\"B\"}"})
    void testT09_missingTitleOrAuthorIsBadRequest(String body) throws Exception {
        HttpResponse<String> resp = post("/books", body);
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("Invalid request body"));
        assertEquals(0, gateway.size());
    }

    // --- T10: Summary is optional and round-trips as UTF-8 text ---
    @Test
    void testT10_summaryNullAndUnicode() throws Exception {
        long withoutSummary = createBook("A", "B", null);
        JsonObject book = getArray("/books?id=" + withoutSummary).get(0).getAsJsonObject();
        assertTrue(book.get("summary").isJsonNull());

        long unicode = createBook("Der Zauberberg", "Thomas Mann", "Sanatorium in Davos – über Zeit 📚");
        book = getArray("/books?id=" + unicode).get(0).getAsJsonObject();
        assertEquals("Sanatorium in Davos – über Zeit 📚", book.get("summary").getAsString());
    }

    // --- T11: Update replaces the whole record ---
    @Test
    void testT11_updateIsWholeRecordReplacement() throws Exception {
        long id = createBook("Dune", "Frank Herbert", "Spice");

        HttpResponse<String> resp = put("/books?id=" + id, "{\"title\":\"Dune Messiah\",\"author\":\"Frank Herbert\"}");
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().isEmpty());

        JsonObject book = getArray("/books?id=" + id).get(0).getAsJsonObject();
        assertEquals(id, book.get("id").getAsLong());
        assertEquals("Dune Messiah", book.get("title").getAsString());
        assertTrue(book.get("summary").isJsonNull());
    }

    // --- T12: Update is idempotent ---
    @Test
    void testT12_updateIsIdempotent() throws Exception {
        long id = createBook("A", "B", "C");
        String body = bookJson("X", "Y", "Z");

        assertEquals(200, put("/books?id=" + id, body).statusCode());
        String first = get("/books?id=" + id).body();
        assertEquals(200, put("/books?id=" + id, body).statusCode());
        assertEquals(first, get("/books?id=" + id).body());
    }

    // --- T13: Update input errors ---
    @Test
    void testT13_updateInputErrors() throws Exception {
        long id = createBook("A", "B", "C");

        HttpResponse<String> missingId = put("/books", bookJson("X", "Y", "Z"));
        assertEquals(400, missingId.statusCode());
        assertTrue(missingId.body().contains("Missing book ID"));

        assertEquals(400, put("/books?id=" + id, "{broken").statusCode());
        assertEquals(400, put("/books?id=" + id, "{title:X,author:Y}").statusCode());
        assertEquals(400, put("/books?id=" + id, "{\"title\":\"X\"}").statusCode());

        JsonObject book = getArray("/books?id=" + id).get(0).getAsJsonObject();
        assertEquals("A", book.get("title").getAsString());
    }

    // --- T14: Update/delete of a nonexistent id ---
    @Test
    void testT14_nonexistentIdIsNotFound() throws Exception {
        createBook("A", "B", "C");
        String before = get("/books").body();

        HttpResponse<String> updateResp = put("/books?id=987654", bookJson("X", "Y", "Z"));
        assertEquals(404, updateResp.statusCode());
        assertTrue(updateResp.body().contains("Book not found"));
        assertEquals(404, delete("/books?id=987654").statusCode());

        assertEquals(before, get("/books").body());
    }

    // --- T15: Delete twice ---
    @Test
    void testT15_deleteAlreadyDeleted() throws Exception {
        long id = createBook("A", "B", "C");

        HttpResponse<String> first = delete("/books?id=" + id);
        assertEquals(204, first.statusCode());
        assertTrue(first.body().isEmpty());
        assertEquals(404, delete("/books?id=" + id).statusCode());
    }

    // --- T16: Delete without id ---
    @Test
    void testT16_deleteMissingId() throws Exception {
        createBook("A", "B", "C");
        assertEquals(400, delete("/books").statusCode());
        assertEquals(1, gateway.size());
    }

    // --- T17: Method not allowed ---
    @ParameterizedTest
    @ValueSource(strings = {"PATCH", "OPTIONS"})
    void testT17_methodNotAllowed(String method) throws Exception {
        HttpResponse<String> resp = sendMethod(method, "/books");
        assertEquals(405, resp.statusCode());
        assertTrue(resp.body().contains("Method not allowed"));
    }

    // --- T18: Health check ---
    @Test
    void testT18_healthCheck() throws Exception {
        HttpResponse<String> resp = get("/healthz");
        assertEquals(200, resp.statusCode());
        assertEquals("OK", resp.body());

        assertEquals(200, post("/healthz", "").statusCode());
    }

    // --- T19: Concurrent creates get distinct ids ---
    @Test
    void testT19_concurrentCreatesGetDistinctIds() throws Exception {
        List<CompletableFuture<HttpResponse<String>>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            final int idx = i;
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return post("/books", bookJson("Book " + idx, "Author " + idx, null));
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            }));
        }

        Set<Long> ids = new HashSet<>();
        for (var future : futures) {
            HttpResponse<String> resp = future.get();
            assertEquals(201, resp.statusCode());
            ids.add(JsonParser.parseString(resp.body()).getAsJsonObject().get("id").getAsLong());
        }
        assertEquals(20, ids.size());
        assertEquals(20, getArray("/books").size());
    }

    // --- T20: Unknown path and trailing slash ---
    @Test
    void testT20_unknownPathAndTrailingSlash() throws Exception {
        assertEquals(404, get("/authors").statusCode());
        assertEquals(200, get("/books/").statusCode());
    }
}
