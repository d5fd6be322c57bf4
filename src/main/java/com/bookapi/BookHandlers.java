package com.bookapi;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

/**
 * HTTP handlers for {@code /books}. Each one validates the query string and
 * body, issues a single gateway call and maps the result to a status code.
 */
public class BookHandlers {

    private static final Logger log = LoggerFactory.getLogger(BookHandlers.class);

    private final BookGateway gateway;
    private final Gson gson;

    public BookHandlers(BookGateway gateway) {
        this.gateway = gateway;
        this.gson = new GsonBuilder()
                .serializeNulls()
                .disableHtmlEscaping()
                .create();
    }

    public HttpResponse handleGetBooks(HttpRequest request) {
        String idParam = idParam(request);
        try {
            List<Book> books;
            if (idParam == null) {
                books = gateway.findAll(request.getContext());
            } else {
                Long id = parseId(idParam);
                if (id == null) {
                    return HttpResponse.badRequest("Invalid book ID").withOutcome("invalid_book_id");
                }
                // a miss is an empty array, not a 404
                books = gateway.findById(request.getContext(), id).map(List::of).orElseGet(List::of);
            }
            return HttpResponse.ok(gson.toJson(books));
        } catch (PersistenceException e) {
            log.error("Failed to query books [{}]", e.getKind(), e);
            return HttpResponse.internalServerError("Failed to query books").withOutcome(e.getKind().outcome());
        }
    }

    public HttpResponse handleCreateBook(HttpRequest request) {
        Book book;
        try {
            book = decodeBook(request.getBody());
        } catch (JsonParseException e) {
            log.debug("Rejected create body: {}", e.getMessage());
            return HttpResponse.badRequest("Invalid request body").withOutcome("invalid_request_body");
        }

        try {
            Book created = gateway.insert(request.getContext(), book);
            return HttpResponse.created(gson.toJson(created));
        } catch (PersistenceException e) {
            log.error("Failed to create book [{}]", e.getKind(), e);
            return HttpResponse.internalServerError("Failed to create book").withOutcome("create_failed");
        }
    }

    public HttpResponse handleUpdateBook(HttpRequest request) {
        String idParam = idParam(request);
        if (idParam == null) {
            return HttpResponse.badRequest("Missing book ID").withOutcome("missing_book_id");
        }
        Long id = parseId(idParam);
        if (id == null) {
            return HttpResponse.badRequest("Invalid book ID").withOutcome("invalid_book_id");
        }

        Book book;
        try {
            book = decodeBook(request.getBody());
        } catch (JsonParseException e) {
            log.debug("Rejected update body for book {}: {}", id, e.getMessage());
            return HttpResponse.badRequest("Invalid request body").withOutcome("invalid_request_body");
        }

        try {
            int rows = gateway.update(request.getContext(), id, book);
            if (rows == 0) {
                return HttpResponse.notFound("Book not found").withOutcome("book_not_found");
            }
            return HttpResponse.ok();
        } catch (PersistenceException e) {
            log.error("Failed to update book {} [{}]", id, e.getKind(), e);
            return HttpResponse.internalServerError("Failed to update book").withOutcome("update_failed");
        }
    }

    public HttpResponse handleDeleteBook(HttpRequest request) {
        String idParam = idParam(request);
        if (idParam == null) {
            return HttpResponse.badRequest("Missing book ID").withOutcome("missing_book_id");
        }
        Long id = parseId(idParam);
        if (id == null) {
            return HttpResponse.badRequest("Invalid book ID").withOutcome("invalid_book_id");
        }

        try {
            int rows = gateway.delete(request.getContext(), id);
            if (rows == 0) {
                return HttpResponse.notFound("Book not found").withOutcome("book_not_found");
            }
            return HttpResponse.noContent();
        } catch (PersistenceException e) {
            log.error("Failed to delete book {} [{}]", id, e.getKind(), e);
            return HttpResponse.internalServerError("Failed to delete book").withOutcome("delete_failed");
        }
    }

    /** The {@code id} query parameter, or null when absent or empty. */
    static String idParam(HttpRequest request) {
        String id = request.getQueryParams().get("id");
        return id == null || id.isEmpty() ? null : id;
    }

    private static Long parseId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Decodes {title, author, summary} from strict JSON. Unknown members,
     * including a client supplied id, are ignored. {@code title} and
     * {@code author} are required; an absent or null summary decodes to null.
     *
     * @throws JsonParseException if the body is missing, not a single JSON
     *         object, lacks title or author, or carries a non-string value for
     *         one of the three fields
     */
    private Book decodeBook(String body) {
        if (body == null || body.isBlank()) {
            throw new JsonParseException("empty body");
        }
        JsonElement parsed = parseStrict(body);
        if (!parsed.isJsonObject()) {
            throw new JsonParseException("body is not a JSON object");
        }
        JsonObject json = parsed.getAsJsonObject();

        Book book = new Book();
        book.setTitle(requireStringField(json, "title"));
        book.setAuthor(requireStringField(json, "author"));
        book.setSummary(getStringField(json, "summary"));
        return book;
    }

    private JsonElement parseStrict(String body) {
        try (JsonReader reader = new JsonReader(new StringReader(body))) {
            reader.setLenient(false);
            JsonElement element = gson.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonParseException("trailing data after JSON value");
            }
            return element;
        } catch (IOException | IllegalStateException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    private static String requireStringField(JsonObject json, String field) {
        String value = getStringField(json, field);
        if (value == null) {
            throw new JsonParseException("'" + field + "' is required");
        }
        return value;
    }

    private static String getStringField(JsonObject json, String field) {
        if (!json.has(field) || json.get(field).isJsonNull()) {
            return null;
        }
        JsonElement value = json.get(field);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new JsonParseException("'" + field + "' must be a string");
        }
        return value.getAsString();
    }
}
