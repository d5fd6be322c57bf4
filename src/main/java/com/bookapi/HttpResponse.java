package com.bookapi;

import java.util.HashMap;
import java.util.Map;

public class HttpResponse {
    private final int statusCode;
    private final String statusText;
    private final Map<String, String> headers;
    private final String body;
    private String outcome;

    public HttpResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
        this.statusCode = statusCode;
        this.statusText = statusText;
        this.headers = headers != null ? headers : new HashMap<>();
        this.body = body;
    }

    public int getStatusCode() { return statusCode; }
    public String getStatusText() { return statusText; }
    public Map<String, String> getHeaders() { return headers; }
    public String getBody() { return body; }

    /**
     * Short reason label reported to metrics and spans, e.g. {@code book_not_found}.
     * Defaults to {@code success} or {@code http_<status>} when a handler sets none.
     */
    public String getOutcome() {
        if (outcome != null) return outcome;
        return statusCode < 400 ? "success" : "http_" + statusCode;
    }

    public HttpResponse withOutcome(String outcome) {
        this.outcome = outcome;
        return this;
    }

    public static HttpResponse ok(String body) {
        return new HttpResponse(200, "OK", new HashMap<>(), body);
    }

    public static HttpResponse ok() {
        return new HttpResponse(200, "OK", new HashMap<>(), null);
    }

    public static HttpResponse text(String body) {
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "text/plain; charset=utf-8");
        return new HttpResponse(200, "OK", headers, body);
    }

    public static HttpResponse created(String body) {
        return new HttpResponse(201, "Created", new HashMap<>(), body);
    }

    public static HttpResponse noContent() {
        return new HttpResponse(204, "No Content", new HashMap<>(), null);
    }

    public static HttpResponse badRequest(String error) {
        return new HttpResponse(400, "Bad Request", new HashMap<>(), errorBody(error));
    }

    public static HttpResponse notFound(String error) {
        return new HttpResponse(404, "Not Found", new HashMap<>(), errorBody(error));
    }

    public static HttpResponse internalServerError(String error) {
        return new HttpResponse(500, "Internal Server Error", new HashMap<>(), errorBody(error));
    }

    public static HttpResponse payloadTooLarge(String error) {
        return new HttpResponse(413, "Payload Too Large", new HashMap<>(), errorBody(error));
    }

    public static HttpResponse methodNotAllowed() {
        return new HttpResponse(405, "Method Not Allowed", new HashMap<>(), errorBody("Method not allowed"))
                .withOutcome("method_not_allowed");
    }

    private static String errorBody(String error) {
        return "{\"error\":\"" + escapeJson(error) + "\"}";
    }

    private static String escapeJson(String s) {
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
