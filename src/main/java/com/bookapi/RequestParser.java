package com.bookapi;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads one HTTP/1.x request off a socket stream. Bodies are read either by
 * Content-Length or chunked transfer coding; both are capped at 10 MB.
 */
public class RequestParser {

    static final int MAX_BODY_SIZE = 10 * 1024 * 1024; // 10 MB
    static final int MAX_HEADER_LINE_SIZE = 8 * 1024;  // 8 KB per header line

    public static HttpRequest parse(InputStream input) throws IOException {
        String requestLine = readLine(input);
        if (requestLine == null || requestLine.isEmpty()) {
            throw new IOException("Empty request");
        }

        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/1.")) {
            throw new IOException("Malformed request line: " + requestLine);
        }

        String method = parts[0].toUpperCase(Locale.ROOT);
        String target = parts[1];

        String path;
        Map<String, String> queryParams = new HashMap<>();
        int qIndex = target.indexOf('?');
        if (qIndex >= 0) {
            path = target.substring(0, qIndex);
            parseQueryString(target.substring(qIndex + 1), queryParams);
        } else {
            path = target;
        }

        Map<String, String> headers = new HashMap<>();
        String headerLine;
        while ((headerLine = readLine(input)) != null && !headerLine.isEmpty()) {
            int colonIndex = headerLine.indexOf(':');
            if (colonIndex > 0) {
                String key = headerLine.substring(0, colonIndex).trim().toLowerCase(Locale.ROOT);
                String value = headerLine.substring(colonIndex + 1).trim();
                headers.putIfAbsent(key, value);
            }
        }

        String body = null;
        String transferEncoding = headers.get("transfer-encoding");
        if (transferEncoding != null && transferEncoding.toLowerCase(Locale.ROOT).contains("chunked")) {
            body = new String(readChunked(input), StandardCharsets.UTF_8);
        } else {
            String contentLengthStr = headers.get("content-length");
            if (contentLengthStr != null) {
                body = readFixed(input, parseContentLength(contentLengthStr));
            }
        }

        return new HttpRequest(method, path, queryParams, headers, body);
    }

    private static int parseContentLength(String value) throws IOException {
        long contentLength;
        try {
            contentLength = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IOException("Invalid Content-Length header: " + value.trim());
        }
        if (contentLength < 0) {
            throw new IOException("Invalid Content-Length: " + contentLength);
        }
        if (contentLength > MAX_BODY_SIZE) {
            throw new RequestTooLargeException("Request body too large (" + contentLength + " bytes)");
        }
        return (int) contentLength;
    }

    private static String readFixed(InputStream input, int contentLength) throws IOException {
        if (contentLength == 0) {
            return "";
        }
        byte[] bodyBytes = input.readNBytes(contentLength);
        if (bodyBytes.length < contentLength) {
            throw new IOException("Unexpected end of body: expected " + contentLength
                    + " bytes, got " + bodyBytes.length);
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private static byte[] readChunked(InputStream input) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = readLine(input);
            if (sizeLine == null) {
                throw new IOException("Unexpected end of chunked body");
            }
            int semicolon = sizeLine.indexOf(';');
            String sizeHex = (semicolon >= 0 ? sizeLine.substring(0, semicolon) : sizeLine).trim();
            int size;
            try {
                size = Integer.parseInt(sizeHex, 16);
            } catch (NumberFormatException e) {
                throw new IOException("Invalid chunk size: " + sizeHex);
            }
            if (size < 0) {
                throw new IOException("Invalid chunk size: " + sizeHex);
            }
            if (size == 0) {
                // skip trailers
                String trailer;
                do {
                    trailer = readLine(input);
                } while (trailer != null && !trailer.isEmpty());
                return body.toByteArray();
            }
            if (body.size() + (long) size > MAX_BODY_SIZE) {
                throw new RequestTooLargeException("Request body too large");
            }
            byte[] chunk = input.readNBytes(size);
            if (chunk.length < size) {
                throw new IOException("Unexpected end of chunk");
            }
            body.write(chunk);
            readLine(input);
        }
    }

    private static String readLine(InputStream input) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int c;
        while ((c = input.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                line.write(c);
                if (line.size() > MAX_HEADER_LINE_SIZE) {
                    throw new IOException("Header line too long");
                }
            }
        }
        if (line.size() == 0 && c == -1) {
            return null;
        }
        return line.toString(StandardCharsets.UTF_8);
    }

    /** Repeated keys keep their first value; a key without '=' maps to "". */
    private static void parseQueryString(String queryString, Map<String, String> params) throws IOException {
        if (queryString.isEmpty()) return;
        for (String pair : queryString.split("&")) {
            if (pair.isEmpty()) continue;
            int eqIndex = pair.indexOf('=');
            String rawKey = eqIndex >= 0 ? pair.substring(0, eqIndex) : pair;
            String rawValue = eqIndex >= 0 ? pair.substring(eqIndex + 1) : "";
            try {
                String key = URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
                String value = URLDecoder.decode(rawValue, StandardCharsets.UTF_8);
                params.putIfAbsent(key, value);
            } catch (IllegalArgumentException e) {
                throw new IOException("Malformed percent-encoding in query string", e);
            }
        }
    }
}
