package com.bookapi;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class ResponseWriter {

    public static void write(OutputStream output, HttpResponse response) throws IOException {
        byte[] bodyBytes = response.getBody() != null
                ? response.getBody().getBytes(StandardCharsets.UTF_8)
                : null;

        Map<String, String> headers = new LinkedHashMap<>(response.getHeaders());
        if (bodyBytes != null && !headers.containsKey("Content-Type")) {
            headers.put("Content-Type", "application/json");
        }
        // 204 must not carry a Content-Length
        if (response.getStatusCode() != 204) {
            headers.put("Content-Length", String.valueOf(bodyBytes != null ? bodyBytes.length : 0));
        }
        headers.put("Connection", "close");

        StringBuilder sb = new StringBuilder();
        sb.append("HTTP/1.1 ").append(response.getStatusCode())
          .append(' ').append(response.getStatusText()).append("\r\n");
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue()).append("\r\n");
        }
        sb.append("\r\n");

        output.write(sb.toString().getBytes(StandardCharsets.UTF_8));
        if (bodyBytes != null && response.getStatusCode() != 204) {
            output.write(bodyBytes);
        }
        output.flush();
    }
}
