package com.bookapi;

/** Liveness probe. Never touches the database. */
public class HealthHandler {

    public HttpResponse handle(HttpRequest request) {
        return HttpResponse.text("OK");
    }
}
