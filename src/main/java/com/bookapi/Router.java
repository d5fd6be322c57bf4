package com.bookapi;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Dispatches on exact path and method. A path that is registered but not for
 * the request's method answers 405; an unknown path answers 404.
 */
public class Router {

    /** Registers a route for every method. */
    public static final String ANY_METHOD = "*";

    private record Route(String method, String path, Function<HttpRequest, HttpResponse> handler) {}

    private final List<Route> routes = new ArrayList<>();

    public Router addRoute(String method, String path, Function<HttpRequest, HttpResponse> handler) {
        routes.add(new Route(method.toUpperCase(Locale.ROOT), normalize(path), handler));
        return this;
    }

    public HttpResponse route(HttpRequest request) {
        String path = normalize(request.getPath());

        Route wildcard = null;
        boolean pathMatchedButMethodDifferent = false;

        for (Route route : routes) {
            if (!route.path.equals(path)) {
                continue;
            }
            if (route.method.equals(request.getMethod())) {
                return route.handler.apply(request);
            }
            if (ANY_METHOD.equals(route.method)) {
                wildcard = route;
            } else {
                pathMatchedButMethodDifferent = true;
            }
        }

        if (wildcard != null) {
            return wildcard.handler.apply(request);
        }
        if (pathMatchedButMethodDifferent) {
            return HttpResponse.methodNotAllowed();
        }
        return HttpResponse.notFound("Not found").withOutcome("route_not_found");
    }

    private static String normalize(String path) {
        if (path.isEmpty()) {
            return "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }
}
