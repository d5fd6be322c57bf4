package com.bookapi;

import java.util.Map;

public class HttpRequest {
    private final String method;
    private final String path;
    private final Map<String, String> queryParams;
    private final Map<String, String> headers;
    private final String body;
    private RequestContext context;

    public HttpRequest(String method, String path, Map<String, String> queryParams,
                       Map<String, String> headers, String body) {
        this.method = method;
        this.path = path;
        this.queryParams = queryParams;
        this.headers = headers;
        this.body = body;
        this.context = RequestContext.background();
    }

    public String getMethod() { return method; }
    public String getPath() { return path; }

    public Map<String, String> getQueryParams() { return queryParams; }

    /** Header names are lower-cased by the parser. */
    public Map<String, String> getHeaders() { return headers; }
    public String getBody() { return body; }

    public RequestContext getContext() { return context; }
    public void setContext(RequestContext context) { this.context = context; }
}
