package com.bookapi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Blocking HTTP/1.1 server: one accept thread, a fixed worker pool, one request
 * per connection. Each request gets a {@link RequestContext} whose deadline is
 * the request timeout; contexts still running when the shutdown grace period
 * runs out are cancelled.
 */
public class HttpServer {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final int port;
    private final Function<HttpRequest, HttpResponse> handler;
    private final int workerThreads;
    private final Duration requestTimeout;
    private final Set<RequestContext> inFlight = ConcurrentHashMap.newKeySet();
    private ServerSocket serverSocket;
    private ExecutorService threadPool;
    private volatile boolean running;

    public HttpServer(int port, Function<HttpRequest, HttpResponse> handler) {
        this(port, handler, 10, Duration.ofSeconds(30));
    }

    public HttpServer(int port, Function<HttpRequest, HttpResponse> handler,
                      int workerThreads, Duration requestTimeout) {
        this.port = port;
        this.handler = handler;
        this.workerThreads = workerThreads;
        this.requestTimeout = requestTimeout;
    }

    public void start() throws IOException {
        serverSocket = new ServerSocket(port);
        AtomicInteger workerIds = new AtomicInteger();
        threadPool = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "http-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;

        Thread acceptThread = new Thread(this::acceptLoop, "http-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Listening on port {}", getPort());
    }

    private void acceptLoop() {
        while (running) {
            Socket clientSocket;
            try {
                clientSocket = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    log.warn("Error accepting connection: {}", e.getMessage());
                }
                continue;
            }
            try {
                threadPool.submit(() -> handleConnection(clientSocket));
            } catch (RejectedExecutionException e) {
                closeQuietly(clientSocket);
            }
        }
    }

    private void handleConnection(Socket socket) {
        RequestContext context = RequestContext.withTimeout(requestTimeout);
        inFlight.add(context);
        try {
            socket.setSoTimeout(socketTimeoutMillis(requestTimeout));
            HttpResponse response = dispatch(socket, context);
            if (response != null) {
                ResponseWriter.write(socket.getOutputStream(), response);
                socket.shutdownOutput();
            }
        } catch (SocketException e) {
            log.debug("Client connection lost: {}", e.getMessage());
        } catch (IOException e) {
            log.warn("Error writing response: {}", e.getMessage());
        } finally {
            inFlight.remove(context);
            closeQuietly(socket);
        }
    }

    private HttpResponse dispatch(Socket socket, RequestContext context) {
        HttpRequest request;
        try {
            request = RequestParser.parse(socket.getInputStream());
        } catch (RequestTooLargeException e) {
            return HttpResponse.payloadTooLarge("Request body too large");
        } catch (IOException e) {
            log.debug("Error parsing request: {}", e.getMessage());
            return HttpResponse.badRequest("Bad request");
        }
        request.setContext(context);
        try {
            return handler.apply(request);
        } catch (RuntimeException e) {
            log.error("Unhandled error for {} {}", request.getMethod(), request.getPath(), e);
            return HttpResponse.internalServerError("Internal server error");
        }
    }

    /**
     * Stops accepting, waits up to {@code grace} for in-flight requests, then
     * cancels their database work and interrupts the workers.
     */
    public void stop(Duration grace) {
        running = false;
        try {
            if (serverSocket != null && !serverSocket.isClosed()) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.warn("Error closing server socket: {}", e.getMessage());
        }
        if (threadPool == null) {
            return;
        }
        threadPool.shutdown();
        try {
            if (!threadPool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} request(s) still running after {}s grace period, cancelling",
                        inFlight.size(), grace.toSeconds());
                inFlight.forEach(RequestContext::cancel);
                threadPool.shutdownNow();
                if (!threadPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Worker threads did not terminate");
                }
            }
        } catch (InterruptedException e) {
            inFlight.forEach(RequestContext::cancel);
            threadPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public void stop() {
        stop(Duration.ofSeconds(5));
    }

    public int getPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : port;
    }

    /** Read timeout for a connection; never 0, which would mean no timeout. */
    static int socketTimeoutMillis(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis <= 0) {
            return 1;
        }
        return (int) Math.min(millis, Integer.MAX_VALUE);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
