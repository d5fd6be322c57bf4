package com.bookapi;

import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.function.Function;

public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        AppConfig config = AppConfig.fromEnv();

        DatabaseConfig dbConfig;
        try {
            dbConfig = new DatabaseConfig(config.getDatabase(), config.getPoolSize());
        } catch (RuntimeException e) {
            log.error("Failed to connect to database", e);
            System.exit(1);
            return;
        }
        dbConfig.runMigrations();
        if (config.isSeedSampleData()) {
            dbConfig.seedSampleData();
        }

        // No-op unless an OpenTelemetry SDK or agent registered itself globally
        BookApiTelemetry telemetry = new BookApiTelemetry(GlobalOpenTelemetry.get(), config.getServiceName());
        BookGateway gateway = new TracingBookGateway(new JdbcBookGateway(dbConfig.getDataSource()),
                telemetry.getTracer());
        Function<HttpRequest, HttpResponse> handler = createHandler(new BookHandlers(gateway), telemetry);

        HttpServer server = new HttpServer(config.getPort(), handler,
                config.getWorkerThreads(), config.getRequestTimeout());
        server.start();
        log.info("Book API started on port {}", server.getPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down server...");
            server.stop(config.getShutdownGrace());
            dbConfig.close();
            log.info("Server exited");
            stopped.countDown();
        }, "shutdown"));

        // accept and worker threads are daemons
        stopped.await();
    }

    public static Router createRouter(BookHandlers handlers, BookApiTelemetry telemetry) {
        Router router = new Router();
        router.addRoute("GET", "/books", telemetry.instrument(
                request -> BookHandlers.idParam(request) != null ? "get_by_id" : "get_all",
                handlers::handleGetBooks));
        router.addRoute("POST", "/books", telemetry.instrument("create", handlers::handleCreateBook));
        router.addRoute("PUT", "/books", telemetry.instrument("update", handlers::handleUpdateBook));
        router.addRoute("DELETE", "/books", telemetry.instrument("delete", handlers::handleDeleteBook));
        router.addRoute(Router.ANY_METHOD, "/healthz",
                telemetry.instrument("health_check", new HealthHandler()::handle));
        return router;
    }

    public static Function<HttpRequest, HttpResponse> createHandler(BookHandlers handlers, BookApiTelemetry telemetry) {
        return telemetry.traceRequests(createRouter(handlers, telemetry)::route);
    }
}
