package com.bookapi;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Opens a client span around every gateway call. Spans are children of
 * whatever span is current on the calling thread.
 */
public class TracingBookGateway implements BookGateway {

    private static final Logger log = LoggerFactory.getLogger(TracingBookGateway.class);

    private final BookGateway delegate;
    private final Tracer tracer;

    public TracingBookGateway(BookGateway delegate, Tracer tracer) {
        this.delegate = delegate;
        this.tracer = tracer;
    }

    @Override
    public List<Book> findAll(RequestContext context) {
        return traced("db.query.get_all_books", "SELECT",
                span -> {},
                () -> delegate.findAll(context),
                (span, books) -> span.setAttribute("books.count", books.size()));
    }

    @Override
    public Optional<Book> findById(RequestContext context, long id) {
        return traced("db.query.get_book_by_id", "SELECT",
                span -> span.setAttribute("db.query.id", id),
                () -> delegate.findById(context, id),
                (span, book) -> span.setAttribute("books.count", book.isPresent() ? 1 : 0));
    }

    @Override
    public Book insert(RequestContext context, Book book) {
        return traced("db.insert.book", "INSERT",
                span -> span.setAttribute("book.summary.length",
                        book.getSummary() != null ? book.getSummary().length() : 0),
                () -> delegate.insert(context, book),
                (span, created) -> span.setAttribute("book.id", created.getId()));
    }

    @Override
    public int update(RequestContext context, long id, Book book) {
        return traced("db.update.book", "UPDATE",
                span -> span.setAttribute("db.query.id", id),
                () -> delegate.update(context, id, book),
                (span, rows) -> span.setAttribute("db.rows_affected", rows));
    }

    @Override
    public int delete(RequestContext context, long id) {
        return traced("db.delete.book", "DELETE",
                span -> span.setAttribute("db.query.id", id),
                () -> delegate.delete(context, id),
                (span, rows) -> span.setAttribute("db.rows_affected", rows));
    }

    private <T> T traced(String name, String operation, Consumer<Span> before,
                         Supplier<T> call, BiConsumer<Span, T> after) {
        Span span = start(name, operation, before);
        T result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            fail(span, e);
            throw e;
        }
        finish(span, result, after);
        return result;
    }

    private Span start(String name, String operation, Consumer<Span> before) {
        try {
            Span span = tracer.spanBuilder(name)
                    .setSpanKind(SpanKind.CLIENT)
                    .setAttribute("db.system", "postgresql")
                    .setAttribute("db.operation", operation)
                    .setAttribute("db.table", "books")
                    .startSpan();
            before.accept(span);
            return span;
        } catch (RuntimeException e) {
            log.debug("Failed to start span {}: {}", name, e.getMessage());
            return Span.getInvalid();
        }
    }

    private static <T> void finish(Span span, T result, BiConsumer<Span, T> after) {
        try {
            after.accept(span, result);
            span.end();
        } catch (RuntimeException e) {
            log.debug("Failed to end span: {}", e.getMessage());
        }
    }

    private static void fail(Span span, RuntimeException e) {
        try {
            span.setAttribute("error", e instanceof PersistenceException
                    ? ((PersistenceException) e).getKind().outcome()
                    : "unexpected_error");
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.end();
        } catch (RuntimeException ex) {
            log.debug("Failed to end span: {}", ex.getMessage());
        }
    }
}
