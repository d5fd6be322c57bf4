package com.bookapi;

import java.util.List;
import java.util.Optional;

/**
 * Issues the single statement behind each book operation. Every method runs
 * exactly one statement and throws {@link PersistenceException} on failure.
 */
public interface BookGateway {
    List<Book> findAll(RequestContext context);
    Optional<Book> findById(RequestContext context, long id);

    /** Inserts the book and returns a copy carrying the database-assigned id. */
    Book insert(RequestContext context, Book book);

    /** @return affected-row count */
    int update(RequestContext context, long id, Book book);

    /** @return affected-row count */
    int delete(RequestContext context, long id);
}
