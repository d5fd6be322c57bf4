package com.bookapi;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed gateway with the same contract as the JDBC one: ids come from a
 * sequence starting at 1, and title/author are NOT NULL.
 */
public class InMemoryBookGateway implements BookGateway {

    private final ConcurrentSkipListMap<Long, Book> store = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<Book> findAll(RequestContext context) {
        checkCancelled(context);
        List<Book> books = new ArrayList<>();
        store.values().forEach(b -> books.add(copy(b)));
        return books;
    }

    @Override
    public Optional<Book> findById(RequestContext context, long id) {
        checkCancelled(context);
        return Optional.ofNullable(store.get(id)).map(InMemoryBookGateway::copy);
    }

    @Override
    public Book insert(RequestContext context, Book book) {
        checkCancelled(context);
        checkNotNull(book);
        Book created = book.withId(sequence.incrementAndGet());
        store.put(created.getId(), copy(created));
        return created;
    }

    @Override
    public int update(RequestContext context, long id, Book book) {
        checkCancelled(context);
        checkNotNull(book);
        Book replaced = store.computeIfPresent(id, (key, existing) -> book.withId(key));
        return replaced != null ? 1 : 0;
    }

    @Override
    public int delete(RequestContext context, long id) {
        checkCancelled(context);
        return store.remove(id) != null ? 1 : 0;
    }

    public void clear() {
        store.clear();
    }

    public int size() {
        return store.size();
    }

    private static void checkCancelled(RequestContext context) {
        if (context.isCancelled()) {
            throw PersistenceException.cancelled("Request cancelled before statement execution");
        }
    }

    private static void checkNotNull(Book book) {
        if (book.getTitle() == null || book.getAuthor() == null) {
            throw PersistenceException.queryFailed("null value violates not-null constraint on books",
                    null);
        }
    }

    private static Book copy(Book book) {
        return new Book(book.getId(), book.getTitle(), book.getAuthor(), book.getSummary());
    }
}
