package com.bookapi;

import javax.sql.DataSource;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class JdbcBookGateway implements BookGateway {

    private static final String SELECT_ALL = "SELECT id, title, author, summary FROM books";
    private static final String SELECT_BY_ID = "SELECT id, title, author, summary FROM books WHERE id = ?";
    private static final String INSERT = "INSERT INTO books (title, author, summary) VALUES (?, ?, ?) RETURNING id";
    private static final String UPDATE = "UPDATE books SET title = ?, author = ?, summary = ? WHERE id = ?";
    private static final String DELETE = "DELETE FROM books WHERE id = ?";

    private final DataSource dataSource;

    public JdbcBookGateway(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Book> findAll(RequestContext context) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL)) {
            context.attach(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                return readAll(rs);
            } finally {
                context.detach(stmt);
            }
        } catch (SQLException e) {
            throw failure("Failed to query books", context, e);
        }
    }

    @Override
    public Optional<Book> findById(RequestContext context, long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID)) {
            stmt.setLong(1, id);
            context.attach(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                return readAll(rs).stream().findFirst();
            } finally {
                context.detach(stmt);
            }
        } catch (SQLException e) {
            throw failure("Failed to query book " + id, context, e);
        }
    }

    @Override
    public Book insert(RequestContext context, Book book) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT)) {
            stmt.setString(1, book.getTitle());
            stmt.setString(2, book.getAuthor());
            stmt.setBytes(3, encodeSummary(book.getSummary()));
            context.attach(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw PersistenceException.queryFailed("Insert returned no id", null);
                }
                return book.withId(rs.getLong(1));
            } finally {
                context.detach(stmt);
            }
        } catch (SQLException e) {
            throw failure("Failed to insert book", context, e);
        }
    }

    @Override
    public int update(RequestContext context, long id, Book book) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE)) {
            stmt.setString(1, book.getTitle());
            stmt.setString(2, book.getAuthor());
            stmt.setBytes(3, encodeSummary(book.getSummary()));
            stmt.setLong(4, id);
            context.attach(stmt);
            try {
                return stmt.executeUpdate();
            } finally {
                context.detach(stmt);
            }
        } catch (SQLException e) {
            throw failure("Failed to update book " + id, context, e);
        }
    }

    @Override
    public int delete(RequestContext context, long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE)) {
            stmt.setLong(1, id);
            context.attach(stmt);
            try {
                return stmt.executeUpdate();
            } finally {
                context.detach(stmt);
            }
        } catch (SQLException e) {
            throw failure("Failed to delete book " + id, context, e);
        }
    }

    /**
     * Reads every row. Cursor and connection errors propagate as
     * {@link SQLException} so the caller can tell a cancellation from a query
     * failure; malformed column values are decode failures.
     */
    private static List<Book> readAll(ResultSet rs) throws SQLException {
        List<Book> books = new ArrayList<>();
        while (rs.next()) {
            books.add(mapRow(rs));
        }
        return books;
    }

    private static Book mapRow(ResultSet rs) throws SQLException {
        Book book = new Book();
        try {
            book.setId(rs.getLong("id"));
            book.setTitle(rs.getString("title"));
            book.setAuthor(rs.getString("author"));
            book.setSummary(decodeSummary(rs.getBytes("summary")));
        } catch (CharacterCodingException e) {
            throw PersistenceException.decodeFailed("Failed to decode book row", e);
        } catch (SQLException e) {
            if (isDataException(e)) {
                throw PersistenceException.decodeFailed("Failed to decode book row", e);
            }
            throw e;
        }
        return book;
    }

    // SQLState class 22: data exception (bad value conversion)
    private static boolean isDataException(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("22");
    }

    private static PersistenceException failure(String message, RequestContext context, SQLException e) {
        if (context.isCancelled()) {
            return new PersistenceException(PersistenceException.Kind.CANCELLED, message + " (cancelled)", e);
        }
        return PersistenceException.queryFailed(message, e);
    }

    static byte[] encodeSummary(String summary) {
        return summary != null ? summary.getBytes(StandardCharsets.UTF_8) : null;
    }

    static String decodeSummary(byte[] bytes) throws CharacterCodingException {
        if (bytes == null) return null;
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
