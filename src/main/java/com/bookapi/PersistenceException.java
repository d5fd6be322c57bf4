package com.bookapi;

/**
 * Failure of a gateway statement. Callers answer every kind with an opaque 500;
 * the kind only feeds logs, spans and metrics.
 */
public class PersistenceException extends RuntimeException {

    public enum Kind {
        QUERY_FAILED("query_failed"),
        DECODE_FAILED("decode_failed"),
        CANCELLED("cancelled");

        private final String outcome;

        Kind(String outcome) {
            this.outcome = outcome;
        }

        public String outcome() {
            return outcome;
        }
    }

    private final Kind kind;

    public PersistenceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static PersistenceException queryFailed(String message, Throwable cause) {
        return new PersistenceException(Kind.QUERY_FAILED, message, cause);
    }

    public static PersistenceException decodeFailed(String message, Throwable cause) {
        return new PersistenceException(Kind.DECODE_FAILED, message, cause);
    }

    public static PersistenceException cancelled(String message) {
        return new PersistenceException(Kind.CANCELLED, message, null);
    }

    public Kind getKind() {
        return kind;
    }
}
