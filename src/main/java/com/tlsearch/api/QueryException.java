package com.tlsearch.api;

/**
 * A failed search request. The {@link Kind} tells the transport which class of error to report.
 */
public class QueryException extends RuntimeException {
    public enum Kind {
        BAD_REQUEST,
        UNAVAILABLE,
        INTERNAL
    }

    private final Kind kind;

    public QueryException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static QueryException badRequest(String message) {
        return new QueryException(Kind.BAD_REQUEST, message, null);
    }

    public static QueryException unavailable(String message) {
        return new QueryException(Kind.UNAVAILABLE, message, null);
    }

    public static QueryException internal(String message, Throwable cause) {
        return new QueryException(Kind.INTERNAL, message, cause);
    }

    public Kind kind() {
        return kind;
    }
}
