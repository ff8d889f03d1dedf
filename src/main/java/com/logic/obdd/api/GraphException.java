package com.logic.obdd.api;

/**
 * Raised by graph and document operations when a request cannot be honoured.
 *
 * Unchecked: callers that drive the editor interactively catch it at the
 * transition boundary and report {@link #getMessage()} to the user.
 */
public class GraphException extends RuntimeException {
    private final ErrorKind kind;

    public GraphException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GraphException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static GraphException notFound(String id) {
        return new GraphException(ErrorKind.NOT_FOUND, "no node with id " + id);
    }

    public static GraphException malformed(String message) {
        return new GraphException(ErrorKind.MALFORMED_DOCUMENT, message);
    }
}
