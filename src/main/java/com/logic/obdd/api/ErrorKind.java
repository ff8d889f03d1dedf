package com.logic.obdd.api;

/**
 * Recoverable failure categories of the editor.
 *
 * None of them ends the session. The interaction layer turns every one of
 * them into a status message.
 */
public enum ErrorKind {
    /** An id that does not (or no longer) exists in the graph. */
    NOT_FOUND,
    /** An operation that needs a decision node was given a terminal. */
    INVALID_SOURCE,
    /** A command that needs a selected node was issued with none. */
    NO_SELECTION,
    /** An import document that cannot be parsed or violates the structure rules. */
    MALFORMED_DOCUMENT
}
