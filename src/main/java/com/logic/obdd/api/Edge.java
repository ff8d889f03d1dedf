package com.logic.obdd.api;

/**
 * A directed edge {@code source --kind--> target}.
 *
 * Edges are not stored on their own. They are rebuilt from each node's
 * outgoing map whenever a caller asks for them.
 */
public record Edge(String source, EdgeKind kind, String target) {
}
