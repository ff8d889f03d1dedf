package com.logic.obdd.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * POJO representation of an exported diagram.
 *
 * <pre>
 * {
 *   "nodes": [ { "id": "n2", "kind": "decision", "label": "p", "x": 400, "y": 200 }, ... ],
 *   "edges": [ { "source": "n2", "kind": "zero", "target": "n0" }, ... ],
 *   "root": "n2"
 * }
 * </pre>
 *
 * {@code root} is written as {@code null} when no root is set. Coordinates are
 * boxed so that a missing {@code x} or {@code y} can be told apart from 0.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "nodes", "edges", "root" })
public final class ObddDocument {
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;
    private String root;

    /** One node of the diagram. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "id", "kind", "label", "x", "y" })
    public static final class NodeDef {
        private String id, kind, label;
        private Double x, y;
    }

    /** One edge: {@code source --kind--> target}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "source", "kind", "target" })
    public static final class EdgeDef {
        private String source, kind, target;
    }
}
