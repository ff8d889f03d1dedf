package com.logic.obdd.engine;

import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.NodeKind;
import com.logic.obdd.api.NodeView;
import com.logic.obdd.api.Position;

/**
 * Immutable copy of a node taken for a {@link GraphView}.
 */
public record NodeSnapshot(String id, NodeKind kind, String label, Position position,
        String zeroTarget, String oneTarget) implements NodeView {

    public static NodeSnapshot of(NodeView node) {
        return new NodeSnapshot(node.id(), node.kind(), node.label(), node.position(),
                node.target(EdgeKind.ZERO), node.target(EdgeKind.ONE));
    }

    @Override
    public String target(EdgeKind kind) {
        return kind == EdgeKind.ZERO ? zeroTarget : oneTarget;
    }
}
