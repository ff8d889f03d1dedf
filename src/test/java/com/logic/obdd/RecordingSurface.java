package com.logic.obdd;

import com.logic.obdd.api.CursorStyle;
import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.FileAction;
import com.logic.obdd.api.Position;
import com.logic.obdd.api.RenderSurface;

import java.util.ArrayList;
import java.util.List;

/**
 * Render surface that remembers what it was asked to draw.
 *
 * Frame lists hold the primitives of the last completed frame; {@link #calls}
 * is the full call log in order.
 */
public class RecordingSurface implements RenderSurface {

    public record DrawnNode(Position center, String label, boolean selected, boolean terminal) {
    }

    public record DrawnEdge(Position from, Position to, EdgeKind kind) {
    }

    public final List<String> calls = new ArrayList<>();
    public final List<DrawnNode> nodes = new ArrayList<>();
    public final List<DrawnEdge> edges = new ArrayList<>();
    public final List<Position[]> rootIndicators = new ArrayList<>();
    public final List<Position[]> selectionBoxes = new ArrayList<>();
    public final List<String> statuses = new ArrayList<>();
    public final List<String> modes = new ArrayList<>();
    public final List<CursorStyle> cursors = new ArrayList<>();
    public final List<FileAction> fileRequests = new ArrayList<>();
    public int framesCompleted;

    private boolean inFrame;

    @Override
    public void beginFrame() {
        if (inFrame)
            throw new IllegalStateException("beginFrame inside a frame");
        inFrame = true;
        nodes.clear();
        edges.clear();
        rootIndicators.clear();
        selectionBoxes.clear();
        calls.add("beginFrame");
    }

    @Override
    public void drawDecisionNode(Position center, String label, boolean selected) {
        requireFrame();
        nodes.add(new DrawnNode(center, label, selected, false));
        calls.add("decision " + label);
    }

    @Override
    public void drawTerminalNode(Position center, String label, boolean selected) {
        requireFrame();
        nodes.add(new DrawnNode(center, label, selected, true));
        calls.add("terminal " + label);
    }

    @Override
    public void drawEdge(Position from, Position to, EdgeKind kind) {
        requireFrame();
        edges.add(new DrawnEdge(from, to, kind));
        calls.add("edge " + kind);
    }

    @Override
    public void drawRootIndicator(Position tail, Position tip) {
        requireFrame();
        rootIndicators.add(new Position[] { tail, tip });
        calls.add("root");
    }

    @Override
    public void drawSelectionBox(Position corner, Position opposite) {
        requireFrame();
        selectionBoxes.add(new Position[] { corner, opposite });
        calls.add("box");
    }

    @Override
    public void endFrame() {
        requireFrame();
        inFrame = false;
        framesCompleted++;
        calls.add("endFrame");
    }

    @Override
    public void setCursor(CursorStyle style) {
        cursors.add(style);
        calls.add("cursor " + style);
    }

    @Override
    public void showStatus(String message) {
        statuses.add(message);
        calls.add("status " + message);
    }

    @Override
    public void showMode(String mode) {
        modes.add(mode);
        calls.add("mode " + mode);
    }

    @Override
    public void requestFile(FileAction action) {
        fileRequests.add(action);
        calls.add("file " + action);
    }

    public String lastStatus() {
        return statuses.isEmpty() ? null : statuses.get(statuses.size() - 1);
    }

    public String lastMode() {
        return modes.isEmpty() ? null : modes.get(modes.size() - 1);
    }

    public DrawnNode node(String label) {
        for (DrawnNode n : nodes) {
            if (n.label().equals(label))
                return n;
        }
        return null;
    }

    private void requireFrame() {
        if (!inFrame)
            throw new IllegalStateException("draw call outside a frame");
    }
}
