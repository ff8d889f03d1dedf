package com.logic.obdd.ui;

import com.logic.obdd.api.InputEvent;
import com.logic.obdd.api.Position;

import javax.swing.JPanel;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.util.List;
import java.util.function.Consumer;

/**
 * The drawing area.
 *
 * Paints a display list: the primitives of the last completed frame, replayed
 * on every repaint. Frames are built on the editor thread and handed over with
 * {@link #display(List)} on the event dispatch thread.
 *
 * Mouse input is forwarded unchanged as press / drag / release events in
 * canvas coordinates, with shift marking an additive press; the canvas does
 * no hit testing of its own.
 */
final class DiagramCanvas extends JPanel {
    private static final Color BACKGROUND = Color.WHITE;

    private List<Consumer<Graphics2D>> displayList = List.of();

    DiagramCanvas(int width, int height, Consumer<InputEvent> input) {
        setBackground(BACKGROUND);
        setPreferredSize(new Dimension(width, height));
        setFocusable(true);

        MouseAdapter mouse = new MouseAdapter() {
            @Override
            public void mousePressed(MouseEvent e) {
                requestFocusInWindow();
                input.accept(new InputEvent.DragStart(at(e), e.isShiftDown()));
            }

            @Override
            public void mouseDragged(MouseEvent e) {
                input.accept(new InputEvent.DragMove(at(e)));
            }

            @Override
            public void mouseReleased(MouseEvent e) {
                input.accept(new InputEvent.DragEnd(at(e)));
            }
        };
        addMouseListener(mouse);
        addMouseMotionListener(mouse);
    }

    /** Replaces the display list and repaints. Event dispatch thread only. */
    void display(List<Consumer<Graphics2D>> frame) {
        this.displayList = frame;
        repaint();
    }

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);
        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g2.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
            for (Consumer<Graphics2D> op : displayList)
                op.accept(g2);
        } finally {
            g2.dispose();
        }
    }

    private static Position at(MouseEvent e) {
        return new Position(e.getX(), e.getY());
    }
}
