package com.logic.obdd.ui;

import com.logic.obdd.api.CursorStyle;
import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.FileAction;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.api.Position;
import com.logic.obdd.api.RenderSurface;
import com.logic.obdd.engine.KeyBindings;
import com.logic.obdd.engine.NodeGeometry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.swing.BorderFactory;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BasicStroke;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Cursor;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Stroke;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Line2D;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Swing window implementing {@link RenderSurface}.
 *
 * Layout: command buttons on top, the diagram canvas in the centre, mode and
 * status lines at the bottom.
 *
 * Threading:
 * Surface calls arrive on the editor thread. Frame primitives are collected
 * into a display list there; {@link #endFrame()} and the feedback calls hop
 * to the event dispatch thread with {@link SwingUtilities#invokeLater}. User
 * input is handed to the event sink on the event dispatch thread, which is
 * therefore the only publisher. Clearing the diagram and deleting a node are
 * confirmed with a dialog before they are handed over.
 */
public final class EditorFrame extends JFrame implements RenderSurface {
    private static final Logger log = LogManager.getLogger(EditorFrame.class);

    private static final Color DECISION_FILL = new Color(255, 255, 224);
    private static final Color TERMINAL_FILL = new Color(173, 216, 230);
    private static final Color SELECTED = Color.RED;
    private static final Color ROOT = Color.RED;
    private static final Color ONE_EDGE = Color.BLACK;
    private static final Color ZERO_EDGE = Color.GRAY;
    private static final Color SELECTION_BOX = Color.BLUE;
    private static final Font LABEL_FONT = new Font("Arial", Font.BOLD, 14);
    private static final Font ROOT_FONT = new Font("Arial", Font.BOLD, 10);
    private static final Stroke ONE_STROKE = new BasicStroke(2f);
    private static final Stroke ZERO_STROKE = new BasicStroke(2f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
            10f, new float[] { 5f, 5f }, 0f);
    private static final Stroke BOX_STROKE = new BasicStroke(1f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
            10f, new float[] { 4f, 2f }, 0f);
    private static final double ARROW_LENGTH = 10;
    private static final double ARROW_HALF_WIDTH = 4;

    private final DiagramCanvas canvas;
    private final JLabel modeLabel = new JLabel("Ready");
    private final JLabel statusLabel = new JLabel(" ");
    private final JFileChooser chooser = new JFileChooser();

    private final ConfirmingInput input;

    // editor thread only
    private List<Consumer<Graphics2D>> building = new ArrayList<>();
    private List<String> buildingSelection = new ArrayList<>();

    /**
     * Must be called on the event dispatch thread.
     *
     * @param keys the editor's key table, used to recognise keys that need a
     *             confirmation.
     */
    public EditorFrame(int canvasWidth, int canvasHeight, KeyBindings keys) {
        super("OBDD Editor");
        this.input = new ConfirmingInput(keys, this::confirm,
                e -> log.debug("Input before the editor is attached: {}", e));
        this.canvas = new DiagramCanvas(canvasWidth, canvasHeight, this::emit);
        chooser.setFileFilter(new FileNameExtensionFilter("OBDD documents (*.json)", "json"));

        JPanel root = new JPanel(new BorderLayout(0, 0));
        root.add(new ControlPanel(this::emit), BorderLayout.NORTH);
        root.add(canvas, BorderLayout.CENTER);
        root.add(buildStatusBar(), BorderLayout.SOUTH);
        setContentPane(root);

        canvas.addKeyListener(new KeyAdapter() {
            @Override
            public void keyPressed(KeyEvent e) {
                char key = translate(e);
                if (key != KeyEvent.CHAR_UNDEFINED)
                    emit(new InputEvent.KeyPress(key));
            }
        });

        setDefaultCloseOperation(EXIT_ON_CLOSE);
        pack();
        setLocationRelativeTo(null);
    }

    /** Where user input goes; normally the event loop's publish method. */
    public void setEventSink(Consumer<InputEvent> sink) {
        input.setTarget(sink);
    }

    private JPanel buildStatusBar() {
        JPanel bar = new JPanel(new BorderLayout(12, 0));
        bar.setBorder(BorderFactory.createEmptyBorder(4, 8, 4, 8));
        modeLabel.setFont(modeLabel.getFont().deriveFont(Font.BOLD));
        bar.add(modeLabel, BorderLayout.WEST);
        bar.add(statusLabel, BorderLayout.CENTER);
        return bar;
    }

    private void emit(InputEvent event) {
        input.accept(event);
    }

    private boolean confirm(String question) {
        return JOptionPane.showConfirmDialog(this, question, "Confirm", JOptionPane.YES_NO_OPTION)
                == JOptionPane.YES_OPTION;
    }

    private static char translate(KeyEvent e) {
        if (e.getKeyCode() == KeyEvent.VK_ESCAPE)
            return InputEvent.KeyPress.ESCAPE;
        if (e.getKeyCode() == KeyEvent.VK_DELETE)
            return InputEvent.KeyPress.DELETE;
        char c = e.getKeyChar();
        if (c == KeyEvent.CHAR_UNDEFINED || Character.isISOControl(c))
            return KeyEvent.CHAR_UNDEFINED;
        return c;
    }

    // ── RenderSurface: frame ─────────────────────────────────────

    @Override
    public void beginFrame() {
        building = new ArrayList<>();
        buildingSelection = new ArrayList<>();
    }

    @Override
    public void drawDecisionNode(Position center, String label, boolean selected) {
        double r = NodeGeometry.DECISION_RADIUS;
        Ellipse2D shape = new Ellipse2D.Double(center.x() - r, center.y() - r, 2 * r, 2 * r);
        if (selected)
            buildingSelection.add(label);
        building.add(g -> drawNode(g, shape, DECISION_FILL, center, label, selected));
    }

    @Override
    public void drawTerminalNode(Position center, String label, boolean selected) {
        double half = NodeGeometry.TERMINAL_SIZE / 2;
        Rectangle2D shape = new Rectangle2D.Double(center.x() - half, center.y() - half,
                NodeGeometry.TERMINAL_SIZE, NodeGeometry.TERMINAL_SIZE);
        building.add(g -> drawNode(g, shape, TERMINAL_FILL, center, label, selected));
    }

    @Override
    public void drawEdge(Position from, Position to, EdgeKind kind) {
        boolean one = kind == EdgeKind.ONE;
        building.add(g -> drawArrow(g, from, to, one ? ONE_EDGE : ZERO_EDGE, one ? ONE_STROKE : ZERO_STROKE));
    }

    @Override
    public void drawRootIndicator(Position tail, Position tip) {
        building.add(g -> {
            drawArrow(g, tail, tip, ROOT, new BasicStroke(3f));
            g.setFont(ROOT_FONT);
            drawCentered(g, "ROOT", tail.x(), tail.y() - 10);
        });
    }

    @Override
    public void drawSelectionBox(Position corner, Position opposite) {
        Rectangle2D rect = new Rectangle2D.Double(
                Math.min(corner.x(), opposite.x()), Math.min(corner.y(), opposite.y()),
                Math.abs(corner.x() - opposite.x()), Math.abs(corner.y() - opposite.y()));
        building.add(g -> {
            g.setColor(SELECTION_BOX);
            g.setStroke(BOX_STROKE);
            g.draw(rect);
        });
    }

    @Override
    public void endFrame() {
        List<Consumer<Graphics2D>> frame = List.copyOf(building);
        List<String> selection = List.copyOf(buildingSelection);
        building = new ArrayList<>();
        buildingSelection = new ArrayList<>();
        SwingUtilities.invokeLater(() -> {
            canvas.display(frame);
            input.frameSelection(selection);
        });
    }

    // ── RenderSurface: feedback ──────────────────────────────────

    @Override
    public void setCursor(CursorStyle style) {
        int type = style == CursorStyle.CROSSHAIR ? Cursor.CROSSHAIR_CURSOR : Cursor.DEFAULT_CURSOR;
        SwingUtilities.invokeLater(() -> canvas.setCursor(Cursor.getPredefinedCursor(type)));
    }

    @Override
    public void showStatus(String message) {
        SwingUtilities.invokeLater(() -> statusLabel.setText(message));
    }

    @Override
    public void showMode(String mode) {
        SwingUtilities.invokeLater(() -> modeLabel.setText(mode));
    }

    @Override
    public void requestFile(FileAction action) {
        SwingUtilities.invokeLater(() -> {
            int answer = action == FileAction.EXPORT ? chooser.showSaveDialog(this) : chooser.showOpenDialog(this);
            if (answer != JFileChooser.APPROVE_OPTION) {
                statusLabel.setText(action == FileAction.EXPORT ? "export cancelled" : "import cancelled");
                return;
            }
            Path path = chooser.getSelectedFile().toPath();
            if (action == FileAction.EXPORT) {
                if (!path.getFileName().toString().contains("."))
                    path = path.resolveSibling(path.getFileName() + ".json");
                emit(new InputEvent.ExportTo(path));
            } else {
                emit(new InputEvent.ImportFrom(path));
            }
        });
    }

    // ── Painting ─────────────────────────────────────────────────

    private static void drawNode(Graphics2D g, java.awt.Shape shape, Color fill, Position center, String label,
            boolean selected) {
        g.setColor(fill);
        g.fill(shape);
        g.setColor(selected ? SELECTED : Color.BLACK);
        g.setStroke(new BasicStroke(selected ? 3f : 2f));
        g.draw(shape);
        g.setColor(Color.BLACK);
        g.setFont(LABEL_FONT);
        drawCentered(g, label, center.x(), center.y());
    }

    private static void drawArrow(Graphics2D g, Position from, Position to, Color color, Stroke stroke) {
        g.setColor(color);
        g.setStroke(stroke);
        g.draw(new Line2D.Double(from.x(), from.y(), to.x(), to.y()));

        double length = from.distanceTo(to);
        if (length == 0)
            return;
        double ux = (to.x() - from.x()) / length;
        double uy = (to.y() - from.y()) / length;
        double baseX = to.x() - ux * ARROW_LENGTH;
        double baseY = to.y() - uy * ARROW_LENGTH;
        Path2D head = new Path2D.Double();
        head.moveTo(to.x(), to.y());
        head.lineTo(baseX - uy * ARROW_HALF_WIDTH, baseY + ux * ARROW_HALF_WIDTH);
        head.lineTo(baseX + uy * ARROW_HALF_WIDTH, baseY - ux * ARROW_HALF_WIDTH);
        head.closePath();
        g.fill(head);
    }

    private static void drawCentered(Graphics2D g, String text, double x, double y) {
        FontMetrics fm = g.getFontMetrics();
        float tx = (float) (x - fm.stringWidth(text) / 2.0);
        float ty = (float) (y + (fm.getAscent() - fm.getDescent()) / 2.0);
        g.drawString(text, tx, ty);
    }
}
