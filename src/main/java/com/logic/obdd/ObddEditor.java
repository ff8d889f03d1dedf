package com.logic.obdd;

import com.logic.obdd.api.CursorStyle;
import com.logic.obdd.api.EditorCommand;
import com.logic.obdd.api.GraphException;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.api.RenderSurface;
import com.logic.obdd.engine.CanvasLayout;
import com.logic.obdd.engine.DiagramPainter;
import com.logic.obdd.engine.EditorListener;
import com.logic.obdd.engine.EditorSession;
import com.logic.obdd.engine.InteractionStateMachine;
import com.logic.obdd.engine.KeyBindings;
import com.logic.obdd.engine.ObddGraph;
import com.logic.obdd.engine.RenderCommand;
import com.logic.obdd.engine.Transition;
import com.logic.obdd.io.DocumentCodec;
import com.logic.obdd.io.EditorSettings;
import com.logic.obdd.io.ObddDocument;
import com.logic.obdd.util.CompositeEditorListener;
import com.logic.obdd.util.DiagramExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The editor: a graph, the interaction session and the surface it renders to.
 * <p>
 * This class handles:
 * <ul>
 * <li>Running each {@link InputEvent} through the
 * {@link InteractionStateMachine} and keeping the resulting session</li>
 * <li>Forwarding the render commands to the {@link RenderSurface}, painting
 * diagrams with {@link DiagramPainter}</li>
 * <li>File export and import, which the state machine only requests</li>
 * <li>Notifying registered {@link EditorListener}s</li>
 * </ul>
 * <p>
 * Not thread-safe. In the desktop application every call comes from the
 * single consumer thread of the {@link com.logic.obdd.wiring.EditorEventLoop}.
 */
public class ObddEditor {
    private static final Logger log = LogManager.getLogger(ObddEditor.class);

    private final EditorSettings settings;
    private final ObddGraph graph;
    private final InteractionStateMachine machine;
    private final RenderSurface surface;
    private final CompositeEditorListener listeners = new CompositeEditorListener();
    private final DocumentCodec codec = new DocumentCodec();

    private EditorSession session = EditorSession.INITIAL;
    private long sequence;

    public ObddEditor(RenderSurface surface) {
        this(surface, new EditorSettings());
    }

    /**
     * @throws IllegalArgumentException if the settings carry an invalid canvas
     *                                  size or key binding.
     */
    public ObddEditor(RenderSurface surface, EditorSettings settings) {
        this.surface = surface;
        this.settings = settings;
        this.graph = new ObddGraph(new CanvasLayout(
                settings.getCanvasWidth(), settings.getCanvasHeight(), settings.getNewNodeOffset()));
        this.machine = new InteractionStateMachine(graph, KeyBindings.fromNames(settings.getKeyBindings()));
    }

    /**
     * Registers a listener. Adds to the existing ones rather than replacing them.
     */
    public ObddEditor addListener(EditorListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Processes one event to completion.
     *
     * @return the transition that was applied.
     */
    public Transition handle(InputEvent event) {
        Transition transition;
        if (event instanceof InputEvent.ExportTo export)
            transition = doExport(export.path());
        else if (event instanceof InputEvent.ImportFrom imp)
            transition = doImport(imp.path());
        else
            transition = machine.apply(session, event);

        session = transition.session();
        dispatch(transition.commands());

        long seq = ++sequence;
        listeners.onTransition(seq, event, transition);
        if (transition.isRejected())
            listeners.onRejected(seq, event, transition.error(), transition.status());
        return transition;
    }

    /** Paints the current state without changing it. Used at start-up. */
    public void refresh() {
        dispatch(machine.refresh(session).commands());
    }

    public Transition clearAll() {
        return handle(new InputEvent.Command(EditorCommand.CLEAR_ALL));
    }

    public Transition exportTo(Path path) {
        return handle(new InputEvent.ExportTo(path));
    }

    public Transition importFrom(Path path) {
        return handle(new InputEvent.ImportFrom(path));
    }

    /** The current diagram as document JSON. */
    public String exportJson() {
        return codec.write(graph.toDocument());
    }

    /**
     * Replaces the diagram with the given document JSON and repaints.
     * Unlike {@link #importFrom(Path)} a rejected document is thrown to the
     * caller; the graph and the session are unchanged in that case.
     *
     * @throws GraphException MALFORMED_DOCUMENT if the JSON or its structure is
     *                        invalid.
     */
    public void importJson(String json) {
        graph.fromDocument(codec.read(json));
        session = EditorSession.INITIAL;
        refresh();
    }

    public ObddGraph graph() {
        return graph;
    }

    public EditorSession session() {
        return session;
    }

    public EditorSettings settings() {
        return settings;
    }

    // ── Files ────────────────────────────────────────────────────

    private Transition doExport(Path path) {
        try {
            codec.writeFile(path, graph.toDocument());
        } catch (IOException e) {
            log.warn("Export to {} failed: {}", path, e.getMessage());
            return statusOnly("export failed: " + e.getMessage());
        }
        log.info("Exported {} nodes to {}", graph.nodeCount(), path);
        String status = "exported " + graph.nodeCount() + " nodes to " + path.getFileName();

        // the JSON is already on disk; a failed markdown write only amends the status
        if (settings.isExportMermaid()) {
            try {
                writeMermaid(path);
            } catch (IOException e) {
                log.warn("Mermaid diagram next to {} not written: {}", path, e.getMessage());
                status += " (mermaid diagram not written: " + e.getMessage() + ")";
            }
        }
        return statusOnly(status);
    }

    private void writeMermaid(Path jsonPath) throws IOException {
        String fileName = jsonPath.getFileName().toString();
        String baseName = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        Path mdPath = jsonPath.resolveSibling(baseName + ".md");
        String markdown = "```mermaid\n" + DiagramExplain.toMermaid(graph.snapshot()) + "```\n";
        Files.writeString(mdPath, markdown, StandardCharsets.UTF_8);
        log.info("Diagram visualization saved to {}", mdPath);
    }

    private Transition doImport(Path path) {
        try {
            ObddDocument doc = codec.readFile(path);
            graph.fromDocument(doc);
        } catch (GraphException e) {
            log.warn("Import from {} rejected: {}", path, e.getMessage());
            return new Transition(session,
                    List.of(new RenderCommand.ShowStatus("import failed: " + e.getMessage())), e.kind());
        }
        log.info("Imported {} nodes from {}", graph.nodeCount(), path);
        EditorSession fresh = EditorSession.INITIAL;
        return new Transition(fresh, List.of(
                new RenderCommand.Redraw(graph.snapshot(), null),
                new RenderCommand.SetCursor(CursorStyle.NORMAL),
                new RenderCommand.ShowMode(InteractionStateMachine.MODE_READY),
                new RenderCommand.ShowStatus("imported " + graph.nodeCount() + " nodes from " + path.getFileName())),
                null);
    }

    private Transition statusOnly(String message) {
        return new Transition(session, List.of(new RenderCommand.ShowStatus(message)), null);
    }

    // ── Rendering ────────────────────────────────────────────────

    private void dispatch(List<RenderCommand> commands) {
        for (RenderCommand command : commands) {
            if (command instanceof RenderCommand.Redraw redraw)
                DiagramPainter.paint(redraw, surface);
            else if (command instanceof RenderCommand.SetCursor cursor)
                surface.setCursor(cursor.style());
            else if (command instanceof RenderCommand.ShowStatus status)
                surface.showStatus(status.message());
            else if (command instanceof RenderCommand.ShowMode mode)
                surface.showMode(mode.mode());
            else if (command instanceof RenderCommand.RequestFile request)
                surface.requestFile(request.action());
        }
    }
}
