package com.logic.obdd;

import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.EditorCommand;
import com.logic.obdd.api.ErrorKind;
import com.logic.obdd.api.FileAction;
import com.logic.obdd.api.GraphException;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.api.NodeView;
import com.logic.obdd.api.Position;
import com.logic.obdd.engine.EditorListener;
import com.logic.obdd.engine.EditorSession;
import com.logic.obdd.engine.GraphView;
import com.logic.obdd.engine.InteractionStateMachine;
import com.logic.obdd.engine.ObddGraph;
import com.logic.obdd.engine.Transition;
import com.logic.obdd.io.EditorSettings;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ObddEditorTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private RecordingSurface surface;
    private ObddEditor editor;

    @Before
    public void setUp() {
        surface = new RecordingSurface();
        editor = new ObddEditor(surface);
    }

    private void clickAt(Position at) {
        editor.handle(new InputEvent.Click(at));
    }

    private void clickNode(String label) {
        clickAt(editor.graph().findByLabel(label).position());
    }

    private void press(char key) {
        editor.handle(new InputEvent.KeyPress(key));
    }

    /** Builds p AND q through user input only. */
    private void drawAndDiagram() {
        press('n');                                              // p at the default spot
        press('n');                                              // q above p
        editor.handle(new InputEvent.DragStart(editor.graph().findByLabel("q").position()));
        editor.handle(new InputEvent.DragMove(new Position(550, 300)));
        editor.handle(new InputEvent.DragEnd(new Position(550, 300)));

        clickNode("p");
        press('1');
        clickNode("q");
        clickNode("p");
        press('0');
        clickNode("0");
        clickNode("q");
        press('1');
        clickNode("1");
        clickNode("q");
        press('0');
        clickNode("0");
        clickNode("p");
        press('r');
    }

    /** Follows the diagram from the root for one assignment. */
    static boolean evaluate(GraphView view, Map<String, Boolean> assignment) {
        NodeView node = view.node(view.rootId());
        for (int steps = 0; !node.isTerminal(); steps++) {
            if (steps > view.nodeCount())
                throw new IllegalStateException("cycle while evaluating");
            boolean value = assignment.get(node.label());
            node = view.node(node.target(EdgeKind.forValue(value)));
        }
        return node.label().equals(ObddGraph.TRUE_LABEL);
    }

    @Test
    public void testRefreshPaintsInitialDiagram() {
        editor.refresh();
        assertEquals(1, surface.framesCompleted);
        assertEquals(2, surface.nodes.size());
        assertEquals("Ready", surface.lastMode());
    }

    @Test
    public void testAndScenario() {
        drawAndDiagram();

        ObddGraph graph = editor.graph();
        NodeView p = graph.findByLabel("p");
        NodeView q = graph.findByLabel("q");
        assertEquals(4, graph.nodeCount());
        assertEquals(4, graph.edges().size());
        assertEquals(p.id(), graph.rootId());
        assertEquals(q.id(), p.target(EdgeKind.ONE));
        assertEquals(graph.terminal(false).id(), p.target(EdgeKind.ZERO));
        assertEquals(graph.terminal(true).id(), q.target(EdgeKind.ONE));
        assertEquals(graph.terminal(false).id(), q.target(EdgeKind.ZERO));

        GraphView view = graph.snapshot();
        assertTrue(evaluate(view, Map.of("p", true, "q", true)));
        assertFalse(evaluate(view, Map.of("p", true, "q", false)));
        assertFalse(evaluate(view, Map.of("p", false, "q", true)));
        assertFalse(evaluate(view, Map.of("p", false, "q", false)));

        // last frame shows everything
        assertEquals(4, surface.edges.size());
        assertEquals(1, surface.rootIndicators.size());
        assertTrue(surface.node("p").selected());
        assertEquals("node p is now the root", surface.lastStatus());
    }

    @Test
    public void testExportImportRoundTrip() throws Exception {
        drawAndDiagram();
        GraphView before = editor.graph().snapshot();
        Path file = tmp.getRoot().toPath().resolve("and.json");

        Transition export = editor.exportTo(file);
        assertFalse(export.isRejected());
        assertTrue(Files.exists(file));
        assertFalse("mermaid is off by default", Files.exists(file.resolveSibling("and.md")));

        editor.clearAll();
        assertEquals(2, editor.graph().nodeCount());

        Transition imp = editor.importFrom(file);
        assertFalse(imp.isRejected());
        assertEquals(before, editor.graph().snapshot());
        assertEquals(EditorSession.INITIAL, editor.session());
        assertEquals("imported 4 nodes from and.json", surface.lastStatus());
    }

    @Test
    public void testRejectedImportChangesNothing() throws Exception {
        drawAndDiagram();
        clickNode("q");
        String exportedBefore = editor.exportJson();
        EditorSession sessionBefore = editor.session();

        Path file = tmp.getRoot().toPath().resolve("bad.json");
        Files.writeString(file, """
                { "nodes": [ { "id": "t0", "kind": "terminal", "label": "0", "x": 1, "y": 1 } ] }
                """, StandardCharsets.UTF_8);
        int framesBefore = surface.framesCompleted;

        Transition t = editor.importFrom(file);

        assertEquals(ErrorKind.MALFORMED_DOCUMENT, t.error());
        assertEquals(exportedBefore, editor.exportJson());
        assertEquals(sessionBefore, editor.session());
        assertEquals(framesBefore, surface.framesCompleted);
        assertTrue(surface.lastStatus().startsWith("import failed: "));
    }

    @Test
    public void testImportOfMissingFile() {
        Transition t = editor.importFrom(tmp.getRoot().toPath().resolve("nope.json"));
        assertEquals(ErrorKind.MALFORMED_DOCUMENT, t.error());
        assertEquals(2, editor.graph().nodeCount());
    }

    @Test
    public void testExportFailureReported() {
        Path dir = tmp.getRoot().toPath();
        Transition t = editor.exportTo(dir);
        assertTrue(surface.lastStatus().startsWith("export failed: "));
        assertEquals(EditorSession.INITIAL, t.session());
    }

    @Test
    public void testMermaidWrittenNextToExport() throws Exception {
        EditorSettings settings = new EditorSettings();
        settings.setExportMermaid(true);
        ObddEditor withMermaid = new ObddEditor(surface, settings);
        withMermaid.handle(new InputEvent.KeyPress('n'));
        Path file = tmp.getRoot().toPath().resolve("diagram.json");

        withMermaid.exportTo(file);

        Path md = file.resolveSibling("diagram.md");
        assertTrue(Files.exists(md));
        String markdown = Files.readString(md);
        assertTrue(markdown.startsWith("```mermaid\ngraph TD;"));
        assertTrue(markdown.contains("((\"p\"))"));
    }

    @Test
    public void testMermaidFailureKeepsJsonExport() throws Exception {
        EditorSettings settings = new EditorSettings();
        settings.setExportMermaid(true);
        ObddEditor withMermaid = new ObddEditor(surface, settings);
        withMermaid.handle(new InputEvent.KeyPress('n'));
        Path file = tmp.getRoot().toPath().resolve("d.json");
        Files.createDirectory(file.resolveSibling("d.md"));

        Transition t = withMermaid.exportTo(file);

        assertNull(t.error());
        assertTrue(Files.isRegularFile(file));
        assertTrue(surface.lastStatus().startsWith("exported 3 nodes to d.json (mermaid diagram not written: "));
    }

    @Test
    public void testBoxSelectionThenGroupDrag() {
        drawAndDiagram();
        Position p = editor.graph().findByLabel("p").position();
        Position q = editor.graph().findByLabel("q").position();

        editor.handle(new InputEvent.DragStart(new Position(5, 5)));
        editor.handle(new InputEvent.DragMove(new Position(700, 400)));
        assertEquals(1, surface.selectionBoxes.size());
        assertEquals(InteractionStateMachine.MODE_BOX, surface.lastMode());
        editor.handle(new InputEvent.DragEnd(new Position(700, 400)));

        assertTrue(surface.selectionBoxes.isEmpty());
        assertTrue(surface.node("p").selected());
        assertTrue(surface.node("q").selected());
        assertEquals("selected 2 node(s)", surface.lastStatus());

        editor.handle(new InputEvent.DragStart(p));
        editor.handle(new InputEvent.DragMove(p.translate(-20, 10)));
        editor.handle(new InputEvent.DragEnd(p.translate(-20, 10)));

        assertEquals(p.translate(-20, 10), editor.graph().findByLabel("p").position());
        assertEquals(q.translate(-20, 10), editor.graph().findByLabel("q").position());
        assertEquals("moved 2 nodes", surface.lastStatus());
    }

    @Test
    public void testExportCommandAsksForFile() {
        press('e');
        assertEquals(List.of(FileAction.EXPORT), surface.fileRequests);
        editor.handle(new InputEvent.Command(EditorCommand.IMPORT));
        assertEquals(List.of(FileAction.EXPORT, FileAction.IMPORT), surface.fileRequests);
    }

    @Test
    public void testImportJsonRoundTrip() {
        drawAndDiagram();
        String json = editor.exportJson();
        GraphView before = editor.graph().snapshot();

        ObddEditor other = new ObddEditor(new RecordingSurface());
        other.importJson(json);

        assertEquals(before, other.graph().snapshot());
        assertEquals(json, other.exportJson());
    }

    @Test
    public void testImportJsonRejectsAndKeepsState() {
        press('n');
        String before = editor.exportJson();
        try {
            editor.importJson("{ \"nodes\": [] }");
            fail("Should have rejected a document without terminals");
        } catch (GraphException e) {
            assertEquals(ErrorKind.MALFORMED_DOCUMENT, e.kind());
        }
        assertEquals(before, editor.exportJson());
    }

    @Test
    public void testListenersSeeTransitionsAndRejections() {
        List<Long> sequences = new ArrayList<>();
        List<ErrorKind> rejections = new ArrayList<>();
        editor.addListener(new EditorListener() {
            @Override
            public void onTransition(long sequence, InputEvent event, Transition transition) {
                sequences.add(sequence);
            }

            @Override
            public void onRejected(long sequence, InputEvent event, ErrorKind kind, String message) {
                rejections.add(kind);
                assertEquals("no node selected: cannot set root", message);
            }
        });

        press('n');
        clickAt(new Position(5, 5));
        press('r');

        assertEquals(List.of(1L, 2L, 3L), sequences);
        assertEquals(List.of(ErrorKind.NO_SELECTION), rejections);
    }

    @Test
    public void testCustomCanvasAndBindings() {
        EditorSettings settings = new EditorSettings();
        settings.setCanvasWidth(400);
        settings.setCanvasHeight(300);
        settings.setKeyBindings(Map.of("a", "ADD_NODE"));
        ObddEditor custom = new ObddEditor(surface, settings);

        custom.handle(new InputEvent.KeyPress('a'));
        NodeView p = custom.graph().findByLabel("p");
        assertEquals(new Position(200, 100), p.position());

        custom.handle(new InputEvent.KeyPress('n'));
        assertNull("n is unbound in the custom table", custom.graph().findByLabel("q"));
    }
}
