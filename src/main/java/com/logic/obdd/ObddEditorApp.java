package com.logic.obdd;

import com.logic.obdd.engine.KeyBindings;
import com.logic.obdd.io.EditorSettings;
import com.logic.obdd.io.SettingsLoader;
import com.logic.obdd.ui.EditorFrame;
import com.logic.obdd.util.LoggingEditorListener;
import com.logic.obdd.wiring.EditorEventLoop;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.swing.SwingUtilities;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Desktop entry point.
 *
 * Usage: {@code ObddEditorApp [settings.json]}. Without an argument the
 * settings come from {@code obdd-editor.json} on the classpath.
 */
public final class ObddEditorApp {
    private static final Logger log = LogManager.getLogger(ObddEditorApp.class);

    private ObddEditorApp() {
    }

    public static void main(String[] args) throws InterruptedException, InvocationTargetException {
        EditorSettings settings = args.length > 0 ? SettingsLoader.load(Path.of(args[0])) : SettingsLoader.load();
        log.info("Starting OBDD editor ({}x{} canvas)", settings.getCanvasWidth(), settings.getCanvasHeight());

        // 1. Window, built on the event dispatch thread
        AtomicReference<EditorFrame> ref = new AtomicReference<>();
        SwingUtilities.invokeAndWait(
                () -> ref.set(new EditorFrame(settings.getCanvasWidth(), settings.getCanvasHeight(),
                        KeyBindings.fromNames(settings.getKeyBindings()))));
        EditorFrame frame = ref.get();

        // 2. Editor, painted once before any input can reach it
        ObddEditor editor = new ObddEditor(frame, settings).addListener(new LoggingEditorListener());
        editor.refresh();

        // 3. Event loop; from here on only its consumer thread touches the editor
        EditorEventLoop loop = new EditorEventLoop(editor, settings.getRingBufferSize()).start();
        Runtime.getRuntime().addShutdownHook(new Thread(loop::close, "obdd-editor-shutdown"));

        SwingUtilities.invokeLater(() -> {
            frame.setEventSink(loop::publish);
            frame.setVisible(true);
        });
    }
}
