package com.logic.obdd.ui;

import com.logic.obdd.api.EditorCommand;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.engine.KeyBindings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Gate in front of the event sink that asks the user before destructive
 * commands: clearing the diagram, and deleting a selected decision node.
 *
 * Keys are resolved through the same {@link KeyBindings} as the editor, so a
 * rebound delete key is confirmed too. Declined commands are dropped here and
 * never reach the editor.
 *
 * The selection is taken from the last painted frame. When no decision node
 * is highlighted the delete goes through unasked and the editor reports why
 * it cannot proceed.
 */
final class ConfirmingInput implements Consumer<InputEvent> {
    private static final Logger log = LogManager.getLogger(ConfirmingInput.class);

    static final String CLEAR_ALL_QUESTION = "Are you sure you want to clear all decision nodes?";

    private final KeyBindings keys;
    private final Predicate<String> confirm;
    private volatile Consumer<InputEvent> target;
    private volatile List<String> selectedDecisions = List.of();

    ConfirmingInput(KeyBindings keys, Predicate<String> confirm, Consumer<InputEvent> target) {
        this.keys = keys;
        this.confirm = confirm;
        this.target = target;
    }

    void setTarget(Consumer<InputEvent> target) {
        this.target = target;
    }

    /** Labels of the decision nodes highlighted in the frame on screen. */
    void frameSelection(List<String> decisionLabels) {
        this.selectedDecisions = List.copyOf(decisionLabels);
    }

    @Override
    public void accept(InputEvent event) {
        EditorCommand command = commandOf(event);
        String question = command == null ? null : question(command);
        if (question != null && !confirm.test(question)) {
            log.debug("{} declined by the user", command);
            return;
        }
        target.accept(event);
    }

    private EditorCommand commandOf(InputEvent event) {
        if (event instanceof InputEvent.Command c)
            return c.command();
        if (event instanceof InputEvent.KeyPress k)
            return keys.lookup(k.key());
        return null;
    }

    String question(EditorCommand command) {
        if (command == EditorCommand.CLEAR_ALL)
            return CLEAR_ALL_QUESTION;
        if (command != EditorCommand.DELETE_NODE)
            return null;
        List<String> selected = selectedDecisions;
        if (selected.isEmpty())
            return null;
        if (selected.size() == 1)
            return "Delete node '" + selected.get(0) + "' and its edges?";
        return "Delete the selected node and its edges?";
    }
}
