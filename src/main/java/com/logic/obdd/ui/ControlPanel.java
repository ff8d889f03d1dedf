package com.logic.obdd.ui;

import com.logic.obdd.api.EditorCommand;
import com.logic.obdd.api.InputEvent;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JTextField;
import java.awt.FlowLayout;
import java.util.function.Consumer;

/**
 * Button bar mirroring the keyboard shortcuts, plus a field for a custom
 * variable name used by "Add node".
 */
final class ControlPanel extends JPanel {
    private final JTextField labelField = new JTextField(6);

    ControlPanel(Consumer<InputEvent> input) {
        super(new FlowLayout(FlowLayout.LEFT, 6, 6));
        setBorder(BorderFactory.createMatteBorder(0, 0, 1, 0, getBackground().darker()));

        add(new JLabel("Variable:"));
        labelField.setToolTipText("Leave empty for the next free variable name");
        add(labelField);

        JButton addNode = button("Add node (n)");
        addNode.addActionListener(e -> {
            String label = labelField.getText();
            labelField.setText("");
            input.accept(new InputEvent.Command(EditorCommand.ADD_NODE, label));
        });
        add(addNode);

        add(commandButton("Set root (r)", EditorCommand.SET_ROOT, input));
        add(commandButton("0-edge (0)", EditorCommand.CONNECT_ZERO, input));
        add(commandButton("1-edge (1)", EditorCommand.CONNECT_ONE, input));
        add(commandButton("Delete edges (d)", EditorCommand.DELETE_EDGES, input));
        add(commandButton("Delete node (x)", EditorCommand.DELETE_NODE, input));
        add(commandButton("Clear all", EditorCommand.CLEAR_ALL, input));
        add(commandButton("Export (e)", EditorCommand.EXPORT, input));
        add(commandButton("Import (i)", EditorCommand.IMPORT, input));
    }

    private static JButton commandButton(String text, EditorCommand command, Consumer<InputEvent> input) {
        JButton b = button(text);
        b.addActionListener(e -> input.accept(new InputEvent.Command(command)));
        return b;
    }

    private static JButton button(String text) {
        JButton b = new JButton(text);
        // keep keyboard focus on the canvas so shortcuts keep working
        b.setFocusable(false);
        return b;
    }
}
