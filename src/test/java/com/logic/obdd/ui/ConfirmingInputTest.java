package com.logic.obdd.ui;

import com.logic.obdd.api.EditorCommand;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.api.Position;
import com.logic.obdd.engine.KeyBindings;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ConfirmingInputTest {

    private final List<String> questions = new ArrayList<>();
    private final List<InputEvent> forwarded = new ArrayList<>();
    private boolean answer;
    private ConfirmingInput input;

    @Before
    public void setUp() {
        input = new ConfirmingInput(KeyBindings.defaults(), q -> {
            questions.add(q);
            return answer;
        }, forwarded::add);
    }

    @Test
    public void testDeclinedClearAllIsDropped() {
        answer = false;
        input.accept(new InputEvent.Command(EditorCommand.CLEAR_ALL));
        assertEquals(List.of(ConfirmingInput.CLEAR_ALL_QUESTION), questions);
        assertTrue(forwarded.isEmpty());
    }

    @Test
    public void testConfirmedClearAllIsForwarded() {
        answer = true;
        InputEvent clear = new InputEvent.Command(EditorCommand.CLEAR_ALL);
        input.accept(clear);
        assertEquals(List.of(clear), forwarded);
    }

    @Test
    public void testDeleteKeyAsksWithNodeLabel() {
        input.frameSelection(List.of("p"));
        answer = false;
        input.accept(new InputEvent.KeyPress('x'));
        input.accept(new InputEvent.KeyPress(InputEvent.KeyPress.DELETE));
        assertEquals(List.of("Delete node 'p' and its edges?", "Delete node 'p' and its edges?"), questions);
        assertTrue(forwarded.isEmpty());
    }

    @Test
    public void testDeleteWithoutDecisionSelectionIsNotAsked() {
        InputEvent delete = new InputEvent.Command(EditorCommand.DELETE_NODE);
        input.accept(delete);
        assertTrue(questions.isEmpty());
        assertEquals(List.of(delete), forwarded);
    }

    @Test
    public void testDeleteWithSeveralSelected() {
        input.frameSelection(List.of("p", "q"));
        assertEquals("Delete the selected node and its edges?", input.question(EditorCommand.DELETE_NODE));
    }

    @Test
    public void testOtherInputPassesUnasked() {
        input.accept(new InputEvent.KeyPress('n'));
        input.accept(new InputEvent.Command(EditorCommand.SET_ROOT));
        input.accept(new InputEvent.DragStart(new Position(5, 5)));
        assertTrue(questions.isEmpty());
        assertEquals(3, forwarded.size());
    }

    @Test
    public void testReboundDeleteKeyIsConfirmed() {
        ConfirmingInput custom = new ConfirmingInput(KeyBindings.fromNames(Map.of("k", "DELETE_NODE")), q -> {
            questions.add(q);
            return true;
        }, forwarded::add);
        custom.frameSelection(List.of("r"));
        custom.accept(new InputEvent.KeyPress('k'));
        custom.accept(new InputEvent.KeyPress('x'));
        assertEquals(List.of("Delete node 'r' and its edges?"), questions);
        assertEquals(2, forwarded.size());
    }
}
