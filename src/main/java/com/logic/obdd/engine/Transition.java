package com.logic.obdd.engine;

import com.logic.obdd.api.ErrorKind;

import java.util.List;

/**
 * Result of feeding one event to the state machine.
 *
 * @param session  the session after the event.
 * @param commands render commands, in the order they must be applied.
 * @param error    the guard or graph failure reported to the user, or null if
 *                 the event was handled normally.
 */
public record Transition(EditorSession session, List<RenderCommand> commands, ErrorKind error) {

    public Transition {
        commands = List.copyOf(commands);
    }

    /** An event that changes nothing and shows nothing. */
    public static Transition ignored(EditorSession session) {
        return new Transition(session, List.of(), null);
    }

    public boolean isRejected() {
        return error != null;
    }

    /** The last status message among the commands, or null. */
    public String status() {
        String status = null;
        for (RenderCommand command : commands) {
            if (command instanceof RenderCommand.ShowStatus s)
                status = s.message();
        }
        return status;
    }

    public boolean redraws() {
        for (RenderCommand command : commands) {
            if (command instanceof RenderCommand.Redraw)
                return true;
        }
        return false;
    }
}
