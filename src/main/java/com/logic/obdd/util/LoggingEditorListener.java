package com.logic.obdd.util;

import com.logic.obdd.api.ErrorKind;
import com.logic.obdd.api.InputEvent;
import com.logic.obdd.engine.EditorListener;
import com.logic.obdd.engine.Transition;

import lombok.extern.log4j.Log4j2;

/**
 * Writes every processed event to the log.
 *
 * Transitions go out at DEBUG. Refused requests are expected user mistakes and
 * go out at INFO, except broken import files which are logged at WARN.
 */
@Log4j2
public final class LoggingEditorListener implements EditorListener {

    @Override
    public void onTransition(long sequence, InputEvent event, Transition transition) {
        if (log.isDebugEnabled()) {
            log.debug("#{} {} -> mode={} selected={} commands={} status={}",
                    sequence, event, transition.session().mode(), transition.session().selectedNodeId(),
                    transition.commands().size(), transition.status());
        }
    }

    @Override
    public void onRejected(long sequence, InputEvent event, ErrorKind kind, String message) {
        if (kind == ErrorKind.MALFORMED_DOCUMENT)
            log.warn("#{} {} rejected: {}", sequence, event, message);
        else
            log.info("#{} {} rejected ({}): {}", sequence, event, kind, message);
    }
}
