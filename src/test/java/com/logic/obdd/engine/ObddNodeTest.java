package com.logic.obdd.engine;

import com.logic.obdd.api.EdgeKind;
import com.logic.obdd.api.NodeKind;
import com.logic.obdd.api.Position;
import org.junit.Test;

import static org.junit.Assert.*;

public class ObddNodeTest {

    @Test
    public void testTerminalFactoryLabels() {
        ObddNode zero = ObddNode.terminal("t0", false, new Position(0, 0));
        ObddNode one = ObddNode.terminal("t1", true, new Position(0, 0));
        assertEquals("0", zero.label());
        assertEquals("1", one.label());
        assertEquals(NodeKind.TERMINAL, zero.kind());
        assertTrue(one.isTerminal());
    }

    @Test
    public void testLinkReplacesSameKind() {
        ObddNode p = ObddNode.decision("n2", "p", new Position(10, 10));
        assertTrue(p.link(EdgeKind.ONE, "n3"));
        assertTrue(p.link(EdgeKind.ONE, "n4"));
        assertFalse("re-pointing to the same target is not a change", p.link(EdgeKind.ONE, "n4"));

        assertEquals("n4", p.target(EdgeKind.ONE));
        assertNull(p.target(EdgeKind.ZERO));
        assertEquals(1, p.outgoing().size());
    }

    @Test
    public void testOutgoingIteratesZeroFirst() {
        ObddNode p = ObddNode.decision("n2", "p", new Position(10, 10));
        p.link(EdgeKind.ONE, "a");
        p.link(EdgeKind.ZERO, "b");
        assertEquals(EdgeKind.ZERO, p.outgoing().keySet().iterator().next());
    }

    @Test
    public void testUnlinkAllCountsEdges() {
        ObddNode p = ObddNode.decision("n2", "p", new Position(10, 10));
        p.link(EdgeKind.ONE, "a");
        p.link(EdgeKind.ZERO, "b");
        assertEquals(2, p.unlinkAll());
        assertEquals(0, p.unlinkAll());
        assertFalse(p.unlink(EdgeKind.ONE));
    }

    @Test(expected = IllegalStateException.class)
    public void testTerminalCannotLink() {
        ObddNode.terminal("t0", false, new Position(0, 0)).link(EdgeKind.ONE, "x");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testOutgoingIsReadOnly() {
        ObddNode p = ObddNode.decision("n2", "p", new Position(10, 10));
        p.outgoing().put(EdgeKind.ONE, "x");
    }

    @Test
    public void testMoveTo() {
        ObddNode p = ObddNode.decision("n2", "p", new Position(10, 10));
        p.moveTo(new Position(30, 40));
        assertEquals(new Position(30, 40), p.position());
    }
}
