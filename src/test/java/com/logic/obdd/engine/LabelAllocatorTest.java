package com.logic.obdd.engine;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class LabelAllocatorTest {

    @Test
    public void testSingleLettersStartAtP() {
        LabelAllocator labels = new LabelAllocator();
        List<String> produced = new ArrayList<>();
        for (int i = 0; i < 26; i++)
            produced.add(labels.next(l -> false));

        assertEquals(List.of("p", "q", "r", "s", "t", "u", "v", "w", "x", "y", "z",
                "a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l", "m", "n", "o"), produced);
    }

    @Test
    public void testNumberedLabelsAfterAlphabet() {
        assertEquals("o", LabelAllocator.labelAt(25));
        assertEquals("p1", LabelAllocator.labelAt(26));
        assertEquals("p2", LabelAllocator.labelAt(27));
        assertEquals("p100", LabelAllocator.labelAt(125));
    }

    @Test
    public void testLabelsAreDistinct() {
        LabelAllocator labels = new LabelAllocator();
        Set<String> seen = new java.util.HashSet<>();
        for (int i = 0; i < 500; i++)
            assertTrue(seen.add(labels.next(l -> false)));
        assertFalse(seen.contains("0"));
        assertFalse(seen.contains("1"));
    }

    @Test
    public void testSkipsLabelsInUse() {
        LabelAllocator labels = new LabelAllocator();
        Set<String> live = Set.of("p", "q");
        assertEquals("r", labels.next(live::contains));
        assertEquals("s", labels.next(live::contains));
        assertEquals(4, labels.allocated());
    }

    @Test
    public void testPeekDoesNotConsume() {
        LabelAllocator labels = new LabelAllocator();
        assertEquals("p", labels.peek(l -> false));
        assertEquals("p", labels.peek(l -> false));
        assertEquals("q", labels.peek("p"::equals));
        assertEquals(0, labels.allocated());
        assertEquals("p", labels.next(l -> false));
    }

    @Test
    public void testSkipAndReset() {
        LabelAllocator labels = new LabelAllocator();
        labels.skip();
        assertEquals("q", labels.next(l -> false));
        labels.reset();
        assertEquals(0, labels.allocated());
        assertEquals("p", labels.next(l -> false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeIndexRejected() {
        LabelAllocator.labelAt(-1);
    }
}
