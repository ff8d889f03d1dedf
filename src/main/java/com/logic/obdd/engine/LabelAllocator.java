package com.logic.obdd.engine;

import java.util.function.Predicate;

/**
 * Hands out decision-variable labels in a fixed, human-readable order.
 *
 * Sequence:
 * 1. The 26 single letters, starting at "p" and wrapping round the alphabet:
 * p q r s t u v w x y z a b ... o
 * 2. Numbered labels without end: p1, p2, p3, ...
 *
 * The allocator keeps a monotonic counter and never produces the terminal
 * labels "0" and "1". Callers pass a predicate telling it which labels are
 * held by live nodes; those are skipped, so a label is never handed out twice
 * while its owner exists (relevant after an import or a user-chosen label).
 */
public final class LabelAllocator {
    private static final int LETTERS = 26;
    private static final int FIRST_LETTER = 'p' - 'a';

    private long counter;

    /**
     * Returns the next free label and advances past it.
     *
     * @param inUse true for labels that must not be produced.
     */
    public String next(Predicate<String> inUse) {
        String label;
        do {
            label = labelAt(counter++);
        } while (inUse.test(label));
        return label;
    }

    /** Same as {@link #next} without consuming anything. */
    public String peek(Predicate<String> inUse) {
        long candidate = counter;
        String label = labelAt(candidate);
        while (inUse.test(label)) {
            label = labelAt(++candidate);
        }
        return label;
    }

    /**
     * Advances the counter by one position without returning a label. Used when
     * the user overrides the suggested label, so the suggestion is not offered
     * again.
     */
    public void skip() {
        counter++;
    }

    /** Restarts the sequence at "p". */
    public void reset() {
        counter = 0;
    }

    /** Number of positions consumed since the last reset. */
    public long allocated() {
        return counter;
    }

    /** The label at a position of the sequence, ignoring live labels. */
    public static String labelAt(long index) {
        if (index < 0)
            throw new IllegalArgumentException("Negative label index: " + index);
        if (index < LETTERS)
            return String.valueOf((char) ('a' + (FIRST_LETTER + index) % LETTERS));
        return "p" + (index - LETTERS + 1);
    }
}
