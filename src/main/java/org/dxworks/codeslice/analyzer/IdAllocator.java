package org.dxworks.codeslice.analyzer;

/**
 * Hands out statement ids in source order for one collection pass. Id 0 is reserved for the
 * synthetic parameter entry.
 */
public class IdAllocator {

    public static final int ENTRY_ID = 0;

    private int next = 1;

    public int next() {
        return next++;
    }
}
