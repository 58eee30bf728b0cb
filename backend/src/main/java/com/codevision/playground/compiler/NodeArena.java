package com.codevision.playground.compiler;

/**
 * Hands out syntax node ids for a single parse. Ids start at 0 and follow allocation order, so
 * parsing the same tokens twice yields the same ids.
 */
final class NodeArena {

    private int next;

    int allocate() {
        return next++;
    }

    int size() {
        return next;
    }
}
