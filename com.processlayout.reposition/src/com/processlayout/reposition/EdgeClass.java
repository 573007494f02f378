package com.processlayout.reposition;

/** How the engine treated an edge when routing it. */
public enum EdgeClass {
    FORWARD,
    BACK_EDGE,
    EXCEPTION_CHAIN,
    ASSOCIATION,
    CROSS_CONTAINER
}
