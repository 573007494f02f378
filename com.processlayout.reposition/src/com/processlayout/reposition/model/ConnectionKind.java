package com.processlayout.reposition.model;

public enum ConnectionKind {
    /** Control flow inside one process scope. */
    SEQUENCE_FLOW,
    /** Communication between pools. */
    MESSAGE_FLOW,
    /** Link between an artifact and a flow node. */
    ASSOCIATION
}
