package com.processlayout.elk;

/** The layered layout could not be computed for a diagram. */
public class InitialPlacementException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InitialPlacementException(String message, Throwable cause) {
        super(message, cause);
    }
}
