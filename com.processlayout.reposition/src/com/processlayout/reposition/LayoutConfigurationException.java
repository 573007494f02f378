package com.processlayout.reposition;

/**
 * Raised for invalid layout options, before the diagram is touched.
 */
public class LayoutConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LayoutConfigurationException(String message) {
        super(message);
    }
}
