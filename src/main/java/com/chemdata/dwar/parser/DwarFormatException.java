package com.chemdata.dwar.parser;

/**
 * Raised when content carries none of the markers that identify a DataWarrior document.
 */
public class DwarFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DwarFormatException(String message) {
        super(message);
    }
}
