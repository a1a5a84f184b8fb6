package com.chemdata.dwar.decode;

/**
 * A whole decode batch failed: timeout, non-zero exit or I/O trouble.
 */
public class DecoderException extends Exception {

    private static final long serialVersionUID = 1L;

    public DecoderException(String message) {
        super(message);
    }

    public DecoderException(String message, Throwable cause) {
        super(message, cause);
    }
}
