package com.chemdata.dwar.decode;

/**
 * The decoder runtime or one of its files is missing.
 */
public class DecoderUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DecoderUnavailableException(String message) {
        super(message);
    }

    public DecoderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
