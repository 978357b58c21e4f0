package com.opencm.format;

/**
 * Thrown when input is not a usable OpenCM document: the text is not valid JSON, or a field is
 * present with a shape the parser cannot convert (e.g. a string where a number is required).
 */
public final class OpenCmFormatException extends RuntimeException {

    public OpenCmFormatException(String message) {
        super(message);
    }

    public OpenCmFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
