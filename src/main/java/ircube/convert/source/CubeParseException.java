package ircube.convert.source;

import java.io.IOException;

/**
 * Thrown when a spectral image file cannot be decoded into a cube.
 * This distinguishes unreadable or malformed input from failures writing the output table.
 *
 * @since 0.1.0
 */
public class CubeParseException extends IOException {

    /**
     * Constructs a new parse exception with the specified detail message.
     *
     * @param message the detail message
     */
    public CubeParseException(String message) {
        super(message);
    }

    /**
     * Constructs a new parse exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public CubeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
