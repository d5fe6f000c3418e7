package ircube.convert.processing;

import java.io.IOException;

/**
 * Thrown when a spectral table cannot be written to its destination.
 */
public class SerializationException extends IOException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
