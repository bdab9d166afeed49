package io.github.yok.flashsync.destination;

/**
 * A destination operation (describe, create, update, delete, load) failed.
 *
 * @author Yasuharu.Okawauchi
 */
public class DestinationException extends Exception {

    private static final long serialVersionUID = 1L;

    public DestinationException(String message) {
        super(message);
    }

    public DestinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
