package io.github.yok.flashsync.error;

/**
 * The sample query failed or its column metadata could not be read.
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaInferenceException extends SyncException {

    private static final long serialVersionUID = 1L;

    public SchemaInferenceException(String message) {
        super(message);
    }

    public SchemaInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
