package io.github.yok.flashsync.error;

/**
 * The source query, the row cursor or the encoding of a parsed record failed.
 *
 * @author Yasuharu.Okawauchi
 */
public class ExtractionException extends SyncException {

    private static final long serialVersionUID = 1L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
