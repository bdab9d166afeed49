package io.github.yok.flashsync.destination;

/**
 * An in-place schema update was refused.
 *
 * <p>
 * {@link #isCritical()} is {@code true} when the destination refused the update as an unsafe
 * migration (a column changed type or a column was dropped); such a table can only be brought to
 * the new schema by deleting and recreating it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaUpdateException extends DestinationException {

    private static final long serialVersionUID = 1L;

    private final boolean critical;

    public SchemaUpdateException(String message, Throwable cause, boolean critical) {
        super(message, cause);
        this.critical = critical;
    }

    public boolean isCritical() {
        return critical;
    }
}
