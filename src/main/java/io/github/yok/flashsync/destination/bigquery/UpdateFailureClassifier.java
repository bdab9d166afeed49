package io.github.yok.flashsync.destination.bigquery;

import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Decides whether a refused schema update can only be resolved by recreating the table.
 *
 * <p>
 * BigQuery rejects in-place updates that change a column type or drop a column with an
 * {@code invalid} error such as <i>"Field x has changed type from INTEGER to STRING"</i> or
 * <i>"Field y is missing in new schema"</i>. Any other rejection is not critical.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class UpdateFailureClassifier {

    private UpdateFailureClassifier() {}

    static boolean isCritical(BigQueryException e) {
        StringBuilder text = new StringBuilder(StringUtils.defaultString(e.getMessage()));
        BigQueryError error = e.getError();
        if (error != null) {
            text.append(' ').append(StringUtils.defaultString(error.getMessage()));
        }
        String message = text.toString().toLowerCase(Locale.ROOT);
        boolean invalid = "invalid".equalsIgnoreCase(e.getReason()) || message.contains("invalid");
        return invalid && (message.contains("changed type") || message.contains("is missing"));
    }
}
