package io.github.yok.flashsync.parser;

import io.github.yok.flashsync.error.RowParseException;
import io.github.yok.flashsync.model.SyncRecord;
import java.sql.ResultSet;
import java.util.List;

/**
 * Converts the current row of a {@link ResultSet} into a {@link SyncRecord}.
 *
 * @author Yasuharu.Okawauchi
 */
public interface RowParser {

    /**
     * Parses the row the cursor is positioned on.
     *
     * @param row result set positioned on a row; the cursor is not moved
     * @param columns column labels, in result-set order
     * @return record whose key set equals {@code columns}
     * @throws RowParseException if a column value cannot be read from the driver
     */
    SyncRecord parse(ResultSet row, List<String> columns) throws RowParseException;
}
