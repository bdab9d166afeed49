package io.github.yok.flashsync.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Target state of a destination table: its name and the schema inferred from the source.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DestinationTableSpec {

    @NonNull
    String tableName;

    @NonNull
    InferredSchema schema;
}
