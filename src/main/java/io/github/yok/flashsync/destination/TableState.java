package io.github.yok.flashsync.destination;

import io.github.yok.flashsync.model.InferredSchema;
import lombok.NonNull;
import lombok.Value;

/**
 * What the destination currently holds for an existing table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableState {

    @NonNull
    String tableName;

    // Current schema; fields of types without a semantic counterpart carry a null type
    @NonNull
    InferredSchema schema;
}
