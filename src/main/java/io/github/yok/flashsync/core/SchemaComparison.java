package io.github.yok.flashsync.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Outcome of comparing an inferred schema with a destination schema.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SchemaComparison {

    boolean equal;

    // "missing:<column>" or "type:<column>" entries; empty when equal
    ImmutableList<String> differences;

    static SchemaComparison of(List<String> differences) {
        return new SchemaComparison(differences.isEmpty(), ImmutableList.copyOf(differences));
    }
}
