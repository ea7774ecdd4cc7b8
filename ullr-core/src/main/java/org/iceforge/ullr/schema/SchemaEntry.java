package org.iceforge.ullr.schema;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * What the sample says about one field: its inferred type, how many rows carried it, and every
 * concrete type behind a {@link FieldType#MIXED} verdict.
 */
public record SchemaEntry(String field, FieldType type, int occurrences, Set<FieldType> observedTypes) {
    public SchemaEntry {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(type, "type");
        observedTypes = (observedTypes == null || observedTypes.isEmpty())
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(observedTypes));
    }
}
