package org.iceforge.ullr.schema;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    /** Seen with two or more concrete types across the sample. Never observed directly. */
    MIXED,
    /** Only null values were seen. */
    UNKNOWN;

    public boolean concrete() {
        return this != MIXED && this != UNKNOWN;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
