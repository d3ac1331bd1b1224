package com.tfve.sync.core.value;

/**
 * Variant tag of a {@link Value}.
 *
 * Scalars ({@code BOOLEAN, INTEGER, FLOAT, STRING}) are sent to the API as plain
 * variables. {@code NULL, ARRAY, OBJECT} are structured and sent as HCL.
 */
public enum ValueKind {
    NULL,
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING,
    ARRAY,
    OBJECT
}
