package com.tfve.sync.core.model;

/**
 * Remote mutation attempted for a single variable.
 */
public enum SyncOperation {
    CREATE,
    UPDATE
}
