package uk.gegc.fluency.features.sync.domain.model;

public enum SyncOperation {
    UPSERT,
    REMOVE
}
