package org.cobbzilla.s3s3sync;

public enum MirrorPhase {

    BUCKET_CONFIG ("bucket configuration"),
    LISTING ("object listing"),
    OBJECT ("object sync");

    private final String description;

    MirrorPhase(String description) { this.description = description; }

    @Override public String toString() { return description; }
}
