package org.cobbzilla.s3s3sync;

public enum SyncDecision {

    /** No object under this key in the destination bucket. */
    ABSENT,

    /** The destination object differs in size or entity tag. */
    STALE,

    /** Size and entity tag match, nothing to do. */
    CURRENT;

    public boolean needsCopy() { return this != CURRENT; }
}
