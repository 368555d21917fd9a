package org.cobbzilla.s3s3sync;

import lombok.Getter;

/**
 * The destination object read back after a copy does not match the source size and entity tag.
 */
public class KeyVerificationException extends MirrorException {

    @Getter private final long sourceSize;
    @Getter private final long destinationSize;
    @Getter private final String sourceETag;
    @Getter private final String destinationETag;

    public KeyVerificationException(String key, long sourceSize, long destinationSize, String sourceETag, String destinationETag) {
        super(MirrorPhase.OBJECT, key, "Verification failed for " + key
                + ": size (source " + sourceSize + ", destination " + destinationSize + ")"
                + ", ETag (source " + sourceETag + ", destination " + destinationETag + ")", null);
        this.sourceSize = sourceSize;
        this.destinationSize = destinationSize;
        this.sourceETag = sourceETag;
        this.destinationETag = destinationETag;
    }
}
