package org.cobbzilla.s3s3sync;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a run: either success with the final counts, or the first error that stopped it.
 * A failed run means the destination can't be assumed to mirror the source.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MirrorResult {

    @Getter private final long total;
    @Getter private final long copied;
    @Getter private final long skipped;
    @Getter private final long wouldCopy;
    @Getter private final long failed;
    @Getter private final MirrorException error;

    public static MirrorResult success(long total, MirrorStats stats) {
        return new MirrorResult(total, stats.getObjectsCopied(), stats.getObjectsSkipped(),
                stats.getObjectsWouldCopy(), stats.getCopyErrors(), null);
    }

    public static MirrorResult failure(long total, MirrorStats stats, MirrorException error) {
        return new MirrorResult(total, stats.getObjectsCopied(), stats.getObjectsSkipped(),
                stats.getObjectsWouldCopy(), stats.getCopyErrors(), error);
    }

    public boolean isSuccess() { return error == null; }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Synchronization completed: " + total + " objects found, " + copied + " copied, " + skipped + " skipped"
                    + (wouldCopy > 0 ? ", " + wouldCopy + " would have been copied" : "");
        }
        return "Synchronization incomplete (" + copied + " copied, " + skipped + " skipped, " + failed + " failed of "
                + total + "): " + error;
    }
}
