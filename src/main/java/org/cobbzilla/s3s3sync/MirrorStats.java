package org.cobbzilla.s3s3sync;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.joda.time.Period;
import org.joda.time.format.PeriodFormatter;
import org.joda.time.format.PeriodFormatterBuilder;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by all jobs of a run. Object outcomes and the progress reporter are updated together under
 * this object's lock, so a progress tick always matches a finished copied/skipped count.
 */
@Slf4j
public class MirrorStats {

    private static final PeriodFormatter ELAPSED_FORMAT = new PeriodFormatterBuilder()
            .appendHours().appendSuffix("h ")
            .appendMinutes().appendSuffix("m ")
            .appendSeconds().appendSuffix("s")
            .printZeroRarelyLast()
            .toFormatter();

    @Getter private final long start = System.currentTimeMillis();

    @Setter private MirrorProgress progress = MirrorProgress.NONE;

    private final AtomicLong objectsRead = new AtomicLong(0);
    private final AtomicLong objectsCopied = new AtomicLong(0);
    private final AtomicLong objectsSkipped = new AtomicLong(0);
    private final AtomicLong objectsWouldCopy = new AtomicLong(0);
    private final AtomicLong copyErrors = new AtomicLong(0);
    private final AtomicLong bytesCopied = new AtomicLong(0);

    // request counters, informational only
    final AtomicLong s3getCount = new AtomicLong(0);
    final AtomicLong s3putCount = new AtomicLong(0);
    final AtomicLong s3copyCount = new AtomicLong(0);

    @Getter private final Thread shutdownHook = new Thread(this::logStats);

    public void objectsRead(int count) { objectsRead.addAndGet(count); }

    public synchronized void objectCopied(long bytes) {
        objectsCopied.incrementAndGet();
        bytesCopied.addAndGet(bytes);
        progress.advance();
    }

    public synchronized void objectSkipped() {
        objectsSkipped.incrementAndGet();
        progress.advance();
    }

    public synchronized void objectWouldCopy() {
        objectsWouldCopy.incrementAndGet();
        progress.advance();
    }

    // errored objects do not advance the progress
    public synchronized void copyError() { copyErrors.incrementAndGet(); }

    public long getObjectsRead() { return objectsRead.get(); }
    public long getObjectsCopied() { return objectsCopied.get(); }
    public long getObjectsSkipped() { return objectsSkipped.get(); }
    public long getObjectsWouldCopy() { return objectsWouldCopy.get(); }
    public long getCopyErrors() { return copyErrors.get(); }
    public long getBytesCopied() { return bytesCopied.get(); }

    public long getS3getCount() { return s3getCount.get(); }
    public long getS3putCount() { return s3putCount.get(); }
    public long getS3copyCount() { return s3copyCount.get(); }

    /** Objects with a final outcome, i.e. copied, skipped, would-copy or failed. */
    public long getObjectsFinished() {
        return getObjectsCopied() + getObjectsSkipped() + getObjectsWouldCopy() + getCopyErrors();
    }

    public void logStats() { log.info(toString()); }

    private static String formatBytes(long bytes) {
        if (bytes >= MirrorConstants.GB) return String.format("%.2f GB", (double) bytes / MirrorConstants.GB);
        if (bytes >= MirrorConstants.MB) return String.format("%.2f MB", (double) bytes / MirrorConstants.MB);
        if (bytes >= MirrorConstants.KB) return String.format("%.2f KB", (double) bytes / MirrorConstants.KB);
        return bytes + " bytes";
    }

    @Override
    public String toString() {
        final long elapsed = System.currentTimeMillis() - start;
        return "\n--------------------------------------------------------------------\n" +
                "STATS BEGIN\n" +
                "read: " + getObjectsRead() + "\n" +
                "copied: " + getObjectsCopied() + "\n" +
                "skipped: " + getObjectsSkipped() + "\n" +
                (getObjectsWouldCopy() > 0 ? "would copy (dry run): " + getObjectsWouldCopy() + "\n" : "") +
                "copy errors: " + getCopyErrors() + "\n" +
                "duration: " + ELAPSED_FORMAT.print(new Period(elapsed).normalizedStandard()) + "\n" +
                "data copied: " + formatBytes(getBytesCopied()) + "\n" +
                "GET/HEAD/LIST operations: " + getS3getCount() + "\n" +
                "PUT operations: " + getS3putCount() + "\n" +
                "COPY operations: " + getS3copyCount() + "\n" +
                "STATS END\n" +
                "--------------------------------------------------------------------\n";
    }
}
