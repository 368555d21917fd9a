package org.cobbzilla.s3s3sync;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.model.CopyObjectRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.Tag;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.util.List;
import java.util.Objects;

import static org.cobbzilla.s3s3sync.MirrorPhase.OBJECT;

/**
 * Handles a single key. Determines if it should be copied, and if so, copies it server-side and reads the
 * destination back to verify it. An object only counts as copied once the verification passed.
 */
@Slf4j
public class KeyCopyJob extends KeyJob {

    public static final String METADATA_DIRECTIVE_HEADER = "x-amz-metadata-directive";
    public static final String TAGGING_DIRECTIVE_HEADER = "x-amz-tagging-directive";
    public static final String DIRECTIVE_COPY = "COPY";

    private final KeyChangeDetector detector;

    public KeyCopyJob(MirrorContext context, KeyObjectSummary summary, Callback callback) {
        this(context, summary, callback, new KeyChangeDetector(context));
    }

    KeyCopyJob(MirrorContext context, KeyObjectSummary summary, Callback callback, KeyChangeDetector detector) {
        super(context, summary, callback);
        this.detector = detector;
    }

    @Override public Logger getLog() { return log; }

    @Override
    public void run() {
        final MirrorStats stats = context.getStats();
        final String key = summary.getKey();
        MirrorException error = null;
        Error fatal = null;
        try {
            final KeyComparison comparison = detector.compare(summary);

            if (!comparison.needsCopy()) {
                log.info("Object {} is up-to-date, skipping.", key);
                stats.objectSkipped();

            } else if (context.isDryRun()) {
                log.info("Would have copied {} ({}).", key, comparison.getDecision());
                stats.objectWouldCopy();

            } else {
                if (context.isVerbose()) log.info("Copying {} ({}).", key, comparison);
                copyAndVerify();
                stats.objectCopied(summary.getSize());
                log.info("Copied and verified object {}.", key);
            }

        } catch (MirrorException e) {
            error = e;
        } catch (RuntimeException e) {
            error = new MirrorException(OBJECT, key, "Unexpected error syncing " + key, e);
        } catch (Error e) {
            // reported as a failure of this key first, then rethrown to the worker thread
            error = new MirrorException(OBJECT, key, "Fatal error syncing " + key, e);
            fatal = e;
        } finally {
            if (error != null) {
                stats.copyError();
                log.error("Error syncing key {}: {}", key, error.toString(), error.getCause());
            }
            callback.done(this, error);
            if (context.isVerbose()) log.info("Done with {}.", key);
        }
        if (fatal != null) throw fatal;
    }

    /**
     * Copies the object with its metadata, tags and storage class, then checks that the destination now
     * reports the size and entity tag recorded for the source when it was listed.
     */
    void copyAndVerify() {
        final String key = summary.getKey();
        final boolean verbose = context.isVerbose();
        final String sourceBucket = context.getSourceBucket();
        final String destinationBucket = context.getDestinationBucket();

        final ObjectMetadata sourceMetadata = getSourceObjectMetadata(key);
        if (verbose) logMetadata("source " + key, sourceMetadata);

        final List<Tag> tags = getSourceObjectTags(key);
        if (verbose) log.info("Source object {} has {} tag(s).", key, tags == null ? 0 : tags.size());

        final CopyObjectRequest copyRequest = new CopyObjectRequest(sourceBucket, key, destinationBucket, key);
        copyRequest.putCustomRequestHeader(METADATA_DIRECTIVE_HEADER, DIRECTIVE_COPY);
        copyRequest.putCustomRequestHeader(TAGGING_DIRECTIVE_HEADER, DIRECTIVE_COPY);
        if (sourceMetadata.getStorageClass() != null) copyRequest.setStorageClass(sourceMetadata.getStorageClass());

        try {
            context.getStats().s3copyCount.incrementAndGet();
            context.getDestinationClient().copyObject(copyRequest);
        } catch (SdkClientException e) {
            throw new MirrorException(OBJECT, key, "Failed to copy " + sourceBucket + "/" + key + " to " + destinationBucket, e);
        }

        final ObjectMetadata copied;
        try {
            copied = getDestinationObjectMetadata(key);
        } catch (MirrorException e) {
            throw new MirrorException(OBJECT, key, "Failed to verify copied object " + key, e.getCause());
        }

        verify(key, summary.getSize(), summary.getETag(), copied.getContentLength(), copied.getETag());
    }

    static void verify(String key, long sourceSize, String sourceETag, long destinationSize, String destinationETag) {
        if (sourceSize != destinationSize || !Objects.equals(sourceETag, destinationETag)) {
            throw new KeyVerificationException(key, sourceSize, destinationSize, sourceETag, destinationETag);
        }
    }
}
