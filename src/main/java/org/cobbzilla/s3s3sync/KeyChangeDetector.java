package org.cobbzilla.s3s3sync;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.model.GetObjectMetadataRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static org.cobbzilla.s3s3sync.MirrorPhase.OBJECT;

/**
 * Decides whether a source object has to be copied by comparing its size and entity tag with the
 * destination's HEAD response. Both have to match: copies with a different part size keep the size
 * but get another entity tag.
 */
@Slf4j
public class KeyChangeDetector {

    private final MirrorContext context;

    public KeyChangeDetector(MirrorContext context) { this.context = context; }

    public KeyComparison compare(KeyObjectSummary summary) {
        final String bucket = context.getDestinationBucket();
        final String key = summary.getKey();

        final ObjectMetadata destinationMetadata;
        try {
            context.getStats().s3getCount.incrementAndGet();
            destinationMetadata = context.getDestinationClient().getObjectMetadata(new GetObjectMetadataRequest(bucket, key));
        } catch (SdkClientException e) {
            if (S3Errors.isNotFound(e)) {
                if (context.isVerbose()) log.info("Key {} not found in destination bucket (will copy).", key);
                return KeyComparison.absent();
            }
            throw new MirrorException(OBJECT, key, "Failed to get metadata of destination object " + bucket + "/" + key, e);
        }

        return compare(summary, destinationMetadata.getContentLength(), destinationMetadata.getETag());
    }

    static KeyComparison compare(KeyObjectSummary summary, long destinationSize, String destinationETag) {
        final boolean changed = destinationSize != summary.getSize()
                || !Objects.equals(destinationETag, summary.getETag());
        return new KeyComparison(changed ? SyncDecision.STALE : SyncDecision.CURRENT, destinationSize, destinationETag);
    }
}
