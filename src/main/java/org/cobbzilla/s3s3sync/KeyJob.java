package org.cobbzilla.s3s3sync;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GetObjectMetadataRequest;
import com.amazonaws.services.s3.model.GetObjectTaggingRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.Tag;
import lombok.Cleanup;
import lombok.Getter;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;
import org.slf4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.cobbzilla.s3s3sync.MirrorPhase.OBJECT;

/**
 * Base class of the per-key jobs: the S3 lookups they share and the completion callback to whoever
 * scheduled them.
 */
@Slf4j
public abstract class KeyJob implements Runnable {

    public interface Callback {
        /** Called exactly once when the job is done, {@code error} is null on success. */
        void done(KeyJob job, MirrorException error);
    }

    protected final MirrorContext context;
    @Getter protected final KeyObjectSummary summary;
    protected final Callback callback;

    public KeyJob(MirrorContext context, KeyObjectSummary summary, Callback callback) {
        this.context = context;
        this.summary = summary;
        this.callback = callback;
    }

    public abstract Logger getLog();

    @Override public String toString() { return summary.getKey(); }

    private ObjectMetadata getObjectMetadata(AmazonS3 client, String bucket, String key) {
        try {
            context.getStats().s3getCount.incrementAndGet();
            return client.getObjectMetadata(new GetObjectMetadataRequest(bucket, key));
        } catch (SdkClientException e) {
            throw new MirrorException(OBJECT, key, "Failed to get metadata of " + bucket + "/" + key, e);
        }
    }

    protected ObjectMetadata getSourceObjectMetadata(String key) {
        return getObjectMetadata(context.getSourceClient(), context.getSourceBucket(), key);
    }

    protected ObjectMetadata getDestinationObjectMetadata(String key) {
        return getObjectMetadata(context.getDestinationClient(), context.getDestinationBucket(), key);
    }

    protected List<Tag> getSourceObjectTags(String key) {
        final String bucket = context.getSourceBucket();
        try {
            context.getStats().s3getCount.incrementAndGet();
            return context.getSourceClient().getObjectTagging(new GetObjectTaggingRequest(bucket, key)).getTagSet();
        } catch (SdkClientException e) {
            throw new MirrorException(OBJECT, key, "Failed to get tags of " + bucket + "/" + key, e);
        }
    }

    @SneakyThrows
    protected static void logMetadata(String label, ObjectMetadata metadata) {
        Map userMetadataMap = metadata.getUserMetadata();
        Map rawMetadataMap = metadata.getRawMetadata();

        final Charset charset = StandardCharsets.UTF_8;
        @Cleanup ByteArrayOutputStream baos = new ByteArrayOutputStream();
        @Cleanup PrintStream ps = new PrintStream(baos, true, charset.name());

        MapUtils.debugPrint(ps, label + " user metadata", userMetadataMap);
        MapUtils.debugPrint(ps, label + " raw metadata", rawMetadataMap);

        log.info(new String(baos.toByteArray(), charset));
    }
}
