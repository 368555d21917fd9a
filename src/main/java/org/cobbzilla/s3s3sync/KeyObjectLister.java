package org.cobbzilla.s3s3sync;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.cobbzilla.s3s3sync.MirrorPhase.LISTING;

/**
 * Lists the whole source bucket, following continuation tokens page by page. The complete list is built
 * before any object is synced since the total is needed up front; a failed page fails the listing, a
 * partial list is never returned.
 */
@Slf4j
public class KeyObjectLister {

    private final MirrorContext context;
    private final AmazonS3 client;
    private final String bucket;
    private final int pageSize;

    public KeyObjectLister(MirrorContext context) {
        this(context, context.getSourceClient(), context.getSourceBucket(), context.getOptions().getPageSize());
    }

    public KeyObjectLister(MirrorContext context, AmazonS3 client, String bucket, int pageSize) {
        this.context = context;
        this.client = client;
        this.bucket = bucket;
        this.pageSize = pageSize;
    }

    public List<KeyObjectSummary> list() {
        final boolean verbose = context.isVerbose();
        final List<KeyObjectSummary> summaries = new ArrayList<KeyObjectSummary>();

        final ListObjectsV2Request request = new ListObjectsV2Request()
                .withBucketName(bucket)
                .withMaxKeys(pageSize);

        int page = 0;
        while (true) {
            page++;
            final ListObjectsV2Result result;
            try {
                context.getStats().s3getCount.incrementAndGet();
                result = client.listObjectsV2(request);
            } catch (SdkClientException e) {
                throw new MirrorException(LISTING, "Failed to list objects of " + bucket + " (page " + page + ", "
                        + summaries.size() + " keys listed so far)", e);
            }

            final List<KeyObjectSummary> batch = KeyObjectSummary.S3ObjectSummaryToKeyObject(result.getObjectSummaries());
            summaries.addAll(batch);
            context.getStats().objectsRead(batch.size());
            if (verbose) log.info("Listed page {} of {} with {} keys (total now={}).", page, bucket, batch.size(), summaries.size());

            final String next = result.getNextContinuationToken();
            if (next == null || next.isEmpty()) break;
            request.setContinuationToken(next);
        }

        log.info("Found {} objects in source bucket {}.", summaries.size(), bucket);
        return Collections.unmodifiableList(summaries);
    }
}
