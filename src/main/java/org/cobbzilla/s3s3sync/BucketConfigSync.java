package org.cobbzilla.s3s3sync;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.model.*;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

import static org.cobbzilla.s3s3sync.MirrorPhase.BUCKET_CONFIG;

/**
 * Makes sure the destination bucket exists and carries the source bucket's policy, versioning status and
 * lifecycle rules. Runs once, before any object is looked at. A source that has no policy or no lifecycle
 * rules is fine; every other failure aborts the run.
 *
 * The versioning status is written as read, except for a source that was never versioned ("Off" or no
 * status): S3 rejects "Off" in a PUT, so the destination's versioning is left unchanged in that case.
 */
@Slf4j
public class BucketConfigSync {

    private static final String US_EAST_1 = "us-east-1";

    private final MirrorContext context;

    public BucketConfigSync(MirrorContext context) { this.context = context; }

    public void sync() {
        ensureDestinationBucket();
        syncPolicy();
        syncVersioning();
        syncLifecycle();
    }

    void ensureDestinationBucket() {
        final String bucket = context.getDestinationBucket();
        final String region = context.getConfig().getDestination().getRegion();

        if (context.isDryRun()) {
            log.info("Would have ensured destination bucket {} exists.", bucket);
            return;
        }

        final CreateBucketRequest request = region == null || region.isEmpty() || region.equals(US_EAST_1)
                ? new CreateBucketRequest(bucket)
                : new CreateBucketRequest(bucket, region);
        try {
            context.getStats().s3putCount.incrementAndGet();
            context.getDestinationClient().createBucket(request);
            log.info("Created destination bucket {}.", bucket);

        } catch (SdkClientException e) {
            if (!S3Errors.isBucketAlreadyOwnedByYou(e)) {
                if (S3Errors.isBucketAlreadyExists(e)) {
                    throw new MirrorException(BUCKET_CONFIG, "Destination bucket " + bucket + " exists but belongs to another account", e);
                }
                throw new MirrorException(BUCKET_CONFIG, "Failed to create destination bucket " + bucket, e);
            }
            log.info("Destination bucket {} already exists.", bucket);
        }
    }

    void syncPolicy() {
        final String sourceBucket = context.getSourceBucket();
        final String destinationBucket = context.getDestinationBucket();

        final String policy;
        try {
            context.getStats().s3getCount.incrementAndGet();
            final BucketPolicy bucketPolicy = context.getSourceClient().getBucketPolicy(new GetBucketPolicyRequest(sourceBucket));
            policy = bucketPolicy == null ? null : bucketPolicy.getPolicyText();
        } catch (SdkClientException e) {
            if (S3Errors.isNoSuchBucketPolicy(e)) {
                if (context.isVerbose()) log.info("Source bucket {} has no policy.", sourceBucket);
                return;
            }
            throw new MirrorException(BUCKET_CONFIG, "Failed to get bucket policy of source bucket " + sourceBucket, e);
        }

        // the SDK maps NoSuchBucketPolicy to an empty policy
        if (policy == null || policy.isEmpty()) {
            if (context.isVerbose()) log.info("Source bucket {} has no policy.", sourceBucket);
            return;
        }

        if (context.isDryRun()) {
            log.info("Would have copied bucket policy to {}.", destinationBucket);
            return;
        }

        try {
            context.getStats().s3putCount.incrementAndGet();
            context.getDestinationClient().setBucketPolicy(new SetBucketPolicyRequest(destinationBucket, policy));
        } catch (SdkClientException e) {
            throw new MirrorException(BUCKET_CONFIG, "Failed to set bucket policy of destination bucket " + destinationBucket, e);
        }
        log.info("Synced bucket policy.");
    }

    void syncVersioning() {
        final String sourceBucket = context.getSourceBucket();
        final String destinationBucket = context.getDestinationBucket();

        final String status;
        try {
            context.getStats().s3getCount.incrementAndGet();
            status = context.getSourceClient()
                    .getBucketVersioningConfiguration(new GetBucketVersioningConfigurationRequest(sourceBucket))
                    .getStatus();
        } catch (SdkClientException e) {
            throw new MirrorException(BUCKET_CONFIG, "Failed to get versioning status of source bucket " + sourceBucket, e);
        }

        // S3 rejects "Off" in a PUT, a bucket that was never versioned can't be set to it explicitly
        if (status == null || BucketVersioningConfiguration.OFF.equals(status)) {
            log.info("Source bucket {} was never versioned, leaving versioning of {} unchanged.", sourceBucket, destinationBucket);
            return;
        }

        if (context.isDryRun()) {
            log.info("Would have set versioning of {} to {}.", destinationBucket, status);
            return;
        }

        try {
            context.getStats().s3putCount.incrementAndGet();
            context.getDestinationClient().setBucketVersioningConfiguration(
                    new SetBucketVersioningConfigurationRequest(destinationBucket, new BucketVersioningConfiguration(status)));
        } catch (SdkClientException e) {
            throw new MirrorException(BUCKET_CONFIG, "Failed to set versioning status of destination bucket " + destinationBucket, e);
        }
        log.info("Synced bucket versioning ({}).", status);
    }

    void syncLifecycle() {
        final String sourceBucket = context.getSourceBucket();
        final String destinationBucket = context.getDestinationBucket();

        final BucketLifecycleConfiguration lifecycle;
        try {
            context.getStats().s3getCount.incrementAndGet();
            lifecycle = context.getSourceClient()
                    .getBucketLifecycleConfiguration(new GetBucketLifecycleConfigurationRequest(sourceBucket));
        } catch (SdkClientException e) {
            if (S3Errors.isNoSuchLifecycleConfiguration(e)) {
                if (context.isVerbose()) log.info("Source bucket {} has no lifecycle configuration.", sourceBucket);
                return;
            }
            throw new MirrorException(BUCKET_CONFIG, "Failed to get lifecycle configuration of source bucket " + sourceBucket, e);
        }

        // null is how the SDK reports NoSuchLifecycleConfiguration
        final List<BucketLifecycleConfiguration.Rule> rules = lifecycle == null ? null : lifecycle.getRules();
        if (rules == null || rules.isEmpty()) {
            if (context.isVerbose()) log.info("Source bucket {} has no lifecycle rules.", sourceBucket);
            return;
        }

        if (context.isDryRun()) {
            log.info("Would have copied {} lifecycle rule(s) to {}.", rules.size(), destinationBucket);
            return;
        }

        try {
            context.getStats().s3putCount.incrementAndGet();
            context.getDestinationClient().setBucketLifecycleConfiguration(
                    new SetBucketLifecycleConfigurationRequest(destinationBucket, new BucketLifecycleConfiguration(rules)));
        } catch (SdkClientException e) {
            throw new MirrorException(BUCKET_CONFIG, "Failed to set lifecycle configuration of destination bucket " + destinationBucket, e);
        }
        log.info("Synced {} lifecycle rule(s).", rules.size());
    }
}
