package org.cobbzilla.s3s3sync;

import com.amazonaws.AmazonServiceException;

/**
 * Classifies S3 failures by HTTP status and S3 error code.
 *
 * Matching on the exception message is only a last resort, used when the service answered but sent no error
 * code at all (some S3-compatible servers answer HEAD requests with an empty body). Client-side and transport
 * failures never match.
 */
public class S3Errors {

    public static final String NO_SUCH_KEY = "NoSuchKey";
    public static final String NOT_FOUND = "NotFound";
    public static final String NO_SUCH_BUCKET_POLICY = "NoSuchBucketPolicy";
    public static final String NO_SUCH_LIFECYCLE_CONFIGURATION = "NoSuchLifecycleConfiguration";
    public static final String BUCKET_ALREADY_OWNED_BY_YOU = "BucketAlreadyOwnedByYou";
    public static final String BUCKET_ALREADY_EXISTS = "BucketAlreadyExists";

    private S3Errors() {}

    public static boolean isNotFound(Exception e) {
        if (!(e instanceof AmazonServiceException)) return false;
        final AmazonServiceException ase = (AmazonServiceException) e;
        if (ase.getStatusCode() == 404) return true;
        if (hasErrorCode(ase)) return NO_SUCH_KEY.equals(ase.getErrorCode()) || NOT_FOUND.equals(ase.getErrorCode());
        return messageContains(ase, NOT_FOUND) || messageContains(ase, "404");
    }

    public static boolean isNoSuchBucketPolicy(Exception e) {
        return hasCode(e, NO_SUCH_BUCKET_POLICY);
    }

    public static boolean isNoSuchLifecycleConfiguration(Exception e) {
        return hasCode(e, NO_SUCH_LIFECYCLE_CONFIGURATION);
    }

    public static boolean isBucketAlreadyOwnedByYou(Exception e) {
        return hasCode(e, BUCKET_ALREADY_OWNED_BY_YOU);
    }

    public static boolean isBucketAlreadyExists(Exception e) {
        return hasCode(e, BUCKET_ALREADY_EXISTS);
    }

    private static boolean hasCode(Exception e, String code) {
        if (!(e instanceof AmazonServiceException)) return false;
        final AmazonServiceException ase = (AmazonServiceException) e;
        if (hasErrorCode(ase)) return code.equals(ase.getErrorCode());
        return messageContains(ase, code);
    }

    private static boolean hasErrorCode(AmazonServiceException e) {
        return e.getErrorCode() != null && e.getErrorCode().length() > 0;
    }

    private static boolean messageContains(Exception e, String text) {
        return e.getMessage() != null && e.getMessage().contains(text);
    }
}
