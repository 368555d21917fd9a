package org.cobbzilla.s3s3sync;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.Headers;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.GetObjectMetadataRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class KeyChangeDetectorTest {

    private AmazonS3 destination;
    private KeyChangeDetector detector;

    @Before
    public void setUp() {
        destination = mock(AmazonS3.class);
        detector = new KeyChangeDetector(TestMirror.context(mock(AmazonS3.class), destination));
    }

    private static ObjectMetadata metadata(long size, String eTag) {
        final ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentLength(size);
        metadata.setHeader(Headers.ETAG, eTag);
        return metadata;
    }

    @Test
    public void testCurrent() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class))).thenReturn(metadata(20, "t2"));

        final KeyComparison comparison = detector.compare(new KeyObjectSummary("b", 20, "t2"));

        assertEquals(SyncDecision.CURRENT, comparison.getDecision());
        assertFalse(comparison.needsCopy());
        assertEquals(20, comparison.getDestinationSize());
        assertEquals("t2", comparison.getDestinationETag());
    }

    @Test
    public void testStaleTag() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class))).thenReturn(metadata(30, "old"));

        final KeyComparison comparison = detector.compare(new KeyObjectSummary("c", 30, "t3"));

        assertEquals(SyncDecision.STALE, comparison.getDecision());
        assertTrue(comparison.needsCopy());
        assertEquals("old", comparison.getDestinationETag());
    }

    @Test
    public void testStaleSize() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class))).thenReturn(metadata(31, "t3"));
        assertEquals(SyncDecision.STALE, detector.compare(new KeyObjectSummary("c", 30, "t3")).getDecision());
    }

    @Test
    public void testAbsentRegardlessOfSizeAndTag() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class)))
                .thenThrow(InMemoryS3.s3Exception(404, "404 Not Found", "Not Found"));

        final long[] sizes = {0, 1, 10, 5L * MirrorConstants.GB};
        final String[] tags = {"", "t1", "d41d8cd98f00b204e9800998ecf8427e", "abc-12"};
        for (long size : sizes) {
            for (String tag : tags) {
                final KeyComparison comparison = detector.compare(new KeyObjectSummary("a", size, tag));
                assertEquals(SyncDecision.ABSENT, comparison.getDecision());
                assertTrue(comparison.needsCopy());
            }
        }
    }

    @Test
    public void testAbsentWithoutStatusCode() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class)))
                .thenThrow(new AmazonS3Exception("NotFound"));
        assertEquals(SyncDecision.ABSENT, detector.compare(new KeyObjectSummary("a", 1, "x")).getDecision());
    }

    @Test
    public void testTransportErrorMentioning404IsHardFailure() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class)))
                .thenThrow(new SdkClientException("Unable to execute HTTP request: Connect to s3-404.internal.example:9404 failed"));
        try {
            detector.compare(new KeyObjectSummary("a", 1, "x"));
            fail("expected MirrorException");
        } catch (MirrorException e) {
            assertEquals(MirrorPhase.OBJECT, e.getPhase());
            assertTrue(e.getCause() instanceof SdkClientException);
        }
    }

    @Test
    public void testOtherErrorIsHardFailure() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class)))
                .thenThrow(InMemoryS3.s3Exception(403, "403 Forbidden", "Forbidden"));
        try {
            detector.compare(new KeyObjectSummary("secret", 1, "x"));
            fail("expected MirrorException");
        } catch (MirrorException e) {
            assertEquals(MirrorPhase.OBJECT, e.getPhase());
            assertEquals("secret", e.getKey());
        }
    }

    @Test
    public void testHeadsDestinationBucket() throws Exception {
        when(destination.getObjectMetadata(any(GetObjectMetadataRequest.class))).thenReturn(metadata(1, "x"));
        detector.compare(new KeyObjectSummary("dir/file.txt", 1, "x"));
        verify(destination).getObjectMetadata(argThat((GetObjectMetadataRequest r) ->
                r.getBucketName().equals(TestMirror.DESTINATION) && r.getKey().equals("dir/file.txt")));
    }
}
