package org.cobbzilla.s3s3sync;

import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class KeyObjectListerTest {

    private static ListObjectsV2Result page(String nextToken, String... keys) {
        final ListObjectsV2Result result = new ListObjectsV2Result();
        for (String key : keys) {
            final S3ObjectSummary summary = new S3ObjectSummary();
            summary.setKey(key);
            summary.setSize(key.length());
            summary.setETag("etag-" + key);
            result.getObjectSummaries().add(summary);
        }
        result.setNextContinuationToken(nextToken);
        result.setTruncated(nextToken != null);
        return result;
    }

    @Test
    public void testFollowsContinuationTokens() throws Exception {
        final AmazonS3 source = mock(AmazonS3.class);
        // the request object is reused between pages, record the token as it was at call time
        final List<String> tokens = new ArrayList<String>();
        when(source.listObjectsV2(any(ListObjectsV2Request.class))).thenAnswer(invocation -> {
            final ListObjectsV2Request request = invocation.getArgument(0);
            tokens.add(request.getContinuationToken());
            assertEquals(TestMirror.SOURCE, request.getBucketName());
            assertEquals(Integer.valueOf(2), request.getMaxKeys());
            switch (tokens.size()) {
                case 1: return page("token-1", "a", "b");
                case 2: return page("token-2", "c", "d");
                default: return page(null, "e");
            }
        });
        final MirrorOptions options = new MirrorOptions();
        options.setPageSize(2);
        final MirrorContext context = TestMirror.context(source, mock(AmazonS3.class), options, 1);

        final List<KeyObjectSummary> summaries = new KeyObjectLister(context).list();

        assertEquals(5, summaries.size());
        assertEquals("a", summaries.get(0).getKey());
        assertEquals("e", summaries.get(4).getKey());
        assertEquals("etag-c", summaries.get(2).getETag());
        assertEquals(3, tokens.size());
        assertNull(tokens.get(0));
        assertEquals("token-1", tokens.get(1));
        assertEquals("token-2", tokens.get(2));
        assertEquals(5, context.getStats().getObjectsRead());
    }

    @Test
    public void testEmptyTokenEndsListing() throws Exception {
        final AmazonS3 source = mock(AmazonS3.class);
        when(source.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(page("", "only"));

        final List<KeyObjectSummary> summaries = new KeyObjectLister(TestMirror.context(source, mock(AmazonS3.class))).list();

        assertEquals(1, summaries.size());
        verify(source, times(1)).listObjectsV2(any(ListObjectsV2Request.class));
    }

    @Test
    public void testEmptyBucket() throws Exception {
        final AmazonS3 source = mock(AmazonS3.class);
        when(source.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(page(null));

        assertTrue(new KeyObjectLister(TestMirror.context(source, mock(AmazonS3.class))).list().isEmpty());
    }

    @Test
    public void testDefaultPageSize() throws Exception {
        final AmazonS3 source = mock(AmazonS3.class);
        when(source.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(page(null, "x"));

        new KeyObjectLister(TestMirror.context(source, mock(AmazonS3.class))).list();

        final ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(source).listObjectsV2(captor.capture());
        assertEquals(Integer.valueOf(MirrorConstants.DEFAULT_PAGE_SIZE), captor.getValue().getMaxKeys());
    }

    @Test
    public void testFailedPageFailsListing() throws Exception {
        final AmazonS3 source = mock(AmazonS3.class);
        when(source.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(page("token-1", "a", "b"))
                .thenThrow(InMemoryS3.s3Exception(503, "SlowDown", "Please reduce your request rate."));

        try {
            new KeyObjectLister(TestMirror.context(source, mock(AmazonS3.class))).list();
            fail("expected MirrorException");
        } catch (MirrorException e) {
            assertEquals(MirrorPhase.LISTING, e.getPhase());
            assertFalse(e.hasKey());
            assertTrue(e.getMessage().contains("page 2"));
        }
    }

    @Test
    public void testListsGivenClientAndBucket() throws Exception {
        final InMemoryS3.Store store = new InMemoryS3.Store();
        store.put("other-bucket", "k1", 1, "e1");
        store.put("other-bucket", "k2", 2, "e2");
        final MirrorContext context = TestMirror.context(store, 1);

        final List<KeyObjectSummary> summaries =
                new KeyObjectLister(context, context.getDestinationClient(), "other-bucket", 1).list();

        assertEquals(2, summaries.size());
        assertEquals(2, store.count("listObjectsV2"));
        assertTrue(store.getCalls().contains("destination:listObjectsV2"));
    }
}
