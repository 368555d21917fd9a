package org.cobbzilla.s3s3sync;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.cobbzilla.s3s3sync.MirrorPhase.BUCKET_CONFIG;
import static org.cobbzilla.s3s3sync.MirrorPhase.LISTING;
import static org.cobbzilla.s3s3sync.MirrorPhase.OBJECT;

/**
 * Runs a sync: bucket configuration first, then one {@link KeyCopyJob} per listed key.
 *
 * At most {@code concurrency} jobs hold an admission slot at any time. The first job that fails becomes the
 * run's error and stops admission of further keys, jobs already admitted still finish and are counted.
 */
@Slf4j
public class MirrorMaster implements KeyJob.Callback {

    private static final long AWAIT_LOG_SECONDS = 60;

    private final MirrorContext context;
    @Getter private final int concurrency;

    private final Semaphore slots;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<MirrorException> firstError = new AtomicReference<MirrorException>();

    public MirrorMaster(MirrorContext context) {
        this.context = context;
        this.concurrency = context.getConfig().getConcurrency();
        this.slots = new Semaphore(concurrency);
    }

    public boolean isCancelled() { return cancelled.get(); }

    public MirrorResult mirror() {
        final MirrorStats stats = context.getStats();

        try {
            new BucketConfigSync(context).sync();
        } catch (MirrorException e) {
            log.error("Failed to sync bucket configuration: {}", e.toString(), e.getCause());
            return MirrorResult.failure(0, stats, e);
        } catch (RuntimeException e) {
            // client-side SDK errors such as IllegalBucketNameException are not SdkClientExceptions
            log.error("Failed to sync bucket configuration: {}", e.toString(), e);
            return MirrorResult.failure(0, stats, new MirrorException(BUCKET_CONFIG, "Unexpected error syncing bucket configuration", e));
        }

        final List<KeyObjectSummary> summaries;
        try {
            summaries = new KeyObjectLister(context).list();
        } catch (MirrorException e) {
            log.error("Failed to list source objects: {}", e.toString(), e.getCause());
            return MirrorResult.failure(0, stats, e);
        } catch (RuntimeException e) {
            log.error("Failed to list source objects: {}", e.toString(), e);
            return MirrorResult.failure(0, stats, new MirrorException(LISTING, "Unexpected error listing source objects", e));
        }

        return mirror(summaries);
    }

    MirrorResult mirror(List<KeyObjectSummary> summaries) {
        final MirrorStats stats = context.getStats();
        final int total = summaries.size();
        final MirrorProgress progress = new LoggingMirrorProgress();
        stats.setProgress(progress);
        progress.start(total);

        final ExecutorService executor = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
        int submitted = 0;
        try {
            for (KeyObjectSummary summary : summaries) {
                if (cancelled.get()) break;
                try {
                    slots.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    fail(new MirrorException(OBJECT, summary.getKey(), "Interrupted while waiting to sync " + summary.getKey(), e));
                    break;
                }
                // a job may have failed while we were waiting for the slot
                if (cancelled.get()) {
                    slots.release();
                    break;
                }
                try {
                    executor.submit(getTask(summary));
                    submitted++;
                } catch (RejectedExecutionException e) {
                    slots.release();
                    fail(new MirrorException(OBJECT, summary.getKey(), "Could not schedule " + summary.getKey(), e));
                    break;
                }
            }
        } finally {
            // wait for the admitted jobs, they are never interrupted
            executor.shutdown();
            awaitTermination(executor);
            progress.finish();
        }

        if (submitted < total) log.warn("Stopped after scheduling {} of {} objects.", submitted, total);

        final MirrorException error = firstError.get();
        final MirrorResult result = error == null
                ? MirrorResult.success(total, stats)
                : MirrorResult.failure(total, stats, error);
        if (result.isSuccess()) log.info(result.toString()); else log.error(result.toString());
        return result;
    }

    protected KeyJob getTask(KeyObjectSummary summary) {
        return new KeyCopyJob(context, summary, this);
    }

    @Override
    public void done(KeyJob job, MirrorException error) {
        try {
            if (error != null) fail(error);
        } finally {
            slots.release();
        }
    }

    private void fail(MirrorException error) {
        if (firstError.compareAndSet(null, error)) {
            log.error("Stopping admission of new objects after error on {}.", error.hasKey() ? error.getKey() : error.getPhase());
        }
        cancelled.set(true);
    }

    private void awaitTermination(ExecutorService executor) {
        boolean interrupted = false;
        while (true) {
            try {
                if (executor.awaitTermination(AWAIT_LOG_SECONDS, TimeUnit.SECONDS)) break;
                log.info("Waiting for {} running object(s) to finish.", concurrency - slots.availablePermits());
            } catch (InterruptedException e) {
                // keep waiting, in-flight jobs must be accounted for
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override public Thread newThread(Runnable r) {
            final Thread t = new Thread(r, "s3s3sync-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
