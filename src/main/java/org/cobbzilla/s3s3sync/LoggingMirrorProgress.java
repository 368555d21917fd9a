package org.cobbzilla.s3s3sync;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import static org.cobbzilla.s3s3sync.MirrorConstants.PROGRESS_LOG_PERCENT_STEP;

/**
 * Writes a progress line to the log each time another {@value MirrorConstants#PROGRESS_LOG_PERCENT_STEP}
 * percent of the objects are done.
 */
@Slf4j
public class LoggingMirrorProgress implements MirrorProgress {

    @Getter private long total;
    @Getter private long current;
    private int lastLoggedPercent;

    @Override
    public void start(long total) {
        this.total = total;
        this.current = 0;
        this.lastLoggedPercent = 0;
        log.info("Syncing objects: 0/{} (0%)", total);
    }

    @Override
    public void advance() {
        current++;
        final int percent = total == 0 ? 100 : (int) (current * 100 / total);
        if (percent - lastLoggedPercent >= PROGRESS_LOG_PERCENT_STEP || current == total) {
            lastLoggedPercent = percent;
            log.info("Syncing objects: {}/{} ({}%)", current, total, percent);
        }
    }

    @Override
    public void finish() {
        if (current != total) log.info("Syncing objects: stopped at {}/{}", current, total);
    }
}
