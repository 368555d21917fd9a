package org.cobbzilla.s3s3sync;

/**
 * Counter-style progress indicator, advanced once for each object whose outcome is final.
 * Callers serialize calls to {@link #advance()}.
 */
public interface MirrorProgress {

    MirrorProgress NONE = new MirrorProgress() {
        @Override public void start(long total) {}
        @Override public void advance() {}
        @Override public void finish() {}
    };

    void start(long total);

    void advance();

    void finish();
}
