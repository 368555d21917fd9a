package org.cobbzilla.s3s3sync;

/**
 * Raised while loading configuration or building clients, before anything is synchronized.
 */
public class MirrorConfigException extends RuntimeException {

    public MirrorConfigException(String message) { super(message); }

    public MirrorConfigException(String message, Throwable cause) { super(message, cause); }
}
