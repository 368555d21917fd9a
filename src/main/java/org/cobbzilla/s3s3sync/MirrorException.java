package org.cobbzilla.s3s3sync;

import lombok.Getter;

/**
 * A failure that stops the run. Carries the phase it happened in and, for object work, the key.
 */
public class MirrorException extends RuntimeException {

    @Getter private final MirrorPhase phase;
    @Getter private final String key;

    public MirrorException(MirrorPhase phase, String message, Throwable cause) {
        this(phase, null, message, cause);
    }

    public MirrorException(MirrorPhase phase, String key, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.key = key;
    }

    public boolean hasKey() { return key != null; }

    @Override
    public String toString() {
        final StringBuilder b = new StringBuilder("Failed during ").append(phase);
        if (hasKey()) b.append(" (key ").append(key).append(")");
        b.append(": ").append(getMessage());
        if (getCause() != null && getCause() != this) b.append(" [").append(getCause()).append("]");
        return b.toString();
    }
}
