package org.cobbzilla.s3s3sync;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor @ToString
public class KeyComparison {

    @Getter private final SyncDecision decision;

    // what the destination reported, unset when ABSENT
    @Getter private final long destinationSize;
    @Getter private final String destinationETag;

    public static KeyComparison absent() { return new KeyComparison(SyncDecision.ABSENT, -1, null); }

    public boolean needsCopy() { return decision.needsCopy(); }
}
