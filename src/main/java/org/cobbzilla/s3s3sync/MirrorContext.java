package org.cobbzilla.s3s3sync;

import com.amazonaws.services.s3.AmazonS3;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
public class MirrorContext {

    @Getter private final MirrorOptions options;
    @Getter private final MirrorConfig config;
    @Getter private final AmazonS3 sourceClient;
    @Getter private final AmazonS3 destinationClient;
    @Getter private final MirrorStats stats = new MirrorStats();

    public String getSourceBucket() { return config.getSource().getBucket(); }

    public String getDestinationBucket() { return config.getDestination().getBucket(); }

    public boolean isVerbose() { return options.isVerbose(); }

    public boolean isDryRun() { return options.isDryRun(); }
}
