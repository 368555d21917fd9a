package org.cobbzilla.s3s3sync;

import lombok.Getter;
import lombok.Setter;
import org.kohsuke.args4j.Option;

import static org.cobbzilla.s3s3sync.MirrorConstants.*;

public class MirrorOptions {

    public static final String USAGE_CONFIG = "Path to the JSON configuration file (default " + DEFAULT_CONFIG_FILE + ")";
    public static final String OPT_CONFIG = "-f";
    public static final String LONGOPT_CONFIG = "--config";
    @Option(name=OPT_CONFIG, aliases=LONGOPT_CONFIG, usage=USAGE_CONFIG)
    @Getter @Setter private String configFile = DEFAULT_CONFIG_FILE;

    public static final String USAGE_DRY_RUN = "Do not actually do anything, but show what would be done";
    public static final String OPT_DRY_RUN = "-n";
    public static final String LONGOPT_DRY_RUN = "--dry-run";
    @Option(name=OPT_DRY_RUN, aliases=LONGOPT_DRY_RUN, usage=USAGE_DRY_RUN)
    @Getter @Setter private boolean dryRun = false;

    public static final String USAGE_VERBOSE = "Verbose output";
    public static final String OPT_VERBOSE = "-v";
    public static final String LONGOPT_VERBOSE = "--verbose";
    @Option(name=OPT_VERBOSE, aliases=LONGOPT_VERBOSE, usage=USAGE_VERBOSE)
    @Getter @Setter private boolean verbose = false;

    public static final String USAGE_CONCURRENCY = "Maximum number of objects synced at the same time (overrides the config file, default " + DEFAULT_CONCURRENCY + ")";
    public static final String OPT_CONCURRENCY = "-t";
    public static final String LONGOPT_CONCURRENCY = "--concurrency";
    @Option(name=OPT_CONCURRENCY, aliases=LONGOPT_CONCURRENCY, usage=USAGE_CONCURRENCY)
    @Getter @Setter private int concurrency = 0;

    public boolean hasConcurrency() { return concurrency > 0; }

    public static final String USAGE_MAX_RETRIES = "Maximum number of attempts for each S3 request (overrides the config file, default " + DEFAULT_MAX_RETRIES + ")";
    public static final String OPT_MAX_RETRIES = "-r";
    public static final String LONGOPT_MAX_RETRIES = "--max-retries";
    @Option(name=OPT_MAX_RETRIES, aliases=LONGOPT_MAX_RETRIES, usage=USAGE_MAX_RETRIES)
    @Getter @Setter private int maxRetries = 0;

    public boolean hasMaxRetries() { return maxRetries > 0; }

    public static final String USAGE_MAX_CONNECTIONS = "Maximum number of connections to S3 per account (default " + DEFAULT_MAX_CONNECTIONS + ")";
    public static final String OPT_MAX_CONNECTIONS = "-m";
    public static final String LONGOPT_MAX_CONNECTIONS = "--max-connections";
    @Option(name=OPT_MAX_CONNECTIONS, aliases=LONGOPT_MAX_CONNECTIONS, usage=USAGE_MAX_CONNECTIONS)
    @Getter @Setter private int maxConnections = DEFAULT_MAX_CONNECTIONS;

    public static final String USAGE_PAGE_SIZE = "Number of keys requested per listing call (default " + DEFAULT_PAGE_SIZE + ")";
    public static final String OPT_PAGE_SIZE = "-P";
    public static final String LONGOPT_PAGE_SIZE = "--page-size";
    @Option(name=OPT_PAGE_SIZE, aliases=LONGOPT_PAGE_SIZE, usage=USAGE_PAGE_SIZE)
    @Getter @Setter private int pageSize = DEFAULT_PAGE_SIZE;

    private static final String USAGE_DISABLE_CERT_CHECK = "Disable checking of TLS certificates";
    public static final String LONGOPT_DISABLE_CERT_CHECK = "--disable-cert-check";
    @Option(name=LONGOPT_DISABLE_CERT_CHECK, usage=USAGE_DISABLE_CERT_CHECK)
    @Getter @Setter private boolean disableCertCheck = false;

    public void validate() {
        if (concurrency < 0) throw new IllegalArgumentException("Invalid value for " + LONGOPT_CONCURRENCY + ": " + concurrency);
        if (maxRetries < 0) throw new IllegalArgumentException("Invalid value for " + LONGOPT_MAX_RETRIES + ": " + maxRetries);
        if (maxConnections <= 0) throw new IllegalArgumentException("Invalid value for " + LONGOPT_MAX_CONNECTIONS + ": " + maxConnections);
        if (pageSize <= 0 || pageSize > 1000) throw new IllegalArgumentException("Invalid value for " + LONGOPT_PAGE_SIZE + " (1-1000): " + pageSize);
    }
}
