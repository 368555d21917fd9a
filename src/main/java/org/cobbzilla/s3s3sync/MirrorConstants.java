package org.cobbzilla.s3s3sync;

public class MirrorConstants {

    public static final long KB = 1024;
    public static final long MB = KB * 1024;
    public static final long GB = MB * 1024;

    public static final String DEFAULT_CONFIG_FILE = ".config.json";

    public static final int DEFAULT_CONCURRENCY = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final int DEFAULT_PAGE_SIZE = 1000;

    // log a progress line at most this often
    public static final int PROGRESS_LOG_PERCENT_STEP = 5;

    public static final int EXIT_OK = 0;
    public static final int EXIT_BOOTSTRAP_FAILED = 1;
    public static final int EXIT_SYNC_FAILED = 2;
}
