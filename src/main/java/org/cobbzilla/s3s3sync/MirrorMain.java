package org.cobbzilla.s3s3sync;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.regions.Regions;
import com.amazonaws.retry.PredefinedRetryPolicies;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.kohsuke.args4j.CmdLineParser;

import java.io.File;

import static com.amazonaws.SDKGlobalConfiguration.DISABLE_CERT_CHECKING_SYSTEM_PROPERTY;
import static org.cobbzilla.s3s3sync.MirrorConstants.*;

/**
 * Provides the "main" method. Responsible for parsing options, loading the configuration file and setting up
 * the MirrorMaster to manage the sync.
 */
@Slf4j
public class MirrorMain {

    @Getter @Setter private String[] args;

    @Getter private final MirrorOptions options = new MirrorOptions();

    private final CmdLineParser parser = new CmdLineParser(options);

    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler = new Thread.UncaughtExceptionHandler() {
        @Override public void uncaughtException(Thread t, Throwable e) {
            log.error("Uncaught Exception (thread "+t.getName()+"): "+e, e);
        }
    };

    @Getter private MirrorConfig config;
    @Getter private AmazonS3 sourceClient;
    @Getter private AmazonS3 destinationClient;
    @Getter private MirrorContext context;
    @Getter private MirrorMaster master;

    public MirrorMain(String[] args) { this.args = args; }

    public static void main (String[] args) {
        MirrorMain main = new MirrorMain(args);
        main.init();
        final MirrorResult result = main.run();
        System.exit(result.isSuccess() ? EXIT_OK : EXIT_SYNC_FAILED);
    }

    public MirrorResult run() {
        try {
            return master.mirror();
        } finally {
            context.getStats().logStats();
            Runtime.getRuntime().removeShutdownHook(context.getStats().getShutdownHook());
        }
    }

    public void init() {
        try {
            parseArguments();
        } catch (Exception e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            System.exit(EXIT_BOOTSTRAP_FAILED);
        }

        if (options.isDisableCertCheck())
            System.setProperty(DISABLE_CERT_CHECKING_SYSTEM_PROPERTY, "true");

        try {
            sourceClient = getAmazonS3Client(config.getSource());
            destinationClient = getAmazonS3Client(config.getDestination());
        } catch (RuntimeException e) {
            log.error("Failed to create S3 clients: {}", e.getMessage(), e);
            System.exit(EXIT_BOOTSTRAP_FAILED);
        }

        context = new MirrorContext(options, config, sourceClient, destinationClient);
        master = new MirrorMaster(context);

        log.info("Syncing {} to {} with concurrency {} and up to {} attempts per request{}.",
                config.getSource(), config.getDestination(), config.getConcurrency(), config.getMaxRetries(),
                options.isDryRun() ? " (dry run)" : "");

        Runtime.getRuntime().addShutdownHook(context.getStats().getShutdownHook());
        Thread.setDefaultUncaughtExceptionHandler(uncaughtExceptionHandler);
    }

    protected AmazonS3 getAmazonS3Client(MirrorAccount account) {
        if (!account.isValid()) {
            throw new MirrorConfigException("Account is invalid: " + account);
        }

        // max_retries counts attempts, the SDK counts retries after the first attempt
        final int retries = config.getMaxRetries() - 1;
        final ClientConfiguration clientConfiguration = new ClientConfiguration()
                .withMaxConnections(options.getMaxConnections())
                .withRetryPolicy(PredefinedRetryPolicies.getDefaultRetryPolicyWithCustomMaxRetries(retries))
                .withMaxErrorRetry(retries);

        final String region = account.hasRegion() ? account.getRegion() : Regions.US_EAST_1.getName();

        final AmazonS3ClientBuilder builder = AmazonS3ClientBuilder
                .standard()
                .withPathStyleAccessEnabled(account.isPathStyleAccess())
                .withClientConfiguration(clientConfiguration)
                .withCredentials(new AWSStaticCredentialsProvider(account));

        if (account.hasEndpoint()) {
            builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(account.getEndpoint(), region));
        } else {
            builder.withRegion(region);
        }
        return builder.build();
    }

    protected void parseArguments() throws Exception {
        parser.parseArgument(args);
        options.validate();

        config = MirrorConfig.load(new File(options.getConfigFile()));

        if (options.hasConcurrency()) config.setConcurrency(options.getConcurrency());
        if (options.hasMaxRetries()) config.setMaxRetries(options.getMaxRetries());
    }
}
