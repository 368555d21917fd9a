package org.cobbzilla.s3s3sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.File;
import java.io.IOException;

import static org.cobbzilla.s3s3sync.MirrorConstants.DEFAULT_CONCURRENCY;
import static org.cobbzilla.s3s3sync.MirrorConstants.DEFAULT_MAX_RETRIES;

/**
 * The parsed configuration file. Concurrency and retry settings fall back to their defaults
 * whenever they are missing or not positive.
 */
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MirrorConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonProperty("source") @Getter private MirrorAccount source;
    @JsonProperty("destination") @Getter private MirrorAccount destination;

    @JsonProperty("concurrency") @Setter private int concurrency;
    @JsonProperty("max_retries") @Setter private int maxRetries;

    public MirrorConfig(MirrorAccount source, MirrorAccount destination, int concurrency, int maxRetries) {
        this.source = source;
        this.destination = destination;
        this.concurrency = concurrency;
        this.maxRetries = maxRetries;
    }

    public int getConcurrency() { return concurrency > 0 ? concurrency : DEFAULT_CONCURRENCY; }

    /** Total attempts per S3 request, including the first one. */
    public int getMaxRetries() { return maxRetries > 0 ? maxRetries : DEFAULT_MAX_RETRIES; }

    public static MirrorConfig load(File file) {
        if (!file.isFile()) throw new MirrorConfigException("Config file not found: " + file.getAbsolutePath());
        final MirrorConfig config;
        try {
            config = MAPPER.readValue(file, MirrorConfig.class);
        } catch (JsonProcessingException e) {
            throw new MirrorConfigException("Failed to parse config file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MirrorConfigException("Failed to read config file " + file + ": " + e.getMessage(), e);
        }
        config.validate();
        return config;
    }

    public static MirrorConfig parse(String json) {
        final MirrorConfig config;
        try {
            config = MAPPER.readValue(json, MirrorConfig.class);
        } catch (JsonProcessingException e) {
            throw new MirrorConfigException("Failed to parse config: " + e.getOriginalMessage(), e);
        }
        config.validate();
        return config;
    }

    public void validate() {
        if (source == null) throw new MirrorConfigException("No source account configured");
        if (destination == null) throw new MirrorConfigException("No destination account configured");
        if (!source.isValid()) throw new MirrorConfigException("Source account needs access_key, secret_key and bucket");
        if (!destination.isValid()) throw new MirrorConfigException("Destination account needs access_key, secret_key and bucket");
    }
}
