package org.cobbzilla.s3s3sync;

import com.amazonaws.auth.AWSCredentials;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One side of the sync: credentials, region and bucket of a single S3 account.
 * Populated once from the configuration file and never changed afterwards.
 */
@NoArgsConstructor @AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MirrorAccount implements AWSCredentials {

    @JsonProperty("access_key") @Getter private String accessKey;
    @JsonProperty("secret_key") @Getter private String secretKey;
    @JsonProperty("region") @Getter private String region;
    @JsonProperty("bucket") @Getter private String bucket;

    // Only needed for S3-compatible services, AWS is addressed by region alone
    @JsonProperty("endpoint") @Getter private String endpoint;
    @JsonProperty("path_style_access") @Getter private boolean pathStyleAccess;

    @JsonIgnore @Override public String getAWSAccessKeyId() { return accessKey; }
    @JsonIgnore @Override public String getAWSSecretKey() { return secretKey; }

    public boolean hasEndpoint() { return endpoint != null && endpoint.trim().length() > 0; }

    public boolean hasRegion() { return region != null && region.trim().length() > 0; }

    public boolean isValid() {
        return isSet(accessKey) && isSet(secretKey) && isSet(bucket);
    }

    private static boolean isSet(String value) { return value != null && value.trim().length() > 0; }

    @Override
    public String toString() {
        // never print the secret key
        return "MirrorAccount{" +
                "bucket='" + bucket + '\'' +
                ", region='" + region + '\'' +
                ", endpoint='" + endpoint + '\'' +
                ", accessKey='" + accessKey + '\'' +
                '}';
    }
}
