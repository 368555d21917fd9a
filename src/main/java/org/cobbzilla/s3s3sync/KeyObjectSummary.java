package org.cobbzilla.s3s3sync;

import com.amazonaws.services.s3.model.S3ObjectSummary;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Date;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@NoArgsConstructor @AllArgsConstructor
public class KeyObjectSummary implements Serializable {

    @Getter private String key;
    @Getter private long size;
    @Getter private String eTag;
    @Getter private Date lastModified;
    @Getter private String storageClass;

    public KeyObjectSummary(String key, long size, String eTag) {
        this(key, size, eTag, null, null);
    }

    private static Function<S3ObjectSummary, KeyObjectSummary> S3ObjectSummaryToKeyObjectSummaryFunction
            = new Function<S3ObjectSummary, KeyObjectSummary>() {

        public KeyObjectSummary apply(S3ObjectSummary input) {
            return new KeyObjectSummary(input.getKey(), input.getSize(), input.getETag(),
                    input.getLastModified(), input.getStorageClass());
        }
    };

    public static List<KeyObjectSummary> S3ObjectSummaryToKeyObject(List<S3ObjectSummary> input) {
        return input.stream().map(S3ObjectSummaryToKeyObjectSummaryFunction).collect(Collectors.<KeyObjectSummary>toList());
    }

    @Override
    public String toString() {
        return "KeyObjectSummary{" +
                "key='" + key + '\'' +
                ", size=" + size +
                ", eTag='" + eTag + '\'' +
                ", lastModified=" + lastModified +
                ", storageClass='" + storageClass + '\'' +
                '}';
    }
}
