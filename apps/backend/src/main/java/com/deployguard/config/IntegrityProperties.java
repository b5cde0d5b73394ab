package com.deployguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "integrity")
public class IntegrityProperties {

    private Storage storage = new Storage();
    private Checksum checksum = new Checksum();
    private Audit audit = new Audit();
    private Anomaly anomaly = new Anomaly();
    private Baseline baseline = new Baseline();
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Storage {
        /** memory | filesystem | minio */
        private String type = "memory";
        /** Root directory of the filesystem backend. */
        private String directory = ".data-integrity";
        private Minio minio = new Minio();
    }

    @Data
    public static class Minio {
        private String endpoint;
        private String accessKey;
        private String secretKey;
        private String region = "us-east-1";
        private String bucket = "deployguard";
        /** Key prefix for every stream. */
        private String prefix = "streams/";
    }

    @Data
    public static class Checksum {
        /** Datasets with at least this many records are hashed in parallel. */
        private int parallelThreshold = 2048;
    }

    @Data
    public static class Audit {
        private String defaultActor = "deployguard";
        /** Risk score above which an alert is raised. */
        private double alertThreshold = 0.75;
        /** Risk score above which the alert is CRITICAL instead of HIGH. */
        private double criticalAlertThreshold = 0.9;
    }

    /** Thresholds in percent. A null critical threshold disables escalation for that metric. */
    @Data
    public static class Anomaly {
        private Double recordCountWarning = 50.0;
        private Double recordCountCritical = 100.0;
        private Double meanSizeWarning = 50.0;
        private Double meanSizeCritical;
        private Double fieldMeanWarning = 50.0;
        private Double fieldMeanCritical;
        private Double fieldStddevWarning = 50.0;
        private Double fieldStddevCritical;
    }

    @Data
    public static class Baseline {
        private long cacheMaxSize = 256;
        /** Keep full record snapshots next to the checksums so comparisons report field diffs. */
        private boolean storeRecords = true;
    }

    @Data
    public static class Pipeline {
        private String identityField = "id";
        /** Null or zero disables the timeout. */
        private Duration preTimeout;
        private Duration postTimeout;
        /** Treat records added outside the declared scope as scope violations. */
        private boolean unscopedAdditionsAreViolations = false;
    }
}
