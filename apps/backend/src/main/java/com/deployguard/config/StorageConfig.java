package com.deployguard.config;

import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.impl.FileSystemAppendOnlyStore;
import com.deployguard.storage.impl.InMemoryAppendOnlyStore;
import com.deployguard.storage.impl.MinioAppendOnlyStore;
import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Picks the append-only backend from {@code integrity.storage.type}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(IntegrityProperties.class)
public class StorageConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "integrity.storage", name = "type", havingValue = "memory", matchIfMissing = true)
    public AppendOnlyStore inMemoryAppendOnlyStore() {
        log.warn("Using in-memory append-only store: audit chains and baselines are lost on restart");
        return new InMemoryAppendOnlyStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "integrity.storage", name = "type", havingValue = "filesystem")
    public AppendOnlyStore fileSystemAppendOnlyStore(IntegrityProperties props) {
        return new FileSystemAppendOnlyStore(Path.of(props.getStorage().getDirectory()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "integrity.storage", name = "type", havingValue = "minio")
    public MinioClient minioClient(IntegrityProperties props) {
        IntegrityProperties.Minio m = props.getStorage().getMinio();
        return MinioClient.builder()
                .endpoint(m.getEndpoint())
                .credentials(m.getAccessKey(), m.getSecretKey())
                .region(m.getRegion())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "integrity.storage", name = "type", havingValue = "minio")
    public AppendOnlyStore minioAppendOnlyStore(MinioClient minioClient, IntegrityProperties props) {
        log.info("MinIO append-only store: bucket={} prefix={}",
                props.getStorage().getMinio().getBucket(), props.getStorage().getMinio().getPrefix());
        return new MinioAppendOnlyStore(minioClient, props.getStorage().getMinio());
    }
}
