package com.deployguard.storage.impl;

import com.deployguard.config.IntegrityProperties;
import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.StorageFailureException;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.Result;
import io.minio.errors.MinioException;
import io.minio.messages.Item;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Object-store backend: every entry is its own object
 * {@code <prefix><streamId>/<ordinal, 12 digits>.json}, so listing a stream prefix in key order
 * yields append order. Ordinals are tracked per stream in this process.
 */
@Slf4j
public class MinioAppendOnlyStore implements AppendOnlyStore {

    private static final String CONTENT_TYPE = "application/json";

    private final MinioClient client;
    private final String bucket;
    private final String prefix;
    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private volatile boolean bucketReady;

    public MinioAppendOnlyStore(MinioClient client, IntegrityProperties.Minio props) {
        this.client = client;
        this.bucket = props.getBucket();
        this.prefix = props.getPrefix() == null ? "" : props.getPrefix();
    }

    /** Object key of entry {@code ordinal} of {@code streamId}. */
    public String objectKey(String streamId, long ordinal) {
        return String.format("%s%s/%012d.json", prefix, streamId, ordinal);
    }

    @Override
    public long append(String streamId, String payload) {
        AtomicLong counter = counters.computeIfAbsent(streamId, k -> new AtomicLong(-1));
        synchronized (counter) {
            ensureBucket();
            if (counter.get() < 0) {
                counter.set(listKeys(streamId).size());
            }
            long ordinal = counter.get();
            byte[] data = payload.getBytes(StandardCharsets.UTF_8);
            try (ByteArrayInputStream in = new ByteArrayInputStream(data)) {
                client.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(objectKey(streamId, ordinal))
                        .stream(in, data.length, -1)
                        .contentType(CONTENT_TYPE)
                        .build());
            } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
                throw new StorageFailureException(streamId, "putObject failed", e);
            }
            counter.incrementAndGet();
            return ordinal;
        }
    }

    @Override
    public List<String> readAll(String streamId) {
        List<String> out = new ArrayList<>();
        for (String key : listKeys(streamId)) {
            try (GetObjectResponse in = client.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(key).build())) {
                out.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
                throw new StorageFailureException(streamId, "getObject failed for " + key, e);
            }
        }
        return out;
    }

    @Override
    public List<String> streams(String streamPrefix) {
        String listPrefix = prefix + (streamPrefix == null ? "" : streamPrefix);
        TreeSet<String> ids = new TreeSet<>();
        for (String key : list(listPrefix, streamPrefix)) {
            int slash = key.lastIndexOf('/');
            if (slash > prefix.length()) ids.add(key.substring(prefix.length(), slash));
        }
        return List.copyOf(ids);
    }

    private List<String> listKeys(String streamId) {
        List<String> keys = list(prefix + streamId + "/", streamId);
        keys.sort(null);
        return keys;
    }

    private List<String> list(String listPrefix, String streamId) {
        List<String> keys = new ArrayList<>();
        Iterable<Result<Item>> it = client.listObjects(ListObjectsArgs.builder()
                .bucket(bucket)
                .prefix(listPrefix)
                .recursive(true)
                .build());
        for (Result<Item> res : it) {
            try {
                keys.add(res.get().objectName());
            } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
                throw new StorageFailureException(streamId, "listObjects failed", e);
            }
        }
        return keys;
    }

    private void ensureBucket() {
        if (bucketReady) return;
        try {
            boolean exists = client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (!exists) {
                client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created bucket '{}'", bucket);
            }
            bucketReady = true;
        } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
            throw new StorageFailureException(bucket, "bucket check failed", e);
        }
    }
}
