package com.deployguard.storage.impl;

import com.deployguard.config.IntegrityProperties;
import com.deployguard.storage.StorageFailureException;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.Result;
import io.minio.errors.ServerException;
import io.minio.messages.Item;
import okhttp3.Headers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MinioAppendOnlyStoreTest {

    @Mock
    private MinioClient client;

    private MinioAppendOnlyStore store;

    @BeforeEach
    void setUp() {
        IntegrityProperties.Minio props = new IntegrityProperties.Minio();
        props.setBucket("integrity");
        props.setPrefix("streams/");
        store = new MinioAppendOnlyStore(client, props);
    }

    @Test
    void objectKeysAreZeroPaddedOrdinals() {
        assertEquals("streams/audit/c1/000000000007.json", store.objectKey("audit/c1", 7));
    }

    @Test
    void appendCreatesBucketOnceAndWritesSequentialKeys() throws Exception {
        when(client.bucketExists(any(BucketExistsArgs.class))).thenReturn(false);
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(List.of());
        when(client.putObject(any(PutObjectArgs.class))).thenReturn(null);

        assertEquals(0L, store.append("audit/c1", "{\"a\":1}"));
        assertEquals(1L, store.append("audit/c1", "{\"a\":2}"));

        verify(client, times(1)).makeBucket(any(MakeBucketArgs.class));
        ArgumentCaptor<PutObjectArgs> captor = ArgumentCaptor.forClass(PutObjectArgs.class);
        verify(client, times(2)).putObject(captor.capture());
        assertThat(captor.getAllValues()).extracting(PutObjectArgs::object)
                .containsExactly("streams/audit/c1/000000000000.json", "streams/audit/c1/000000000001.json");
        assertThat(captor.getAllValues()).allMatch(a -> a.bucket().equals("integrity"));
    }

    @Test
    void appendContinuesAfterExistingObjects() throws Exception {
        when(client.bucketExists(any(BucketExistsArgs.class))).thenReturn(true);
        List<Result<Item>> existing = List.of(
                item("streams/audit/c1/000000000000.json"),
                item("streams/audit/c1/000000000001.json"));
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(existing);
        when(client.putObject(any(PutObjectArgs.class))).thenReturn(null);

        assertEquals(2L, store.append("audit/c1", "{}"));
        verify(client, never()).makeBucket(any(MakeBucketArgs.class));
    }

    @Test
    void readAllReturnsObjectsInKeyOrder() throws Exception {
        List<Result<Item>> listed = List.of(
                item("streams/audit/c1/000000000001.json"),
                item("streams/audit/c1/000000000000.json"));
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(listed);
        when(client.getObject(any(GetObjectArgs.class))).thenAnswer(inv -> {
            GetObjectArgs args = inv.getArgument(0);
            String body = args.object().endsWith("0.json") ? "first" : "second";
            return new GetObjectResponse(Headers.of(), args.bucket(), null, args.object(),
                    new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        });

        assertThat(store.readAll("audit/c1")).containsExactly("first", "second");
    }

    @Test
    void streamsAreDerivedFromKeys() {
        List<Result<Item>> listed = List.of(
                item("streams/audit/a/000000000000.json"),
                item("streams/audit/a/000000000001.json"),
                item("streams/audit/b/000000000000.json"));
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(listed);

        assertThat(store.streams("audit/")).containsExactly("audit/a", "audit/b");
    }

    @Test
    void clientFailureBecomesStorageFailure() throws Exception {
        when(client.bucketExists(any(BucketExistsArgs.class))).thenReturn(true);
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(List.of());
        when(client.putObject(any(PutObjectArgs.class)))
                .thenThrow(new ServerException("boom", 500, "trace"));

        assertThatThrownBy(() -> store.append("audit/c1", "{}"))
                .isInstanceOf(StorageFailureException.class)
                .hasMessageContaining("audit/c1");
    }

    private static Result<Item> item(String key) {
        Item item = mock(Item.class);
        when(item.objectName()).thenReturn(key);
        return new Result<>(item);
    }
}
