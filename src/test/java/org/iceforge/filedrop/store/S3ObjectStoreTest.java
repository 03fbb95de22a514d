package org.iceforge.filedrop.store;

import org.iceforge.filedrop.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs {@link S3ObjectStore} against an in-memory bucket wired into a mocked {@link S3Client}.
 */
class S3ObjectStoreTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");
    private static final int FAKE_PAGE_SIZE = 2;

    @Mock private S3Client s3;

    private final TreeMap<String, byte[]> objects = new TreeMap<>();
    private final List<PutObjectRequest> puts = new ArrayList<>();
    private final Set<String> failingPuts = new HashSet<>();
    private final Set<String> failingDeletes = new HashSet<>();
    private final AtomicInteger listCalls = new AtomicInteger();

    private MutableClock clock;
    private S3ObjectStore store;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = MutableClock.startingAt(T0);
        store = new S3ObjectStore(s3, "bucket", "files/", "metadata/",
                new SecureRandomKeyGenerator(), clock, new ObjectLocks());

        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenAnswer(inv -> {
            PutObjectRequest req = inv.getArgument(0);
            RequestBody body = inv.getArgument(1);
            if (failingPuts.contains(req.key())) {
                throw S3Exception.builder().statusCode(500).message("put boom").build();
            }
            puts.add(req);
            objects.put(req.key(), body.contentStreamProvider().newStream().readAllBytes());
            return PutObjectResponse.builder().eTag("etag").build();
        });

        when(s3.getObject(any(GetObjectRequest.class))).thenAnswer(inv -> {
            GetObjectRequest req = inv.getArgument(0);
            byte[] data = objects.get(req.key());
            if (data == null) {
                throw NoSuchKeyException.builder().message("nope").build();
            }
            return new ResponseInputStream<>(GetObjectResponse.builder().build(), new ByteArrayInputStream(data));
        });

        when(s3.headObject(any(HeadObjectRequest.class))).thenAnswer(inv -> {
            HeadObjectRequest req = inv.getArgument(0);
            if (!objects.containsKey(req.key())) {
                throw NoSuchKeyException.builder().message("nope").build();
            }
            return HeadObjectResponse.builder().contentLength((long) objects.get(req.key()).length).build();
        });

        when(s3.deleteObject(any(DeleteObjectRequest.class))).thenAnswer(inv -> {
            DeleteObjectRequest req = inv.getArgument(0);
            if (failingDeletes.contains(req.key())) {
                throw S3Exception.builder().statusCode(500).message("delete boom").build();
            }
            objects.remove(req.key());
            return DeleteObjectResponse.builder().build();
        });

        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenAnswer(inv -> {
            ListObjectsV2Request req = inv.getArgument(0);
            listCalls.incrementAndGet();
            List<String> matching = objects.keySet().stream()
                    .filter(k -> k.startsWith(req.prefix()))
                    .toList();
            int from = req.continuationToken() == null ? 0 : Integer.parseInt(req.continuationToken());
            int to = Math.min(from + FAKE_PAGE_SIZE, matching.size());
            List<S3Object> page = matching.subList(from, to).stream()
                    .map(k -> S3Object.builder().key(k).size((long) objects.get(k).length).build())
                    .toList();
            boolean truncated = to < matching.size();
            return ListObjectsV2Response.builder()
                    .contents(page)
                    .isTruncated(truncated)
                    .nextContinuationToken(truncated ? String.valueOf(to) : null)
                    .build();
        });
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private S3ObjectStore fixedKeyStore(String publicKey, String privateKey) {
        return new S3ObjectStore(s3, "bucket", "files/", "metadata/",
                () -> new StoreModels.KeyPair(publicKey, privateKey), clock, new ObjectLocks());
    }

    @Test
    void constructor_rejectsSharedPrefix() {
        assertThrows(StoreConfigurationException.class,
                () -> new S3ObjectStore(s3, "bucket", "data/", "data/"));
    }

    @Test
    void put_writesContentAndTwoMetadataDocuments() {
        StoreModels.KeyPair keys = store.put(bytes("hello"), "résumé.pdf", "application/pdf");

        assertArrayEquals(bytes("hello"), objects.get("files/" + keys.publicKey()));
        assertTrue(objects.containsKey("metadata/" + keys.publicKey() + ".json"));
        assertTrue(objects.containsKey("metadata/" + keys.privateKey() + ".json"));
        assertEquals(3, objects.size());

        PutObjectRequest contentPut = puts.get(0);
        assertEquals("bucket", contentPut.bucket());
        assertEquals("application/pdf", contentPut.contentType());
        assertEquals("r%C3%A9sum%C3%A9.pdf", contentPut.metadata().get("originalname"));
        assertEquals("application/json", puts.get(1).contentType());

        ObjectMetadata m = MetadataCodec.decode(objects.get("metadata/" + keys.privateKey() + ".json"));
        assertEquals(keys.publicKey(), m.publicKey());
        assertEquals("résumé.pdf", m.originalName());
        assertEquals(T0, m.createdAt());
        assertNull(m.lastAccessed());
        assertEquals(5L, m.fileSize());
    }

    @Test
    void put_failureOnSecondCopy_rollsBackEverything() {
        S3ObjectStore fixed = fixedKeyStore("pub01", "priv01");
        failingPuts.add("metadata/priv01.json");

        StoreException ex = assertThrows(StoreException.class,
                () -> fixed.put(bytes("x"), "x.txt", "text/plain"));

        assertTrue(ex.getMessage().contains("S3 put failed"));
        assertTrue(objects.isEmpty(), "partial writes must be removed, found " + objects.keySet());
    }

    @Test
    void get_returnsContentAndMirrorsLastAccessed() {
        StoreModels.KeyPair keys = store.put(bytes("payload"), "p.bin", "application/octet-stream");
        clock.advance(Duration.ofHours(3));

        StoreModels.StoredObject got = store.get(keys.publicKey());

        assertArrayEquals(bytes("payload"), got.content());
        assertEquals("application/octet-stream", got.contentType());
        assertEquals("p.bin", got.originalName());

        byte[] publicCopy = objects.get("metadata/" + keys.publicKey() + ".json");
        byte[] privateCopy = objects.get("metadata/" + keys.privateKey() + ".json");
        assertArrayEquals(publicCopy, privateCopy);
        assertEquals(T0.plus(Duration.ofHours(3)), MetadataCodec.decode(publicCopy).lastAccessed());
    }

    @Test
    void get_unknownOrPrivateKey_isNotFound() {
        StoreModels.KeyPair keys = store.put(bytes("x"), "x", "text/plain");

        assertThrows(ObjectNotFoundException.class, () -> store.get("nonexistent-key"));
        assertThrows(ObjectNotFoundException.class, () -> store.get(keys.privateKey()));
    }

    @Test
    void get_generic404_isNotFound() {
        doThrow(S3Exception.builder().statusCode(404).message("not found").build())
                .when(s3).getObject(any(GetObjectRequest.class));

        assertThrows(ObjectNotFoundException.class, () -> store.get("abc123"));
    }

    @Test
    void get_serverError_isStoreFailure() {
        doThrow(S3Exception.builder().statusCode(503).message("slow down").build())
                .when(s3).getObject(any(GetObjectRequest.class));

        assertThrows(StoreException.class, () -> store.get("abc123"));
    }

    @Test
    void get_contentMissing_isStoreFailure() {
        StoreModels.KeyPair keys = store.put(bytes("x"), "x", "text/plain");
        objects.remove("files/" + keys.publicKey());

        assertThrows(StoreException.class, () -> store.get(keys.publicKey()));
    }

    @Test
    void get_malformedKey_neverReachesS3() {
        assertThrows(InvalidKeyException.class, () -> store.get("../metadata/x"));
        verify(s3, never()).getObject(any(GetObjectRequest.class));
    }

    @Test
    void delete_removesAllThreeObjects_thenReturnsFalse() {
        StoreModels.KeyPair keys = store.put(bytes("x"), "x", "text/plain");

        assertTrue(store.delete(keys.privateKey()));
        assertTrue(objects.isEmpty());
        assertFalse(store.delete(keys.privateKey()));
        assertThrows(ObjectNotFoundException.class, () -> store.get(keys.publicKey()));
    }

    @Test
    void delete_withPublicKey_returnsFalseAndKeepsObject() {
        StoreModels.KeyPair keys = store.put(bytes("x"), "x", "text/plain");

        assertFalse(store.delete(keys.publicKey()));
        assertEquals(3, objects.size());
    }

    @Test
    void delete_contentRemovalFailure_stillSucceeds() {
        S3ObjectStore fixed = fixedKeyStore("pub02", "priv02");
        fixed.put(bytes("x"), "x", "text/plain");
        failingDeletes.add("files/pub02");

        assertTrue(fixed.delete("priv02"));
        assertFalse(objects.containsKey("metadata/pub02.json"));
        assertFalse(objects.containsKey("metadata/priv02.json"));
    }

    @Test
    void delete_metadataLeftBehind_isStoreFailure_andRetryable() {
        S3ObjectStore fixed = fixedKeyStore("pub03", "priv03");
        fixed.put(bytes("x"), "x", "text/plain");
        failingDeletes.add("metadata/pub03.json");

        StoreException ex = assertThrows(StoreException.class, () -> fixed.delete("priv03"));
        assertEquals(1, ex.getSuppressed().length);
        assertTrue(objects.containsKey("metadata/priv03.json"), "private copy must survive for a retry");

        failingDeletes.clear();
        assertTrue(fixed.delete("priv03"));
        assertTrue(objects.isEmpty());
    }

    @Test
    void get_failedMirrorWrite_restoresPublicCopy() {
        S3ObjectStore fixed = fixedKeyStore("pubP", "privP");
        fixed.put(bytes("x"), "x", "text/plain");
        byte[] before = objects.get("metadata/pubP.json");
        clock.advance(Duration.ofHours(1));
        failingPuts.add("metadata/privP.json");

        assertThrows(StoreException.class, () -> fixed.get("pubP"));

        assertArrayEquals(before, objects.get("metadata/pubP.json"));
        assertEquals(fixed.getMetadata("pubP"), fixed.getMetadata("privP"));
        assertNull(fixed.getMetadata("pubP").lastAccessed());
    }

    @Test
    void getMetadata_readsEitherCopy() {
        StoreModels.KeyPair keys = store.put(bytes("x"), "x", "text/plain");

        assertEquals(store.getMetadata(keys.publicKey()), store.getMetadata(keys.privateKey()));
        assertEquals(T0, store.getMetadata(keys.publicKey()).createdAt());
    }

    @Test
    void listInactiveSince_followsContinuationTokens() {
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            expected.add(store.put(bytes("old" + i), "o", "text/plain").privateKey());
        }
        clock.advance(Duration.ofDays(40));
        store.put(bytes("new"), "n", "text/plain");
        objects.put("metadata/broken.json", bytes("{oops"));
        objects.put("metadata/notes.txt", bytes("ignored"));

        List<String> inactive = store.listInactiveSince(T0.plus(Duration.ofDays(1)));

        assertEquals(Set.copyOf(expected), Set.copyOf(inactive));
        assertEquals(3, inactive.size());
        // 8 metadata documents plus 2 strays at 2 per page
        assertEquals(5, listCalls.get());
    }

    @Test
    void listInactiveSince_listFailure_isStoreFailure() {
        doThrow(S3Exception.builder().statusCode(500).message("boom").build())
                .when(s3).listObjectsV2(any(ListObjectsV2Request.class));

        assertThrows(StoreException.class, () -> store.listInactiveSince(T0));
    }

    @Test
    void verifyBucket_existingBucket_doesNotCreate() {
        when(s3.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());

        store.verifyBucket(true);

        verify(s3, never()).createBucket(any(CreateBucketRequest.class));
    }

    @Test
    void verifyBucket_missingBucket_createsWhenAllowed() {
        when(s3.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(NoSuchBucketException.builder().message("no bucket").build());
        when(s3.createBucket(any(CreateBucketRequest.class))).thenReturn(CreateBucketResponse.builder().build());

        store.verifyBucket(true);

        verify(s3).createBucket(any(CreateBucketRequest.class));
    }

    @Test
    void verifyBucket_missingBucket_failsWhenCreationDisabled() {
        when(s3.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(404).message("no bucket").build());

        assertThrows(StoreConfigurationException.class, () -> store.verifyBucket(false));
        verify(s3, never()).createBucket(any(CreateBucketRequest.class));
    }

    @Test
    void verifyBucket_accessDenied_isConfigurationFailure() {
        when(s3.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

        assertThrows(StoreConfigurationException.class, () -> store.verifyBucket(true));
    }

    @Test
    void describe_namesBucket() {
        assertEquals("s3://bucket", store.describe());
    }
}
