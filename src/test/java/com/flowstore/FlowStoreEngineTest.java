package com.flowstore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowstore.backup.Backup;
import com.flowstore.codec.CorruptRecordException;
import com.flowstore.codec.DecryptionException;
import com.flowstore.config.EngineConfig;
import com.flowstore.core.InMemoryRecordStore;
import com.flowstore.core.InvalidKeyException;
import com.flowstore.core.KeyPattern;
import com.flowstore.core.Record;
import com.flowstore.core.RecordMetadata;
import com.flowstore.core.RecordStore;
import com.flowstore.core.ScanTimeoutException;
import com.flowstore.core.StorageException;
import com.flowstore.core.TransientStorageException;
import com.flowstore.model.DeleteOptions;
import com.flowstore.model.DeleteResult;
import com.flowstore.model.EngineStats;
import com.flowstore.model.HealthCheckResult;
import com.flowstore.model.ScanOptions;
import com.flowstore.model.SetOptions;
import com.flowstore.model.WriteResult;
import com.flowstore.util.MetricsCollector;
import com.flowstore.wal.WalEntry;
import com.flowstore.wal.WalOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class FlowStoreEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<FlowStoreEngine> engines = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (FlowStoreEngine engine : engines) {
            engine.close();
        }
    }

    private static EngineConfig.Builder baseConfig() {
        return EngineConfig.builder()
            .encryptionKey("engine-test-key")
            .retryAttempts(3)
            .retryDelayMs(1);
    }

    private FlowStoreEngine engine(EngineConfig config) {
        return engine(config, new InMemoryRecordStore());
    }

    private FlowStoreEngine engine(EngineConfig config, RecordStore store) {
        FlowStoreEngine engine = new FlowStoreEngine(config, store, new MetricsCollector());
        engines.add(engine);
        return engine;
    }

    private FlowStoreEngine engine() {
        return engine(baseConfig().build());
    }

    private static ObjectNode user(String name, int age, String city) {
        return MAPPER.createObjectNode().put("name", name).put("age", age).put("city", city);
    }

    private static String repeated(char c, int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    public static class User {
        public String name;
        public int age;
        public String city;
    }

    @Nested
    class Lifecycle {

        @Test
        void firstOperation_startsEngine() {
            FlowStoreEngine engine = engine();
            assertThat(engine.isStarted()).isFalse();

            engine.set("k", "v");

            assertThat(engine.isStarted()).isTrue();
        }

        @Test
        void closedEngine_rejectsOperations() {
            FlowStoreEngine engine = engine();
            engine.set("k", "v");

            engine.close();

            assertThatThrownBy(() -> engine.get("k")).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> engine.set("k", "v2")).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void close_isIdempotent() {
            FlowStoreEngine engine = engine();
            engine.close();
            engine.close();
        }

        @Test
        void close_flushesWalToSink() {
            FlowStoreEngine engine = engine();
            List<WalEntry> delivered = new CopyOnWriteArrayList<>();
            engine.setWalSink(delivered::addAll);
            engine.set("a", 1);
            engine.set("b", 2);

            engine.close();

            assertThat(delivered).extracting(WalEntry::getKey).containsExactly("a", "b");
        }
    }

    @Nested
    class SetAndGet {

        @Test
        void putAndGet_basicOperation() {
            FlowStoreEngine engine = engine();
            ObjectNode value = user("Ada", 36, "London");

            WriteResult result = engine.set("user:1", value);

            assertThat(result.getKey()).isEqualTo("user:1");
            assertThat(result.getVersion()).isEqualTo(1);
            assertThat(result.isEncrypted()).isTrue();
            assertThat(result.getDurationMs()).isNotNegative();
            assertThat(engine.get("user:1")).isEqualTo(value);
        }

        @Test
        void get_absentKey_returnsNull() {
            assertThat(engine().get("missing")).isNull();
        }

        @Test
        void roundTrip_acrossOptionCombinations() {
            FlowStoreEngine engine = engine();
            JsonNode large = MAPPER.createObjectNode().put("blob", repeated('x', 12_000));
            JsonNode small = MAPPER.createObjectNode().put("n", 1);

            for (boolean compress : new boolean[]{true, false}) {
                for (boolean encrypt : new boolean[]{true, false}) {
                    SetOptions options = SetOptions.builder().compress(compress).encrypt(encrypt).build();
                    String suffix = compress + ":" + encrypt;

                    WriteResult largeResult = engine.set("large:" + suffix, large, options);
                    WriteResult smallResult = engine.set("small:" + suffix, small, options);

                    assertThat(largeResult.isCompressed()).isEqualTo(compress);
                    assertThat(largeResult.isEncrypted()).isEqualTo(encrypt);
                    assertThat(smallResult.isCompressed()).isFalse();
                    assertThat(engine.get("large:" + suffix)).isEqualTo(large);
                    assertThat(engine.get("small:" + suffix)).isEqualTo(small);
                }
            }
        }

        @Test
        void compressedPayload_isSmallerThanOriginal() {
            FlowStoreEngine engine = engine();
            JsonNode large = MAPPER.createObjectNode().put("blob", repeated('y', 12_000));

            WriteResult result = engine.set("big", large, SetOptions.builder().encrypt(false).build());

            assertThat(result.isCompressed()).isTrue();
            assertThat(result.getSize()).isLessThan(12_000);
            assertThat(engine.getStats().getCompression().getOperations()).isEqualTo(1);
            assertThat(engine.getStats().getCompression().getBytesSaved()).isPositive();
        }

        @Test
        void disabledFeatures_storePlainPayloads() {
            FlowStoreEngine engine = engine(baseConfig()
                .compressionEnabled(false)
                .encryptionEnabled(false)
                .build());
            JsonNode large = MAPPER.createObjectNode().put("blob", repeated('z', 12_000));

            WriteResult result = engine.set("big", large);

            assertThat(result.isCompressed()).isFalse();
            assertThat(result.isEncrypted()).isFalse();
            assertThat(engine.get("big")).isEqualTo(large);
        }

        @Test
        void nullValue_isStoredAsJsonNull() {
            FlowStoreEngine engine = engine();

            engine.set("nothing", (JsonNode) null);

            assertThat(engine.exists("nothing")).isTrue();
            assertThat(engine.get("nothing").isNull()).isTrue();
        }

        @Test
        void typedGet_convertsStoredValue() {
            FlowStoreEngine engine = engine();
            engine.set("user:1", user("Grace", 45, "Arlington"));

            User loaded = engine.get("user:1", User.class);

            assertThat(loaded.name).isEqualTo("Grace");
            assertThat(loaded.age).isEqualTo(45);
            assertThat(engine.get("user:2", User.class)).isNull();
        }

        @Test
        void pojoValue_isStoredAsJson() {
            FlowStoreEngine engine = engine();
            User user = new User();
            user.name = "Linus";
            user.age = 28;
            user.city = "Helsinki";

            engine.set("user:1", user);

            assertThat(engine.get("user:1").get("city").asText()).isEqualTo("Helsinki");
        }

        @Test
        void versions_increasePerWrite() {
            FlowStoreEngine engine = engine();

            assertThat(engine.set("k", 1).getVersion()).isEqualTo(1);
            assertThat(engine.set("k", 2).getVersion()).isEqualTo(2);
            assertThat(engine.set("k", 3).getVersion()).isEqualTo(3);
        }

        @Test
        void concurrentWrites_produceDistinctVersions() throws InterruptedException {
            FlowStoreEngine engine = engine(baseConfig().encryptionEnabled(false).build());
            int threads = 8;
            int writesPerThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch latch = new CountDownLatch(threads);
            Set<Long> versions = ConcurrentHashMap.newKeySet();

            for (int t = 0; t < threads; t++) {
                final int thread = t;
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < writesPerThread; i++) {
                            versions.add(engine.set("counter", thread * 1000 + i).getVersion());
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            assertThat(versions).hasSize(threads * writesPerThread);
            assertThat(engine.set("counter", -1).getVersion()).isEqualTo(threads * writesPerThread + 1);
        }

        @Test
        void cachedAndUncachedEngines_returnSameValues() {
            FlowStoreEngine cached = engine();
            FlowStoreEngine uncached = engine(baseConfig().cacheEnabled(false).build());
            ObjectNode value = user("Ken", 70, "Murray Hill");

            cached.set("u", value);
            uncached.set("u", value);
            cached.set("u", user("Ken", 71, "Murray Hill"));
            uncached.set("u", user("Ken", 71, "Murray Hill"));

            assertThat(cached.get("u")).isEqualTo(uncached.get("u"));
            assertThat(cached.get("u").get("age").asInt()).isEqualTo(71);
            assertThat(cached.getMetrics().getCacheHits()).isPositive();
            assertThat(uncached.getMetrics().getCacheHits()).isZero();
        }
    }

    @Nested
    class Validation {

        @Test
        void emptyOrNullKey_isRejected() {
            FlowStoreEngine engine = engine();

            assertThatThrownBy(() -> engine.set("", "v")).isInstanceOf(InvalidKeyException.class);
            assertThatThrownBy(() -> engine.set(null, "v")).isInstanceOf(InvalidKeyException.class);
            assertThatThrownBy(() -> engine.get("")).isInstanceOf(InvalidKeyException.class);
            assertThatThrownBy(() -> engine.delete("")).isInstanceOf(InvalidKeyException.class);
        }

        @Test
        void overlongKey_isRejected() {
            FlowStoreEngine engine = engine();
            String atLimit = repeated('k', 250);
            String overLimit = repeated('k', 251);

            engine.set(atLimit, "ok");

            assertThat(engine.get(atLimit).asText()).isEqualTo("ok");
            assertThatThrownBy(() -> engine.set(overLimit, "v"))
                .isInstanceOf(InvalidKeyException.class)
                .hasMessageContaining("251");
        }

        @Test
        void exists_invalidKey_returnsFalse() {
            FlowStoreEngine engine = engine();

            assertThat(engine.exists("")).isFalse();
            assertThat(engine.exists(null)).isFalse();
        }

        @Test
        void invalidKey_isNotRetried() {
            FlowStoreEngine engine = engine();

            assertThatThrownBy(() -> engine.set("", "v")).isInstanceOf(InvalidKeyException.class);

            assertThat(engine.getMetrics().getTotalRetries()).isZero();
            assertThat(engine.getRecentErrors(10)).hasSize(1);
        }
    }

    @Nested
    class Deletes {

        @Test
        void delete_removesValue() {
            FlowStoreEngine engine = engine();
            engine.set("k", "v");

            DeleteResult result = engine.delete("k");

            assertThat(result.isExisted()).isTrue();
            assertThat(engine.get("k")).isNull();
            assertThat(engine.exists("k")).isFalse();
        }

        @Test
        void delete_isIdempotent() {
            FlowStoreEngine engine = engine();
            engine.set("k", "v");

            engine.delete("k");
            DeleteResult second = engine.delete("k");
            DeleteResult never = engine.delete("never-written");

            assertThat(second.isExisted()).isFalse();
            assertThat(never.isExisted()).isFalse();
        }

        @Test
        void deleteOfAbsentKey_isNotLogged() {
            FlowStoreEngine engine = engine();
            engine.set("k", "v");
            engine.delete("k");
            int walSize = engine.getWriteAheadLog().size();

            engine.delete("k");

            assertThat(engine.getWriteAheadLog().size()).isEqualTo(walSize);
            assertThat(engine.getWriteAheadLog().entries()).extracting(WalEntry::getOperation)
                .containsExactly(WalOperation.SET, WalOperation.DELETE);
        }

        @Test
        void delete_removesFromQueries() {
            FlowStoreEngine engine = engine();
            engine.set("user:1", user("Ada", 36, "London"));

            engine.delete("user:1");

            assertThat(engine.query(Map.of("city", "London"))).isEmpty();
        }
    }

    @Nested
    class CompareAndSet {

        @Test
        void expectedZero_writesOnlyWhenAbsent() {
            FlowStoreEngine engine = engine();
            JsonNode first = MAPPER.valueToTree("first");

            Optional<WriteResult> created = engine.compareAndSet("k", 0, first);
            Optional<WriteResult> conflict = engine.compareAndSet("k", 0, MAPPER.valueToTree("second"));

            assertThat(created).hasValueSatisfying(r -> assertThat(r.getVersion()).isEqualTo(1));
            assertThat(conflict).isEmpty();
            assertThat(engine.get("k")).isEqualTo(first);
        }

        @Test
        void matchingVersion_writes() {
            FlowStoreEngine engine = engine();
            long version = engine.set("k", "v1").getVersion();

            Optional<WriteResult> result = engine.compareAndSet("k", version, MAPPER.valueToTree("v2"));

            assertThat(result).hasValueSatisfying(r -> assertThat(r.getVersion()).isEqualTo(version + 1));
            assertThat(engine.get("k").asText()).isEqualTo("v2");
        }

        @Test
        void staleVersion_isRejected() {
            FlowStoreEngine engine = engine();
            engine.set("k", "v1");
            engine.set("k", "v2");

            Optional<WriteResult> result = engine.compareAndSet("k", 1, MAPPER.valueToTree("v3"));

            assertThat(result).isEmpty();
            assertThat(engine.get("k").asText()).isEqualTo("v2");
        }

        @Test
        void negativeVersion_isRejected() {
            FlowStoreEngine engine = engine();

            assertThatThrownBy(() -> engine.compareAndSet("k", -1, MAPPER.valueToTree("v")))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Batch {

        @Test
        void mset_thenMget() {
            FlowStoreEngine engine = engine();
            Map<String, Object> entries = new LinkedHashMap<>();
            entries.put("a", 1);
            entries.put("b", "two");
            entries.put("c", user("Ada", 36, "London"));

            Map<String, WriteResult> written = engine.mset(entries);
            Map<String, JsonNode> read = engine.mget(List.of("a", "b", "c", "d"));

            assertThat(written).containsOnlyKeys("a", "b", "c");
            assertThat(read.get("a").asInt()).isEqualTo(1);
            assertThat(read.get("b").asText()).isEqualTo("two");
            assertThat(read.get("c").get("name").asText()).isEqualTo("Ada");
            assertThat(read).containsEntry("d", null);
            assertThat(read.keySet()).containsExactly("a", "b", "c", "d");
        }

        @Test
        void mset_invalidKey_writesNothing() {
            FlowStoreEngine engine = engine();
            Map<String, Object> entries = new LinkedHashMap<>();
            entries.put("good", 1);
            entries.put("", 2);

            assertThatThrownBy(() -> engine.mset(entries)).isInstanceOf(InvalidKeyException.class);

            assertThat(engine.exists("good")).isFalse();
        }
    }

    @Nested
    class Scans {

        @Test
        void keys_matchesPatternInSortedOrder() {
            FlowStoreEngine engine = engine();
            engine.set("user:2", 2);
            engine.set("user:10", 10);
            engine.set("user:1", 1);
            engine.set("order:1", 1);

            assertThat(engine.keys("user:*")).containsExactly("user:1", "user:10", "user:2");
            assertThat(engine.keys("user:?")).containsExactly("user:1", "user:2");
            assertThat(engine.keys()).hasSize(4);
            assertThat(engine.keys("nothing*")).isEmpty();
        }

        @Test
        void keys_paginates() {
            FlowStoreEngine engine = engine();
            for (int i = 0; i < 10; i++) {
                engine.set("k" + i, i);
            }

            List<String> page = engine.keys("k*", ScanOptions.builder().offset(3).limit(4).build());
            List<String> pastEnd = engine.keys("k*", ScanOptions.builder().offset(20).build());

            assertThat(page).containsExactly("k3", "k4", "k5", "k6");
            assertThat(pastEnd).isEmpty();
        }

        @Test
        void keys_withTimeout_throwsWhenExceeded() {
            FlowStoreEngine engine = engine(baseConfig().encryptionEnabled(false).build());
            for (int i = 0; i < 500; i++) {
                engine.set("key:" + i, i);
            }
            ScanOptions options = ScanOptions.builder().timeout(Duration.ofNanos(1)).build();

            assertThatThrownBy(() -> engine.keys("*", options)).isInstanceOf(ScanTimeoutException.class);
            assertThat(engine.getMetrics().getTotalRetries()).isZero();
        }

        @Test
        void keys_withGenerousTimeout_completes() {
            FlowStoreEngine engine = engine();
            engine.set("a", 1);

            ScanOptions options = ScanOptions.builder().timeout(Duration.ofSeconds(10)).build();

            assertThat(engine.keys("*", options)).containsExactly("a");
        }

        @Test
        void keys_storeFailure_returnsEmptyList() {
            FlakyRecordStore store = new FlakyRecordStore();
            FlowStoreEngine engine = engine(baseConfig().build(), store);
            engine.set("a", 1);
            store.failScans = true;

            assertThat(engine.keys()).isEmpty();
            assertThat(engine.getMetrics().getTotalErrors()).isEqualTo(1);
        }

        @Test
        void query_matchesAllFilterFields() {
            FlowStoreEngine engine = engine();
            engine.set("user:1", user("Ada", 36, "London"));
            engine.set("user:2", user("Alan", 41, "London"));
            engine.set("user:3", user("Grace", 36, "Arlington"));

            List<JsonNode> londoners = engine.query(Map.of("city", "London"));
            List<JsonNode> both = engine.query(Map.of("city", "London", "age", 36));

            assertThat(londoners).extracting(n -> n.get("name").asText()).containsExactly("Ada", "Alan");
            assertThat(both).extracting(n -> n.get("name").asText()).containsExactly("Ada");
        }

        @Test
        void query_numbersCompareByValue() {
            FlowStoreEngine engine = engine();
            engine.set("user:1", user("Ada", 37, "London"));

            assertThat(engine.query(Map.of("age", 37.0))).hasSize(1);
            assertThat(engine.query(Map.of("age", 37))).hasSize(1);
            assertThat(engine.query(Map.of("age", "37"))).isEmpty();
        }

        @Test
        void query_reflectsOverwrites() {
            FlowStoreEngine engine = engine();
            engine.set("user:1", user("Ada", 36, "London"));

            engine.set("user:1", user("Ada", 36, "Paris"));

            assertThat(engine.query(Map.of("city", "London"))).isEmpty();
            assertThat(engine.query(Map.of("city", "Paris"))).hasSize(1);
        }

        @Test
        void query_withoutIndexing_scansStore() {
            FlowStoreEngine engine = engine(baseConfig().indexingEnabled(false).build());
            engine.set("user:1", user("Ada", 36, "London"));
            engine.set("user:2", user("Alan", 41, "Wilmslow"));

            List<JsonNode> result = engine.query(Map.of("city", "Wilmslow"));

            assertThat(result).extracting(n -> n.get("name").asText()).containsExactly("Alan");
        }

        @Test
        void query_nonIndexableFilter_fallsBackToScan() {
            FlowStoreEngine engine = engine();
            ObjectNode withTags = user("Ada", 36, "London");
            withTags.putArray("tags").add("math");
            engine.set("user:1", withTags);
            engine.set("user:2", user("Alan", 41, "London"));

            ObjectNode filter = MAPPER.createObjectNode();
            filter.putArray("tags").add("math");

            assertThat(engine.query(filter, ScanOptions.defaults())).hasSize(1);
        }

        @Test
        void query_appliesOffsetAndLimit() {
            FlowStoreEngine engine = engine();
            for (int i = 1; i <= 5; i++) {
                engine.set("user:" + i, user("u" + i, 30, "Oslo"));
            }

            List<JsonNode> page = engine.query(Map.of("city", "Oslo"),
                ScanOptions.builder().offset(1).limit(2).build());

            assertThat(page).extracting(n -> n.get("name").asText()).containsExactly("u2", "u3");
            assertThat(engine.getMetrics().getTotalQueryOps()).isEqualTo(1);
        }

        @Test
        void nonFiniteNumbers_areStoredButNotIndexed() {
            FlowStoreEngine engine = engine();
            Map<String, Object> reading = new LinkedHashMap<>();
            reading.put("city", "Oslo");
            reading.put("ratio", Double.POSITIVE_INFINITY);
            ObjectNode sensor = MAPPER.createObjectNode().put("city", "Oslo").put("score", Double.NaN);

            engine.set("reading:1", reading);
            engine.set("sensor:1", sensor);

            assertThat(engine.exists("reading:1")).isTrue();
            assertThat(engine.exists("sensor:1")).isTrue();
            assertThat(engine.query(Map.of("city", "Oslo"))).hasSize(2);
            assertThat(engine.getStats().getStorage().getIndexedFields()).isEqualTo(1);
            assertThat(engine.getWriteAheadLog().size()).isEqualTo(2);
        }

        @Test
        void maintenance_keepsIndexEntriesOfKeyRewrittenMidCollection() {
            InterleavingRecordStore store = new InterleavingRecordStore();
            FlowStoreEngine engine = engine(baseConfig().build(), store);
            engine.set("u:1", MAPPER.createObjectNode().put("theme", "light"));
            engine.set("u:2", MAPPER.createObjectNode().put("theme", "dark"));
            // Delete u:1 before the collector checks it, then rewrite it before the collector acts
            store.interleaveOnce("u:1",
                () -> engine.delete("u:1"),
                () -> engine.set("u:1", MAPPER.createObjectNode().put("theme", "dark")));

            engine.runMaintenance();

            assertThat(store.interleaved()).isTrue();
            assertThat(engine.query(Map.of("theme", "dark"))).hasSize(2);
            assertThat(engine.getRecentErrors(10)).isEmpty();
        }

        @Test
        void keysAndQuery_hideHealthCheckKeys() {
            FlowStoreEngine engine = engine();
            engine.set("user:1", user("Ada", 36, "London"));
            engine.set(FlowStoreEngine.HEALTH_KEY_PREFIX + "99", user("check", 0, "London"));

            assertThat(engine.keys()).containsExactly("user:1");
            assertThat(engine.query(Map.of("city", "London")))
                .extracting(n -> n.get("name").asText()).containsExactly("Ada");
            assertThat(engine.query(Map.of("age", 0))).isEmpty();
        }

        @Test
        void query_withTimeout_throwsWhenExceeded() {
            FlowStoreEngine engine = engine();
            for (int i = 0; i < 50; i++) {
                engine.set("user:" + i, user("u" + i, 30, "Oslo"));
            }
            ScanOptions options = ScanOptions.builder().timeout(Duration.ofNanos(1)).build();

            assertThatThrownBy(() -> engine.query(Map.of("city", "Oslo"), options))
                .isInstanceOf(ScanTimeoutException.class);
        }
    }

    @Nested
    class Corruption {

        private FlowStoreEngine engine;
        private InMemoryRecordStore store;

        private void setUpEngine() {
            store = new InMemoryRecordStore();
            engine = engine(baseConfig().cacheEnabled(false).build(), store);
        }

        private void flipByte(String key, int offset) {
            Record original = store.get(key).orElseThrow();
            byte[] payload = original.getPayload();
            payload[offset] ^= 0x5A;
            store.put(key, new Record(payload, original.getMetadata()));
        }

        private void truncate(String key, int bytes) {
            Record original = store.get(key).orElseThrow();
            byte[] payload = Arrays.copyOf(original.getPayload(), original.getSize() - bytes);
            RecordMetadata m = original.getMetadata();
            RecordMetadata shortened = new RecordMetadata(m.getOriginalSize(), m.isCompressed(), m.isEncrypted(),
                m.getAlgorithm(), m.getCreatedAt(), m.getUpdatedAt(), m.getVersion(), payload.length);
            store.put(key, new Record(payload, shortened));
        }

        @Test
        void tamperedCiphertext_throwsDecryptionException() {
            setUpEngine();
            engine.set("secret", user("Ada", 36, "London"));
            flipByte("secret", store.get("secret").orElseThrow().getSize() - 1);

            assertThatThrownBy(() -> engine.get("secret")).isInstanceOf(DecryptionException.class);
            assertThat(engine.getMetrics().getDecryptionFailures()).isEqualTo(1);
            assertThat(engine.getMetrics().getTotalRetries()).isZero();
        }

        @Test
        void garbledPlainPayload_throwsCorruptRecordException() {
            setUpEngine();
            engine.set("plain", user("Ada", 36, "London"), SetOptions.builder().encrypt(false).build());
            flipByte("plain", 0);

            assertThatThrownBy(() -> engine.get("plain"))
                .isInstanceOf(CorruptRecordException.class)
                .isNotInstanceOf(DecryptionException.class);
            assertThat(engine.getMetrics().getCorruptRecords()).isEqualTo(1);
            assertThat(engine.getRecentErrors(5)).extracting(e -> e.getKey()).contains("plain");
        }

        @Test
        void truncatedPayloadWithMatchingMetadata_throwsCorruptRecordException() {
            setUpEngine();
            engine.set("sealed", user("Ada", 36, "London"));
            engine.set("plain", user("Alan", 41, "Wilmslow"), SetOptions.builder().encrypt(false).build());
            truncate("sealed", 5);
            truncate("plain", 5);

            assertThatThrownBy(() -> engine.get("sealed")).isInstanceOf(DecryptionException.class);
            assertThatThrownBy(() -> engine.get("plain"))
                .isInstanceOf(CorruptRecordException.class)
                .isNotInstanceOf(DecryptionException.class);
            assertThat(engine.getMetrics().getCorruptRecords()).isEqualTo(2);
            assertThat(engine.getMetrics().getTotalRetries()).isZero();
        }

        @Test
        void query_skipsCorruptRecords() {
            setUpEngine();
            engine.set("user:1", user("Ada", 36, "London"));
            engine.set("user:2", user("Alan", 41, "London"), SetOptions.builder().encrypt(false).build());
            flipByte("user:2", 0);

            List<JsonNode> result = engine.query(Map.of("city", "London"));

            assertThat(result).extracting(n -> n.get("name").asText()).containsExactly("Ada");
            assertThat(engine.getMetrics().getCorruptRecords()).isEqualTo(1);
        }
    }

    @Nested
    class Retries {

        @Test
        void transientReadFailure_isRetried() {
            FlakyRecordStore store = new FlakyRecordStore();
            FlowStoreEngine engine = engine(baseConfig().cacheEnabled(false).build(), store);
            engine.set("k", "v");
            store.getFailures.set(2);

            assertThat(engine.get("k").asText()).isEqualTo("v");
            assertThat(engine.getMetrics().getTotalRetries()).isEqualTo(2);
        }

        @Test
        void persistentReadFailure_returnsNull() {
            FlakyRecordStore store = new FlakyRecordStore();
            FlowStoreEngine engine = engine(baseConfig().cacheEnabled(false).build(), store);
            engine.set("k", "v");
            store.getFailures.set(100);

            assertThat(engine.get("k")).isNull();
            assertThat(engine.getMetrics().getTotalErrors()).isEqualTo(1);
            assertThat(engine.getRecentErrors(1)).extracting(e -> e.getOperation()).containsExactly("get");
        }

        @Test
        void persistentWriteFailure_propagates() {
            FlakyRecordStore store = new FlakyRecordStore();
            FlowStoreEngine engine = engine(baseConfig().build(), store);
            store.putFailures.set(100);

            assertThatThrownBy(() -> engine.set("k", "v")).isInstanceOf(TransientStorageException.class);
            assertThat(engine.getMetrics().getTotalRetries()).isEqualTo(2);
            assertThat(engine.exists("k")).isFalse();
        }

        @Test
        void transientWriteFailure_succeedsOnRetry() {
            FlakyRecordStore store = new FlakyRecordStore();
            FlowStoreEngine engine = engine(baseConfig().build(), store);
            store.putFailures.set(1);

            WriteResult result = engine.set("k", "v");

            assertThat(result.getVersion()).isEqualTo(1);
            assertThat(engine.get("k").asText()).isEqualTo("v");
        }

        @Test
        void exists_storeFailure_returnsFalse() {
            FlakyRecordStore store = new FlakyRecordStore();
            FlowStoreEngine engine = engine(baseConfig().cacheEnabled(false).build(), store);
            engine.set("k", "v");
            store.getFailures.set(100);

            assertThat(engine.exists("k")).isFalse();
        }
    }

    @Nested
    class Expiry {

        private final MutableClock clock = MutableClock.at("2026-05-05T12:00:00Z");

        private SetOptions ttl(Duration ttl) {
            return SetOptions.builder().ttl(ttl).build();
        }

        @Test
        void get_afterTtl_readsAsAbsent() {
            FlowStoreEngine engine = engine(baseConfig().clock(clock).build());
            engine.set("session", "abc", ttl(Duration.ofSeconds(10)));

            clock.advance(Duration.ofSeconds(10));
            assertThat(engine.get("session").asText()).isEqualTo("abc");
            assertThat(engine.exists("session")).isTrue();

            clock.advance(Duration.ofMillis(1));
            assertThat(engine.exists("session")).isFalse();
            assertThat(engine.get("session")).isNull();
            assertThat(engine.getStats().getStorage().getTotalKeys()).isZero();
        }

        @Test
        void expiredCachedRecord_isNotServed() {
            FlowStoreEngine engine = engine(baseConfig().clock(clock).build());
            engine.set("session", "abc", ttl(Duration.ofSeconds(1)));
            engine.get("session");

            clock.advance(Duration.ofSeconds(2));

            assertThat(engine.get("session")).isNull();
            assertThat(engine.getStats().getCache().getEntries()).isZero();
        }

        @Test
        void keysAndQuery_skipExpiredRecords() {
            FlowStoreEngine engine = engine(baseConfig().clock(clock).build());
            engine.set("user:1", user("Ada", 36, "London"), ttl(Duration.ofSeconds(5)));
            engine.set("user:2", user("Alan", 41, "London"));

            clock.advance(Duration.ofSeconds(6));

            assertThat(engine.keys("user:*")).containsExactly("user:2");
            assertThat(engine.query(Map.of("city", "London")))
                .extracting(n -> n.get("name").asText()).containsExactly("Alan");
        }

        @Test
        void maintenance_purgesExpiredRecords() {
            FlowStoreEngine engine = engine(baseConfig().clock(clock).build());
            List<WalEntry> delivered = new CopyOnWriteArrayList<>();
            engine.setWalSink(delivered::addAll);
            engine.set("temp", user("Ada", 36, "Paris"), ttl(Duration.ofMinutes(1)));
            engine.set("kept", user("Alan", 41, "London"));
            long entriesBefore = engine.getStats().getStorage().getIndexEntries();

            clock.advance(Duration.ofMinutes(2));
            engine.runMaintenance();

            EngineStats stats = engine.getStats();
            assertThat(stats.getStorage().getTotalKeys()).isEqualTo(1);
            assertThat(stats.getCache().getEntries()).isEqualTo(1);
            assertThat(stats.getStorage().getIndexEntries()).isLessThan(entriesBefore);
            assertThat(engine.query(Map.of("city", "Paris"))).isEmpty();
            assertThat(delivered).extracting(WalEntry::getOperation)
                .containsExactly(WalOperation.SET, WalOperation.SET, WalOperation.DELETE);
            assertThat(delivered.get(2).getKey()).isEqualTo("temp");
        }

        @Test
        void writeOverExpiredKey_startsAtVersionOne() {
            FlowStoreEngine engine = engine(baseConfig().clock(clock).build());
            engine.set("k", "a", ttl(Duration.ofSeconds(1)));
            engine.set("k", "b", ttl(Duration.ofSeconds(1)));

            clock.advance(Duration.ofSeconds(5));

            assertThat(engine.compareAndSet("k", 2, MAPPER.getNodeFactory().textNode("c"))).isEmpty();
            Optional<WriteResult> result = engine.compareAndSet("k", 0, MAPPER.getNodeFactory().textNode("c"));
            assertThat(result).hasValueSatisfying(r -> assertThat(r.getVersion()).isEqualTo(1));
            assertThat(engine.get("k").asText()).isEqualTo("c");

            clock.advance(Duration.ofDays(1));
            assertThat(engine.get("k").asText()).isEqualTo("c");
        }

        @Test
        void delete_expiredKey_reportsNotFound() {
            FlowStoreEngine engine = engine(baseConfig().clock(clock).build());
            engine.set("k", "v", ttl(Duration.ofSeconds(1)));

            clock.advance(Duration.ofSeconds(2));
            DeleteResult result = engine.delete("k", DeleteOptions.withBackup());

            assertThat(result.isExisted()).isFalse();
            assertThat(engine.listBackups("k")).isEmpty();
        }

        @Test
        void ttl_mustBePositive() {
            assertThatThrownBy(() -> SetOptions.builder().ttl(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> SetOptions.builder().ttl(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(SetOptions.defaults().getTtl()).isNull();
        }
    }

    @Nested
    class Backups {

        @Test
        void restore_writesBackedUpValueAsNewVersion() {
            FlowStoreEngine engine = engine();
            engine.set("doc", "v1", SetOptions.builder().backup(true).build());
            engine.set("doc", "v2");
            Backup backup = engine.listBackups("doc").get(0);

            WriteResult restored = engine.restoreBackup(backup.getId());

            assertThat(restored.getVersion()).isEqualTo(3);
            assertThat(engine.get("doc").asText()).isEqualTo("v1");
        }

        @Test
        void deleteWithBackup_canBeRestored() {
            FlowStoreEngine engine = engine();
            engine.set("doc", user("Ada", 36, "London"));

            engine.delete("doc", DeleteOptions.withBackup());

            List<Backup> backups = engine.listBackups("doc");
            assertThat(backups).hasSize(1);
            assertThat(backups.get(0).isDeleted()).isTrue();
            assertThat(backups.get(0).getId()).startsWith("deleted_doc_");

            engine.restoreBackup(backups.get(0).getId());
            assertThat(engine.get("doc").get("name").asText()).isEqualTo("Ada");
        }

        @Test
        void writesWithoutBackupOption_createNone() {
            FlowStoreEngine engine = engine();
            engine.set("doc", "v1");
            engine.delete("doc");

            assertThat(engine.listBackups("doc")).isEmpty();
        }

        @Test
        void restore_unknownId_throws() {
            FlowStoreEngine engine = engine();

            assertThatThrownBy(() -> engine.restoreBackup("backup_nope_0"))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("Backup not found");
        }
    }

    @Nested
    class Monitoring {

        @Test
        void healthCheck_healthyEngine() {
            FlowStoreEngine engine = engine();
            engine.set("k", "v");

            HealthCheckResult result = engine.healthCheck();

            assertThat(result.isHealthy()).isTrue();
            assertThat(result.isTestPassed()).isTrue();
            assertThat(result.getIssues()).isEmpty();
            assertThat(result.getStats().getHealth().getLastCheckHealthy()).isTrue();
            assertThat(engine.keys()).containsExactly("k");
        }

        @Test
        void healthCheck_leavesCacheCountersAndKeysUntouched() {
            FlowStoreEngine engine = engine();
            engine.set("k", "v");

            engine.healthCheck();
            engine.healthCheck();

            EngineStats stats = engine.getStats();
            assertThat(stats.getCache().getHits()).isZero();
            assertThat(stats.getCache().getMisses()).isZero();
            assertThat(stats.getStorage().getTotalKeys()).isEqualTo(1);
            assertThat(engine.keys()).containsExactly("k");
        }

        @Test
        void healthCheck_failingStore_reportsIssue() {
            FlakyRecordStore store = new FlakyRecordStore();
            FlowStoreEngine engine = engine(baseConfig().build(), store);
            store.putFailures.set(100);

            HealthCheckResult result = engine.healthCheck();

            assertThat(result.isHealthy()).isFalse();
            assertThat(result.isTestPassed()).isFalse();
            assertThat(result.getIssues()).anySatisfy(issue -> assertThat(issue).startsWith("Storage self-test failed"));
        }

        @Test
        void stats_reflectOperations() {
            FlowStoreEngine engine = engine();
            engine.set("a", 1);
            engine.set("b", 2);
            engine.get("a");
            engine.delete("b");

            EngineStats stats = engine.getStats();

            assertThat(stats.getStorage().getTotalKeys()).isEqualTo(1);
            assertThat(stats.getStorage().getWalEntries()).isEqualTo(3);
            assertThat(stats.getPerformance().getSets()).isEqualTo(2);
            assertThat(stats.getPerformance().getGets()).isEqualTo(1);
            assertThat(stats.getPerformance().getDeletes()).isEqualTo(1);
            assertThat(stats.getCache().getHits()).isEqualTo(1);
            assertThat(stats.getEncryption().isEnabled()).isTrue();
            assertThat(stats.getConfig().getMaxKeyLength()).isEqualTo(250);
            assertThat(engine.getMetrics().summary()).contains("SET=2");
        }

        @Test
        void lowMemoryPressure_keepsDefaultCacheFraction() {
            FlowStoreEngine engine = engine();
            engine.set("a", 1);

            assertThat(engine.getStats().getResources().isLowMemoryMode()).isFalse();
            assertThat(engine.getStats().getResources().getCacheFraction()).isEqualTo(0.30);
        }

        @Test
        void highMemoryUsage_entersLowMemoryMode() {
            FlowStoreEngine engine = engine(baseConfig().maxMemorySize(2_000).encryptionEnabled(false).build());
            for (int i = 0; i < 40; i++) {
                engine.set("key:" + i, "value-" + i);
            }

            engine.runMaintenance();

            assertThat(engine.getStats().getResources().isLowMemoryMode()).isTrue();
            assertThat(engine.getStats().getResources().getCacheFraction()).isEqualTo(0.20);
        }
    }

    @Nested
    class WriteAheadLogDelivery {

        @Test
        void maintenance_deliversEntriesToSink() {
            FlowStoreEngine engine = engine();
            List<WalEntry> delivered = new CopyOnWriteArrayList<>();
            engine.setWalSink(delivered::addAll);
            engine.set("a", 1);
            engine.set("b", 2);
            engine.delete("a");

            engine.runMaintenance();

            assertThat(delivered).extracting(WalEntry::getOperation)
                .containsExactly(WalOperation.SET, WalOperation.SET, WalOperation.DELETE);
            assertThat(delivered.get(0).getValue().asInt()).isEqualTo(1);
            assertThat(engine.getWriteAheadLog().pending()).isZero();
        }

        @Test
        void failingSink_keepsEntriesPending() {
            FlowStoreEngine engine = engine();
            AtomicInteger calls = new AtomicInteger();
            engine.setWalSink(batch -> {
                calls.incrementAndGet();
                throw new IllegalStateException("downstream unavailable");
            });
            engine.set("a", 1);

            engine.runMaintenance();

            assertThat(calls.get()).isPositive();
            assertThat(engine.getWriteAheadLog().pending()).isEqualTo(1);
        }

        @Test
        void withoutTransactionSupport_walIsDisabled() {
            FlowStoreEngine engine = engine(baseConfig().transactionSupport(false).build());
            engine.set("a", 1);

            assertThat(engine.getWriteAheadLog()).isNull();
            assertThatThrownBy(() -> engine.setWalSink(batch -> { }))
                .isInstanceOf(IllegalStateException.class);
        }
    }

    /**
     * Store that fails a configurable number of calls with a transient error.
     */
    static class FlakyRecordStore implements RecordStore {
        private final InMemoryRecordStore delegate = new InMemoryRecordStore();
        final AtomicInteger getFailures = new AtomicInteger();
        final AtomicInteger putFailures = new AtomicInteger();
        volatile boolean failScans;

        private static void maybeFail(AtomicInteger failures, String operation) {
            if (failures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new TransientStorageException(operation + " unavailable");
            }
        }

        @Override
        public Optional<Record> put(String key, Record record) {
            maybeFail(putFailures, "put");
            return delegate.put(key, record);
        }

        @Override
        public Optional<Record> get(String key) {
            maybeFail(getFailures, "get");
            return delegate.get(key);
        }

        @Override
        public Optional<Record> remove(String key) {
            return delegate.remove(key);
        }

        @Override
        public boolean contains(String key) {
            return delegate.contains(key);
        }

        @Override
        public Set<String> keys() {
            if (failScans) {
                throw new TransientStorageException("scan unavailable");
            }
            return delegate.keys();
        }

        @Override
        public List<String> scanKeys(KeyPattern pattern) {
            if (failScans) {
                throw new TransientStorageException("scan unavailable");
            }
            return delegate.scanKeys(pattern);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public long memoryBytes() {
            return delegate.memoryBytes();
        }

        @Override
        public void clear() {
            delegate.clear();
        }
    }

    /**
     * Store that runs writes on another thread around one {@code contains} check,
     * so a key can change between a caller's check and its next step.
     */
    static class InterleavingRecordStore extends InMemoryRecordStore {
        private final AtomicReference<String> armedKey = new AtomicReference<>();
        private volatile Runnable beforeCheck;
        private volatile Runnable afterCheck;
        private volatile boolean interleaved;

        void interleaveOnce(String key, Runnable beforeCheck, Runnable afterCheck) {
            this.beforeCheck = beforeCheck;
            this.afterCheck = afterCheck;
            armedKey.set(key);
        }

        boolean interleaved() {
            return interleaved;
        }

        @Override
        public boolean contains(String key) {
            if (!armedKey.compareAndSet(key, null)) {
                return super.contains(key);
            }
            runOnOtherThread(beforeCheck);
            boolean result = super.contains(key);
            runOnOtherThread(afterCheck);
            interleaved = true;
            return result;
        }

        private static void runOnOtherThread(Runnable action) {
            try {
                CompletableFuture.runAsync(action).get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } catch (ExecutionException | TimeoutException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
