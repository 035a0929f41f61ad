package com.flowstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowstore.backup.Backup;
import com.flowstore.backup.BackupStore;
import com.flowstore.cache.RecordCache;
import com.flowstore.codec.CorruptRecordException;
import com.flowstore.codec.DecryptionException;
import com.flowstore.codec.EncodedPayload;
import com.flowstore.codec.RecordCodec;
import com.flowstore.codec.crypto.AesGcmPayloadCipher;
import com.flowstore.codec.crypto.PayloadCipher;
import com.flowstore.config.EngineConfig;
import com.flowstore.core.InMemoryRecordStore;
import com.flowstore.core.InvalidKeyException;
import com.flowstore.core.KeyPattern;
import com.flowstore.core.Record;
import com.flowstore.core.RecordMetadata;
import com.flowstore.core.RecordStore;
import com.flowstore.core.ScanTimeoutException;
import com.flowstore.core.StorageException;
import com.flowstore.health.ErrorLog;
import com.flowstore.health.ErrorRecord;
import com.flowstore.health.HealthMonitor;
import com.flowstore.health.HealthReport;
import com.flowstore.index.IndexValue;
import com.flowstore.index.SecondaryIndex;
import com.flowstore.model.DeleteOptions;
import com.flowstore.model.DeleteResult;
import com.flowstore.model.EngineStats;
import com.flowstore.model.HealthCheckResult;
import com.flowstore.model.ScanOptions;
import com.flowstore.model.SetOptions;
import com.flowstore.model.WriteResult;
import com.flowstore.resource.ResourceGovernor;
import com.flowstore.resource.ResourcePolicy;
import com.flowstore.resource.ResourceState;
import com.flowstore.util.MetricsCollector;
import com.flowstore.util.RetryExecutor;
import com.flowstore.wal.WalOperation;
import com.flowstore.wal.WalSink;
import com.flowstore.wal.WriteAheadLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Embedded storage engine for JSON values.
 *
 * A write goes WAL, codec (serialize, compress, encrypt), primary store, cache,
 * index. A read checks the cache first and falls back to the primary store.
 * Writes to the same key are serialized by a striped lock, so versions reflect
 * completion order and the cache never holds a record older than the store's.
 *
 * The engine starts its maintenance scheduler on first use and stops it on
 * {@link #close()}. Instances are independent; there is no shared global engine.
 */
public class FlowStoreEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FlowStoreEngine.class);

    private static final int LOCK_STRIPES = 64;
    private static final int MAX_FLUSH_BATCHES = 100;
    private static final int DEADLINE_CHECK_INTERVAL = 64;
    static final String HEALTH_KEY_PREFIX = "__health__:";

    private final EngineConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final RecordStore store;
    private final RecordCodec codec;
    private final RecordCache cache;
    private final SecondaryIndex index;
    private final WriteAheadLog wal; // null without transaction support
    private final ResourceGovernor governor;
    private final MetricsCollector metrics;
    private final RetryExecutor retry;
    private final ErrorLog errorLog;
    private final BackupStore backups;
    private final HealthMonitor healthMonitor;
    private final Object[] locks;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong healthProbeSequence = new AtomicLong(0);
    private volatile boolean closed;

    /**
     * Create an engine with configuration read from the environment.
     */
    public FlowStoreEngine() {
        this(new EngineConfig());
    }

    public FlowStoreEngine(EngineConfig config) {
        this(config, new InMemoryRecordStore(), new MetricsCollector());
    }

    /**
     * Create an engine over a specific primary store.
     *
     * @param config  engine configuration
     * @param store   the primary store
     * @param metrics metrics collector
     */
    public FlowStoreEngine(EngineConfig config, RecordStore store, MetricsCollector metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = config.getClock();
        this.mapper = new ObjectMapper();

        this.governor = new ResourceGovernor(config.getEnvironmentProbe(), store::memoryBytes,
            config.getMaxMemorySize());
        this.codec = new RecordCodec(mapper, createCipher(config), config.isCompressionEnabled(),
            config.getCompressionThreshold());
        this.cache = new RecordCache(config.getMaxMemorySize(),
            () -> governor.currentPolicy().getCacheFraction(), clock, config.isCacheEnabled());
        this.index = new SecondaryIndex();
        this.wal = config.isTransactionSupport()
            ? new WriteAheadLog(clock, config.getWalRetentionMs(), config.getWalMaxEntries())
            : null;
        this.retry = new RetryExecutor(config.getRetryAttempts(), config.getRetryDelayMs(), metrics);
        this.errorLog = new ErrorLog(config.getErrorLogCapacity(), clock);
        this.backups = new BackupStore(clock);
        this.healthMonitor = new HealthMonitor(metrics, governor, store::memoryBytes,
            config.getMaxMemorySize(), this::runHealthProbe, clock);

        this.locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flowstore-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    private static PayloadCipher createCipher(EngineConfig config) {
        if (!config.isEncryptionEnabled()) {
            return null;
        }
        String key = config.getEncryptionKey();
        if (key == null) {
            byte[] material = new byte[32];
            new SecureRandom().nextBytes(material);
            key = Base64.getEncoder().encodeToString(material);
            logger.warn("No encryption key configured, generated an ephemeral key. "
                + "Encrypted records will only be readable by this engine instance.");
        }
        return new AesGcmPayloadCipher(key, config.getClock());
    }

    // Lifecycle

    /**
     * Start background maintenance. Called implicitly by the first operation.
     */
    public void start() {
        if (closed) {
            throw new IllegalStateException("Engine is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        governor.refresh();

        scheduler.scheduleAtFixedRate(
            this::runMaintenance,
            config.getMaintenanceIntervalMs(),
            config.getMaintenanceIntervalMs(),
            TimeUnit.MILLISECONDS
        );
        scheduler.scheduleAtFixedRate(
            this::runScheduledHealthCheck,
            config.getHealthCheckIntervalMs(),
            config.getHealthCheckIntervalMs(),
            TimeUnit.MILLISECONDS
        );

        logger.info("FlowStore engine started (maxMemory={} bytes, compression={}, encryption={}, wal={})",
            config.getMaxMemorySize(), config.isCompressionEnabled(), config.isEncryptionEnabled(),
            config.isTransactionSupport());
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Stop background work and hand any unconsumed WAL entries to the sink.
     * Stored data stays readable through the store passed in, but the engine
     * rejects further operations.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (wal != null) {
            flushWal(governor.currentPolicy().getBatchSize());
        }
        logger.info("FlowStore engine closed ({} records)", store.size());
    }

    private void ensureStarted() {
        if (closed) {
            throw new IllegalStateException("Engine is closed");
        }
        if (!started.get()) {
            start();
        }
    }

    // Writes

    public WriteResult set(String key, JsonNode value) {
        return set(key, value, SetOptions.defaults());
    }

    /**
     * Store any Jackson-serializable value.
     */
    public WriteResult set(String key, Object value) {
        return set(key, toJson(value), SetOptions.defaults());
    }

    public WriteResult set(String key, Object value, SetOptions options) {
        return set(key, toJson(value), options);
    }

    /**
     * Store a value.
     *
     * @param key     the key
     * @param value   the value; null is stored as JSON null
     * @param options per-write options
     * @return details of the stored record
     * @throws InvalidKeyException if the key is empty or too long
     */
    public WriteResult set(String key, JsonNode value, SetOptions options) {
        Objects.requireNonNull(options, "options");
        ensureStarted();
        JsonNode node = value != null ? value : NullNode.getInstance();
        try {
            validateKey(key);
            return retry.execute("set", () -> doSet(key, node, options, -1));
        } catch (RuntimeException e) {
            recordFailure("set", key, e);
            throw e;
        }
    }

    /**
     * Store a value only if the key is currently at {@code expectedVersion}.
     *
     * @param expectedVersion the version the caller last saw, or 0 if the key must be absent
     * @return the write result, or empty if the current version differs
     */
    public Optional<WriteResult> compareAndSet(String key, long expectedVersion, JsonNode value,
                                               SetOptions options) {
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must be non-negative, got: " + expectedVersion);
        }
        Objects.requireNonNull(options, "options");
        ensureStarted();
        JsonNode node = value != null ? value : NullNode.getInstance();
        try {
            validateKey(key);
            return Optional.ofNullable(retry.execute("compareAndSet",
                () -> doSet(key, node, options, expectedVersion)));
        } catch (RuntimeException e) {
            recordFailure("compareAndSet", key, e);
            throw e;
        }
    }

    public Optional<WriteResult> compareAndSet(String key, long expectedVersion, JsonNode value) {
        return compareAndSet(key, expectedVersion, value, SetOptions.defaults());
    }

    /**
     * Store several values. All keys are validated before anything is written.
     *
     * @return results in the iteration order of {@code entries}
     */
    public Map<String, WriteResult> mset(Map<String, ?> entries, SetOptions options) {
        Objects.requireNonNull(entries, "entries");
        for (String key : entries.keySet()) {
            validateKey(key);
        }
        Map<String, WriteResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : entries.entrySet()) {
            results.put(entry.getKey(), set(entry.getKey(), toJson(entry.getValue()), options));
        }
        return results;
    }

    public Map<String, WriteResult> mset(Map<String, ?> entries) {
        return mset(entries, SetOptions.defaults());
    }

    private WriteResult doSet(String key, JsonNode value, SetOptions options, long expectedVersion) {
        synchronized (lockFor(key)) {
            long startNanos = System.nanoTime();
            long now = clock.millis();
            // An expired record counts as absent, so the key starts over at version 1
            Optional<Record> existing = store.get(key).filter(r -> !r.getMetadata().isExpired(now));
            if (expectedVersion >= 0) {
                long current = existing.map(Record::getVersion).orElse(0L);
                if (current != expectedVersion) {
                    logger.debug("compareAndSet conflict on key={}: expected={}, current={}",
                        key, expectedVersion, current);
                    return null;
                }
            }

            ResourcePolicy policy = governor.currentPolicy();
            EncodedPayload encoded = codec.encode(value, options.isCompress(), options.isEncrypt(), policy);
            long version = existing.map(r -> r.getVersion() + 1).orElse(1L);
            long createdAt = existing.map(r -> r.getMetadata().getCreatedAt()).orElse(now);
            long expiresAt = options.getTtl() != null ? now + options.getTtl().toMillis() : 0L;
            RecordMetadata metadata = new RecordMetadata(encoded.getOriginalSize(), encoded.isCompressed(),
                encoded.isEncrypted(), encoded.getAlgorithm(), createdAt, now, version, encoded.getSize(),
                expiresAt);
            Record record = new Record(encoded.getPayload(), metadata);

            if (wal != null) {
                wal.append(WalOperation.SET, key, value);
            }
            store.put(key, record);
            cache.put(key, record);
            if (config.isIndexingEnabled()) {
                index.indexOnWrite(key, value);
            }
            if (options.isBackup()) {
                backups.create(key, record, false);
            }

            long elapsed = System.nanoTime() - startNanos;
            metrics.recordSet(elapsed);
            updateGauges();
            logger.trace("SET key={} version={} size={} compressed={} encrypted={}",
                key, version, metadata.getSize(), metadata.isCompressed(), metadata.isEncrypted());
            return new WriteResult(key, metadata.getSize(), TimeUnit.NANOSECONDS.toMillis(elapsed),
                metadata.isCompressed(), metadata.isEncrypted(), version);
        }
    }

    // Reads

    /**
     * Read a value.
     *
     * @param key the key
     * @return the value, or null if the key is absent or the store kept failing
     * @throws InvalidKeyException    if the key is empty or too long
     * @throws CorruptRecordException if the stored payload cannot be decoded
     */
    public JsonNode get(String key) {
        ensureStarted();
        try {
            validateKey(key);
            return retry.execute("get", () -> doGet(key));
        } catch (CorruptRecordException e) {
            metrics.recordCorruptRecord(e instanceof DecryptionException);
            recordFailure("get", key, e);
            logger.warn("Record for key={} is corrupt: {}", key, e.getMessage());
            throw e;
        } catch (InvalidKeyException e) {
            recordFailure("get", key, e);
            throw e;
        } catch (RuntimeException e) {
            recordFailure("get", key, e);
            logger.warn("GET key={} failed, returning null: {}", key, e.getMessage());
            return null;
        }
    }

    /**
     * Read a value and convert it to the given type.
     */
    public <T> T get(String key, Class<T> type) {
        JsonNode node = get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for key " + key + " cannot be read as " + type.getName(), e);
        }
    }

    /**
     * Read several values.
     *
     * @return each key mapped to its value, or to null when absent
     */
    public Map<String, JsonNode> mget(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        Map<String, JsonNode> results = new LinkedHashMap<>();
        for (String key : keys) {
            results.put(key, get(key));
        }
        return results;
    }

    private JsonNode doGet(String key) {
        return doGet(key, true);
    }

    private JsonNode doGet(String key, boolean recordMetrics) {
        long startNanos = System.nanoTime();
        Optional<Record> cached = cache.get(key);
        boolean hit = cached.isPresent();
        Record record;
        if (hit) {
            record = cached.get();
        } else {
            // Repopulate under the key lock so a concurrent write cannot be shadowed by this read
            synchronized (lockFor(key)) {
                record = store.get(key).orElse(null);
                if (record != null) {
                    cache.put(key, record);
                }
            }
        }
        if (record != null && record.getMetadata().isExpired(clock.millis())) {
            purgeIfExpired(key);
            record = null;
            hit = false;
        }
        if (record == null) {
            if (recordMetrics) {
                metrics.recordGet(System.nanoTime() - startNanos, false);
            }
            return null;
        }
        JsonNode value = codec.decode(record.getPayloadUnsafe(), record.getMetadata());
        record.touch(clock.millis());
        if (recordMetrics) {
            metrics.recordGet(System.nanoTime() - startNanos, hit);
        }
        logger.trace("GET key={} version={} cacheHit={}", key, record.getVersion(), hit);
        return value;
    }

    /**
     * Check whether a key is stored and not expired. Never throws; any failure reads as absent.
     */
    public boolean exists(String key) {
        ensureStarted();
        try {
            validateKey(key);
            return retry.execute("exists", () -> cache.get(key).or(() -> store.get(key))
                .map(record -> !record.getMetadata().isExpired(clock.millis()))
                .orElse(false));
        } catch (RuntimeException e) {
            recordFailure("exists", key, e);
            return false;
        }
    }

    // Deletes

    public DeleteResult delete(String key) {
        return delete(key, DeleteOptions.defaults());
    }

    /**
     * Remove a key from the store, cache and index. Deleting an absent key succeeds.
     */
    public DeleteResult delete(String key, DeleteOptions options) {
        Objects.requireNonNull(options, "options");
        ensureStarted();
        try {
            validateKey(key);
            return retry.execute("delete", () -> doDelete(key, options));
        } catch (RuntimeException e) {
            recordFailure("delete", key, e);
            throw e;
        }
    }

    private DeleteResult doDelete(String key, DeleteOptions options) {
        synchronized (lockFor(key)) {
            long startNanos = System.nanoTime();
            Optional<Record> existing = store.get(key);
            boolean live = existing.isPresent() && !existing.get().getMetadata().isExpired(clock.millis());
            if (existing.isPresent()) {
                if (wal != null) {
                    wal.append(WalOperation.DELETE, key, null);
                }
                if (live && options.isBackup()) {
                    backups.create(key, existing.get(), true);
                }
                store.remove(key);
            }
            cache.invalidate(key);
            if (config.isIndexingEnabled()) {
                index.removeFromIndex(key);
            }
            metrics.recordDelete(System.nanoTime() - startNanos);
            updateGauges();
            logger.trace("DELETE key={} -> {}", key, live ? "DELETED" : "NOT_FOUND");
            return new DeleteResult(key, live);
        }
    }

    // Scans

    public List<String> keys() {
        return keys("*", ScanOptions.defaults());
    }

    public List<String> keys(String pattern) {
        return keys(pattern, ScanOptions.defaults());
    }

    /**
     * List keys matching a glob pattern, sorted lexicographically.
     *
     * @param pattern {@code *} matches any substring, {@code ?} one character
     * @param options offset, limit and timeout
     * @return a page of matching keys; empty if the store fails
     * @throws ScanTimeoutException if the scan exceeds the timeout
     */
    public List<String> keys(String pattern, ScanOptions options) {
        Objects.requireNonNull(options, "options");
        ensureStarted();
        try {
            List<String> result = retry.execute("keys", () -> doKeys(KeyPattern.compile(pattern), options));
            metrics.recordKeys();
            return result;
        } catch (ScanTimeoutException e) {
            recordFailure("keys", null, e);
            throw e;
        } catch (RuntimeException e) {
            recordFailure("keys", null, e);
            logger.warn("KEYS pattern={} failed, returning empty list: {}", pattern, e.getMessage());
            return List.of();
        }
    }

    private List<String> doKeys(KeyPattern pattern, ScanOptions options) {
        List<String> matched;
        Duration timeout = options.getTimeout();
        if (timeout == null) {
            matched = store.scanKeys(pattern);
        } else {
            long deadline = System.nanoTime() + timeout.toNanos();
            matched = new ArrayList<>();
            int examined = 0;
            for (String key : store.keys()) {
                if (++examined % DEADLINE_CHECK_INTERVAL == 0) {
                    checkDeadline("keys", deadline, timeout, examined);
                }
                if (pattern.matches(key)) {
                    matched.add(key);
                }
            }
            checkDeadline("keys", deadline, timeout, examined);
        }
        long now = clock.millis();
        TreeSet<String> visible = new TreeSet<>();
        for (String key : matched) {
            if (!key.startsWith(HEALTH_KEY_PREFIX) && !isExpired(key, now)) {
                visible.add(key);
            }
        }
        return page(new ArrayList<>(visible), options);
    }

    /**
     * Find object values whose fields equal every entry of the filter.
     * Numbers compare by value, so a filter of 37 matches a stored 37.0.
     */
    public List<JsonNode> query(Map<String, ?> filter) {
        return query(filter, ScanOptions.defaults());
    }

    public List<JsonNode> query(Map<String, ?> filter, ScanOptions options) {
        Objects.requireNonNull(filter, "filter");
        ObjectNode node = mapper.createObjectNode();
        for (Map.Entry<String, ?> entry : filter.entrySet()) {
            node.set(entry.getKey(), toJson(entry.getValue()));
        }
        return query(node, options);
    }

    /**
     * Find object values matching a filter.
     *
     * @param filter  field name to required value
     * @param options offset, limit and timeout
     * @return matching values in key order
     * @throws ScanTimeoutException if the query exceeds the timeout
     */
    public List<JsonNode> query(ObjectNode filter, ScanOptions options) {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(options, "options");
        ensureStarted();
        long startNanos = System.nanoTime();
        try {
            List<JsonNode> result = retry.execute("query", () -> doQuery(filter, options));
            metrics.recordQuery(System.nanoTime() - startNanos);
            return result;
        } catch (RuntimeException e) {
            recordFailure("query", null, e);
            throw e;
        }
    }

    private List<JsonNode> doQuery(ObjectNode filter, ScanOptions options) {
        Duration timeout = options.getTimeout();
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : Long.MAX_VALUE;

        Set<String> candidates = null;
        List<String> indexedFields = new ArrayList<>();
        if (config.isIndexingEnabled()) {
            Iterator<Map.Entry<String, JsonNode>> it = filter.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                if (IndexValue.of(field.getValue()) == null || !index.isIndexed(field.getKey())) {
                    continue;
                }
                Set<String> keys = index.findByField(field.getKey(), field.getValue());
                if (candidates == null) {
                    candidates = new TreeSet<>(keys);
                } else {
                    candidates.retainAll(keys);
                }
                indexedFields.add(field.getKey());
            }
        }
        if (candidates == null) {
            candidates = new TreeSet<>(store.keys());
        }
        candidates.removeIf(key -> key.startsWith(HEALTH_KEY_PREFIX));

        List<JsonNode> results = new ArrayList<>();
        int skipped = 0;
        int examined = 0;
        for (String key : candidates) {
            if (results.size() >= options.getLimit()) {
                break;
            }
            if (timeout != null) {
                checkDeadline("query", deadline, timeout, examined);
            }
            examined++;

            JsonNode value;
            try {
                value = doGet(key);
            } catch (CorruptRecordException e) {
                metrics.recordCorruptRecord(e instanceof DecryptionException);
                recordFailure("query", key, e);
                logger.warn("Skipping corrupt record key={} during query: {}", key, e.getMessage());
                continue;
            }

            if (!mismatchedFields(value, filter).isEmpty()) {
                if (!indexedFields.isEmpty()) {
                    pruneStaleEntries(key, filter, indexedFields);
                }
                continue;
            }
            if (skipped < options.getOffset()) {
                skipped++;
                continue;
            }
            results.add(value);
        }
        return results;
    }

    /**
     * Drop index entries that led a query to a key whose value no longer matches.
     * The value is re-read under the key lock so a write that raced the query
     * keeps the entries it just added.
     */
    private void pruneStaleEntries(String key, ObjectNode filter, List<String> indexedFields) {
        synchronized (lockFor(key)) {
            Record current = store.get(key).orElse(null);
            JsonNode value = null;
            if (current != null && !current.getMetadata().isExpired(clock.millis())) {
                try {
                    value = codec.decode(current.getPayloadUnsafe(), current.getMetadata());
                } catch (CorruptRecordException e) {
                    logger.debug("Not pruning index entries of corrupt record key={}: {}", key, e.getMessage());
                    return;
                }
            }
            List<String> mismatched = mismatchedFields(value, filter);
            for (String field : indexedFields) {
                if (mismatched.contains(field)) {
                    index.prune(key, field, filter.get(field));
                }
            }
        }
    }

    private static List<String> mismatchedFields(JsonNode value, ObjectNode filter) {
        List<String> mismatched = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = filter.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode actual = value != null && value.isObject() ? value.get(field.getKey()) : null;
            if (!fieldMatches(actual, field.getValue())) {
                mismatched.add(field.getKey());
            }
        }
        return mismatched;
    }

    static boolean fieldMatches(JsonNode actual, JsonNode expected) {
        if (actual == null) {
            return false;
        }
        IndexValue a = IndexValue.of(actual);
        IndexValue e = IndexValue.of(expected);
        if (a != null && e != null) {
            return a.equals(e);
        }
        return actual.equals(expected);
    }

    private static <T> List<T> page(List<T> items, ScanOptions options) {
        int from = Math.min(options.getOffset(), items.size());
        int to = (int) Math.min((long) from + options.getLimit(), items.size());
        return new ArrayList<>(items.subList(from, to));
    }

    private static void checkDeadline(String operation, long deadline, Duration timeout, int examined) {
        if (System.nanoTime() - deadline > 0) {
            throw new ScanTimeoutException(operation, timeout, examined);
        }
    }

    // Backups

    /**
     * Backups of one key, oldest first.
     */
    public List<Backup> listBackups(String key) {
        validateKey(key);
        return backups.list(key);
    }

    /**
     * Write a backed-up value back under its original key as a new version.
     *
     * @param backupId id returned in {@link Backup#getId()}
     * @return the write result
     * @throws StorageException if no backup has this id
     */
    public WriteResult restoreBackup(String backupId) {
        ensureStarted();
        Backup backup = backups.get(backupId)
            .orElseThrow(() -> new StorageException("Backup not found: " + backupId));
        Record record = backup.getRecord();
        JsonNode value = codec.decode(record.getPayloadUnsafe(), record.getMetadata());
        SetOptions options = SetOptions.builder()
            .encrypt(record.getMetadata().isEncrypted())
            .build();
        logger.info("Restoring key={} from backup {}", backup.getOriginalKey(), backupId);
        return set(backup.getOriginalKey(), value, options);
    }

    // Monitoring

    /**
     * Run the self-test and threshold checks now.
     */
    public HealthCheckResult healthCheck() {
        ensureStarted();
        HealthReport report = healthMonitor.runSelfTest();
        return new HealthCheckResult(report.isHealthy(), report.getTimestamp(), report.isTestPassed(),
            report.getIssues(), getStats());
    }

    public EngineStats getStats() {
        ResourcePolicy policy = governor.currentPolicy();
        ResourceState state = governor.currentState();
        HealthReport lastReport = healthMonitor.getLastReport();

        EngineStats.Storage storage = new EngineStats.Storage(
            store.size(), store.memoryBytes(), config.getMaxMemorySize(),
            wal != null ? wal.size() : 0, wal != null ? wal.pending() : 0,
            backups.size(), index.fieldCount(), index.entryCount());

        EngineStats.Performance performance = new EngineStats.Performance(
            metrics.getTotalOps(), metrics.getTotalGetOps(), metrics.getTotalSetOps(),
            metrics.getTotalDeleteOps(), metrics.getTotalQueryOps(),
            metrics.getTotalErrors(), metrics.getTotalRetries(), metrics.getErrorRate(),
            metrics.getGetMeanLatencyMs(), metrics.getSetMeanLatencyMs(),
            metrics.getGetP99LatencyMs(), metrics.getSetP99LatencyMs());

        EngineStats.Cache cacheStats = new EngineStats.Cache(
            cache.isEnabled(), cache.size(), cache.totalBytes(), cache.budgetBytes(),
            metrics.getCacheHits(), metrics.getCacheMisses(), cache.getEvictions());

        EngineStats.Compression compression = new EngineStats.Compression(
            config.isCompressionEnabled(), codec.getCompressionOperations(), codec.getCompressionRejected(),
            codec.getBytesSaved(), codec.getAverageRatio());

        EngineStats.Encryption encryption = new EngineStats.Encryption(
            codec.isEncryptionAvailable(), codec.getEncryptionOperations(), codec.getDecryptionOperations(),
            metrics.getDecryptionFailures());

        EngineStats.Resources resources = new EngineStats.Resources(
            state.getMemoryPressure(), state.getNetworkQuality().name(), state.isBatteryConstrained(),
            policy.isLowMemoryMode(), policy.getCompressionMode().name(), policy.getCacheFraction(),
            policy.getBatchSize());

        EngineStats.Health health = new EngineStats.Health(
            lastReport != null ? lastReport.isHealthy() : null,
            lastReport != null ? lastReport.getTimestamp() : 0L,
            lastReport != null ? lastReport.getIssues() : List.of(),
            metrics.getCorruptRecords(), errorLog.size(), errorLog.getTotalRecorded());

        EngineStats.Config configStats = new EngineStats.Config(
            config.getMaxMemorySize(), config.isCompressionEnabled(), config.isEncryptionEnabled(),
            config.isTransactionSupport(), config.isCacheEnabled(), config.isIndexingEnabled(),
            config.getRetryAttempts(), config.getRetryDelayMs(), config.getMaxKeyLength());

        return new EngineStats(storage, performance, cacheStats, compression, encryption, resources,
            health, configStats);
    }

    /**
     * Most recent errors, oldest first.
     */
    public List<ErrorRecord> getRecentErrors(int limit) {
        return errorLog.recent(limit);
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * @return the write-ahead log, or null when transaction support is off
     */
    public WriteAheadLog getWriteAheadLog() {
        return wal;
    }

    /**
     * Attach a downstream consumer for WAL entries. Entries are delivered
     * during maintenance and on close.
     *
     * @throws IllegalStateException if transaction support is off
     */
    public void setWalSink(WalSink sink) {
        if (wal == null) {
            throw new IllegalStateException("Write-ahead log is disabled");
        }
        wal.setSink(sink);
    }

    // Maintenance

    /**
     * One maintenance pass: refresh the resource policy, purge expired records,
     * trim the cache, garbage-collect the index and backups, and flush and prune the WAL.
     * Runs on the scheduler; callable directly.
     */
    public void runMaintenance() {
        try {
            ResourcePolicy policy = governor.refresh();
            int expired = purgeExpired();
            int evicted = cache.evictIfOverBudget();
            int dangling = config.isIndexingEnabled()
                ? index.collectGarbage(store::contains, this::withKeyLock)
                : 0;
            int flushed = 0;
            int pruned = 0;
            if (wal != null) {
                flushed = flushWal(policy.getBatchSize());
                pruned = wal.prune();
            }
            int expiredBackups = backups.collectGarbage();
            updateGauges();
            logger.debug("Maintenance: expired={}, evicted={}, danglingIndexKeys={}, walFlushed={}, "
                + "walPruned={}, expiredBackups={}", expired, evicted, dangling, flushed, pruned, expiredBackups);
        } catch (RuntimeException e) {
            errorLog.record("maintenance", null, e);
            logger.warn("Maintenance pass failed: {}", e.getMessage(), e);
        }
    }

    private int purgeExpired() {
        long now = clock.millis();
        int purged = 0;
        for (String key : store.keys()) {
            if (isExpired(key, now) && purgeIfExpired(key)) {
                purged++;
            }
        }
        return purged;
    }

    /**
     * Remove an expired record from the store, cache and index. The WAL gets a
     * DELETE entry so downstream consumers drop the key too.
     *
     * @return true if the record was still expired and has been removed
     */
    private boolean purgeIfExpired(String key) {
        synchronized (lockFor(key)) {
            Optional<Record> current = store.get(key);
            if (!current.isPresent() || !current.get().getMetadata().isExpired(clock.millis())) {
                return false;
            }
            if (wal != null) {
                wal.append(WalOperation.DELETE, key, null);
            }
            store.remove(key);
            cache.invalidate(key);
            if (config.isIndexingEnabled()) {
                index.removeFromIndex(key);
            }
            updateGauges();
            logger.debug("Expired key={} (expiresAt={})", key, current.get().getMetadata().getExpiresAt());
            return true;
        }
    }

    private boolean isExpired(String key, long now) {
        return store.get(key)
            .map(record -> record.getMetadata().isExpired(now))
            .orElse(false);
    }

    private void withKeyLock(String key, Runnable action) {
        synchronized (lockFor(key)) {
            action.run();
        }
    }

    private int flushWal(int batchSize) {
        int total = 0;
        for (int i = 0; i < MAX_FLUSH_BATCHES; i++) {
            int flushed = wal.flush(batchSize);
            total += flushed;
            if (flushed < batchSize) {
                break;
            }
        }
        return total;
    }

    private void runScheduledHealthCheck() {
        try {
            healthMonitor.runSelfTest();
        } catch (RuntimeException e) {
            errorLog.record("healthCheck", null, e);
            logger.warn("Scheduled health check failed: {}", e.getMessage(), e);
        }
    }

    private boolean runHealthProbe() {
        String key = HEALTH_KEY_PREFIX + healthProbeSequence.incrementAndGet();
        ObjectNode probe = mapper.createObjectNode()
            .put("probe", key)
            .put("timestamp", clock.millis());
        try {
            set(key, probe, SetOptions.defaults());
            // Self-test reads stay out of the cache hit/miss counters
            return probe.equals(retry.execute("healthCheck", () -> doGet(key, false)));
        } finally {
            delete(key);
        }
    }

    // Helpers

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new InvalidKeyException("Key cannot be null or empty", key);
        }
        if (key.length() > config.getMaxKeyLength()) {
            throw new InvalidKeyException("Key length " + key.length()
                + " exceeds maximum of " + config.getMaxKeyLength(), key);
        }
    }

    private Object lockFor(String key) {
        return locks[(key.hashCode() & 0x7fffffff) % LOCK_STRIPES];
    }

    private JsonNode toJson(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return mapper.valueToTree(value);
    }

    private void recordFailure(String operation, String key, RuntimeException e) {
        metrics.recordError();
        errorLog.record(operation, key, e);
    }

    private void updateGauges() {
        metrics.setStoreSize(store.size());
        metrics.setMemoryBytes(store.memoryBytes());
        metrics.setCacheBytes(cache.totalBytes());
    }
}
