package com.wildfire.resolution.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildfire.resolution.core.model.Freshness;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.error.ServiceError;
import com.wildfire.resolution.geo.Geohash;
import com.wildfire.resolution.logging.LogContext;
import com.wildfire.resolution.metrics.MetricsService;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Geohash-keyed cache of risk observations with TTL expiry and LRU eviction.
 *
 * <p>Entries are stored as versioned JSON records in a {@link CacheStore}. An in-memory index of
 * {@code key -> lastAccessedAt} drives eviction. Reads and writes share a read lock and only
 * {@link #clear()} takes the write lock. Admitting a key the index does not hold yet is serialized,
 * so the index never grows past capacity; recency ordering stays approximate when writers race.</p>
 *
 * <p>Entries are readable while {@code age <= ttl}; an entry exactly {@code ttl} old is still a hit.</p>
 */
public class Geocache {
    private static final Logger log = LoggerFactory.getLogger(Geocache.class);

    static final String ENTRY_PREFIX = "cache_entry_";

    private final GeocacheConfig config;
    private final CacheStore store;
    private final MetricsService metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final ConcurrentMap<String, Instant> accessIndex = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object admission = new Object();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicReference<Instant> lastCleanup = new AtomicReference<>();

    public Geocache() {
        this(GeocacheConfig.defaults());
    }

    public Geocache(GeocacheConfig config) {
        this(config, new CaffeineCacheStore(config.capacity() * 2L), new NoOpMetricsService(), Clock.systemUTC());
    }

    public Geocache(GeocacheConfig config, CacheStore store, MetricsService metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.objectMapper = new ObjectMapper();
        loadIndex();
        log.info("Geocache initialized: capacity={}, ttl={}, precision={}, restoredEntries={}",
                config.capacity(), config.ttl(), config.precision(), accessIndex.size());
    }

    /**
     * Returns the cached observation for a geohash key, with freshness forced to
     * {@link Freshness#CACHED}. Missing, expired, corrupt or version-mismatched entries are misses.
     */
    public Optional<RiskObservation> get(String key) {
        if (key == null || key.isBlank()) {
            return miss();
        }
        lock.readLock().lock();
        try {
            Optional<String> raw = store.get(ENTRY_PREFIX + key);
            if (raw.isEmpty()) {
                accessIndex.remove(key);
                return miss();
            }
            CacheRecord record = decode(key, raw.get());
            if (record == null) {
                discard(key);
                return miss();
            }
            if (!CacheRecord.FORMAT_VERSION.equals(record.formatVersion())) {
                log.debug("Cache entry {} has unsupported version {}", key, record.formatVersion());
                return miss();
            }
            Instant now = clock.instant();
            if (isExpired(record, now)) {
                log.debug("Cache entry {} expired (stored {})", key, record.storedAt());
                discard(key);
                return miss();
            }
            RiskObservation observation;
            try {
                observation = record.toObservation();
            } catch (IllegalArgumentException e) {
                log.warn("Cache entry {} holds an invalid observation: {}", key, e.getMessage());
                discard(key);
                return miss();
            }
            touch(key, now);
            hits.incrementAndGet();
            metrics.recordCacheHit();
            return Optional.of(observation.withFreshness(Freshness.CACHED));
        } catch (CacheStoreException e) {
            log.warn("Cache store read failed for {}: {}", key, e.getMessage());
            return miss();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RiskObservation> getForCoordinate(GeoCoordinate coordinate) {
        return get(keyFor(coordinate));
    }

    /**
     * Stores an observation under the geohash cell containing {@code coordinate}.
     */
    public Result<Void> set(GeoCoordinate coordinate, RiskObservation observation) {
        if (coordinate == null) {
            return Result.failure(ServiceError.validation("coordinate is required"));
        }
        return setWithKey(keyFor(coordinate), observation);
    }

    /**
     * Stores an observation under an explicit geohash key, evicting the least recently accessed
     * entry first when the cache is full and the key is new.
     */
    public Result<Void> setWithKey(String key, RiskObservation observation) {
        if (!Geohash.isValid(key)) {
            return Result.failure(ServiceError.validation("Invalid geohash key: " + key));
        }
        if (observation == null) {
            return Result.failure(ServiceError.validation("observation is required"));
        }
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            String json;
            try {
                json = objectMapper.writeValueAsString(CacheRecord.of(key, observation, now));
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize cache entry {}: {}", key, e.getOriginalMessage());
                return Result.failure(ServiceError.parse("Could not serialize cache entry: " + e.getOriginalMessage()));
            }
            synchronized (admission) {
                if (!accessIndex.containsKey(key)) {
                    enforceCapacity();
                }
                store.put(ENTRY_PREFIX + key, json);
                accessIndex.put(key, now);
            }
            log.debug("Cached {} observation for {}", observation.getSource(), key);
            return Result.success(null);
        } catch (CacheStoreException e) {
            log.warn("Cache store write failed for {}: {}", key, e.getMessage());
            return Result.failure(ServiceError.general("Cache write failed: " + e.getMessage()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes an entry. Missing keys are ignored.
     */
    public void remove(String key) {
        if (key == null) {
            return;
        }
        lock.readLock().lock();
        try {
            discard(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every entry. Exclusive with respect to all other operations.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            for (String storeKey : store.keys()) {
                if (storeKey.startsWith(ENTRY_PREFIX)) {
                    store.remove(storeKey);
                }
            }
            log.debug("Cleared {} indexed cache entries", accessIndex.size());
        } catch (CacheStoreException e) {
            log.warn("Cache store could not be fully cleared: {}", e.getMessage());
        } finally {
            accessIndex.clear();
            lock.writeLock().unlock();
        }
    }

    /**
     * Purges expired and unreadable entries.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        lock.readLock().lock();
        try (LogContext ignored = LogContext.forCacheMaintenance("cleanup")) {
            Instant now = clock.instant();
            int removed = 0;
            for (String storeKey : store.keys()) {
                if (!storeKey.startsWith(ENTRY_PREFIX)) {
                    continue;
                }
                String key = storeKey.substring(ENTRY_PREFIX.length());
                Optional<String> raw = store.get(storeKey);
                if (raw.isEmpty()) {
                    accessIndex.remove(key);
                    continue;
                }
                CacheRecord record = decode(key, raw.get());
                if (record == null || !CacheRecord.FORMAT_VERSION.equals(record.formatVersion())
                        || isExpired(record, now)) {
                    discard(key);
                    removed++;
                }
            }
            lastCleanup.set(now);
            log.info("Cache cleanup removed {} entries, {} remain", removed, accessIndex.size());
            return removed;
        } catch (CacheStoreException e) {
            log.warn("Cache cleanup aborted: {}", e.getMessage());
            return 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheMetadata metadata() {
        Map<String, Instant> snapshot = new HashMap<>(accessIndex);
        return new CacheMetadata(snapshot.size(), snapshot, lruKey(snapshot), lastCleanup.get());
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), evictions.get(), accessIndex.size());
    }

    public String keyFor(GeoCoordinate coordinate) {
        return Geohash.encode(coordinate.latitude(), coordinate.longitude(), config.precision());
    }

    public GeocacheConfig getConfig() {
        return config;
    }

    /**
     * Returns true if the backing store can be listed. Used by health checks.
     */
    public boolean isStoreReachable() {
        try {
            store.keys();
            return true;
        } catch (CacheStoreException e) {
            log.debug("Cache store unreachable: {}", e.getMessage());
            return false;
        }
    }

    private boolean isExpired(CacheRecord record, Instant now) {
        Duration age = Duration.between(record.storedAt(), now);
        return age.compareTo(config.ttl()) > 0;
    }

    /**
     * Records an access. A key written by another instance sharing the store is admitted like a new write.
     */
    private void touch(String key, Instant now) throws CacheStoreException {
        if (accessIndex.replace(key, now) != null) {
            return;
        }
        synchronized (admission) {
            if (!accessIndex.containsKey(key)) {
                enforceCapacity();
            }
            accessIndex.put(key, now);
        }
    }

    private void enforceCapacity() throws CacheStoreException {
        while (accessIndex.size() >= config.capacity()) {
            String victim = lruKey(accessIndex);
            if (victim == null) {
                return;
            }
            store.remove(ENTRY_PREFIX + victim);
            if (accessIndex.remove(victim) != null) {
                evictions.incrementAndGet();
                metrics.recordCacheEviction();
                log.debug("Evicted least recently used cache entry {}", victim);
            }
        }
    }

    private static String lruKey(Map<String, Instant> index) {
        String oldestKey = null;
        Instant oldest = null;
        for (Map.Entry<String, Instant> entry : index.entrySet()) {
            if (oldest == null || entry.getValue().isBefore(oldest)) {
                oldest = entry.getValue();
                oldestKey = entry.getKey();
            }
        }
        return oldestKey;
    }

    private CacheRecord decode(String key, String json) {
        try {
            return objectMapper.readValue(json, CacheRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Corrupt cache entry {}: {}", key, e.getOriginalMessage());
            return null;
        }
    }

    private void discard(String key) {
        try {
            store.remove(ENTRY_PREFIX + key);
        } catch (CacheStoreException e) {
            log.warn("Could not remove cache entry {}: {}", key, e.getMessage());
        }
        accessIndex.remove(key);
    }

    private Optional<RiskObservation> miss() {
        misses.incrementAndGet();
        metrics.recordCacheMiss();
        return Optional.empty();
    }

    private void loadIndex() {
        try {
            for (String storeKey : store.keys()) {
                if (!storeKey.startsWith(ENTRY_PREFIX)) {
                    continue;
                }
                String key = storeKey.substring(ENTRY_PREFIX.length());
                store.get(storeKey)
                        .map(json -> decode(key, json))
                        .ifPresent(record -> accessIndex.put(key, record.storedAt()));
            }
        } catch (CacheStoreException e) {
            log.warn("Could not restore cache index: {}", e.getMessage());
        }
    }
}
