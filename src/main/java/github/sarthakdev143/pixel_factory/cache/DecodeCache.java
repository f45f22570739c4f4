package github.sarthakdev143.pixel_factory.cache;

import github.sarthakdev143.pixel_factory.model.PixelImage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Time-to-live cache of decoded images keyed by source (path or URL).
 * <p>
 * Expiry is sweep-driven: {@link #get(String)} never drops entries, a background
 * task removes those older than the TTL. Callers refresh hot entries with
 * {@link #updateTimestamp(String)}. While disabled every lookup misses and writes are
 * ignored, but stored entries are kept.
 */
public class DecodeCache implements AutoCloseable {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(2);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

    private static final Logger logger = LoggerFactory.getLogger(DecodeCache.class);

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter evictionCounter;
    private ScheduledExecutorService sweeper;
    private boolean active = true;

    public DecodeCache(Duration ttl, Clock clock, MeterRegistry meterRegistry) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive.");
        }
        this.ttl = ttl;
        this.clock = clock;
        this.hitCounter = meterRegistry.counter("pixel_factory.cache.hits");
        this.missCounter = meterRegistry.counter("pixel_factory.cache.misses");
        this.evictionCounter = meterRegistry.counter("pixel_factory.cache.evictions");
    }

    public synchronized void startSweeper(Duration interval) {
        if (sweeper != null) {
            return;
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Cache sweep interval must be positive.");
        }

        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "decode-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        sweeper.scheduleWithFixedDelay(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Decode cache sweeper running every {} with TTL {}", interval, ttl);
    }

    public Optional<PixelImage> get(String key) {
        lock.readLock().lock();
        try {
            if (!active) {
                return Optional.empty();
            }
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                missCounter.increment();
                return Optional.empty();
            }
            hitCounter.increment();
            return Optional.of(entry.image());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(String key, PixelImage image) {
        lock.writeLock().lock();
        try {
            if (!active) {
                return;
            }
            entries.put(key, new CacheEntry(key, image, clock.instant()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean updateTimestamp(String key) {
        lock.writeLock().lock();
        try {
            if (!active) {
                return false;
            }
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            entries.put(key, entry.touchedAt(clock.instant()));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void enable() {
        setActive(true);
    }

    public void disable() {
        setActive(false);
    }

    public boolean isEnabled() {
        lock.readLock().lock();
        try {
            return active;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;

        lock.writeLock().lock();
        try {
            Iterator<CacheEntry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                CacheEntry entry = iterator.next();
                if (Duration.between(entry.insertedAt(), now).compareTo(ttl) > 0) {
                    iterator.remove();
                    evicted++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (evicted > 0) {
            evictionCounter.increment(evicted);
            logger.debug("Evicted {} expired decode cache entries", evicted);
        }
        return evicted;
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    private void setActive(boolean value) {
        lock.writeLock().lock();
        try {
            active = value;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Decode cache {}", value ? "enabled" : "disabled");
    }

    private void sweepSafely() {
        try {
            evictExpired();
        } catch (RuntimeException e) {
            // A failed sweep must not cancel the schedule.
            logger.error("Decode cache sweep failed", e);
        }
    }

    private record CacheEntry(String key, PixelImage image, Instant insertedAt) {

        CacheEntry touchedAt(Instant timestamp) {
            return new CacheEntry(key, image, timestamp);
        }
    }
}
