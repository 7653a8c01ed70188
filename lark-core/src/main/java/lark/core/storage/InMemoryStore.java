package lark.core.storage;

import lark.core.common.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} backed by a hash map behind a single exclusive lock.
 * <p>
 * Reads take the lock as well, since checking an entry may evict it. Expired
 * entries are only removed when their key is accessed again.
 * <p>
 * Entries passed in or handed out outside of {@link #slot} are copies, so stored
 * lists change only while the lock is held.
 */
public class InMemoryStore implements KeyValueStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final MonotonicClock clock;

    public InMemoryStore() {
        this(MonotonicClock.system());
    }

    public InMemoryStore(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public Optional<Entry> lookup(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            return Optional.ofNullable(liveEntry(key)).map(Entry::detached);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Entry> upsert(String key, Entry entry) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(entry, "entry cannot be null");
        lock.lock();
        try {
            Entry previous = liveEntry(key);
            entries.put(key, entry.detached());
            return Optional.ofNullable(previous);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <R> R slot(String key, Function<Slot, R> action) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        MapSlot slot = new MapSlot(key);
        try {
            liveEntry(key);
            return action.apply(slot);
        } finally {
            slot.valid = false;
            lock.unlock();
        }
    }

    @Override
    public Optional<Entry> remove(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            if (liveEntry(key) == null) {
                return Optional.empty();
            }
            return Optional.of(entries.remove(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(String key) {
        return lookup(key).isPresent();
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long now() {
        return clock.nanos();
    }

    // Caller must hold the lock.
    private Entry liveEntry(String key) {
        Entry entry = entries.get(key);
        if (entry != null && entry.isExpired(clock.nanos())) {
            entries.remove(key);
            logger.trace("Evicted expired key {}", key);
            return null;
        }
        return entry;
    }

    private class MapSlot implements Slot {
        private final String key;
        private boolean valid = true;

        MapSlot(String key) {
            this.key = key;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public Optional<Entry> entry() {
            checkValid();
            return Optional.ofNullable(entries.get(key));
        }

        @Override
        public boolean isOccupied() {
            checkValid();
            return entries.containsKey(key);
        }

        @Override
        public Entry orInsert(Supplier<Entry> supplier) {
            checkValid();
            return entries.computeIfAbsent(key, k -> Objects.requireNonNull(supplier.get(), "entry cannot be null"));
        }

        @Override
        public Optional<Entry> insert(Entry entry) {
            checkValid();
            Objects.requireNonNull(entry, "entry cannot be null");
            return Optional.ofNullable(entries.put(key, entry.detached()));
        }

        @Override
        public Optional<Entry> remove() {
            checkValid();
            return Optional.ofNullable(entries.remove(key));
        }

        private void checkValid() {
            if (!valid) {
                throw new IllegalStateException("Slot for key " + key + " used outside of its action");
            }
        }
    }
}
