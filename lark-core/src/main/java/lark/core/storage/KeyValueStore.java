package lark.core.storage;

import java.util.Optional;
import java.util.function.Function;

/**
 * Keyed entry storage with lazy expiry.
 * <p>
 * Every operation evicts an expired entry for the key it touches before doing
 * anything else, so an expired entry is indistinguishable from an absent one.
 */
public interface KeyValueStore {

    Optional<Entry> lookup(String key);

    /**
     * Installs {@code entry} at {@code key} unconditionally.
     *
     * @return the live entry that was replaced, if any
     */
    Optional<Entry> upsert(String key, Entry entry);

    /**
     * Runs {@code action} with exclusive access to the slot for {@code key}.
     */
    <R> R slot(String key, Function<Slot, R> action);

    Optional<Entry> remove(String key);

    boolean contains(String key);

    int size();

    /**
     * Current reading of the clock expiry deadlines are compared against.
     */
    long now();
}
