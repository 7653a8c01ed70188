package lark.core.storage;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Mutable view of a single key, handed out by {@link KeyValueStore#slot}.
 * A slot is valid only for the duration of the action it was passed to.
 */
public interface Slot {

    String key();

    Optional<Entry> entry();

    boolean isOccupied();

    /**
     * Returns the current entry, installing the supplied one first if the slot is vacant.
     */
    Entry orInsert(Supplier<Entry> supplier);

    /**
     * Installs {@code entry}, returning the entry it replaced.
     */
    Optional<Entry> insert(Entry entry);

    Optional<Entry> remove();
}
