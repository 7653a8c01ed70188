package lark.core.storage;

import lark.core.common.MonotonicClock;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A stored value together with its optional deletion deadline, expressed as
 * a reading of the store's {@link MonotonicClock}.
 */
public record Entry(EntryValue value, OptionalLong deletionTime) {

    public Entry {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(deletionTime, "deletionTime cannot be null");
    }

    public static Entry ofString(String text) {
        return new Entry(new EntryValue.StringValue(text), OptionalLong.empty());
    }

    public static Entry ofList() {
        return new Entry(new EntryValue.ListValue(), OptionalLong.empty());
    }

    public static Entry ofList(List<String> items) {
        return new Entry(new EntryValue.ListValue(items), OptionalLong.empty());
    }

    public Entry withDeletion(long deadline) {
        return new Entry(value, OptionalLong.of(deadline));
    }

    /**
     * Returns an entry equal to this one that shares no mutable state with it.
     */
    public Entry detached() {
        if (value instanceof EntryValue.ListValue list) {
            return new Entry(new EntryValue.ListValue(list.items()), deletionTime);
        }
        return this;
    }

    public boolean isExpired(long now) {
        return deletionTime.isPresent() && MonotonicClock.hasPassed(deletionTime.getAsLong(), now);
    }
}
