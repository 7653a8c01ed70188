package lark.core.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Payload of a stored {@link Entry}. The store itself never looks inside it;
 * commands decide what to do when they find a shape they do not expect.
 */
public sealed interface EntryValue {

    record StringValue(String text) implements EntryValue {
        public StringValue {
            Objects.requireNonNull(text, "text cannot be null");
        }
    }

    /**
     * List payload, appended to in place. Only the instance reached through the
     * store's slot for the owning key is the stored one; every other accessor
     * hands out a copy.
     */
    record ListValue(List<String> items) implements EntryValue {
        public ListValue {
            items = new ArrayList<>(items);
        }

        public ListValue() {
            this(List.of());
        }

        public int append(Collection<String> values) {
            items.addAll(values);
            return items.size();
        }

        public int size() {
            return items.size();
        }

        @Override
        public List<String> items() {
            return Collections.unmodifiableList(items);
        }
    }
}
