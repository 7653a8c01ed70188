package lark.server.resp;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A value of the RESP wire protocol. There is one record per wire type; see
 * {@link lark.server.resp.codec.RespCodec} for the encoding of each.
 */
public sealed interface RespValue {

    RespValue NULL = new Null();

    /**
     * Text carried by a simple string or a present bulk string, empty for every other value.
     */
    default Optional<String> asString() {
        return Optional.empty();
    }

    record SimpleString(String text) implements RespValue {
        public SimpleString {
            Objects.requireNonNull(text, "text cannot be null");
        }

        @Override
        public Optional<String> asString() {
            return Optional.of(text);
        }
    }

    record SimpleError(String text) implements RespValue {
        public SimpleError {
            Objects.requireNonNull(text, "text cannot be null");
        }
    }

    /**
     * Length-prefixed string. A null {@code text} is the absent bulk string, which
     * is a different wire value from {@link Null}.
     */
    record BulkString(String text) implements RespValue {

        public static BulkString absent() {
            return new BulkString(null);
        }

        public boolean isAbsent() {
            return text == null;
        }

        @Override
        public Optional<String> asString() {
            return Optional.ofNullable(text);
        }
    }

    record BulkError(String text) implements RespValue {
        public BulkError {
            Objects.requireNonNull(text, "text cannot be null");
        }
    }

    record Integer(long value) implements RespValue {
    }

    record Array(List<RespValue> values) implements RespValue {
        public Array {
            values = List.copyOf(values);
        }

        public static Array of(RespValue... values) {
            return new Array(List.of(values));
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }
    }

    record Null() implements RespValue {
    }
}
