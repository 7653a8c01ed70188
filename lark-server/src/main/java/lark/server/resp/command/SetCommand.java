package lark.server.resp.command;

import lark.core.storage.Entry;
import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * {@code SET key value [PX milliseconds]...}
 * <p>
 * Replaces whatever is stored at the key, whatever its type or expiry. When PX
 * is given more than once the last one applies.
 */
public class SetCommand implements Command {
    private static final Logger logger = LoggerFactory.getLogger(SetCommand.class);

    public static final String NAME = "SET";

    private static final RespValue OK = new RespValue.SimpleString("OK");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RespValue handle(List<RespValue> arguments, KeyValueStore store) {
        SetArguments parsed;
        try {
            parsed = SetArguments.parse(arguments);
        } catch (ArgumentException e) {
            logger.debug("Invalid {} arguments: {}", NAME, e.getMessage());
            return e.toReply(NAME);
        }

        Entry entry = Entry.ofString(parsed.value);
        if (parsed.expiryMillis.isPresent()) {
            long ttl = TimeUnit.MILLISECONDS.toNanos(parsed.expiryMillis.getAsLong());
            entry = entry.withDeletion(store.now() + ttl);
        }
        store.upsert(parsed.key, entry);
        return OK;
    }

    private static final class SetArguments {
        private final String key;
        private final String value;
        private final OptionalLong expiryMillis;

        private SetArguments(String key, String value, OptionalLong expiryMillis) {
            this.key = key;
            this.value = value;
            this.expiryMillis = expiryMillis;
        }

        static SetArguments parse(List<RespValue> arguments) throws ArgumentException {
            Arguments args = new Arguments(arguments);
            String key = args.nextString("Missing key", "Failed to extract key");
            String value = args.nextString("Missing value", "Failed to extract value");

            OptionalLong expiryMillis = OptionalLong.empty();
            while (args.hasNext()) {
                String option = args.nextString("Failed to extract option");
                if (!"px".equals(option.toLowerCase(Locale.ROOT))) {
                    throw new ArgumentException(option + " is not a valid option");
                }
                String duration = args.nextString("Missing milliseconds for PX option", "Failed to extract duration string");
                expiryMillis = OptionalLong.of(parseMillis(duration));
            }
            return new SetArguments(key, value, expiryMillis);
        }

        private static long parseMillis(String duration) throws ArgumentException {
            long millis;
            try {
                millis = Long.parseLong(duration);
            } catch (NumberFormatException e) {
                throw new ArgumentException("Failed to convert PX duration string to a number", e);
            }
            if (millis < 0) {
                throw new ArgumentException("Failed to convert PX duration string to a number");
            }
            return millis;
        }
    }
}
