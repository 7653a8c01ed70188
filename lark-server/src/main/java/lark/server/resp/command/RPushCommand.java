package lark.server.resp.command;

import lark.core.storage.Entry;
import lark.core.storage.EntryValue;
import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code RPUSH key value [value ...]}
 * <p>
 * Appends to the tail of the list at key, creating it if needed, and replies
 * with the new length.
 */
public class RPushCommand implements Command {
    private static final Logger logger = LoggerFactory.getLogger(RPushCommand.class);

    public static final String NAME = "RPUSH";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RespValue handle(List<RespValue> arguments, KeyValueStore store) {
        Arguments args = new Arguments(arguments);
        String key;
        List<String> values = new ArrayList<>();
        try {
            key = args.nextString("Missing key", "Failed to extract key");
            while (args.hasNext()) {
                values.add(args.nextString("Failed to extract value"));
            }
            if (values.isEmpty()) {
                throw new ArgumentException("At least one value must be provided");
            }
        } catch (ArgumentException e) {
            logger.debug("Invalid {} arguments: {}", NAME, e.getMessage());
            return e.toReply(NAME);
        }

        return store.slot(key, slot -> {
            Entry entry = slot.orInsert(Entry::ofList);
            if (!(entry.value() instanceof EntryValue.ListValue list)) {
                return new RespValue.BulkError("WRONGTYPE Entry at key " + key + " is not a list");
            }
            return new RespValue.Integer(list.append(values));
        });
    }
}
