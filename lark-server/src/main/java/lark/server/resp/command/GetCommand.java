package lark.server.resp.command;

import lark.core.storage.Entry;
import lark.core.storage.EntryValue;
import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

public class GetCommand implements Command {
    private static final Logger logger = LoggerFactory.getLogger(GetCommand.class);

    public static final String NAME = "GET";

    static final String WRONG_TYPE = "WRONGTYPE stored type is not a string";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RespValue handle(List<RespValue> arguments, KeyValueStore store) {
        String key;
        try {
            key = parseKey(arguments);
        } catch (ArgumentException e) {
            logger.debug("Invalid {} arguments: {}", NAME, e.getMessage());
            return e.toReply(NAME);
        }

        Optional<Entry> entry = store.lookup(key);
        if (entry.isEmpty()) {
            return RespValue.NULL;
        }
        if (entry.get().value() instanceof EntryValue.StringValue string) {
            return new RespValue.BulkString(string.text());
        }
        return new RespValue.BulkError(WRONG_TYPE);
    }

    private static String parseKey(List<RespValue> arguments) throws ArgumentException {
        Arguments args = new Arguments(arguments);
        String key = args.nextString("Missing key", "Failed to extract key");
        if (args.hasNext()) {
            throw new ArgumentException("Too many arguments");
        }
        return key;
    }
}
