package lark.server.resp.command;

import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;

import java.util.List;

/**
 * Replies with its first argument as a bulk string, or an absent bulk string
 * when there is no usable argument.
 */
public class EchoCommand implements Command {
    public static final String NAME = "ECHO";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RespValue handle(List<RespValue> arguments, KeyValueStore store) {
        if (arguments.isEmpty()) {
            return RespValue.BulkString.absent();
        }
        return new RespValue.BulkString(arguments.get(0).asString().orElse(null));
    }
}
