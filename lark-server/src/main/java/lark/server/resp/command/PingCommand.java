package lark.server.resp.command;

import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;

import java.util.List;

public class PingCommand implements Command {
    public static final String NAME = "PING";

    private static final RespValue PONG = new RespValue.SimpleString("PONG");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RespValue handle(List<RespValue> arguments, KeyValueStore store) {
        return PONG;
    }
}
