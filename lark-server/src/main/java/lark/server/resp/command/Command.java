package lark.server.resp.command;

import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;

import java.util.List;

public interface Command {

    /**
     * Name the command is registered under. Matched case-insensitively.
     */
    String name();

    /**
     * Executes the command and returns the reply. Argument and type errors are
     * returned as error replies rather than thrown.
     *
     * @param arguments request elements following the command name
     */
    RespValue handle(List<RespValue> arguments, KeyValueStore store);
}
