package lark.server.resp.command;

import lark.core.error.LarkException;
import lark.server.resp.RespValue;

/**
 * A command's arguments are missing or malformed. The message is the reason
 * reported back to the client.
 */
public class ArgumentException extends LarkException {

    public ArgumentException(String reason) {
        super(reason);
    }

    public ArgumentException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public RespValue.BulkError toReply(String commandName) {
        return new RespValue.BulkError("ERR " + getMessage() + " for '" + commandName + "' command");
    }
}
