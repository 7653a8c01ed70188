package lark.server.resp.command;

import lark.server.resp.RespValue;
import lark.server.resp.codec.ProtocolException;

import java.util.List;

/**
 * A decoded request split into command name and arguments.
 */
public record CommandRequest(String name, List<RespValue> arguments) {

    public CommandRequest {
        arguments = List.copyOf(arguments);
    }

    /**
     * Splits a request value. Requests must be non-empty arrays whose first
     * element is a simple or bulk string.
     */
    public static CommandRequest from(RespValue request) throws ProtocolException {
        if (!(request instanceof RespValue.Array array)) {
            throw new ProtocolException("Request must be an array, got " + request.getClass().getSimpleName());
        }
        if (array.isEmpty()) {
            throw new ProtocolException("Request array is empty");
        }
        List<RespValue> values = array.values();
        String name = values.get(0).asString()
                .orElseThrow(() -> new ProtocolException("Command name must be a string"));
        return new CommandRequest(name, values.subList(1, values.size()));
    }
}
