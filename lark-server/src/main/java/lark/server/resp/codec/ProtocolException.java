package lark.server.resp.codec;

import lark.core.error.LarkException;

/**
 * Raised when bytes read from a connection do not form a valid RESP value.
 */
public class ProtocolException extends LarkException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
