package lark.server.resp.codec;

/**
 * The available bytes end before the value does. More bytes from the same
 * connection may complete it.
 */
public class IncompleteFrameException extends ProtocolException {

    public IncompleteFrameException(String message) {
        super(message);
    }
}
