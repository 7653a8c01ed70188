package lark.server.resp.command;

import lark.server.resp.RespValue;

import java.util.Iterator;
import java.util.List;

/**
 * Sequential reader over a command's arguments.
 */
class Arguments {
    private final Iterator<RespValue> iterator;

    Arguments(List<RespValue> arguments) {
        this.iterator = arguments.iterator();
    }

    boolean hasNext() {
        return iterator.hasNext();
    }

    /**
     * Reads the next argument as text.
     *
     * @param missing reason reported when there is no next argument
     * @param invalid reason reported when the next argument does not carry text
     */
    String nextString(String missing, String invalid) throws ArgumentException {
        if (!iterator.hasNext()) {
            throw new ArgumentException(missing);
        }
        return iterator.next().asString().orElseThrow(() -> new ArgumentException(invalid));
    }

    /**
     * Reads the next argument, which the caller has checked exists, as text.
     */
    String nextString(String invalid) throws ArgumentException {
        return nextString(invalid, invalid);
    }
}
