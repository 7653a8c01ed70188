package lark.server.resp.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import lark.server.resp.RespValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses and serializes {@link RespValue}s.
 *
 * <pre>
 * +text\r\n                 simple string
 * -text\r\n                 simple error
 * $length\r\nbytes\r\n      bulk string ($-1\r\n when absent)
 * !length\r\nbytes\r\n      bulk error
 * :[+|-]digits\r\n          integer
 * *count\r\n...             array of count values
 * _\r\n                     null
 * </pre>
 * Lengths are byte lengths of the UTF-8 payload.
 */
public final class RespCodec {

    public static final byte SIMPLE_STRING = '+';
    public static final byte SIMPLE_ERROR = '-';
    public static final byte BULK_STRING = '$';
    public static final byte BULK_ERROR = '!';
    public static final byte INTEGER = ':';
    public static final byte ARRAY = '*';
    public static final byte NULL = '_';

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    static final int MAX_PREALLOCATED_ELEMENTS = 1024;

    /**
     * Deepest array nesting accepted; a request nested further is rejected as malformed.
     */
    public static final int MAX_NESTING_DEPTH = 512;

    private RespCodec() {
    }

    /**
     * Reads one complete value from {@code in}, advancing its reader index past it.
     * <p>
     * On failure the reader index is left wherever parsing stopped; callers that
     * want to retry must restore it themselves.
     *
     * @throws IncompleteFrameException if the buffer ends before the value does
     * @throws ProtocolException        if the bytes are not a valid value
     */
    public static RespValue parse(ByteBuf in) throws ProtocolException {
        return parse(in, 0);
    }

    private static RespValue parse(ByteBuf in, int depth) {
        if (!in.isReadable()) {
            throw new IncompleteFrameException("Expected a type tag but no bytes are available");
        }
        byte tag = in.readByte();
        return switch (tag) {
            case SIMPLE_STRING -> new RespValue.SimpleString(readLine(in, "simple string"));
            case SIMPLE_ERROR -> new RespValue.SimpleError(readLine(in, "simple error"));
            case BULK_STRING -> new RespValue.BulkString(readBulk(in, "bulk string", true));
            case BULK_ERROR -> new RespValue.BulkError(readBulk(in, "bulk error", false));
            case INTEGER -> new RespValue.Integer(parseDecimal(readLine(in, "integer"), "integer"));
            case ARRAY -> readArray(in, depth);
            case NULL -> readNull(in);
            default -> throw new ProtocolException("Unknown type tag '" + printable(tag) + "'");
        };
    }

    /**
     * Writes the wire encoding of {@code value} to {@code out}.
     *
     * @throws IllegalArgumentException if the value has no legal encoding
     */
    public static void serialize(RespValue value, ByteBuf out) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value instanceof RespValue.SimpleString simple) {
            writeLine(out, SIMPLE_STRING, singleLine(simple.text()));
        } else if (value instanceof RespValue.SimpleError error) {
            writeLine(out, SIMPLE_ERROR, singleLine(error.text()));
        } else if (value instanceof RespValue.BulkString bulk) {
            if (bulk.isAbsent()) {
                writeLine(out, BULK_STRING, "-1");
            } else {
                writeBulk(out, BULK_STRING, bulk.text());
            }
        } else if (value instanceof RespValue.BulkError error) {
            writeBulk(out, BULK_ERROR, error.text());
        } else if (value instanceof RespValue.Integer integer) {
            writeLine(out, INTEGER, Long.toString(integer.value()));
        } else if (value instanceof RespValue.Array array) {
            writeLine(out, ARRAY, Integer.toString(array.values().size()));
            for (RespValue element : array.values()) {
                serialize(element, out);
            }
        } else if (value instanceof RespValue.Null) {
            writeLine(out, NULL, "");
        } else {
            throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
        }
    }

    public static byte[] serialize(RespValue value) {
        ByteBuf buffer = Unpooled.buffer();
        try {
            serialize(value, buffer);
            return ByteBufUtil.getBytes(buffer);
        } finally {
            buffer.release();
        }
    }

    private static String readLine(ByteBuf in, String what) {
        int eol = indexOfCrlf(in);
        if (eol < 0) {
            throw new IncompleteFrameException("Missing CRLF terminator after " + what);
        }
        String line = in.toString(in.readerIndex(), eol - in.readerIndex(), StandardCharsets.UTF_8);
        in.readerIndex(eol + 2);
        return line;
    }

    private static int indexOfCrlf(ByteBuf in) {
        return indexOfCrlf(in, in.readerIndex());
    }

    static int indexOfCrlf(ByteBuf in, int fromIndex) {
        int last = in.writerIndex() - 1;
        for (int i = fromIndex; i < last; i++) {
            if (in.getByte(i) == CR && in.getByte(i + 1) == LF) {
                return i;
            }
        }
        return -1;
    }

    private static String readBulk(ByteBuf in, String what, boolean allowAbsent) {
        long length = parseDecimal(readLine(in, what + " length"), what + " length");
        if (length == -1 && allowAbsent) {
            return null;
        }
        if (length < 0) {
            throw new ProtocolException("Invalid " + what + " length " + length);
        }
        if (length > Integer.MAX_VALUE - 2) {
            throw new ProtocolException(what + " length " + length + " is too large");
        }
        int size = (int) length;
        if (in.readableBytes() < size + 2) {
            throw new IncompleteFrameException(String.format(
                    "%s declares %d bytes but only %d bytes are available", what, size, in.readableBytes()));
        }
        int end = in.readerIndex() + size;
        if (in.getByte(end) != CR || in.getByte(end + 1) != LF) {
            throw new ProtocolException(String.format(
                    "%s does not end with CRLF after its declared length of %d bytes", what, size));
        }
        String text = in.toString(in.readerIndex(), size, StandardCharsets.UTF_8);
        in.skipBytes(size + 2);
        return text;
    }

    private static RespValue readArray(ByteBuf in, int depth) {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new ProtocolException("Array nesting too deep");
        }
        int count = readArrayCount(in);
        List<RespValue> values = new ArrayList<>(Math.min(count, MAX_PREALLOCATED_ELEMENTS));
        for (int i = 0; i < count; i++) {
            values.add(parse(in, depth + 1));
        }
        return new RespValue.Array(values);
    }

    /**
     * Reads the element count of an array whose tag has already been consumed.
     */
    static int readArrayCount(ByteBuf in) {
        long count = parseDecimal(readLine(in, "array count"), "array count");
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new ProtocolException("Invalid array count " + count);
        }
        return (int) count;
    }

    static boolean isTypeTag(byte tag) {
        return switch (tag) {
            case SIMPLE_STRING, SIMPLE_ERROR, BULK_STRING, BULK_ERROR, INTEGER, ARRAY, NULL -> true;
            default -> false;
        };
    }

    private static RespValue readNull(ByteBuf in) {
        String body = readLine(in, "null");
        if (!body.isEmpty()) {
            throw new ProtocolException("Null must not carry a body, got '" + body + "'");
        }
        return RespValue.NULL;
    }

    static long parseDecimal(String text, String what) {
        int digitsStart = 0;
        if (!text.isEmpty() && (text.charAt(0) == '+' || text.charAt(0) == '-')) {
            digitsStart = 1;
        }
        if (digitsStart == text.length()) {
            throw new ProtocolException("Invalid " + what + " '" + text + "': no digits");
        }
        for (int i = digitsStart; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new ProtocolException("Invalid " + what + " '" + text + "': not a decimal number");
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid " + what + " '" + text + "': out of 64-bit range", e);
        }
    }

    private static String singleLine(String text) {
        if (text.indexOf(CR) >= 0 || text.indexOf(LF) >= 0) {
            throw new IllegalArgumentException("Simple values cannot contain CR or LF: " + text);
        }
        return text;
    }

    private static void writeLine(ByteBuf out, byte tag, String line) {
        out.writeByte(tag);
        out.writeCharSequence(line, StandardCharsets.UTF_8);
        out.writeByte(CR);
        out.writeByte(LF);
    }

    private static void writeBulk(ByteBuf out, byte tag, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        writeLine(out, tag, Integer.toString(bytes.length));
        out.writeBytes(bytes);
        out.writeByte(CR);
        out.writeByte(LF);
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02X", b);
    }
}
