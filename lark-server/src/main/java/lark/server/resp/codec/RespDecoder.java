package lark.server.resp.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import lark.server.resp.RespValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Decodes inbound bytes into {@link lark.server.resp.RespValue}s.
 * <p>
 * A value is read one element at a time. Completed elements are consumed from
 * the cumulation buffer and the arrays still waiting for elements are kept
 * between reads, so a value arriving in many small reads is never parsed from
 * its start again. A value still incomplete after {@code maxFrameBytes} bytes
 * fails with {@link TooLongFrameException}.
 */
public class RespDecoder extends ByteToMessageDecoder {
    public static final int DEFAULT_MAX_FRAME_BYTES = 512 * 1024 * 1024;

    private final int maxFrameBytes;

    // Arrays of the value in progress, innermost first.
    private final Deque<PartialArray> openArrays = new ArrayDeque<>();
    // Bytes of the value in progress already consumed from the buffer.
    private long consumedBytes;
    // Bytes past the reader index already searched for a CRLF without finding one.
    private int scannedBytes;

    public RespDecoder() {
        this(DEFAULT_MAX_FRAME_BYTES);
    }

    public RespDecoder(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive: " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws ProtocolException {
        try {
            while (in.isReadable()) {
                int checkpoint = in.readerIndex();
                RespValue element;
                try {
                    element = readElement(in);
                } catch (IncompleteFrameException e) {
                    in.readerIndex(checkpoint);
                    break;
                }
                consumedBytes += in.readerIndex() - checkpoint;
                scannedBytes = 0;

                RespValue value = element == null ? null : attach(element);
                if (value != null) {
                    consumedBytes = 0;
                    out.add(value);
                    return;
                }
            }
            checkFrameLength(in);
        } catch (RuntimeException e) {
            reset();
            throw e;
        }
    }

    /**
     * Reads the next element of the value in progress. Returns {@code null} when
     * the element opens an array that still needs its own elements.
     */
    private RespValue readElement(ByteBuf in) {
        byte tag = in.getByte(in.readerIndex());
        if (!RespCodec.isTypeTag(tag)) {
            // Let the codec report the malformed tag.
            return RespCodec.parse(in);
        }
        if (!headerLineAvailable(in)) {
            throw new IncompleteFrameException("Header line is not complete yet");
        }
        if (tag != RespCodec.ARRAY) {
            return RespCodec.parse(in);
        }
        if (openArrays.size() >= RespCodec.MAX_NESTING_DEPTH) {
            throw new ProtocolException("Array nesting too deep");
        }
        in.skipBytes(1);
        int count = RespCodec.readArrayCount(in);
        if (count == 0) {
            return new RespValue.Array(List.of());
        }
        openArrays.push(new PartialArray(count));
        return null;
    }

    // Every element starts with a CRLF-terminated line. The search resumes where the previous read stopped.
    private boolean headerLineAvailable(ByteBuf in) {
        int from = in.readerIndex() + Math.max(0, scannedBytes - 1);
        if (RespCodec.indexOfCrlf(in, from) >= 0) {
            return true;
        }
        scannedBytes = in.readableBytes();
        return false;
    }

    /**
     * Adds a completed element to the innermost open array, closing every array
     * it completes. Returns the finished top-level value, if any.
     */
    private RespValue attach(RespValue element) {
        RespValue value = element;
        while (!openArrays.isEmpty()) {
            PartialArray array = openArrays.peek();
            array.values.add(value);
            if (array.values.size() < array.count) {
                return null;
            }
            openArrays.pop();
            value = new RespValue.Array(array.values);
        }
        return value;
    }

    private void checkFrameLength(ByteBuf in) {
        long pending = consumedBytes + in.readableBytes();
        if (pending > maxFrameBytes) {
            throw new TooLongFrameException(
                    "Incomplete frame of " + pending + " bytes exceeds " + maxFrameBytes + " bytes");
        }
    }

    private void reset() {
        openArrays.clear();
        consumedBytes = 0;
        scannedBytes = 0;
    }

    private static final class PartialArray {
        private final int count;
        private final List<RespValue> values;

        PartialArray(int count) {
            this.count = count;
            this.values = new ArrayList<>(Math.min(count, RespCodec.MAX_PREALLOCATED_ELEMENTS));
        }
    }
}
