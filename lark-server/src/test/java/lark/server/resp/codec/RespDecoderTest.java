package lark.server.resp.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.TooLongFrameException;
import lark.server.resp.RespValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private static ByteBuf bytes(String wire) {
        return Unpooled.copiedBuffer(wire, StandardCharsets.UTF_8);
    }

    @Test
    void testDecodeValidCommand() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertTrue(channel.writeInbound(bytes("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n")));
        RespValue value = channel.readInbound();

        assertEquals(RespValue.Array.of(new RespValue.BulkString("ECHO"), new RespValue.BulkString("hi")), value);
        assertNull(channel.readInbound());
    }

    @Test
    void testDecodeRequestSplitAcrossReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertFalse(channel.writeInbound(bytes("*2\r\n$4\r\nEC")));
        assertFalse(channel.writeInbound(bytes("HO\r\n$5\r\nhel")));
        assertTrue(channel.writeInbound(bytes("lo\r\n")));

        RespValue value = channel.readInbound();
        assertEquals(RespValue.Array.of(new RespValue.BulkString("ECHO"), new RespValue.BulkString("hello")), value);
    }

    @Test
    void testDecodePipelinedRequests() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertTrue(channel.writeInbound(bytes("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPI")));

        RespValue ping = RespValue.Array.of(new RespValue.BulkString("PING"));
        assertEquals(ping, channel.readInbound());
        assertEquals(ping, channel.readInbound());
        assertNull(channel.readInbound());

        assertTrue(channel.writeInbound(bytes("NG\r\n")));
        assertEquals(ping, channel.readInbound());
    }

    @Test
    void testDecodeInvalidTypeTag() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        DecoderException e = assertThrows(DecoderException.class, () -> channel.writeInbound(bytes("?2\r\n")));
        assertInstanceOf(ProtocolException.class, e.getCause());
    }

    @Test
    void testDecodeLengthMismatch() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertThrows(DecoderException.class, () -> channel.writeInbound(bytes("*1\r\n$2\r\nPING\r\n")));
    }

    @Test
    void testDecodeIncompleteFrameOverLimit() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(16));

        assertFalse(channel.writeInbound(bytes("$100\r\n0123456789")));
        assertThrows(TooLongFrameException.class, () -> channel.writeInbound(bytes("0123456789")));
    }

    private static void writeInChunks(EmbeddedChannel channel, String wire, int chunkSize) {
        for (int i = 0; i < wire.length(); i += chunkSize) {
            channel.writeInbound(bytes(wire.substring(i, Math.min(wire.length(), i + chunkSize))));
        }
    }

    @Test
    void testDecodeNestedArraysOneByteAtATime() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        writeInChunks(channel, "*3\r\n*1\r\n$1\r\na\r\n*0\r\n:-7\r\n+OK\r\n", 1);

        RespValue expected = RespValue.Array.of(
                RespValue.Array.of(new RespValue.BulkString("a")),
                RespValue.Array.of(),
                new RespValue.Integer(-7));
        assertEquals(expected, channel.readInbound());
        assertEquals(new RespValue.SimpleString("OK"), channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    void testDecodeLongLineOneByteAtATime() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        String text = "x".repeat(10_000);

        writeInChunks(channel, "+" + text + "\r\n", 1);

        assertEquals(new RespValue.SimpleString(text), channel.readInbound());
    }

    @Test
    void testDecodeLargeArrayInSmallReads() {
        int elements = 50_000;
        StringBuilder wire = new StringBuilder("*").append(elements + 1).append("\r\n$5\r\nRPUSH\r\n");
        for (int i = 0; i < elements; i++) {
            wire.append("$1\r\nx\r\n");
        }
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertTimeout(Duration.ofSeconds(5), () -> writeInChunks(channel, wire.toString(), 64));

        RespValue.Array value = channel.readInbound();
        assertEquals(elements + 1, value.values().size());
        assertEquals(new RespValue.BulkString("RPUSH"), value.values().get(0));
        assertNull(channel.readInbound());
    }

    @Test
    void testDecodeRejectsExcessiveNesting() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        String wire = "*1\r\n".repeat(RespCodec.MAX_NESTING_DEPTH + 1) + ":1\r\n";

        DecoderException e = assertThrows(DecoderException.class, () -> channel.writeInbound(bytes(wire)));
        assertInstanceOf(ProtocolException.class, e.getCause());
        assertEquals("Array nesting too deep", e.getCause().getMessage());
    }

    @Test
    void testDecodeFrameLimitCountsConsumedElements() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(16));

        assertFalse(channel.writeInbound(bytes("*3\r\n$3\r\nabc\r\n")));
        assertThrows(TooLongFrameException.class, () -> channel.writeInbound(bytes("$3\r\nde")));
    }

    @Test
    void testDecodeFrameLimitAppliesPerValue() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(16));

        for (int i = 0; i < 4; i++) {
            assertFalse(channel.writeInbound(bytes("*1\r\n$3\r\n")));
            assertTrue(channel.writeInbound(bytes("abc\r\n")));
            assertEquals(RespValue.Array.of(new RespValue.BulkString("abc")), channel.readInbound());
        }
    }

    @Test
    void testRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RespDecoder(0));
    }
}
