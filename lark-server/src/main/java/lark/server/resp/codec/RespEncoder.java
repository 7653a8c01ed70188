package lark.server.resp.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lark.server.resp.RespValue;

public class RespEncoder extends MessageToByteEncoder<RespValue> {
    @Override
    protected void encode(ChannelHandlerContext ctx, RespValue msg, ByteBuf out) throws IllegalArgumentException {
        RespCodec.serialize(msg, out);
    }
}
