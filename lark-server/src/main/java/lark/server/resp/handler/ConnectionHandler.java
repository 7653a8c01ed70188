package lark.server.resp.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;
import lark.server.resp.codec.ProtocolException;
import lark.server.resp.command.CommandRegistry;
import lark.server.resp.command.CommandRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs decoded requests of one connection against the shared store and writes
 * back the replies, in arrival order.
 * <p>
 * Requests that cannot be dispatched and undecodable input both close the
 * connection without a reply.
 */
public class ConnectionHandler extends SimpleChannelInboundHandler<RespValue> {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final KeyValueStore store;
    private final CommandRegistry registry;

    public ConnectionHandler(KeyValueStore store, CommandRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.debug("Accepted connection from {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        logger.debug("Connection from {} closed", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespValue msg) {
        CommandRequest request;
        try {
            request = CommandRequest.from(msg);
        } catch (ProtocolException e) {
            logger.warn("Closing connection from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            ctx.close();
            return;
        }

        RespValue response = registry.dispatch(request, store);
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            logger.debug("Closing connection from {} after decode failure: {}",
                    ctx.channel().remoteAddress(), cause.getMessage());
        } else if (cause instanceof IOException) {
            logger.debug("Connection from {} failed: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            logger.error("Error while handling RESP request", cause);
        }
        ctx.close();
    }
}
