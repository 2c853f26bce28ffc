package datahandler.netty.http;

import datahandler.api.response.DataHandlerException;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Answers requests that no route claimed.
 */
@Sharable
public class HttpNotFoundHandler extends SimpleChannelInboundHandler<FullHttpRequest> implements DataHandlerHttpHandler {

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest msg) throws Exception {
        this.sendHttpError(ctx, new DataHandlerException(HttpResponseStatus.NOT_FOUND.code(), "Resource not found", msg.uri()));
    }
}
