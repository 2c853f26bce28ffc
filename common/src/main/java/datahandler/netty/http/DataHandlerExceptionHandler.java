package datahandler.netty.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.response.DataHandlerException;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpResponseStatus;

@Sharable
public class DataHandlerExceptionHandler extends SimpleChannelInboundHandler<DataHandlerException> implements DataHandlerHttpHandler {

    private static final Logger log = LoggerFactory.getLogger(DataHandlerExceptionHandler.class);

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DataHandlerException msg) throws Exception {
        this.sendHttpError(ctx, msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        log.error("Exception in pipeline", cause);
        if (cause instanceof DataHandlerException) {
            this.sendHttpError(ctx, (DataHandlerException) cause);
        } else if (null != cause.getCause() && cause.getCause() instanceof DataHandlerException) {
            this.sendHttpError(ctx, (DataHandlerException) cause.getCause());
        } else if (cause instanceof IllegalArgumentException || cause.getCause() instanceof IllegalArgumentException) {
            Throwable t = cause instanceof IllegalArgumentException ? cause : cause.getCause();
            this.sendHttpError(ctx, new DataHandlerException(HttpResponseStatus.BAD_REQUEST.code(), t.getMessage(), ""));
        } else {
            DataHandlerException e = new DataHandlerException(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(), cause.getMessage(), "");
            this.sendHttpError(ctx, e);
        }
    }
}
