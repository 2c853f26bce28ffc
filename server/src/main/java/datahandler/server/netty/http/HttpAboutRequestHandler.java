package datahandler.server.netty.http;

import java.util.Collections;

import datahandler.api.request.AboutRequest;
import datahandler.netty.http.DataHandlerHttpHandler;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@Sharable
public class HttpAboutRequestHandler extends SimpleChannelInboundHandler<AboutRequest> implements DataHandlerHttpHandler {

    public static final String ABOUT = "Data handler for the Analytics component. Visit /help for more info.";

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, AboutRequest msg) throws Exception {
        sendJsonResponse(ctx, Collections.singletonMap("about", ABOUT));
    }
}
