package com.oniongateway.core.dispatch;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * 每条连接 pipeline 的最后一个 handler，到这里的异常只结束本连接。
 */
@Slf4j
final class ConnectionGuard extends ChannelInboundHandlerAdapter {

    private final ConnectionTask task;

    ConnectionGuard(ConnectionTask task) {
        this.task = task;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        task.fail(task.stage(), cause);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            task.idle();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        log.debug("Dropping unhandled {} on channel {}", msg.getClass().getSimpleName(),
                ctx.channel().id().asShortText());
        ReferenceCountUtil.release(msg);
    }
}
