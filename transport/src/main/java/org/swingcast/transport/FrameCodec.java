package org.swingcast.transport;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.common.JsonCodec;

import java.io.IOException;
import java.util.List;

/** JSON body of one length-prefixed frame. Undecodable frames are dropped, the connection stays up. */
final class FrameCodec extends MessageToMessageCodec<ByteBuf, ChannelFrame> {

    private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);

    @Override
    protected void encode(ChannelHandlerContext ctx, ChannelFrame frame, List<Object> out) {
        out.add(Unpooled.wrappedBuffer(JsonCodec.encodeBytes(frame)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf buf, List<Object> out) {
        byte[] bytes = ByteBufUtil.getBytes(buf);
        try {
            ChannelFrame frame = JsonCodec.decodeBytes(bytes, ChannelFrame.class);
            if (frame == null || frame.cmd == null) {
                log.warn("dropping frame without command from {}", ctx.channel().remoteAddress());
                return;
            }
            out.add(frame);
        } catch (IOException e) {
            log.warn("dropping undecodable frame ({} bytes) from {}: {}",
                    bytes.length, ctx.channel().remoteAddress(), e.getMessage());
        }
    }
}
