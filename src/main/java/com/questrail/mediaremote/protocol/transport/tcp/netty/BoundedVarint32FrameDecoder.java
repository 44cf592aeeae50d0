package com.questrail.mediaremote.protocol.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;

/**
 * Splits the inbound stream on varint32 length prefixes, like
 * {@code ProtobufVarint32FrameDecoder}, but rejects a prefix above
 * {@code maxFrameLength} as soon as it is read.
 */
final class BoundedVarint32FrameDecoder extends ByteToMessageDecoder
{
    private final int maxFrameLength;

    BoundedVarint32FrameDecoder(int maxFrameLength)
    {
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        int start = in.readerIndex();
        int length = readRawVarint32(in);
        if (length == -1) {
            in.readerIndex(start);
            return;
        }

        if (length > maxFrameLength) {
            in.skipBytes(in.readableBytes());
            throw new TooLongFrameException(
                    "frame length " + Integer.toUnsignedString(length) + " exceeds " + maxFrameLength);
        }

        if (in.readableBytes() < length) {
            in.readerIndex(start);
            return;
        }
        out.add(in.readRetainedSlice(length));
    }

    /**
     * @return the decoded value, or {@code -1} if the prefix is not complete yet
     */
    private static int readRawVarint32(ByteBuf in)
    {
        int result = 0;
        for (int shift = 0; shift < 35; shift += 7) {
            if (!in.isReadable()) {
                return -1;
            }
            byte b = in.readByte();
            result |= (b & 0x7F) << shift;
            if (b >= 0) {
                if (result < 0) {
                    // Five-byte prefix with the sign bit set.
                    in.skipBytes(in.readableBytes());
                    throw new TooLongFrameException("frame length " + Integer.toUnsignedString(result)
                            + " exceeds " + Integer.MAX_VALUE);
                }
                return result;
            }
        }
        in.skipBytes(in.readableBytes());
        throw new CorruptedFrameException("malformed varint32 length prefix");
    }
}
