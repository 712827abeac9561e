package com.questrail.grpcwire.transport.netty;

import com.questrail.grpcwire.transport.ByteSink;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * NettyByteSink
 * =============================================================================
 * Netty-backed implementation of the {@link ByteSink} port.
 *
 * <p>Committed bytes accumulate in one {@link ByteBuf} taken from the channel's
 * allocator, which is the transport's buffer pool. {@link #flush()} hands that
 * buffer to {@link Channel#writeAndFlush(Object)} and waits for the write to
 * complete.</p>
 *
 * <p>When called on the channel's own event loop, {@link #flush()} cannot
 * wait; it returns as soon as the write has been issued, unless the write has
 * already completed.</p>
 */
public final class NettyByteSink implements ByteSink
{
    static final int INITIAL_CAPACITY = 256;

    private final Channel channel;

    private ByteBuf pending;
    private int reserved;

    public NettyByteSink(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public ByteBuffer reserve(int sizeHint)
    {
        int needed = Math.max(sizeHint, 1);

        ByteBuf buf = pendingBuffer(needed);
        buf.ensureWritable(needed);
        reserved = buf.writableBytes();
        return buf.nioBuffer(buf.writerIndex(), reserved);
    }

    @Override
    public void commit(int count)
    {
        if (count < 0 || count > reserved) {
            throw new IllegalArgumentException("commit of " + count + " bytes exceeds reserved " + reserved);
        }
        pending.writerIndex(pending.writerIndex() + count);
        reserved -= count;
    }

    @Override
    public void write(byte[] source, int offset, int length)
    {
        Objects.requireNonNull(source, "source");
        Objects.checkFromIndexSize(offset, length, source.length);

        pendingBuffer(length).writeBytes(source, offset, length);
        reserved = 0;
    }

    @Override
    public void flush() throws IOException
    {
        ByteBuf out = pending;
        pending = null;
        reserved = 0;

        if (out == null || !out.isReadable()) {
            if (out != null) {
                out.release();
            }
            channel.flush();
            return;
        }

        ChannelFuture future = channel.writeAndFlush(out);
        if (!future.isDone() && channel.eventLoop().inEventLoop()) {
            return;
        }

        try {
            future.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while flushing to " + channel);
        }

        if (!future.isSuccess()) {
            throw new IOException("Flush to " + channel + " failed", future.cause());
        }
    }

    /**
     * Drop committed but unflushed bytes.
     */
    public void discard()
    {
        if (pending != null) {
            pending.release();
            pending = null;
        }
        reserved = 0;
    }

    private ByteBuf pendingBuffer(int needed)
    {
        if (pending == null) {
            pending = channel.alloc().buffer(Math.max(needed, INITIAL_CAPACITY));
        }
        return pending;
    }
}
