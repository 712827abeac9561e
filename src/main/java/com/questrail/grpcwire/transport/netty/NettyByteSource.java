package com.questrail.grpcwire.transport.netty;

import com.questrail.grpcwire.buffer.ByteSequence;
import com.questrail.grpcwire.transport.ByteSource;
import com.questrail.grpcwire.transport.ReadResult;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * NettyByteSource
 * =============================================================================
 * Netty-backed implementation of the {@link ByteSource} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It is installed in
 * a channel pipeline as an inbound handler and accumulates every inbound
 * {@link ByteBuf} until a reader consumes it. It MUST NOT decode frames.
 *
 * <h2>Threading</h2>
 * Inbound buffers arrive on the channel's event loop; {@link #read()} is called
 * from the reader's own thread and blocks until the event loop has delivered
 * something new. All shared state is guarded by one lock.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Readers see the accumulated bytes
 * as a {@link ByteSequence} of read-only views over the component buffers; no
 * bytes are copied. Components are released once fully consumed, so a view
 * is only valid until the next {@link #advanceTo(long, long)}.
 *
 * <h2>Back-pressure</h2>
 * Once more than the high-water mark is buffered, the channel's
 * {@code autoRead} is switched off. It is switched back on when consumption
 * brings the buffer down to the mark, or when the reader has examined every
 * buffered byte and must wait for more, so a frame larger than the mark still
 * completes.
 *
 * <h2>Lifecycle</h2>
 * Channel inactivity, input shutdown or handler removal complete the stream;
 * bytes already buffered remain readable until consumed or {@link #close()}.
 */
public final class NettyByteSource extends ChannelInboundHandlerAdapter implements ByteSource, Closeable
{
    public static final int DEFAULT_HIGH_WATER_MARK = 1024 * 1024;

    private final int highWaterMark;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // Unbounded component count: consolidation would move bytes under live views.
    private final CompositeByteBuf cumulation = Unpooled.compositeBuffer(Integer.MAX_VALUE);

    private long examined;
    private boolean completed;
    private Throwable failure;
    private boolean cancelRequested;
    private boolean readPending;
    private boolean released;
    private boolean readPaused;
    private volatile Channel channel;

    public NettyByteSource()
    {
        this(DEFAULT_HIGH_WATER_MARK);
    }

    /**
     * @param highWaterMark buffered byte count above which inbound reads are paused
     */
    public NettyByteSource(int highWaterMark)
    {
        if (highWaterMark <= 0) {
            throw new IllegalArgumentException("highWaterMark must be positive: " + highWaterMark);
        }
        this.highWaterMark = highWaterMark;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx)
    {
        channel = ctx.channel();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        if (!(msg instanceof ByteBuf)) {
            ctx.fireChannelRead(msg);
            return;
        }

        ByteBuf buf = (ByteBuf) msg;
        lock.lock();
        try {
            if (completed || released) {
                buf.release();
                return;
            }
            // Ownership of buf moves to the composite.
            cumulation.addComponent(true, buf);
            if (!readPaused && cumulation.readableBytes() > highWaterMark) {
                readPaused = true;
                ctx.channel().config().setAutoRead(false);
            }
            changed.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
    {
        if (evt instanceof ChannelInputShutdownEvent) {
            markCompleted(null);
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        markCompleted(null);
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        markCompleted(cause);
        ctx.close();
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx)
    {
        // Buffered bytes stay readable; they are released once consumed or on close().
        markCompleted(null);
    }

    /**
     * Release every buffered byte. Pending and later reads see a completed,
     * empty stream.
     */
    @Override
    public void close()
    {
        lock.lock();
        try {
            releaseCumulation();
            changed.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public ReadResult read() throws IOException
    {
        lock.lock();
        try {
            if (readPending) {
                throw new IllegalStateException("advanceTo must be called before the next read");
            }

            while (!cancelRequested && failure == null && !completed && cumulation.readableBytes() <= examined) {
                // Everything buffered has been examined; more input is required.
                resumeReading();
                try {
                    changed.await();
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelRequested = true;
                }
            }

            boolean cancelled = cancelRequested;
            cancelRequested = false;

            if (!cancelled && failure != null) {
                throw new IOException("Transport failed", failure);
            }

            readPending = true;
            return new ReadResult(view(), cancelled, completed);
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void advanceTo(long consumed, long examined)
    {
        lock.lock();
        try {
            if (!readPending) {
                throw new IllegalStateException("advanceTo called without a preceding read");
            }
            int readable = released ? 0 : cumulation.readableBytes();
            if (consumed < 0 || consumed > examined || examined > readable) {
                throw new IllegalArgumentException(
                        "invalid cursors consumed=" + consumed + " examined=" + examined + " buffered=" + readable);
            }
            readPending = false;

            if (consumed > 0) {
                cumulation.skipBytes((int) consumed);
                cumulation.discardReadComponents();
            }
            this.examined = examined - consumed;

            if (completed && !cumulation.isReadable()) {
                releaseCumulation();
            }
            else if (cumulation.readableBytes() <= highWaterMark) {
                resumeReading();
            }
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void cancelPendingRead()
    {
        lock.lock();
        try {
            cancelRequested = true;
            changed.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    private void markCompleted(Throwable cause)
    {
        lock.lock();
        try {
            completed = true;
            if (cause != null && failure == null) {
                failure = cause;
            }
            changed.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    private void resumeReading()
    {
        if (!readPaused) {
            return;
        }
        readPaused = false;
        Channel ch = channel;
        if (ch != null) {
            ch.config().setAutoRead(true);
        }
    }

    private void releaseCumulation()
    {
        if (!released) {
            released = true;
            completed = true;
            cumulation.release();
        }
    }

    private ByteSequence view()
    {
        if (released || !cumulation.isReadable()) {
            return ByteSequence.EMPTY;
        }
        return ByteSequence.of(cumulation.nioBuffers(cumulation.readerIndex(), cumulation.readableBytes()));
    }
}
