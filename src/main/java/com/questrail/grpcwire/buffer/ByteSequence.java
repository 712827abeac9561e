package com.questrail.grpcwire.buffer;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ByteSequence
 * -----------------------------------------------------------------------------
 * Read-only view over bytes buffered by a transport, possibly spread across
 * several non-contiguous segments.
 *
 * <p>A sequence is borrowed: it stays valid only until the source that
 * produced it is advanced. Callers that need the bytes afterwards must copy
 * them out ({@link #toArray(long, int)}).</p>
 *
 * <p>Offsets are {@code long} because a single frame may announce up to
 * {@code 2^31 - 1} payload bytes plus its header.</p>
 */
public final class ByteSequence
{
    public static final ByteSequence EMPTY = new ByteSequence(List.of(), 0);

    private final List<ByteBuffer> segments;
    private final long length;

    private ByteSequence(List<ByteBuffer> segments, long length)
    {
        this.segments = segments;
        this.length = length;
    }

    /**
     * Creates a sequence over the remaining bytes of each buffer.
     *
     * <p>Each buffer is wrapped as a read-only duplicate; positions of the
     * given buffers are not modified. Empty buffers are skipped.</p>
     */
    public static ByteSequence of(List<ByteBuffer> buffers)
    {
        Objects.requireNonNull(buffers, "buffers");

        List<ByteBuffer> views = new ArrayList<>(buffers.size());
        long total = 0;
        for (ByteBuffer buffer : buffers) {
            Objects.requireNonNull(buffer, "buffer");
            if (!buffer.hasRemaining()) {
                continue;
            }
            ByteBuffer view = buffer.asReadOnlyBuffer().slice();
            views.add(view);
            total += view.remaining();
        }

        if (views.isEmpty()) {
            return EMPTY;
        }
        return new ByteSequence(Collections.unmodifiableList(views), total);
    }

    public static ByteSequence of(ByteBuffer... buffers)
    {
        return of(List.of(buffers));
    }

    /**
     * Wraps {@code array[offset, offset + length)} without copying.
     */
    public static ByteSequence wrap(byte[] array, int offset, int length)
    {
        return of(ByteBuffer.wrap(array, offset, length));
    }

    public static ByteSequence wrap(byte[] array)
    {
        return wrap(array, 0, array.length);
    }

    public long length()
    {
        return length;
    }

    public boolean isEmpty()
    {
        return length == 0;
    }

    /**
     * Returns a read-only view of the first segment (empty if the sequence is empty).
     */
    public ByteBuffer first()
    {
        return segments.isEmpty() ? ByteBuffer.allocate(0).asReadOnlyBuffer() : segments.get(0).duplicate();
    }

    public int segmentCount()
    {
        return segments.size();
    }

    public byte get(long index)
    {
        checkRange(index, 1);

        long remaining = index;
        for (ByteBuffer segment : segments) {
            int size = segment.remaining();
            if (remaining < size) {
                return segment.get(segment.position() + (int) remaining);
            }
            remaining -= size;
        }
        throw new IllegalStateException("unreachable: index " + index + " within length " + length);
    }

    /**
     * Copies {@code count} bytes starting at {@code offset} into {@code destination}.
     */
    public void copyTo(long offset, byte[] destination, int destinationOffset, int count)
    {
        Objects.requireNonNull(destination, "destination");
        Objects.checkFromIndexSize(destinationOffset, count, destination.length);
        checkRange(offset, count);

        long skip = offset;
        int written = 0;
        for (ByteBuffer segment : segments) {
            if (written == count) {
                break;
            }

            int size = segment.remaining();
            if (skip >= size) {
                skip -= size;
                continue;
            }

            int start = segment.position() + (int) skip;
            int n = Math.min(size - (int) skip, count - written);
            ByteBuffer view = segment.duplicate();
            view.position(start);
            view.get(destination, destinationOffset + written, n);

            written += n;
            skip = 0;
        }
    }

    /**
     * Returns a freshly allocated copy of {@code count} bytes starting at {@code offset}.
     */
    public byte[] toArray(long offset, int count)
    {
        byte[] copy = new byte[count];
        copyTo(offset, copy, 0, count);
        return copy;
    }

    private void checkRange(long offset, long count)
    {
        if (offset < 0 || count < 0 || offset + count > length) {
            throw new IndexOutOfBoundsException(
                    "range [" + offset + ", " + (offset + count) + ") outside sequence of length " + length);
        }
    }

    @Override
    public String toString()
    {
        return "ByteSequence[length=" + length + ", segments=" + segments.size() + ']';
    }
}
