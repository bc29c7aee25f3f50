package com.github.rudygunawan.slotcache.value;

import java.util.Arrays;
import java.util.Objects;

/**
 * A growable byte buffer that always owns its content.
 *
 * <p>Every write copies the input and every read-out copies the content, so the buffer never
 * shares an array with its caller. Clearing keeps the allocated capacity for the next value.
 *
 * <p>This class is not thread-safe.
 */
public final class OwnedBuffer {

    private static final byte[] EMPTY = new byte[0];

    private byte[] data = EMPTY;
    private int length;

    /**
     * Creates an empty buffer.
     */
    public OwnedBuffer() {
    }

    /**
     * Creates a buffer holding a copy of {@code content}.
     */
    public OwnedBuffer(byte[] content) {
        set(content);
    }

    /**
     * Replaces the content with a copy of {@code src}.
     *
     * @return this buffer
     */
    public OwnedBuffer set(byte[] src) {
        return set(src, 0, src.length);
    }

    /**
     * Replaces the content with a copy of {@code len} bytes of {@code src} starting at
     * {@code offset}.
     *
     * @return this buffer
     * @throws IndexOutOfBoundsException if the range is outside {@code src}
     */
    public OwnedBuffer set(byte[] src, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, src.length);
        ensureCapacity(len);
        System.arraycopy(src, offset, data, 0, len);
        length = len;
        return this;
    }

    /**
     * Replaces the content with a copy of the content of {@code other}.
     *
     * @return this buffer
     */
    public OwnedBuffer set(OwnedBuffer other) {
        if (other == this) {
            return this;
        }
        return set(other.data, 0, other.length);
    }

    /**
     * Appends a copy of {@code src} to the content.
     *
     * @return this buffer
     */
    public OwnedBuffer append(byte[] src) {
        ensureCapacity(length + src.length);
        System.arraycopy(src, 0, data, length, src.length);
        length += src.length;
        return this;
    }

    /**
     * Returns the byte at {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not below {@link #length()}
     */
    public byte byteAt(int index) {
        Objects.checkIndex(index, length);
        return data[index];
    }

    /**
     * Returns the number of content bytes.
     */
    public int length() {
        return length;
    }

    /**
     * Returns the number of bytes the buffer can hold without growing.
     */
    public int capacity() {
        return data.length;
    }

    /**
     * Returns a copy of the content.
     */
    public byte[] toByteArray() {
        return length == 0 ? EMPTY : Arrays.copyOf(data, length);
    }

    /**
     * Empties the buffer, keeping its capacity.
     */
    public void clear() {
        length = 0;
    }

    private void ensureCapacity(int required) {
        if (required > data.length) {
            data = Arrays.copyOf(data, Math.max(required, data.length * 2));
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof OwnedBuffer)) {
            return false;
        }
        OwnedBuffer other = (OwnedBuffer) obj;
        return Arrays.equals(data, 0, length, other.data, 0, other.length);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < length; i++) {
            result = 31 * result + data[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return "OwnedBuffer{length=" + length + ", capacity=" + data.length + '}';
    }
}
