package com.github.rudygunawan.slotcache.value;

import java.util.Arrays;

/**
 * Fixed-length raw values. Each slot owns one {@code byte[]} of {@link #size()} bytes, allocated
 * when the cache is built; creating, updating and evicting entries never allocates.
 *
 * <p>References returned by the cache point directly at the slot array, so values are written in
 * place:
 * <pre>{@code
 * PriorityCache<byte[]> cache = CacheBuilder.newBuilder()
 *     .maximumSize(2)
 *     .fixedSizeValues(3)
 *     .buildPriority();
 *
 * byte[] slot = cache.create(0x12345678L, 7).get();
 * slot[0] = 'a';
 * }</pre>
 */
public final class FixedBytes implements ValueKind<byte[]> {

    private final int size;

    private FixedBytes(int size) {
        this.size = size;
    }

    /**
     * Returns the kind for values of exactly {@code size} bytes.
     *
     * @throws IllegalArgumentException if {@code size} is negative
     */
    public static FixedBytes of(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("value size must not be negative: " + size);
        }
        return new FixedBytes(size);
    }

    /**
     * Returns the length of every value.
     */
    public int size() {
        return size;
    }

    @Override
    public byte[] newValue() {
        return new byte[size];
    }

    @Override
    public byte[] assign(byte[] current, byte[] incoming) {
        if (incoming.length != size) {
            throw new IllegalArgumentException(
                    "expected a value of " + size + " bytes but got " + incoming.length);
        }
        if (current != incoming) {
            System.arraycopy(incoming, 0, current, 0, size);
        }
        return current;
    }

    @Override
    public byte[] reset(byte[] current) {
        Arrays.fill(current, (byte) 0);
        return current;
    }

    @Override
    public boolean isEmpty(byte[] value) {
        return size == 0;
    }

    @Override
    public String toString() {
        return "FixedBytes(" + size + ")";
    }
}
