package com.github.rudygunawan.slotcache.value;

/**
 * Variable-length raw values. Each slot owns an {@link OwnedBuffer}; the buffer copies whatever is
 * stored into it and keeps its capacity when the slot is reused, so a cache in steady state stops
 * allocating once its buffers have grown to the typical value size.
 */
public final class GrowableBytes implements ValueKind<OwnedBuffer> {

    private static final GrowableBytes INSTANCE = new GrowableBytes();

    private GrowableBytes() {
    }

    /**
     * Returns the shared instance.
     */
    public static GrowableBytes instance() {
        return INSTANCE;
    }

    @Override
    public OwnedBuffer newValue() {
        return new OwnedBuffer();
    }

    @Override
    public OwnedBuffer assign(OwnedBuffer current, OwnedBuffer incoming) {
        if (current != incoming) {
            current.set(incoming);
        }
        return current;
    }

    @Override
    public OwnedBuffer reset(OwnedBuffer current) {
        current.clear();
        return current;
    }

    @Override
    public boolean isEmpty(OwnedBuffer value) {
        return value.length() == 0;
    }

    @Override
    public String toString() {
        return "GrowableBytes";
    }
}
