package com.github.rudygunawan.slotcache.value;

/**
 * Describes how a cache stores its values in the pre-allocated slot array.
 *
 * <p>The kind is chosen once, at build time, and fixes the value type of the cache:
 * <ul>
 *   <li>{@link FixedBytes} - a {@code byte[]} of a fixed length per slot, allocated once and
 *       reused for every entry that occupies the slot.</li>
 *   <li>{@link GrowableBytes} - an {@link OwnedBuffer} per slot that copies its input and keeps
 *       its capacity across entries.</li>
 *   <li>{@link ObjectValues} - plain object references.</li>
 * </ul>
 *
 * @param <V> the type of the values stored in a slot
 */
public interface ValueKind<V> {

    /**
     * Creates the initial content of one slot. Called once per slot when the cache is built.
     */
    V newValue();

    /**
     * Stores {@code incoming} into a slot whose current content is {@code current}.
     *
     * @return the value the slot holds afterwards
     * @throws IllegalArgumentException if {@code incoming} cannot be stored in this kind of slot
     */
    V assign(V current, V incoming);

    /**
     * Clears a slot whose entry was removed.
     *
     * @return the value the slot holds afterwards
     */
    V reset(V current);

    /**
     * Returns whether {@code value} counts as empty, which selects the empty-value lifetime of
     * expiring caches.
     */
    boolean isEmpty(V value);
}
