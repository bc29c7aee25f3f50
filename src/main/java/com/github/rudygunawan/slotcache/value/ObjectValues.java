package com.github.rudygunawan.slotcache.value;

/**
 * Plain object references. A slot starts out {@code null}, holds whatever reference is assigned,
 * and is set back to {@code null} when its entry is removed so the cache never keeps dropped
 * values reachable. A {@code null} value counts as empty.
 *
 * @param <T> the type of the stored objects
 */
public final class ObjectValues<T> implements ValueKind<T> {

    private static final ObjectValues<Object> INSTANCE = new ObjectValues<>();

    private ObjectValues() {
    }

    /**
     * Returns the shared instance, typed for {@code T}.
     */
    @SuppressWarnings("unchecked")
    public static <T> ObjectValues<T> create() {
        return (ObjectValues<T>) INSTANCE;
    }

    @Override
    public T newValue() {
        return null;
    }

    @Override
    public T assign(T current, T incoming) {
        return incoming;
    }

    @Override
    public T reset(T current) {
        return null;
    }

    @Override
    public boolean isEmpty(T value) {
        return value == null;
    }

    @Override
    public String toString() {
        return "ObjectValues";
    }
}
