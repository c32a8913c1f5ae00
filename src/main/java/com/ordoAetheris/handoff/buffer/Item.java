package com.ordoAetheris.handoff.buffer;

/**
 * One slot of the shared buffer: either a payload value or the stop sentinel.
 *
 * The sentinel is tagged by a flag, not by a reserved value, so no payload can be mistaken for it.
 */
public final class Item<T> {

    private final T value;
    private final boolean stop;

    private Item(T value, boolean stop) {
        this.value = value;
        this.stop = stop;
    }

    public static <T> Item<T> of(T value) {
        if (value == null) throw new IllegalArgumentException("item value must not be null");
        return new Item<>(value, false);
    }

    public static <T> Item<T> stop() {
        return new Item<>(null, true);
    }

    public boolean isStop() {
        return stop;
    }

    public T value() {
        if (stop) throw new IllegalStateException("stop sentinel carries no value");
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item)) return false;
        Item<?> other = (Item<?>) o;
        if (stop || other.stop) return stop == other.stop;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return stop ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        return stop ? "STOP" : String.valueOf(value);
    }
}
