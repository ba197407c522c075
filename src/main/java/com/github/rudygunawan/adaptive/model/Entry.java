package com.github.rudygunawan.adaptive.model;

/**
 * The unit of storage shared by every policy: a key, its value, an access-frequency counter and
 * the links that place it in exactly one {@link OrderedList}.
 *
 * <p>Only {@link OrderedList} touches the links. An entry is never linked into two lists at once;
 * moving it between lists is an unlink followed by a relink under the owning policy's lock.
 *
 * <p><b>Ghost entries:</b> when a policy evicts an entry into its history list it does not move
 * the live entry. It creates a fresh key-only entry via {@link #ghostOf(Object)} and drops the old
 * one, so the value is released and the ghost's frequency starts over at 1.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public final class Entry<K, V> {
    private final K key;
    private V value;
    private int frequency;

    Entry<K, V> prev;
    Entry<K, V> next;

    /**
     * Creates a new entry with frequency 1.
     *
     * @param key the key
     * @param value the value, or {@code null} for a ghost entry
     */
    public Entry(K key, V value) {
        this.key = key;
        this.value = value;
        this.frequency = 1;
    }

    /**
     * Creates a key-only history entry for a key that was just evicted.
     */
    public static <K, V> Entry<K, V> ghostOf(K key) {
        return new Entry<>(key, null);
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public void setValue(V value) {
        this.value = value;
    }

    public int getFrequency() {
        return frequency;
    }

    /**
     * Sets the frequency, flooring it at 1.
     */
    public void setFrequency(int frequency) {
        this.frequency = Math.max(1, frequency);
    }

    /**
     * Increments the access frequency, saturating at {@link Integer#MAX_VALUE}.
     *
     * @return the new frequency
     */
    public int incrementFrequency() {
        if (frequency < Integer.MAX_VALUE) {
            frequency++;
        }
        return frequency;
    }

    /**
     * Returns whether this entry is currently linked into a list.
     */
    public boolean isLinked() {
        return prev != null;
    }

    @Override
    public String toString() {
        return "Entry{key=" + key + ", frequency=" + frequency + '}';
    }
}
