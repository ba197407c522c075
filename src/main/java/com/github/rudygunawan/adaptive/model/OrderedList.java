package com.github.rudygunawan.adaptive.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An intrusive doubly-linked sequence of {@link Entry} instances ordered from oldest (front) to
 * newest (back).
 *
 * <p>Two sentinel entries bound the list so insertion and removal never special-case an empty
 * list. Every operation except {@link #toList()} is O(1).
 *
 * <p>This class is not thread-safe; it is always guarded by the lock of the policy that owns it.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public final class OrderedList<K, V> {
    private final Entry<K, V> head;
    private final Entry<K, V> tail;
    private int size;

    public OrderedList() {
        this.head = new Entry<>(null, null);
        this.tail = new Entry<>(null, null);
        head.next = tail;
        tail.prev = head;
    }

    /**
     * Appends the entry at the most-recent end. The entry must not be linked into any list.
     */
    public void pushBack(Entry<K, V> entry) {
        if (entry.isLinked()) {
            throw new IllegalStateException("entry is already linked: " + entry);
        }
        Entry<K, V> last = tail.prev;
        entry.prev = last;
        entry.next = tail;
        last.next = entry;
        tail.prev = entry;
        size++;
    }

    /**
     * Unlinks the entry. The caller guarantees the entry belongs to this list.
     */
    public void remove(Entry<K, V> entry) {
        entry.prev.next = entry.next;
        entry.next.prev = entry.prev;
        entry.prev = null;
        entry.next = null;
        size--;
    }

    /**
     * Moves the entry to the most-recent end.
     */
    public void moveToBack(Entry<K, V> entry) {
        remove(entry);
        pushBack(entry);
    }

    /**
     * Returns the oldest entry without removing it, or {@code null} if the list is empty.
     */
    public Entry<K, V> peekOldest() {
        Entry<K, V> first = head.next;
        return first == tail ? null : first;
    }

    /**
     * Removes and returns the oldest entry, or {@code null} if the list is empty.
     */
    public Entry<K, V> pollOldest() {
        Entry<K, V> first = peekOldest();
        if (first != null) {
            remove(first);
        }
        return first;
    }

    /**
     * Returns the newest entry without removing it, or {@code null} if the list is empty.
     */
    public Entry<K, V> peekNewest() {
        Entry<K, V> last = tail.prev;
        return last == head ? null : last;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /**
     * Copies the entries into a list, oldest first.
     */
    public List<Entry<K, V>> toList() {
        List<Entry<K, V>> entries = new ArrayList<>(size);
        for (Entry<K, V> e = head.next; e != tail; e = e.next) {
            entries.add(e);
        }
        return entries;
    }

    /**
     * Unlinks every entry and empties the list.
     */
    public void clear() {
        Entry<K, V> e = head.next;
        while (e != tail) {
            Entry<K, V> next = e.next;
            e.prev = null;
            e.next = null;
            e = next;
        }
        head.next = tail;
        tail.prev = head;
        size = 0;
    }
}
