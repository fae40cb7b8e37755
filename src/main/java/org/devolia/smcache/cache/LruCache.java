package org.devolia.smcache.cache;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity key/value store with least-recently-used eviction.
 *
 * <p>Recency is kept in a doubly-linked list whose nodes live in an index-addressed arena: the
 * {@code prev}/{@code next} links are plain slot numbers into parallel arrays, and slots freed by
 * eviction are recycled through a free-list. Both {@link #get(Object)} and {@link
 * #putIfAbsent(Object, Object)} run in constant time under a single per-instance lock.
 *
 * <p>A capacity of zero is legal and disables retention: every inserted entry is evicted
 * immediately.
 *
 * @param <K> key type
 * @param <V> value type
 * @author Devolia
 * @since 1.0.0
 */
public class LruCache<K, V> {

  private static final int NIL = -1;
  private static final int INITIAL_ARENA_SIZE = 16;

  private final int capacity;
  private final Map<K, Integer> slots = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  // Node arena
  private Object[] keys;
  private Object[] values;
  private int[] prev;
  private int[] next;
  private int allocated;
  private int freeHead = NIL;

  // Recency list, head is the most recently used slot
  private int head = NIL;
  private int tail = NIL;
  private int size;

  /**
   * Creates a cache holding at most {@code capacity} entries.
   *
   * @param capacity maximum number of retained entries, zero disables retention
   * @throws IllegalArgumentException if capacity is negative
   */
  public LruCache(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Cache capacity cannot be negative: " + capacity);
    }
    this.capacity = capacity;
    int arenaSize = (int) Math.min((long) capacity + 1, INITIAL_ARENA_SIZE);
    this.keys = new Object[arenaSize];
    this.values = new Object[arenaSize];
    this.prev = new int[arenaSize];
    this.next = new int[arenaSize];
  }

  /**
   * Gets the value mapped to the key and marks it as most recently used.
   *
   * @param key the key to look up
   * @return the mapped value, or empty if the key is not cached
   */
  public Optional<V> get(K key) {
    Objects.requireNonNull(key, "key cannot be null");
    lock.lock();
    try {
      Integer slot = slots.get(key);
      if (slot == null) {
        return Optional.empty();
      }
      moveToHead(slot);
      return Optional.of(valueAt(slot));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Maps the key to the value unless the key is already cached.
   *
   * <p>An existing mapping is left untouched, including its recency. A new mapping becomes the most
   * recently used entry; if that pushes the size over capacity the least recently used entry is
   * dropped.
   *
   * @param key the key
   * @param value the value to associate with the key
   * @return true if the value was inserted
   */
  public boolean putIfAbsent(K key, V value) {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
    lock.lock();
    try {
      if (slots.containsKey(key)) {
        return false;
      }
      int slot = allocate();
      keys[slot] = key;
      values[slot] = value;
      linkAtHead(slot);
      slots.put(key, slot);
      size++;
      if (size > capacity) {
        evict(tail);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Checks whether the key is cached without changing its recency.
   *
   * @param key the key
   * @return true if the key is cached
   */
  public boolean containsKey(K key) {
    lock.lock();
    try {
      return slots.containsKey(key);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the number of cached entries.
   *
   * @return current size
   */
  public int size() {
    lock.lock();
    try {
      return size;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the configured capacity.
   *
   * @return maximum number of entries
   */
  public int capacity() {
    return capacity;
  }

  @SuppressWarnings("unchecked")
  private V valueAt(int slot) {
    return (V) values[slot];
  }

  private void moveToHead(int slot) {
    if (slot == head) {
      return;
    }
    unlink(slot);
    linkAtHead(slot);
  }

  private void linkAtHead(int slot) {
    prev[slot] = NIL;
    next[slot] = head;
    if (head != NIL) {
      prev[head] = slot;
    }
    head = slot;
    if (tail == NIL) {
      tail = slot;
    }
  }

  private void unlink(int slot) {
    int before = prev[slot];
    int after = next[slot];
    if (before != NIL) {
      next[before] = after;
    } else {
      head = after;
    }
    if (after != NIL) {
      prev[after] = before;
    } else {
      tail = before;
    }
    prev[slot] = NIL;
    next[slot] = NIL;
  }

  private void evict(int slot) {
    unlink(slot);
    slots.remove(keys[slot]);
    keys[slot] = null;
    values[slot] = null;
    release(slot);
    size--;
  }

  private int allocate() {
    if (freeHead != NIL) {
      int slot = freeHead;
      freeHead = next[slot];
      return slot;
    }
    if (allocated == keys.length) {
      grow();
    }
    return allocated++;
  }

  private void release(int slot) {
    next[slot] = freeHead;
    freeHead = slot;
  }

  // The arena never needs more than capacity + 1 slots: one insert may precede its eviction.
  private void grow() {
    int newSize = (int) Math.min((long) capacity + 1, Math.max(2L * keys.length, 1L));
    Object[] newKeys = new Object[newSize];
    Object[] newValues = new Object[newSize];
    int[] newPrev = new int[newSize];
    int[] newNext = new int[newSize];
    System.arraycopy(keys, 0, newKeys, 0, allocated);
    System.arraycopy(values, 0, newValues, 0, allocated);
    System.arraycopy(prev, 0, newPrev, 0, allocated);
    System.arraycopy(next, 0, newNext, 0, allocated);
    keys = newKeys;
    values = newValues;
    prev = newPrev;
    next = newNext;
  }
}
