/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.internal.collect;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import tether.internal.Nullable;

/**
 * A side table keyed on object identity that does not keep its keys alive. Used to associate
 * state with objects owned by other libraries, such as responses, without patching them.
 *
 * <p>This borrows heavily from Rafael Winterhalter's {@code
 * com.blogspot.mydailyjava.weaklockfree.WeakConcurrentMap}. Unlike that type, keys are compared by
 * identity, so objects with value-based {@code equals} don't collide.
 *
 * <p>Stale entries are expunged inline on each access.
 */
public final class WeakIdentityMap<K, V> extends ReferenceQueue<K> {
  final ConcurrentMap<Object, V> target = new ConcurrentHashMap<>();

  @Nullable public V getIfPresent(K key) {
    if (key == null) throw new NullPointerException("key == null");
    expungeStaleEntries();

    return target.get(new LookupKey<>(key));
  }

  /** Associates the value unless there is already one for the key. Returns the existing value. */
  @Nullable public V putIfAbsent(K key, V value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) throw new NullPointerException("value == null");
    expungeStaleEntries();

    return target.putIfAbsent(new WeakKey<>(key, this), value);
  }

  /** Removes the entry with the indicated key and returns the old value or {@code null}. */
  @Nullable public V remove(K key) {
    if (key == null) throw new NullPointerException("key == null");
    expungeStaleEntries();

    return target.remove(new LookupKey<>(key));
  }

  public boolean containsKey(K key) {
    return getIfPresent(key) != null;
  }

  /** Returns the count of entries including any whose keys were collected but not expunged. */
  public int size() {
    return target.size();
  }

  void expungeStaleEntries() {
    Reference<?> reference;
    while ((reference = poll()) != null) {
      target.remove(reference);
    }
  }

  /** Stored in the map. Equal to another key when both refer to the same instance. */
  static final class WeakKey<T> extends WeakReference<T> {
    final int hashCode;

    WeakKey(T key, ReferenceQueue<? super T> queue) {
      super(key, queue);
      this.hashCode = System.identityHashCode(key);
    }

    @Override public int hashCode() {
      return hashCode;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (o instanceof LookupKey) return ((LookupKey<?>) o).key == get();
      if (!(o instanceof WeakKey)) return false;
      Object referent = get();
      return referent != null && referent == ((WeakKey<?>) o).get();
    }

    @Override public String toString() {
      T value = get();
      return value != null ? value.toString() : "ClearedReference()";
    }
  }

  /** Allocated per lookup so that reads never enqueue references. */
  static final class LookupKey<T> {
    final T key;

    LookupKey(T key) {
      this.key = key;
    }

    @Override public int hashCode() {
      return System.identityHashCode(key);
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (o instanceof WeakKey) return ((WeakKey<?>) o).get() == key;
      return o instanceof LookupKey && ((LookupKey<?>) o).key == key;
    }
  }
}
