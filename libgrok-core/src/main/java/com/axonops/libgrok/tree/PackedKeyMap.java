/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libgrok.tree;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Ordered map keyed by {@link PackedKey}, owning copies of every value it stores.
 *
 * <p>Values are passed through a copier on the way in, so the map never aliases the caller's
 * object. Values the map drops (overwritten by {@link #put}, or removed by {@link #clear} and
 * {@link #destroy}) are handed to a releaser.
 *
 * <h2>Iteration</h2>
 *
 * <p>A map supports a single live {@link Cursor}. Calling {@link #iterate()} again invalidates the
 * previous cursor, which then reports end of sequence. Mutating the map while a cursor is in use
 * is not guarded: the cursor's next {@link Cursor#next()} may throw {@link
 * java.util.ConcurrentModificationException}.
 *
 * <p><strong>Thread Safety:</strong> not thread-safe. One owner thread per map.
 *
 * @param <V> value type
 * @since 1.0.0
 */
public final class PackedKeyMap<V> {

  private final TreeMap<PackedKey, V> entries;
  private final UnaryOperator<V> copier;
  private final Consumer<? super V> releaser;

  private Cursor<V> cursor;
  private long cursorGeneration;
  private boolean destroyed;

  /**
   * Creates a map that stores values as given and releases nothing.
   *
   * @param comparator payload comparator, usually one of {@link PackedKeyComparators}
   */
  public PackedKeyMap(Comparator<PackedKey> comparator) {
    this(comparator, UnaryOperator.identity(), value -> {});
  }

  /**
   * Creates a map with value ownership hooks.
   *
   * @param comparator payload comparator, usually one of {@link PackedKeyComparators}
   * @param copier produces the map's private copy of a value on every put
   * @param releaser invoked for each value the map drops
   */
  public PackedKeyMap(
      Comparator<PackedKey> comparator, UnaryOperator<V> copier, Consumer<? super V> releaser) {
    this.entries = new TreeMap<>(Objects.requireNonNull(comparator, "comparator cannot be null"));
    this.copier = Objects.requireNonNull(copier, "copier cannot be null");
    this.releaser = Objects.requireNonNull(releaser, "releaser cannot be null");
  }

  /**
   * Inserts or replaces the value for {@code key}.
   *
   * <p>A replaced value is released, unless it is the same instance the copier produced for the
   * new value (storing a mutated bucket back under its own key).
   *
   * @param key entry key
   * @param value value to copy into the map
   */
  public void put(PackedKey key, V value) {
    checkNotDestroyed();
    Objects.requireNonNull(key, "key cannot be null");
    V stored = copier.apply(Objects.requireNonNull(value, "value cannot be null"));
    V prior = entries.put(key, stored);
    if (prior != null && prior != stored) {
      releaser.accept(prior);
    }
  }

  /**
   * Inserts the value only if {@code key} is absent.
   *
   * @param key entry key
   * @param value value to copy into the map
   * @return true if inserted, false if the key was present (original value kept)
   */
  public boolean putIfAbsent(PackedKey key, V value) {
    checkNotDestroyed();
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
    if (entries.containsKey(key)) {
      return false;
    }
    entries.put(key, copier.apply(value));
    return true;
  }

  /**
   * Looks up the value for {@code key}.
   *
   * <p>The returned value is owned by the map and stays valid until the next mutation of the same
   * key.
   *
   * @param key entry key
   * @return stored value, or empty if absent
   */
  public Optional<V> get(PackedKey key) {
    checkNotDestroyed();
    return Optional.ofNullable(entries.get(Objects.requireNonNull(key, "key cannot be null")));
  }

  public boolean containsKey(PackedKey key) {
    checkNotDestroyed();
    return entries.containsKey(Objects.requireNonNull(key, "key cannot be null"));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Starts an ascending traversal. Any previous cursor on this map is discarded.
   *
   * @return cursor positioned before the first entry
   */
  public Cursor<V> iterate() {
    checkNotDestroyed();
    cursorGeneration++;
    cursor = new Cursor<>(this, cursorGeneration, entries.entrySet().iterator());
    return cursor;
  }

  /** Releases every entry. The map stays usable. */
  public void clear() {
    checkNotDestroyed();
    releaseAll();
  }

  /**
   * Releases every entry and the cursor. Any further call other than {@link #size()}, {@link
   * #isEmpty()} and {@link #isDestroyed()} throws {@link IllegalStateException}. Idempotent.
   */
  public void destroy() {
    if (destroyed) {
      return;
    }
    releaseAll();
    cursor = null;
    cursorGeneration++;
    destroyed = true;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  private void releaseAll() {
    Iterator<V> values = entries.values().iterator();
    while (values.hasNext()) {
      V value = values.next();
      values.remove();
      releaser.accept(value);
    }
  }

  private void checkNotDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("PackedKeyMap has been destroyed");
    }
  }

  /**
   * Single-pass ascending cursor over a {@link PackedKeyMap}.
   *
   * @param <V> value type
   */
  public static final class Cursor<V> {
    private final PackedKeyMap<V> owner;
    private final long generation;
    private final Iterator<Map.Entry<PackedKey, V>> delegate;

    private Cursor(
        PackedKeyMap<V> owner, long generation, Iterator<Map.Entry<PackedKey, V>> delegate) {
      this.owner = owner;
      this.generation = generation;
      this.delegate = delegate;
    }

    /**
     * Advances to the next entry.
     *
     * @return next entry, or empty at end of sequence or if this cursor has been superseded
     * @throws java.util.ConcurrentModificationException if a key was added or removed since the
     *     cursor was created
     */
    public Optional<Entry<V>> next() {
      if (!isLive() || !delegate.hasNext()) {
        return Optional.empty();
      }
      Map.Entry<PackedKey, V> e = delegate.next();
      return Optional.of(new Entry<>(e.getKey(), e.getValue()));
    }

    /** True while this is the map's current cursor. */
    public boolean isLive() {
      return owner.cursor == this && owner.cursorGeneration == generation;
    }
  }

  /**
   * Key/value pair returned by a {@link Cursor}. The value is a view owned by the map.
   *
   * @param key entry key
   * @param value stored value
   * @param <V> value type
   */
  public record Entry<V>(PackedKey key, V value) {}
}
