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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Append-ordered, duplicate-permitting singly linked list.
 *
 * <p>Used as the bucket type for secondary indexes, where a handful of records share one key.
 * Positional operations walk from the head, so they are linear in the list length.
 *
 * <p>Elements removed with {@link #remove(int)} are handed back to the caller. Elements dropped by
 * {@link #overwrite(int, Object)} or {@link #destroy()} go to the releaser.
 *
 * @param <E> element type
 * @since 1.0.0
 */
public final class OrderedList<E> implements Iterable<E> {

  private static final class Node<E> {
    E value;
    Node<E> next;

    Node(E value) {
      this.value = value;
    }
  }

  // Sentinel; real elements start at head.next
  private final Node<E> head = new Node<>(null);
  private final Consumer<? super E> releaser;
  private int length;

  public OrderedList() {
    this(value -> {});
  }

  /**
   * Creates an empty list.
   *
   * @param releaser invoked for elements dropped by overwrite or destroy
   */
  public OrderedList(Consumer<? super E> releaser) {
    this.releaser = Objects.requireNonNull(releaser, "releaser cannot be null");
  }

  /**
   * Appends at the tail.
   *
   * @param value element to append
   */
  public void push(E value) {
    Objects.requireNonNull(value, "value cannot be null");
    Node<E> tail = head;
    while (tail.next != null) {
      tail = tail.next;
    }
    tail.next = new Node<>(value);
    length++;
  }

  /**
   * Unlinks the element at {@code index}. Ownership passes to the caller; it is not released.
   *
   * @param index position to remove
   * @return removed element, or empty if out of range
   */
  public Optional<E> remove(int index) {
    if (!inRange(index)) {
      return Optional.empty();
    }
    Node<E> prev = nodeBefore(index);
    Node<E> removed = prev.next;
    prev.next = removed.next;
    length--;
    return Optional.of(removed.value);
  }

  /**
   * Replaces the element at {@code index}, releasing the old one. No-op if out of range.
   *
   * @param index position to replace
   * @param value new element
   */
  public void overwrite(int index, E value) {
    Objects.requireNonNull(value, "value cannot be null");
    if (!inRange(index)) {
      return;
    }
    Node<E> node = nodeBefore(index).next;
    E old = node.value;
    node.value = value;
    if (old != value) {
      releaser.accept(old);
    }
  }

  /**
   * Returns the element at {@code index}.
   *
   * @param index position
   * @return element view, or empty if out of range
   */
  public Optional<E> get(int index) {
    if (!inRange(index)) {
      return Optional.empty();
    }
    return Optional.of(nodeBefore(index).next.value);
  }

  public int length() {
    return length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  /** Releases every element and empties the list. The list remains usable afterwards. */
  public void destroy() {
    Node<E> node = head.next;
    head.next = null;
    length = 0;
    while (node != null) {
      releaser.accept(node.value);
      node = node.next;
    }
  }

  @Override
  public Iterator<E> iterator() {
    return new Iterator<>() {
      private Node<E> current = head.next;

      @Override
      public boolean hasNext() {
        return current != null;
      }

      @Override
      public E next() {
        if (current == null) {
          throw new NoSuchElementException();
        }
        E value = current.value;
        current = current.next;
        return value;
      }
    };
  }

  private boolean inRange(int index) {
    return index >= 0 && index < length;
  }

  private Node<E> nodeBefore(int index) {
    Node<E> node = head;
    for (int i = 0; i < index; i++) {
      node = node.next;
    }
    return node;
  }
}
