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

package com.axonops.libgrok.capture;

import com.axonops.libgrok.util.PatternHasher;

/**
 * Metadata for one named or numbered capture group of a compiled grok pattern.
 *
 * <p>A new Capture starts with {@link #NOT_SET} for id and capture number and {@code null} for
 * every string. The pattern compiler fills it in, then hands it to {@link
 * CaptureIndexStore#addCapture(Capture, boolean)}, which stores private copies; the caller's
 * instance is never aliased by the store.
 *
 * <pre>{@code
 * Capture capture = Capture.builder()
 *     .id(3)
 *     .captureNumber(5)
 *     .name("IP:client")
 *     .subname("client")
 *     .pattern("(?:%{IPV6}|%{IPV4})")
 *     .build();
 * }</pre>
 *
 * <h2>Extra Handle</h2>
 *
 * <p>{@code extra} is an opaque caller-owned reference. The store copies the reference, never the
 * referent, and never inspects or disposes of it.
 *
 * <p>Not thread-safe.
 *
 * @since 1.0.0
 */
public final class Capture {

  /** Value of {@link #getId()} and {@link #getCaptureNumber()} before the compiler assigns one. */
  public static final int NOT_SET = -1;

  /** Shared empty-string sentinel. Never released. */
  public static final String EMPTY = "";

  private int id = NOT_SET;
  private int captureNumber = NOT_SET;
  private String name;
  private String subname;
  private String pattern;
  private String predicateLib;
  private String predicateFunc;
  private Object extra;
  private boolean released;

  /** Creates an unpopulated capture. */
  public Capture() {}

  private Capture(Capture source) {
    this.id = source.id;
    this.captureNumber = source.captureNumber;
    this.name = source.name;
    this.subname = source.subname;
    this.pattern = source.pattern;
    this.predicateLib = source.predicateLib;
    this.predicateFunc = source.predicateFunc;
    this.extra = source.extra;
    this.released = source.released;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns an independent copy. Changing either instance afterwards leaves the other untouched.
   * The extra handle is copied by reference.
   *
   * @return copy of this capture
   */
  public Capture copy() {
    return new Capture(this);
  }

  /**
   * Drops every owned field. The {@link #EMPTY} sentinel is left in place; a second call does
   * nothing.
   */
  void release() {
    if (released) {
      return;
    }
    name = releaseString(name);
    subname = releaseString(subname);
    pattern = releaseString(pattern);
    predicateLib = releaseString(predicateLib);
    predicateFunc = releaseString(predicateFunc);
    extra = null;
    released = true;
  }

  private static String releaseString(String value) {
    // Reference comparison: only the shared instance is exempt
    return value == EMPTY ? EMPTY : null;
  }

  public boolean isReleased() {
    return released;
  }

  public int getId() {
    return id;
  }

  public void setId(int id) {
    this.id = id;
  }

  public int getCaptureNumber() {
    return captureNumber;
  }

  public void setCaptureNumber(int captureNumber) {
    this.captureNumber = captureNumber;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getSubname() {
    return subname;
  }

  public void setSubname(String subname) {
    this.subname = subname;
  }

  public String getPattern() {
    return pattern;
  }

  public void setPattern(String pattern) {
    this.pattern = pattern;
  }

  public String getPredicateLib() {
    return predicateLib;
  }

  public void setPredicateLib(String predicateLib) {
    this.predicateLib = predicateLib;
  }

  public String getPredicateFunc() {
    return predicateFunc;
  }

  public void setPredicateFunc(String predicateFunc) {
    this.predicateFunc = predicateFunc;
  }

  /** True if both predicate library and function name are set. */
  public boolean hasPredicate() {
    return predicateLib != null && predicateFunc != null;
  }

  public Object getExtra() {
    return extra;
  }

  /**
   * Typed access to the extra handle.
   *
   * @param type expected handle type
   * @param <T> handle type
   * @return the handle, or null if unset
   * @throws ClassCastException if the handle is not a {@code type}
   */
  public <T> T getExtra(Class<T> type) {
    return type.cast(extra);
  }

  void setExtra(Object extra) {
    this.extra = extra;
  }

  @Override
  public String toString() {
    return "Capture[id="
        + id
        + ", captureNumber="
        + captureNumber
        + ", name="
        + name
        + ", subname="
        + subname
        + ", pattern#"
        + PatternHasher.hash(pattern)
        + "]";
  }

  /** Builder for a populated capture. Unset fields keep their initial values. */
  public static final class Builder {
    private final Capture capture = new Capture();

    private Builder() {}

    public Builder id(int id) {
      capture.id = id;
      return this;
    }

    public Builder captureNumber(int captureNumber) {
      capture.captureNumber = captureNumber;
      return this;
    }

    public Builder name(String name) {
      capture.name = name;
      return this;
    }

    public Builder subname(String subname) {
      capture.subname = subname;
      return this;
    }

    public Builder pattern(String pattern) {
      capture.pattern = pattern;
      return this;
    }

    public Builder predicate(String lib, String func) {
      capture.predicateLib = lib;
      capture.predicateFunc = func;
      return this;
    }

    public Builder extra(Object extra) {
      capture.extra = extra;
      return this;
    }

    /** Returns a new capture each call; the builder can be reused. */
    public Capture build() {
      return capture.copy();
    }
  }
}
