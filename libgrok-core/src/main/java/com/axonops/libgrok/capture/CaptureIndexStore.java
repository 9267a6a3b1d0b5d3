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

import com.axonops.libgrok.metrics.GrokMetricsRegistry;
import com.axonops.libgrok.metrics.MetricNames;
import com.axonops.libgrok.tree.OrderedList;
import com.axonops.libgrok.tree.PackedKey;
import com.axonops.libgrok.tree.PackedKeyComparators;
import com.axonops.libgrok.tree.PackedKeyMap;
import com.axonops.libgrok.util.CaptureResourceTracker;
import com.axonops.libgrok.util.PatternHasher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store of {@link Capture} records for one compiled pattern set, indexed four ways.
 *
 * <h2>Indexes</h2>
 *
 * <ul>
 *   <li><b>by id</b> - primary index, one entry per id; re-adding an id overwrites
 *   <li><b>by capture number</b> - one entry per number; last writer wins
 *   <li><b>by name</b> / <b>by subname</b> - buckets ({@link OrderedList}) of every capture sharing
 *       the key, at most one per id, in insertion order
 * </ul>
 *
 * <p>The backing {@link PackedKeyMap} has no multi-value support, so the secondary indexes map a
 * key to a bucket. Each index holds its own copy of a capture; mutating one copy (or the caller's
 * original) does not affect the others.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (CaptureIndexStore store = new CaptureIndexStore()) {
 *     store.addCapture(capture, false);
 *
 *     // after a match
 *     Optional<Capture> group = store.getByCaptureNumber(5);
 *     Optional<Capture> client = store.getBySubname("client");
 *
 *     CaptureWalk walk = store.walkInit();
 *     for (Optional<Capture> c = store.walkNext(walk); c.isPresent(); c = store.walkNext(walk)) {
 *         // ascending id order
 *     }
 * }
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe. A store has one owner thread. Only one walk
 * is live at a time. Adding captures (or clearing) during a walk is not guarded: the next {@link
 * #walkNext} may throw {@link java.util.ConcurrentModificationException}.
 *
 * @since 1.0.0
 */
public final class CaptureIndexStore implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(CaptureIndexStore.class);

  private final CaptureStoreConfig config;
  private final CaptureResourceTracker resourceTracker;

  private final PackedKeyMap<Capture> byId;
  private final PackedKeyMap<Capture> byCaptureNumber;
  private final PackedKeyMap<OrderedList<Capture>> byName;
  private final PackedKeyMap<OrderedList<Capture>> bySubname;

  // Same supplier instances on register and remove
  private final Map<String, Supplier<Number>> indexGauges = new LinkedHashMap<>();

  private long added;
  private long skipped;
  private long replaced;
  private long hits;
  private long misses;
  private boolean closed;

  /** Creates a store with {@link CaptureStoreConfig#DEFAULT}. */
  public CaptureIndexStore() {
    this(CaptureStoreConfig.DEFAULT);
  }

  /**
   * Creates an empty store.
   *
   * @param config store configuration
   */
  public CaptureIndexStore(CaptureStoreConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.resourceTracker = new CaptureResourceTracker(config.metricsRegistry());

    UnaryOperator<Capture> copier = this::takeCopy;
    this.byId = new PackedKeyMap<>(PackedKeyComparators.INT32, copier, this::releaseCopy);
    this.byCaptureNumber =
        new PackedKeyMap<>(PackedKeyComparators.INT32, copier, this::releaseCopy);
    // Buckets are owned by the map once inserted; put stores the same instance back
    this.byName = newBucketIndex();
    this.bySubname = newBucketIndex();

    registerIndexMetrics();
    logger.debug(
        "Grok: Capture store initialized - renameSeparator: '{}', logCaptures: {}",
        config.renameSeparator(),
        config.logCaptures());
  }

  private static PackedKeyMap<OrderedList<Capture>> newBucketIndex() {
    return new PackedKeyMap<>(
        PackedKeyComparators.STRING, UnaryOperator.identity(), OrderedList::destroy);
  }

  public CaptureStoreConfig getConfig() {
    return config;
  }

  public CaptureResourceTracker getResourceTracker() {
    return resourceTracker;
  }

  /**
   * Stores a capture in all four indexes.
   *
   * <p>With {@code onlyIfRenamed} set, a capture whose name lacks the configured rename separator
   * is ignored entirely: no index is touched.
   *
   * <p>In the name and subname buckets an existing capture with the same id is removed and the new
   * one appended, so re-adding moves a capture to the end of its bucket.
   *
   * @param record populated capture; copied, never retained
   * @param onlyIfRenamed skip captures without a rename
   */
  public void addCapture(Capture record, boolean onlyIfRenamed) {
    checkNotClosed();
    Objects.requireNonNull(record, "record cannot be null");
    GrokMetricsRegistry metrics = config.metricsRegistry();

    if (config.logCaptures()) {
      logger.trace(
          "Grok: Adding pattern '{}' as capture {} (capture number {}), pattern#{}",
          record.getName(),
          record.getId(),
          record.getCaptureNumber(),
          PatternHasher.hash(record.getPattern()));
    }

    if (onlyIfRenamed && !CaptureNames.isRenamed(record.getName(), config.renameSeparator())) {
      skipped++;
      metrics.incrementCounter(MetricNames.CAPTURES_SKIPPED);
      if (config.logCaptures()) {
        logger.trace(
            "Grok: Capture {} skipped - '{}' is not renamed", record.getId(), record.getName());
      }
      return;
    }

    long start = System.nanoTime();

    byId.put(PackedKey.ofInt(record.getId()), record);
    byCaptureNumber.put(PackedKey.ofInt(record.getCaptureNumber()), record);
    addToBucket(byName, record.getName(), record);
    addToBucket(bySubname, record.getSubname(), record);

    metrics.recordTimer(MetricNames.CAPTURES_ADD_LATENCY, System.nanoTime() - start);
    added++;
    metrics.incrementCounter(MetricNames.CAPTURES_ADDED);
  }

  private void addToBucket(
      PackedKeyMap<OrderedList<Capture>> index, String key, Capture record) {
    PackedKey packed = PackedKey.ofString(key);
    OrderedList<Capture> bucket = index.get(packed).orElse(null);
    if (bucket == null) {
      bucket = new OrderedList<>(this::releaseCopy);
      index.putIfAbsent(packed, bucket);
    }

    int position = indexOfId(bucket, record.getId());
    if (position >= 0) {
      bucket.remove(position).ifPresent(this::releaseCopy);
      replaced++;
      config.metricsRegistry().incrementCounter(MetricNames.CAPTURES_REPLACED);
    }

    bucket.push(takeCopy(record));
    index.put(packed, bucket);
  }

  private static int indexOfId(OrderedList<Capture> bucket, int id) {
    int i = 0;
    for (Capture capture : bucket) {
      if (capture.getId() == id) {
        return i;
      }
      i++;
    }
    return -1;
  }

  /**
   * Looks up a capture by id.
   *
   * @param id capture id
   * @return stored capture (owned by the store, do not modify), or empty
   */
  public Optional<Capture> getById(int id) {
    checkNotClosed();
    return recordLookup(byId.get(PackedKey.ofInt(id)));
  }

  /**
   * Looks up a capture by engine capture number.
   *
   * @param captureNumber capture group number
   * @return stored capture, or empty
   */
  public Optional<Capture> getByCaptureNumber(int captureNumber) {
    checkNotClosed();
    return recordLookup(byCaptureNumber.get(PackedKey.ofInt(captureNumber)));
  }

  /**
   * Returns the earliest-inserted surviving capture with this name.
   *
   * @param name capture name; null looks up the empty name
   * @return first capture in the bucket, or empty
   */
  public Optional<Capture> getByName(String name) {
    checkNotClosed();
    return recordLookup(firstInBucket(byName, name));
  }

  /**
   * Returns the earliest-inserted surviving capture with this subname.
   *
   * @param subname capture subname; null looks up the empty subname
   * @return first capture in the bucket, or empty
   */
  public Optional<Capture> getBySubname(String subname) {
    checkNotClosed();
    return recordLookup(firstInBucket(bySubname, subname));
  }

  /**
   * Returns every capture sharing a name, in bucket order.
   *
   * @param name capture name
   * @return unmodifiable snapshot, empty if none
   */
  public List<Capture> getAllByName(String name) {
    checkNotClosed();
    return bucketSnapshot(byName, name);
  }

  /**
   * Returns every capture sharing a subname, in bucket order.
   *
   * @param subname capture subname
   * @return unmodifiable snapshot, empty if none
   */
  public List<Capture> getAllBySubname(String subname) {
    checkNotClosed();
    return bucketSnapshot(bySubname, subname);
  }

  private static Optional<Capture> firstInBucket(
      PackedKeyMap<OrderedList<Capture>> index, String key) {
    return index.get(PackedKey.ofString(key)).flatMap(bucket -> bucket.get(0));
  }

  private static List<Capture> bucketSnapshot(
      PackedKeyMap<OrderedList<Capture>> index, String key) {
    Optional<OrderedList<Capture>> bucket = index.get(PackedKey.ofString(key));
    if (bucket.isEmpty()) {
      return Collections.emptyList();
    }
    List<Capture> snapshot = new ArrayList<>(bucket.get().length());
    bucket.get().forEach(snapshot::add);
    return Collections.unmodifiableList(snapshot);
  }

  private Optional<Capture> recordLookup(Optional<Capture> result) {
    if (result.isPresent()) {
      hits++;
      config.metricsRegistry().incrementCounter(MetricNames.LOOKUPS_HITS);
    } else {
      misses++;
      config.metricsRegistry().incrementCounter(MetricNames.LOOKUPS_MISSES);
    }
    return result;
  }

  /**
   * Starts a traversal of every capture in ascending id order. A previous walk, if any, is
   * finished.
   *
   * @return new walk
   */
  public CaptureWalk walkInit() {
    checkNotClosed();
    return new CaptureWalk(byId.iterate());
  }

  /**
   * Advances a walk.
   *
   * @param walk walk from {@link #walkInit()}
   * @return next capture, or empty once exhausted or superseded
   * @throws java.util.ConcurrentModificationException if a new id was added after {@link
   *     #walkInit()}
   */
  public Optional<Capture> walkNext(CaptureWalk walk) {
    checkNotClosed();
    Optional<Capture> next = Objects.requireNonNull(walk, "walk cannot be null").next();
    if (config.logCaptures()) {
      if (next.isPresent()) {
        logger.trace("Grok: walknext ok {}", next.get().getId());
      } else {
        logger.trace("Grok: walknext null");
      }
    }
    return next;
  }

  /**
   * Ends a walk early. Later {@link #walkNext(CaptureWalk)} calls on it return empty.
   *
   * @param walk walk to end
   */
  public void walkEnd(CaptureWalk walk) {
    Objects.requireNonNull(walk, "walk cannot be null").end();
  }

  /**
   * Attaches an opaque handle to a capture. The reference is stored as-is; the caller keeps
   * ownership of the referent and its lifetime.
   *
   * <p>Works on any capture, stored copy or not, and on a closed store.
   *
   * @param record capture to update
   * @param payload handle, may be null
   * @return the same record
   */
  public Capture setExtra(Capture record, Object payload) {
    Objects.requireNonNull(record, "record cannot be null");
    if (config.logCaptures()) {
      logger.trace("Grok: Setting extra value of capture {} to {}", record.getId(), payload);
    }
    record.setExtra(payload);
    return record;
  }

  /**
   * Releases a capture's owned fields. The shared {@link Capture#EMPTY} sentinel is never
   * released and a second call is a no-op. The record is not removed from any index.
   *
   * @param record capture to release
   */
  public void freeCapture(Capture record) {
    Objects.requireNonNull(record, "record cannot be null").release();
  }

  /** Number of distinct ids stored. */
  public int size() {
    return byId.size();
  }

  public boolean isEmpty() {
    return byId.isEmpty();
  }

  /**
   * Gets statistics snapshot.
   *
   * @return index sizes and counters
   */
  public CaptureStoreStatistics getStatistics() {
    return new CaptureStoreStatistics(
        byId.size(),
        byCaptureNumber.size(),
        byName.size(),
        bySubname.size(),
        added,
        skipped,
        replaced,
        hits,
        misses);
  }

  /** Releases every stored capture. The store stays usable. */
  public void clear() {
    checkNotClosed();
    byId.clear();
    byCaptureNumber.clear();
    byName.clear();
    bySubname.clear();
    logger.debug("Grok: Capture store cleared");
  }

  /** Same as {@link #close()}. */
  public void destroy() {
    close();
  }

  /**
   * Releases every stored capture and unregisters the index gauges. Idempotent; any other
   * operation afterwards throws {@link IllegalStateException}.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    byId.destroy();
    byCaptureNumber.destroy();
    byName.destroy();
    bySubname.destroy();
    removeIndexMetrics();

    if (resourceTracker.getLiveCopies() != 0) {
      logger.warn(
          "Grok: Capture store closed with {} unreleased copies", resourceTracker.getLiveCopies());
    }
    logger.debug("Grok: Capture store closed - {} captures added, {} skipped", added, skipped);
  }

  public boolean isClosed() {
    return closed;
  }

  private Capture takeCopy(Capture record) {
    resourceTracker.trackCopyCreated();
    return record.copy();
  }

  private void releaseCopy(Capture copy) {
    copy.release();
    resourceTracker.trackCopyReleased();
  }

  private void registerIndexMetrics() {
    indexGauges.put(MetricNames.INDEX_BY_ID_COUNT, byId::size);
    indexGauges.put(MetricNames.INDEX_BY_CAPTURE_NUMBER_COUNT, byCaptureNumber::size);
    indexGauges.put(MetricNames.INDEX_BY_NAME_COUNT, byName::size);
    indexGauges.put(MetricNames.INDEX_BY_SUBNAME_COUNT, bySubname::size);
    indexGauges.forEach(config.metricsRegistry()::registerGauge);
  }

  private void removeIndexMetrics() {
    indexGauges.forEach(config.metricsRegistry()::removeGauge);
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("Grok: CaptureIndexStore is closed");
    }
  }
}
