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

import com.axonops.libgrok.tree.PackedKeyMap;
import java.util.Optional;

/**
 * Ascending-id traversal handle returned by {@link CaptureIndexStore#walkInit()}.
 *
 * <p>Only the most recent walk of a store advances; starting another walk makes this one report
 * exhaustion.
 *
 * @since 1.0.0
 */
public final class CaptureWalk {

  private final PackedKeyMap.Cursor<Capture> cursor;
  private boolean ended;

  CaptureWalk(PackedKeyMap.Cursor<Capture> cursor) {
    this.cursor = cursor;
  }

  Optional<Capture> next() {
    if (ended) {
      return Optional.empty();
    }
    Optional<Capture> next = cursor.next().map(PackedKeyMap.Entry::value);
    if (next.isEmpty()) {
      ended = true;
    }
    return next;
  }

  void end() {
    ended = true;
  }

  /** True once exhausted, ended, or superseded by a newer walk. */
  public boolean isFinished() {
    return ended || !cursor.isLive();
  }
}
