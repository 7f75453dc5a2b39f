/*
 * Copyright 2026 Yellowbrick Data, Inc.
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
package ai.floedb.deta.client.spi;

import java.util.Locale;

/** What a multi-page walk does when a page after the first one fails. */
public enum WalkPolicy {
  /** Propagate the error and discard the pages collected so far. */
  FAIL_FAST,

  /**
   * Stop at the failing page and return what was collected, together with the cursor of the page
   * that failed. An error on the first page still propagates.
   */
  PARTIAL_ON_ERROR;

  public static WalkPolicy parse(String s) {
    if (s == null || s.isBlank()) {
      return FAIL_FAST;
    }
    String norm = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    if ("PARTIAL".equals(norm)) {
      return PARTIAL_ON_ERROR;
    }
    try {
      return WalkPolicy.valueOf(norm);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown walk policy: " + s, e);
    }
  }
}
