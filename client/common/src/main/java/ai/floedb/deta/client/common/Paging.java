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
package ai.floedb.deta.client.common;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** Page metadata returned with a query or listing; an empty {@code last} means no more pages. */
public record Paging(int size, String last) {
  public Paging {
    last = Objects.requireNonNullElse(last, "");
  }

  public boolean hasMore() {
    return !last.isEmpty();
  }

  public static Paging fromJson(JsonNode paging, int fallbackSize) {
    if (paging == null || paging.isMissingNode() || paging.isNull()) {
      return new Paging(fallbackSize, "");
    }
    return new Paging(paging.path("size").asInt(fallbackSize), paging.path("last").asText(""));
  }
}
