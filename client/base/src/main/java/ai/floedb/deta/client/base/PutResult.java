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
package ai.floedb.deta.client.base;

import ai.floedb.deta.client.common.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record PutResult(List<JsonNode> processed, List<JsonNode> failed) {
  public PutResult {
    processed = List.copyOf(processed);
    failed = List.copyOf(failed);
  }

  static PutResult fromJson(JsonNode resp) {
    return new PutResult(
        JsonValues.elements(resp.path("processed").path("items")),
        JsonValues.elements(resp.path("failed").path("items")));
  }

  public boolean allProcessed() {
    return failed.isEmpty();
  }
}
